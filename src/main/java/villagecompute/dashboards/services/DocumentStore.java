package villagecompute.dashboards.services;

import java.util.List;
import java.util.Optional;

/**
 * Key-addressed JSON document storage backing custom widgets and layouts.
 *
 * <p>
 * Implementations throw {@link villagecompute.dashboards.exceptions.DocumentStoreException} for I/O failures. A missing
 * document is not a failure: {@link #get} returns {@link Optional#empty()} and {@link #delete} is a no-op.
 */
public interface DocumentStore {

    /**
     * Buckets per document family.
     */
    enum BucketType {
        CUSTOM_WIDGETS, DASHBOARD_LAYOUTS
    }

    /**
     * Writes (or replaces) a document.
     */
    void put(BucketType bucket, String path, byte[] content);

    Optional<byte[]> get(BucketType bucket, String path);

    /**
     * Lists every document path starting with {@code prefix}.
     */
    List<String> list(BucketType bucket, String prefix);

    void delete(BucketType bucket, String path);
}
