package villagecompute.dashboards.services;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import villagecompute.dashboards.exceptions.DocumentStoreException;

/**
 * {@link DocumentStore} over S3-compatible object storage (MinIO for dev, Cloudflare R2 for prod).
 *
 * <p>
 * Every operation is traced with OpenTelemetry and counted with Micrometer. S3 failures are rethrown as
 * {@link DocumentStoreException}; a missing key on read yields {@link Optional#empty()}.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * storageGateway.put(BucketType.DASHBOARD_LAYOUTS, "pulse/cust-42.json", json);
 * Optional&lt;byte[]&gt; layout = storageGateway.get(BucketType.DASHBOARD_LAYOUTS, "pulse/cust-42.json");
 * </pre>
 */
@ApplicationScoped
public class StorageGateway implements DocumentStore {

    private static final Logger LOG = Logger.getLogger(StorageGateway.class);

    private static final String JSON_CONTENT_TYPE = "application/json";

    @Inject
    S3Client s3Client;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "villagecompute.storage.buckets.custom-widgets")
    String customWidgetsBucket;

    @ConfigProperty(
            name = "villagecompute.storage.buckets.dashboard-layouts")
    String dashboardLayoutsBucket;

    @ConfigProperty(
            name = "villagecompute.storage.list-page-size",
            defaultValue = "500")
    int listPageSize;

    @Override
    public void put(BucketType bucket, String path, byte[] content) {
        Span span = tracer.spanBuilder("storage.put").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", path).setAttribute("size_bytes", content.length).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);

            PutObjectRequest putRequest = PutObjectRequest.builder().bucket(bucketName).key(path)
                    .contentType(JSON_CONTENT_TYPE).build();

            s3Client.putObject(putRequest, RequestBody.fromBytes(content));

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Stored %s/%s (%d bytes, %dms)", bucketName, path, content.length, latencyMs);

            recordOperationMetrics("put", bucket, latencyMs, true);
            span.setAttribute("put_success", true);

        } catch (S3Exception e) {
            recordOperationMetrics("put", bucket, System.currentTimeMillis() - startTime, false);

            span.recordException(e);
            span.setAttribute("put_success", false);
            LOG.errorf(e, "Failed to store %s/%s: %s", bucket, path, errorMessage(e));
            throw new DocumentStoreException("Storage write failed: " + errorMessage(e), e);

        } catch (Exception e) {
            recordOperationMetrics("put", bucket, System.currentTimeMillis() - startTime, false);

            span.recordException(e);
            span.setAttribute("put_success", false);
            LOG.errorf(e, "Failed to store %s/%s: %s", bucket, path, e.getMessage());
            throw new DocumentStoreException("Storage write failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    @Override
    public Optional<byte[]> get(BucketType bucket, String path) {
        Span span = tracer.spanBuilder("storage.get").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", path).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);

            GetObjectRequest getRequest = GetObjectRequest.builder().bucket(bucketName).key(path).build();

            byte[] bytes = s3Client.getObjectAsBytes(getRequest).asByteArray();

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Read %s/%s (%d bytes, %dms)", bucketName, path, bytes.length, latencyMs);

            recordOperationMetrics("get", bucket, latencyMs, true);
            span.setAttribute("found", true);
            span.setAttribute("size_bytes", bytes.length);

            return Optional.of(bytes);

        } catch (NoSuchKeyException e) {
            recordOperationMetrics("get", bucket, System.currentTimeMillis() - startTime, true);
            span.setAttribute("found", false);
            LOG.debugf("No document at %s/%s", bucket, path);
            return Optional.empty();

        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                recordOperationMetrics("get", bucket, System.currentTimeMillis() - startTime, true);
                span.setAttribute("found", false);
                return Optional.empty();
            }
            recordOperationMetrics("get", bucket, System.currentTimeMillis() - startTime, false);

            span.recordException(e);
            LOG.errorf(e, "Failed to read %s/%s: %s", bucket, path, errorMessage(e));
            throw new DocumentStoreException("Storage read failed: " + errorMessage(e), e);

        } catch (Exception e) {
            recordOperationMetrics("get", bucket, System.currentTimeMillis() - startTime, false);

            span.recordException(e);
            LOG.errorf(e, "Failed to read %s/%s: %s", bucket, path, e.getMessage());
            throw new DocumentStoreException("Storage read failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Lists all keys under a prefix, following continuation tokens across pages.
     */
    @Override
    public List<String> list(BucketType bucket, String prefix) {
        Span span = tracer.spanBuilder("storage.list").setAttribute("bucket", bucket.name())
                .setAttribute("prefix", prefix).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);
            List<String> keys = new ArrayList<>();
            String continuationToken = null;

            do {
                ListObjectsV2Request.Builder listRequest = ListObjectsV2Request.builder().bucket(bucketName)
                        .prefix(prefix).maxKeys(listPageSize);
                if (continuationToken != null) {
                    listRequest.continuationToken(continuationToken);
                }

                ListObjectsV2Response response = s3Client.listObjectsV2(listRequest.build());
                for (S3Object s3Object : response.contents()) {
                    keys.add(s3Object.key());
                }
                continuationToken = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken()
                        : null;
            } while (continuationToken != null);

            long latencyMs = System.currentTimeMillis() - startTime;
            LOG.debugf("Listed %d objects in %s with prefix %s (%dms)", keys.size(), bucketName, prefix, latencyMs);

            recordOperationMetrics("list", bucket, latencyMs, true);
            span.setAttribute("object_count", keys.size());

            return keys;

        } catch (S3Exception e) {
            recordOperationMetrics("list", bucket, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            LOG.errorf(e, "Failed to list objects in %s: %s", bucket, errorMessage(e));
            throw new DocumentStoreException("Storage listing failed: " + errorMessage(e), e);

        } catch (Exception e) {
            recordOperationMetrics("list", bucket, System.currentTimeMillis() - startTime, false);
            span.recordException(e);
            LOG.errorf(e, "Failed to list objects in %s: %s", bucket, e.getMessage());
            throw new DocumentStoreException("Storage listing failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    /**
     * Deletes a document. S3 deletes are idempotent, so a missing key succeeds.
     */
    @Override
    public void delete(BucketType bucket, String path) {
        Span span = tracer.spanBuilder("storage.delete").setAttribute("bucket", bucket.name())
                .setAttribute("object_key", path).startSpan();

        long startTime = System.currentTimeMillis();

        try (Scope scope = span.makeCurrent()) {
            String bucketName = getBucketName(bucket);

            DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder().bucket(bucketName).key(path).build();

            s3Client.deleteObject(deleteRequest);

            LOG.infof("Deleted document %s/%s", bucketName, path);

            recordOperationMetrics("delete", bucket, System.currentTimeMillis() - startTime, true);
            span.setAttribute("delete_success", true);

        } catch (S3Exception e) {
            recordOperationMetrics("delete", bucket, System.currentTimeMillis() - startTime, false);

            span.recordException(e);
            span.setAttribute("delete_success", false);
            LOG.errorf(e, "Failed to delete %s: %s", path, errorMessage(e));
            throw new DocumentStoreException("Storage deletion failed: " + errorMessage(e), e);

        } catch (Exception e) {
            recordOperationMetrics("delete", bucket, System.currentTimeMillis() - startTime, false);

            span.recordException(e);
            span.setAttribute("delete_success", false);
            LOG.errorf(e, "Failed to delete %s: %s", path, e.getMessage());
            throw new DocumentStoreException("Storage deletion failed: " + e.getMessage(), e);

        } finally {
            span.end();
        }
    }

    private String getBucketName(BucketType bucket) {
        return switch (bucket) {
            case CUSTOM_WIDGETS -> customWidgetsBucket;
            case DASHBOARD_LAYOUTS -> dashboardLayoutsBucket;
        };
    }

    private static String errorMessage(S3Exception e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
            return e.awsErrorDetails().errorMessage();
        }
        return e.getMessage();
    }

    private void recordOperationMetrics(String operation, BucketType bucket, long latencyMs, boolean success) {
        String status = success ? "success" : "failure";
        String bucketTag = bucket.name().toLowerCase();

        Counter.builder("storage.operations.total").tag("operation", operation).tag("bucket", bucketTag)
                .tag("status", status).register(meterRegistry).increment();

        Timer.builder("storage.operation.duration").tag("operation", operation).tag("bucket", bucketTag)
                .tag("status", status).register(meterRegistry).record(Duration.ofMillis(latencyMs));
    }
}
