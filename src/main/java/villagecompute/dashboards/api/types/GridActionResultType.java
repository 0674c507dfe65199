package villagecompute.dashboards.api.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a grid operation. On failure {@code layout} is the unchanged, last persisted layout.
 *
 * @param outcome
 *            applied, scheduled or failed
 * @param failure
 *            failure kind, {@code null} unless failed
 * @param message
 *            human-readable failure message
 * @param state
 *            grid state after the operation
 */
public record GridActionResultType(Outcome outcome, Failure failure, String message, GridStateType state) {

    public enum Outcome {
        /** Persisted and reflected in the view. */
        APPLIED("applied"),
        /** Accepted and waiting for the debounced save. */
        SCHEDULED("scheduled"),
        FAILED("failed");

        private final String code;

        Outcome(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }

    public enum Failure {
        INVALID_REQUEST("invalid_request"),
        /** Operation not allowed in the current grid mode. */
        WRONG_MODE("wrong_mode"),
        NOT_FOUND("not_found"),
        /** The layout document could not be written; the view is unchanged. */
        STORE_FAILURE("store_failure");

        private final String code;

        Failure(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }
    }

    public static GridActionResultType applied(GridStateType state) {
        return new GridActionResultType(Outcome.APPLIED, null, null, state);
    }

    public static GridActionResultType scheduled(GridStateType state) {
        return new GridActionResultType(Outcome.SCHEDULED, null, null, state);
    }

    public static GridActionResultType failed(Failure failure, String message, GridStateType state) {
        return new GridActionResultType(Outcome.FAILED, failure, message, state);
    }

    public boolean succeeded() {
        return outcome != Outcome.FAILED;
    }
}
