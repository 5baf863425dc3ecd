package me.golemcore.relay.domain.model;

/**
 * Machine-readable classification of generation call failures.
 *
 * <p>
 * This exists to avoid relying on string matching in exception messages when
 * building the user-facing failure notice.
 */
public enum GenerationFailureKind {

    /**
     * The service answered with a non-success HTTP status.
     */
    UPSTREAM_ERROR,

    /**
     * The service could not be reached or the connection broke mid-exchange.
     */
    NETWORK_ERROR,

    /**
     * The service answered with success but the payload has no usable text.
     */
    MALFORMED_RESPONSE,

    /**
     * No answer within the configured generation timeout.
     */
    TIMEOUT,

    /**
     * Anything the adapter could not classify.
     */
    UNEXPECTED
}
