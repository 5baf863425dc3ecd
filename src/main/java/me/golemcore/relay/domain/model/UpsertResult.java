package me.golemcore.relay.domain.model;

/**
 * Outcome of storing an inbound text for an owner.
 *
 * @param requestId
 *            id of the request now pending for the owner
 * @param merge
 *            {@code true} when the text was appended to an existing request
 * @param previousRequestId
 *            id retired by the merge, {@code null} for a fresh request
 */
public record UpsertResult(String requestId, boolean merge, String previousRequestId) {

    public static UpsertResult created(String requestId) {
        return new UpsertResult(requestId, false, null);
    }

    public static UpsertResult merged(String requestId, String previousRequestId) {
        return new UpsertResult(requestId, true, previousRequestId);
    }
}
