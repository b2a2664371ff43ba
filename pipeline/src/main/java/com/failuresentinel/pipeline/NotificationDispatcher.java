package com.failuresentinel.pipeline;

/**
 * Delivery channel for severe-pattern notifications.
 *
 * <p>
 * Implementations own the transport (mail, chat, paging). The pipeline calls
 * {@link #dispatch} once per qualifying pattern; an exception thrown here is
 * logged and recorded as a notification-stage failure, and the remaining
 * payloads are still dispatched.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationDispatcher {

    /**
     * @param payload structured notification
     * @param json    the same payload serialized as JSON; empty if
     *                serialization failed
     * @throws Exception if delivery fails
     */
    void dispatch(NotificationPayload payload, byte[] json) throws Exception;
}
