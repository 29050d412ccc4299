package io.eventwatch.notify;

import java.util.Objects;

/**
 * A decoded notification: a record was appended to {@code streamId} at {@code position}.
 *
 * @param streamId the stream (run id)
 * @param position the position of the appended record
 */
public record StreamNotification(String streamId, long position) {

    public StreamNotification {
        Objects.requireNonNull(streamId, "streamId");
    }

    /**
     * Encodes this notification in the channel wire format.
     *
     * @return the payload string
     */
    public String toPayload() {
        return NotificationPayloads.format(streamId, position);
    }
}
