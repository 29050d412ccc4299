package io.eventwatch.notify;

import java.util.Objects;
import java.util.Optional;

/**
 * Codec for the channel wire format {@code "{streamId}_{position}"}.
 *
 * <p>Decoding splits on the <em>last</em> {@code '_'}, so stream ids may themselves contain
 * underscores: {@code "my_run_42"} decodes to stream {@code "my_run"} at position 42. The
 * position must be a non-empty run of ASCII digits that fits in a {@code long}.
 */
public final class NotificationPayloads {
    public static final char DELIMITER = '_';

    private NotificationPayloads() {
    }

    /**
     * Encodes a notification payload.
     *
     * @param streamId the stream id, must not be empty
     * @param position the record position, must be &ge; 0
     * @return the payload string
     * @throws NullPointerException     if {@code streamId} is null
     * @throws IllegalArgumentException if {@code streamId} is empty or {@code position} is negative
     */
    public static String format(String streamId, long position) {
        Objects.requireNonNull(streamId, "streamId");
        if (streamId.isEmpty()) {
            throw new IllegalArgumentException("streamId must not be empty");
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got: " + position);
        }
        return streamId + DELIMITER + position;
    }

    /**
     * Decodes a notification payload.
     *
     * @param payload the raw payload, may be null
     * @return the decoded notification, or empty if the payload is malformed
     */
    public static Optional<StreamNotification> parse(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        int sep = payload.lastIndexOf(DELIMITER);
        if (sep <= 0 || sep == payload.length() - 1) {
            return Optional.empty();
        }
        String index = payload.substring(sep + 1);
        for (int i = 0; i < index.length(); i++) {
            char c = index.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }
        long position;
        try {
            position = Long.parseLong(index);
        } catch (NumberFormatException e) {
            return Optional.empty(); // overflow
        }
        return Optional.of(new StreamNotification(payload.substring(0, sep), position));
    }
}
