/**
 * Notification decoding and transports.
 *
 * <p>{@link io.eventwatch.notify.NotificationPayloads} encodes and decodes the
 * {@code "{streamId}_{position}"} wire format. {@link io.eventwatch.notify.AbstractNotificationStream}
 * is the base for polling transports; {@link io.eventwatch.notify.QueueNotificationSource} is an
 * in-process transport.
 */
package io.eventwatch.notify;
