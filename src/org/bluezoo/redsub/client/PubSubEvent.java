/*
 * PubSubEvent.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of redsub, a Redis Pub/Sub subscriber for Java.
 *
 * redsub is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * redsub is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with redsub.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.redsub.client;

/**
 * An event delivered by a {@link SubscriptionStream}.
 *
 * <p>Most events are server pushes: subscription confirmations and
 * published messages. The stream also reports its own connection
 * lifecycle ({@link Type#CONNECTED}, {@link Type#DISCONNECTED}) and data
 * it could not decode ({@link Type#DECODE_ERROR}) in the same feed, so a
 * consumer sees everything in one ordered sequence.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * for (PubSubEvent event : iterable(subscriber.listen())) {
 *     switch (event.getType()) {
 *         case MESSAGE:
 *             handle(event.getChannel(), event.getPayload());
 *             break;
 *         case DISCONNECTED:
 *             log(event.getCause());
 *             break;
 *         default:
 *             break;
 *     }
 * }
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PubSubEvent {

    /**
     * Kinds of event.
     */
    public enum Type {
        /** A {@code SUBSCRIBE} was confirmed. */
        SUBSCRIBED,
        /** An {@code UNSUBSCRIBE} was confirmed. */
        UNSUBSCRIBED,
        /** A {@code PSUBSCRIBE} was confirmed. */
        PATTERN_SUBSCRIBED,
        /** A {@code PUNSUBSCRIBE} was confirmed. */
        PATTERN_UNSUBSCRIBED,
        /** A message was published to a subscribed channel. */
        MESSAGE,
        /** A message was published to a channel matching a subscribed pattern. */
        PATTERN_MESSAGE,
        /** A connection was established and all subscriptions replayed. */
        CONNECTED,
        /** The connection was lost; the stream will reconnect. */
        DISCONNECTED,
        /** Data from the server could not be decoded and was skipped. */
        DECODE_ERROR
    }

    private static final PubSubEvent CONNECTED = new PubSubEvent(Type.CONNECTED, null, null, null, 0L, null);

    private final Type type;
    private final String channel;
    private final String pattern;
    private final String payload;
    private final long subscriptionCount;
    private final Exception cause;

    private PubSubEvent(Type type, String channel, String pattern, String payload,
                        long subscriptionCount, Exception cause) {
        this.type = type;
        this.channel = channel;
        this.pattern = pattern;
        this.payload = payload;
        this.subscriptionCount = subscriptionCount;
        this.cause = cause;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Factory methods
    // ─────────────────────────────────────────────────────────────────────────

    static PubSubEvent subscribed(String channel, long subscriptionCount) {
        return new PubSubEvent(Type.SUBSCRIBED, channel, null, null, subscriptionCount, null);
    }

    static PubSubEvent unsubscribed(String channel, long subscriptionCount) {
        return new PubSubEvent(Type.UNSUBSCRIBED, channel, null, null, subscriptionCount, null);
    }

    static PubSubEvent patternSubscribed(String pattern, long subscriptionCount) {
        return new PubSubEvent(Type.PATTERN_SUBSCRIBED, null, pattern, null, subscriptionCount, null);
    }

    static PubSubEvent patternUnsubscribed(String pattern, long subscriptionCount) {
        return new PubSubEvent(Type.PATTERN_UNSUBSCRIBED, null, pattern, null, subscriptionCount, null);
    }

    static PubSubEvent message(String channel, String payload) {
        return new PubSubEvent(Type.MESSAGE, channel, null, payload, 0L, null);
    }

    static PubSubEvent patternMessage(String pattern, String channel, String payload) {
        return new PubSubEvent(Type.PATTERN_MESSAGE, channel, pattern, payload, 0L, null);
    }

    static PubSubEvent connected() {
        return CONNECTED;
    }

    static PubSubEvent disconnected(Exception cause) {
        return new PubSubEvent(Type.DISCONNECTED, null, null, null, 0L, cause);
    }

    static PubSubEvent decodeError(Exception cause) {
        return new PubSubEvent(Type.DECODE_ERROR, null, null, null, 0L, cause);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Accessors
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns the kind of this event.
     *
     * @return the event type
     */
    public Type getType() {
        return type;
    }

    /**
     * Returns the channel this event concerns.
     *
     * <p>Set for subscription changes on channels and for both kinds of
     * message (for a pattern message, the channel actually published to).
     *
     * @return the channel, or null
     */
    public String getChannel() {
        return channel;
    }

    /**
     * Returns the pattern this event concerns.
     *
     * <p>Set for pattern subscription changes and pattern messages.
     *
     * @return the pattern, or null
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * Returns the published message text.
     *
     * @return the payload, or null if this is not a message
     */
    public String getPayload() {
        return payload;
    }

    /**
     * Returns the number of channels and patterns the connection is
     * subscribed to after a subscription change, as reported by the server.
     *
     * @return the subscription count, or 0 for other events
     */
    public long getSubscriptionCount() {
        return subscriptionCount;
    }

    /**
     * Returns why the connection was lost or why data was skipped.
     *
     * @return the cause, or null for other events
     */
    public Exception getCause() {
        return cause;
    }

    public boolean isSubscription() {
        return type == Type.SUBSCRIBED;
    }

    public boolean isUnsubscription() {
        return type == Type.UNSUBSCRIBED;
    }

    public boolean isPatternSubscription() {
        return type == Type.PATTERN_SUBSCRIBED;
    }

    public boolean isPatternUnsubscription() {
        return type == Type.PATTERN_UNSUBSCRIBED;
    }

    public boolean isMessage() {
        return type == Type.MESSAGE;
    }

    public boolean isPatternMessage() {
        return type == Type.PATTERN_MESSAGE;
    }

    public boolean isConnected() {
        return type == Type.CONNECTED;
    }

    public boolean isDisconnected() {
        return type == Type.DISCONNECTED;
    }

    public boolean isDecodeError() {
        return type == Type.DECODE_ERROR;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(type.name());
        switch (type) {
            case SUBSCRIBED:
            case UNSUBSCRIBED:
                buf.append('[').append(channel).append(", ").append(subscriptionCount).append(']');
                break;
            case PATTERN_SUBSCRIBED:
            case PATTERN_UNSUBSCRIBED:
                buf.append('[').append(pattern).append(", ").append(subscriptionCount).append(']');
                break;
            case MESSAGE:
                buf.append('[').append(channel).append(", ").append(payload).append(']');
                break;
            case PATTERN_MESSAGE:
                buf.append('[').append(pattern).append(", ").append(channel)
                        .append(", ").append(payload).append(']');
                break;
            case DISCONNECTED:
            case DECODE_ERROR:
                buf.append('[').append(cause).append(']');
                break;
            default:
                break;
        }
        return buf.toString();
    }

}
