/*
 * MessageMappingException.java
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

import java.text.MessageFormat;

/**
 * Exception thrown when a decoded RESP value is not a valid Pub/Sub push.
 *
 * <p>The {@link Reason} says which part of the value was wrong, and
 * {@link #getMessageKind()} which kind of push was being mapped, so that a
 * bad subscription count can be told apart from a bad channel name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MessageMappingException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * What was wrong with the value.
     */
    public enum Reason {
        /** Not an array, or its first element is missing or not text. */
        MALFORMED_RESPONSE("err.malformed_response"),
        /** The first element names no known Pub/Sub message kind. */
        UNKNOWN_TYPE("err.unknown_type"),
        /** The channel element is missing or not text. */
        INVALID_CHANNEL("err.invalid_channel"),
        /** The pattern element is missing or not text. */
        INVALID_PATTERN("err.invalid_pattern"),
        /** The subscription count element is missing or not an integer. */
        INVALID_COUNT("err.invalid_count"),
        /** The message payload element is missing or not text. */
        INVALID_PAYLOAD("err.invalid_payload");

        private final String key;

        Reason(String key) {
            this.key = key;
        }

    }

    private final Reason reason;
    private final String messageKind;

    /**
     * Creates a new mapping exception.
     *
     * @param reason what was wrong
     * @param messageKind the message kind being mapped, or for
     *        {@link Reason#MALFORMED_RESPONSE} a description of the value
     */
    public MessageMappingException(Reason reason, String messageKind) {
        super(MessageFormat.format(RedisSubscriber.L10N.getString(reason.key), messageKind));
        this.reason = reason;
        this.messageKind = messageKind;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the message kind being mapped (for example {@code "pmessage"}).
     *
     * @return the message kind
     */
    public String getMessageKind() {
        return messageKind;
    }

}
