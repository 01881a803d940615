/*
 * PubSubMessageMapper.java
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

import java.util.List;
import java.util.Locale;

import org.bluezoo.redsub.codec.RESPValue;

/**
 * Converts decoded RESP values into {@link PubSubEvent}s.
 *
 * <p>A subscribed connection receives only arrays whose first element is
 * the message kind:
 *
 * <table border="1" cellpadding="5">
 *   <caption>Pub/Sub pushes</caption>
 *   <tr><th>Kind</th><th>Elements</th><th>Event</th></tr>
 *   <tr><td>subscribe</td><td>channel, count</td><td>SUBSCRIBED</td></tr>
 *   <tr><td>unsubscribe</td><td>channel, count</td><td>UNSUBSCRIBED</td></tr>
 *   <tr><td>psubscribe</td><td>pattern, count</td><td>PATTERN_SUBSCRIBED</td></tr>
 *   <tr><td>punsubscribe</td><td>pattern, count</td><td>PATTERN_UNSUBSCRIBED</td></tr>
 *   <tr><td>message</td><td>channel, payload</td><td>MESSAGE</td></tr>
 *   <tr><td>pmessage</td><td>pattern, channel, payload</td><td>PATTERN_MESSAGE</td></tr>
 * </table>
 *
 * <p>The kind is matched case-insensitively. Names and payloads may be bulk
 * or simple strings; counts must be integers. Extra trailing elements are
 * ignored. Anything else is rejected with a {@link MessageMappingException}
 * that names the offending element.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PubSubMessageMapper {

    private PubSubMessageMapper() {
    }

    /**
     * Maps one decoded value to an event.
     *
     * @param response the decoded value
     * @return the corresponding event
     * @throws MessageMappingException if the value is not a valid push
     */
    public static PubSubEvent map(RESPValue response) throws MessageMappingException {
        List<RESPValue> array = response.asArray();
        if (array == null || array.isEmpty() || !array.get(0).isText()) {
            throw new MessageMappingException(MessageMappingException.Reason.MALFORMED_RESPONSE,
                    String.valueOf(response));
        }
        String kind = array.get(0).asString().toLowerCase(Locale.ROOT);
        switch (kind) {
            case "subscribe":
                return PubSubEvent.subscribed(
                        text(array, 1, kind, MessageMappingException.Reason.INVALID_CHANNEL),
                        count(array, 2, kind));
            case "unsubscribe":
                return PubSubEvent.unsubscribed(
                        text(array, 1, kind, MessageMappingException.Reason.INVALID_CHANNEL),
                        count(array, 2, kind));
            case "psubscribe":
                return PubSubEvent.patternSubscribed(
                        text(array, 1, kind, MessageMappingException.Reason.INVALID_PATTERN),
                        count(array, 2, kind));
            case "punsubscribe":
                return PubSubEvent.patternUnsubscribed(
                        text(array, 1, kind, MessageMappingException.Reason.INVALID_PATTERN),
                        count(array, 2, kind));
            case "message":
                return PubSubEvent.message(
                        text(array, 1, kind, MessageMappingException.Reason.INVALID_CHANNEL),
                        text(array, 2, kind, MessageMappingException.Reason.INVALID_PAYLOAD));
            case "pmessage":
                return PubSubEvent.patternMessage(
                        text(array, 1, kind, MessageMappingException.Reason.INVALID_PATTERN),
                        text(array, 2, kind, MessageMappingException.Reason.INVALID_CHANNEL),
                        text(array, 3, kind, MessageMappingException.Reason.INVALID_PAYLOAD));
            default:
                throw new MessageMappingException(MessageMappingException.Reason.UNKNOWN_TYPE, kind);
        }
    }

    private static String text(List<RESPValue> array, int index, String kind,
                               MessageMappingException.Reason reason) throws MessageMappingException {
        if (index >= array.size() || !array.get(index).isText()) {
            throw new MessageMappingException(reason, kind);
        }
        return array.get(index).asString();
    }

    private static long count(List<RESPValue> array, int index, String kind) throws MessageMappingException {
        if (index >= array.size() || !array.get(index).isInteger()) {
            throw new MessageMappingException(MessageMappingException.Reason.INVALID_COUNT, kind);
        }
        return array.get(index).asLong();
    }

}
