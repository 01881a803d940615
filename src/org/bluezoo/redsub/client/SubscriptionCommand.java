/*
 * SubscriptionCommand.java
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

import java.nio.ByteBuffer;
import java.text.MessageFormat;

import org.bluezoo.redsub.codec.RESPEncoder;

/**
 * A command changing the subscriptions of a connection.
 *
 * <p>Commands are sent inline, for example {@code SUBSCRIBE news\r\n},
 * so a channel or pattern name must be non-empty and must not contain a
 * space, CR or LF.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SubscriptionCommand {

    /**
     * The Pub/Sub command verbs.
     */
    public enum Verb {
        SUBSCRIBE,
        UNSUBSCRIBE,
        PSUBSCRIBE,
        PUNSUBSCRIBE
    }

    private final Verb verb;
    private final String name;

    private SubscriptionCommand(Verb verb, String name) {
        checkName(name);
        this.verb = verb;
        this.name = name;
    }

    /**
     * Rejects names that cannot be sent as a single inline argument.
     */
    private static void checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(RedisSubscriber.L10N.getString("err.empty_name"));
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == ' ' || c == '\r' || c == '\n') {
                String msg = MessageFormat.format(RedisSubscriber.L10N.getString("err.invalid_name"), name.trim());
                throw new IllegalArgumentException(msg);
            }
        }
    }

    static SubscriptionCommand subscribe(String channel) {
        return new SubscriptionCommand(Verb.SUBSCRIBE, channel);
    }

    static SubscriptionCommand unsubscribe(String channel) {
        return new SubscriptionCommand(Verb.UNSUBSCRIBE, channel);
    }

    static SubscriptionCommand psubscribe(String pattern) {
        return new SubscriptionCommand(Verb.PSUBSCRIBE, pattern);
    }

    static SubscriptionCommand punsubscribe(String pattern) {
        return new SubscriptionCommand(Verb.PUNSUBSCRIBE, pattern);
    }

    public Verb getVerb() {
        return verb;
    }

    /**
     * Returns the channel or pattern this command applies to.
     *
     * @return the name
     */
    public String getName() {
        return name;
    }

    /**
     * Renders this command in wire format.
     *
     * @param encoder the encoder to use
     * @return the encoded command, {@code "<VERB> <name>\r\n"}
     */
    public ByteBuffer render(RESPEncoder encoder) {
        return encoder.encodeInline(verb.name(), name);
    }

    @Override
    public String toString() {
        return verb.name() + " " + name;
    }

}
