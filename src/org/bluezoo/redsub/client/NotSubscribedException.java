/*
 * NotSubscribedException.java
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
 * Thrown when unsubscribing from a channel or pattern that is not
 * subscribed. No command is sent to the server in that case.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class NotSubscribedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String name;

    /**
     * Creates a new exception for the given channel or pattern.
     *
     * @param name the channel or pattern that was not subscribed
     */
    public NotSubscribedException(String name) {
        super(MessageFormat.format(RedisSubscriber.L10N.getString("err.not_subscribed"), name));
        this.name = name;
    }

    /**
     * Returns the channel or pattern that was not subscribed.
     *
     * @return the name
     */
    public String getName() {
        return name;
    }

}
