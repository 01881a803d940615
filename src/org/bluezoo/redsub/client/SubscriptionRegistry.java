/*
 * SubscriptionRegistry.java
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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The channels and patterns a subscriber wants to receive.
 *
 * <p>This is the authoritative record of desired subscriptions: it is
 * replayed to the server after every reconnect, so it is never changed by
 * connection failures. Each set is guarded by its own monitor and every
 * operation is atomic with respect to that set.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SubscriptionRegistry {

    private final Set<String> channels = new HashSet<String>();
    private final Set<String> patterns = new HashSet<String>();

    /**
     * Records a channel subscription.
     *
     * @param channel the channel name
     * @return true if the channel was not already present
     */
    public boolean addChannel(String channel) {
        synchronized (channels) {
            return channels.add(channel);
        }
    }

    /**
     * Removes a channel subscription.
     *
     * @param channel the channel name
     * @return false if the channel was not present
     */
    public boolean removeChannel(String channel) {
        synchronized (channels) {
            return channels.remove(channel);
        }
    }

    /**
     * Records a pattern subscription.
     *
     * @param pattern the glob-style pattern
     * @return true if the pattern was not already present
     */
    public boolean addPattern(String pattern) {
        synchronized (patterns) {
            return patterns.add(pattern);
        }
    }

    /**
     * Removes a pattern subscription.
     *
     * @param pattern the glob-style pattern
     * @return false if the pattern was not present
     */
    public boolean removePattern(String pattern) {
        synchronized (patterns) {
            return patterns.remove(pattern);
        }
    }

    /**
     * Returns a snapshot of the subscribed channels, in no particular order.
     *
     * @return a new list of channel names
     */
    public List<String> getChannels() {
        synchronized (channels) {
            return new ArrayList<String>(channels);
        }
    }

    /**
     * Returns a snapshot of the subscribed patterns, in no particular order.
     *
     * @return a new list of patterns
     */
    public List<String> getPatterns() {
        synchronized (patterns) {
            return new ArrayList<String>(patterns);
        }
    }

    public boolean containsChannel(String channel) {
        synchronized (channels) {
            return channels.contains(channel);
        }
    }

    public boolean containsPattern(String pattern) {
        synchronized (patterns) {
            return patterns.contains(pattern);
        }
    }

}
