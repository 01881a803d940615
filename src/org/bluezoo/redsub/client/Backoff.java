/*
 * Backoff.java
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

import java.util.Random;

/**
 * Reconnect delay policy.
 *
 * <p>After the n-th consecutive failed connect attempt the subscriber
 * waits {@code min(n * n, maxDelaySeconds)} seconds plus a random jitter
 * of {@code [0, maxJitterMillis)} milliseconds. After {@code maxRetries}
 * retries the connect sequence gives up; the subscription stream then
 * starts a fresh sequence, so a stream never stops reconnecting.
 *
 * <p>The defaults are 8 retries, a 64 second cap and up to one second of
 * jitter.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Backoff {

    public static final int DEFAULT_MAX_RETRIES = 8;
    public static final int DEFAULT_MAX_DELAY_SECONDS = 64;
    public static final int DEFAULT_MAX_JITTER_MILLIS = 1000;

    private final int maxRetries;
    private final int maxDelaySeconds;
    private final int maxJitterMillis;
    private final Random random;

    /**
     * Creates a backoff policy with the default settings.
     */
    public Backoff() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_MAX_DELAY_SECONDS, DEFAULT_MAX_JITTER_MILLIS, new Random());
    }

    /**
     * Creates a backoff policy.
     *
     * @param maxRetries retries before a connect sequence gives up
     * @param maxDelaySeconds cap on the squared delay, in seconds
     * @param maxJitterMillis exclusive upper bound of the jitter, 0 for none
     * @param random source of jitter
     * @throws IllegalArgumentException if any bound is negative
     */
    public Backoff(int maxRetries, int maxDelaySeconds, int maxJitterMillis, Random random) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (maxDelaySeconds < 0) {
            throw new IllegalArgumentException("maxDelaySeconds must not be negative");
        }
        if (maxJitterMillis < 0) {
            throw new IllegalArgumentException("maxJitterMillis must not be negative");
        }
        this.maxRetries = maxRetries;
        this.maxDelaySeconds = maxDelaySeconds;
        this.maxJitterMillis = maxJitterMillis;
        this.random = random;
    }

    /**
     * Returns how many retries follow the first connect attempt before
     * the connect sequence gives up.
     *
     * @return the maximum number of retries
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Returns the delay before the given retry.
     *
     * @param attempt the retry number, starting at 1
     * @return the delay in milliseconds
     */
    public long getDelay(int attempt) {
        long squared = (long) attempt * attempt;
        long seconds = Math.min(squared, maxDelaySeconds);
        long jitter = (maxJitterMillis > 0) ? random.nextInt(maxJitterMillis) : 0L;
        return seconds * 1000L + jitter;
    }

}
