/*
 * BackoffTest.java
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

import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link Backoff}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BackoffTest {

    @Test
    public void testDefaults() {
        Backoff backoff = new Backoff();

        assertEquals(8, backoff.getMaxRetries());
    }

    @Test
    public void testSquaredDelayWithoutJitter() {
        Backoff backoff = new Backoff(8, 64, 0, new Random(1));

        assertEquals(1000L, backoff.getDelay(1));
        assertEquals(4000L, backoff.getDelay(2));
        assertEquals(9000L, backoff.getDelay(3));
        assertEquals(49000L, backoff.getDelay(7));
        assertEquals(64000L, backoff.getDelay(8));
        assertEquals(64000L, backoff.getDelay(100));
    }

    @Test
    public void testLargeAttemptDoesNotOverflow() {
        Backoff backoff = new Backoff(8, 64, 0, new Random(1));

        assertEquals(64000L, backoff.getDelay(Integer.MAX_VALUE));
    }

    @Test
    public void testJitterBounds() {
        Backoff backoff = new Backoff(8, 64, 1000, new Random(42));

        for (int attempt = 1; attempt <= 8; attempt++) {
            long base = Math.min((long) attempt * attempt, 64L) * 1000L;
            for (int i = 0; i < 100; i++) {
                long delay = backoff.getDelay(attempt);
                assertTrue(delay >= base);
                assertTrue(delay < base + 1000L);
            }
        }
    }

    @Test
    public void testSeededJitterIsReproducible() {
        Backoff a = new Backoff(8, 64, 1000, new Random(7));
        Backoff b = new Backoff(8, 64, 1000, new Random(7));

        for (int attempt = 1; attempt <= 8; attempt++) {
            assertEquals(a.getDelay(attempt), b.getDelay(attempt));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeRetries() {
        new Backoff(-1, 64, 1000, new Random());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeJitter() {
        new Backoff(8, 64, -1, new Random());
    }

}
