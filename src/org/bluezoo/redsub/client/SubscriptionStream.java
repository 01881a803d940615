/*
 * SubscriptionStream.java
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

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.redsub.codec.RESPDecoder;
import org.bluezoo.redsub.codec.RESPException;
import org.bluezoo.redsub.codec.RESPValue;

/**
 * The endless feed of events from a {@link RedisSubscriber}.
 *
 * <p>Each call to {@link #next()} blocks until an event is available,
 * doing whatever work that takes: connecting (with backoff), replaying
 * the subscriptions, reading from the socket and decoding. The stream
 * moves through these states:
 *
 * <pre>
 * Disconnected -&gt; Connecting -&gt; Resubscribing -&gt; Streaming
 *      ^                                               |
 *      +-----------------------------------------------+
 * </pre>
 *
 * <p>Events come out in the order the server sent them. A
 * {@link PubSubEvent.Type#DISCONNECTED DISCONNECTED} event always precedes
 * the next {@link PubSubEvent.Type#CONNECTED CONNECTED} event, and
 * {@code CONNECTED} is delivered after the subscriptions have been
 * replayed and before anything read from the new connection. Undecodable
 * data produces a {@link PubSubEvent.Type#DECODE_ERROR DECODE_ERROR}
 * event and is skipped. Failures never end the stream; only
 * {@link #close()} does.
 *
 * <p>A stream is consumed by one thread. {@link #close()} may be called
 * from any thread: it interrupts a pending connect, backoff wait or read,
 * after which {@link #hasNext()} returns false once the events already
 * decoded have been consumed.
 *
 * <p>There is no read timeout unless one is configured with
 * {@link RedisSubscriber#setReadTimeout(int)}; without one, a connection
 * that stays open but silent is never detected as dead.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SubscriptionStream implements Iterator<PubSubEvent>, Closeable {

    private static final Logger LOGGER = Logger.getLogger(SubscriptionStream.class.getName());

    static final int READ_BUFFER_SIZE = 64 * 1024;

    private final RedisSubscriber subscriber;
    private final Deque<PubSubEvent> pending = new ArrayDeque<PubSubEvent>();
    private final RESPDecoder decoder = new RESPDecoder();
    private final byte[] readBuffer = new byte[READ_BUFFER_SIZE];
    private final CountDownLatch closed = new CountDownLatch(1);

    private volatile Socket socket;
    private InputStream in;

    SubscriptionStream(RedisSubscriber subscriber) {
        this.subscriber = subscriber;
    }

    /**
     * Returns true until the stream has been closed and drained.
     *
     * @return whether {@link #next()} can return an event
     */
    @Override
    public boolean hasNext() {
        return !pending.isEmpty() || !isClosed();
    }

    /**
     * Returns the next event, blocking until there is one.
     *
     * @return the next event
     * @throws NoSuchElementException if the stream has been closed
     */
    @Override
    public PubSubEvent next() {
        while (pending.isEmpty()) {
            if (isClosed()) {
                throw new NoSuchElementException();
            }
            if (in == null) {
                establish();
            } else {
                receive();
            }
        }
        return pending.removeFirst();
    }

    /**
     * Returns whether this stream has been closed.
     *
     * @return true if closed
     */
    public boolean isClosed() {
        return closed.getCount() == 0;
    }

    /**
     * Closes the stream. Any connection is closed; the subscriber's
     * subscriptions are kept.
     */
    @Override
    public void close() {
        if (isClosed()) {
            return;
        }
        closed.countDown();
        Socket s = socket;
        if (s != null) {
            subscriber.detach(s);
            subscriber.closeSocket(s);
        }
        subscriber.streamClosed(this);
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(RedisSubscriber.L10N.getString("debug.stream_closed"),
                    subscriber.getAddress());
            LOGGER.fine(msg);
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Connecting and Resubscribing
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Connects, installs the connection as the subscriber's writer and
     * replays the registry. Queues CONNECTED on success; on failure leaves
     * the stream disconnected so that the next call starts over.
     */
    private void establish() {
        Socket s = connect();
        if (s == null) {
            return;
        }
        InputStream input;
        try {
            input = s.getInputStream();
            subscriber.attach(s);
            subscriber.replay();
        } catch (IOException e) {
            if (!isClosed()) {
                String msg = MessageFormat.format(RedisSubscriber.L10N.getString("warn.resubscribe_failed"),
                        subscriber.getAddress());
                LOGGER.log(Level.WARNING, msg, e);
            }
            release(s);
            return;
        } catch (RuntimeException e) {
            release(s);
            throw e;
        }
        if (isClosed()) {
            release(s);
            return;
        }
        in = input;
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(RedisSubscriber.L10N.getString("debug.connected"),
                    subscriber.getAddress());
            LOGGER.fine(msg);
        }
        pending.addLast(PubSubEvent.connected());
    }

    /**
     * Runs one connect sequence: a first attempt followed by up to
     * maxRetries retries with backoff.
     *
     * @return the connected socket, or null if the sequence gave up or
     *         the stream was closed
     */
    private Socket connect() {
        Backoff backoff = subscriber.getBackoff();
        int attempt = 0;
        while (!isClosed()) {
            Socket s = null;
            try {
                s = subscriber.createSocket();
                socket = s;
                if (isClosed()) {
                    release(s);
                    return null;
                }
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = MessageFormat.format(RedisSubscriber.L10N.getString("debug.connecting"),
                            subscriber.getAddress());
                    LOGGER.fine(msg);
                }
                subscriber.connect(s);
                return s;
            } catch (IOException e) {
                if (s != null) {
                    release(s);
                }
                if (isClosed()) {
                    return null;
                }
                if (attempt >= backoff.getMaxRetries()) {
                    String msg = MessageFormat.format(RedisSubscriber.L10N.getString("warn.connect_gave_up"),
                            subscriber.getAddress(), attempt + 1);
                    LOGGER.log(Level.WARNING, msg, e);
                    return null;
                }
                attempt++;
                long delay = backoff.getDelay(attempt);
                String msg = MessageFormat.format(RedisSubscriber.L10N.getString("warn.connect_failed"),
                        subscriber.getAddress(), attempt, backoff.getMaxRetries(), delay, e.getMessage());
                LOGGER.warning(msg);
                if (!sleep(delay)) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * Waits for the given delay.
     *
     * @return false if the stream was closed (or the thread interrupted)
     *         while waiting
     */
    private boolean sleep(long delay) {
        try {
            return !closed.await(delay, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return false;
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Streaming
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Performs one read and queues the events decoded from it.
     */
    private void receive() {
        int len;
        try {
            len = in.read(readBuffer);
        } catch (IOException e) {
            disconnect(e);
            return;
        }
        if (len < 0) {
            disconnect(new EOFException(RedisSubscriber.L10N.getString("err.end_of_stream")));
            return;
        }
        decoder.receive(ByteBuffer.wrap(readBuffer, 0, len));
        for (;;) {
            RESPValue value;
            try {
                value = decoder.next();
            } catch (RESPException e) {
                String msg = MessageFormat.format(RedisSubscriber.L10N.getString("warn.decode_failed"),
                        subscriber.getAddress());
                LOGGER.log(Level.WARNING, msg, e);
                pending.addLast(PubSubEvent.decodeError(e));
                continue;
            }
            if (value == null) {
                break;
            }
            try {
                pending.addLast(PubSubMessageMapper.map(value));
            } catch (MessageMappingException e) {
                String msg = MessageFormat.format(RedisSubscriber.L10N.getString("warn.mapping_failed"),
                        value);
                LOGGER.log(Level.WARNING, msg, e);
                pending.addLast(PubSubEvent.decodeError(e));
            }
        }
    }

    /**
     * Ends Streaming: clears the writer, drops the connection and any
     * partial data, and queues DISCONNECTED unless the stream was closed.
     */
    private void disconnect(IOException cause) {
        Socket s = socket;
        if (s != null) {
            release(s);
        }
        in = null;
        decoder.reset();
        if (isClosed()) {
            return;
        }
        String msg = MessageFormat.format(RedisSubscriber.L10N.getString("warn.disconnected"),
                subscriber.getAddress(), cause.getMessage());
        LOGGER.warning(msg);
        pending.addLast(PubSubEvent.disconnected(cause));
    }

    private void release(Socket s) {
        subscriber.detach(s);
        subscriber.closeSocket(s);
        if (socket == s) {
            socket = null;
        }
    }

}
