/*
 * RedisSubscriber.java
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
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.redsub.codec.RESPEncoder;

/**
 * A resilient Redis Pub/Sub subscriber.
 *
 * <p>The subscriber keeps a {@link SubscriptionRegistry} of the channels
 * and patterns the caller wants. A channel counts as subscribed as soon
 * as {@link #subscribe} returns, whether or not a connection is open: the
 * command is sent immediately when connected, and every subscription is
 * replayed whenever {@link #listen() the subscription stream} connects
 * or reconnects.
 *
 * <p>Nothing connects until {@link #listen()} is called. The returned
 * stream connects, replays the registry, and then delivers server pushes
 * and connection events for as long as it is consumed, reconnecting with
 * {@link Backoff backoff} after any failure.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * RedisSubscriber subscriber = new RedisSubscriber("localhost:6379");
 * subscriber.subscribe("news");
 * subscriber.psubscribe("sensor.*");
 *
 * SubscriptionStream stream = subscriber.listen();
 * while (stream.hasNext()) {
 *     PubSubEvent event = stream.next();
 *     if (event.isMessage()) {
 *         System.out.println(event.getChannel() + ": " + event.getPayload());
 *     }
 * }
 * }</pre>
 *
 * <p>The subscription methods may be called from any thread while
 * another thread consumes the stream. All commands go through one send
 * path guarded by a single lock, so writes never interleave. A registry
 * change and the command sent for it happen under that same lock, as
 * does the replay after a reconnect, so the server always ends up with
 * the subscriptions in the registry.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RedisSubscriber implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(RedisSubscriber.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.redsub.client.L10N");

    /** The default Redis port. */
    public static final int DEFAULT_PORT = 6379;

    /** The default connect timeout in milliseconds. */
    public static final int DEFAULT_CONNECT_TIMEOUT = 10000;

    private final String host;
    private final int port;
    private final SubscriptionRegistry registry;
    private final RESPEncoder encoder = new RESPEncoder();

    private final Object writeLock = new Object();
    private Socket socket; // guarded by writeLock
    private OutputStream out; // guarded by writeLock

    private SubscriptionStream stream; // guarded by this

    private volatile int connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private volatile int readTimeout = 0;
    private volatile Backoff backoff = new Backoff();

    // ─────────────────────────────────────────────────────────────────────────
    // Constructors
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Creates a subscriber for the server at the given address.
     *
     * <p>The address has the form {@code host:port}, {@code [ipv6]:port}
     * or just {@code host}, in which case the default port is used.
     * The host is resolved on every connect.
     *
     * @param address the server address
     * @throws IllegalArgumentException if the address cannot be parsed
     */
    public RedisSubscriber(String address) {
        this.registry = new SubscriptionRegistry();
        if (address == null || address.isEmpty()) {
            throw invalidAddress(address);
        }
        String h;
        int p = DEFAULT_PORT;
        if (address.startsWith("[")) {
            int end = address.indexOf(']');
            if (end < 0) {
                throw invalidAddress(address);
            }
            h = address.substring(1, end);
            String rest = address.substring(end + 1);
            if (!rest.isEmpty()) {
                if (rest.charAt(0) != ':') {
                    throw invalidAddress(address);
                }
                p = parsePort(rest.substring(1), address);
            }
        } else {
            int colon = address.indexOf(':');
            if (colon < 0 || address.indexOf(':', colon + 1) >= 0) {
                // no port, or an unbracketed IPv6 literal
                h = address;
            } else {
                h = address.substring(0, colon);
                p = parsePort(address.substring(colon + 1), address);
            }
        }
        if (h.isEmpty() || p < 1 || p > 65535) {
            throw invalidAddress(address);
        }
        this.host = h;
        this.port = p;
    }

    /**
     * Creates a subscriber for the server at the given host and port.
     *
     * @param host the Redis server host
     * @param port the Redis server port (typically 6379)
     * @throws IllegalArgumentException if the port is out of range
     */
    public RedisSubscriber(String host, int port) {
        this(host, port, new SubscriptionRegistry());
    }

    RedisSubscriber(String host, int port, SubscriptionRegistry registry) {
        if (host == null || host.isEmpty() || port < 1 || port > 65535) {
            throw invalidAddress(host + ":" + port);
        }
        this.host = host;
        this.port = port;
        this.registry = registry;
    }

    private static int parsePort(String text, String address) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw invalidAddress(address);
        }
    }

    private static IllegalArgumentException invalidAddress(String address) {
        return new IllegalArgumentException(MessageFormat.format(L10N.getString("err.invalid_address"), address));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Configuration
    // ─────────────────────────────────────────────────────────────────────────

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Sets the timeout for each connect attempt. Takes effect on the next
     * connect.
     *
     * @param connectTimeout the timeout in milliseconds, 0 for none
     */
    public void setConnectTimeout(int connectTimeout) {
        if (connectTimeout < 0) {
            throw new IllegalArgumentException("connectTimeout must not be negative");
        }
        this.connectTimeout = connectTimeout;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    /**
     * Sets how long a connection may stay silent before it is considered
     * dead. An expired read timeout is handled like a read error: the
     * stream reports a disconnect and reconnects. Subscribed connections
     * are idle whenever nothing is published, so choose a generous value.
     * Takes effect on the next connect.
     *
     * @param readTimeout the timeout in milliseconds, 0 (the default) for none
     */
    public void setReadTimeout(int readTimeout) {
        if (readTimeout < 0) {
            throw new IllegalArgumentException("readTimeout must not be negative");
        }
        this.readTimeout = readTimeout;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    /**
     * Sets the reconnect delay policy.
     *
     * @param backoff the backoff policy
     */
    public void setBackoff(Backoff backoff) {
        if (backoff == null) {
            throw new NullPointerException("backoff");
        }
        this.backoff = backoff;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Subscriptions
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Subscribes to a channel.
     *
     * <p>The channel is recorded first; if a connection is open the
     * {@code SUBSCRIBE} command is then sent on it. If not, the command is
     * sent when the stream next connects.
     *
     * @param channel the channel name
     * @throws IllegalArgumentException if the name is null, empty or
     *         contains a space, CR or LF; the registry is unchanged
     * @throws IOException if sending the command failed; the connection is
     *         closed and the subscription will be replayed on reconnect
     */
    public void subscribe(String channel) throws IOException {
        SubscriptionCommand command = SubscriptionCommand.subscribe(channel);
        synchronized (writeLock) {
            registry.addChannel(channel);
            send(command);
        }
    }

    /**
     * Unsubscribes from a channel.
     *
     * @param channel the channel name
     * @throws NotSubscribedException if the channel is not subscribed;
     *         nothing is sent
     * @throws IOException if sending the command failed; the connection is
     *         closed and the channel will not be replayed on reconnect
     */
    public void unsubscribe(String channel) throws NotSubscribedException, IOException {
        SubscriptionCommand command = SubscriptionCommand.unsubscribe(channel);
        synchronized (writeLock) {
            if (!registry.removeChannel(channel)) {
                throw new NotSubscribedException(channel);
            }
            send(command);
        }
    }

    /**
     * Subscribes to all channels matching a glob-style pattern.
     *
     * @param pattern the pattern
     * @throws IllegalArgumentException if the pattern is null, empty or
     *         contains a space, CR or LF; the registry is unchanged
     * @throws IOException if sending the command failed; the connection is
     *         closed and the subscription will be replayed on reconnect
     */
    public void psubscribe(String pattern) throws IOException {
        SubscriptionCommand command = SubscriptionCommand.psubscribe(pattern);
        synchronized (writeLock) {
            registry.addPattern(pattern);
            send(command);
        }
    }

    /**
     * Unsubscribes from a pattern.
     *
     * @param pattern the pattern
     * @throws NotSubscribedException if the pattern is not subscribed;
     *         nothing is sent
     * @throws IOException if sending the command failed
     */
    public void punsubscribe(String pattern) throws NotSubscribedException, IOException {
        SubscriptionCommand command = SubscriptionCommand.punsubscribe(pattern);
        synchronized (writeLock) {
            if (!registry.removePattern(pattern)) {
                throw new NotSubscribedException(pattern);
            }
            send(command);
        }
    }

    /**
     * Returns the channels currently subscribed.
     *
     * @return a snapshot of the channel names
     */
    public List<String> getChannels() {
        return registry.getChannels();
    }

    /**
     * Returns the patterns currently subscribed.
     *
     * @return a snapshot of the patterns
     */
    public List<String> getPatterns() {
        return registry.getPatterns();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Lifecycle
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Opens the subscription stream.
     *
     * <p>Only one stream may be open at a time, since all streams would
     * share the single connection. Close the stream to stop listening; a
     * later call to this method starts again from a fresh connection.
     *
     * @return the subscription stream
     * @throws IllegalStateException if a stream is already open
     */
    public synchronized SubscriptionStream listen() {
        if (stream != null) {
            throw new IllegalStateException(L10N.getString("err.stream_active"));
        }
        stream = new SubscriptionStream(this);
        return stream;
    }

    /**
     * Returns whether a connection is currently open.
     *
     * @return true if commands are sent immediately
     */
    public boolean isConnected() {
        synchronized (writeLock) {
            return out != null;
        }
    }

    /**
     * Closes the open subscription stream, if any. Subscriptions are kept.
     */
    @Override
    public void close() {
        SubscriptionStream s;
        synchronized (this) {
            s = stream;
        }
        if (s != null) {
            s.close();
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Connection management, used by SubscriptionStream
    // ─────────────────────────────────────────────────────────────────────────

    synchronized void streamClosed(SubscriptionStream s) {
        if (stream == s) {
            stream = null;
        }
    }

    String getAddress() {
        return host + ":" + port;
    }

    /**
     * Creates an unconnected socket configured with the current settings.
     */
    Socket createSocket() throws IOException {
        Socket s = new Socket();
        s.setTcpNoDelay(true);
        s.setKeepAlive(true);
        s.setSoTimeout(readTimeout);
        return s;
    }

    /**
     * Connects the given socket to the server, resolving the host afresh.
     */
    void connect(Socket s) throws IOException {
        s.connect(new InetSocketAddress(host, port), connectTimeout);
    }

    /**
     * Makes the given connected socket the one commands are written to.
     */
    void attach(Socket s) throws IOException {
        OutputStream o = s.getOutputStream();
        synchronized (writeLock) {
            socket = s;
            out = o;
        }
    }

    /**
     * Stops writing to the given socket, if it is the current one.
     */
    void detach(Socket s) {
        synchronized (writeLock) {
            if (socket == s) {
                socket = null;
                out = null;
            }
        }
    }

    /**
     * Sends a subscribe command for every registered channel, then for
     * every registered pattern. Registry changes wait until the replay
     * is complete.
     */
    void replay() throws IOException {
        synchronized (writeLock) {
            List<String> channels = registry.getChannels();
            List<String> patterns = registry.getPatterns();
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("debug.replaying"),
                        channels.size(), patterns.size(), getAddress());
                LOGGER.fine(msg);
            }
            for (String channel : channels) {
                send(SubscriptionCommand.subscribe(channel));
            }
            for (String pattern : patterns) {
                send(SubscriptionCommand.psubscribe(pattern));
            }
        }
    }

    /**
     * Writes a command to the current connection. Does nothing when
     * disconnected: the registry is replayed on the next connect.
     * A failed write closes the connection so that the stream reconnects.
     */
    void send(SubscriptionCommand command) throws IOException {
        ByteBuffer data = command.render(encoder);
        synchronized (writeLock) {
            if (out == null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = MessageFormat.format(L10N.getString("debug.command_deferred"), command);
                    LOGGER.fine(msg);
                }
                return;
            }
            try {
                out.write(data.array(), data.arrayOffset() + data.position(), data.remaining());
                out.flush();
            } catch (IOException e) {
                String msg = MessageFormat.format(L10N.getString("warn.write_failed"), command, getAddress());
                LOGGER.log(Level.WARNING, msg, e);
                Socket failed = socket;
                socket = null;
                out = null;
                closeSocket(failed);
                throw e;
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("debug.command_sent"), command);
                LOGGER.fine(msg);
            }
        }
    }

    /**
     * Closes a socket, logging rather than propagating any failure.
     */
    void closeSocket(Socket s) {
        if (s == null) {
            return;
        }
        try {
            s.close();
        } catch (IOException e) {
            String msg = MessageFormat.format(L10N.getString("warn.close_failed"), getAddress());
            LOGGER.log(Level.FINE, msg, e);
        }
    }

}
