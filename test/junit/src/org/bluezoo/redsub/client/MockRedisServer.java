/*
 * MockRedisServer.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A minimal Redis stand-in for testing subscribers.
 *
 * <p>Listens on an ephemeral loopback port and serves one client at a
 * time. Every line the client sends is recorded without its CRLF; tests
 * push raw RESP data back with {@link #send(String)} and simulate a
 * dropped connection with {@link #dropClient()}.
 *
 * <p>Usage:
 * <pre>
 * MockRedisServer server = new MockRedisServer();
 * server.start();
 * RedisSubscriber subscriber = new RedisSubscriber(server.getHost(), server.getPort());
 * // ...
 * assertEquals("SUBSCRIBE news", server.takeCommand());
 * server.close();
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MockRedisServer {

    private static final Logger LOGGER = Logger.getLogger(MockRedisServer.class.getName());

    private static final long TIMEOUT_SECONDS = 10;

    private final BlockingQueue<String> commands = new LinkedBlockingQueue<String>();
    private final BlockingQueue<Socket> accepted = new LinkedBlockingQueue<Socket>();
    private final AtomicInteger connectionCount = new AtomicInteger();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile Socket client;

    /**
     * Starts listening on an ephemeral port.
     */
    public void start() throws IOException {
        start(0);
    }

    /**
     * Starts listening on the given loopback port.
     */
    public void start(int port) throws IOException {
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
        acceptThread = new Thread(new Runnable() {
            @Override
            public void run() {
                acceptLoop();
            }
        }, "MockRedisServer-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
    }

    /**
     * Returns the address this server is listening on.
     */
    public String getHost() {
        return serverSocket.getInetAddress().getHostAddress();
    }

    /**
     * Returns the port this server is listening on.
     */
    public int getPort() {
        return serverSocket.getLocalPort();
    }

    /**
     * Returns how many connections have been accepted.
     */
    public int getConnectionCount() {
        return connectionCount.get();
    }

    /**
     * Waits for the next client connection.
     */
    public void awaitConnection() throws InterruptedException {
        Socket s = accepted.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (s == null) {
            throw new AssertionError("No client connected");
        }
    }

    /**
     * Returns the next command line received, waiting for it if necessary.
     */
    public String takeCommand() throws InterruptedException {
        String command = commands.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (command == null) {
            throw new AssertionError("No command received");
        }
        return command;
    }

    /**
     * Returns the next command line if one arrives within the given time.
     */
    public String pollCommand(long millis) throws InterruptedException {
        return commands.poll(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Writes raw data to the connected client.
     */
    public void send(String data) throws IOException {
        Socket s = client;
        if (s == null) {
            throw new IOException("No client connected");
        }
        OutputStream out = s.getOutputStream();
        out.write(data.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    /**
     * Closes the current client connection, leaving the server listening.
     */
    public void dropClient() throws IOException {
        Socket s = client;
        client = null;
        if (s != null) {
            s.close();
        }
    }

    /**
     * Stops the server and closes any client connection.
     */
    public void close() throws IOException {
        dropClient();
        if (serverSocket != null) {
            serverSocket.close();
        }
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            final Socket s;
            try {
                s = serverSocket.accept();
            } catch (IOException e) {
                if (!serverSocket.isClosed()) {
                    LOGGER.log(Level.WARNING, "Accept failed", e);
                }
                return;
            }
            client = s;
            connectionCount.incrementAndGet();
            Thread reader = new Thread(new Runnable() {
                @Override
                public void run() {
                    readLoop(s);
                }
            }, "MockRedisServer-read");
            reader.setDaemon(true);
            reader.start();
            accepted.add(s);
        }
    }

    private void readLoop(Socket s) {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        try {
            InputStream in = s.getInputStream();
            int prev = -1;
            int c;
            while ((c = in.read()) != -1) {
                if (prev == '\r' && c == '\n') {
                    byte[] bytes = line.toByteArray();
                    commands.add(new String(bytes, 0, bytes.length - 1, StandardCharsets.UTF_8));
                    line.reset();
                    prev = -1;
                    continue;
                }
                line.write(c);
                prev = c;
            }
        } catch (SocketException e) {
            LOGGER.fine("Client connection closed: " + e.getMessage());
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Read failed", e);
        }
    }

}
