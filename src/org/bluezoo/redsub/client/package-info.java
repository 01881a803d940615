/**
 * Resilient Redis Pub/Sub subscriber.
 *
 * <p>This package maintains a single logical subscription session against
 * a Redis server over an unreliable TCP connection. It remembers which
 * channels and patterns the caller wants, reconnects with backoff after
 * any failure, replays those subscriptions on every new connection, and
 * delivers everything that happens as one ordered feed of
 * {@link org.bluezoo.redsub.client.PubSubEvent}s.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.redsub.client.RedisSubscriber} - The session:
 *       subscription methods and {@code listen()}</li>
 *   <li>{@link org.bluezoo.redsub.client.SubscriptionStream} - The event feed
 *       and the connect/resubscribe/read loop behind it</li>
 *   <li>{@link org.bluezoo.redsub.client.SubscriptionRegistry} - Desired
 *       channels and patterns</li>
 *   <li>{@link org.bluezoo.redsub.client.PubSubMessageMapper} - Converts
 *       decoded values into events</li>
 *   <li>{@link org.bluezoo.redsub.client.Backoff} - Reconnect delays</li>
 * </ul>
 *
 * <h2>Errors</h2>
 *
 * <p>Only usage errors are thrown to callers: unsubscribing from something
 * not subscribed raises
 * {@link org.bluezoo.redsub.client.NotSubscribedException}, and a failed
 * write raises {@link java.io.IOException} after closing the connection.
 * Connection failures and undecodable data are reported as
 * {@code DISCONNECTED} and {@code DECODE_ERROR} events and never end the
 * stream.
 *
 * <h2>Logging</h2>
 *
 * <p>Classes log through {@link java.util.logging} under their own class
 * names: connection state changes and commands at {@code FINE}, failures
 * at {@code WARNING}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.redsub.codec
 */
package org.bluezoo.redsub.client;
