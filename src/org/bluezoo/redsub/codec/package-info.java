/**
 * RESP (Redis Serialization Protocol) codec for the subscriber.
 *
 * <p>This package decodes the values a Redis server pushes to a subscribed
 * connection and encodes the inline commands sent back to it.
 *
 * <h2>RESP Data Types</h2>
 *
 * <table border="1" cellpadding="5">
 *   <caption>RESP Data Types</caption>
 *   <tr><th>Prefix</th><th>Type</th><th>Example</th></tr>
 *   <tr><td>{@code +}</td><td>Simple String</td><td>{@code +OK\r\n}</td></tr>
 *   <tr><td>{@code -}</td><td>Error</td><td>{@code -ERR unknown command\r\n}</td></tr>
 *   <tr><td>{@code :}</td><td>Integer</td><td>{@code :1000\r\n}</td></tr>
 *   <tr><td>{@code $}</td><td>Bulk String</td><td>{@code $6\r\nfoobar\r\n}</td></tr>
 *   <tr><td>{@code $-1}</td><td>Null</td><td>{@code $-1\r\n}</td></tr>
 *   <tr><td>{@code *}</td><td>Array</td><td>{@code *2\r\n$3\r\nfoo\r\n$3\r\nbar\r\n}</td></tr>
 * </table>
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.redsub.codec.RESPType} - Enumeration of RESP data types</li>
 *   <li>{@link org.bluezoo.redsub.codec.RESPValue} - An immutable decoded value</li>
 *   <li>{@link org.bluezoo.redsub.codec.RESPDecoder} - Incremental decoder</li>
 *   <li>{@link org.bluezoo.redsub.codec.RESPEncoder} - Inline command and value encoder</li>
 *   <li>{@link org.bluezoo.redsub.codec.RESPException} - Malformed or undecodable data</li>
 * </ul>
 *
 * <h2>Streaming Decoding</h2>
 *
 * <p>The decoder handles partial data gracefully. If a complete value
 * cannot be parsed from the available data, {@code next()} returns null
 * and the decoder keeps the partial data until more is received.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Encoder instances are thread-safe. Decoder instances are not and
 * should be used by the thread reading the connection.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see <a href="https://redis.io/docs/reference/protocol-spec/">Redis Protocol Specification</a>
 * @see org.bluezoo.redsub.client
 */
package org.bluezoo.redsub.codec;
