/*
 * RESPEncoder.java
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

package org.bluezoo.redsub.codec;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encodes commands and values to RESP wire format.
 *
 * <p>Subscription commands are sent in the inline form, a single line of
 * space-separated words terminated by CRLF. Any {@link RESPValue} can also
 * be encoded in its canonical wire form, which is what a server sends;
 * decoding the result yields an equal value.
 *
 * <p>This class is thread-safe. Each encoding operation creates a new
 * buffer.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * RESPEncoder encoder = new RESPEncoder();
 *
 * // SUBSCRIBE news\r\n
 * ByteBuffer command = encoder.encodeInline("SUBSCRIBE", "news");
 *
 * // *3\r\n$7\r\nmessage\r\n$4\r\nnews\r\n$5\r\nhello\r\n
 * ByteBuffer push = encoder.encode(RESPValue.array(
 *         RESPValue.bulkString("message"),
 *         RESPValue.bulkString("news"),
 *         RESPValue.bulkString("hello")));
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPEncoder {

    private static final Charset UTF_8 = StandardCharsets.UTF_8;
    private static final byte[] CRLF = new byte[] { '\r', '\n' };
    private static final byte[] NULL = "$-1\r\n".getBytes(UTF_8);

    /**
     * Creates a new RESP encoder.
     */
    public RESPEncoder() {
    }

    /**
     * Encodes an inline command.
     *
     * <p>The command and its arguments are joined by single spaces and
     * terminated with CRLF. Arguments are written as given, so they must
     * not contain spaces or line terminators.
     *
     * @param command the command name
     * @param args the command arguments
     * @return a ByteBuffer containing the encoded inline command
     */
    public ByteBuffer encodeInline(String command, String... args) {
        StringBuilder sb = new StringBuilder(command);
        for (String arg : args) {
            sb.append(' ');
            sb.append(arg);
        }
        sb.append("\r\n");
        return ByteBuffer.wrap(sb.toString().getBytes(UTF_8));
    }

    /**
     * Encodes a value in RESP wire format.
     *
     * @param value the value to encode
     * @return a ByteBuffer containing the encoded value
     */
    public ByteBuffer encode(RESPValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, value);
        return ByteBuffer.wrap(out.toByteArray());
    }

    private void write(ByteArrayOutputStream out, RESPValue value) {
        switch (value.getType()) {
            case NULL:
                out.write(NULL, 0, NULL.length);
                break;
            case SIMPLE_STRING:
            case ERROR:
            case INTEGER:
                out.write(value.getType().getPrefix());
                writeLine(out, value.asString().getBytes(UTF_8));
                break;
            case BULK_STRING:
                byte[] data = value.asString().getBytes(UTF_8);
                out.write('$');
                writeLine(out, Integer.toString(data.length).getBytes(UTF_8));
                writeLine(out, data);
                break;
            case ARRAY:
                List<RESPValue> elements = value.asArray();
                out.write('*');
                writeLine(out, Integer.toString(elements.size()).getBytes(UTF_8));
                for (RESPValue element : elements) {
                    write(out, element);
                }
                break;
            default:
                throw new IllegalArgumentException(String.valueOf(value.getType()));
        }
    }

    private void writeLine(ByteArrayOutputStream out, byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        out.write(CRLF, 0, CRLF.length);
    }

}
