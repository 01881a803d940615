/*
 * RESPDecoder.java
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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;

/**
 * Decodes RESP wire format to values.
 *
 * <p>This decoder handles streaming input, accumulating data until complete
 * RESP values can be parsed. Data may arrive in arbitrary chunks: a value
 * split across several reads is returned once its last byte has been
 * received, exactly as if it had arrived in one piece.
 *
 * <h4>Usage Pattern</h4>
 * <pre>{@code
 * RESPDecoder decoder = new RESPDecoder();
 *
 * // After each read:
 * decoder.receive(ByteBuffer.wrap(buf, 0, n));
 * for (;;) {
 *     RESPValue value;
 *     try {
 *         value = decoder.next();
 *     } catch (RESPException e) {
 *         report(e); // the bad data has been discarded
 *         continue;
 *     }
 *     if (value == null) {
 *         break; // need more data
 *     }
 *     handle(value);
 * }
 * }</pre>
 *
 * <h4>Malformed input</h4>
 *
 * <p>A value is either parsed completely or left in the buffer for a later
 * call. Data that can never parse is not retained: when {@link #next()}
 * throws, the decoder has already skipped past the line where the problem
 * was found (or discarded everything buffered, if that line is not yet
 * terminated), so repeated calls always make progress. A value whose text
 * is not valid UTF-8 is structurally complete; it is consumed as a whole
 * and reported with a {@link CharacterCodingException} cause.
 *
 * <p>Buffering is bounded: a line longer than 64 KiB, a bulk string
 * longer than 512 MiB, an array of more than 1048576 elements or arrays
 * nested more than 256 deep are rejected as malformed. For over-deep
 * nesting the array headers already read are discarded with the
 * offending one.
 *
 * <p>Decoder instances are not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPDecoder {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.redsub.codec.L10N");

    private static final int DEFAULT_BUFFER_SIZE = 16384;
    private static final int MAX_INLINE_LENGTH = 65536;
    private static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    private static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    private static final int MAX_NESTING_DEPTH = 256;

    private final CharsetDecoder utf8;
    private ByteBuffer buffer;
    private CharacterCodingException encodingError;
    private boolean discardParsed;

    /**
     * Creates a new RESP decoder with default buffer size.
     */
    public RESPDecoder() {
        this(DEFAULT_BUFFER_SIZE);
    }

    /**
     * Creates a new RESP decoder with the specified initial buffer size.
     * The buffer grows as needed.
     *
     * @param initialCapacity the initial buffer capacity
     */
    public RESPDecoder(int initialCapacity) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("initialCapacity must be at least 1");
        }
        this.utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        this.buffer = ByteBuffer.allocate(initialCapacity);
        this.buffer.flip(); // read mode, no data
    }

    /**
     * Appends data to the decode buffer.
     *
     * <p>Call {@link #next()} afterwards to retrieve decoded values.
     *
     * @param data the data to append; its position is advanced to its limit
     */
    public void receive(ByteBuffer data) {
        if (!data.hasRemaining()) {
            return;
        }
        int needed = buffer.remaining() + data.remaining();
        if (needed > buffer.capacity()) {
            int newCapacity = buffer.capacity();
            while (newCapacity < needed) {
                newCapacity = newCapacity * 2;
            }
            ByteBuffer newBuffer = ByteBuffer.allocate(newCapacity);
            newBuffer.put(buffer);
            buffer = newBuffer;
        } else {
            buffer.compact();
        }
        buffer.put(data);
        buffer.flip();
    }

    /**
     * Decodes the next complete RESP value.
     *
     * <p>If a complete value is available it is returned and removed from
     * the buffer. If the data is incomplete, returns null and the data is
     * kept for the next call.
     *
     * @return the next decoded value, or null if incomplete
     * @throws RESPException if the data is malformed; the malformed data
     *         has been discarded
     */
    public RESPValue next() throws RESPException {
        if (!buffer.hasRemaining()) {
            return null;
        }
        int start = buffer.position();
        encodingError = null;
        discardParsed = false;
        RESPValue result;
        try {
            result = tryParse(0);
        } catch (RESPException e) {
            if (!discardParsed) {
                buffer.position(start);
            }
            discardParsed = false;
            discardLine();
            throw e;
        }
        if (result == null) {
            buffer.position(start);
            return null;
        }
        if (encodingError != null) {
            // Structurally complete, so the whole value has been consumed
            CharacterCodingException cause = encodingError;
            encodingError = null;
            throw new RESPException(L10N.getString("err.invalid_utf8"), cause);
        }
        return result;
    }

    /**
     * Decodes every complete value currently buffered.
     *
     * <p>Stops at the first incomplete value, leaving it buffered.
     *
     * @return the decoded values in wire order, possibly empty
     * @throws RESPException if malformed data is found; values decoded
     *         before it are lost to the caller, so stream consumers should
     *         prefer {@link #next()}
     */
    public List<RESPValue> decodeAll() throws RESPException {
        List<RESPValue> values = new ArrayList<RESPValue>();
        RESPValue value;
        while ((value = next()) != null) {
            values.add(value);
        }
        return values;
    }

    /**
     * Parses a value at the current position.
     * Returns null if incomplete.
     */
    private RESPValue tryParse(int depth) throws RESPException {
        if (!buffer.hasRemaining()) {
            return null;
        }
        RESPType type = RESPType.fromPrefix(buffer.get());
        switch (type) {
            case SIMPLE_STRING:
                return parseSimpleString();
            case ERROR:
                return parseError();
            case INTEGER:
                return parseInteger();
            case BULK_STRING:
                return parseBulkString();
            default:
                return parseArray(depth);
        }
    }

    /**
     * Parses a simple string (+...\r\n).
     */
    private RESPValue parseSimpleString() throws RESPException {
        String line = readLine();
        if (line == null) {
            return null;
        }
        return RESPValue.simpleString(line);
    }

    /**
     * Parses an error (-...\r\n).
     */
    private RESPValue parseError() throws RESPException {
        String line = readLine();
        if (line == null) {
            return null;
        }
        return RESPValue.error(line);
    }

    /**
     * Parses an integer (:...\r\n).
     */
    private RESPValue parseInteger() throws RESPException {
        String line = readLine();
        if (line == null) {
            return null;
        }
        try {
            return RESPValue.integer(Long.parseLong(line));
        } catch (NumberFormatException e) {
            String msg = MessageFormat.format(L10N.getString("err.invalid_integer"), line);
            throw new RESPException(msg, e);
        }
    }

    /**
     * Parses a bulk string ($length\r\ndata\r\n) or the null marker ($-1\r\n).
     */
    private RESPValue parseBulkString() throws RESPException {
        String lengthLine = readLine();
        if (lengthLine == null) {
            return null;
        }
        int length = parseLength(lengthLine, "err.invalid_bulk_string_length");
        if (length == -1) {
            return RESPValue.nullValue();
        }
        if (length > MAX_BULK_LENGTH) {
            String msg = MessageFormat.format(L10N.getString("err.bulk_string_too_long"), length);
            throw new RESPException(msg);
        }
        if (buffer.remaining() < (long) length + 2) {
            return null;
        }
        int end = buffer.position() + length;
        if (buffer.get(end) != '\r' || buffer.get(end + 1) != '\n') {
            throw new RESPException(L10N.getString("err.no_crlf_after_bulk_string"));
        }
        String text = decodeText(length);
        buffer.position(end + 2);
        return RESPValue.bulkString(text);
    }

    /**
     * Parses an array (*count\r\n...). Elements are parsed recursively,
     * up to MAX_NESTING_DEPTH levels.
     */
    private RESPValue parseArray(int depth) throws RESPException {
        if (depth >= MAX_NESTING_DEPTH) {
            // the enclosing headers are discarded with this one
            discardParsed = true;
            String msg = MessageFormat.format(L10N.getString("err.nesting_too_deep"), MAX_NESTING_DEPTH);
            throw new RESPException(msg);
        }
        String countLine = readLine();
        if (countLine == null) {
            return null;
        }
        int count = parseLength(countLine, "err.invalid_array_count");
        if (count == -1) {
            return RESPValue.nullValue();
        }
        if (count > MAX_ARRAY_LENGTH) {
            String msg = MessageFormat.format(L10N.getString("err.array_too_long"), count);
            throw new RESPException(msg);
        }
        List<RESPValue> elements = new ArrayList<RESPValue>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            RESPValue element = tryParse(depth + 1);
            if (element == null) {
                return null;
            }
            elements.add(element);
        }
        return RESPValue.array(elements);
    }

    /**
     * Parses a length header. The only negative length accepted is -1.
     */
    private int parseLength(String line, String errorKey) throws RESPException {
        int length;
        try {
            length = Integer.parseInt(line);
        } catch (NumberFormatException e) {
            String msg = MessageFormat.format(L10N.getString(errorKey), line);
            throw new RESPException(msg, e);
        }
        if (length < -1) {
            String msg = MessageFormat.format(L10N.getString(errorKey), line);
            throw new RESPException(msg);
        }
        return length;
    }

    /**
     * Reads a line terminated by CRLF, leaving the position after the CRLF.
     * Returns null if incomplete, unless the partial line is already too
     * long.
     */
    private String readLine() throws RESPException {
        int start = buffer.position();
        int limit = buffer.limit();
        for (int i = start; i < limit - 1; i++) {
            if (buffer.get(i) == '\r' && buffer.get(i + 1) == '\n') {
                int length = i - start;
                if (length > MAX_INLINE_LENGTH) {
                    String msg = MessageFormat.format(L10N.getString("err.line_too_long"), length);
                    throw new RESPException(msg);
                }
                String line = decodeText(length);
                buffer.position(i + 2);
                return line;
            }
        }
        if (limit - start > MAX_INLINE_LENGTH + 1) {
            String msg = MessageFormat.format(L10N.getString("err.line_too_long"), limit - start);
            throw new RESPException(msg);
        }
        return null;
    }

    /**
     * Decodes the next length bytes as UTF-8 without moving the position.
     * Invalid text is recorded in encodingError and decoded as empty,
     * so that parsing can find the end of the enclosing value.
     */
    private String decodeText(int length) {
        if (length == 0) {
            return "";
        }
        ByteBuffer slice = buffer.duplicate();
        slice.limit(slice.position() + length);
        try {
            return utf8.decode(slice).toString();
        } catch (CharacterCodingException e) {
            if (encodingError == null) {
                encodingError = e;
            }
            return "";
        }
    }

    /**
     * Skips past the next CRLF, or discards all buffered data if there
     * is none. Always consumes at least one byte.
     */
    private void discardLine() {
        int start = buffer.position();
        int limit = buffer.limit();
        for (int i = start; i < limit - 1; i++) {
            if (buffer.get(i) == '\r' && buffer.get(i + 1) == '\n') {
                buffer.position(i + 2);
                return;
            }
        }
        buffer.position(limit);
    }

    /**
     * Resets the decoder, discarding any buffered data.
     */
    public void reset() {
        buffer.clear();
        buffer.flip();
        encodingError = null;
    }

    /**
     * Returns the number of bytes currently buffered.
     *
     * @return the buffered byte count
     */
    public int bufferedBytes() {
        return buffer.remaining();
    }

}
