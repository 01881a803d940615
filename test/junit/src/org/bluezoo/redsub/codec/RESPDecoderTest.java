/*
 * RESPDecoderTest.java
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

import org.junit.Before;
import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link RESPDecoder}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPDecoderTest {

    private RESPDecoder decoder;

    @Before
    public void setUp() {
        decoder = new RESPDecoder();
    }

    private static ByteBuffer wrap(String data) {
        return ByteBuffer.wrap(data.getBytes(StandardCharsets.UTF_8));
    }

    private RESPValue decode(String data) throws RESPException {
        decoder.receive(wrap(data));
        return decoder.next();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Scalars
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testDecodeSimpleString() throws RESPException {
        RESPValue value = decode("+OK\r\n");

        assertNotNull(value);
        assertTrue(value.isSimpleString());
        assertEquals("OK", value.asString());
    }

    @Test
    public void testDecodeEmptySimpleString() throws RESPException {
        assertEquals(RESPValue.simpleString(""), decode("+\r\n"));
    }

    @Test
    public void testDecodeError() throws RESPException {
        RESPValue value = decode("-ERR unknown command\r\n");

        assertTrue(value.isError());
        assertEquals("ERR unknown command", value.getErrorMessage());
    }

    @Test
    public void testDecodeIntegers() throws RESPException {
        assertEquals(1000, decode(":1000\r\n").asLong());
        assertEquals(-500, decode(":-500\r\n").asLong());
        assertEquals(Long.MAX_VALUE, decode(":9223372036854775807\r\n").asLong());
    }

    @Test
    public void testDecodeBulkString() throws RESPException {
        RESPValue value = decode("$6\r\nfoobar\r\n");

        assertTrue(value.isBulkString());
        assertEquals("foobar", value.asString());
    }

    @Test
    public void testEmptyBulkStringIsNotNull() throws RESPException {
        RESPValue value = decode("$0\r\n\r\n");

        assertFalse(value.isNull());
        assertEquals(RESPValue.bulkString(""), value);
    }

    @Test
    public void testDecodeNullBulkString() throws RESPException {
        assertSame(RESPValue.nullValue(), decode("$-1\r\n"));
    }

    @Test
    public void testDecodeNullArray() throws RESPException {
        assertTrue(decode("*-1\r\n").isNull());
    }

    @Test
    public void testBulkStringMayContainCRLF() throws RESPException {
        assertEquals("foo\r\nbar", decode("$8\r\nfoo\r\nbar\r\n").asString());
    }

    @Test
    public void testBulkLengthCountsBytesNotChars() throws RESPException {
        // "héllo" is 6 bytes in UTF-8
        assertEquals("héllo", decode("$6\r\nhéllo\r\n").asString());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Arrays
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testDecodeEmptyArray() throws RESPException {
        RESPValue value = decode("*0\r\n");

        assertTrue(value.isArray());
        assertTrue(value.asArray().isEmpty());
    }

    @Test
    public void testDecodePubSubMessage() throws RESPException {
        RESPValue value = decode("*3\r\n$7\r\nmessage\r\n$4\r\nnews\r\n$5\r\nhello\r\n");

        assertEquals(RESPValue.array(
                RESPValue.bulkString("message"),
                RESPValue.bulkString("news"),
                RESPValue.bulkString("hello")), value);
    }

    @Test
    public void testDecodeArrayWithNullElement() throws RESPException {
        RESPValue value = decode("*3\r\n$3\r\nfoo\r\n$-1\r\n$3\r\nbar\r\n");

        List<RESPValue> elements = value.asArray();
        assertEquals(3, elements.size());
        assertEquals("foo", elements.get(0).asString());
        assertTrue(elements.get(1).isNull());
        assertEquals("bar", elements.get(2).asString());
    }

    @Test
    public void testDecodeNestedArray() throws RESPException {
        RESPValue value = decode("*2\r\n*3\r\n:1\r\n:2\r\n:3\r\n*2\r\n+Foo\r\n-Bar\r\n");

        RESPValue expected = RESPValue.array(
                RESPValue.array(RESPValue.integer(1), RESPValue.integer(2), RESPValue.integer(3)),
                RESPValue.array(RESPValue.simpleString("Foo"), RESPValue.error("Bar")));
        assertEquals(expected, value);
    }

    @Test
    public void testDecodeDeeplyNestedArray() throws RESPException {
        StringBuilder wire = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            wire.append("*1\r\n");
        }
        wire.append(":7\r\n");

        RESPValue value = decode(wire.toString());
        for (int i = 0; i < 50; i++) {
            assertTrue(value.isArray());
            value = value.asArray().get(0);
        }
        assertEquals(7, value.asLong());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Incremental decoding
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testIncompleteBulkString() throws RESPException {
        decoder.receive(wrap("$5\r\nhel"));
        assertNull(decoder.next());
        assertEquals(7, decoder.bufferedBytes());

        decoder.receive(wrap("lo\r\n"));
        assertEquals("hello", decoder.next().asString());
        assertEquals(0, decoder.bufferedBytes());
    }

    @Test
    public void testIncompleteArrayKeepsEarlierElements() throws RESPException {
        decoder.receive(wrap("*2\r\n$3\r\nfoo\r\n"));
        assertNull(decoder.next());

        decoder.receive(wrap("$3\r\nbar\r\n"));
        assertEquals(2, decoder.next().asArray().size());
    }

    @Test
    public void testSplitAtEveryBoundary() throws RESPException {
        String[] samples = new String[] {
            "+OK\r\n",
            "-ERR no\r\n",
            ":-42\r\n",
            "$-1\r\n",
            "$0\r\n\r\n",
            "$8\r\nfoo\r\nbar\r\n",
            "*4\r\n$8\r\npmessage\r\n$2\r\nn*\r\n$4\r\nnews\r\n$2\r\nhi\r\n",
            "*2\r\n*1\r\n:1\r\n*0\r\n",
        };
        for (String sample : samples) {
            byte[] bytes = sample.getBytes(StandardCharsets.UTF_8);
            RESPValue whole = wholeValue(bytes);
            for (int split = 1; split < bytes.length; split++) {
                RESPDecoder d = new RESPDecoder();
                d.receive(ByteBuffer.wrap(bytes, 0, split));
                assertNull(sample + " split at " + split, d.next());
                d.receive(ByteBuffer.wrap(bytes, split, bytes.length - split));
                assertEquals(sample + " split at " + split, whole, d.next());
                assertEquals(0, d.bufferedBytes());
            }
        }
    }

    private static RESPValue wholeValue(byte[] bytes) throws RESPException {
        RESPDecoder d = new RESPDecoder();
        d.receive(ByteBuffer.wrap(bytes));
        RESPValue value = d.next();
        assertNotNull(value);
        return value;
    }

    @Test
    public void testSplitInsideMultiByteCharacter() throws RESPException {
        byte[] bytes = "$2\r\né\r\n".getBytes(StandardCharsets.UTF_8);
        // split between the two bytes of the e-acute
        decoder.receive(ByteBuffer.wrap(bytes, 0, 5));
        assertNull(decoder.next());
        decoder.receive(ByteBuffer.wrap(bytes, 5, bytes.length - 5));
        assertEquals("é", decoder.next().asString());
    }

    @Test
    public void testDecodeAll() throws RESPException {
        decoder.receive(wrap("+OK\r\n:100\r\n$3\r\nfoo\r\n$3\r\nba"));

        List<RESPValue> values = decoder.decodeAll();
        assertEquals(3, values.size());
        assertEquals("OK", values.get(0).asString());
        assertEquals(100, values.get(1).asLong());
        assertEquals("foo", values.get(2).asString());
        assertEquals(7, decoder.bufferedBytes());
    }

    @Test
    public void testBufferGrowth() throws RESPException {
        decoder = new RESPDecoder(8);

        decoder.receive(wrap("$20\r\n1234567890"));
        decoder.receive(wrap("1234567890\r\n+OK\r\n"));
        assertEquals("12345678901234567890", decoder.next().asString());
        assertEquals("OK", decoder.next().asString());
    }

    @Test
    public void testReset() throws RESPException {
        decoder.receive(wrap("+partial"));
        decoder.reset();
        assertEquals(0, decoder.bufferedBytes());

        assertEquals("OK", decode("+OK\r\n").asString());
    }

    @Test
    public void testNextOnEmptyBuffer() throws RESPException {
        assertNull(decoder.next());
        decoder.receive(ByteBuffer.allocate(0));
        assertNull(decoder.next());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Malformed input
    // ─────────────────────────────────────────────────────────────────────────

    @Test(expected = RESPException.class)
    public void testUnknownTypePrefix() throws RESPException {
        decode("X123\r\n");
    }

    @Test(expected = RESPException.class)
    public void testInvalidInteger() throws RESPException {
        decode(":abc\r\n");
    }

    @Test(expected = RESPException.class)
    public void testInvalidBulkStringLength() throws RESPException {
        decode("$abc\r\nhello\r\n");
    }

    @Test(expected = RESPException.class)
    public void testNegativeBulkLengthOtherThanNull() throws RESPException {
        decode("$-2\r\n");
    }

    @Test(expected = RESPException.class)
    public void testNegativeArrayCountOtherThanNull() throws RESPException {
        decode("*-5\r\n");
    }

    @Test(expected = RESPException.class)
    public void testBulkStringWithoutTrailingCRLF() throws RESPException {
        decode("$3\r\nfooXY");
    }

    @Test
    public void testMalformedLineIsDiscarded() throws RESPException {
        decoder.receive(wrap("X123\r\n+OK\r\n"));
        try {
            decoder.next();
            fail("Expected RESPException");
        } catch (RESPException e) {
            assertFalse(e.isEncodingError());
        }
        assertEquals("OK", decoder.next().asString());
        assertNull(decoder.next());
    }

    @Test
    public void testUnterminatedGarbageIsDiscarded() throws RESPException {
        decoder.receive(wrap("garbage without line end"));
        try {
            decoder.next();
            fail("Expected RESPException");
        } catch (RESPException e) {
            // expected
        }
        assertEquals(0, decoder.bufferedBytes());
    }

    @Test
    public void testRepeatedFailuresAlwaysProgress() {
        decoder.receive(wrap("?\r\n?\r\n?\r\n!"));
        int failures = 0;
        for (int i = 0; i < 10; i++) {
            try {
                if (decoder.next() == null) {
                    break;
                }
            } catch (RESPException e) {
                failures++;
            }
        }
        assertEquals(4, failures);
        assertEquals(0, decoder.bufferedBytes());
    }

    @Test
    public void testInvalidUTF8DiscardsWholeValue() throws RESPException {
        ByteBuffer buf = ByteBuffer.allocate(64);
        buf.put("*3\r\n$7\r\nmessage\r\n$1\r\na\r\n$2\r\n".getBytes(StandardCharsets.US_ASCII));
        buf.put(new byte[] { (byte) 0xC3, (byte) 0x28 });
        buf.put("\r\n+OK\r\n".getBytes(StandardCharsets.US_ASCII));
        buf.flip();
        decoder.receive(buf);

        try {
            decoder.next();
            fail("Expected RESPException");
        } catch (RESPException e) {
            assertTrue(e.isEncodingError());
        }
        assertEquals("OK", decoder.next().asString());
        assertNull(decoder.next());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Limits
    // ─────────────────────────────────────────────────────────────────────────

    private static String nested(int depth) {
        StringBuilder wire = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            wire.append("*1\r\n");
        }
        return wire.append(":1\r\n").toString();
    }

    @Test
    public void testNestingAtLimit() throws RESPException {
        assertTrue(decode(nested(256)).isArray());
    }

    @Test
    public void testNestingBeyondLimit() {
        decoder.receive(wrap(nested(257)));
        try {
            decoder.next();
            fail("Expected RESPException");
        } catch (RESPException e) {
            assertFalse(e.isEncodingError());
        }
    }

    @Test
    public void testExtremeNestingIsReportedNotFatal() {
        decoder.receive(wrap(nested(100000)));
        int failures = 0;
        int values = 0;
        for (int i = 0; i < 10000; i++) {
            try {
                RESPValue value = decoder.next();
                if (value == null) {
                    break;
                }
                values++;
            } catch (RESPException e) {
                failures++;
            }
        }
        assertTrue(failures > 0);
        assertTrue(failures < 1000);
        assertEquals(1, values);
        assertEquals(0, decoder.bufferedBytes());
    }

    @Test
    public void testUnterminatedLongLineRejected() {
        StringBuilder line = new StringBuilder("+");
        for (int i = 0; i < 70000; i++) {
            line.append('a');
        }
        decoder.receive(wrap(line.toString()));
        try {
            decoder.next();
            fail("Expected RESPException");
        } catch (RESPException e) {
            assertEquals(0, decoder.bufferedBytes());
        }
    }

    @Test
    public void testOversizedBulkLengthRejected() throws RESPException {
        decoder.receive(wrap("$2000000000\r\n+OK\r\n"));
        try {
            decoder.next();
            fail("Expected RESPException");
        } catch (RESPException e) {
            // header discarded
        }
        assertEquals("OK", decoder.next().asString());
    }

    @Test(expected = RESPException.class)
    public void testOversizedArrayCountRejected() throws RESPException {
        decode("*2000000000\r\n");
    }

}
