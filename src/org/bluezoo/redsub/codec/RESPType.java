/*
 * RESPType.java
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

import java.text.MessageFormat;

/**
 * RESP (Redis Serialization Protocol) value kinds.
 *
 * <p>Every kind except {@link #NULL} is identified by a single-byte prefix
 * in the wire format. A null value shares the bulk string prefix and is
 * recognised by its {@code -1} length.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum RESPType {

    /**
     * Simple string, prefixed by '+'.
     * A single line of text such as "OK".
     */
    SIMPLE_STRING('+'),

    /**
     * Error, prefixed by '-'.
     * A single line error message, usually starting with an error code.
     */
    ERROR('-'),

    /**
     * Integer, prefixed by ':'.
     * A signed 64-bit integer.
     */
    INTEGER(':'),

    /**
     * Bulk string, prefixed by '$'.
     * Text with an explicit byte length.
     */
    BULK_STRING('$'),

    /**
     * Array, prefixed by '*'.
     * An ordered sequence of RESP values, possibly nested.
     */
    ARRAY('*'),

    /**
     * Null, written as {@code $-1\r\n} (or {@code *-1\r\n} for arrays).
     */
    NULL('$');

    private final byte prefix;

    RESPType(char prefix) {
        this.prefix = (byte) prefix;
    }

    /**
     * Returns the wire format prefix byte for this type.
     *
     * @return the prefix byte
     */
    public byte getPrefix() {
        return prefix;
    }

    /**
     * Returns the RESP type introduced by the given prefix byte.
     *
     * <p>The {@code '$'} prefix always yields {@link #BULK_STRING}; the
     * decoder turns it into {@link #NULL} once it has read the length.
     *
     * @param prefix the prefix byte
     * @return the corresponding RESP type
     * @throws RESPException if the prefix is not one of the RESP prefixes
     */
    public static RESPType fromPrefix(byte prefix) throws RESPException {
        switch (prefix) {
            case '+':
                return SIMPLE_STRING;
            case '-':
                return ERROR;
            case ':':
                return INTEGER;
            case '$':
                return BULK_STRING;
            case '*':
                return ARRAY;
            default:
                String printable = (prefix >= 0x20 && prefix < 0x7f)
                        ? String.valueOf((char) prefix)
                        : String.format("0x%02x", prefix & 0xff);
                String msg = MessageFormat.format(RESPDecoder.L10N.getString("err.unknown_type"), printable);
                throw new RESPException(msg);
        }
    }

}
