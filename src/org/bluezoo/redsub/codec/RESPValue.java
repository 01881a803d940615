/*
 * RESPValue.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A decoded RESP value.
 *
 * <p>Values are immutable. Text is held as Java strings: the decoder
 * has already checked that it was valid UTF-8. Arrays may nest to any
 * depth. Two values are equal when they have the same type and equal
 * content, which makes decoded values easy to compare in tests.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RESPValue {

    private static final RESPValue NULL = new RESPValue(RESPType.NULL, null);

    private final RESPType type;
    private final Object value;

    private RESPValue(RESPType type, Object value) {
        this.type = type;
        this.value = value;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Factory methods
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns the null value singleton.
     *
     * @return the null RESP value
     */
    public static RESPValue nullValue() {
        return NULL;
    }

    /**
     * Creates a simple string value.
     *
     * @param value the string value
     * @return the RESP value
     */
    public static RESPValue simpleString(String value) {
        return new RESPValue(RESPType.SIMPLE_STRING, requireText(value));
    }

    /**
     * Creates an error value.
     *
     * @param message the error message
     * @return the RESP value
     */
    public static RESPValue error(String message) {
        return new RESPValue(RESPType.ERROR, requireText(message));
    }

    /**
     * Creates an integer value.
     *
     * @param value the integer value
     * @return the RESP value
     */
    public static RESPValue integer(long value) {
        return new RESPValue(RESPType.INTEGER, Long.valueOf(value));
    }

    /**
     * Creates a bulk string value.
     *
     * @param value the text, which may be empty but not null
     * @return the RESP value
     */
    public static RESPValue bulkString(String value) {
        return new RESPValue(RESPType.BULK_STRING, requireText(value));
    }

    /**
     * Creates an array value. The elements are copied.
     *
     * @param elements the array elements
     * @return the RESP value
     */
    public static RESPValue array(List<RESPValue> elements) {
        List<RESPValue> copy = new ArrayList<RESPValue>(elements);
        return new RESPValue(RESPType.ARRAY, Collections.unmodifiableList(copy));
    }

    /**
     * Creates an array value from the given elements.
     *
     * @param elements the array elements
     * @return the RESP value
     */
    public static RESPValue array(RESPValue... elements) {
        List<RESPValue> list = new ArrayList<RESPValue>(elements.length);
        Collections.addAll(list, elements);
        return new RESPValue(RESPType.ARRAY, Collections.unmodifiableList(list));
    }

    private static String requireText(String text) {
        if (text == null) {
            throw new NullPointerException("text");
        }
        return text;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Type checking
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns the RESP type of this value.
     *
     * @return the type, never null
     */
    public RESPType getType() {
        return type;
    }

    public boolean isNull() {
        return type == RESPType.NULL;
    }

    public boolean isSimpleString() {
        return type == RESPType.SIMPLE_STRING;
    }

    public boolean isError() {
        return type == RESPType.ERROR;
    }

    public boolean isInteger() {
        return type == RESPType.INTEGER;
    }

    public boolean isBulkString() {
        return type == RESPType.BULK_STRING;
    }

    public boolean isArray() {
        return type == RESPType.ARRAY;
    }

    /**
     * Returns whether this value carries text a server would use for a
     * name or payload, i.e. it is a bulk string or a simple string.
     *
     * @return true if bulk or simple string
     */
    public boolean isText() {
        return type == RESPType.BULK_STRING || type == RESPType.SIMPLE_STRING;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Value access
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Returns this value as a string.
     *
     * <p>Simple strings, errors and bulk strings return their text.
     * Integers return their decimal representation.
     * Arrays and null return null.
     *
     * @return the string value, or null
     */
    public String asString() {
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
            case BULK_STRING:
                return (String) value;
            case INTEGER:
                return value.toString();
            default:
                return null;
        }
    }

    /**
     * Returns this value as a long integer.
     *
     * @return the integer value
     * @throws IllegalStateException if this is not an integer
     */
    public long asLong() {
        if (type != RESPType.INTEGER) {
            throw new IllegalStateException("Not an integer value: " + this);
        }
        return ((Long) value).longValue();
    }

    /**
     * Returns the elements of this array.
     *
     * @return an unmodifiable list of elements, or null if not an array
     */
    @SuppressWarnings("unchecked")
    public List<RESPValue> asArray() {
        if (type != RESPType.ARRAY) {
            return null;
        }
        return (List<RESPValue>) value;
    }

    /**
     * Returns the error message if this is an error value.
     *
     * @return the error message, or null if not an error
     */
    public String getErrorMessage() {
        if (type != RESPType.ERROR) {
            return null;
        }
        return (String) value;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Object methods
    // ─────────────────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RESPValue)) {
            return false;
        }
        RESPValue o = (RESPValue) other;
        if (type != o.type) {
            return false;
        }
        return (value == null) ? o.value == null : value.equals(o.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + ((value == null) ? 0 : value.hashCode());
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE_STRING:
                return "+" + value;
            case ERROR:
                return "-" + value;
            case INTEGER:
                return ":" + value;
            case BULK_STRING:
                return "$\"" + value + "\"";
            case ARRAY:
                return value.toString();
            default:
                return "null";
        }
    }

}
