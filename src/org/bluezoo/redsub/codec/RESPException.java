/*
 * RESPException.java
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

import java.nio.charset.CharacterCodingException;

/**
 * Exception thrown when RESP data cannot be decoded.
 *
 * <p>The decoder disposes of the offending bytes before throwing this
 * exception, so the caller may report it and carry on decoding.
 * Text that is not valid UTF-8 is reported with a
 * {@link CharacterCodingException} as the cause.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new RESP exception with the specified message.
     *
     * @param message the error message
     */
    public RESPException(String message) {
        super(message);
    }

    /**
     * Creates a new RESP exception with the specified message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public RESPException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns whether this exception reports invalid UTF-8 text rather
     * than a structural protocol violation.
     *
     * @return true if the cause is a character coding failure
     */
    public boolean isEncodingError() {
        return getCause() instanceof CharacterCodingException;
    }

}
