/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.imgconv;

import java.io.EOFException;

/**
 * Signals that a row stream ended before delivering the number of rows its
 * {@link RowSource#size() size} declares.
 */
public class UnexpectedEndOfStreamException extends EOFException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception with a detail message.
     *
     * @param message the detail message
     */
    public UnexpectedEndOfStreamException(String message) {
        super(message);
    }

    /**
     * Creates the exception for a stream that delivered {@code rows} out of {@code height} rows.
     *
     * @param rows rows delivered
     * @param height rows declared
     * @return the exception
     */
    public static UnexpectedEndOfStreamException truncated(int rows, int height) {
        return new UnexpectedEndOfStreamException("Stream ended after " + rows + " of " + height + " rows");
    }
}
