/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.graphwire.exception;

/**
 * Exception thrown when a value read from a result row cannot be converted to the requested type, or when the requested column
 * does not exist.
 * <p>
 * Example usage:
 * <pre>{@code
 * throw new TypeCoercionException(ErrorCode.UNKNOWN_COLUMN, "Column 'age' not found")
 *     .addContext("columns", columns);
 * }</pre>
 */
public class TypeCoercionException extends GraphWireException {
  public TypeCoercionException(final String message) {
    super(ErrorCode.TYPE_COERCION, message);
  }

  public TypeCoercionException(final String message, final Throwable cause) {
    super(ErrorCode.TYPE_COERCION, message, cause);
  }

  public TypeCoercionException(final ErrorCode errorCode, final String message) {
    super(errorCode, message);
  }

  @Override
  public TypeCoercionException addContext(final String key, final Object value) {
    super.addContext(key, value);
    return this;
  }
}
