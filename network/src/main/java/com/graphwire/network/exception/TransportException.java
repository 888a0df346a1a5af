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
package com.graphwire.network.exception;

import com.graphwire.exception.ErrorCode;
import com.graphwire.exception.GraphWireException;

/**
 * Exception thrown when the HTTP exchange with the server fails: IO errors, interrupted requests, HTTP status codes different
 * from the one expected by the operation and response bodies that do not follow the transactional endpoint format.
 * <p>
 * Example usage:
 * <pre>{@code
 * throw new TransportException(ErrorCode.UNEXPECTED_HTTP_STATUS, "Unexpected status on commit", 503, body)
 *     .addContext("url", commitUrl);
 * }</pre>
 *
 * @see ErrorCode#TRANSPORT_ERROR
 * @see ErrorCode#UNEXPECTED_HTTP_STATUS
 * @see ErrorCode#PROTOCOL_ERROR
 * @see ErrorCode#REQUEST_INTERRUPTED
 */
public class TransportException extends GraphWireException {
  private final int    statusCode;
  private final String body;

  public TransportException(final ErrorCode errorCode, final String message) {
    this(errorCode, message, -1, null, null);
  }

  public TransportException(final ErrorCode errorCode, final String message, final Throwable cause) {
    this(errorCode, message, -1, null, cause);
  }

  public TransportException(final ErrorCode errorCode, final String message, final int statusCode, final String body) {
    this(errorCode, message, statusCode, body, null);
  }

  public TransportException(final ErrorCode errorCode, final String message, final int statusCode, final String body,
      final Throwable cause) {
    super(errorCode, message, cause);
    this.statusCode = statusCode;
    this.body = body;
    if (statusCode > -1)
      addContext("httpStatus", statusCode);
  }

  /**
   * @return the HTTP status code returned by the server, or -1 if no response was received
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * @return the response body, or null if no response was received
   */
  public String getBody() {
    return body;
  }

  @Override
  public TransportException addContext(final String key, final Object value) {
    super.addContext(key, value);
    return this;
  }
}
