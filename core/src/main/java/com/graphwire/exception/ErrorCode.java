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

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for GraphWire exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Configuration errors</li>
 *   <li>2xxx - Transport errors (HTTP status, IO, wire format)</li>
 *   <li>3xxx - Endpoint errors (reported by the server)</li>
 *   <li>4xxx - Transaction lifecycle errors</li>
 *   <li>5xxx - Type coercion errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see GraphWireException
 */
public enum ErrorCode {

  // ========== Configuration Errors (1xxx) ==========
  /** Invalid or inconsistent client setting */
  CONFIGURATION_ERROR(1001, "Configuration error"),

  /** The server URL or a URL returned by the server cannot be parsed */
  INVALID_ENDPOINT_URL(1002, "Invalid endpoint URL"),

  // ========== Transport Errors (2xxx) ==========
  /** IO failure while sending the request or reading the response */
  TRANSPORT_ERROR(2001, "Transport error"),

  /** The server answered with a status code different from the one expected by the operation */
  UNEXPECTED_HTTP_STATUS(2002, "Unexpected HTTP status"),

  /** The response body does not follow the transactional endpoint format */
  PROTOCOL_ERROR(2003, "Protocol error"),

  /** The calling thread was interrupted while waiting for the response */
  REQUEST_INTERRUPTED(2004, "Request interrupted"),

  // ========== Endpoint Errors (3xxx) ==========
  /** The server reported one or more errors for the submitted statements */
  ENDPOINT_ERROR(3001, "Endpoint error"),

  // ========== Transaction Errors (4xxx) ==========
  /** Operation not allowed in the current state of the transaction */
  TRANSACTION_INVALID_STATE(4001, "Invalid transaction state"),

  /** The transaction expired on the server or its expiry time is past */
  TRANSACTION_EXPIRED(4002, "Transaction expired"),

  // ========== Coercion Errors (5xxx) ==========
  /** A cell value cannot be converted to the requested type */
  TYPE_COERCION(5001, "Type coercion error"),

  /** The requested column is not part of the result */
  UNKNOWN_COLUMN(5002, "Unknown column"),

  /** The requested column index is outside the row */
  COLUMN_INDEX_OUT_OF_RANGE(5003, "Column index out of range"),

  // ========== General Errors (99xxx) ==========
  /** Error without a more specific code */
  UNKNOWN_ERROR(99998, "Unknown error"),

  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  /**
   * Returns the numeric error code.
   *
   * @return the error code (e.g., 1001, 2001, etc.)
   */
  public int getCode() {
    return code;
  }

  /**
   * Returns the default human-readable error message.
   * This can be overridden when throwing exceptions with custom messages.
   *
   * @return the default error message
   */
  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public ErrorCategory getCategory() {
    return switch (code / 1000) {
      case 1 -> ErrorCategory.CONFIGURATION;
      case 2 -> ErrorCategory.TRANSPORT;
      case 3 -> ErrorCategory.ENDPOINT;
      case 4 -> ErrorCategory.TRANSACTION;
      case 5 -> ErrorCategory.COERCION;
      default -> ErrorCategory.INTERNAL;
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @param code the numeric error code to look up
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
