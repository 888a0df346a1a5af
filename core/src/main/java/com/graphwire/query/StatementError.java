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
package com.graphwire.query;

/**
 * Error reported by the server for a submitted statement. Codes follow the scheme
 * {@code Neo.<classification>.<category>.<title>}, for example {@code Neo.ClientError.Statement.SyntaxError}.
 *
 * @param code    status code as returned by the server
 * @param message human-readable description
 */
public record StatementError(String code, String message) {
  private static final String NOT_FOUND        = "Neo.ClientError.Transaction.TransactionNotFound";
  private static final String UNKNOWN_ID       = "Neo.ClientError.Transaction.UnknownId";
  private static final String NOT_FOUND_SUFFIX = "Transaction.TransactionNotFound";

  public StatementError {
    code = code != null ? code : "";
    message = message != null ? message : "";
  }

  /**
   * Returns true if the error says the transaction does not exist anymore on the server, because it expired or was already
   * terminated.
   */
  public boolean isTransactionNotFound() {
    return code.equals(NOT_FOUND) || code.equals(UNKNOWN_ID) || code.endsWith(NOT_FOUND_SUFFIX);
  }

  /**
   * @return the classification part of the code (ClientError, ClientNotification, TransientError, DatabaseError), or null if
   * the code does not follow the standard scheme
   */
  public String getClassification() {
    return part(1);
  }

  public String getCategory() {
    return part(2);
  }

  public String getTitle() {
    return part(3);
  }

  public boolean isClientError() {
    return "ClientError".equals(getClassification());
  }

  private String part(final int index) {
    final String[] parts = code.split("\\.");
    return parts.length == 4 ? parts[index] : null;
  }

  @Override
  public String toString() {
    return code + ": " + message;
  }
}
