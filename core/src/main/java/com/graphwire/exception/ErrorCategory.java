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
 * Categories for organizing error codes in the GraphWire exception hierarchy.
 * <p>
 * Each {@link ErrorCode} belongs to exactly one category, derived from its numeric range:
 * <ul>
 *   <li>{@link #CONFIGURATION} - Client settings and endpoint URLs (1xxx)</li>
 *   <li>{@link #TRANSPORT} - HTTP exchange and wire format (2xxx)</li>
 *   <li>{@link #ENDPOINT} - Errors reported by the server for the submitted statements (3xxx)</li>
 *   <li>{@link #TRANSACTION} - Client-side transaction lifecycle (4xxx)</li>
 *   <li>{@link #COERCION} - Extraction of typed values from result rows (5xxx)</li>
 *   <li>{@link #INTERNAL} - Internal errors and unexpected conditions (99xxx)</li>
 * </ul>
 *
 * @see ErrorCode
 * @see GraphWireException
 */
public enum ErrorCategory {
  CONFIGURATION("Configuration"),
  TRANSPORT("Transport"),
  ENDPOINT("Endpoint"),
  TRANSACTION("Transaction"),
  COERCION("Coercion"),
  INTERNAL("Internal");

  private final String displayName;

  ErrorCategory(final String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the human-readable display name for this category, used in error messages and JSON representations.
   */
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
