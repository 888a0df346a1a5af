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

import com.graphwire.query.StatementError;

import java.util.List;

/**
 * Exception thrown when the server reports errors for the submitted statements. The errors are carried in the order the server
 * returned them.
 */
public class EndpointException extends GraphWireException {
  private final List<StatementError> errors;

  public EndpointException(final List<StatementError> errors) {
    super(ErrorCode.ENDPOINT_ERROR, buildMessage(errors));
    this.errors = errors != null ? List.copyOf(errors) : List.of();
    if (!this.errors.isEmpty())
      addContext("code", this.errors.get(0).code());
  }

  public List<StatementError> getErrors() {
    return errors;
  }

  /**
   * Returns the first error reported by the server, or null if the list is empty.
   */
  public StatementError getFirstError() {
    return errors.isEmpty() ? null : errors.get(0);
  }

  private static String buildMessage(final List<StatementError> errors) {
    if (errors == null || errors.isEmpty())
      return "The server reported an error";
    if (errors.size() == 1)
      return errors.get(0).toString();
    return errors.get(0) + " (and " + (errors.size() - 1) + " more errors)";
  }
}
