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

import com.graphwire.exception.EndpointException;

import java.util.List;

/**
 * Outcome of a batch of statements: exactly one {@link ResultTable} per submitted statement, in submission order, plus the
 * errors reported by the server. Statements following the first failing one have an empty table.
 */
public class BatchResult {
  private final List<ResultTable>    results;
  private final List<StatementError> errors;

  public BatchResult(final List<ResultTable> results, final List<StatementError> errors) {
    this.results = List.copyOf(results);
    this.errors = List.copyOf(errors);
  }

  public List<ResultTable> getResults() {
    return results;
  }

  public ResultTable getResult(final int index) {
    if (index < 0 || index >= results.size())
      throw new IndexOutOfBoundsException("Result " + index + " out of range, the batch has " + results.size() + " statements");
    return results.get(index);
  }

  public int size() {
    return results.size();
  }

  public List<StatementError> getErrors() {
    return errors;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /**
   * Throws an {@link EndpointException} if the server reported errors, otherwise returns this batch.
   */
  public BatchResult checkErrors() {
    if (!errors.isEmpty())
      throw new EndpointException(errors);
    return this;
  }

  @Override
  public String toString() {
    return "BatchResult{results=" + results + ", errors=" + errors + "}";
  }
}
