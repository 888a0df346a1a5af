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
package com.graphwire.remote;

import com.graphwire.query.BatchResult;
import com.graphwire.query.ResultTable;
import com.graphwire.query.StatementError;

import java.time.Instant;
import java.util.List;

/**
 * Decoded answer of the transactional endpoint.
 *
 * @param results   one table per submitted statement
 * @param errors    errors reported by the server
 * @param commitUrl URL to commit the transaction, null for autocommit answers
 * @param expiresAt server expiry of the transaction, null if absent or unparsable
 */
public record TransactionalResponse(List<ResultTable> results, List<StatementError> errors, String commitUrl,
                                    Instant expiresAt) {
  public TransactionalResponse {
    results = List.copyOf(results);
    errors = List.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /**
   * @return true if the server says the transaction does not exist anymore
   */
  public boolean isTransactionNotFound() {
    for (StatementError e : errors)
      if (e.isTransactionNotFound())
        return true;
    return false;
  }

  public BatchResult toBatchResult() {
    return new BatchResult(results, errors);
  }
}
