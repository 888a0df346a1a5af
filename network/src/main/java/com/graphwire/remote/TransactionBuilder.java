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

import com.graphwire.query.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the statements to send with the request that opens a transaction.
 *
 * <pre>{@code
 * TransactionStart start = client.transaction()
 *     .withStatement(Statement.of("CREATE (n:Person {name: 'Alice'})"))
 *     .begin();
 * Transaction tx = start.transaction();
 * }</pre>
 */
public class TransactionBuilder {
  private final GraphClient     client;
  private final List<Statement> statements = new ArrayList<>();

  TransactionBuilder(final GraphClient client) {
    this.client = client;
  }

  public TransactionBuilder withStatement(final Statement statement) {
    addStatement(statement);
    return this;
  }

  public TransactionBuilder withStatement(final String statement) {
    return withStatement(Statement.of(statement));
  }

  public void addStatement(final Statement statement) {
    if (statement == null)
      throw new IllegalArgumentException("Statement is null");
    statements.add(statement);
  }

  public List<Statement> getStatements() {
    return List.copyOf(statements);
  }

  /**
   * Opens the transaction.
   *
   * @see GraphClient#beginTransaction(List)
   */
  public TransactionStart begin() {
    return client.beginTransaction(statements);
  }
}
