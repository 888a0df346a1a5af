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
import com.graphwire.query.Statement;
import com.graphwire.utility.RWLockContext;

import java.time.Instant;
import java.util.List;

/**
 * Thread safe view of a {@link Transaction}: operations run one at a time under an exclusive lock, accessors under the shared
 * lock. The transaction must not be used directly while views are in use.
 */
public class LockedTransaction extends RWLockContext {
  private final Transaction transaction;

  LockedTransaction(final Transaction transaction) {
    this.transaction = transaction;
  }

  public void addStatement(final Statement statement) {
    executeInWriteLock(() -> {
      transaction.addStatement(statement);
      return null;
    });
  }

  public BatchResult execute(final List<Statement> statements) {
    return executeInWriteLock(() -> transaction.execute(statements));
  }

  public BatchResult execute() {
    return executeInWriteLock(() -> transaction.execute());
  }

  public void resetTimeout() {
    executeInWriteLock(() -> {
      transaction.resetTimeout();
      return null;
    });
  }

  public BatchResult commit(final List<Statement> statements) {
    return executeInWriteLock(() -> transaction.commit(statements));
  }

  public BatchResult commit() {
    return executeInWriteLock(() -> transaction.commit());
  }

  public void rollback() {
    executeInWriteLock(() -> {
      transaction.rollback();
      return null;
    });
  }

  public TransactionState getState() {
    return executeInReadLock(transaction::getState);
  }

  public Instant getExpiresAt() {
    return executeInReadLock(transaction::getExpiresAt);
  }

  public String getId() {
    return transaction.getId();
  }

  /**
   * @return the wrapped transaction
   */
  public Transaction unwrap() {
    return transaction;
  }
}
