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

import com.graphwire.ContextConfiguration;
import com.graphwire.GlobalConfiguration;
import com.graphwire.exception.EndpointException;
import com.graphwire.exception.ErrorCode;
import com.graphwire.log.LogManager;
import com.graphwire.network.exception.ExpiredTransactionException;
import com.graphwire.network.exception.InvalidTransactionStateException;
import com.graphwire.network.exception.TransportException;
import com.graphwire.query.BatchResult;
import com.graphwire.query.Statement;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

/**
 * Explicit transaction opened on the transactional endpoint. The transaction mirrors the state kept by the server: it starts
 * {@link TransactionState#OPEN} and ends committed, rolled back or expired. Once in a terminal state every operation fails
 * immediately without contacting the server.
 * <p>
 * Statements can be sent right away with {@link #execute(List)}, or queued with {@link #addStatement(Statement)} and sent with the
 * next {@link #execute()} or {@link #commit()}. Errors reported by the server for the statements are returned in the
 * {@link BatchResult} and leave the transaction open, except when they say the transaction does not exist anymore: in that case
 * the transaction becomes {@link TransactionState#EXPIRED} and an {@link ExpiredTransactionException} is thrown.
 * <p>
 * This class is not thread safe. Use {@link #synchronizedView()} to share a transaction among threads.
 */
public class Transaction {
  static final int BEGIN_STATUS   = 201;
  static final int SUCCESS_STATUS = 200;

  private final Transport       transport;
  private final Clock           clock;
  private final ClientStats     stats;
  private final boolean         clientExpiryCheck;
  private final long            expiryGraceMs;
  private final String          id;
  private final String          transactionUrl;
  private final String          commitUrl;
  private final List<Statement> pending = new ArrayList<>();
  private       Instant         expiresAt;
  private       TransactionState state  = TransactionState.OPEN;

  Transaction(final Transport transport, final String transactionUrl, final String commitUrl, final Instant expiresAt,
      final ContextConfiguration configuration, final Clock clock, final ClientStats stats) {
    this.transport = transport;
    this.transactionUrl = transactionUrl;
    this.commitUrl = commitUrl;
    this.expiresAt = expiresAt;
    this.clock = clock;
    this.stats = stats;
    this.clientExpiryCheck = configuration.getValueAsBoolean(GlobalConfiguration.TX_CLIENT_EXPIRY_CHECK);
    this.expiryGraceMs = configuration.getValueAsLong(GlobalConfiguration.TX_EXPIRY_GRACE);
    this.id = lastSegment(transactionUrl);
  }

  /**
   * Opens a transaction on the server, sending the first statements with the same request.
   *
   * @throws EndpointException  if the server reported errors: no transaction is created
   * @throws TransportException if the request failed or the answer is not valid
   */
  static TransactionStart begin(final Transport transport, final String endpoint, final List<Statement> statements,
      final ContextConfiguration configuration, final Clock clock, final ClientStats stats) {
    final TransportResponse response = transport.send("POST", endpoint, RequestCodec.encode(statements));
    stats.statementsSent.addAndGet(statements.size());

    if (response.statusCode() != BEGIN_STATUS)
      throw unexpectedStatus("begin transaction", endpoint, response);

    final TransactionalResponse decoded = RequestCodec.decode(response.body(), statements.size());
    if (decoded.hasErrors()) {
      stats.endpointErrors.incrementAndGet();
      throw new EndpointException(decoded.errors());
    }

    final String commitUrl = decoded.commitUrl();
    if (commitUrl == null)
      throw new TransportException(ErrorCode.PROTOCOL_ERROR, "The server did not return the commit URL of the new transaction",
          response.statusCode(), response.body());

    final String transactionUrl = response.location() != null ? response.location() : stripCommit(commitUrl);

    final Transaction transaction = new Transaction(transport, transactionUrl, commitUrl, decoded.expiresAt(), configuration,
        clock, stats);
    stats.transactionsBegun.incrementAndGet();

    LogManager.instance().log(transaction, Level.FINE, "Transaction %s opened (url=%s expires=%s)", transaction.id, transactionUrl,
        decoded.expiresAt());

    return new TransactionStart(transaction, decoded.toBatchResult());
  }

  public void addStatement(final Statement statement) {
    if (statement == null)
      throw new IllegalArgumentException("Statement is null");
    checkOpen("add statement", false);
    pending.add(statement);
  }

  public void addStatement(final String statement) {
    addStatement(Statement.of(statement));
  }

  /**
   * @return the statements queued for the next request
   */
  public List<Statement> getPendingStatements() {
    return List.copyOf(pending);
  }

  /**
   * Sends the queued statements.
   */
  public BatchResult execute() {
    return execute(List.of());
  }

  public BatchResult execute(final Statement... statements) {
    return execute(List.of(statements));
  }

  /**
   * Sends the queued statements followed by the given ones. The transaction stays open.
   *
   * @return one result per statement, plus the errors reported by the server
   *
   * @throws ExpiredTransactionException      if the transaction expired
   * @throws InvalidTransactionStateException if the transaction was already committed or rolled back
   * @throws TransportException               if the request failed
   */
  public BatchResult execute(final List<Statement> statements) {
    checkOpen("execute", true);
    final TransactionalResponse response = send(transactionUrl, withPending(statements), true, "execute");
    return response.toBatchResult();
  }

  /**
   * Sends an empty request to keep the transaction alive. The queued statements are not sent.
   */
  public void resetTimeout() {
    checkOpen("reset timeout", true);
    send(transactionUrl, List.of(), false, "reset timeout");
  }

  public BatchResult commit() {
    return commit(List.of());
  }

  public BatchResult commit(final Statement... statements) {
    return commit(List.of(statements));
  }

  /**
   * Sends the queued statements followed by the given ones and commits. The transaction is committed also when the server reports
   * errors for the last statements: the errors are returned in the result.
   *
   * @throws ExpiredTransactionException      if the transaction expired
   * @throws InvalidTransactionStateException if the transaction was already committed or rolled back
   * @throws TransportException               if the request failed, the transaction stays open
   */
  public BatchResult commit(final List<Statement> statements) {
    checkOpen("commit", true);
    final TransactionalResponse response = send(commitUrl, withPending(statements), true, "commit");

    state = TransactionState.COMMITTED;
    stats.transactionsCommitted.incrementAndGet();
    LogManager.instance().log(this, Level.FINE, "Transaction %s committed", id);

    return response.toBatchResult();
  }

  /**
   * Rolls back the transaction. If the server does not know the transaction anymore, because it expired or was already
   * terminated, the transaction is considered rolled back.
   *
   * @throws InvalidTransactionStateException if the transaction was already committed or rolled back
   * @throws TransportException               if the request failed, the transaction stays open
   * @throws EndpointException                if the server reported other errors, the transaction is rolled back anyway
   */
  public void rollback() {
    checkOpen("rollback", false);

    final TransportResponse response = transport.send("DELETE", transactionUrl, null);

    final TransactionalResponse decoded;
    if (response.statusCode() == SUCCESS_STATUS)
      decoded = response.body().isBlank() ? null : RequestCodec.decode(response.body(), 0);
    else {
      decoded = decodeQuietly(response);
      if (decoded == null || !decoded.isTransactionNotFound())
        throw unexpectedStatus("rollback", transactionUrl, response);
    }

    state = TransactionState.ROLLED_BACK;
    stats.transactionsRolledBack.incrementAndGet();

    if (decoded != null && decoded.isTransactionNotFound()) {
      LogManager.instance().log(this, Level.WARNING, "Transaction %s was already terminated on the server, considered rolled back",
          id);
      return;
    }

    LogManager.instance().log(this, Level.FINE, "Transaction %s rolled back", id);

    if (decoded != null && decoded.hasErrors()) {
      stats.endpointErrors.incrementAndGet();
      throw new EndpointException(decoded.errors());
    }
  }

  /**
   * Returns a view of this transaction that serializes every operation with an exclusive lock.
   */
  public LockedTransaction synchronizedView() {
    return new LockedTransaction(this);
  }

  public String getId() {
    return id;
  }

  public String getTransactionUrl() {
    return transactionUrl;
  }

  public String getCommitUrl() {
    return commitUrl;
  }

  /**
   * @return expiry time announced by the server with the last answer, or null if unknown
   */
  public Instant getExpiresAt() {
    return expiresAt;
  }

  public TransactionState getState() {
    return state;
  }

  public boolean isOpen() {
    return state == TransactionState.OPEN;
  }

  /**
   * @return true if the transaction expired, or if its expiry time is past according to the clock of this transaction
   */
  public boolean isExpired() {
    return state == TransactionState.EXPIRED || (state == TransactionState.OPEN && isPastExpiry());
  }

  private TransactionalResponse send(final String url, final List<Statement> statements, final boolean clearPending,
      final String operation) {
    final TransportResponse response = transport.send("POST", url, RequestCodec.encode(statements));
    stats.statementsSent.addAndGet(statements.size());

    final TransactionalResponse decoded;
    if (response.statusCode() == SUCCESS_STATUS)
      decoded = RequestCodec.decode(response.body(), statements.size());
    else {
      decoded = decodeQuietly(response);
      if (decoded == null || !decoded.isTransactionNotFound())
        throw unexpectedStatus(operation, url, response);
    }

    if (clearPending)
      pending.clear();

    if (decoded.isTransactionNotFound()) {
      markExpired();
      LogManager.instance().log(this, Level.WARNING, "Transaction %s expired on the server (operation=%s)", id, operation);
      throw new ExpiredTransactionException("Transaction " + id + " does not exist anymore on the server: " + decoded.errors());
    }

    if (decoded.expiresAt() != null)
      expiresAt = decoded.expiresAt();

    if (decoded.hasErrors())
      stats.endpointErrors.incrementAndGet();

    return decoded;
  }

  private List<Statement> withPending(final List<Statement> statements) {
    final List<Statement> all = new ArrayList<>(pending.size() + statements.size());
    all.addAll(pending);
    all.addAll(statements);
    return all;
  }

  private void checkOpen(final String operation, final boolean checkClock) {
    if (state == TransactionState.EXPIRED)
      throw new ExpiredTransactionException("Cannot " + operation + ": transaction " + id + " expired");
    if (state.isTerminal())
      throw new InvalidTransactionStateException("Cannot " + operation + ": transaction " + id + " is " + state, state);

    if (checkClock && clientExpiryCheck && isPastExpiry()) {
      markExpired();
      LogManager.instance().log(this, Level.FINE, "Transaction %s expired at %s, %s not sent", id, expiresAt, operation);
      throw new ExpiredTransactionException("Cannot " + operation + ": transaction " + id + " expired at " + expiresAt);
    }
  }

  private boolean isPastExpiry() {
    return expiresAt != null && clock.instant().isAfter(expiresAt.plusMillis(expiryGraceMs));
  }

  private void markExpired() {
    state = TransactionState.EXPIRED;
    stats.transactionsExpired.incrementAndGet();
  }

  /**
   * Decodes the body of an error answer, returning null if it does not follow the endpoint format.
   */
  private static TransactionalResponse decodeQuietly(final TransportResponse response) {
    try {
      return RequestCodec.decode(response.body(), 0);
    } catch (final TransportException e) {
      LogManager.instance().log(Transaction.class, Level.FINE, "Body of HTTP %d answer is not a transactional response: %s", e,
          response.statusCode(), e.getMessage());
      return null;
    }
  }

  static TransportException unexpectedStatus(final String operation, final String url, final TransportResponse response) {
    return new TransportException(ErrorCode.UNEXPECTED_HTTP_STATUS,
        "Error on " + operation + " (httpErrorCode=" + response.statusCode() + " url=" + url + ")", response.statusCode(),
        response.body()).addContext("url", url);
  }

  private static String stripCommit(final String commitUrl) {
    return commitUrl.endsWith("/commit") ? commitUrl.substring(0, commitUrl.length() - "/commit".length()) : commitUrl;
  }

  private static String lastSegment(final String url) {
    String u = url;
    while (u.endsWith("/"))
      u = u.substring(0, u.length() - 1);
    final int slash = u.lastIndexOf('/');
    return slash > -1 ? u.substring(slash + 1) : u;
  }

  @Override
  public String toString() {
    return "Transaction{id=" + id + ", state=" + state + ", expiresAt=" + expiresAt + "}";
  }
}
