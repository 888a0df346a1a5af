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
import com.graphwire.remote.TransactionState;

/**
 * Exception thrown when an operation is invoked on a transaction that is not open anymore. No request is sent to the server.
 */
public class InvalidTransactionStateException extends GraphWireException {
  private final TransactionState state;

  public InvalidTransactionStateException(final String message, final TransactionState state) {
    this(ErrorCode.TRANSACTION_INVALID_STATE, message, state);
  }

  protected InvalidTransactionStateException(final ErrorCode errorCode, final String message, final TransactionState state) {
    super(errorCode, message);
    this.state = state;
    addContext("state", state);
  }

  /**
   * @return the state of the transaction when the operation was refused
   */
  public TransactionState getState() {
    return state;
  }
}
