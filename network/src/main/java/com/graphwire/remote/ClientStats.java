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

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the operations executed by a {@link GraphClient} and its transactions.
 */
public class ClientStats {
  public final AtomicLong autocommitBatches      = new AtomicLong();
  public final AtomicLong statementsSent         = new AtomicLong();
  public final AtomicLong transactionsBegun      = new AtomicLong();
  public final AtomicLong transactionsCommitted  = new AtomicLong();
  public final AtomicLong transactionsRolledBack = new AtomicLong();
  public final AtomicLong transactionsExpired    = new AtomicLong();
  public final AtomicLong endpointErrors         = new AtomicLong();

  public Map<String, Object> toMap() {
    final Map<String, Object> map = new TreeMap<>();
    map.put("autocommitBatches", autocommitBatches.get());
    map.put("statementsSent", statementsSent.get());
    map.put("transactionsBegun", transactionsBegun.get());
    map.put("transactionsCommitted", transactionsCommitted.get());
    map.put("transactionsRolledBack", transactionsRolledBack.get());
    map.put("transactionsExpired", transactionsExpired.get());
    map.put("endpointErrors", endpointErrors.get());
    return map;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}
