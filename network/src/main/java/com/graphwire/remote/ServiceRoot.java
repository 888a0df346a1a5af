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

import com.graphwire.exception.EndpointException;
import com.graphwire.exception.ErrorCode;
import com.graphwire.network.exception.TransportException;
import com.graphwire.query.StatementError;
import com.graphwire.serializer.json.JSONArray;
import com.graphwire.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service root document returned by the server at the base URL. It advertises the transactional endpoint, whose URL can contain
 * the {@code {databaseName}} placeholder, and the server version and edition.
 */
public class ServiceRoot {
  public static final String DATABASE_PLACEHOLDER = "{databaseName}";

  private final String              transaction;
  private final String              version;
  private final String              edition;
  private final Map<String, Object> entries;

  public ServiceRoot(final String transaction, final String version, final String edition, final Map<String, Object> entries) {
    this.transaction = transaction;
    this.version = version;
    this.edition = edition;
    this.entries = Map.copyOf(entries);
  }

  /**
   * Parses the service root document.
   *
   * @throws EndpointException  if the document carries errors
   * @throws TransportException if the document is not valid or misses the transaction entry
   */
  public static ServiceRoot parse(final String body) {
    final JSONObject json = RequestCodec.parse(body);

    final JSONArray errors = json.optJSONArray("errors");
    if (errors != null && !errors.isEmpty()) {
      final List<StatementError> list = new ArrayList<>(errors.length());
      for (int i = 0; i < errors.length(); i++) {
        final Object e = errors.get(i);
        if (e instanceof JSONObject error)
          list.add(new StatementError(error.optString("code", null), error.optString("message", null)));
      }
      throw new EndpointException(list);
    }

    final String transaction = json.optString("transaction", null);
    if (transaction == null)
      throw new TransportException(ErrorCode.PROTOCOL_ERROR, "The service root does not advertise the transactional endpoint", -1,
          body);

    final Map<String, Object> entries = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : json.toMap().entrySet())
      if (entry.getValue() != null)
        entries.put(entry.getKey(), entry.getValue());

    return new ServiceRoot(transaction, json.optString("neo4j_version", null), json.optString("neo4j_edition", null), entries);
  }

  /**
   * @return the transactional endpoint template as advertised by the server
   */
  public String getTransaction() {
    return transaction;
  }

  /**
   * Returns the transactional endpoint for a database, replacing the {@value #DATABASE_PLACEHOLDER} placeholder.
   */
  public String getTransactionEndpoint(final String database) {
    return transaction.replace(DATABASE_PLACEHOLDER, database);
  }

  /**
   * @return the server version (for example {@code 4.4.12}), or null if not advertised
   */
  public String getVersion() {
    return version;
  }

  /**
   * @return the major number of the server version, or -1 if the version is unknown
   */
  public int getMajorVersion() {
    if (version == null)
      return -1;

    int end = 0;
    while (end < version.length() && Character.isDigit(version.charAt(end)))
      ++end;

    // MORE THAN 9 DIGITS MAY NOT FIT IN AN INT
    return end > 0 && end <= 9 ? Integer.parseInt(version.substring(0, end)) : -1;
  }

  /**
   * @return the server edition (community or enterprise), or null if not advertised
   */
  public String getEdition() {
    return edition;
  }

  /**
   * @return the raw value of an entry of the document, for example {@code bolt_direct}
   */
  public Object getEntry(final String name) {
    return entries.get(name);
  }

  @Override
  public String toString() {
    return "ServiceRoot{transaction=" + transaction + ", version=" + version + ", edition=" + edition + "}";
  }
}
