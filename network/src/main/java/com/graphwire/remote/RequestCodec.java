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

import com.graphwire.exception.ErrorCode;
import com.graphwire.log.LogManager;
import com.graphwire.network.exception.TransportException;
import com.graphwire.query.ParameterValue;
import com.graphwire.query.ResultTable;
import com.graphwire.query.Statement;
import com.graphwire.query.StatementError;
import com.graphwire.serializer.json.JSONArray;
import com.graphwire.serializer.json.JSONException;
import com.graphwire.serializer.json.JSONObject;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

/**
 * Converts statements to the JSON payload of the transactional endpoint and its answers back to result tables and errors.
 * <p>
 * Request:
 * <pre>{@code {"statements":[{"statement":"RETURN $x","parameters":{"x":1}}]}}</pre>
 * Response:
 * <pre>{@code {"results":[{"columns":["x"],"data":[{"row":[1]}]}],"errors":[],
 *  "commit":"http://host/db/neo4j/tx/1/commit","transaction":{"expires":"Fri, 05 Jun 2015 12:34:56 +0000"}}}</pre>
 */
public class RequestCodec {
  private RequestCodec() {
  }

  public static String encode(final List<Statement> statements) {
    final JSONArray array = new JSONArray();
    for (Statement statement : statements) {
      final JSONObject parameters = new JSONObject();
      for (Map.Entry<String, ParameterValue> entry : statement.getParams().entrySet())
        parameters.put(entry.getKey(), entry.getValue().toJSON());

      array.put(new JSONObject().put("statement", statement.getText()).put("parameters", parameters));
    }
    return new JSONObject().put("statements", array).toString();
  }

  /**
   * Decodes an answer of the endpoint.
   *
   * @param body               response body
   * @param expectedStatements number of statements submitted: missing result tables are added as empty tables
   *
   * @throws TransportException with code {@link ErrorCode#PROTOCOL_ERROR} if the body is not a JSON object following the
   *                            endpoint format
   */
  public static TransactionalResponse decode(final String body, final int expectedStatements) {
    final JSONObject json = parse(body);

    try {
      final List<ResultTable> results = new ArrayList<>(Math.max(expectedStatements, 0));
      final JSONArray jsonResults = json.optJSONArray("results");
      if (jsonResults != null)
        for (int i = 0; i < jsonResults.length(); i++)
          results.add(decodeResult(jsonResults.getJSONObject(i)));

      while (results.size() < expectedStatements)
        // THE SERVER STOPS AT THE FIRST FAILING STATEMENT
        results.add(ResultTable.empty());

      final List<StatementError> errors = new ArrayList<>();
      final JSONArray jsonErrors = json.optJSONArray("errors");
      if (jsonErrors != null)
        for (int i = 0; i < jsonErrors.length(); i++) {
          final JSONObject error = jsonErrors.getJSONObject(i);
          errors.add(new StatementError(error.optString("code", null), error.optString("message", null)));
        }

      final String commitUrl = json.optString("commit", null);

      Instant expiresAt = null;
      final JSONObject transaction = json.optJSONObject("transaction");
      if (transaction != null)
        expiresAt = parseExpiry(transaction.optString("expires", null));

      return new TransactionalResponse(results, errors, commitUrl, expiresAt);

    } catch (final JSONException e) {
      throw new TransportException(ErrorCode.PROTOCOL_ERROR, "Malformed response from the transactional endpoint: " + e.getMessage(),
          -1, body, e);
    }
  }

  /**
   * Parses a body that must be a JSON object.
   */
  static JSONObject parse(final String body) {
    if (body == null || body.isBlank())
      throw new TransportException(ErrorCode.PROTOCOL_ERROR, "Empty response from the server", -1, body);
    try {
      return new JSONObject(body);
    } catch (final JSONException e) {
      throw new TransportException(ErrorCode.PROTOCOL_ERROR, "Response is not a JSON object", -1, body, e);
    }
  }

  /**
   * Parses an RFC 1123 timestamp (for example {@code Fri, 05 Jun 2015 12:34:56 +0000}).
   *
   * @return the instant, or null if the value is null or cannot be parsed
   */
  static Instant parseExpiry(final String expires) {
    if (expires == null)
      return null;
    try {
      return ZonedDateTime.parse(expires, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
    } catch (final DateTimeParseException e) {
      LogManager.instance().log(RequestCodec.class, Level.WARNING, "Cannot parse transaction expiry '%s', ignoring it", e, expires);
      return null;
    }
  }

  private static ResultTable decodeResult(final JSONObject result) {
    final List<String> columns = new ArrayList<>();
    final JSONArray jsonColumns = result.optJSONArray("columns");
    if (jsonColumns != null)
      for (Object column : jsonColumns)
        columns.add(String.valueOf(column));

    final List<List<Object>> rows = new ArrayList<>();
    final JSONArray data = result.optJSONArray("data");
    if (data != null)
      for (int i = 0; i < data.length(); i++) {
        final JSONArray row = data.getJSONObject(i).optJSONArray("row");
        rows.add(row != null ? row.toList() : List.of());
      }

    return new ResultTable(columns, rows);
  }
}
