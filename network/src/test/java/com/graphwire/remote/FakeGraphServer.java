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

import com.graphwire.serializer.json.JSONArray;
import com.graphwire.serializer.json.JSONObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory HTTP server answering like the transactional Cypher endpoint. Every statement is echoed back as a row with two
 * columns: the statement text and its parameters. A statement starting with {@code BAD} fails with a syntax error and the
 * following statements of the same request are not executed.
 */
class FakeGraphServer implements AutoCloseable {
  private final HttpServer          server;
  private final AtomicInteger       nextId      = new AtomicInteger(1);
  private final AtomicBoolean       stopped     = new AtomicBoolean();
  final         Set<String>         open        = ConcurrentHashMap.newKeySet();
  final         Set<String>         committed   = ConcurrentHashMap.newKeySet();
  final         List<String>        requests    = new CopyOnWriteArrayList<>();
  final         Map<String, String> lastHeaders = new ConcurrentHashMap<>();

  FakeGraphServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext("/", this::serviceRoot);
    server.createContext("/db/", this::transactional);
    server.createContext("/broken", exchange -> reply(exchange, 500, "Internal server error", null));
    server.start();
  }

  String baseUrl() {
    return "http://localhost:" + server.getAddress().getPort() + "/";
  }

  @Override
  public void close() {
    if (stopped.compareAndSet(false, true))
      server.stop(0);
  }

  private void serviceRoot(final HttpExchange exchange) throws IOException {
    record(exchange, null);
    final JSONObject root = new JSONObject()//
        .put("transaction", "http://localhost:" + server.getAddress().getPort() + "/db/{databaseName}/tx")//
        .put("bolt_direct", "bolt://localhost:7687")//
        .put("neo4j_version", "4.4.12")//
        .put("neo4j_edition", "community");
    reply(exchange, 200, root.toString(), null);
  }

  private void transactional(final HttpExchange exchange) throws IOException {
    final String method = exchange.getRequestMethod();
    final String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    record(exchange, body);

    // /db/{database}/tx[/{id}][/commit]
    final String[] path = exchange.getRequestURI().getPath().split("/");
    final String txBase = "http://localhost:" + server.getAddress().getPort() + "/" + path[1] + "/" + path[2] + "/tx";

    if (path.length == 4) {
      final String id = String.valueOf(nextId.getAndIncrement());
      open.add(id);
      final JSONObject answer = execute(body).put("commit", txBase + "/" + id + "/commit").put("transaction",
          new JSONObject().put("expires", expiry()));
      reply(exchange, 201, answer.toString(), txBase + "/" + id);
      return;
    }

    if (path.length == 5 && path[4].equals("commit")) {
      reply(exchange, 200, execute(body).toString(), null);
      return;
    }

    final String id = path[4];
    if (!open.contains(id)) {
      final JSONObject error = new JSONObject().put("code", "Neo.ClientError.Transaction.TransactionNotFound")
          .put("message", "Unrecognized transaction id. Transaction may have timed out and been rolled back.");
      reply(exchange, 404, new JSONObject().put("results", new JSONArray()).put("errors", new JSONArray().put(error)).toString(),
          null);
      return;
    }

    if ("DELETE".equals(method)) {
      open.remove(id);
      reply(exchange, 200, new JSONObject().put("results", new JSONArray()).put("errors", new JSONArray()).toString(), null);
    } else if (path.length == 6) {
      open.remove(id);
      committed.add(id);
      reply(exchange, 200, execute(body).toString(), null);
    } else
      reply(exchange, 200, execute(body).put("commit", txBase + "/" + id + "/commit")
          .put("transaction", new JSONObject().put("expires", expiry())).toString(), null);
  }

  private static JSONObject execute(final String body) {
    final JSONArray results = new JSONArray();
    final JSONArray errors = new JSONArray();

    final JSONArray statements = body.isBlank() ? new JSONArray() : new JSONObject(body).getJSONArray("statements");
    for (int i = 0; i < statements.length(); i++) {
      final JSONObject statement = statements.getJSONObject(i);
      final String text = statement.getString("statement");
      if (text.startsWith("BAD")) {
        errors.put(new JSONObject().put("code", "Neo.ClientError.Statement.SyntaxError").put("message", "Invalid input '" + text + "'"));
        break;
      }

      final JSONArray row = new JSONArray().put(text).put(statement.optJSONObject("parameters"));
      results.put(new JSONObject().put("columns", new JSONArray().put("text").put("params"))
          .put("data", new JSONArray().put(new JSONObject().put("row", row))));
    }

    return new JSONObject().put("results", results).put("errors", errors);
  }

  private static String expiry() {
    return DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC).plusSeconds(60));
  }

  private void record(final HttpExchange exchange, final String body) {
    requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
    lastHeaders.clear();
    exchange.getRequestHeaders().forEach((k, v) -> lastHeaders.put(k.toLowerCase(), String.join(",", v)));
    if (body != null)
      lastHeaders.put("x-body-length", String.valueOf(body.length()));
  }

  private static void reply(final HttpExchange exchange, final int status, final String body, final String location)
      throws IOException {
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json; charset=UTF-8");
    if (location != null)
      exchange.getResponseHeaders().add("Location", location);
    exchange.sendResponseHeaders(status, bytes.length);
    exchange.getResponseBody().write(bytes);
    exchange.close();
  }
}
