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
import com.graphwire.exception.ConfigurationException;
import com.graphwire.exception.EndpointException;
import com.graphwire.exception.ErrorCode;
import com.graphwire.network.exception.ExpiredTransactionException;
import com.graphwire.network.exception.TransportException;
import com.graphwire.query.BatchResult;
import com.graphwire.query.ResultTable;
import com.graphwire.query.Row;
import com.graphwire.query.Statement;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphClientTest {
  private FakeGraphServer server;
  private GraphClient     client;

  @BeforeEach
  void startServer() throws IOException {
    server = new FakeGraphServer();
  }

  @AfterEach
  void stopServer() {
    if (client != null)
      client.close();
    server.close();
  }

  @Test
  void connectDiscoversTheEndpoint() {
    client = GraphClient.connect(server.baseUrl());

    assertThat(client.getTransactionEndpoint()).isEqualTo(server.baseUrl() + "db/neo4j/tx");
    assertThat(client.getVersion()).isEqualTo("4.4.12");
    assertThat(client.getEdition()).isEqualTo("community");
    assertThat(client.getServiceRoot().getMajorVersion()).isEqualTo(4);
    assertThat(client.getServiceRoot().getEntry("bolt_direct")).isEqualTo("bolt://localhost:7687");
    assertThat(server.requests).containsExactly("GET /");
    assertThat(server.lastHeaders).doesNotContainKey("authorization");
  }

  @Test
  void connectToNamedDatabase() {
    client = GraphClient.connect(server.baseUrl(), "movies");

    assertThat(client.getTransactionEndpoint()).endsWith("/db/movies/tx");
    assertThat(client.getConfiguration().getValueAsString(GlobalConfiguration.SERVER_DATABASE)).isEqualTo("movies");
  }

  @Test
  void credentialsFromTheUrl() {
    client = GraphClient.connect(server.baseUrl().replace("http://", "http://neo4j:s3cr:et@"));

    final String expected = "Basic " + Base64.getEncoder().encodeToString("neo4j:s3cr:et".getBytes(StandardCharsets.UTF_8));
    assertThat(server.lastHeaders).containsEntry("authorization", expected);

    client.exec("RETURN 1");
    assertThat(server.lastHeaders).containsEntry("authorization", expected);
    assertThat(server.lastHeaders.get("user-agent")).startsWith("GraphWire/");
  }

  @Test
  void execSingleStatement() {
    client = GraphClient.connect(server.baseUrl());

    final ResultTable result = client.exec(Statement.builder("RETURN $x AS x").withParam("x", 42).withParam("f", 1.0).build());

    assertThat(result.getColumns()).containsExactly("text", "params");
    final Row row = result.getRow(0);
    assertThat(row.getString("text")).isEqualTo("RETURN $x AS x");
    assertThat(row.getMap("params")).containsEntry("x", 42).containsEntry("f", 1.0);
    assertThat(server.requests).containsExactly("GET /", "POST /db/neo4j/tx/commit");
  }

  @Test
  void execFailsOnServerError() {
    client = GraphClient.connect(server.baseUrl());

    assertThatThrownBy(() -> client.exec("BAD STATEMENT")).isInstanceOf(EndpointException.class).satisfies(e -> {
      final EndpointException ee = (EndpointException) e;
      assertThat(ee.getFirstError().getTitle()).isEqualTo("SyntaxError");
      assertThat(ee.getErrorCode()).isEqualTo(ErrorCode.ENDPOINT_ERROR);
    });
    assertThat(client.getStats().endpointErrors.get()).isEqualTo(1);
  }

  @Test
  void batchKeepsOneResultPerStatement() {
    client = GraphClient.connect(server.baseUrl());

    final CypherQuery query = client.query().withStatement("RETURN 1").withStatement("BAD 2").withStatement("RETURN 3");
    assertThat(query.getStatements()).hasSize(3);

    final BatchResult result = query.send();

    assertThat(result.size()).isEqualTo(3);
    assertThat(result.getResult(0).getRow(0).getString("text")).isEqualTo("RETURN 1");
    assertThat(result.getResult(1).isEmpty()).isTrue();
    assertThat(result.getResult(2).isEmpty()).isTrue();
    assertThat(result.getErrors()).hasSize(1);
  }

  @Test
  void fullTransaction() {
    client = GraphClient.connect(server.baseUrl());

    final TransactionStart start = client.transaction().withStatement("CREATE (a)").begin();
    final Transaction tx = start.transaction();

    assertThat(start.result().getResult(0).getRow(0).getString("text")).isEqualTo("CREATE (a)");
    assertThat(tx.getTransactionUrl()).isEqualTo(server.baseUrl() + "db/neo4j/tx/1");
    assertThat(tx.getExpiresAt()).isNotNull();
    assertThat(server.open).containsExactly("1");

    final BatchResult executed = tx.execute(Statement.of("MATCH (n) RETURN n"));
    assertThat(executed.getResult(0).getRow(0).getString("text")).isEqualTo("MATCH (n) RETURN n");

    tx.addStatement("CREATE (b)");
    final BatchResult committed = tx.commit();
    assertThat(committed.getResult(0).getRow(0).getString("text")).isEqualTo("CREATE (b)");

    assertThat(tx.getState()).isEqualTo(TransactionState.COMMITTED);
    assertThat(server.committed).containsExactly("1");
    assertThat(server.requests).containsExactly("GET /", "POST /db/neo4j/tx", "POST /db/neo4j/tx/1", "POST /db/neo4j/tx/1/commit");
    assertThat(client.getStatsAsMap()).containsEntry("transactionsBegun", 1L).containsEntry("transactionsCommitted", 1L)
        .containsEntry("statementsSent", 3L);
  }

  @Test
  void beginWithoutStatements() {
    client = GraphClient.connect(server.baseUrl());

    final TransactionStart start = client.beginTransaction();

    assertThat(start.result().size()).isZero();
    start.transaction().rollback();
    assertThat(server.open).isEmpty();
    assertThat(start.transaction().getState()).isEqualTo(TransactionState.ROLLED_BACK);
  }

  @Test
  void transactionRemovedOnTheServer() {
    client = GraphClient.connect(server.baseUrl());

    final Transaction first = client.beginTransaction(Statement.of("RETURN 1")).transaction();
    final Transaction second = client.beginTransaction(Statement.of("RETURN 2")).transaction();
    server.open.clear();

    first.rollback();
    assertThat(first.getState()).isEqualTo(TransactionState.ROLLED_BACK);

    assertThatThrownBy(() -> second.execute(Statement.of("RETURN 3"))).isInstanceOf(ExpiredTransactionException.class);
    assertThat(second.getState()).isEqualTo(TransactionState.EXPIRED);
  }

  @Test
  void invalidUrls() {
    for (String url : List.of("ftp://localhost/", "not a url", "http:///db", "localhost:7474"))
      assertThatThrownBy(() -> GraphClient.connect(url)).as(url).isInstanceOf(ConfigurationException.class)
          .satisfies(e -> assertThat(((ConfigurationException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_ENDPOINT_URL));
    assertThatThrownBy(() -> GraphClient.connect((String) null)).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void discoveryFailure() {
    assertThatThrownBy(() -> GraphClient.connect(server.baseUrl() + "broken")).isInstanceOf(TransportException.class)
        .satisfies(e -> assertThat(((TransportException) e).getStatusCode()).isEqualTo(500));
  }

  @Test
  void serverNotReachable() {
    final String url = server.baseUrl();
    server.close();

    final ContextConfiguration configuration = new ContextConfiguration();
    configuration.setValue(GlobalConfiguration.NETWORK_CONNECT_TIMEOUT, 2000);
    assertThatThrownBy(() -> GraphClient.connect(url, configuration)).isInstanceOf(TransportException.class)
        .satisfies(e -> assertThat(((TransportException) e).getErrorCode()).isEqualTo(ErrorCode.TRANSPORT_ERROR));
  }

  @Test
  void knownEndpointWithoutDiscovery() {
    client = new GraphClient(new HttpTransport(), server.baseUrl() + "db/neo4j/tx/", new ContextConfiguration());

    assertThat(client.getTransactionEndpoint()).isEqualTo(server.baseUrl() + "db/neo4j/tx");
    assertThat(client.getServiceRoot()).isNull();
    assertThat(client.getVersion()).isNull();
    assertThat(client.exec("RETURN 1").size()).isEqualTo(1);
    assertThat(server.requests).containsExactly("POST /db/neo4j/tx/commit");
  }
}
