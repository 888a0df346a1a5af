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
package com.graphwire;

import com.graphwire.serializer.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalConfigurationTest {
  @AfterEach
  void resetConfiguration() {
    GlobalConfiguration.resetAll();
  }

  @Test
  void stringValuesAreConvertedToTheSettingType() {
    GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.setValue("5000");
    assertThat(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.getValueAsInteger()).isEqualTo(5000);
    assertThat((Object) GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.getValue()).isInstanceOf(Integer.class);

    GlobalConfiguration.TX_EXPIRY_GRACE.setValue(" 250 ");
    assertThat((Object) GlobalConfiguration.TX_EXPIRY_GRACE.getValue()).isEqualTo(250L);

    GlobalConfiguration.TX_CLIENT_EXPIRY_CHECK.setValue("false");
    assertThat(GlobalConfiguration.TX_CLIENT_EXPIRY_CHECK.getValueAsBoolean()).isFalse();
  }

  @Test
  void invalidNumbersAreRefused() {
    assertThatThrownBy(() -> GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.setValue("notvalid"))//
        .isInstanceOf(IllegalArgumentException.class)//
        .hasMessageContaining("graphwire.network.socketTimeout");
    assertThat(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.isChanged()).isFalse();
  }

  @Test
  void defaultValue() {
    GlobalConfiguration.SERVER_DATABASE.reset();
    assertThat(GlobalConfiguration.SERVER_DATABASE.getValueAsString()).isEqualTo("neo4j");
    assertThat(GlobalConfiguration.SERVER_DATABASE.getDefValue()).isEqualTo("neo4j");
    assertThat(GlobalConfiguration.SERVER_DATABASE.isChanged()).isFalse();

    GlobalConfiguration.SERVER_DATABASE.setValue("movies");
    assertThat(GlobalConfiguration.SERVER_DATABASE.isChanged()).isTrue();

    GlobalConfiguration.SERVER_DATABASE.setValue(null);
    assertThat(GlobalConfiguration.SERVER_DATABASE.isChanged()).isFalse();
    assertThat(GlobalConfiguration.SERVER_DATABASE.getValueAsString()).isEqualTo("neo4j");
  }

  @Test
  void findByKeyIsCaseInsensitive() {
    assertThat(GlobalConfiguration.findByKey("graphwire.tx.clientexpirycheck")).isEqualTo(
        GlobalConfiguration.TX_CLIENT_EXPIRY_CHECK);
    assertThat(GlobalConfiguration.findByKey("graphwire.unknown")).isNull();
  }

  @Test
  void setConfigurationAcceptsKeysAndEnumNames() {
    GlobalConfiguration.setConfiguration(Map.of("graphwire.network.connectTimeout", 1000, "NETWORK_LOG_PAYLOADS", "true"));

    assertThat(GlobalConfiguration.NETWORK_CONNECT_TIMEOUT.getValueAsInteger()).isEqualTo(1000);
    assertThat(GlobalConfiguration.NETWORK_LOG_PAYLOADS.getValueAsBoolean()).isTrue();
  }

  @Test
  void jsonExportAndImport() {
    GlobalConfiguration.SERVER_DATABASE.setValue("movies");
    final String json = GlobalConfiguration.toJSON();

    final JSONObject cfg = new JSONObject(json).getJSONObject("configuration");
    assertThat(cfg.getString("server.database")).isEqualTo("movies");
    assertThat(cfg.getInt("network.socketTimeout")).isEqualTo(30000);

    GlobalConfiguration.resetAll();
    assertThat(GlobalConfiguration.SERVER_DATABASE.getValueAsString()).isEqualTo("neo4j");

    GlobalConfiguration.fromJSON(json);
    assertThat(GlobalConfiguration.SERVER_DATABASE.getValueAsString()).isEqualTo("movies");
    assertThat((Object) GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.getValue()).isEqualTo(30000);
  }

  @Test
  void dumpConfigurationListsSectionsAndKeys() {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    GlobalConfiguration.dumpConfiguration(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    final String dump = buffer.toString(StandardCharsets.UTF_8);
    assertThat(dump).startsWith("GRAPHWIRE");
    assertThat(dump).contains("- NETWORK", "- TX", "+ graphwire.server.database = neo4j");
  }
}
