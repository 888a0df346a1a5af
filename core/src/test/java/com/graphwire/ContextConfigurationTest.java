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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContextConfigurationTest {
  private ContextConfiguration config;

  @BeforeEach
  void setUp() {
    config = new ContextConfiguration();
  }

  @Test
  void emptyConstructorFallsBackToGlobals() {
    assertThat(config.getContextKeys()).isEmpty();
    assertThat(config.getValueAsInteger(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT)).isEqualTo(
        GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.getValueAsInteger());
  }

  @Test
  void overrideDoesNotChangeTheGlobalSetting() {
    config.setValue(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT, "1000");

    assertThat(config.getValue(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT)).isEqualTo(1000);
    assertThat(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT.isChanged()).isFalse();
  }

  @Test
  void knownKeysAreConverted() {
    config.setValue("graphwire.tx.expiryGraceMs", "250");

    assertThat(config.getValue(GlobalConfiguration.TX_EXPIRY_GRACE)).isEqualTo(250L);
    assertThat(config.getValueAsLong(GlobalConfiguration.TX_EXPIRY_GRACE)).isEqualTo(250L);
  }

  @Test
  void constructorWithMapCopiesValues() {
    final Map<String, Object> initial = new HashMap<>();
    initial.put("custom", "value1");
    initial.put("graphwire.server.database", "movies");

    final ContextConfiguration configWithMap = new ContextConfiguration(initial);

    assertThat(configWithMap.hasValue("custom")).isTrue();
    assertThat(configWithMap.getValueAsString(GlobalConfiguration.SERVER_DATABASE)).isEqualTo("movies");
  }

  @Test
  void setValueWithNullRemovesKey() {
    config.setValue("custom", "value");
    assertThat(config.hasValue("custom")).isTrue();

    config.setValue("custom", null);
    assertThat(config.hasValue("custom")).isFalse();

    config.setValue(GlobalConfiguration.SERVER_DATABASE, "movies");
    config.setValue(GlobalConfiguration.SERVER_DATABASE, null);
    assertThat(config.getValueAsString(GlobalConfiguration.SERVER_DATABASE)).isEqualTo("neo4j");
  }

  @Test
  void copyAndMerge() {
    config.setValue(GlobalConfiguration.SERVER_DATABASE, "movies");

    final ContextConfiguration copy = new ContextConfiguration(config);
    assertThat(copy.getValueAsString(GlobalConfiguration.SERVER_DATABASE)).isEqualTo("movies");
    assertThat(new ContextConfiguration((ContextConfiguration) null).getContextSize()).isZero();

    final ContextConfiguration other = new ContextConfiguration();
    other.setValue(GlobalConfiguration.TX_CLIENT_EXPIRY_CHECK, false);
    copy.merge(other);

    assertThat(copy.getContextSize()).isEqualTo(2);
    assertThat(copy.getValueAsBoolean(GlobalConfiguration.TX_CLIENT_EXPIRY_CHECK)).isFalse();

    copy.reset();
    assertThat(copy.getContextSize()).isZero();
  }

  @Test
  void jsonRoundTrip() {
    config.setValue(GlobalConfiguration.SERVER_DATABASE, "movies");
    config.setValue(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT, 1500);

    final ContextConfiguration restored = new ContextConfiguration();
    restored.fromJSON(config.toJSON());

    assertThat(restored.getValueAsString(GlobalConfiguration.SERVER_DATABASE)).isEqualTo("movies");
    assertThat(restored.getValueAsInteger(GlobalConfiguration.NETWORK_SOCKET_TIMEOUT)).isEqualTo(1500);
  }
}
