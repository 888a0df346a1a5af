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
package com.graphwire.query;

import com.graphwire.exception.TypeCoercionException;
import com.graphwire.serializer.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterValueTest {
  @Test
  void factoriesSetTheKind() {
    assertThat(ParameterValue.nullValue().getKind()).isEqualTo(ParameterValue.Kind.NULL);
    assertThat(ParameterValue.of(true).getKind()).isEqualTo(ParameterValue.Kind.BOOLEAN);
    assertThat(ParameterValue.of(1).getKind()).isEqualTo(ParameterValue.Kind.INTEGER);
    assertThat(ParameterValue.of(1L).getKind()).isEqualTo(ParameterValue.Kind.INTEGER);
    assertThat(ParameterValue.of(1.0f).getKind()).isEqualTo(ParameterValue.Kind.FLOAT);
    assertThat(ParameterValue.of(1.0).getKind()).isEqualTo(ParameterValue.Kind.FLOAT);
    assertThat(ParameterValue.of("a").getKind()).isEqualTo(ParameterValue.Kind.STRING);
    assertThat(ParameterValue.of((String) null).isNull()).isTrue();
    assertThat(ParameterValue.list(ParameterValue.of(1), null).asList()).containsExactly(ParameterValue.of(1),
        ParameterValue.nullValue());
  }

  @Test
  void integersAndFloatsAreDistinct() {
    assertThat(ParameterValue.of(1)).isEqualTo(ParameterValue.of(1L));
    assertThat(ParameterValue.of(1)).isNotEqualTo(ParameterValue.of(1.0));
    assertThat(ParameterValue.of(1.0).asDouble()).isEqualTo(1.0);
  }

  @Test
  void fromPlainJavaValues() {
    final Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", "Alice");
    map.put("age", 42);
    map.put("scores", List.of(1.5, 2));
    map.put("tags", new String[] { "a", "b" });
    map.put("big", new BigInteger("12345678901234"));
    map.put("decimal", new BigDecimal("2.5"));
    map.put("missing", null);

    final ParameterValue value = ParameterValue.from(map);

    assertThat(value.getKind()).isEqualTo(ParameterValue.Kind.MAP);
    final Map<String, ParameterValue> m = value.asMap();
    assertThat(m.keySet()).containsExactly("name", "age", "scores", "tags", "big", "decimal", "missing");
    assertThat(m.get("name").asString()).isEqualTo("Alice");
    assertThat(m.get("age").asLong()).isEqualTo(42L);
    assertThat(m.get("scores").asList()).containsExactly(ParameterValue.of(1.5), ParameterValue.of(2));
    assertThat(m.get("tags").asList()).containsExactly(ParameterValue.of("a"), ParameterValue.of("b"));
    assertThat(m.get("big").asLong()).isEqualTo(12345678901234L);
    assertThat(m.get("decimal").asDouble()).isEqualTo(2.5);
    assertThat(m.get("missing").isNull()).isTrue();
    assertThat(ParameterValue.from('c').asString()).isEqualTo("c");
  }

  @Test
  void unsupportedValuesAreRefused() {
    assertThatThrownBy(() -> ParameterValue.from(new Object())).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ParameterValue.from(List.of(new Object()))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ParameterValue.from(Map.of(1, "a"))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ParameterValue.from(new BigInteger("123456789012345678901234567890"))).isInstanceOf(
        IllegalArgumentException.class);

    final Map<String, ParameterValue> nullKey = new LinkedHashMap<>();
    nullKey.put(null, ParameterValue.of(1));
    assertThatThrownBy(() -> ParameterValue.map(nullKey)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void accessorsCheckTheKind() {
    assertThatThrownBy(() -> ParameterValue.of("42").asLong()).isInstanceOf(TypeCoercionException.class);
    assertThatThrownBy(() -> ParameterValue.of(42).asDouble()).isInstanceOf(TypeCoercionException.class);
    assertThatThrownBy(() -> ParameterValue.nullValue().asBoolean()).isInstanceOf(TypeCoercionException.class);
    assertThatThrownBy(() -> ParameterValue.of(1.0).asMap()).isInstanceOf(TypeCoercionException.class);
  }

  @Test
  void containersAreImmutable() {
    final List<ParameterValue> source = new ArrayList<>(List.of(ParameterValue.of(1)));
    final ParameterValue list = ParameterValue.list(source);
    source.add(ParameterValue.of(2));

    assertThat(list.asList()).hasSize(1);
    assertThatThrownBy(() -> list.asList().add(ParameterValue.of(3))).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void encodeDecodeIsLossless() {
    final Map<String, ParameterValue> nested = new LinkedHashMap<>();
    nested.put("integral float", ParameterValue.of(1.0));
    nested.put("one", ParameterValue.of(1));
    nested.put("max", ParameterValue.of(Long.MAX_VALUE));
    nested.put("min", ParameterValue.of(Long.MIN_VALUE));
    nested.put("pi", ParameterValue.of(3.14159));
    nested.put("huge", ParameterValue.of(1e300));
    nested.put("tiny", ParameterValue.of(Double.MIN_VALUE));
    nested.put("text", ParameterValue.of("héllo \"quoted\" \n"));
    nested.put("flag", ParameterValue.of(false));
    nested.put("nothing", ParameterValue.nullValue());
    nested.put("list", ParameterValue.list(ParameterValue.of(2.0), ParameterValue.of(2), ParameterValue.list()));
    nested.put("map", ParameterValue.map(Map.of()));

    final ParameterValue original = ParameterValue.map(nested);

    final String encoded = new JSONObject().put("value", original.toJSON()).toString();
    final ParameterValue decoded = ParameterValue.fromJSON(new JSONObject(encoded).opt("value"));

    assertThat(decoded).isEqualTo(original);
    assertThat(decoded.asMap().get("integral float").getKind()).isEqualTo(ParameterValue.Kind.FLOAT);
    assertThat(decoded.asMap().get("one").getKind()).isEqualTo(ParameterValue.Kind.INTEGER);
    assertThat(decoded.asMap().keySet()).containsExactlyElementsOf(nested.keySet());
  }

  @Test
  void decodeFromPlainCollections() {
    final ParameterValue value = ParameterValue.fromJSON(List.of(1, 2.5, "x", Map.of("k", true)));
    assertThat(value.asList()).containsExactly(ParameterValue.of(1), ParameterValue.of(2.5), ParameterValue.of("x"),
        ParameterValue.map(Map.of("k", ParameterValue.of(true))));
  }
}
