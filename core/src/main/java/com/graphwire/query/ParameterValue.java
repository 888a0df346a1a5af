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

import com.graphwire.exception.ErrorCode;
import com.graphwire.exception.TypeCoercionException;
import com.graphwire.serializer.json.JSONArray;
import com.graphwire.serializer.json.JSONObject;
import com.google.gson.JsonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable value bound to a statement parameter. A value has exactly one {@link Kind}: integers are kept as 64-bit longs and
 * floating point numbers as doubles, so an integral double like {@code 1.0} is never confused with the integer {@code 1}.
 * Lists and maps are built bottom-up from other values, maps keep the insertion order of their keys.
 */
public final class ParameterValue {
  public enum Kind {
    NULL, BOOLEAN, INTEGER, FLOAT, STRING, LIST, MAP
  }

  private static final ParameterValue NULL_VALUE = new ParameterValue(Kind.NULL, null);
  private static final ParameterValue TRUE       = new ParameterValue(Kind.BOOLEAN, Boolean.TRUE);
  private static final ParameterValue FALSE      = new ParameterValue(Kind.BOOLEAN, Boolean.FALSE);

  private final Kind   kind;
  private final Object value;

  private ParameterValue(final Kind kind, final Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static ParameterValue nullValue() {
    return NULL_VALUE;
  }

  public static ParameterValue of(final boolean value) {
    return value ? TRUE : FALSE;
  }

  public static ParameterValue of(final int value) {
    return new ParameterValue(Kind.INTEGER, (long) value);
  }

  public static ParameterValue of(final long value) {
    return new ParameterValue(Kind.INTEGER, value);
  }

  public static ParameterValue of(final float value) {
    return new ParameterValue(Kind.FLOAT, (double) value);
  }

  public static ParameterValue of(final double value) {
    return new ParameterValue(Kind.FLOAT, value);
  }

  /**
   * Creates a STRING value. A null string is the NULL value.
   */
  public static ParameterValue of(final String value) {
    return value == null ? NULL_VALUE : new ParameterValue(Kind.STRING, value);
  }

  public static ParameterValue list(final ParameterValue... values) {
    return list(values != null ? Arrays.asList(values) : List.of());
  }

  public static ParameterValue list(final List<ParameterValue> values) {
    final List<ParameterValue> copy = new ArrayList<>(values != null ? values.size() : 0);
    if (values != null)
      for (ParameterValue v : values)
        copy.add(v != null ? v : NULL_VALUE);
    return new ParameterValue(Kind.LIST, Collections.unmodifiableList(copy));
  }

  public static ParameterValue map(final Map<String, ParameterValue> values) {
    final Map<String, ParameterValue> copy = new LinkedHashMap<>();
    if (values != null)
      for (Map.Entry<String, ParameterValue> entry : values.entrySet()) {
        if (entry.getKey() == null)
          throw new IllegalArgumentException("Map parameter keys cannot be null");
        copy.put(entry.getKey(), entry.getValue() != null ? entry.getValue() : NULL_VALUE);
      }
    return new ParameterValue(Kind.MAP, Collections.unmodifiableMap(copy));
  }

  /**
   * Converts a plain Java value to a parameter value. Accepted shapes are null, {@link Boolean}, {@link Number},
   * {@link CharSequence}, {@link Character}, {@link Collection}, object arrays, maps with string keys and {@link ParameterValue}
   * itself. Containers are converted recursively.
   *
   * @throws IllegalArgumentException if the value, or one of the values it contains, has an unsupported type
   */
  public static ParameterValue from(final Object value) {
    if (value == null)
      return NULL_VALUE;
    else if (value instanceof ParameterValue parameterValue)
      return parameterValue;
    else if (value instanceof Boolean bool)
      return of(bool.booleanValue());
    else if (value instanceof Number number)
      return fromNumber(number);
    else if (value instanceof CharSequence || value instanceof Character)
      return of(value.toString());
    else if (value instanceof Collection<?> collection) {
      final List<ParameterValue> list = new ArrayList<>(collection.size());
      for (Object o : collection)
        list.add(from(o));
      return list(list);
    } else if (value instanceof Object[] array) {
      final List<ParameterValue> list = new ArrayList<>(array.length);
      for (Object o : array)
        list.add(from(o));
      return list(list);
    } else if (value instanceof Map<?, ?> map) {
      final Map<String, ParameterValue> result = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key))
          throw new IllegalArgumentException("Map parameter keys must be strings, found: " + entry.getKey());
        result.put(key, from(entry.getValue()));
      }
      return map(result);
    }

    throw new IllegalArgumentException("Unsupported parameter type " + value.getClass().getName());
  }

  /**
   * Reads a value decoded from JSON, as returned by the JSON wrappers or by {@link JSONObject#toMap()}.
   */
  public static ParameterValue fromJSON(final Object json) {
    if (json == null || json instanceof JsonNull)
      return NULL_VALUE;
    else if (json instanceof JSONArray array) {
      final List<ParameterValue> list = new ArrayList<>(array.length());
      for (Object o : array)
        list.add(fromJSON(o));
      return list(list);
    } else if (json instanceof JSONObject object) {
      final Map<String, ParameterValue> map = new LinkedHashMap<>();
      for (String key : object.keySet())
        map.put(key, fromJSON(object.opt(key)));
      return map(map);
    }
    return from(json);
  }

  private static ParameterValue fromNumber(final Number number) {
    if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte)
      return of(number.longValue());
    else if (number instanceof Double || number instanceof Float)
      return of(number.doubleValue());
    else if (number instanceof BigInteger bigInteger) {
      if (bigInteger.bitLength() < 64)
        return of(bigInteger.longValue());
      throw new IllegalArgumentException("Integer parameter out of the 64-bit range: " + number);
    } else if (number instanceof BigDecimal bigDecimal) {
      if (bigDecimal.scale() <= 0)
        return fromNumber(bigDecimal.toBigIntegerExact());
      return of(bigDecimal.doubleValue());
    }

    // LAZILY PARSED NUMBERS AND CUSTOM IMPLEMENTATIONS: DECIDE FROM THE TEXT
    final String text = number.toString();
    if (text.contains(".") || text.contains("e") || text.contains("E") || text.equals("NaN") || text.contains("Infinity"))
      return of(number.doubleValue());
    return fromNumber(new BigInteger(text));
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean asBoolean() {
    check(Kind.BOOLEAN);
    return (Boolean) value;
  }

  public long asLong() {
    check(Kind.INTEGER);
    return (Long) value;
  }

  public double asDouble() {
    check(Kind.FLOAT);
    return (Double) value;
  }

  public String asString() {
    check(Kind.STRING);
    return (String) value;
  }

  @SuppressWarnings("unchecked")
  public List<ParameterValue> asList() {
    check(Kind.LIST);
    return (List<ParameterValue>) value;
  }

  @SuppressWarnings("unchecked")
  public Map<String, ParameterValue> asMap() {
    check(Kind.MAP);
    return (Map<String, ParameterValue>) value;
  }

  /**
   * Renders the value with the JSON wrapper types: null, Boolean, Long, Double, String, {@link JSONArray} or {@link JSONObject}.
   */
  public Object toJSON() {
    switch (kind) {
    case NULL:
      return null;
    case LIST: {
      final JSONArray array = new JSONArray();
      for (ParameterValue v : asList())
        array.put(v.toJSON());
      return array;
    }
    case MAP: {
      final JSONObject object = new JSONObject();
      for (Map.Entry<String, ParameterValue> entry : asMap().entrySet())
        object.put(entry.getKey(), entry.getValue().toJSON());
      return object;
    }
    default:
      return value;
    }
  }

  private void check(final Kind expected) {
    if (kind != expected)
      throw new TypeCoercionException(ErrorCode.TYPE_COERCION, "Cannot read a " + kind + " parameter value as " + expected);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ParameterValue))
      return false;
    final ParameterValue that = (ParameterValue) o;
    return kind == that.kind && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case NULL -> "null";
      case STRING -> "'" + value + "'";
      default -> String.valueOf(value);
    };
  }
}
