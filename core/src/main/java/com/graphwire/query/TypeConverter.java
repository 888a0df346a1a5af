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
import com.graphwire.serializer.json.JSONFactory;
import com.google.gson.Gson;
import com.google.gson.JsonElement;

import java.util.List;
import java.util.Map;

/**
 * Strict conversion of result cells to Java types. No conversion ever changes the meaning of a value: booleans and strings are
 * never parsed from other types, integral targets accept floating values only when they have no fractional part, and every
 * numeric target checks its range.
 * <p>
 * Cells holding a JSON object or array can be mapped to any other class (for example a POJO describing a node) through Gson.
 */
public class TypeConverter {
  private static final double LONG_MIN_AS_DOUBLE = -0x1p63;
  private static final double LONG_MAX_AS_DOUBLE = 0x1p63;

  private TypeConverter() {
  }

  /**
   * Converts the cell value to the requested type.
   *
   * @param value  raw cell value
   * @param type   target class, primitive classes are accepted
   * @param source description of the cell used in error messages
   *
   * @throws TypeCoercionException if the value cannot be represented by the requested type without loss
   */
  @SuppressWarnings("unchecked")
  public static <T> T convert(final Object value, final Class<T> type, final String source) {
    if (type == null)
      throw new IllegalArgumentException("Target type is null");

    if (value == null) {
      if (type.isPrimitive())
        throw error(null, type, source, "null cannot be assigned to a primitive");
      return null;
    }

    if (type == Object.class)
      return (T) value;
    else if (type == ParameterValue.class)
      return (T) toParameterValue(value, source);
    else if (type == Boolean.class || type == boolean.class) {
      if (value instanceof Boolean)
        return (T) value;
      throw error(value, type, source, null);
    } else if (type == String.class) {
      if (value instanceof String)
        return (T) value;
      throw error(value, type, source, null);
    } else if (type == Long.class || type == long.class)
      return (T) Long.valueOf(toIntegral(value, type, source, Long.MIN_VALUE, Long.MAX_VALUE));
    else if (type == Integer.class || type == int.class)
      return (T) Integer.valueOf((int) toIntegral(value, type, source, Integer.MIN_VALUE, Integer.MAX_VALUE));
    else if (type == Short.class || type == short.class)
      return (T) Short.valueOf((short) toIntegral(value, type, source, Short.MIN_VALUE, Short.MAX_VALUE));
    else if (type == Byte.class || type == byte.class)
      return (T) Byte.valueOf((byte) toIntegral(value, type, source, Byte.MIN_VALUE, Byte.MAX_VALUE));
    else if (type == Double.class || type == double.class) {
      if (value instanceof Number number) {
        final double d = number.doubleValue();
        if (isIntegral(number) && !fitsExactly(d, number.longValue()))
          throw error(value, type, source, "loses precision");
        return (T) Double.valueOf(d);
      }
      throw error(value, type, source, null);
    } else if (type == Float.class || type == float.class) {
      if (value instanceof Number number) {
        final double d = number.doubleValue();
        if (Double.isFinite(d) && Math.abs(d) > Float.MAX_VALUE)
          throw error(value, type, source, "out of range");
        final float f = (float) d;
        if (isIntegral(number) ? !fitsExactly(f, number.longValue()) : d != 0 && f == 0)
          throw error(value, type, source, "loses precision");
        return (T) Float.valueOf(f);
      }
      throw error(value, type, source, null);
    } else if (type == Number.class) {
      if (value instanceof Number)
        return (T) value;
      throw error(value, type, source, null);
    } else if (type == List.class) {
      if (value instanceof List)
        return (T) value;
      throw error(value, type, source, null);
    } else if (type == Map.class) {
      if (value instanceof Map)
        return (T) value;
      throw error(value, type, source, null);
    } else if (type.isPrimitive())
      throw error(value, type, source, null);

    if (type.isInstance(value))
      return (T) value;

    if (!(value instanceof Map) && !(value instanceof List))
      throw error(value, type, source, "only JSON objects and arrays can be mapped to " + type.getSimpleName());

    try {
      final Gson gson = JSONFactory.INSTANCE.getGson();
      final JsonElement tree = gson.toJsonTree(value);
      return gson.fromJson(tree, type);
    } catch (RuntimeException e) {
      throw new TypeCoercionException(
          "Cannot convert " + source + " to " + type.getSimpleName() + ": " + e.getMessage(), e);
    }
  }

  private static boolean isIntegral(final Number number) {
    return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
  }

  // (long) saturates at Long.MAX_VALUE, so 2^63 must be excluded before comparing
  private static boolean fitsExactly(final double converted, final long original) {
    return converted < LONG_MAX_AS_DOUBLE && (long) converted == original;
  }

  private static long toIntegral(final Object value, final Class<?> type, final String source, final long min,
      final long max) {
    if (!(value instanceof Number number))
      throw error(value, type, source, null);

    final long result;
    if (isIntegral(number))
      result = number.longValue();
    else {
      final double d = number.doubleValue();
      if (!Double.isFinite(d) || d != Math.rint(d))
        throw error(value, type, source, "the value is not integral");
      if (d < LONG_MIN_AS_DOUBLE || d >= LONG_MAX_AS_DOUBLE)
        throw error(value, type, source, "out of range");
      result = (long) d;
    }

    if (result < min || result > max)
      throw error(value, type, source, "out of range");
    return result;
  }

  private static ParameterValue toParameterValue(final Object value, final String source) {
    try {
      return ParameterValue.fromJSON(value);
    } catch (IllegalArgumentException e) {
      throw new TypeCoercionException("Cannot convert " + source + " to ParameterValue: " + e.getMessage(), e);
    }
  }

  private static TypeCoercionException error(final Object value, final Class<?> type, final String source, final String reason) {
    final String found = value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    return new TypeCoercionException(
        "Cannot convert " + source + " of type " + found + " to " + type.getSimpleName() + (reason != null ? ": " + reason : ""))//
        .addContext("targetType", type.getName());
  }
}
