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
package com.graphwire.serializer.json;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.Strictness;
import com.google.gson.internal.LazilyParsedNumber;
import com.google.gson.stream.JsonReader;

import java.io.StringReader;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * JSON object.<br>
 * This API is compatible with org.json Java API, but uses Google GSON library under the hood. Properties keep the insertion order,
 * that is the order the server sent them.
 *
 * @author Luca Garulli (l.garulli@arcadedata.com)
 */
public class JSONObject {
  public static final JsonNull   NULL = JsonNull.INSTANCE;
  private final       JsonObject object;

  public JSONObject() {
    this.object = new JsonObject();
  }

  public JSONObject(final JsonObject input) {
    this.object = input;
  }

  public JSONObject(final String input) {
    if (input != null) {
      try {
        final JsonReader reader = new JsonReader(new StringReader(input));
        reader.setStrictness(Strictness.LENIENT);
        object = JsonParser.parseReader(reader).getAsJsonObject();
      } catch (Exception e) {
        throw new JSONException("Invalid JSON object format: " + input, e);
      }
    } else
      object = new JsonObject();
  }

  public JSONObject(final Map<String, ?> map) {
    object = new JsonObject();
    if (map != null)
      for (Map.Entry<String, ?> entry : map.entrySet())
        put(entry.getKey(), entry.getValue());
  }

  public JSONObject put(final String name, final String value) {
    object.addProperty(name, value);
    return this;
  }

  public JSONObject put(final String name, final Number value) {
    object.addProperty(name, value);
    return this;
  }

  public JSONObject put(final String name, final Boolean value) {
    object.addProperty(name, value);
    return this;
  }

  public JSONObject put(final String name, final Object value) {
    if (name == null)
      throw new IllegalArgumentException("Property name is null");

    object.add(name, objectToElement(value));
    return this;
  }

  public String getString(final String name) {
    return getElement(name).getAsString();
  }

  public int getInt(final String name) {
    return getElement(name).getAsNumber().intValue();
  }

  public long getLong(final String name) {
    return getElement(name).getAsNumber().longValue();
  }

  public double getDouble(final String name) {
    return getElement(name).getAsNumber().doubleValue();
  }

  public boolean getBoolean(final String name) {
    return getElement(name).getAsBoolean();
  }

  public JSONObject getJSONObject(final String name) {
    final JsonElement element = getElement(name);
    if (!element.isJsonObject())
      throw new JSONException("JSONObject[" + name + "] is not an object");
    return new JSONObject(element.getAsJsonObject());
  }

  public JSONArray getJSONArray(final String name) {
    final JsonElement element = getElement(name);
    if (!element.isJsonArray())
      throw new JSONException("JSONObject[" + name + "] is not an array");
    return new JSONArray(element.getAsJsonArray());
  }

  public Object get(final String name) {
    return elementToObject(getElement(name));
  }

  public String optString(final String name) {
    return optString(name, "");
  }

  public String optString(final String name, final String defaultValue) {
    final Object value = this.opt(name);
    return value == null ? defaultValue : value.toString();
  }

  /**
   * Returns the array under the property name, or null if the property is missing, null or of another type.
   */
  public JSONArray optJSONArray(final String name) {
    final JsonElement element = name == null ? null : object.get(name);
    return element != null && element.isJsonArray() ? new JSONArray(element.getAsJsonArray()) : null;
  }

  /**
   * Returns the object under the property name, or null if the property is missing, null or of another type.
   */
  public JSONObject optJSONObject(final String name) {
    final JsonElement element = name == null ? null : object.get(name);
    return element != null && element.isJsonObject() ? new JSONObject(element.getAsJsonObject()) : null;
  }

  public Object opt(final String name) {
    return name == null ? null : elementToObject(object.get(name));
  }

  public boolean has(final String name) {
    return object.has(name);
  }

  public Map<String, Object> toMap() {
    final Map<String, JsonElement> map = object.asMap();
    final Map<String, Object> result = new LinkedHashMap<>(map.size());
    for (Map.Entry<String, JsonElement> entry : map.entrySet()) {
      Object value = elementToObject(entry.getValue());
      if (value instanceof JSONObject nObject)
        value = nObject.toMap();
      else if (value instanceof JSONArray array)
        value = array.toList();

      result.put(entry.getKey(), value);
    }

    return result;
  }

  public Set<String> keySet() {
    return object.keySet();
  }

  public int length() {
    return object.size();
  }

  public boolean isEmpty() {
    return object.size() == 0;
  }

  public boolean isNull(final String name) {
    return !object.has(name) || object.get(name).isJsonNull();
  }

  public JsonObject getInternal() {
    return object;
  }

  @Override
  public String toString() {
    return JSONFactory.INSTANCE.getGson().toJson(object);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof JSONObject))
      return false;
    final JSONObject that = (JSONObject) o;
    return object.equals(that.object);
  }

  @Override
  public int hashCode() {
    return Objects.hash(object);
  }

  /**
   * Converts a Gson element to the plain Java value: integral numbers become Integer or Long (the smallest that fits), numbers
   * with a decimal point or an exponent become Double.
   */
  protected static Object elementToObject(final JsonElement element) {
    if (element == null || element.isJsonNull())
      return null;
    else if (element.isJsonPrimitive()) {
      final JsonPrimitive primitive = element.getAsJsonPrimitive();
      if (primitive.isNumber()) {
        final Number value = primitive.getAsNumber();
        if (!(value instanceof LazilyParsedNumber))
          return value;
        final String strValue = primitive.getAsString();

        if (strValue.contains(".") || strValue.contains("e") || strValue.contains("E"))
          return primitive.getAsDouble();

        try {
          final long longVal = primitive.getAsLong();
          if (longVal >= Integer.MIN_VALUE && longVal <= Integer.MAX_VALUE)
            return (int) longVal;
          return longVal;

        } catch (NumberFormatException e) {
          // OUT OF THE LONG RANGE
          return primitive.getAsDouble();
        }
      } else if (primitive.isString())
        return primitive.getAsString();
      else if (primitive.isBoolean())
        return primitive.getAsBoolean();

    } else if (element.isJsonObject())
      return new JSONObject(element.getAsJsonObject());
    else if (element.isJsonArray())
      return new JSONArray(element.getAsJsonArray());

    throw new IllegalArgumentException("Element " + element + " not supported");
  }

  protected static JsonElement objectToElement(final Object object) {
    if (object == null) {
      return JsonNull.INSTANCE;
    } else if (object instanceof JsonElement jsonElement) {
      return jsonElement;
    } else if (object instanceof String string) {
      return new JsonPrimitive(string);
    } else if (object instanceof Number number) {
      return new JsonPrimitive(number);
    } else if (object instanceof Boolean boolean1) {
      return new JsonPrimitive(boolean1);
    } else if (object instanceof Character character) {
      return new JsonPrimitive(character);
    } else if (object instanceof JSONObject nObject) {
      return nObject.getInternal();
    } else if (object instanceof JSONArray array) {
      return array.getInternal();
    } else if (object instanceof Collection<?> collection) {
      return new JSONArray(collection).getInternal();
    } else if (object instanceof Object[] array) {
      return new JSONArray(array).getInternal();
    } else if (object instanceof Map<?, ?> map) {
      final JsonObject embedded = new JsonObject();
      for (Map.Entry<?, ?> entry : map.entrySet())
        embedded.add(String.valueOf(entry.getKey()), objectToElement(entry.getValue()));
      return embedded;
    } else if (object instanceof Enum<?> enumValue) {
      return new JsonPrimitive(enumValue.name());
    } else {
      throw new IllegalArgumentException("Object of type " + object.getClass() + " not supported");
    }
  }

  private JsonElement getElement(final String name) {
    if (name == null)
      throw new JSONException("Null key");

    final JsonElement value = object.get(name);
    if (value == null)
      throw new JSONException("JSONObject[" + name + "] not found");

    return value;
  }
}
