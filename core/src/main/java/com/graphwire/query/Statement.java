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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cypher statement with its named parameters. Statements are immutable: use {@link #builder(String)} to bind many parameters,
 * or {@link #withParam(String, Object)} to derive a new statement from an existing one.
 * <p>
 * Parameter names are not validated against the statement text, the server reports unknown or missing parameters.
 *
 * <pre>{@code
 * Statement s = Statement.builder("MATCH (n:Person) WHERE n.name = $name RETURN n")
 *     .withParam("name", "Alice")
 *     .build();
 * }</pre>
 */
public final class Statement {
  private final String                      text;
  private final Map<String, ParameterValue> params;

  public Statement(final String text) {
    this(text, Map.of());
  }

  public Statement(final String text, final Map<String, ParameterValue> params) {
    if (text == null)
      throw new IllegalArgumentException("Statement text is null");
    this.text = text;
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public static Statement of(final String text) {
    return new Statement(text);
  }

  public static Statement from(final String text) {
    return new Statement(text);
  }

  public static Builder builder(final String text) {
    return new Builder(text);
  }

  public String getText() {
    return text;
  }

  public Map<String, ParameterValue> getParams() {
    return params;
  }

  /**
   * @return the value bound to the parameter, or null if the parameter is not bound
   */
  public ParameterValue getParam(final String name) {
    return params.get(name);
  }

  public boolean hasParams() {
    return !params.isEmpty();
  }

  /**
   * Returns a new statement with the parameter bound, this statement is not changed.
   */
  public Statement withParam(final String name, final Object value) {
    return new Builder(this).withParam(name, value).build();
  }

  public Statement withParam(final String name, final ParameterValue value) {
    return new Builder(this).withParam(name, value).build();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Statement))
      return false;
    final Statement that = (Statement) o;
    return text.equals(that.text) && params.equals(that.params);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, params);
  }

  @Override
  public String toString() {
    return params.isEmpty() ? text : text + " " + params;
  }

  /**
   * Collects parameters for a statement. A parameter bound twice keeps the last value. The builder can be reused after
   * {@link #build()}: statements already built are not affected.
   */
  public static final class Builder {
    private final String                      text;
    private final Map<String, ParameterValue> params = new LinkedHashMap<>();

    private Builder(final String text) {
      if (text == null)
        throw new IllegalArgumentException("Statement text is null");
      this.text = text;
    }

    private Builder(final Statement statement) {
      this.text = statement.text;
      this.params.putAll(statement.params);
    }

    public Builder withParam(final String name, final ParameterValue value) {
      if (name == null)
        throw new IllegalArgumentException("Parameter name is null");
      params.put(name, value != null ? value : ParameterValue.nullValue());
      return this;
    }

    public Builder withParam(final String name, final String value) {
      return withParam(name, ParameterValue.of(value));
    }

    public Builder withParam(final String name, final boolean value) {
      return withParam(name, ParameterValue.of(value));
    }

    public Builder withParam(final String name, final int value) {
      return withParam(name, ParameterValue.of(value));
    }

    public Builder withParam(final String name, final long value) {
      return withParam(name, ParameterValue.of(value));
    }

    public Builder withParam(final String name, final double value) {
      return withParam(name, ParameterValue.of(value));
    }

    public Builder withParam(final String name, final List<ParameterValue> value) {
      return withParam(name, ParameterValue.list(value));
    }

    public Builder withParam(final String name, final Map<String, ParameterValue> value) {
      return withParam(name, ParameterValue.map(value));
    }

    /**
     * Binds any value accepted by {@link ParameterValue#from(Object)}.
     *
     * @throws IllegalArgumentException if the value type is not supported
     */
    public Builder withParam(final String name, final Object value) {
      return withParam(name, ParameterValue.from(value));
    }

    /**
     * Binds all the entries of the map, values are converted with {@link ParameterValue#from(Object)}.
     */
    public Builder withParams(final Map<String, ?> values) {
      for (Map.Entry<String, ?> entry : values.entrySet())
        withParam(entry.getKey(), ParameterValue.from(entry.getValue()));
      return this;
    }

    public Statement build() {
      return new Statement(text, params);
    }
  }
}
