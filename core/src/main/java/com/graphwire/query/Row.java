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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * View over one row of a {@link ResultTable}. Values can be read by column name or by position, either raw or converted to the
 * requested type with the strict rules of {@link TypeConverter}.
 *
 * <pre>{@code
 * for (Row row : result.rows()) {
 *   String name = row.get("name", String.class);
 *   int age = row.get("age", int.class);
 * }
 * }</pre>
 */
public class Row {
  private final ResultTable  table;
  private final List<Object> cells;

  Row(final ResultTable table, final List<Object> cells) {
    this.table = table;
    this.cells = cells;
  }

  public List<String> getColumns() {
    return table.getColumns();
  }

  public int size() {
    return Math.max(table.getColumns().size(), cells.size());
  }

  public boolean has(final String column) {
    return table.columnIndex(column) > -1;
  }

  /**
   * Returns the raw value of the column.
   *
   * @throws TypeCoercionException with code {@link ErrorCode#UNKNOWN_COLUMN} if the result has no such column
   */
  public Object get(final String column) {
    return cell(indexOf(column));
  }

  public Object get(final int index) {
    checkIndex(index);
    return cell(index);
  }

  public <T> T get(final String column, final Class<T> type) {
    return TypeConverter.convert(get(column), type, "column '" + column + "'");
  }

  public <T> T get(final int index, final Class<T> type) {
    return TypeConverter.convert(get(index), type, "column " + index);
  }

  public String getString(final String column) {
    return get(column, String.class);
  }

  public Boolean getBoolean(final String column) {
    return get(column, Boolean.class);
  }

  public Integer getInteger(final String column) {
    return get(column, Integer.class);
  }

  public Long getLong(final String column) {
    return get(column, Long.class);
  }

  public Double getDouble(final String column) {
    return get(column, Double.class);
  }

  @SuppressWarnings("unchecked")
  public List<Object> getList(final String column) {
    return get(column, List.class);
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> getMap(final String column) {
    return get(column, Map.class);
  }

  /**
   * Returns the row as an ordered map of column names to raw values.
   */
  public Map<String, Object> toMap() {
    final List<String> columns = table.getColumns();
    final Map<String, Object> map = new LinkedHashMap<>(columns.size());
    for (int i = 0; i < columns.size(); i++)
      map.putIfAbsent(columns.get(i), cell(i));
    return map;
  }

  private int indexOf(final String column) {
    final int index = table.columnIndex(column);
    if (index < 0)
      throw new TypeCoercionException(ErrorCode.UNKNOWN_COLUMN, "Column '" + column + "' not found").addContext("columns",
          table.getColumns());
    return index;
  }

  private void checkIndex(final int index) {
    if (index < 0 || index >= size())
      throw new TypeCoercionException(ErrorCode.COLUMN_INDEX_OUT_OF_RANGE,
          "Column index " + index + " out of range, the row has " + size() + " columns");
  }

  private Object cell(final int index) {
    // THE SERVER CAN RETURN SHORTER ROWS: MISSING CELLS ARE NULL
    return index < cells.size() ? cells.get(index) : null;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }
}
