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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Tabular result of one statement: the column names and the rows as returned by the server. Cells are kept as plain Java
 * values (null, Boolean, Integer, Long, Double, String, List and Map) and converted only when read through a {@link Row}.
 * Tables are immutable and can be iterated many times.
 */
public class ResultTable {
  private static final ResultTable EMPTY = new ResultTable(List.of(), List.of());

  private final List<String>         columns;
  private final List<List<Object>>   rows;
  private final Map<String, Integer> columnIndex;

  public ResultTable(final List<String> columns, final List<List<Object>> rows) {
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));

    final List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> row : rows)
      copy.add(row != null ? Collections.unmodifiableList(new ArrayList<>(row)) : List.of());
    this.rows = Collections.unmodifiableList(copy);

    final Map<String, Integer> index = new HashMap<>(this.columns.size());
    for (int i = 0; i < this.columns.size(); i++)
      // WITH DUPLICATED NAMES THE FIRST COLUMN WINS
      index.putIfAbsent(this.columns.get(i), i);
    this.columnIndex = Collections.unmodifiableMap(index);
  }

  public static ResultTable empty() {
    return EMPTY;
  }

  public List<String> getColumns() {
    return columns;
  }

  /**
   * @return the position of the column, or -1 if the table has no column with that name
   */
  public int columnIndex(final String column) {
    final Integer i = columnIndex.get(column);
    return i != null ? i : -1;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public Row getRow(final int index) {
    if (index < 0 || index >= rows.size())
      throw new IndexOutOfBoundsException("Row " + index + " out of range, the result has " + rows.size() + " rows");
    return new Row(this, rows.get(index));
  }

  /**
   * Returns the rows of the table. Every call to {@link Iterable#iterator()} starts again from the first row.
   */
  public Iterable<Row> rows() {
    return () -> new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < rows.size();
      }

      @Override
      public Row next() {
        if (!hasNext())
          throw new NoSuchElementException();
        return new Row(ResultTable.this, rows.get(next++));
      }
    };
  }

  public Stream<Row> stream() {
    return StreamSupport.stream(rows().spliterator(), false);
  }

  /**
   * Returns the raw cells, row by row.
   */
  public List<List<Object>> getData() {
    return rows;
  }

  @Override
  public String toString() {
    return "ResultTable{columns=" + columns + ", rows=" + rows.size() + "}";
  }
}
