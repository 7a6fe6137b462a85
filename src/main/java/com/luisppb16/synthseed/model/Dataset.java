/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Realized tabular data: named columns of equal length, in schema order. Row {@code i} of every
 * column describes the same synthetic entity.
 */
public record Dataset(List<DatasetColumn> columns) {

  public Dataset {
    Objects.requireNonNull(columns, "The list of columns cannot be null.");
    columns = List.copyOf(columns);

    final Set<String> seen = new HashSet<>();
    for (final DatasetColumn column : columns) {
      if (!seen.add(column.name().toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException("Duplicate column name: " + column.name());
      }
      if (column.size() != columns.get(0).size()) {
        throw new IllegalArgumentException(
            "Column '%s' has %d rows, expected %d"
                .formatted(column.name(), column.size(), columns.get(0).size()));
      }
    }
  }

  public static Dataset of(DatasetColumn... columns) {
    return new Dataset(List.of(columns));
  }

  public int rowCount() {
    return columns.isEmpty() ? 0 : columns.get(0).size();
  }

  public List<String> columnNames() {
    return columns.stream().map(DatasetColumn::name).toList();
  }

  public DatasetColumn column(String columnName) {
    return columns.stream()
        .filter(c -> c.name().equalsIgnoreCase(columnName))
        .findFirst()
        .orElse(null);
  }

  public Row row(int index) {
    Objects.checkIndex(index, rowCount());
    final Map<String, Object> values = new LinkedHashMap<>();
    columns.forEach(c -> values.put(c.name(), c.get(index)));
    return new Row(values);
  }

  public List<Row> rows() {
    return IntStream.range(0, rowCount()).mapToObj(this::row).toList();
  }
}
