/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named, single-kind sequence of values. {@code null} entries and {@code NaN} floats are missing
 * values.
 */
public record DatasetColumn(String name, ValueKind kind, List<Object> values) {

  public DatasetColumn {
    Objects.requireNonNull(name, "Column name cannot be null.");
    Objects.requireNonNull(kind, "Value kind cannot be null.");
    Objects.requireNonNull(values, "Column values cannot be null.");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Column name cannot be blank.");
    }
    for (final Object value : values) {
      if (!kind.accepts(value)) {
        throw new IllegalArgumentException(
            "Column '%s' holds %s values, got %s"
                .formatted(name, kind, value.getClass().getSimpleName()));
      }
    }
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static DatasetColumn of(String name, ValueKind kind, List<?> values) {
    return new DatasetColumn(name, kind, new ArrayList<>(values));
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }

  public List<Object> nonMissing() {
    return values.stream().filter(v -> !isMissing(v)).toList();
  }

  public static boolean isMissing(Object value) {
    return value == null || (value instanceof Double d && d.isNaN());
  }

  /** Text form used by serializers: dates as {@code YYYY-MM-DD}, missing values as "". */
  public String format(int index) {
    final Object value = values.get(index);
    return value == null ? "" : value.toString();
  }
}
