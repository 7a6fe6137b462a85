/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import com.luisppb16.synthseed.error.SchemaException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable set of column declarations. Columns named {@code pid} or {@code id} are
 * normalized to {@link ColumnSpec.Identifier} whatever type they were declared with.
 */
public record Schema(List<ColumnSpec> columns) {

  public Schema {
    Objects.requireNonNull(columns, "The list of columns cannot be null.");
    if (columns.isEmpty()) {
      throw new SchemaException("A schema needs at least one column");
    }

    final Set<String> seen = new HashSet<>();
    final List<ColumnSpec> normalized = new ArrayList<>(columns.size());
    for (final ColumnSpec spec : columns) {
      Objects.requireNonNull(spec, "Column spec cannot be null.");
      if (!seen.add(spec.name().toLowerCase(Locale.ROOT))) {
        throw new SchemaException("Duplicate column name: " + spec.name());
      }
      normalized.add(
          ColumnRoles.isIdentifier(spec.name()) && !(spec instanceof ColumnSpec.Identifier)
              ? new ColumnSpec.Identifier(spec.name())
              : spec);
    }
    columns = List.copyOf(normalized);
  }

  public ColumnSpec column(String columnName) {
    return columns.stream()
        .filter(c -> c.name().equalsIgnoreCase(columnName))
        .findFirst()
        .orElse(null);
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnSpec::name).toList();
  }
}
