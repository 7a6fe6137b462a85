/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import com.luisppb16.synthseed.error.SchemaException;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative description of one column to generate.
 *
 * <p>Each variant checks its own parameters in the compact constructor and throws {@link
 * SchemaException} when they are inconsistent, so a constructed spec can always be generated
 * without further validation.
 */
public sealed interface ColumnSpec {

  String name();

  ColumnType type();

  record IntegerRange(String name, long min, long max) implements ColumnSpec {
    public IntegerRange {
      name = requireName(name);
      if (min > max) {
        throw new SchemaException(
            "Column '" + name + "': min " + min + " is greater than max " + max);
      }
    }

    @Override
    public ColumnType type() {
      return ColumnType.INTEGER;
    }
  }

  record DecimalRange(String name, double min, double max) implements ColumnSpec {
    public DecimalRange {
      name = requireName(name);
      if (!Double.isFinite(min) || !Double.isFinite(max)) {
        throw new SchemaException("Column '" + name + "': float bounds must be finite");
      }
      if (min > max) {
        throw new SchemaException(
            "Column '" + name + "': min " + min + " is greater than max " + max);
      }
    }

    @Override
    public ColumnType type() {
      return ColumnType.FLOAT;
    }
  }

  record Category(String name, List<String> labels) implements ColumnSpec {
    public Category {
      name = requireName(name);
      Objects.requireNonNull(labels, "Labels cannot be null");
      final Set<String> unique = new LinkedHashSet<>();
      for (final String label : labels) {
        if (label != null && !label.isBlank()) {
          unique.add(label.strip());
        }
      }
      if (unique.isEmpty()) {
        throw new SchemaException("Column '" + name + "': category set cannot be empty");
      }
      labels = List.copyOf(unique);
    }

    @Override
    public ColumnType type() {
      return ColumnType.CATEGORY;
    }
  }

  record Text(String name, int length) implements ColumnSpec {
    public Text {
      name = requireName(name);
      if (length <= 0) {
        throw new SchemaException(
            "Column '" + name + "': string length must be positive, was " + length);
      }
    }

    @Override
    public ColumnType type() {
      return ColumnType.STRING;
    }
  }

  record DateRange(String name, LocalDate start, LocalDate end) implements ColumnSpec {
    public DateRange {
      name = requireName(name);
      if (start == null || end == null) {
        throw new SchemaException("Column '" + name + "': date range needs a start and an end");
      }
      if (start.isAfter(end)) {
        throw new SchemaException(
            "Column '" + name + "': start " + start + " is after end " + end);
      }
    }

    @Override
    public ColumnType type() {
      return ColumnType.DATE;
    }
  }

  /** Unique integer keys. Any declared range is irrelevant: values come from the allocator. */
  record Identifier(String name) implements ColumnSpec {
    public Identifier {
      name = requireName(name);
    }

    @Override
    public ColumnType type() {
      return ColumnType.IDENTIFIER;
    }
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new SchemaException("Column name cannot be empty");
    }
    return name.strip();
  }
}
