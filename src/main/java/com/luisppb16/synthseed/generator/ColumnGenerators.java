/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.model.ColumnSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import lombok.experimental.UtilityClass;

/** Selects the generator for each {@link ColumnSpec} variant. */
@UtilityClass
public class ColumnGenerators {

  private static final IntegerColumnGenerator INTEGER = new IntegerColumnGenerator();
  private static final DecimalColumnGenerator DECIMAL = new DecimalColumnGenerator();
  private static final CategoryColumnGenerator CATEGORY = new CategoryColumnGenerator();
  private static final TextColumnGenerator TEXT = new TextColumnGenerator();
  private static final DateColumnGenerator DATE = new DateColumnGenerator();
  private static final IdentifierColumnGenerator IDENTIFIER = new IdentifierColumnGenerator();

  public static List<Object> generate(
      final ColumnSpec spec, final int rowCount, final GeneratorContext context) {
    if (spec instanceof ColumnSpec.IntegerRange s) {
      return INTEGER.generate(s, rowCount, context);
    }
    if (spec instanceof ColumnSpec.DecimalRange s) {
      return DECIMAL.generate(s, rowCount, context);
    }
    if (spec instanceof ColumnSpec.Category s) {
      return CATEGORY.generate(s, rowCount, context);
    }
    if (spec instanceof ColumnSpec.Text s) {
      return TEXT.generate(s, rowCount, context);
    }
    if (spec instanceof ColumnSpec.DateRange s) {
      return DATE.generate(s, rowCount, context);
    }
    if (spec instanceof ColumnSpec.Identifier s) {
      return IDENTIFIER.generate(s, rowCount, context);
    }
    throw new IllegalStateException("No generator for " + spec.getClass().getSimpleName());
  }

  static List<Object> fill(final int rowCount, final Supplier<?> value) {
    final List<Object> values = new ArrayList<>(rowCount);
    for (int i = 0; i < rowCount; i++) {
      values.add(value.get());
    }
    return values;
  }
}
