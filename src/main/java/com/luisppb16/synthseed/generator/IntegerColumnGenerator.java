/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.model.ColumnSpec;
import java.util.List;

final class IntegerColumnGenerator implements ColumnGenerator<ColumnSpec.IntegerRange> {

  @Override
  public List<Object> generate(
      final ColumnSpec.IntegerRange spec, final int rowCount, final GeneratorContext context) {
    return ColumnGenerators.fill(
        rowCount, () -> context.values().boundedLong(spec.min(), spec.max()));
  }
}
