/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.model.ColumnSpec;
import java.util.List;

final class DecimalColumnGenerator implements ColumnGenerator<ColumnSpec.DecimalRange> {

  @Override
  public List<Object> generate(
      final ColumnSpec.DecimalRange spec, final int rowCount, final GeneratorContext context) {
    return ColumnGenerators.fill(
        rowCount, () -> context.values().boundedDecimal(spec.min(), spec.max()));
  }
}
