/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.model.ColumnSpec;
import java.util.List;

/** Uniform draw with replacement from the label set. */
final class CategoryColumnGenerator implements ColumnGenerator<ColumnSpec.Category> {

  @Override
  public List<Object> generate(
      final ColumnSpec.Category spec, final int rowCount, final GeneratorContext context) {
    return ColumnGenerators.fill(rowCount, () -> context.values().pickRandom(spec.labels()));
  }
}
