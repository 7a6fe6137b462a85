/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.model.ColumnSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class IdentifierColumnGenerator implements ColumnGenerator<ColumnSpec.Identifier> {

  @Override
  public List<Object> generate(
      final ColumnSpec.Identifier spec, final int rowCount, final GeneratorContext context) {
    return new ArrayList<>(context.identifiers().allocate(rowCount, Set.of()));
  }
}
