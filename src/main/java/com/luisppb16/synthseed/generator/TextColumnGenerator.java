/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.model.ColumnSpec;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-length alphanumeric strings, unless a {@link SemanticRules semantic rule} recognizes the
 * column name, in which case the provider supplies the values and the length is ignored.
 */
final class TextColumnGenerator implements ColumnGenerator<ColumnSpec.Text> {

  @Override
  public List<Object> generate(
      final ColumnSpec.Text spec, final int rowCount, final GeneratorContext context) {
    final Optional<Capability> capability = context.rules().match(spec.name());
    if (capability.isPresent()) {
      return ColumnGenerators.fill(rowCount, () -> capability.get().draw(context.provider()));
    }
    return ColumnGenerators.fill(rowCount, () -> context.values().alphanumeric(spec.length()));
  }
}
