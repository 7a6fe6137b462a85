/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.model.ColumnSpec;
import java.util.List;

/**
 * Produces a whole column for one {@link ColumnSpec} variant. Implementations never fail for a
 * constructed spec: parameters were already checked when the spec was built.
 */
@FunctionalInterface
public interface ColumnGenerator<S extends ColumnSpec> {

  List<Object> generate(S spec, int rowCount, GeneratorContext context);
}
