/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.provider.RealisticValueProvider;
import java.util.Objects;

/** Collaborators every column generator draws from. */
public record GeneratorContext(
    ValueGenerator values,
    RealisticValueProvider provider,
    IdentifierAllocator identifiers,
    SemanticRules rules) {

  public GeneratorContext {
    Objects.requireNonNull(values, "Value generator cannot be null");
    Objects.requireNonNull(provider, "Value provider cannot be null");
    Objects.requireNonNull(identifiers, "Identifier allocator cannot be null");
    Objects.requireNonNull(rules, "Semantic rules cannot be null");
  }
}
