/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import com.luisppb16.synthseed.provider.RealisticValueProvider;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;

/** Kind of realistic value a {@link RealisticValueProvider} can produce. */
@RequiredArgsConstructor
public enum Capability {
  NAME(RealisticValueProvider::name),
  CITY(RealisticValueProvider::city),
  PHONE(RealisticValueProvider::phone),
  WORD(RealisticValueProvider::word);

  private final Function<RealisticValueProvider, String> source;

  public String draw(RealisticValueProvider provider) {
    return source.apply(provider);
  }
}
