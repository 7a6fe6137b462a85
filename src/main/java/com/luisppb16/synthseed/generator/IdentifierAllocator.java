/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Hands out integer identifiers that collide neither with each other nor with identifiers
 * already present in a dataset.
 */
public final class IdentifierAllocator {

  private final long base;

  public IdentifierAllocator(final long base) {
    this.base = base;
  }

  /**
   * Allocates {@code n} identifiers, increasing from {@code max(existing) + 1}, or from the base
   * value when {@code existing} is empty, skipping every value already in {@code existing}.
   *
   * @throws ArithmeticException if the allocation would run past {@link Long#MAX_VALUE}
   */
  public List<Long> allocate(final int n, final Set<Long> existing) {
    if (n < 0) {
      throw new IllegalArgumentException("Identifier count cannot be negative: " + n);
    }
    Objects.requireNonNull(existing, "Existing identifiers cannot be null");

    final List<Long> ids = new ArrayList<>(n);
    long current = existing.isEmpty() ? base : Math.addExact(Collections.max(existing), 1L);
    while (ids.size() < n) {
      if (!existing.contains(current)) {
        ids.add(current);
      }
      current = Math.addExact(current, 1L);
    }
    return ids;
  }
}
