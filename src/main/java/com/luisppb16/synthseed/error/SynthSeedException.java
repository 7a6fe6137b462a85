/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.error;

/** Base type of every failure raised at the boundary of a generation, augmentation or parse call. */
public class SynthSeedException extends RuntimeException {

  public SynthSeedException(String message) {
    super(message);
  }

  public SynthSeedException(String message, Throwable cause) {
    super(message, cause);
  }
}
