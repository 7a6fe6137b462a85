/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.error;

public class AugmentationException extends SynthSeedException {

  public AugmentationException(String message) {
    super(message);
  }

  public AugmentationException(String message, Throwable cause) {
    super(message, cause);
  }
}
