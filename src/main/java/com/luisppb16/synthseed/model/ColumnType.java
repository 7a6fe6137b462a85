/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ColumnType {
  INTEGER(ValueKind.INTEGER),
  FLOAT(ValueKind.FLOAT),
  CATEGORY(ValueKind.STRING),
  STRING(ValueKind.STRING),
  DATE(ValueKind.DATE),
  IDENTIFIER(ValueKind.INTEGER);

  private final ValueKind valueKind;
}
