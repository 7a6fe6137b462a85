/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.experimental.UtilityClass;

/**
 * Name-based column roles shared by schema generation and dataset augmentation.
 *
 * <p>Column names double as type hints: {@code pid}/{@code id} mark identifier columns, any name
 * containing {@code email} marks an email column, and the first other column containing {@code
 * name} is the source the emails are derived from.
 */
@UtilityClass
public class ColumnRoles {

  private static final List<String> IDENTIFIER_NAMES = List.of("pid", "id");
  private static final String EMAIL_FRAGMENT = "email";
  private static final String NAME_FRAGMENT = "name";

  public static boolean isIdentifier(String columnName) {
    return IDENTIFIER_NAMES.contains(lower(columnName));
  }

  public static boolean isEmail(String columnName) {
    return lower(columnName).contains(EMAIL_FRAGMENT);
  }

  public static List<String> emailColumns(List<String> columnNames) {
    return columnNames.stream().filter(ColumnRoles::isEmail).toList();
  }

  public static Optional<String> nameSource(List<String> columnNames) {
    return columnNames.stream()
        .filter(n -> !isEmail(n))
        .filter(n -> lower(n).contains(NAME_FRAGMENT))
        .findFirst();
  }

  private static String lower(String columnName) {
    return columnName.toLowerCase(Locale.ROOT);
  }
}
