/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.prompt;

import com.luisppb16.synthseed.config.GenerationConfig;
import com.luisppb16.synthseed.error.PromptSyntaxException;
import com.luisppb16.synthseed.error.SchemaException;
import com.luisppb16.synthseed.model.ColumnSpec;
import com.luisppb16.synthseed.model.Schema;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses one-line generation prompts such as
 *
 * <pre>
 * 5 rows, columns: age int 20-50, gender category M/F, salary float 1000-5000,
 *   doj date 2020-01-01:2023-12-31, nickname string 12
 * </pre>
 *
 * <p>The prompt is lower-cased before tokenizing, so column names come out lower case while
 * category labels are upper-cased after extraction. The digits found before {@code columns:} are
 * concatenated into the row count. Any malformed column definition fails the whole parse with a
 * {@link PromptSyntaxException} naming that definition; partial schemas are never returned.
 */
public final class PromptParser {

  private static final String COLUMNS_MARKER = "columns:";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern RANGE =
      Pattern.compile("^(-?\\d+(?:\\.\\d+)?)-(-?\\d+(?:\\.\\d+)?)$");
  private static final Pattern WHOLE_NUMBER = Pattern.compile("-?\\d+");

  private final int defaultStringLength;

  public PromptParser() {
    this(GenerationConfig.DEFAULT_STRING_LENGTH);
  }

  public PromptParser(final int defaultStringLength) {
    if (defaultStringLength <= 0) {
      throw new IllegalArgumentException("Default string length must be positive");
    }
    this.defaultStringLength = defaultStringLength;
  }

  public ParsedPrompt parse(final String text) {
    if (text == null || text.isBlank()) {
      throw new PromptSyntaxException("Prompt is empty", "");
    }
    final String prompt = text.strip().toLowerCase(Locale.ROOT);

    final int marker = prompt.indexOf(COLUMNS_MARKER);
    if (marker < 0 || prompt.indexOf(COLUMNS_MARKER, marker + 1) >= 0) {
      throw new PromptSyntaxException(
          "Prompt must contain exactly one '" + COLUMNS_MARKER + "' section", prompt);
    }

    final int rowCount = parseRowCount(prompt.substring(0, marker).strip());
    final String columnsPart = prompt.substring(marker + COLUMNS_MARKER.length()).strip();

    final List<ColumnSpec> specs = new ArrayList<>();
    for (final String definition : columnsPart.split(",", -1)) {
      specs.add(parseColumn(definition.strip()));
    }

    try {
      return new ParsedPrompt(new Schema(specs), rowCount);
    } catch (final SchemaException e) {
      throw new PromptSyntaxException(e.getMessage(), columnsPart, e);
    }
  }

  private static int parseRowCount(final String part) {
    final StringBuilder digits = new StringBuilder();
    part.chars().filter(c -> c >= '0' && c <= '9').forEach(c -> digits.append((char) c));
    if (digits.length() == 0) {
      throw new PromptSyntaxException("Row count is missing", part);
    }
    final int rowCount;
    try {
      rowCount = Integer.parseInt(digits.toString());
    } catch (final NumberFormatException e) {
      throw new PromptSyntaxException("Row count is out of range", part, e);
    }
    if (rowCount < 1) {
      throw new PromptSyntaxException("Row count must be positive", part);
    }
    return rowCount;
  }

  private ColumnSpec parseColumn(final String definition) {
    final String[] tokens =
        definition.isEmpty() ? new String[0] : WHITESPACE.split(definition);
    if (tokens.length < 2) {
      throw new PromptSyntaxException("Invalid column definition", definition);
    }
    final String name = tokens[0];
    final String type = tokens[1];

    try {
      return switch (type) {
        case "int" -> integerColumn(
            name, argument(tokens, definition, "Missing range for numeric column " + name),
            definition);
        case "float" -> decimalColumn(
            name, argument(tokens, definition, "Missing range for numeric column " + name),
            definition);
        case "category" -> categoryColumn(
            name, argument(tokens, definition, "Missing categories for " + name), definition);
        case "date" -> dateColumn(
            name, argument(tokens, definition, "Missing date range for " + name), definition);
        case "string" -> textColumn(name, tokens, definition);
        default -> throw new PromptSyntaxException("Unsupported type " + type, definition);
      };
    } catch (final SchemaException e) {
      throw new PromptSyntaxException(e.getMessage(), definition, e);
    }
  }

  private static String argument(
      final String[] tokens, final String definition, final String missingReason) {
    if (tokens.length < 3) {
      throw new PromptSyntaxException(missingReason, definition);
    }
    return tokens[2];
  }

  private static ColumnSpec integerColumn(
      final String name, final String range, final String definition) {
    final Matcher m = rangeOf(name, range, definition);
    if (!WHOLE_NUMBER.matcher(m.group(1)).matches()
        || !WHOLE_NUMBER.matcher(m.group(2)).matches()) {
      throw new PromptSyntaxException(
          "Integer range for " + name + " must use whole numbers", definition);
    }
    try {
      return new ColumnSpec.IntegerRange(
          name, Long.parseLong(m.group(1)), Long.parseLong(m.group(2)));
    } catch (final NumberFormatException e) {
      throw new PromptSyntaxException("Unparsable numeric range for " + name, definition, e);
    }
  }

  private static ColumnSpec decimalColumn(
      final String name, final String range, final String definition) {
    final Matcher m = rangeOf(name, range, definition);
    return new ColumnSpec.DecimalRange(
        name, Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)));
  }

  private static Matcher rangeOf(final String name, final String range, final String definition) {
    final Matcher m = RANGE.matcher(range);
    if (!m.matches()) {
      throw new PromptSyntaxException(
          "Invalid range format for " + name + ", expected min-max", definition);
    }
    return m;
  }

  private static ColumnSpec categoryColumn(
      final String name, final String labels, final String definition) {
    final List<String> parsed =
        Arrays.stream(labels.split("/"))
            .map(String::strip)
            .filter(l -> !l.isEmpty())
            .map(l -> l.toUpperCase(Locale.ROOT))
            .toList();
    if (parsed.isEmpty()) {
      throw new PromptSyntaxException("No categories given for " + name, definition);
    }
    return new ColumnSpec.Category(name, parsed);
  }

  private static ColumnSpec dateColumn(
      final String name, final String range, final String definition) {
    final String[] bounds = range.split(":", -1);
    if (bounds.length != 2) {
      throw new PromptSyntaxException(
          "Invalid date range format for " + name + ", expected start:end", definition);
    }
    try {
      return new ColumnSpec.DateRange(name, LocalDate.parse(bounds[0]), LocalDate.parse(bounds[1]));
    } catch (final DateTimeParseException e) {
      throw new PromptSyntaxException(
          "Invalid date for " + name + ", expected YYYY-MM-DD", definition, e);
    }
  }

  private ColumnSpec textColumn(final String name, final String[] tokens, final String definition) {
    if (tokens.length < 3) {
      return new ColumnSpec.Text(name, defaultStringLength);
    }
    try {
      return new ColumnSpec.Text(name, Integer.parseInt(tokens[2]));
    } catch (final NumberFormatException e) {
      throw new PromptSyntaxException("Invalid string length for " + name, definition, e);
    }
  }
}
