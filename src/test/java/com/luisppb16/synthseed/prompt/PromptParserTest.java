/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.prompt;

import static org.assertj.core.api.Assertions.*;

import com.luisppb16.synthseed.error.PromptSyntaxException;
import com.luisppb16.synthseed.error.SchemaException;
import com.luisppb16.synthseed.model.ColumnSpec;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PromptParserTest {

  private final PromptParser parser = new PromptParser();

  @Test
  void parsesRowCountAndColumns() {
    ParsedPrompt parsed = parser.parse("5 rows, columns: age int 20-50, gender category M/F");

    assertThat(parsed.rowCount()).isEqualTo(5);
    assertThat(parsed.schema().columns())
        .containsExactly(
            new ColumnSpec.IntegerRange("age", 20, 50),
            new ColumnSpec.Category("gender", List.of("M", "F")));
  }

  @Test
  void parsesEveryColumnType() {
    ParsedPrompt parsed =
        parser.parse(
            "Generate 12 rows, columns: Salary float 1000.5-5000, "
                + "doj date 2020-01-01:2023-12-31, nickname string 12, code string, "
                + "dept category hr/it");

    assertThat(parsed.rowCount()).isEqualTo(12);
    assertThat(parsed.schema().columns())
        .containsExactly(
            new ColumnSpec.DecimalRange("salary", 1000.5, 5000.0),
            new ColumnSpec.DateRange("doj", LocalDate.of(2020, 1, 1), LocalDate.of(2023, 12, 31)),
            new ColumnSpec.Text("nickname", 12),
            new ColumnSpec.Text("code", 8),
            new ColumnSpec.Category("dept", List.of("HR", "IT")));
  }

  @Test
  void digitsBeforeMarkerAreConcatenated() {
    assertThat(parser.parse("1,000 rows, columns: x int 1-2").rowCount()).isEqualTo(1000);
  }

  @Test
  void acceptsNegativeRanges() {
    ParsedPrompt parsed = parser.parse("3 rows, columns: delta int -5-5, temp float -10.5--2");
    assertThat(parsed.schema().columns())
        .containsExactly(
            new ColumnSpec.IntegerRange("delta", -5, 5),
            new ColumnSpec.DecimalRange("temp", -10.5, -2.0));
  }

  @Test
  void pidColumnBecomesIdentifier() {
    ParsedPrompt parsed = parser.parse("2 rows, columns: pid int 1-9, name string");
    assertThat(parsed.schema().columns().get(0)).isInstanceOf(ColumnSpec.Identifier.class);
  }

  @Test
  void customDefaultStringLength() {
    ParsedPrompt parsed = new PromptParser(4).parse("2 rows, columns: code string");
    assertThat(parsed.schema().columns()).containsExactly(new ColumnSpec.Text("code", 4));
  }

  @Test
  void missingRangeNamesTheDefinition() {
    assertThatThrownBy(() -> parser.parse("5 rows, columns: age int"))
        .isInstanceOfSatisfying(
            PromptSyntaxException.class,
            e -> {
              assertThat(e.offendingFragment()).isEqualTo("age int");
              assertThat(e.reason()).contains("age");
            });
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "5 rows, age int 1-2",
        "5 rows, columns: a int 1-2, columns: b int 1-2",
        "rows, columns: a int 1-2",
        "0 rows, columns: a int 1-2",
        "99999999999 rows, columns: a int 1-2",
        "5 rows, columns: a",
        "5 rows, columns: a int 1-2,",
        "5 rows, columns: a blob 1-2",
        "5 rows, columns: a int 1to2",
        "5 rows, columns: a int 1.5-3",
        "5 rows, columns: a category /",
        "5 rows, columns: a date 2020-01-01",
        "5 rows, columns: a string long",
        "   "
      })
  void rejectsMalformedPrompts(String prompt) {
    assertThatThrownBy(() -> parser.parse(prompt)).isInstanceOf(PromptSyntaxException.class);
  }

  @Test
  void rejectsNullPrompt() {
    assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(PromptSyntaxException.class);
  }

  @Test
  void unsupportedTypeIsReported() {
    assertThatThrownBy(() -> parser.parse("5 rows, columns: a blob"))
        .isInstanceOf(PromptSyntaxException.class)
        .hasMessageContaining("Unsupported type blob");
  }

  @Test
  void invertedRangeKeepsSchemaCause() {
    assertThatThrownBy(() -> parser.parse("5 rows, columns: age int 50-20"))
        .isInstanceOfSatisfying(
            PromptSyntaxException.class,
            e -> assertThat(e.offendingFragment()).isEqualTo("age int 50-20"))
        .hasCauseInstanceOf(SchemaException.class);
  }

  @Test
  void invalidCalendarDateKeepsParseCause() {
    assertThatThrownBy(() -> parser.parse("5 rows, columns: d date 2020-13-01:2021-01-01"))
        .isInstanceOf(PromptSyntaxException.class)
        .hasCauseInstanceOf(DateTimeException.class);
  }

  @Test
  void duplicateColumnsReportTheColumnsSection() {
    assertThatThrownBy(() -> parser.parse("2 rows, columns: a int 1-2, A float 1-2"))
        .isInstanceOfSatisfying(
            PromptSyntaxException.class,
            e -> assertThat(e.offendingFragment()).isEqualTo("a int 1-2, a float 1-2"))
        .hasCauseInstanceOf(SchemaException.class);
  }
}
