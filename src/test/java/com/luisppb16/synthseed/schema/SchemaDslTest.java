/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.schema;

import static com.luisppb16.synthseed.schema.SchemaDsl.*;
import static org.assertj.core.api.Assertions.*;

import com.luisppb16.synthseed.error.SchemaException;
import com.luisppb16.synthseed.model.ColumnSpec;
import com.luisppb16.synthseed.model.ColumnType;
import com.luisppb16.synthseed.model.Schema;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.Test;

class SchemaDslTest {

  @Test
  void buildsSchemaInDeclarationOrder() {
    Schema schema =
        schema(
            identifier("pid"),
            text("name", 12),
            decimal("salary", 1000, 5000),
            category("gender", "M", "F"),
            date("doj", "2020-01-01", "2023-12-31"));

    assertThat(schema.columnNames()).containsExactly("pid", "name", "salary", "gender", "doj");
    assertThat(schema.column("DOJ"))
        .isEqualTo(
            new ColumnSpec.DateRange("doj", LocalDate.of(2020, 1, 1), LocalDate.of(2023, 12, 31)));
    assertThat(schema.column("salary").type()).isEqualTo(ColumnType.FLOAT);
  }

  @Test
  void unparsableDateKeepsCause() {
    assertThatThrownBy(() -> date("doj", "2020-02-30", "2021-01-01"))
        .isInstanceOf(SchemaException.class)
        .hasCauseInstanceOf(DateTimeParseException.class);
  }

  @Test
  void invalidColumnsFailAtDeclaration() {
    assertThatThrownBy(() -> integer("age", 50, 20)).isInstanceOf(SchemaException.class);
    assertThatThrownBy(() -> category("gender")).isInstanceOf(SchemaException.class);
    assertThatThrownBy(() -> text("code", 0)).isInstanceOf(SchemaException.class);
    assertThatThrownBy(() -> schema()).isInstanceOf(SchemaException.class);
  }
}
