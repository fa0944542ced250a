package io.intellixity.dbui.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Key constraint snapshot.\n
 *
 * {@code foreignTable}/{@code foreignColumns} are only set for foreign keys.\n
 */
public record ConstraintInfo(@JsonProperty("name") String name,
                             @JsonProperty("constraint_type") String constraintType,
                             @JsonProperty("columns") List<String> columns,
                             @JsonProperty("foreign_table") String foreignTable,
                             @JsonProperty("foreign_columns") List<String> foreignColumns) {
  public static final String PRIMARY_KEY = "PRIMARY KEY";
  public static final String FOREIGN_KEY = "FOREIGN KEY";

  public ConstraintInfo {
    columns = columns == null ? List.of() : List.copyOf(columns);
    foreignColumns = foreignColumns == null ? null : List.copyOf(foreignColumns);
  }
}
