package io.intellixity.dbui.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Index snapshot; {@link #columns()} is in index key order. */
public record IndexInfo(@JsonProperty("name") String name,
                        @JsonProperty("columns") List<String> columns,
                        @JsonProperty("is_unique") boolean unique,
                        @JsonProperty("is_primary") boolean primary) {
  public IndexInfo {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }
}
