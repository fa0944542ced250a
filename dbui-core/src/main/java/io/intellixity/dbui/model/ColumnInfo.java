package io.intellixity.dbui.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ColumnInfo(@JsonProperty("name") String name,
                         @JsonProperty("data_type") String dataType,
                         @JsonProperty("is_nullable") boolean nullable,
                         @JsonProperty("column_default") String columnDefault,
                         @JsonProperty("is_primary_key") boolean primaryKey) {
}
