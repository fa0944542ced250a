package io.intellixity.dbui.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FunctionInfo(@JsonProperty("name") String name,
                           @JsonProperty("definition") String definition,
                           @JsonProperty("return_type") String returnType,
                           @JsonProperty("language") String language) {
}
