package io.intellixity.dbui.registry.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.dbui.model.QueryResult;

import java.util.Objects;

/** Query result plus wall-clock execution time. */
public record QueryExecution(@JsonProperty("result") QueryResult result,
                             @JsonProperty("elapsed_ms") long elapsedMs) {
  public QueryExecution {
    Objects.requireNonNull(result, "result");
    if (elapsedMs < 0) throw new IllegalArgumentException("elapsedMs must be >= 0");
  }
}
