package io.intellixity.dbui.registry.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Outcome of one boundary call: a value, or the human-readable diagnostic of the failure. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"ok", "value", "error"})
public record CommandResult<T>(@JsonProperty("ok") boolean ok,
                               @JsonProperty("value") T value,
                               @JsonProperty("error") String error) {
  public CommandResult {
    if (ok && error != null) throw new IllegalArgumentException("successful result carries an error");
    if (!ok && (error == null || error.isEmpty())) throw new IllegalArgumentException("failed result needs an error");
  }

  public static <T> CommandResult<T> success(T value) {
    return new CommandResult<>(true, value, null);
  }

  public static <T> CommandResult<T> failure(String error) {
    return new CommandResult<>(false, null, error);
  }
}
