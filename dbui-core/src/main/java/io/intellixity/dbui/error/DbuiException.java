package io.intellixity.dbui.error;

import java.util.Objects;

/**
 * Root of all failures raised by the connection/query layer.
 * <p>
 * The message is the human-readable diagnostic shown to users; {@link #kind()} is the structured category.
 */
public class DbuiException extends RuntimeException {
  private final ErrorKind kind;

  public DbuiException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public DbuiException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }
}
