package io.intellixity.dbui.error;

import io.intellixity.dbui.conn.BackendKind;

/** Raised when an operation is inapplicable to a backend (as opposed to merely returning nothing). */
public final class UnsupportedBackendOperationException extends DbuiException {
  private final BackendKind backend;

  public UnsupportedBackendOperationException(BackendKind backend, String message) {
    super(ErrorKind.UNSUPPORTED_OPERATION, message);
    this.backend = backend;
  }

  public BackendKind backend() {
    return backend;
  }
}
