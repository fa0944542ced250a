package io.intellixity.dbui.error;

/** Failure taxonomy; each {@link DbuiException} carries exactly one kind. */
public enum ErrorKind {
  /** The connection id is not (or no longer) in the registry. */
  CONNECTION_NOT_FOUND,
  /** Handshake or authentication with the backend failed. */
  CONNECT_FAILED,
  /** The backend rejected or failed a statement. Never retried. */
  QUERY_FAILED,
  /** The operation has no meaning for the backend. */
  UNSUPPORTED_OPERATION,
  /** Caller supplied malformed input (connection URL, database index, ...). */
  INVALID_ARGUMENT
}
