package io.intellixity.dbui.error;

/** Statement or introspection failure reported by the backend. */
public final class QueryExecutionException extends DbuiException {
  public QueryExecutionException(String message) {
    super(ErrorKind.QUERY_FAILED, message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(ErrorKind.QUERY_FAILED, message, cause);
  }
}
