package io.intellixity.dbui.error;

public final class ConnectionNotFoundException extends DbuiException {
  private final String connectionId;

  public ConnectionNotFoundException(String connectionId, String message) {
    super(ErrorKind.CONNECTION_NOT_FOUND, message);
    this.connectionId = connectionId;
  }

  /** Lookup of an id that is absent (never connected, disconnected, or mid-switch). */
  public static ConnectionNotFoundException notConnected(String connectionId) {
    return new ConnectionNotFoundException(connectionId, "Connection '" + connectionId + "' not found or not connected");
  }

  /** Removal of an id that was not registered. */
  public static ConnectionNotFoundException notRegistered(String connectionId) {
    return new ConnectionNotFoundException(connectionId, "Connection '" + connectionId + "' not found");
  }

  public String connectionId() {
    return connectionId;
  }
}
