package io.intellixity.dbui.error;

/** Backend handshake/authentication failure. Carries the driver's diagnostic text. */
public final class ConnectFailedException extends DbuiException {
  public ConnectFailedException(String message) {
    super(ErrorKind.CONNECT_FAILED, message);
  }

  public ConnectFailedException(String message, Throwable cause) {
    super(ErrorKind.CONNECT_FAILED, message, cause);
  }
}
