package io.intellixity.dbui.redis;

/** Transport-level failure (connection lost, timeout, rejected SELECT). Translated by the callers. */
public class RedisSessionException extends RuntimeException {
  public RedisSessionException(String message, Throwable cause) {
    super(message, cause);
  }

  public RedisSessionException(String message) {
    super(message);
  }
}
