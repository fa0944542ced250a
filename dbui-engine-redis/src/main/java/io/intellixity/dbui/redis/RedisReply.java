package io.intellixity.dbui.redis;

import java.util.List;
import java.util.Objects;

/**
 * Decoded server reply, independent of the client library.\n
 *
 * RESP2 only produces Nil, Int, Bulk, Status, Error and Array. The remaining cases exist for RESP3 servers.\n
 */
public interface RedisReply {
  record Nil() implements RedisReply {}

  record Int(long value) implements RedisReply {}

  record Bulk(String value) implements RedisReply {
    public Bulk { Objects.requireNonNull(value, "value"); }
  }

  /** Simple-string acknowledgement such as {@code OK} or {@code PONG}. */
  record Status(String value) implements RedisReply {
    public Status { Objects.requireNonNull(value, "value"); }
  }

  /** Error reply, raw server text (e.g. {@code WRONGTYPE Operation against a key ...}). */
  record Error(String message) implements RedisReply {
    public Error { Objects.requireNonNull(message, "message"); }
  }

  record Double(double value) implements RedisReply {}

  record Bool(boolean value) implements RedisReply {}

  record BigNumber(String value) implements RedisReply {}

  record Array(List<RedisReply> items) implements RedisReply {
    public Array { items = List.copyOf(items); }
  }

  record Entry(RedisReply key, RedisReply value) {}

  record MapReply(List<Entry> entries) implements RedisReply {
    public MapReply { entries = List.copyOf(entries); }
  }

  record SetReply(List<RedisReply> items) implements RedisReply {
    public SetReply { items = List.copyOf(items); }
  }

  RedisReply NIL = new Nil();

  static RedisReply bulk(String s) {
    return s == null ? NIL : new Bulk(s);
  }

  static RedisReply array(RedisReply... items) {
    return new Array(List.of(items));
  }
}
