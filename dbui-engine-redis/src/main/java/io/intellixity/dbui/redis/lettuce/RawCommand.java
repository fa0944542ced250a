package io.intellixity.dbui.redis.lettuce;

import io.lettuce.core.protocol.ProtocolKeyword;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/** Command keyword taken from user input rather than from Lettuce's CommandType enum. */
final class RawCommand implements ProtocolKeyword {
  private final String name;
  private final byte[] bytes;

  RawCommand(String name) {
    this.name = Objects.requireNonNull(name, "name").toUpperCase(Locale.ROOT);
    this.bytes = this.name.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public byte[] getBytes() {
    return bytes;
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
