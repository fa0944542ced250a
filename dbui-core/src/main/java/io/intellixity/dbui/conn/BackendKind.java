package io.intellixity.dbui.conn;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Supported backends. Dispatch sites switch over this enum without a default branch. */
public enum BackendKind {
  POSTGRES("postgres", "PostgreSQL", true),
  MYSQL("mysql", "MySQL", true),
  SQLITE("sqlite", "SQLite", true),
  REDIS("redis", "Redis", false);

  private final String id;
  private final String displayName;
  private final boolean relational;

  BackendKind(String id, String displayName, boolean relational) {
    this.id = id;
    this.displayName = displayName;
    this.relational = relational;
  }

  @JsonValue
  public String id() { return id; }
  public String displayName() { return displayName; }
  public boolean relational() { return relational; }

  @JsonCreator
  public static BackendKind fromId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("backend id is blank");
    String k = id.trim().toLowerCase(Locale.ROOT);
    for (BackendKind b : values()) {
      if (b.id.equals(k)) return b;
    }
    throw new IllegalArgumentException("Unknown backend: " + id);
  }
}
