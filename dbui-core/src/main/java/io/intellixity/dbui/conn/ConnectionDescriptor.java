package io.intellixity.dbui.conn;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Connection parameters supplied by the configuration layer.\n
 *
 * For SQLite {@link #host()} carries the database file path. {@link #database()} is optional for every backend.\n
 */
public record ConnectionDescriptor(@JsonProperty("id") String id,
                                   @JsonProperty("db_type") BackendKind backend,
                                   @JsonProperty("host") String host,
                                   @JsonProperty("port") int port,
                                   @JsonProperty("username") String username,
                                   @JsonProperty("password") String password,
                                   @JsonProperty("database") String database) {
  public ConnectionDescriptor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(backend, "backend");
    if (id.isBlank()) throw new IllegalArgumentException("id is blank");
    host = host == null ? "" : host;
    username = username == null ? "" : username;
    password = password == null ? "" : password;
    database = (database == null || database.isBlank()) ? null : database;
    if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
  }

  public Optional<String> databaseName() {
    return Optional.ofNullable(database);
  }

  /** Copy pointing at another database; the original is left untouched. */
  public ConnectionDescriptor withDatabase(String database) {
    return new ConnectionDescriptor(id, backend, host, port, username, password, database);
  }

  /** Copy registered under another id. */
  public ConnectionDescriptor withId(String id) {
    return new ConnectionDescriptor(id, backend, host, port, username, password, database);
  }

  @Override
  public String toString() {
    return "ConnectionDescriptor[id=" + id + ", backend=" + backend.id() + ", host=" + host + ", port=" + port
        + ", username=" + username + ", password=" + (password.isEmpty() ? "" : "****") + ", database=" + database + "]";
  }
}
