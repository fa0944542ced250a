package io.intellixity.dbui.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.dbui.conn.AbstractConnectionHandle;
import io.intellixity.dbui.conn.BackendKind;

import java.util.Objects;

/** JDBC-family handle: a Hikari pool bound to one database. */
public final class JdbcHandle extends AbstractConnectionHandle<HikariDataSource> {
  private final HikariDataSource client;
  private final String database;

  public JdbcHandle(String id, BackendKind backend, HikariDataSource client, String database) {
    super(id, backend);
    this.client = Objects.requireNonNull(client, "client");
    this.database = (database == null || database.isBlank()) ? null : database;
  }

  @Override public HikariDataSource client() { return client; }
  @Override public String namespace() { return database; }

  public String database() { return database; }

  @Override
  protected void closeClient() {
    client.close();
  }
}
