package io.intellixity.dbui.registry;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.conn.ConnectionHandle;
import io.intellixity.dbui.error.ConnectionNotFoundException;
import io.intellixity.dbui.error.InvalidArgumentException;
import io.intellixity.dbui.exec.DriverAdapter;
import io.intellixity.dbui.model.ColumnInfo;
import io.intellixity.dbui.model.ConstraintInfo;
import io.intellixity.dbui.model.FunctionInfo;
import io.intellixity.dbui.model.IndexInfo;
import io.intellixity.dbui.model.QueryResult;
import io.intellixity.dbui.redis.RedisHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Connection registry: connection id -> live handle, plus dispatch of every operation to the adapter of the
 * handle's backend.\n
 *
 * Map mutations are atomic; network I/O (open, introspection, queries) always happens outside them. Every call
 * leases the handle for its duration, so a concurrent disconnect never closes a pool under a running query; the
 * native client closes when the last lease is released.\n
 *
 * Relational {@link #switchDatabase} is not atomic: the id is removed, then reconnected. A lookup in between
 * reports {@link ConnectionNotFoundException}, and a failed reconnect leaves the id absent.\n
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final Drivers drivers;
  private final ConcurrentMap<String, ConnectionHandle<?>> handles = new ConcurrentHashMap<>();

  public ConnectionManager(Drivers drivers) {
    this.drivers = Objects.requireNonNull(drivers, "drivers");
  }

  public static ConnectionManager create(DbuiSettings settings) {
    return new ConnectionManager(Drivers.create(settings));
  }

  /** Opens a handle for {@code d} and registers it under {@code d.id()}, replacing (and releasing) any prior one. */
  public String connect(ConnectionDescriptor d) {
    Objects.requireNonNull(d, "descriptor");
    long t0 = System.nanoTime();
    ConnectionHandle<?> handle = driverFor(d.backend()).open(d);
    ConnectionHandle<?> previous = handles.put(d.id(), handle);
    if (previous != null && previous != handle) previous.release();
    if (log.isDebugEnabled()) {
      log.debug("dbui.connect connectionId={} backend={} database={} replaced={} tookMs={}",
          d.id(), d.backend().id(), handle.namespace(), previous != null, (System.nanoTime() - t0) / 1_000_000);
    }
    return d.id();
  }

  public void disconnect(String connectionId) {
    Objects.requireNonNull(connectionId, "connectionId");
    ConnectionHandle<?> h = handles.remove(connectionId);
    if (h == null) throw ConnectionNotFoundException.notRegistered(connectionId);
    h.release();
    log.debug("dbui.disconnect connectionId={}", connectionId);
  }

  /**
   * Points the connection at another database.\n
   *
   * Redis selects in place on the existing handle. Relational backends drop the entry and reconnect with the
   * descriptor rewritten to {@code database}; the descriptor passed in is left untouched.\n
   */
  public void switchDatabase(ConnectionDescriptor d, String database) {
    Objects.requireNonNull(d, "descriptor");
    Objects.requireNonNull(database, "database");
    switch (d.backend()) {
      case REDIS -> {
        ConnectionHandle<?> h = lease(d.id());
        try {
          if (!(h instanceof RedisHandle redis)) {
            throw new InvalidArgumentException("Connection '" + d.id() + "' is connected as " + h.backend().id()
                + ", not redis; reconnect it first");
          }
          drivers.redis().selectDatabase(redis, database);
        } finally {
          h.release();
        }
      }
      case POSTGRES, MYSQL, SQLITE -> {
        ConnectionHandle<?> old = handles.remove(d.id());
        if (old != null) old.release();
        connect(d.withDatabase(database));
      }
    }
    log.debug("dbui.switch_database connectionId={} backend={} database={}", d.id(), d.backend().id(), database);
  }

  /** Current handle for {@code connectionId}; never blocks on I/O. */
  public ConnectionHandle<?> lookup(String connectionId) {
    Objects.requireNonNull(connectionId, "connectionId");
    ConnectionHandle<?> h = handles.get(connectionId);
    if (h == null) throw ConnectionNotFoundException.notConnected(connectionId);
    return h;
  }

  public Optional<ConnectionHandle<?>> find(String connectionId) {
    return Optional.ofNullable(handles.get(Objects.requireNonNull(connectionId, "connectionId")));
  }

  public boolean isConnected(String connectionId) {
    return find(connectionId).isPresent();
  }

  public List<String> connectionIds() {
    return List.copyOf(handles.keySet());
  }

  public List<String> listDatabases(String connectionId) {
    return call(connectionId, Bound::listDatabases);
  }

  public List<String> listSchemas(String connectionId, String database) {
    return call(connectionId, b -> b.listSchemas(database));
  }

  public List<String> listTables(String connectionId, String database, String schema) {
    return call(connectionId, b -> b.listTables(database, schema));
  }

  public List<String> listViews(String connectionId, String database, String schema) {
    return call(connectionId, b -> b.listViews(database, schema));
  }

  public List<String> listFunctions(String connectionId, String database, String schema) {
    return call(connectionId, b -> b.listFunctions(database, schema));
  }

  public FunctionInfo getFunctionDefinition(String connectionId, String database, String schema, String functionName) {
    return call(connectionId, b -> b.getFunctionDefinition(database, schema, functionName));
  }

  public List<ColumnInfo> listColumns(String connectionId, String database, String schema, String table) {
    return call(connectionId, b -> b.listColumns(database, schema, table));
  }

  public List<IndexInfo> listIndexes(String connectionId, String database, String schema, String table) {
    return call(connectionId, b -> b.listIndexes(database, schema, table));
  }

  public List<ConstraintInfo> listConstraints(String connectionId, String database, String schema, String table) {
    return call(connectionId, b -> b.listConstraints(database, schema, table));
  }

  public QueryResult executeQuery(String connectionId, String statement) {
    return executeQuery(connectionId, statement, null);
  }

  /** {@code database} is honored by Redis only; relational handles run against their connected database. */
  public QueryResult executeQuery(String connectionId, String statement, String database) {
    Objects.requireNonNull(statement, "statement");
    return call(connectionId, b -> b.executeQuery(statement, database));
  }

  /** Releases every registered handle. */
  @Override
  public void close() {
    List<String> ids = new ArrayList<>(handles.keySet());
    for (String id : ids) {
      ConnectionHandle<?> h = handles.remove(id);
      if (h != null) h.release();
    }
    log.debug("dbui.registry_close released={}", ids.size());
  }

  private DriverAdapter<?> driverFor(BackendKind kind) {
    return switch (kind) {
      case POSTGRES -> drivers.postgres();
      case MYSQL -> drivers.mysql();
      case SQLITE -> drivers.sqlite();
      case REDIS -> drivers.redis();
    };
  }

  private ConnectionHandle<?> lease(String connectionId) {
    ConnectionHandle<?> h = lookup(connectionId);
    // retired between get and retain: treat as gone
    if (!h.retain()) throw ConnectionNotFoundException.notConnected(connectionId);
    return h;
  }

  private <T> T call(String connectionId, Function<Bound<?>, T> op) {
    ConnectionHandle<?> h = lease(connectionId);
    try {
      return op.apply(bind(driverFor(h.backend()), h));
    } finally {
      h.release();
    }
  }

  private static <H extends ConnectionHandle<?>> Bound<H> bind(DriverAdapter<H> driver, ConnectionHandle<?> handle) {
    if (!driver.handleType().isInstance(handle)) {
      throw new InvalidArgumentException("Connection '" + handle.id() + "' has a " + handle.backend().id()
          + " handle that " + driver.kind().id() + " cannot use");
    }
    return new Bound<>(driver, driver.handleType().cast(handle));
  }

  /** An adapter paired with a handle of its own type. */
  private static final class Bound<H extends ConnectionHandle<?>> {
    private final DriverAdapter<H> driver;
    private final H handle;

    Bound(DriverAdapter<H> driver, H handle) {
      this.driver = driver;
      this.handle = handle;
    }

    List<String> listDatabases() { return driver.listDatabases(handle); }
    List<String> listSchemas(String db) { return driver.listSchemas(handle, db); }
    List<String> listTables(String db, String schema) { return driver.listTables(handle, db, schema); }
    List<String> listViews(String db, String schema) { return driver.listViews(handle, db, schema); }
    List<String> listFunctions(String db, String schema) { return driver.listFunctions(handle, db, schema); }

    FunctionInfo getFunctionDefinition(String db, String schema, String name) {
      return driver.getFunctionDefinition(handle, db, schema, name);
    }

    List<ColumnInfo> listColumns(String db, String schema, String table) {
      return driver.listColumns(handle, db, schema, table);
    }

    List<IndexInfo> listIndexes(String db, String schema, String table) {
      return driver.listIndexes(handle, db, schema, table);
    }

    List<ConstraintInfo> listConstraints(String db, String schema, String table) {
      return driver.listConstraints(handle, db, schema, table);
    }

    QueryResult executeQuery(String statement, String db) { return driver.executeQuery(handle, statement, db); }
  }
}
