package io.intellixity.dbui.redis;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.error.InvalidArgumentException;
import io.intellixity.dbui.error.QueryExecutionException;
import io.intellixity.dbui.error.UnsupportedBackendOperationException;
import io.intellixity.dbui.exec.DriverAdapter;
import io.intellixity.dbui.model.ColumnInfo;
import io.intellixity.dbui.model.ConstraintInfo;
import io.intellixity.dbui.model.FunctionInfo;
import io.intellixity.dbui.model.IndexInfo;
import io.intellixity.dbui.model.QueryResult;
import io.intellixity.dbui.redis.command.RedisCommandInterpreter;
import io.intellixity.dbui.redis.lettuce.LettuceRedisSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Redis adapter.\n
 *
 * Logical databases 0..15 stand in for databases; there are no schemas, tables or columns, so those listings are
 * empty. Functions are reported as unsupported.\n
 */
public final class RedisDriver implements DriverAdapter<RedisHandle> {
  private static final Logger log = LoggerFactory.getLogger(RedisDriver.class);

  public static final int DATABASE_COUNT = 16;
  private static final List<String> DATABASES = IntStream.range(0, DATABASE_COUNT).mapToObj(Integer::toString).toList();

  private final DbuiSettings settings;
  private final RedisSessionFactory sessions;
  private final RedisCommandInterpreter interpreter = new RedisCommandInterpreter();

  public RedisDriver(DbuiSettings settings) {
    this(settings, LettuceRedisSession::open);
  }

  public RedisDriver(DbuiSettings settings, RedisSessionFactory sessions) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
  }

  @Override public BackendKind kind() { return BackendKind.REDIS; }
  @Override public Class<RedisHandle> handleType() { return RedisHandle.class; }

  @Override
  public RedisHandle open(ConnectionDescriptor d) {
    Objects.requireNonNull(d, "descriptor");
    if (d.backend() != BackendKind.REDIS) {
      throw new InvalidArgumentException("Descriptor backend " + d.backend().id() + " does not match redis");
    }
    int db = d.databaseName().map(RedisDriver::databaseIndex).orElse(0);
    RedisSession session = sessions.open(d, settings);
    return new RedisHandle(d.id(), session, db);
  }

  /** In-place SELECT on the shared session; the handle stays registered. */
  public void selectDatabase(RedisHandle h, String database) {
    Objects.requireNonNull(h, "handle");
    int index;
    try {
      index = Integer.parseInt(database == null ? "" : database.trim());
    } catch (NumberFormatException e) {
      throw new QueryExecutionException("Invalid database index: " + database, e);
    }
    try {
      h.client().select(index);
    } catch (RedisSessionException e) {
      throw new QueryExecutionException("Failed to switch database: " + e.getMessage(), e);
    }
    h.selected(index);
    log.debug("dbui.redis_select connectionId={} database={}", h.id(), index);
  }

  @Override
  public List<String> listDatabases(RedisHandle h) {
    return DATABASES;
  }

  @Override
  public List<String> listSchemas(RedisHandle h, String database) {
    return List.of();
  }

  @Override
  public List<String> listTables(RedisHandle h, String database, String schema) {
    return List.of();
  }

  @Override
  public List<String> listViews(RedisHandle h, String database, String schema) {
    return List.of();
  }

  @Override
  public List<String> listFunctions(RedisHandle h, String database, String schema) {
    throw unsupportedFunctions();
  }

  @Override
  public FunctionInfo getFunctionDefinition(RedisHandle h, String database, String schema, String functionName) {
    throw unsupportedFunctions();
  }

  @Override
  public List<ColumnInfo> listColumns(RedisHandle h, String database, String schema, String table) {
    return List.of();
  }

  @Override
  public List<IndexInfo> listIndexes(RedisHandle h, String database, String schema, String table) {
    return List.of();
  }

  @Override
  public List<ConstraintInfo> listConstraints(RedisHandle h, String database, String schema, String table) {
    return List.of();
  }

  /** Selects {@code database} first when given, then interprets the command. */
  @Override
  public QueryResult executeQuery(RedisHandle h, String statement, String database) {
    Objects.requireNonNull(h, "handle");
    if (database != null && !database.isBlank()) selectDatabase(h, database);
    return interpreter.execute(h, statement);
  }

  private static UnsupportedBackendOperationException unsupportedFunctions() {
    return new UnsupportedBackendOperationException(BackendKind.REDIS,
        "Redis does not support functions in the traditional sense");
  }

  private static int databaseIndex(String database) {
    try {
      return Integer.parseInt(database.trim());
    } catch (NumberFormatException e) {
      throw new InvalidArgumentException("Invalid database index: " + database, e);
    }
  }
}
