package io.intellixity.dbui.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.error.ConnectFailedException;
import io.intellixity.dbui.error.InvalidArgumentException;
import io.intellixity.dbui.error.QueryExecutionException;
import io.intellixity.dbui.exec.DriverAdapter;
import io.intellixity.dbui.jdbc.coerce.JdbcValueCoercer;
import io.intellixity.dbui.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared plumbing for the relational backends: Hikari pool creation, ad-hoc statement execution and
 * catalog query helpers. Dialects supply the JDBC URL, the coercion table and the introspection SQL.
 */
public abstract class AbstractJdbcDriver implements DriverAdapter<JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcDriver.class);

  private final BackendKind kind;
  private final JdbcValueCoercer coercer;
  protected final DbuiSettings settings;

  protected AbstractJdbcDriver(BackendKind kind, JdbcValueCoercer coercer, DbuiSettings settings) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.coercer = Objects.requireNonNull(coercer, "coercer");
    this.settings = Objects.requireNonNull(settings, "settings");
    if (!kind.relational()) throw new IllegalArgumentException("Not a relational backend: " + kind.id());
  }

  @Override public BackendKind kind() { return kind; }
  @Override public Class<JdbcHandle> handleType() { return JdbcHandle.class; }

  public JdbcValueCoercer coercer() { return coercer; }

  /** JDBC URL for the descriptor (host, port and database applied). */
  protected abstract String jdbcUrl(ConnectionDescriptor d);

  /** Database the handle reports when the descriptor names none. */
  protected String defaultDatabase() { return null; }

  @Override
  public JdbcHandle open(ConnectionDescriptor d) {
    Objects.requireNonNull(d, "descriptor");
    if (d.backend() != kind) {
      throw new InvalidArgumentException("Descriptor backend " + d.backend().id() + " does not match " + kind.id());
    }

    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName("dbui-" + kind.id() + "-" + d.id());
    cfg.setJdbcUrl(jdbcUrl(d));
    if (!d.username().isEmpty()) cfg.setUsername(d.username());
    if (!d.password().isEmpty()) cfg.setPassword(d.password());
    cfg.setMaximumPoolSize(settings.maxPoolSize());
    cfg.setMinimumIdle(settings.minIdle());
    cfg.setConnectionTimeout(settings.connectionTimeoutMillis());
    // the pool constructor performs the first handshake and throws on failure
    cfg.setInitializationFailTimeout(1);

    long start = System.nanoTime();
    HikariDataSource ds;
    try {
      ds = new HikariDataSource(cfg);
    } catch (RuntimeException e) {
      log.debug("dbui.jdbc_connect_failed backend={} connectionId={} error={}", kind.id(), d.id(), driverMessage(e));
      throw new ConnectFailedException("Failed to connect to " + kind.displayName() + ": " + driverMessage(e), e);
    }
    String database = d.databaseName().orElse(defaultDatabase());
    log.debug("dbui.jdbc_connect backend={} connectionId={} database={} durationMs={}",
        kind.id(), d.id(), database, (System.nanoTime() - start) / 1_000_000.0);
    return new JdbcHandle(d.id(), kind, ds, database);
  }

  /** Relational handles are bound to one database; the argument is ignored. */
  @Override
  public QueryResult executeQuery(JdbcHandle h, String statement, String database) {
    Objects.requireNonNull(h, "handle");
    Objects.requireNonNull(statement, "statement");
    return execute(h, SqlStatement.adHoc(statement));
  }

  protected QueryResult execute(JdbcHandle h, SqlStatement ss) {
    long start = System.nanoTime();
    debugSql("EXECUTE", h, ss);
    try (Connection c = h.client().getConnection(); Statement st = c.createStatement()) {
      applyTimeout(st);
      if (ss.execKind() == SqlStatement.ExecKind.UPDATE) {
        int n = st.executeUpdate(ss.sql());
        debugDone("UPDATE", h, n, System.nanoTime() - start);
        return QueryResult.affected(Math.max(n, 0));
      }
      if (!st.execute(ss.sql())) {
        debugDone("QUERY", h, "no-result-set", System.nanoTime() - start);
        return QueryResult.affected(0);
      }
      try (ResultSet rs = st.getResultSet()) {
        JdbcRowAdapter row = new JdbcRowAdapter(rs, coercer);
        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) rows.add(row.row());
        debugDone("QUERY", h, rows.size(), System.nanoTime() - start);
        if (rows.isEmpty()) return QueryResult.affected(0);
        // empty target list (SELECT FROM t): rows without columns
        if (row.columns().isEmpty()) return QueryResult.message(rows.size() + " row(s) returned.");
        return QueryResult.of(row.columns(), rows);
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("Query failed: " + e.getMessage(), e);
    }
  }

  @FunctionalInterface
  protected interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  protected interface ConnectionCallback<T> {
    T apply(Connection c) throws SQLException;
  }

  /**
   * Run a catalog query and map every row.\n
   *
   * @param failure message prefix on error, e.g. {@code "Failed to list tables"}
   */
  protected <T> List<T> query(JdbcHandle h, String failure, SqlStatement ss, RowMapper<T> mapper) {
    return withConnection(h, failure, c -> query(c, ss, mapper));
  }

  protected List<String> queryStrings(JdbcHandle h, String failure, String sql, Object... binds) {
    return query(h, failure, SqlStatement.query(sql, binds), rs -> rs.getString(1));
  }

  /** Same as {@link #query(JdbcHandle, String, SqlStatement, RowMapper)} on an already open connection. */
  protected <T> List<T> query(Connection c, SqlStatement ss, RowMapper<T> mapper) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
      applyTimeout(ps);
      for (int i = 0; i < ss.binds().size(); i++) ps.setObject(i + 1, ss.binds().get(i));
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(mapper.map(rs));
        return out;
      }
    }
  }

  protected <T> T withConnection(JdbcHandle h, String failure, ConnectionCallback<T> cb) {
    long start = System.nanoTime();
    try (Connection c = h.client().getConnection()) {
      T out = cb.apply(c);
      if (log.isDebugEnabled()) {
        log.debug("dbui.jdbc_catalog op={} backend={} connectionId={} durationMs={}",
            failure, kind.id(), h.id(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return out;
    } catch (SQLException e) {
      throw new QueryExecutionException(failure + ": " + e.getMessage(), e);
    }
  }

  /** Double-quoted identifier with embedded quotes doubled. */
  protected static String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  private void applyTimeout(Statement st) throws SQLException {
    if (settings.queryTimeoutSeconds() > 0) st.setQueryTimeout(settings.queryTimeoutSeconds());
  }

  private void debugSql(String op, JdbcHandle h, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("dbui.jdbc op={} execKind={} backend={} connectionId={} database={} sql={}",
        op, ss.execKind(), kind.id(), h.id(), h.database(), ss.sql());
  }

  private void debugDone(String op, JdbcHandle h, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("dbui.jdbc_done op={} connectionId={} durationMs={} result={}",
        op, h.id(), durationNanos / 1_000_000.0, result);
  }

  /** Message of the first SQLException in the cause chain, else the top-level message. */
  static String driverMessage(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SQLException && t.getMessage() != null) return t.getMessage();
      if (t.getCause() == t) break;
    }
    return String.valueOf(e.getMessage());
  }
}
