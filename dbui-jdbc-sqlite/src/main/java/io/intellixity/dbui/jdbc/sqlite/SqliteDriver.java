package io.intellixity.dbui.jdbc.sqlite;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.error.UnsupportedBackendOperationException;
import io.intellixity.dbui.jdbc.AbstractJdbcDriver;
import io.intellixity.dbui.jdbc.JdbcHandle;
import io.intellixity.dbui.jdbc.SqlStatement;
import io.intellixity.dbui.model.ColumnInfo;
import io.intellixity.dbui.model.ConstraintInfo;
import io.intellixity.dbui.model.FunctionInfo;
import io.intellixity.dbui.model.IndexInfo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite adapter. The descriptor host is the database file; there is a single database and schema, both
 * named {@code main}. Introspection goes through PRAGMAs and {@code sqlite_master}.
 */
public final class SqliteDriver extends AbstractJdbcDriver {
  public static final String MAIN = "main";

  static final String LIST_TABLES =
      "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";
  static final String LIST_VIEWS =
      "SELECT name FROM sqlite_master WHERE type = 'view' ORDER BY name";

  public SqliteDriver(DbuiSettings settings) {
    super(BackendKind.SQLITE, new SqliteValueCoercer(), settings);
  }

  @Override
  protected String jdbcUrl(ConnectionDescriptor d) {
    return "jdbc:sqlite:" + d.host();
  }

  @Override
  protected String defaultDatabase() { return MAIN; }

  @Override
  public List<String> listDatabases(JdbcHandle h) {
    return List.of(MAIN);
  }

  @Override
  public List<String> listSchemas(JdbcHandle h, String database) {
    return List.of(MAIN);
  }

  @Override
  public List<String> listTables(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list tables", LIST_TABLES);
  }

  @Override
  public List<String> listViews(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list views", LIST_VIEWS);
  }

  /** SQLite has no stored functions. */
  @Override
  public List<String> listFunctions(JdbcHandle h, String database, String schema) {
    return List.of();
  }

  @Override
  public FunctionInfo getFunctionDefinition(JdbcHandle h, String database, String schema, String functionName) {
    throw new UnsupportedBackendOperationException(BackendKind.SQLITE, "SQLite does not support stored functions");
  }

  @Override
  public List<ColumnInfo> listColumns(JdbcHandle h, String database, String schema, String table) {
    return query(h, "Failed to list columns", SqlStatement.query("PRAGMA table_info(" + quoteIdent(table) + ")"),
        rs -> new ColumnInfo(rs.getString("name"), rs.getString("type"), rs.getInt("notnull") == 0,
            rs.getString("dflt_value"), rs.getInt("pk") > 0));
  }

  @Override
  public List<IndexInfo> listIndexes(JdbcHandle h, String database, String schema, String table) {
    List<IndexInfo> out = withConnection(h, "Failed to list indexes", c -> {
      List<IndexInfo> indexes = new ArrayList<>();
      List<IndexInfo> listed = query(c, SqlStatement.query("PRAGMA index_list(" + quoteIdent(table) + ")"),
          rs -> new IndexInfo(rs.getString("name"), List.of(), rs.getInt("unique") == 1, "pk".equals(rs.getString("origin"))));
      for (IndexInfo idx : listed) {
        List<String> cols = query(c, SqlStatement.query("PRAGMA index_info(" + quoteIdent(idx.name()) + ")"),
            rs -> rs.getString("name"));
        indexes.add(new IndexInfo(idx.name(), cols, idx.unique(), idx.primary()));
      }
      return indexes;
    });
    out.sort(Comparator.comparing(IndexInfo::name));
    return out;
  }

  @Override
  public List<ConstraintInfo> listConstraints(JdbcHandle h, String database, String schema, String table) {
    List<ConstraintInfo> out = withConnection(h, "Failed to list constraints", c -> {
      Map<Integer, ForeignKey> byId = new LinkedHashMap<>();
      query(c, SqlStatement.query("PRAGMA foreign_key_list(" + quoteIdent(table) + ")"), rs -> {
        int id = rs.getInt("id");
        String referenced = rs.getString("table");
        ForeignKey fk = byId.computeIfAbsent(id, k -> new ForeignKey(k, referenced));
        fk.from.add(rs.getString("from"));
        // null when the key references the parent's implicit primary key
        String to = rs.getString("to");
        if (to == null) fk.implicitTarget = true;
        else fk.to.add(to);
        return fk;
      });

      List<ConstraintInfo> constraints = new ArrayList<>();
      for (ForeignKey fk : byId.values()) {
        constraints.add(new ConstraintInfo("fk_" + table + "_" + fk.id, ConstraintInfo.FOREIGN_KEY,
            fk.from, fk.table, fk.implicitTarget ? null : fk.to));
      }

      List<String> pkColumns = query(c, SqlStatement.query("PRAGMA table_info(" + quoteIdent(table) + ")"),
              rs -> new PkColumn(rs.getInt("pk"), rs.getString("name")))
          .stream()
          .filter(p -> p.seq() > 0)
          .sorted(Comparator.comparingInt(PkColumn::seq))
          .map(PkColumn::name)
          .toList();
      if (!pkColumns.isEmpty()) {
        constraints.add(new ConstraintInfo(table + "_pkey", ConstraintInfo.PRIMARY_KEY, pkColumns, null, null));
      }
      return constraints;
    });
    out.sort(Comparator.comparing(ConstraintInfo::name));
    return out;
  }

  /** table_info row; {@code seq} is the 1-based position in the primary key, 0 when not part of it. */
  private record PkColumn(int seq, String name) {}

  private static final class ForeignKey {
    final int id;
    final String table;
    final List<String> from = new ArrayList<>();
    final List<String> to = new ArrayList<>();
    boolean implicitTarget;

    ForeignKey(int id, String table) {
      this.id = id;
      this.table = table;
    }
  }
}
