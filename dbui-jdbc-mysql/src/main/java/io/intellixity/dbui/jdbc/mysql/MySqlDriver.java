package io.intellixity.dbui.jdbc.mysql;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.error.QueryExecutionException;
import io.intellixity.dbui.jdbc.AbstractJdbcDriver;
import io.intellixity.dbui.jdbc.JdbcHandle;
import io.intellixity.dbui.jdbc.SqlStatement;
import io.intellixity.dbui.model.ColumnInfo;
import io.intellixity.dbui.model.ConstraintInfo;
import io.intellixity.dbui.model.FunctionInfo;
import io.intellixity.dbui.model.IndexInfo;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * MySQL / MariaDB adapter.\n
 *
 * Schemas and databases are synonyms here: {@code listSchemas(db)} returns {@code [db]} and every catalog query
 * filters on the database argument (falling back to the handle's database when blank).\n
 */
public final class MySqlDriver extends AbstractJdbcDriver {
  public static final String DEFAULT_DATABASE = "mysql";

  static final Set<String> SYSTEM_DATABASES = Set.of("information_schema", "mysql", "performance_schema", "sys");

  static final String LIST_TABLES = """
      SELECT table_name FROM information_schema.tables
      WHERE table_schema = ? AND table_type = 'BASE TABLE'
      ORDER BY table_name""";

  static final String LIST_VIEWS = """
      SELECT table_name FROM information_schema.views
      WHERE table_schema = ?
      ORDER BY table_name""";

  static final String LIST_FUNCTIONS = """
      SELECT routine_name FROM information_schema.routines
      WHERE routine_schema = ? AND routine_type = 'FUNCTION'
      ORDER BY routine_name""";

  static final String FUNCTION_INFO = """
      SELECT routine_name, data_type, external_language
      FROM information_schema.routines
      WHERE routine_schema = ? AND routine_name = ? AND routine_type = 'FUNCTION'
      LIMIT 1""";

  static final String LIST_COLUMNS = """
      SELECT column_name, data_type, is_nullable, column_default, column_key
      FROM information_schema.columns
      WHERE table_schema = ? AND table_name = ?
      ORDER BY ordinal_position""";

  static final String LIST_INDEXES = """
      SELECT index_name,
             GROUP_CONCAT(column_name ORDER BY seq_in_index) AS columns,
             NOT non_unique AS is_unique,
             index_name = 'PRIMARY' AS is_primary
      FROM information_schema.statistics
      WHERE table_schema = ? AND table_name = ?
      GROUP BY index_name, non_unique
      ORDER BY index_name""";

  static final String LIST_CONSTRAINTS = """
      SELECT tc.constraint_name,
             tc.constraint_type,
             GROUP_CONCAT(DISTINCT kcu.column_name) AS columns,
             kcu.referenced_table_name AS foreign_table,
             GROUP_CONCAT(DISTINCT kcu.referenced_column_name) AS foreign_columns
      FROM information_schema.table_constraints tc
      JOIN information_schema.key_column_usage kcu
        ON tc.constraint_name = kcu.constraint_name
       AND tc.table_schema = kcu.table_schema
       AND tc.table_name = kcu.table_name
      WHERE tc.table_schema = ? AND tc.table_name = ?
      GROUP BY tc.constraint_name, tc.constraint_type, kcu.referenced_table_name
      ORDER BY tc.constraint_name""";

  public MySqlDriver(DbuiSettings settings) {
    super(BackendKind.MYSQL, new MySqlValueCoercer(), settings);
  }

  @Override
  protected String jdbcUrl(ConnectionDescriptor d) {
    return "jdbc:mysql://" + d.host() + ":" + d.port() + "/" + d.databaseName().orElse(DEFAULT_DATABASE);
  }

  @Override
  protected String defaultDatabase() { return DEFAULT_DATABASE; }

  @Override
  public List<String> listDatabases(JdbcHandle h) {
    return query(h, "Failed to list databases", SqlStatement.query("SHOW DATABASES"), rs -> rs.getString(1))
        .stream()
        .filter(db -> !SYSTEM_DATABASES.contains(db))
        .toList();
  }

  @Override
  public List<String> listSchemas(JdbcHandle h, String database) {
    return List.of(database(h, database));
  }

  @Override
  public List<String> listTables(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list tables", LIST_TABLES, database(h, database));
  }

  @Override
  public List<String> listViews(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list views", LIST_VIEWS, database(h, database));
  }

  @Override
  public List<String> listFunctions(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list functions", LIST_FUNCTIONS, database(h, database));
  }

  @Override
  public FunctionInfo getFunctionDefinition(JdbcHandle h, String database, String schema, String functionName) {
    String db = database(h, database);
    String[] info = withConnection(h, "Failed to get function info", c -> {
      List<String[]> rows = query(c, SqlStatement.query(FUNCTION_INFO, db, functionName),
          rs -> new String[]{rs.getString("routine_name"), rs.getString("data_type"), rs.getString("external_language")});
      return rows.isEmpty() ? null : rows.get(0);
    });
    if (info == null) {
      throw new QueryExecutionException("Failed to get function info: function " + db + "." + functionName + " not found");
    }
    String definition = withConnection(h, "Failed to get function definition", c -> showCreateFunction(c, db, functionName));
    return new FunctionInfo(info[0], definition, info[1], info[2]);
  }

  @Override
  public List<ColumnInfo> listColumns(JdbcHandle h, String database, String schema, String table) {
    return query(h, "Failed to list columns", SqlStatement.query(LIST_COLUMNS, database(h, database), table),
        rs -> new ColumnInfo(rs.getString("column_name"), rs.getString("data_type"),
            "YES".equals(rs.getString("is_nullable")), rs.getString("column_default"),
            "PRI".equals(rs.getString("column_key"))));
  }

  @Override
  public List<IndexInfo> listIndexes(JdbcHandle h, String database, String schema, String table) {
    return query(h, "Failed to list indexes", SqlStatement.query(LIST_INDEXES, database(h, database), table),
        rs -> new IndexInfo(rs.getString("index_name"), splitList(rs.getString("columns")),
            rs.getBoolean("is_unique"), rs.getBoolean("is_primary")));
  }

  @Override
  public List<ConstraintInfo> listConstraints(JdbcHandle h, String database, String schema, String table) {
    return query(h, "Failed to list constraints", SqlStatement.query(LIST_CONSTRAINTS, database(h, database), table),
        rs -> {
          String foreign = rs.getString("foreign_columns");
          return new ConstraintInfo(rs.getString("constraint_name"), rs.getString("constraint_type"),
              splitList(rs.getString("columns")), rs.getString("foreign_table"),
              foreign == null ? null : splitList(foreign));
        });
  }

  /** Third column of SHOW CREATE FUNCTION; empty when the server hides it (missing privileges). */
  private static String showCreateFunction(Connection c, String db, String fn) throws SQLException {
    try (Statement st = c.createStatement();
         ResultSet rs = st.executeQuery("SHOW CREATE FUNCTION " + backtick(db) + "." + backtick(fn))) {
      if (!rs.next()) return "";
      String def = rs.getString(3);
      return def == null ? "" : def;
    }
  }

  static String backtick(String ident) {
    return "`" + ident.replace("`", "``") + "`";
  }

  static List<String> splitList(String csv) {
    if (csv == null || csv.isEmpty()) return List.of();
    return Arrays.asList(csv.split(","));
  }

  private static String database(JdbcHandle h, String database) {
    if (database != null && !database.isBlank()) return database;
    return h.database() == null ? DEFAULT_DATABASE : h.database();
  }
}
