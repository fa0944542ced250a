package io.intellixity.dbui.jdbc.postgres;

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

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL adapter.\n
 *
 * Catalog queries run against the handle's own database: a pool is bound to one database, so the
 * {@code database} arguments are informational. Switching goes through the registry.\n
 */
public final class PostgresDriver extends AbstractJdbcDriver {
  public static final String DEFAULT_DATABASE = "postgres";

  static final String LIST_DATABASES = """
      SELECT datname FROM pg_database
      WHERE datistemplate = false
        AND has_database_privilege(datname, 'CONNECT')
      ORDER BY datname""";

  static final String LIST_SCHEMAS = """
      SELECT schema_name FROM information_schema.schemata
      WHERE schema_name NOT IN ('pg_catalog', 'information_schema', 'pg_toast')
      ORDER BY schema_name""";

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

  static final String FUNCTION_DEFINITION = """
      SELECT p.proname AS name,
             pg_get_functiondef(p.oid) AS definition,
             pg_catalog.format_type(p.prorettype, NULL) AS return_type,
             l.lanname AS language
      FROM pg_proc p
      JOIN pg_namespace n ON p.pronamespace = n.oid
      JOIN pg_language l ON p.prolang = l.oid
      WHERE n.nspname = ? AND p.proname = ?
      LIMIT 1""";

  static final String LIST_COLUMNS = """
      SELECT c.column_name,
             c.data_type,
             c.is_nullable,
             c.column_default,
             CASE WHEN pk.column_name IS NOT NULL THEN true ELSE false END AS is_primary_key
      FROM information_schema.columns c
      LEFT JOIN (
        SELECT kcu.column_name
        FROM information_schema.table_constraints tc
        JOIN information_schema.key_column_usage kcu
          ON tc.constraint_name = kcu.constraint_name
         AND tc.table_schema = kcu.table_schema
        WHERE tc.constraint_type = 'PRIMARY KEY'
          AND tc.table_schema = ?
          AND tc.table_name = ?
      ) pk ON c.column_name = pk.column_name
      WHERE c.table_schema = ? AND c.table_name = ?
      ORDER BY c.ordinal_position""";

  static final String LIST_INDEXES = """
      SELECT i.relname AS index_name,
             array_agg(a.attname::TEXT ORDER BY array_position(ix.indkey, a.attnum))::TEXT[] AS columns,
             ix.indisunique AS is_unique,
             ix.indisprimary AS is_primary
      FROM pg_class t
      JOIN pg_index ix ON t.oid = ix.indrelid
      JOIN pg_class i ON i.oid = ix.indexrelid
      JOIN pg_namespace n ON n.oid = t.relnamespace
      JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = ANY(ix.indkey)
      WHERE n.nspname = ? AND t.relname = ?
      GROUP BY i.relname, ix.indisunique, ix.indisprimary
      ORDER BY i.relname""";

  static final String LIST_CONSTRAINTS = """
      SELECT tc.constraint_name,
             tc.constraint_type,
             array_agg(DISTINCT kcu.column_name::TEXT)::TEXT[] AS columns,
             ccu.table_name AS foreign_table,
             array_agg(DISTINCT ccu.column_name::TEXT)
               FILTER (WHERE ccu.column_name IS NOT NULL AND tc.constraint_type = 'FOREIGN KEY')::TEXT[] AS foreign_columns
      FROM information_schema.table_constraints tc
      JOIN information_schema.key_column_usage kcu
        ON tc.constraint_name = kcu.constraint_name
       AND tc.table_schema = kcu.table_schema
      LEFT JOIN information_schema.constraint_column_usage ccu
        ON tc.constraint_name = ccu.constraint_name
       AND tc.table_schema = ccu.table_schema
       AND tc.constraint_type = 'FOREIGN KEY'
      WHERE tc.table_schema = ? AND tc.table_name = ?
      GROUP BY tc.constraint_name, tc.constraint_type, ccu.table_name
      ORDER BY tc.constraint_name""";

  public PostgresDriver(DbuiSettings settings) {
    super(BackendKind.POSTGRES, new PostgresValueCoercer(), settings);
  }

  @Override
  protected String jdbcUrl(ConnectionDescriptor d) {
    return "jdbc:postgresql://" + d.host() + ":" + d.port() + "/" + d.databaseName().orElse(DEFAULT_DATABASE);
  }

  @Override
  protected String defaultDatabase() { return DEFAULT_DATABASE; }

  @Override
  public List<String> listDatabases(JdbcHandle h) {
    return queryStrings(h, "Failed to list databases", LIST_DATABASES);
  }

  @Override
  public List<String> listSchemas(JdbcHandle h, String database) {
    return queryStrings(h, "Failed to list schemas", LIST_SCHEMAS);
  }

  @Override
  public List<String> listTables(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list tables", LIST_TABLES, schema);
  }

  @Override
  public List<String> listViews(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list views", LIST_VIEWS, schema);
  }

  @Override
  public List<String> listFunctions(JdbcHandle h, String database, String schema) {
    return queryStrings(h, "Failed to list functions", LIST_FUNCTIONS, schema);
  }

  @Override
  public FunctionInfo getFunctionDefinition(JdbcHandle h, String database, String schema, String functionName) {
    List<FunctionInfo> found = query(h, "Failed to get function definition",
        SqlStatement.query(FUNCTION_DEFINITION, schema, functionName),
        rs -> new FunctionInfo(rs.getString("name"), rs.getString("definition"),
            rs.getString("return_type"), rs.getString("language")));
    if (found.isEmpty()) {
      throw new QueryExecutionException("Failed to get function definition: function "
          + schema + "." + functionName + " not found");
    }
    return found.get(0);
  }

  @Override
  public List<ColumnInfo> listColumns(JdbcHandle h, String database, String schema, String table) {
    return query(h, "Failed to list columns", SqlStatement.query(LIST_COLUMNS, schema, table, schema, table),
        rs -> new ColumnInfo(rs.getString("column_name"), rs.getString("data_type"),
            "YES".equals(rs.getString("is_nullable")), rs.getString("column_default"),
            rs.getBoolean("is_primary_key")));
  }

  @Override
  public List<IndexInfo> listIndexes(JdbcHandle h, String database, String schema, String table) {
    return query(h, "Failed to list indexes", SqlStatement.query(LIST_INDEXES, schema, table),
        rs -> new IndexInfo(rs.getString("index_name"), textArray(rs, "columns"),
            rs.getBoolean("is_unique"), rs.getBoolean("is_primary")));
  }

  @Override
  public List<ConstraintInfo> listConstraints(JdbcHandle h, String database, String schema, String table) {
    return query(h, "Failed to list constraints", SqlStatement.query(LIST_CONSTRAINTS, schema, table),
        rs -> {
          List<String> foreign = textArray(rs, "foreign_columns");
          return new ConstraintInfo(rs.getString("constraint_name"), rs.getString("constraint_type"),
              textArray(rs, "columns"), rs.getString("foreign_table"), foreign.isEmpty() ? null : foreign);
        });
  }

  /** TEXT[] column as a list; SQL NULL reads as empty. */
  static List<String> textArray(ResultSet rs, String column) throws SQLException {
    Array a = rs.getArray(column);
    if (a == null) return List.of();
    try {
      Object raw = a.getArray();
      List<String> out = new ArrayList<>();
      if (raw instanceof Object[] items) {
        for (Object o : items) {
          if (o != null) out.add(o.toString());
        }
      }
      return out;
    } finally {
      a.free();
    }
  }
}
