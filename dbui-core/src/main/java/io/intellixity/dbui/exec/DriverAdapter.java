package io.intellixity.dbui.exec;

import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.conn.ConnectionHandle;
import io.intellixity.dbui.model.ColumnInfo;
import io.intellixity.dbui.model.ConstraintInfo;
import io.intellixity.dbui.model.FunctionInfo;
import io.intellixity.dbui.model.IndexInfo;
import io.intellixity.dbui.model.QueryResult;

import java.util.List;

/**
 * One backend's implementation of the uniform introspection/query contract.\n
 *
 * Adapters are stateless apart from settings; all connection state lives in the handle passed to each call.
 * Introspection results are fresh snapshots ordered by name (columns by ordinal position).\n
 */
public interface DriverAdapter<H extends ConnectionHandle<?>> {
  BackendKind kind();

  /** Concrete handle type, used by the registry to narrow a stored handle safely. */
  Class<H> handleType();

  /** Establish a pooled handle. Throws {@link io.intellixity.dbui.error.ConnectFailedException} on handshake failure. */
  H open(ConnectionDescriptor descriptor);

  List<String> listDatabases(H handle);

  List<String> listSchemas(H handle, String database);

  List<String> listTables(H handle, String database, String schema);

  List<String> listViews(H handle, String database, String schema);

  List<String> listFunctions(H handle, String database, String schema);

  FunctionInfo getFunctionDefinition(H handle, String database, String schema, String functionName);

  List<ColumnInfo> listColumns(H handle, String database, String schema, String table);

  List<IndexInfo> listIndexes(H handle, String database, String schema, String table);

  List<ConstraintInfo> listConstraints(H handle, String database, String schema, String table);

  /**
   * Execute one statement.\n
   *
   * @param database optional database to target first; only honored by backends that can switch in place
   */
  QueryResult executeQuery(H handle, String statement, String database);
}
