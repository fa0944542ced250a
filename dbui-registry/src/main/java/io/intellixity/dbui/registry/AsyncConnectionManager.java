package io.intellixity.dbui.registry;

import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.model.ColumnInfo;
import io.intellixity.dbui.model.ConstraintInfo;
import io.intellixity.dbui.model.FunctionInfo;
import io.intellixity.dbui.model.IndexInfo;
import io.intellixity.dbui.model.QueryResult;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Non-blocking facade over {@link ConnectionManager}. Every operation runs on the supplied executor.\n
 *
 * Cancelling a returned future only abandons that caller's result; the registry and other callers are unaffected.\n
 */
public final class AsyncConnectionManager {
  private final ConnectionManager manager;
  private final Executor executor;

  public AsyncConnectionManager(ConnectionManager manager, Executor executor) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public ConnectionManager manager() { return manager; }

  public CompletableFuture<String> connect(ConnectionDescriptor d) {
    return CompletableFuture.supplyAsync(() -> manager.connect(d), executor);
  }

  public CompletableFuture<Void> disconnect(String connectionId) {
    return CompletableFuture.runAsync(() -> manager.disconnect(connectionId), executor);
  }

  public CompletableFuture<Void> switchDatabase(ConnectionDescriptor d, String database) {
    return CompletableFuture.runAsync(() -> manager.switchDatabase(d, database), executor);
  }

  public CompletableFuture<List<String>> listDatabases(String connectionId) {
    return CompletableFuture.supplyAsync(() -> manager.listDatabases(connectionId), executor);
  }

  public CompletableFuture<List<String>> listSchemas(String connectionId, String database) {
    return CompletableFuture.supplyAsync(() -> manager.listSchemas(connectionId, database), executor);
  }

  public CompletableFuture<List<String>> listTables(String connectionId, String database, String schema) {
    return CompletableFuture.supplyAsync(() -> manager.listTables(connectionId, database, schema), executor);
  }

  public CompletableFuture<List<String>> listViews(String connectionId, String database, String schema) {
    return CompletableFuture.supplyAsync(() -> manager.listViews(connectionId, database, schema), executor);
  }

  public CompletableFuture<List<String>> listFunctions(String connectionId, String database, String schema) {
    return CompletableFuture.supplyAsync(() -> manager.listFunctions(connectionId, database, schema), executor);
  }

  public CompletableFuture<FunctionInfo> getFunctionDefinition(String connectionId, String database, String schema,
                                                               String functionName) {
    return CompletableFuture.supplyAsync(
        () -> manager.getFunctionDefinition(connectionId, database, schema, functionName), executor);
  }

  public CompletableFuture<List<ColumnInfo>> listColumns(String connectionId, String database, String schema,
                                                         String table) {
    return CompletableFuture.supplyAsync(() -> manager.listColumns(connectionId, database, schema, table), executor);
  }

  public CompletableFuture<List<IndexInfo>> listIndexes(String connectionId, String database, String schema,
                                                        String table) {
    return CompletableFuture.supplyAsync(() -> manager.listIndexes(connectionId, database, schema, table), executor);
  }

  public CompletableFuture<List<ConstraintInfo>> listConstraints(String connectionId, String database, String schema,
                                                                 String table) {
    return CompletableFuture.supplyAsync(() -> manager.listConstraints(connectionId, database, schema, table), executor);
  }

  public CompletableFuture<QueryResult> executeQuery(String connectionId, String statement, String database) {
    return CompletableFuture.supplyAsync(() -> manager.executeQuery(connectionId, statement, database), executor);
  }
}
