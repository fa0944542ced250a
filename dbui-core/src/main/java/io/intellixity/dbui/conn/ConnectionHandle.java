package io.intellixity.dbui.conn;

/**
 * Live, backend-specific connection resource owned by the registry.\n
 *
 * Example:\n
 * - JDBC: client() is a pooled DataSource, namespace() is the connected database\n
 * - Redis: client() is a multiplexed connection, namespace() is the logical database index\n
 *
 * Handles are reference counted: the registry holds one reference and every in-flight call leases one more.
 * The native resource is closed when the last reference is released.\n
 */
public interface ConnectionHandle<TClient> {
  /** Connection id this handle was opened for. */
  String id();

  BackendKind backend();

  /** Native client (DataSource, Redis connection, ...). */
  TClient client();

  /** Database/namespace this handle currently points at; may be null. */
  String namespace();

  /** Take one more reference. Returns false once the handle has been retired. */
  boolean retain();

  /** Drop one reference; closes the native client when none are left. */
  void release();

  /** True once the native client has been closed. */
  boolean closed();
}
