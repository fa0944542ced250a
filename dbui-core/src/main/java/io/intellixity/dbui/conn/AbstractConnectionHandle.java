package io.intellixity.dbui.conn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/** Reference counting shared by all handle implementations. Starts with the owner's single reference. */
public abstract class AbstractConnectionHandle<TClient> implements ConnectionHandle<TClient> {
  private static final Logger log = LoggerFactory.getLogger(AbstractConnectionHandle.class);

  private final String id;
  private final BackendKind backend;
  private final AtomicInteger refs = new AtomicInteger(1);

  protected AbstractConnectionHandle(String id, BackendKind backend) {
    this.id = Objects.requireNonNull(id, "id");
    this.backend = Objects.requireNonNull(backend, "backend");
  }

  @Override public String id() { return id; }
  @Override public BackendKind backend() { return backend; }

  @Override
  public boolean retain() {
    while (true) {
      int n = refs.get();
      if (n <= 0) return false;
      if (refs.compareAndSet(n, n + 1)) return true;
    }
  }

  @Override
  public void release() {
    int n = refs.decrementAndGet();
    if (n == 0) {
      log.debug("dbui.handle close connectionId={} backend={}", id, backend.id());
      closeClient();
    } else if (n < 0) {
      throw new IllegalStateException("Handle released more often than retained: " + id);
    }
  }

  @Override
  public boolean closed() {
    return refs.get() <= 0;
  }

  /** Close the native client. Called exactly once. */
  protected abstract void closeClient();
}
