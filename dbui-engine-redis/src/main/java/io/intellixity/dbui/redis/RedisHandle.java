package io.intellixity.dbui.redis;

import io.intellixity.dbui.conn.AbstractConnectionHandle;
import io.intellixity.dbui.conn.BackendKind;

import java.util.Objects;

/** Redis handle: one multiplexed session plus the logical database it currently points at. */
public final class RedisHandle extends AbstractConnectionHandle<RedisSession> {
  private final RedisSession session;
  private volatile int database;

  public RedisHandle(String id, RedisSession session, int database) {
    super(id, BackendKind.REDIS);
    this.session = Objects.requireNonNull(session, "session");
    this.database = database;
  }

  @Override public RedisSession client() { return session; }
  @Override public String namespace() { return String.valueOf(database); }

  public int database() { return database; }

  /** Record a successful SELECT. */
  public void selected(int index) {
    this.database = index;
  }

  @Override
  protected void closeClient() {
    session.close();
  }
}
