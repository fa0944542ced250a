package io.intellixity.dbui.registry;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.conn.ConnectionHandle;
import io.intellixity.dbui.error.ConnectFailedException;
import io.intellixity.dbui.error.ConnectionNotFoundException;
import io.intellixity.dbui.error.InvalidArgumentException;
import io.intellixity.dbui.error.UnsupportedBackendOperationException;
import io.intellixity.dbui.jdbc.mysql.MySqlDriver;
import io.intellixity.dbui.jdbc.postgres.PostgresDriver;
import io.intellixity.dbui.jdbc.sqlite.SqliteDriver;
import io.intellixity.dbui.model.QueryResult;
import io.intellixity.dbui.redis.RedisDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

final class ConnectionManagerTest {
  @TempDir Path dir;

  private final List<ScriptedRedisSession> sessions = new ArrayList<>();
  private ConnectionManager manager;

  @BeforeEach
  void setUp() {
    DbuiSettings s = DbuiSettings.defaults();
    RedisDriver redis = new RedisDriver(s, (d, settings) -> {
      if (d.host().equals("unreachable")) throw new ConnectFailedException("Failed to connect to Redis: refused");
      ScriptedRedisSession session = new ScriptedRedisSession();
      sessions.add(session);
      return session;
    });
    manager = new ConnectionManager(new Drivers(new PostgresDriver(s), new MySqlDriver(s), new SqliteDriver(s), redis));
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  private ConnectionDescriptor sqlite(String id, String file) {
    return new ConnectionDescriptor(id, BackendKind.SQLITE, dir.resolve(file).toString(), 0, null, null, null);
  }

  private static ConnectionDescriptor redis(String id, String host) {
    return new ConnectionDescriptor(id, BackendKind.REDIS, host, 6379, null, null, null);
  }

  @Test
  void connectIntrospectExecuteDisconnect() {
    assertEquals("lite", manager.connect(sqlite("lite", "a.db")));
    assertTrue(manager.isConnected("lite"));

    assertEquals("0 row(s) affected.", manager.executeQuery("lite", "CREATE TABLE t (id INTEGER, name TEXT)").message());
    assertEquals("1 row(s) affected.", manager.executeQuery("lite", "INSERT INTO t VALUES (1, 'a')").message());
    QueryResult r = manager.executeQuery("lite", "SELECT id, name FROM t");
    assertEquals(List.of("id", "name"), r.columns());
    assertEquals(List.of(List.of(1L, "a")), r.rows());

    assertEquals(List.of("main"), manager.listDatabases("lite"));
    assertEquals(List.of("t"), manager.listTables("lite", "main", "main"));
    assertEquals(2, manager.listColumns("lite", "main", "main", "t").size());

    manager.disconnect("lite");
    assertFalse(manager.isConnected("lite"));
  }

  @Test
  void unknownIds() {
    ConnectionNotFoundException e = assertThrows(ConnectionNotFoundException.class, () -> manager.listDatabases("nope"));
    assertEquals("Connection 'nope' not found or not connected", e.getMessage());
    assertEquals("nope", e.connectionId());

    assertEquals("Connection 'nope' not found",
        assertThrows(ConnectionNotFoundException.class, () -> manager.disconnect("nope")).getMessage());
  }

  @Test
  void reconnectReplacesAndReleasesPreviousHandle() {
    manager.connect(sqlite("lite", "a.db"));
    ConnectionHandle<?> first = manager.lookup("lite");
    manager.connect(sqlite("lite", "b.db"));
    assertTrue(first.closed());
    assertNotSame(first, manager.lookup("lite"));
    assertEquals(List.of("lite"), manager.connectionIds());
  }

  @Test
  void failedConnectInsertsNothing() {
    assertThrows(ConnectFailedException.class, () -> manager.connect(redis("r", "unreachable")));
    assertFalse(manager.isConnected("r"));
  }

  @Test
  void leasedHandleSurvivesDisconnectUntilReleased() {
    manager.connect(sqlite("lite", "a.db"));
    ConnectionHandle<?> h = manager.lookup("lite");
    assertTrue(h.retain());
    manager.disconnect("lite");
    assertFalse(h.closed());
    h.release();
    assertTrue(h.closed());
    assertFalse(h.retain());
  }

  @Test
  void relationalSwitchReconnects() {
    ConnectionDescriptor d = sqlite("lite", "a.db");
    manager.connect(d);
    ConnectionHandle<?> before = manager.lookup("lite");

    manager.switchDatabase(d, "main");

    ConnectionHandle<?> after = manager.lookup("lite");
    assertNotSame(before, after);
    assertTrue(before.closed());
    assertFalse(after.closed());
    assertNull(d.database());
  }

  @Test
  void failedRelationalSwitchLeavesIdAbsent() {
    manager.connect(sqlite("lite", "a.db"));
    ConnectionDescriptor broken = new ConnectionDescriptor("lite", BackendKind.SQLITE,
        dir.resolve("missing").resolve("deeper").resolve("x.db").toString(), 0, null, null, null);

    assertThrows(ConnectFailedException.class, () -> manager.switchDatabase(broken, "main"));
    assertFalse(manager.isConnected("lite"));
  }

  @Test
  void redisSwitchSelectsInPlace() {
    manager.connect(redis("r", "localhost"));
    ConnectionHandle<?> before = manager.lookup("r");

    manager.switchDatabase(redis("r", "localhost"), "5");

    assertSame(before, manager.lookup("r"));
    assertEquals("5", before.namespace());
    assertEquals(List.of(5), sessions.get(0).selects);
  }

  @Test
  void lookupDuringRelationalSwitchReportsNotFound() throws Exception {
    DbuiSettings s = DbuiSettings.defaults();
    SqliteDriver sqlite = spy(new SqliteDriver(s));
    CountDownLatch reconnecting = new CountDownLatch(1);
    CountDownLatch proceed = new CountDownLatch(1);
    AtomicBoolean hold = new AtomicBoolean();
    doAnswer(inv -> {
      if (hold.get()) {
        reconnecting.countDown();
        assertTrue(proceed.await(10, TimeUnit.SECONDS));
      }
      return inv.callRealMethod();
    }).when(sqlite).open(any());

    try (ConnectionManager m = new ConnectionManager(new Drivers(new PostgresDriver(s), new MySqlDriver(s), sqlite,
        new RedisDriver(s, (d, settings) -> new ScriptedRedisSession())))) {
      ConnectionDescriptor d = sqlite("lite", "a.db");
      m.connect(d);
      hold.set(true);

      CompletableFuture<Void> switching = CompletableFuture.runAsync(() -> m.switchDatabase(d, "main"));
      assertTrue(reconnecting.await(10, TimeUnit.SECONDS));

      ConnectionNotFoundException e = assertThrows(ConnectionNotFoundException.class, () -> m.lookup("lite"));
      assertEquals("Connection 'lite' not found or not connected", e.getMessage());
      assertFalse(m.isConnected("lite"));

      proceed.countDown();
      switching.get(10, TimeUnit.SECONDS);
      assertTrue(m.isConnected("lite"));
    }
  }

  @Test
  void redisSwitchOnRelationalHandleIsRejected() {
    manager.connect(sqlite("shared", "a.db"));
    ConnectionHandle<?> h = manager.lookup("shared");

    InvalidArgumentException e = assertThrows(InvalidArgumentException.class,
        () -> manager.switchDatabase(redis("shared", "localhost"), "1"));
    assertEquals("Connection 'shared' is connected as sqlite, not redis; reconnect it first", e.getMessage());
    assertSame(h, manager.lookup("shared"));
    assertFalse(h.closed());
  }

  @Test
  void redisSwitchNeedsLiveConnection() {
    assertThrows(ConnectionNotFoundException.class, () -> manager.switchDatabase(redis("r", "localhost"), "1"));
  }

  @Test
  void redisDispatch() {
    manager.connect(redis("r", "localhost"));
    assertEquals(16, manager.listDatabases("r").size());
    assertEquals("Switched to database 2", manager.executeQuery("r", "SELECT 2").message());
    assertEquals(List.of(List.of("PONG")), manager.executeQuery("r", "PING").rows());
    assertThrows(UnsupportedBackendOperationException.class, () -> manager.listFunctions("r", "0", ""));
  }

  @Test
  void closeReleasesEverything() {
    manager.connect(sqlite("lite", "a.db"));
    manager.connect(redis("r", "localhost"));
    ConnectionHandle<?> lite = manager.lookup("lite");

    manager.close();

    assertTrue(lite.closed());
    assertTrue(sessions.get(0).closed);
    assertTrue(manager.connectionIds().isEmpty());
  }
}
