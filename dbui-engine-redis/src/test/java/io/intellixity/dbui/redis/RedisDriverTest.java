package io.intellixity.dbui.redis;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.BackendKind;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.error.InvalidArgumentException;
import io.intellixity.dbui.error.QueryExecutionException;
import io.intellixity.dbui.error.UnsupportedBackendOperationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RedisDriverTest {
  private final FakeRedisSession session = new FakeRedisSession();
  private final RedisDriver driver = new RedisDriver(DbuiSettings.defaults(), (d, s) -> session);

  private static ConnectionDescriptor descriptor(String database) {
    return new ConnectionDescriptor("r1", BackendKind.REDIS, "localhost", 6379, "", "", database);
  }

  @Test
  void opensAtDescriptorDatabase() {
    RedisHandle h = driver.open(descriptor("2"));
    assertEquals("2", h.namespace());
    assertEquals(BackendKind.REDIS, h.backend());

    assertEquals("0", driver.open(descriptor(null)).namespace());
  }

  @Test
  void rejectsNonNumericDatabaseOnOpen() {
    assertThrows(InvalidArgumentException.class, () -> driver.open(descriptor("main")));
  }

  @Test
  void rejectsOtherBackends() {
    ConnectionDescriptor pg = new ConnectionDescriptor("p", BackendKind.POSTGRES, "h", 5432, "u", "", null);
    assertThrows(InvalidArgumentException.class, () -> driver.open(pg));
  }

  @Test
  void introspection() {
    RedisHandle h = driver.open(descriptor(null));
    List<String> dbs = driver.listDatabases(h);
    assertEquals(16, dbs.size());
    assertEquals("0", dbs.get(0));
    assertEquals("15", dbs.get(15));
    assertTrue(driver.listSchemas(h, "0").isEmpty());
    assertTrue(driver.listTables(h, "0", "").isEmpty());
    assertTrue(driver.listViews(h, "0", "").isEmpty());
    assertTrue(driver.listColumns(h, "0", "", "t").isEmpty());
    assertTrue(driver.listIndexes(h, "0", "", "t").isEmpty());
    assertTrue(driver.listConstraints(h, "0", "", "t").isEmpty());
  }

  @Test
  void functionsAreUnsupported() {
    RedisHandle h = driver.open(descriptor(null));
    UnsupportedBackendOperationException e =
        assertThrows(UnsupportedBackendOperationException.class, () -> driver.listFunctions(h, "0", ""));
    assertEquals("Redis does not support functions in the traditional sense", e.getMessage());
    assertThrows(UnsupportedBackendOperationException.class, () -> driver.getFunctionDefinition(h, "0", "", "f"));
  }

  @Test
  void executeSelectsDatabaseFirst() {
    session.reply("GET", RedisReply.bulk("v"));
    RedisHandle h = driver.open(descriptor(null));
    assertEquals("v", driver.executeQuery(h, "GET k", "4").rows().get(0).get(0));
    assertEquals(List.of(4), session.selects);
    assertEquals(4, h.database());
  }

  @Test
  void selectDatabaseErrors() {
    RedisHandle h = driver.open(descriptor(null));
    assertEquals("Invalid database index: x",
        assertThrows(QueryExecutionException.class, () -> driver.selectDatabase(h, "x")).getMessage());

    session.failSelect(new RedisSessionException("ERR DB index is out of range"));
    assertEquals("Failed to switch database: ERR DB index is out of range",
        assertThrows(QueryExecutionException.class, () -> driver.selectDatabase(h, "40")).getMessage());
    assertEquals(0, h.database());
  }

  @Test
  void releaseClosesSession() {
    RedisHandle h = driver.open(descriptor(null));
    h.release();
    assertTrue(session.isClosed());
    assertTrue(h.closed());
  }
}
