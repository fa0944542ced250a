package io.intellixity.dbui.redis.command;

import io.intellixity.dbui.model.QueryResult;
import io.intellixity.dbui.redis.RedisReply;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.intellixity.dbui.redis.RedisReply.array;
import static io.intellixity.dbui.redis.RedisReply.bulk;
import static org.junit.jupiter.api.Assertions.*;

final class ReplyShaperTest {
  @Test
  void scalarBecomesSingleValue() {
    QueryResult r = ReplyShaper.shape(bulk("v"), "GET");
    assertEquals(List.of("value"), r.columns());
    assertEquals(List.of(List.of("v")), r.rows());

    QueryResult n = ReplyShaper.shape(RedisReply.NIL, "GET");
    assertEquals(1, n.rowCount());
    assertNull(n.rows().get(0).get(0));

    assertEquals(List.of(List.of(7L)), ReplyShaper.shape(new RedisReply.Int(7), "INCR").rows());
  }

  @Test
  void okStatusIsMessage() {
    QueryResult r = ReplyShaper.shape(new RedisReply.Status("OK"), "SET");
    assertEquals("OK", r.message());
    assertTrue(r.columns().isEmpty());
  }

  @Test
  void otherStatusIsValue() {
    assertEquals(List.of(List.of("PONG")), ReplyShaper.shape(new RedisReply.Status("PONG"), "PING").rows());
  }

  @Test
  void errorReplyIsMessage() {
    QueryResult r = ReplyShaper.shape(new RedisReply.Error("WRONGTYPE bad"), "GET");
    assertEquals("Server error: WRONGTYPE bad", r.message());
  }

  @Test
  void hashPairs() {
    QueryResult r = ReplyShaper.shape(array(bulk("a"), bulk("1"), bulk("b"), bulk("2")), "hgetall");
    assertEquals(List.of("field", "value"), r.columns());
    assertEquals(List.of(List.of("a", "1"), List.of("b", "2")), r.rows());
  }

  @Test
  void setMembers() {
    QueryResult r = ReplyShaper.shape(array(bulk("x"), bulk("y")), "SMEMBERS");
    assertEquals(List.of("member"), r.columns());
    assertEquals(2, r.rowCount());
  }

  @Test
  void sortedSetScores() {
    QueryResult r = ReplyShaper.shape(array(bulk("m1"), bulk("1.5"), bulk("m2"), bulk("2")), "ZRANGE");
    assertEquals(List.of("member", "score"), r.columns());
    assertEquals(List.of("m2", "2"), r.rows().get(1));
  }

  @Test
  void oddLengthZReplyFallsBackToIndex() {
    QueryResult r = ReplyShaper.shape(array(bulk("a"), bulk("b"), bulk("c")), "ZRANGE");
    assertEquals(List.of("index", "value"), r.columns());
    assertEquals(List.of(2L, "c"), r.rows().get(2));
  }

  @Test
  void scanPage() {
    QueryResult r = ReplyShaper.shape(array(bulk("17"), array(bulk("k1"), bulk("k2"))), "SCAN");
    assertEquals(List.of("key"), r.columns());
    assertEquals(2, r.rowCount());
    assertEquals("Cursor: 17", r.message());
  }

  @Test
  void listIndexesValues() {
    QueryResult r = ReplyShaper.shape(array(bulk("a"), RedisReply.NIL), "LRANGE");
    assertEquals(List.of("index", "value"), r.columns());
    assertEquals(Arrays.asList(1L, null), r.rows().get(1));
  }

  @Test
  void emptyArrayKeepsIndexColumns() {
    QueryResult r = ReplyShaper.shape(array(), "KEYS");
    assertEquals(List.of("index", "value"), r.columns());
    assertEquals(0, r.rowCount());
  }

  @Test
  void nestedArrayRendersAsJson() {
    QueryResult r = ReplyShaper.shape(array(array(bulk("a"), new RedisReply.Int(1))), "XRANGE");
    assertEquals("[\"a\",1]", r.rows().get(0).get(1));
  }

  @Test
  void nanDoubleBecomesNull() {
    QueryResult r = ReplyShaper.shape(new RedisReply.Double(java.lang.Double.NaN), "ZSCORE");
    assertNull(r.rows().get(0).get(0));
  }

  @Test
  void resp3MapBecomesFieldValueRows() {
    RedisReply m = new RedisReply.MapReply(List.of(new RedisReply.Entry(bulk("f"), new RedisReply.Int(3))));
    QueryResult r = ReplyShaper.shape(m, "HGETALL");
    assertEquals(List.of(List.of("f", 3L)), r.rows());
  }
}
