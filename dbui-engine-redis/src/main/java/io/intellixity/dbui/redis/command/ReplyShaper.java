package io.intellixity.dbui.redis.command;

import io.intellixity.dbui.mapping.PortableValues;
import io.intellixity.dbui.model.QueryResult;
import io.intellixity.dbui.redis.RedisReply;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a raw reply into a table, guessing the shape from the command name and the reply structure.\n
 *
 * Array replies, first match wins:\n
 * - HGETALL / HSCAN: (field, value) pairs\n
 * - SMEMBERS / SINTER / SUNION / SDIFF: one member per row\n
 * - Z*: (member, score) pairs when the reply has even length and every odd element is a string or double\n
 * - SCAN: [cursor, [keys]] becomes key rows with the cursor in the message\n
 * - anything else: (index, value)\n
 *
 * The Z* check looks at structure only, so ZRANGE without WITHSCORES over an even number of members is also
 * paired up.\n
 */
public final class ReplyShaper {
  private ReplyShaper() {}

  private static final Set<String> SET_COMMANDS = Set.of("SMEMBERS", "SINTER", "SUNION", "SDIFF");

  public static QueryResult shape(RedisReply reply, String command) {
    String cmd = command == null ? "" : command.toUpperCase(Locale.ROOT);

    if (reply instanceof RedisReply.Array a) return shapeArray(a.items(), cmd);
    if (reply instanceof RedisReply.Status s && "OK".equals(s.value())) return QueryResult.message("OK");
    if (reply instanceof RedisReply.Error e) return QueryResult.message("Server error: " + e.message());
    if (reply instanceof RedisReply.MapReply m) {
      List<List<Object>> rows = new ArrayList<>();
      for (RedisReply.Entry en : m.entries()) rows.add(row(cell(en.key()), cell(en.value())));
      return QueryResult.of(List.of("field", "value"), rows);
    }
    if (reply instanceof RedisReply.SetReply s) {
      List<List<Object>> rows = new ArrayList<>();
      for (RedisReply item : s.items()) rows.add(row(cell(item)));
      return QueryResult.of(List.of("member"), rows);
    }
    return QueryResult.single("value", cell(reply));
  }

  static QueryResult shapeArray(List<RedisReply> items, String cmd) {
    if (cmd.equals("HGETALL") || cmd.equals("HSCAN")) {
      return QueryResult.of(List.of("field", "value"), pairs(items));
    }

    if (SET_COMMANDS.contains(cmd)) {
      List<List<Object>> rows = new ArrayList<>(items.size());
      for (RedisReply item : items) rows.add(row(cell(item)));
      return QueryResult.of(List.of("member"), rows);
    }

    if (cmd.startsWith("Z") && looksLikeScorePairs(items)) {
      return QueryResult.of(List.of("member", "score"), pairs(items));
    }

    if (cmd.equals("SCAN") && items.size() == 2 && items.get(1) instanceof RedisReply.Array keys) {
      List<List<Object>> rows = new ArrayList<>(keys.items().size());
      for (RedisReply k : keys.items()) rows.add(row(cell(k)));
      return QueryResult.of(List.of("key"), rows, "Cursor: " + text(items.get(0)));
    }

    List<List<Object>> rows = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) rows.add(row((long) i, cell(items.get(i))));
    return QueryResult.of(List.of("index", "value"), rows);
  }

  private static boolean looksLikeScorePairs(List<RedisReply> items) {
    if (items.isEmpty() || items.size() % 2 != 0) return false;
    for (int i = 1; i < items.size(); i += 2) {
      RedisReply r = items.get(i);
      if (!(r instanceof RedisReply.Bulk) && !(r instanceof RedisReply.Double)) return false;
    }
    return true;
  }

  private static List<List<Object>> pairs(List<RedisReply> items) {
    List<List<Object>> rows = new ArrayList<>(items.size() / 2);
    for (int i = 0; i + 1 < items.size(); i += 2) rows.add(row(cell(items.get(i)), cell(items.get(i + 1))));
    return rows;
  }

  private static List<Object> row(Object... cells) {
    List<Object> r = new ArrayList<>(cells.length);
    for (Object c : cells) r.add(c);
    return r;
  }

  /** Portable cell value; nested aggregates become JSON text. */
  public static Object cell(RedisReply r) {
    if (r instanceof RedisReply.Array || r instanceof RedisReply.MapReply || r instanceof RedisReply.SetReply) {
      return PortableValues.toJsonText(toJava(r));
    }
    return scalar(r);
  }

  private static Object scalar(RedisReply r) {
    if (r == null || r instanceof RedisReply.Nil) return null;
    if (r instanceof RedisReply.Int i) return i.value();
    if (r instanceof RedisReply.Bulk b) return b.value();
    if (r instanceof RedisReply.Status s) return s.value();
    if (r instanceof RedisReply.Double d) return PortableValues.lower(d.value());
    if (r instanceof RedisReply.Bool b) return b.value();
    if (r instanceof RedisReply.BigNumber n) return n.value();
    if (r instanceof RedisReply.Error e) return "Error: " + e.message();
    return String.valueOf(r);
  }

  private static Object toJava(RedisReply r) {
    if (r instanceof RedisReply.Array a) return toJavaList(a.items());
    if (r instanceof RedisReply.SetReply s) return toJavaList(s.items());
    if (r instanceof RedisReply.MapReply m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (RedisReply.Entry e : m.entries()) out.put(text(e.key()), toJava(e.value()));
      return out;
    }
    return scalar(r);
  }

  private static List<Object> toJavaList(List<RedisReply> items) {
    List<Object> out = new ArrayList<>(items.size());
    for (RedisReply i : items) out.add(toJava(i));
    return out;
  }

  /** Plain text of a scalar reply (cursors, map keys). */
  static String text(RedisReply r) {
    if (r instanceof RedisReply.Bulk b) return b.value();
    if (r instanceof RedisReply.Status s) return s.value();
    if (r instanceof RedisReply.Int i) return Long.toString(i.value());
    if (r instanceof RedisReply.Double d) return java.lang.Double.toString(d.value());
    return String.valueOf(r);
  }
}
