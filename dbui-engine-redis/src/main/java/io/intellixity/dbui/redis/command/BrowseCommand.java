package io.intellixity.dbui.redis.command;

import io.intellixity.dbui.error.QueryExecutionException;
import io.intellixity.dbui.model.QueryResult;
import io.intellixity.dbui.redis.RedisReply;
import io.intellixity.dbui.redis.RedisSession;
import io.intellixity.dbui.redis.RedisSessionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@code BROWSE [cursor] [COUNT n] [MATCH pattern] [TYPE type]}: one SCAN page plus a TYPE lookup per key.\n
 *
 * The message carries the next cursor; running {@code BROWSE <cursor>} continues the scan.\n
 */
final class BrowseCommand {
  static final long DEFAULT_COUNT = 100;

  record Options(long cursor, long count, String match, String type) {}

  private BrowseCommand() {}

  /** Only the first argument may be a cursor; unparsable numbers fall back to the defaults. */
  static Options parse(List<String> args) {
    long cursor = 0;
    long count = DEFAULT_COUNT;
    String match = null;
    String type = null;

    int i = 0;
    while (i < args.size()) {
      String kw = args.get(i).toUpperCase(Locale.ROOT);
      boolean hasValue = i + 1 < args.size();
      if (kw.equals("COUNT") && hasValue) {
        count = parseLong(args.get(i + 1), DEFAULT_COUNT);
        i += 2;
      } else if (kw.equals("MATCH") && hasValue) {
        match = args.get(i + 1);
        i += 2;
      } else if (kw.equals("TYPE") && hasValue) {
        type = args.get(i + 1);
        i += 2;
      } else {
        if (i == 0) cursor = parseLong(args.get(i), 0);
        i++;
      }
    }
    return new Options(cursor, count, match, type);
  }

  static List<String> scanArgs(Options o) {
    List<String> a = new ArrayList<>();
    a.add(Long.toString(o.cursor()));
    a.add("COUNT");
    a.add(Long.toString(o.count()));
    if (o.match() != null) {
      a.add("MATCH");
      a.add(o.match());
    }
    if (o.type() != null) {
      a.add("TYPE");
      a.add(o.type());
    }
    return a;
  }

  static QueryResult run(RedisSession session, List<String> args) {
    RedisReply reply;
    try {
      reply = session.dispatch("SCAN", scanArgs(parse(args)));
    } catch (RedisSessionException e) {
      throw new QueryExecutionException("Redis error: " + e.getMessage(), e);
    }
    if (reply instanceof RedisReply.Error err) throw new QueryExecutionException("Redis error: " + err.message());
    if (!(reply instanceof RedisReply.Array page) || page.items().size() != 2) {
      throw new QueryExecutionException("Invalid SCAN response format");
    }

    RedisReply c = page.items().get(0);
    String next = (c instanceof RedisReply.Bulk || c instanceof RedisReply.Int) ? ReplyShaper.text(c) : "0";
    if (!(page.items().get(1) instanceof RedisReply.Array keys)) {
      throw new QueryExecutionException("Invalid SCAN response");
    }

    List<List<Object>> rows = new ArrayList<>();
    for (RedisReply k : keys.items()) {
      if (!(k instanceof RedisReply.Bulk key)) continue;
      List<Object> row = new ArrayList<>(2);
      row.add(key.value());
      row.add(typeOf(session, key.value()));
      rows.add(row);
    }

    String message = "0".equals(next)
        ? "Scan complete"
        : "Next cursor: " + next + " (run BROWSE " + next + " to continue)";
    return QueryResult.of(List.of("key", "type"), rows, message);
  }

  private static String typeOf(RedisSession session, String key) {
    try {
      RedisReply t = session.dispatch("TYPE", List.of(key));
      if (t instanceof RedisReply.Status || t instanceof RedisReply.Bulk) return ReplyShaper.text(t);
      return "unknown";
    } catch (RedisSessionException e) {
      return "unknown";
    }
  }

  private static long parseLong(String s, long def) {
    try {
      return Long.parseLong(s.trim());
    } catch (NumberFormatException e) {
      return def;
    }
  }
}
