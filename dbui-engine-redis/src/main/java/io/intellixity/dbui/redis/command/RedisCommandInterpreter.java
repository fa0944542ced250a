package io.intellixity.dbui.redis.command;

import io.intellixity.dbui.error.QueryExecutionException;
import io.intellixity.dbui.model.QueryResult;
import io.intellixity.dbui.redis.RedisHandle;
import io.intellixity.dbui.redis.RedisReply;
import io.intellixity.dbui.redis.RedisSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Executes one textual command against a Redis handle: tokenize, handle SELECT and BROWSE locally,
 * forward everything else verbatim, then shape the reply.
 */
public final class RedisCommandInterpreter {
  private static final Logger log = LoggerFactory.getLogger(RedisCommandInterpreter.class);

  public QueryResult execute(RedisHandle handle, String text) {
    Objects.requireNonNull(handle, "handle");
    String trimmed = CommandTokenizer.stripTerminators(text);
    if (trimmed.isEmpty()) return QueryResult.message("Empty command");

    List<String> parts = CommandTokenizer.tokenize(trimmed);
    if (parts.isEmpty()) return QueryResult.message("Empty command");

    String name = parts.get(0).toUpperCase(Locale.ROOT);
    List<String> args = parts.subList(1, parts.size());
    log.debug("dbui.redis_command connectionId={} command={} argCount={}", handle.id(), name, args.size());

    if (name.equals("SELECT") && args.size() == 1) {
      Integer index = parseIndex(args.get(0));
      if (index != null) {
        try {
          handle.client().select(index);
        } catch (RedisSessionException e) {
          throw new QueryExecutionException("Redis error: " + e.getMessage(), e);
        }
        handle.selected(index);
        return QueryResult.message("Switched to database " + index);
      }
    }

    if (name.equals("BROWSE")) return BrowseCommand.run(handle.client(), args);

    RedisReply reply;
    try {
      reply = handle.client().dispatch(name, List.copyOf(args));
    } catch (RedisSessionException e) {
      throw new QueryExecutionException("Redis error: " + e.getMessage(), e);
    }
    return ReplyShaper.shape(reply, name);
  }

  static Integer parseIndex(String s) {
    try {
      return Integer.valueOf(s.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
