package io.intellixity.dbui.redis;

import java.util.List;

/**
 * Multiplexed command channel to one Redis server.\n
 *
 * Implementations are thread-safe; concurrent callers share the channel without serializing on it.
 * Server error replies come back as {@link RedisReply.Error}; transport failures and timeouts throw
 * {@link RedisSessionException}.\n
 */
public interface RedisSession extends AutoCloseable {
  /** Send one command verbatim. */
  RedisReply dispatch(String command, List<String> args);

  /** Change the selected logical database; later commands on this session use it. */
  void select(int index);

  @Override
  void close();
}
