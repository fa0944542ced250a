package io.intellixity.dbui.redis;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.ConnectionDescriptor;

/** Opens sessions; throws {@link io.intellixity.dbui.error.ConnectFailedException} when the server is unreachable. */
@FunctionalInterface
public interface RedisSessionFactory {
  RedisSession open(ConnectionDescriptor descriptor, DbuiSettings settings);
}
