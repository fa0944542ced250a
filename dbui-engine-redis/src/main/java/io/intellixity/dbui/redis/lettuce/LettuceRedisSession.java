package io.intellixity.dbui.redis.lettuce;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.conn.ConnectionDescriptor;
import io.intellixity.dbui.error.ConnectFailedException;
import io.intellixity.dbui.error.InvalidArgumentException;
import io.intellixity.dbui.redis.RedisReply;
import io.intellixity.dbui.redis.RedisSession;
import io.intellixity.dbui.redis.RedisSessionException;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.LettuceFutures;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisFuture;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.ProtocolVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Lettuce-backed session: one {@link RedisClient} and one UTF-8 {@link StatefulRedisConnection}.\n
 *
 * The client is pinned to RESP2 so replies keep the flat array shapes the result shaping expects.\n
 */
public final class LettuceRedisSession implements RedisSession {
  private static final Logger log = LoggerFactory.getLogger(LettuceRedisSession.class);

  private final RedisClient client;
  private final StatefulRedisConnection<String, String> connection;
  private final long commandTimeoutMillis;

  private LettuceRedisSession(RedisClient client, StatefulRedisConnection<String, String> connection, long commandTimeoutMillis) {
    this.client = client;
    this.connection = connection;
    this.commandTimeoutMillis = commandTimeoutMillis;
  }

  /** Connect and authenticate. Matches {@link io.intellixity.dbui.redis.RedisSessionFactory}. */
  public static LettuceRedisSession open(ConnectionDescriptor d, DbuiSettings settings) {
    Objects.requireNonNull(d, "descriptor");
    Objects.requireNonNull(settings, "settings");

    RedisURI.Builder uri = RedisURI.Builder.redis(d.host(), d.port())
        .withTimeout(Duration.ofMillis(settings.redisCommandTimeoutMillis()));
    if (!d.username().isEmpty()) {
      uri.withAuthentication(d.username(), d.password());
    } else if (!d.password().isEmpty()) {
      uri.withPassword(d.password().toCharArray());
    }
    if (d.database() != null) uri.withDatabase(databaseIndex(d.database()));

    RedisClient client = RedisClient.create();
    client.setOptions(ClientOptions.builder()
        .protocolVersion(ProtocolVersion.RESP2)
        .socketOptions(SocketOptions.builder()
            .connectTimeout(Duration.ofMillis(settings.connectionTimeoutMillis()))
            .build())
        .build());

    try {
      StatefulRedisConnection<String, String> conn = client.connect(StringCodec.UTF8, uri.build());
      log.debug("dbui.redis_connect connectionId={} host={} port={} database={}", d.id(), d.host(), d.port(), d.database());
      return new LettuceRedisSession(client, conn, settings.redisCommandTimeoutMillis());
    } catch (RedisException e) {
      client.shutdown();
      throw new ConnectFailedException("Failed to connect to Redis: " + e.getMessage(), e);
    }
  }

  @Override
  public RedisReply dispatch(String command, List<String> args) {
    CommandArgs<String, String> ca = new CommandArgs<>(StringCodec.UTF8);
    for (String a : args) ca.add(a);
    long start = System.nanoTime();
    try {
      RedisFuture<RedisReply> f = connection.async().dispatch(new RawCommand(command), new ReplyOutput(), ca);
      RedisReply reply = LettuceFutures.awaitOrCancel(f, commandTimeoutMillis, TimeUnit.MILLISECONDS);
      if (log.isDebugEnabled()) {
        log.debug("dbui.redis op={} argCount={} durationMs={}", command, args.size(), (System.nanoTime() - start) / 1_000_000.0);
      }
      return reply == null ? RedisReply.NIL : reply;
    } catch (RedisCommandExecutionException e) {
      return new RedisReply.Error(String.valueOf(e.getMessage()));
    } catch (RedisException e) {
      throw new RedisSessionException(String.valueOf(e.getMessage()), e);
    }
  }

  @Override
  public void select(int index) {
    try {
      LettuceFutures.awaitOrCancel(connection.async().select(index), commandTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (RedisException e) {
      throw new RedisSessionException(String.valueOf(e.getMessage()), e);
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } finally {
      client.shutdown();
    }
  }

  private static int databaseIndex(String database) {
    try {
      return Integer.parseInt(database.trim());
    } catch (NumberFormatException e) {
      throw new InvalidArgumentException("Invalid database index: " + database, e);
    }
  }
}
