package io.intellixity.dbui.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunables for pools and timeouts.\n
 *
 * Resolution order (last wins): built-in defaults, classpath {@code dbui.properties}, {@code dbui.*} system properties.\n
 *
 * <pre>
 * dbui.pool.maxSize=5
 * dbui.pool.minIdle=0
 * dbui.pool.connectionTimeoutMs=10000
 * dbui.query.timeoutSeconds=0
 * dbui.redis.commandTimeoutMs=30000
 * </pre>
 */
public record DbuiSettings(int maxPoolSize,
                           int minIdle,
                           long connectionTimeoutMillis,
                           int queryTimeoutSeconds,
                           long redisCommandTimeoutMillis) {
  public static final String RESOURCE = "dbui.properties";

  public static final String MAX_POOL_SIZE = "dbui.pool.maxSize";
  public static final String MIN_IDLE = "dbui.pool.minIdle";
  public static final String CONNECTION_TIMEOUT_MS = "dbui.pool.connectionTimeoutMs";
  public static final String QUERY_TIMEOUT_SECONDS = "dbui.query.timeoutSeconds";
  public static final String REDIS_COMMAND_TIMEOUT_MS = "dbui.redis.commandTimeoutMs";

  public DbuiSettings {
    if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
    if (minIdle < 0 || minIdle > maxPoolSize) throw new IllegalArgumentException("minIdle must be within [0, maxPoolSize]");
    // Hikari refuses connection timeouts below 250ms
    if (connectionTimeoutMillis < 250) throw new IllegalArgumentException("connectionTimeoutMillis must be >= 250");
    if (queryTimeoutSeconds < 0) throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    if (redisCommandTimeoutMillis <= 0) throw new IllegalArgumentException("redisCommandTimeoutMillis must be > 0");
  }

  public static DbuiSettings defaults() {
    return new DbuiSettings(5, 0, 10_000L, 0, 30_000L);
  }

  public static DbuiSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static DbuiSettings load(ClassLoader cl) {
    if (cl == null) cl = DbuiSettings.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE, e);
    }
    for (String name : System.getProperties().stringPropertyNames()) {
      if (name.startsWith("dbui.")) p.setProperty(name, System.getProperty(name));
    }
    return fromProperties(p);
  }

  public static DbuiSettings fromProperties(Properties p) {
    DbuiSettings d = defaults();
    return new DbuiSettings(
        intProp(p, MAX_POOL_SIZE, d.maxPoolSize()),
        intProp(p, MIN_IDLE, d.minIdle()),
        longProp(p, CONNECTION_TIMEOUT_MS, d.connectionTimeoutMillis()),
        intProp(p, QUERY_TIMEOUT_SECONDS, d.queryTimeoutSeconds()),
        longProp(p, REDIS_COMMAND_TIMEOUT_MS, d.redisCommandTimeoutMillis()));
  }

  private static int intProp(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
    }
  }

  private static long longProp(Properties p, String key, long def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Long.parseLong(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
    }
  }
}
