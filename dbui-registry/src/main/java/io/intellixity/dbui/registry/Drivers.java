package io.intellixity.dbui.registry;

import io.intellixity.dbui.config.DbuiSettings;
import io.intellixity.dbui.exec.DriverAdapter;
import io.intellixity.dbui.jdbc.JdbcHandle;
import io.intellixity.dbui.jdbc.mysql.MySqlDriver;
import io.intellixity.dbui.jdbc.postgres.PostgresDriver;
import io.intellixity.dbui.jdbc.sqlite.SqliteDriver;
import io.intellixity.dbui.redis.RedisDriver;

import java.util.Objects;

/** One adapter per backend kind. */
public record Drivers(DriverAdapter<JdbcHandle> postgres,
                      DriverAdapter<JdbcHandle> mysql,
                      DriverAdapter<JdbcHandle> sqlite,
                      RedisDriver redis) {
  public Drivers {
    Objects.requireNonNull(postgres, "postgres");
    Objects.requireNonNull(mysql, "mysql");
    Objects.requireNonNull(sqlite, "sqlite");
    Objects.requireNonNull(redis, "redis");
  }

  public static Drivers create(DbuiSettings settings) {
    Objects.requireNonNull(settings, "settings");
    return new Drivers(new PostgresDriver(settings), new MySqlDriver(settings), new SqliteDriver(settings),
        new RedisDriver(settings));
  }
}
