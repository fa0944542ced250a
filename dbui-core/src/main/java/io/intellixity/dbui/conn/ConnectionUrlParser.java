package io.intellixity.dbui.conn;

import io.intellixity.dbui.error.InvalidArgumentException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses connection URLs into descriptors.\n
 *
 * Supported schemes: postgres, postgresql, mysql, mariadb, sqlite, redis. For sqlite the URL path becomes the
 * descriptor host (the database file).\n
 */
public final class ConnectionUrlParser {
  private ConnectionUrlParser() {}

  public static ConnectionDescriptor parse(String id, String url) {
    Objects.requireNonNull(id, "id");
    if (url == null || url.isBlank()) throw new InvalidArgumentException("Invalid URL: empty");

    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException e) {
      throw new InvalidArgumentException("Invalid URL: " + e.getMessage(), e);
    }
    if (uri.getScheme() == null) throw new InvalidArgumentException("Invalid URL: missing scheme");

    BackendKind kind = kindForScheme(uri.getScheme().toLowerCase(Locale.ROOT));

    if (kind == BackendKind.SQLITE) {
      String path = uri.getPath();
      if (path == null || path.isEmpty()) path = uri.getSchemeSpecificPart();
      return new ConnectionDescriptor(id, kind, path, 0, "", "", null);
    }

    String host = uri.getHost();
    if (host == null || host.isEmpty()) throw new InvalidArgumentException("Missing host in connection URL");

    String username = "";
    String password = "";
    String userInfo = uri.getRawUserInfo();
    if (userInfo != null) {
      int colon = userInfo.indexOf(':');
      username = decode(colon < 0 ? userInfo : userInfo.substring(0, colon));
      password = colon < 0 ? "" : decode(userInfo.substring(colon + 1));
    }
    if (username.isEmpty() && kind != BackendKind.REDIS) {
      throw new InvalidArgumentException("Missing username in connection URL");
    }

    int port = uri.getPort() > 0 ? uri.getPort() : defaultPort(kind);
    String path = uri.getPath();
    String database = (path != null && path.length() > 1) ? path.substring(1) : null;

    return new ConnectionDescriptor(id, kind, host, port, username, password, database);
  }

  public static int defaultPort(BackendKind kind) {
    return switch (kind) {
      case POSTGRES -> 5432;
      case MYSQL -> 3306;
      case SQLITE -> 0;
      case REDIS -> 6379;
    };
  }

  private static BackendKind kindForScheme(String scheme) {
    return switch (scheme) {
      case "postgres", "postgresql" -> BackendKind.POSTGRES;
      case "mysql", "mariadb" -> BackendKind.MYSQL;
      case "sqlite" -> BackendKind.SQLITE;
      case "redis" -> BackendKind.REDIS;
      default -> throw new InvalidArgumentException("Unsupported database scheme: " + scheme
          + ". Expected postgres, postgresql, mysql, mariadb, sqlite, or redis");
    };
  }

  private static String decode(String s) {
    // URLDecoder treats '+' as space; credentials keep a literal plus
    return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
  }
}
