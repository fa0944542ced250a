package io.intellixity.dbui.jdbc.coerce;

import io.intellixity.dbui.mapping.PortableValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-dialect table from column type tag to typed reader.\n
 *
 * Unknown tags fall back to a string read. A failed typed read yields null for that cell only; SQL NULL is
 * always null. Results are lowered through {@link PortableValues}.\n
 */
public class JdbcValueCoercer {
  private static final Logger log = LoggerFactory.getLogger(JdbcValueCoercer.class);

  private final Map<String, ValueReader> readers = new HashMap<>();

  protected final JdbcValueCoercer register(ValueReader reader, String... tags) {
    Objects.requireNonNull(reader, "reader");
    for (String t : tags) readers.put(t.toUpperCase(Locale.ROOT), reader);
    return this;
  }

  /** Normalize a driver type name to a lookup tag. Dialects strip suffixes here. */
  public String normalizeTag(String typeName) {
    return typeName == null ? "" : typeName.trim().toUpperCase(Locale.ROOT);
  }

  public ValueReader readerFor(String typeName) {
    return readers.getOrDefault(normalizeTag(typeName), ValueReaders.STRING);
  }

  public Object read(ResultSet rs, int column, String typeName) {
    ValueReader r = readerFor(typeName);
    try {
      Object v = r.read(rs, column);
      if (v == null || rs.wasNull()) return null;
      return PortableValues.lower(v);
    } catch (SQLException | RuntimeException e) {
      if (log.isTraceEnabled()) {
        log.trace("dbui.coerce fallback column={} type={} error={}", column, typeName, e.getClass().getSimpleName());
      }
      return null;
    }
  }
}
