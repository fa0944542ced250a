package io.intellixity.dbui.jdbc.coerce;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.UUID;

/** Stock readers shared by the dialect coercion tables. */
public final class ValueReaders {
  private ValueReaders() {}

  public static final ValueReader BOOLEAN = (rs, c) -> rs.getBoolean(c);
  public static final ValueReader LONG = (rs, c) -> rs.getLong(c);
  public static final ValueReader DOUBLE = (rs, c) -> rs.getDouble(c);
  public static final ValueReader DECIMAL = (rs, c) -> rs.getBigDecimal(c);
  public static final ValueReader STRING = (rs, c) -> rs.getString(c);

  public static final ValueReader LOCAL_DATE_TIME = (rs, c) -> rs.getObject(c, LocalDateTime.class);
  public static final ValueReader OFFSET_DATE_TIME = (rs, c) -> rs.getObject(c, OffsetDateTime.class);
  public static final ValueReader LOCAL_DATE = (rs, c) -> rs.getObject(c, LocalDate.class);
  public static final ValueReader LOCAL_TIME = (rs, c) -> rs.getObject(c, LocalTime.class);
  public static final ValueReader UUID_VALUE = (rs, c) -> rs.getObject(c, UUID.class);

  /** Timestamp read for drivers without java.time support on getObject. */
  public static final ValueReader TIMESTAMP = (rs, c) -> {
    Timestamp ts = rs.getTimestamp(c);
    return ts == null ? null : ts.toLocalDateTime();
  };
}
