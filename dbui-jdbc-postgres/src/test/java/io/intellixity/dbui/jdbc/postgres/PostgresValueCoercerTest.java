package io.intellixity.dbui.jdbc.postgres;

import io.intellixity.dbui.jdbc.coerce.ValueReaders;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class PostgresValueCoercerTest {
  private final PostgresValueCoercer coercer = new PostgresValueCoercer();

  @Test
  void tagsAreCaseInsensitive() {
    assertSame(ValueReaders.LONG, coercer.readerFor("int4"));
    assertSame(ValueReaders.OFFSET_DATE_TIME, coercer.readerFor("timestamptz"));
    assertSame(ValueReaders.STRING, coercer.readerFor("jsonb"));
  }

  @Test
  void timestamptzRendersInUtc() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getObject(1, OffsetDateTime.class))
        .thenReturn(OffsetDateTime.of(2024, 3, 1, 12, 30, 0, 0, ZoneOffset.ofHours(-5)));
    assertEquals("2024-03-01T17:30:00Z", coercer.read(rs, 1, "timestamptz"));
  }

  @Test
  void numericBecomesDouble() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getBigDecimal(2)).thenReturn(new BigDecimal("12.50"));
    assertEquals(12.5d, coercer.read(rs, 2, "numeric"));
  }

  @Test
  void sqlNullIsNull() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getLong(1)).thenReturn(0L);
    when(rs.wasNull()).thenReturn(true);
    assertNull(coercer.read(rs, 1, "int8"));
  }

  @Test
  void failedTypedReadYieldsNull() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getObject(1, UUID.class)).thenThrow(new SQLException("bad uuid"));
    assertNull(coercer.read(rs, 1, "uuid"));
  }

  @Test
  void uuidIsCanonical() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    UUID u = UUID.fromString("00000000-0000-0000-0000-00000000002a");
    when(rs.getObject(1, UUID.class)).thenReturn(u);
    assertEquals("00000000-0000-0000-0000-00000000002a", coercer.read(rs, 1, "uuid"));
  }
}
