package io.intellixity.dbui.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lowering of arbitrary Java values into the portable vocabulary: null, Boolean, Long, Double, String.\n
 *
 * Numbers promote to Long (integral) or Double. Temporal values and UUIDs render as ISO-8601/RFC-3339 strings.
 * Collections, arrays and maps render as compact JSON text.\n
 */
public final class PortableValues {
  private PortableValues() {}

  private static final ObjectMapper JSON = new ObjectMapper();

  public static boolean isPortable(Object v) {
    return v == null || v instanceof Boolean || v instanceof Long || v instanceof Double || v instanceof String;
  }

  public static Object lower(Object raw) {
    if (isPortable(raw)) {
      return (raw instanceof Double d) ? finiteOrNull(d) : raw;
    }
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) return ((Number) raw).longValue();
    if (raw instanceof Float f) return finiteOrNull(f.doubleValue());
    if (raw instanceof BigDecimal bd) return finiteOrNull(bd.doubleValue());
    if (raw instanceof BigInteger bi) return bi.bitLength() < 64 ? (Object) bi.longValue() : finiteOrNull(bi.doubleValue());
    if (raw instanceof Number n) return finiteOrNull(n.doubleValue());
    if (raw instanceof CharSequence cs) return cs.toString();
    if (raw instanceof Character c) return String.valueOf(c);
    if (raw instanceof UUID u) return u.toString();
    if (raw instanceof LocalDateTime ldt) return ldt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    if (raw instanceof OffsetDateTime odt) return rfc3339Utc(odt);
    if (raw instanceof LocalDate ld) return ld.format(DateTimeFormatter.ISO_LOCAL_DATE);
    if (raw instanceof LocalTime lt) return lt.format(DateTimeFormatter.ISO_LOCAL_TIME);
    if (raw instanceof Date d) return rfc3339Utc(d.toInstant().atOffset(ZoneOffset.UTC));
    if (raw instanceof byte[] b) return new String(b, StandardCharsets.UTF_8);
    if (raw instanceof Map<?, ?> || raw instanceof Collection<?> || raw instanceof Object[]) return toJsonText(raw);
    return raw.toString();
  }

  /** Lower every element of a row. */
  public static List<Object> lowerAll(List<?> raw) {
    List<Object> out = new ArrayList<>(raw.size());
    for (Object o : raw) out.add(lower(o));
    return out;
  }

  public static String rfc3339Utc(OffsetDateTime odt) {
    return odt.withOffsetSameInstant(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }

  /** Compact JSON text for nested aggregates; elements are lowered first. */
  public static String toJsonText(Object aggregate) {
    try {
      return JSON.writeValueAsString(lowerNested(aggregate));
    } catch (JsonProcessingException e) {
      // plain strings/numbers/maps only; Jackson cannot fail on these
      throw new IllegalStateException("Failed to render value as JSON", e);
    }
  }

  private static Object lowerNested(Object raw) {
    if (raw instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), lowerNested(e.getValue()));
      return out;
    }
    if (raw instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object o : c) out.add(lowerNested(o));
      return out;
    }
    if (raw instanceof Object[] a) return lowerNested(Arrays.asList(a));
    return lower(raw);
  }

  private static Double finiteOrNull(double d) {
    return (Double.isNaN(d) || Double.isInfinite(d)) ? null : d;
  }
}
