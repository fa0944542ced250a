package io.intellixity.dbui.jdbc.mysql;

import io.intellixity.dbui.jdbc.coerce.JdbcValueCoercer;
import io.intellixity.dbui.jdbc.coerce.ValueReaders;

import java.util.Locale;

/** Coercion table keyed by Connector/J type names; the UNSIGNED suffix and any length are ignored. */
public final class MySqlValueCoercer extends JdbcValueCoercer {
  public MySqlValueCoercer() {
    register(ValueReaders.BOOLEAN, "BOOLEAN", "BOOL", "BIT");
    register(ValueReaders.LONG, "TINYINT", "SMALLINT", "MEDIUMINT", "INT", "INTEGER", "BIGINT", "YEAR");
    register(ValueReaders.DOUBLE, "FLOAT", "DOUBLE", "DECIMAL");
    register(ValueReaders.TIMESTAMP, "DATETIME", "TIMESTAMP");
    register(ValueReaders.LOCAL_DATE, "DATE");
    register(ValueReaders.LOCAL_TIME, "TIME");
  }

  @Override
  public String normalizeTag(String typeName) {
    if (typeName == null) return "";
    String t = typeName.trim().toUpperCase(Locale.ROOT);
    int paren = t.indexOf('(');
    if (paren >= 0) t = t.substring(0, paren);
    if (t.endsWith(" UNSIGNED")) t = t.substring(0, t.length() - " UNSIGNED".length());
    return t.trim();
  }
}
