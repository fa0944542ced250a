package io.intellixity.dbui.jdbc.sqlite;

import io.intellixity.dbui.jdbc.coerce.JdbcValueCoercer;
import io.intellixity.dbui.jdbc.coerce.ValueReaders;

import java.util.Locale;

/**
 * Coercion table keyed by declared column type (length suffix removed).\n
 *
 * Expression columns have no declared type; the xerial driver then reports the storage class of the first row
 * (INTEGER, FLOAT, TEXT, BLOB, NULL).\n
 */
public final class SqliteValueCoercer extends JdbcValueCoercer {
  public SqliteValueCoercer() {
    register(ValueReaders.BOOLEAN, "BOOLEAN");
    register(ValueReaders.LONG, "INTEGER", "INT", "BIGINT");
    register(ValueReaders.DOUBLE, "REAL", "FLOAT", "DOUBLE");
  }

  @Override
  public String normalizeTag(String typeName) {
    if (typeName == null) return "";
    String t = typeName.trim().toUpperCase(Locale.ROOT);
    int paren = t.indexOf('(');
    return paren >= 0 ? t.substring(0, paren).trim() : t;
  }
}
