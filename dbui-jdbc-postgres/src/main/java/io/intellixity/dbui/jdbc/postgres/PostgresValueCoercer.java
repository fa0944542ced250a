package io.intellixity.dbui.jdbc.postgres;

import io.intellixity.dbui.jdbc.coerce.JdbcValueCoercer;
import io.intellixity.dbui.jdbc.coerce.ValueReaders;

/** Coercion table keyed by pgjdbc type names (upper-cased). */
public final class PostgresValueCoercer extends JdbcValueCoercer {
  public PostgresValueCoercer() {
    register(ValueReaders.BOOLEAN, "BOOL");
    register(ValueReaders.LONG, "INT2", "INT4", "INT8", "SERIAL", "SMALLSERIAL", "BIGSERIAL");
    register(ValueReaders.DOUBLE, "FLOAT4", "FLOAT8");
    register(ValueReaders.DECIMAL, "NUMERIC");
    register(ValueReaders.LOCAL_DATE_TIME, "TIMESTAMP");
    register(ValueReaders.OFFSET_DATE_TIME, "TIMESTAMPTZ");
    register(ValueReaders.LOCAL_DATE, "DATE");
    register(ValueReaders.LOCAL_TIME, "TIME");
    register(ValueReaders.UUID_VALUE, "UUID");
  }
}
