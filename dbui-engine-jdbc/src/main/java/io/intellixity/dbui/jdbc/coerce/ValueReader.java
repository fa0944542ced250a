package io.intellixity.dbui.jdbc.coerce;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Typed read of one cell. May return any Java value; the coercer lowers it to the portable vocabulary. */
@FunctionalInterface
public interface ValueReader {
  Object read(ResultSet rs, int column) throws SQLException;
}
