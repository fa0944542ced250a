package io.intellixity.dbui.jdbc;

import io.intellixity.dbui.jdbc.coerce.JdbcValueCoercer;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Reads the current row of a ResultSet into portable values, one coercion per column type. */
public final class JdbcRowAdapter {
  private final ResultSet rs;
  private final JdbcValueCoercer coercer;
  private final List<String> columns;
  private final List<String> typeNames;

  public JdbcRowAdapter(ResultSet rs, JdbcValueCoercer coercer) throws SQLException {
    this.rs = rs;
    this.coercer = coercer;
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> cols = new ArrayList<>(n);
    List<String> types = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) {
      cols.add(md.getColumnLabel(i));
      types.add(md.getColumnTypeName(i));
    }
    this.columns = Collections.unmodifiableList(cols);
    this.typeNames = Collections.unmodifiableList(types);
  }

  public List<String> columns() { return columns; }
  public List<String> typeNames() { return typeNames; }

  public List<Object> row() {
    List<Object> out = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      out.add(coercer.read(rs, i + 1, typeNames.get(i)));
    }
    return out;
  }
}
