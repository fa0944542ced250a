package io.intellixity.dbui.jdbc;

import io.intellixity.dbui.exec.StatementClassifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** SQL text plus positional binds (bound with {@code setObject}). */
public record SqlStatement(String sql, List<Object> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via Statement.execute() and read the row set, if any. */
    QUERY,
    /** Execute via Statement.executeUpdate() and report the affected row count. */
    UPDATE
  }

  public SqlStatement {
    // binds may contain nulls
    binds = binds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public static SqlStatement query(String sql, Object... binds) {
    return new SqlStatement(sql, binds == null ? null : Arrays.asList(binds), ExecKind.QUERY);
  }

  /** Ad-hoc statement classified by its first keyword. */
  public static SqlStatement adHoc(String sql) {
    ExecKind k = StatementClassifier.isWriteOnly(sql) ? ExecKind.UPDATE : ExecKind.QUERY;
    return new SqlStatement(sql, List.of(), k);
  }
}
