package io.intellixity.dbui.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Backend-neutral tabular result.\n
 *
 * Rows hold portable values only (null, Boolean, Long, Double, String) and are positionally aligned with
 * {@link #columns()}. Statements without a row set carry empty columns/rows and a {@link #message()}.\n
 */
@JsonPropertyOrder({"columns", "rows", "row_count", "message"})
public record QueryResult(@JsonProperty("columns") List<String> columns,
                          @JsonProperty("rows") List<List<Object>> rows,
                          @JsonProperty("row_count") int rowCount,
                          @JsonProperty("message") String message) {
  public QueryResult {
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows != null) {
      for (List<Object> row : rows) {
        Objects.requireNonNull(row, "row");
        if (row.size() != columns.size()) {
          throw new IllegalArgumentException("Row width " + row.size() + " does not match column count " + columns.size());
        }
        // rows may contain nulls, so List.copyOf is not an option here
        copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
      }
    }
    rows = Collections.unmodifiableList(copy);
    if (rowCount < 0) throw new IllegalArgumentException("rowCount must be >= 0");
    if (columns.isEmpty() && (message == null || message.isEmpty())) {
      throw new IllegalArgumentException("A result without columns must carry a message");
    }
  }

  /** Row-producing result; row_count is the number of rows. */
  public static QueryResult of(List<String> columns, List<List<Object>> rows) {
    return new QueryResult(columns, rows, rows == null ? 0 : rows.size(), null);
  }

  /** Row-producing result with an informational message (cursor hints and the like). */
  public static QueryResult of(List<String> columns, List<List<Object>> rows, String message) {
    return new QueryResult(columns, rows, rows == null ? 0 : rows.size(), message);
  }

  /** Single-row, single-column result. */
  public static QueryResult single(String column, Object value) {
    List<Object> row = new ArrayList<>(1);
    row.add(value);
    return of(List.of(column), List.of(row));
  }

  /** Result without a row set. */
  public static QueryResult message(String message) {
    return new QueryResult(List.of(), List.of(), 0, Objects.requireNonNull(message, "message"));
  }

  /** Result of a write-only statement. */
  public static QueryResult affected(long rowsAffected) {
    return message(rowsAffected + " row(s) affected.");
  }

  public boolean hasRows() {
    return !rows.isEmpty();
  }
}
