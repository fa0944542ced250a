package io.intellixity.dbui.exec;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Coarse read/write classification of SQL text. No parsing beyond the first keyword. */
public final class StatementClassifier {
  private StatementClassifier() {}

  private static final Set<String> WRITE_KEYWORDS = Set.of(
      "INSERT", "UPDATE", "DELETE", "CREATE", "ALTER", "DROP", "TRUNCATE", "GRANT", "REVOKE");

  private static final Pattern RETURNING = Pattern.compile("\\bRETURNING\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * True if the statement produces no row set: first keyword is a write keyword and there is no RETURNING clause.
   */
  public static boolean isWriteOnly(String sql) {
    if (sql == null) return false;
    String trimmed = sql.trim();
    if (trimmed.isEmpty()) return false;
    if (RETURNING.matcher(trimmed).find()) return false;
    return WRITE_KEYWORDS.contains(firstKeyword(trimmed));
  }

  /** Upper-cased first whitespace-delimited word, or "" for blank input. */
  public static String firstKeyword(String sql) {
    if (sql == null) return "";
    String trimmed = sql.trim();
    if (trimmed.isEmpty()) return "";
    return WHITESPACE.split(trimmed, 2)[0].toUpperCase(Locale.ROOT);
  }
}
