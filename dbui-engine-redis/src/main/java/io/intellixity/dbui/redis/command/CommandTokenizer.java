package io.intellixity.dbui.redis.command;

import java.util.ArrayList;
import java.util.List;

/**
 * Shell-style splitting of one command line.\n
 *
 * Whitespace separates tokens outside quotes. Single or double quotes group text; inside them a backslash
 * escapes the next character ({@code \n}, {@code \t} and {@code \r} become control characters). An unterminated
 * quote runs to the end of the input. {@code ""} yields an empty token.\n
 */
public final class CommandTokenizer {
  private CommandTokenizer() {}

  public static List<String> tokenize(String input) {
    List<String> parts = new ArrayList<>();
    if (input == null) return parts;

    StringBuilder current = new StringBuilder();
    boolean started = false;
    boolean inQuotes = false;
    char quote = 0;

    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (inQuotes) {
        if (c == quote) {
          inQuotes = false;
        } else if (c == '\\') {
          if (i + 1 < input.length()) {
            char next = input.charAt(++i);
            current.append(switch (next) {
              case 'n' -> '\n';
              case 't' -> '\t';
              case 'r' -> '\r';
              default -> next;
            });
          }
        } else {
          current.append(c);
        }
      } else if (c == '"' || c == '\'') {
        inQuotes = true;
        quote = c;
        started = true;
      } else if (Character.isWhitespace(c)) {
        if (started) {
          parts.add(current.toString());
          current.setLength(0);
          started = false;
        }
      } else {
        current.append(c);
        started = true;
      }
    }
    if (started) parts.add(current.toString());
    return parts;
  }

  /** Trim, then drop trailing statement terminators. */
  public static String stripTerminators(String input) {
    if (input == null) return "";
    String s = input.trim();
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == ';') end--;
    return s.substring(0, end).trim();
  }
}
