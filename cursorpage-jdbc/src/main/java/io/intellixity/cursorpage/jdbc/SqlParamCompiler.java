package io.intellixity.cursorpage.jdbc;

/**
 * Rewrites named placeholders into JDBC {@code ?} placeholders.
 *
 * Rules:
 * - A placeholder is ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a placeholder.\n
 * - Text inside single quotes (literals) or double quotes (identifiers) is copied untouched.\n
 */
public final class SqlParamCompiler {
  private SqlParamCompiler() {}

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"') {
        if (quote == 0) {
          quote = ch;
        } else if (quote == ch) {
          // doubled quote is an escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == ch) {
            out.append(ch).append(ch);
            i++;
            continue;
          }
          quote = 0;
        }
        out.append(ch);
        continue;
      }

      if (quote == 0 && ch == ':') {
        // Skip :: casts
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
