package io.intellixity.sqlbridge.jdbc;

import java.util.ArrayList;
import java.util.List;

/** Splits a ';'-separated script, ignoring separators inside quotes. Blank statements are dropped. */
final class SqlScripts {
  private SqlScripts() {}

  static List<String> split(String script) {
    List<String> out = new ArrayList<>();
    StringBuilder cur = new StringBuilder();
    char quote = 0;
    for (int i = 0; i < script.length(); i++) {
      char c = script.charAt(i);
      if (quote != 0) {
        if (c == quote) quote = 0;
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == ';') {
        add(out, cur);
        continue;
      }
      cur.append(c);
    }
    add(out, cur);
    return out;
  }

  private static void add(List<String> out, StringBuilder cur) {
    String s = cur.toString().trim();
    if (!s.isEmpty()) out.add(s);
    cur.setLength(0);
  }
}
