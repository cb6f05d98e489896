package io.github.jsonschemalite.schema;

import java.util.Locale;

/// Built-in format validators. Both are pure textual grammars; nothing is resolved over the network.
public enum Format implements FormatValidator {
  IPV4 {
    @Override
    public boolean test(String s) {
      String[] parts = s.split("\\.", -1);
      if (parts.length != 4) return false;

      for (String part : parts) {
        if (part.isEmpty() || part.length() > 3 || !isDigits(part)) return false;
        // Check for leading zeros (except for 0 itself)
        if (part.length() > 1 && part.startsWith("0")) return false;
        if (Integer.parseInt(part) > 255) return false;
      }
      return true;
    }
  },

  IPV6 {
    @Override
    public boolean test(String s) {
      if (s.isEmpty() || s.length() > 45) return false;
      int compressed = s.indexOf("::");
      if (compressed < 0) {
        return groupCount(s, true) == 8;
      }
      // at most one "::"
      if (s.indexOf("::", compressed + 1) >= 0) return false;
      int head = groupCount(s.substring(0, compressed), false);
      int tail = groupCount(s.substring(compressed + 2), true);
      // "::" stands for at least one zero group
      return head >= 0 && tail >= 0 && head + tail <= 7;
    }
  };

  /// @return the `format` keyword value, e.g. `ipv4`
  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }

  /// Counts 16-bit groups in a colon-separated run; -1 when malformed.
  /// A trailing dotted quad counts as two groups when `mayEndWithIpv4` is set.
  private static int groupCount(String run, boolean mayEndWithIpv4) {
    if (run.isEmpty()) return 0;
    String[] groups = run.split(":", -1);
    int count = 0;
    for (int i = 0; i < groups.length; i++) {
      String group = groups[i];
      if (mayEndWithIpv4 && i == groups.length - 1 && group.indexOf('.') >= 0) {
        if (!IPV4.test(group)) return -1;
        count += 2;
      } else if (group.matches("[0-9A-Fa-f]{1,4}")) {
        count++;
      } else {
        return -1;
      }
    }
    return count;
  }
}
