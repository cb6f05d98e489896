package io.github.jsonschemalite.schema;

/// Direction of a size or numeric limit
public enum Bound {
  MINIMUM,
  MAXIMUM;

  /// @param comparison sign of `actual.compareTo(limit)`
  /// @param exclusive whether equality with the limit is rejected
  public boolean admits(int comparison, boolean exclusive) {
    return switch (this) {
      case MINIMUM -> exclusive ? comparison > 0 : comparison >= 0;
      case MAXIMUM -> exclusive ? comparison < 0 : comparison <= 0;
    };
  }

  public boolean admits(int actual, int limit) {
    return admits(Integer.compare(actual, limit), false);
  }
}
