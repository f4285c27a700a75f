package FSA.Model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An input symbol: either an integer or a short text.
 * Canonical decimal strings are coerced to integers, so {@code 0} and {@code "0"} are the same symbol.
 * Integers order before text; integers compare numerically, text lexicographically.
 */
public final class Symbol implements Comparable<Symbol> {
  private static final Pattern CANONICAL_INT = Pattern.compile("0|-?[1-9][0-9]{0,9}");

  private final Integer number;
  private final String text;

  private Symbol(Integer number, String text) {
    this.number = number;
    this.text = text;
  }

  public static Symbol of(int number) {
    return new Symbol(number, null);
  }

  /**
   * A character is text, never its code point.
   */
  public static Symbol of(char c) {
    return of(String.valueOf(c));
  }

  /**
   * Coerce a raw key into a symbol.
   * @param raw - a Symbol, an integral Number, or a String
   * @return the canonical symbol
   * @throws IllegalArgumentException if the value cannot be a symbol
   */
  public static Symbol of(Object raw) {
    Objects.requireNonNull(raw, "symbol");
    if (raw instanceof Symbol) {
      return (Symbol) raw;
    }
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return of(((Number) raw).intValue());
    }
    if (raw instanceof Long) {
      long l = (Long) raw;
      if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("Symbol out of integer range: " + l);
      }
      return of((int) l);
    }
    if (raw instanceof String) {
      String s = (String) raw;
      if (s.isEmpty()) {
        throw new IllegalArgumentException("Empty symbol");
      }
      if (CANONICAL_INT.matcher(s).matches()) {
        try {
          return of(Integer.parseInt(s));
        } catch (NumberFormatException e) {
          // ten digits can still overflow; keep it as text
          return new Symbol(null, s);
        }
      }
      return new Symbol(null, s);
    }
    if (raw instanceof Character) {
      return of(raw.toString());
    }
    throw new IllegalArgumentException("Unsupported symbol type: " + raw.getClass().getName());
  }

  public boolean isNumeric() {
    return number != null;
  }

  public int intValue() {
    if (number == null) {
      throw new IllegalStateException("Text symbol has no integer value: " + text);
    }
    return number;
  }

  @Override
  public int compareTo(Symbol o) {
    if (isNumeric() != o.isNumeric()) {
      return isNumeric() ? -1 : 1;
    }
    return isNumeric() ? Integer.compare(number, o.number) : text.compareTo(o.text);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Symbol)) {
      return false;
    }
    Symbol other = (Symbol) o;
    return Objects.equals(number, other.number) && Objects.equals(text, other.text);
  }

  @Override
  public int hashCode() {
    return isNumeric() ? number : text.hashCode() * 31 + 1;
  }

  @Override
  public String toString() {
    return isNumeric() ? number.toString() : text;
  }
}
