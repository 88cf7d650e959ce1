package formlang;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Input symbol, compared by value.
 *
 * @param value opaque token (anything with sensible {@code equals}/{@code hashCode})
 */
public record Symbol(Object value) implements Label {

  public Symbol {
    Objects.requireNonNull(value, "symbol value");
    if (value instanceof Label) {
      throw new IllegalArgumentException("symbol cannot wrap a label: " + value);
    }
  }

  public static Symbol of(Object value) {
    return value instanceof Symbol symbol ? symbol : new Symbol(value);
  }

  /**
   * Build a word out of symbol values.
   *
   * @param values values of the successive symbols
   * @return word as an unmodifiable list
   */
  public static List<Symbol> word(Object... values) {
    return Arrays
      .stream(values)
      .map(Symbol::of)
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Build a word out of the characters of a string, one symbol per character.
   */
  public static List<Symbol> chars(String characters) {
    return characters
      .chars()
      .mapToObj(c -> new Symbol(Character.valueOf((char) c)))
      .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public String dotLabel() {
    return value
      .toString()
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
