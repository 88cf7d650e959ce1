package formlang;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Brute-force word enumeration for language comparisons in tests.
 */
public final class Words {

  private Words() { }

  /**
   * Every word over the alphabet of length at most {@code maxLength},
   * shortest first.
   */
  public static List<List<Symbol>> upTo(Collection<Symbol> alphabet, int maxLength) {
    final var output = new ArrayList<List<Symbol>>();
    List<List<Symbol>> layer = List.of(List.of());
    for (int length = 0; length <= maxLength; length++) {
      output.addAll(layer);
      final var nextLayer = new ArrayList<List<Symbol>>();
      for (List<Symbol> word : layer) {
        for (Symbol symbol : alphabet) {
          final var longer = new ArrayList<Symbol>(word);
          longer.add(symbol);
          nextLayer.add(List.copyOf(longer));
        }
      }
      layer = nextLayer;
    }
    return output;
  }

  /**
   * Check that two automata agree on every word up to some length.
   */
  public static void assertSameWords(
    Automaton expected,
    Automaton actual,
    Collection<Symbol> alphabet,
    int maxLength
  ) {
    for (List<Symbol> word : upTo(alphabet, maxLength)) {
      assertEquals("word " + word, expected.accepts(word), actual.accepts(word));
    }
  }
}
