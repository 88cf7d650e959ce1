package formlang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import org.junit.Test;

public class MinimizerTest {

  /**
   * Two final states without outgoing edges, entered on different symbols.
   */
  static Automaton redundantFinals() {
    final var dfa = new Automaton();
    dfa.addStartState(0);
    dfa.addTransition(0, "a", 1);
    dfa.addTransition(0, "b", 2);
    dfa.addFinalState(1);
    dfa.addFinalState(2);
    return dfa;
  }

  @Test
  public void testMergesEquivalentFinals() {
    final Automaton dfa = redundantFinals();
    final Automaton minimal = Minimizer.minimize(dfa);

    assertEquals(dfa.numberOfStates() - 1, minimal.numberOfStates());
    assertTrue(minimal.isDeterministic());
    assertTrue(minimal.accepts(Symbol.word("a")));
    assertTrue(minimal.accepts(Symbol.word("b")));
    assertFalse(minimal.accepts(Symbol.word("a", "a")));
    assertFalse(minimal.accepts(List.of()));
    Words.assertSameWords(dfa, minimal, dfa.alphabet(), 4);
  }

  @Test
  public void testPartition() {
    final Set<SortedSet<Integer>> partition = Minimizer.partition(redundantFinals());
    assertThat(partition, containsInAnyOrder(Set.of(0), Set.of(1, 2)));
  }

  @Test
  public void testIdempotent() {
    final Automaton once = Minimizer.minimize(Determinizer.determinize(DeterminizerTest.endsInAb()));
    final Automaton twice = Minimizer.minimize(once);
    assertEquals(3, once.numberOfStates());
    assertEquals(once.numberOfStates(), twice.numberOfStates());
    assertEquals(once.numberOfTransitions(), twice.numberOfTransitions());
  }

  @Test
  public void testMergesEquivalentCycle() {
    // Two states alternating on `a`, both final: (a)*
    final var dfa = new Automaton();
    dfa.addStartState(0);
    dfa.addTransition(0, "a", 1);
    dfa.addTransition(1, "a", 0);
    dfa.addFinalState(0);
    dfa.addFinalState(1);

    final Automaton minimal = Minimizer.minimize(dfa);
    assertEquals(1, minimal.numberOfStates());
    assertEquals(1, minimal.numberOfTransitions());
    assertTrue(minimal.accepts(Symbol.word("a", "a", "a")));
  }

  @Test
  public void testUnreachableStatesAreDropped() {
    final Automaton dfa = redundantFinals();
    dfa.addTransition(5, "a", 1);
    dfa.addFinalState(6);

    assertEquals(2, Minimizer.minimize(dfa).numberOfStates());
  }

  @Test
  public void testEmptyLanguage() {
    final var dfa = new Automaton();
    dfa.addStartState(0);
    dfa.addTransition(0, "a", 1);
    dfa.addTransition(1, "a", 0);

    final Automaton minimal = Minimizer.minimize(dfa);
    assertEquals(1, minimal.numberOfStates());
    assertEquals(0, minimal.numberOfTransitions());
    assertThat(minimal.finalStates(), empty());
    assertEquals(1, minimal.startStates().size());
  }

  @Test
  public void testRejectsNondeterministicInput() {
    final var error = assertThrows(
      PreconditionException.class,
      () -> Minimizer.minimize(DeterminizerTest.endsInAb())
    );
    assertEquals(PreconditionException.Requirement.DETERMINISTIC, error.requirement);
    assertEquals("minimize", error.operation);
  }

  @Test
  public void testKeepsLanguageOfDeterminizedScenario() {
    final Automaton nfa = AutomatonTest.abStarCOrD();
    final Automaton minimal = Minimizer.minimize(Determinizer.determinize(nfa));

    // start, after `a`, and the merged accepting state
    assertEquals(3, minimal.numberOfStates());
    Words.assertSameWords(nfa, minimal, nfa.alphabet(), 5);
  }
}
