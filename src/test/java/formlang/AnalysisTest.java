package formlang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.Test;

public class AnalysisTest {

  /**
   * States q0 (start) and q1 (final) over {0, 1}: q0 -0-> q0, q0 -1-> q1,
   * q1 -1-> q0.
   */
  static Automaton zeroOne() {
    final var automaton = new Automaton();
    final int q0 = automaton.state("q0");
    final int q1 = automaton.state("q1");
    automaton.addStartState(q0);
    automaton.addFinalState(q1);
    automaton.addTransition(q0, 0, q0);
    automaton.addTransition(q0, 1, q1);
    automaton.addTransition(q1, 1, q0);
    return automaton;
  }

  @Test
  public void testIsEmpty() {
    assertFalse(Analysis.isEmpty(zeroOne()));
    assertFalse(Analysis.isEmpty(AutomatonTest.abStarCOrD()));

    final var unreachableFinal = new Automaton();
    unreachableFinal.addStartState(0);
    unreachableFinal.addTransition(0, "a", 1);
    unreachableFinal.addTransition(2, "a", 3);
    unreachableFinal.addFinalState(3);
    assertTrue(Analysis.isEmpty(unreachableFinal));

    assertTrue(Analysis.isEmpty(new Automaton()));

    final var throughEpsilon = new Automaton();
    throughEpsilon.addStartState(0);
    throughEpsilon.addEpsilonTransition(0, 1);
    throughEpsilon.addFinalState(1);
    assertFalse(Analysis.isEmpty(throughEpsilon));
  }

  @Test
  public void testIsFiniteAndAcyclic() {
    final Automaton infinite = AutomatonTest.abStarCOrD();
    assertFalse(Analysis.isFinite(infinite));
    assertFalse(Analysis.isAcyclic(infinite));

    final Automaton single = OperationsTest.letter("a");
    assertTrue(Analysis.isFinite(single));
    assertTrue(Analysis.isAcyclic(single));

    // A cycle that can never lead to acceptance
    final Automaton deadLoop = OperationsTest.letter("a");
    deadLoop.addTransition(0, "b", 2);
    deadLoop.addTransition(2, "b", 2);
    assertTrue(Analysis.isFinite(deadLoop));
    assertFalse(Analysis.isAcyclic(deadLoop));

    // A cycle that can never be entered
    final Automaton unreachableLoop = OperationsTest.letter("a");
    unreachableLoop.addTransition(5, "a", 6);
    unreachableLoop.addTransition(6, "a", 5);
    assertTrue(Analysis.isAcyclic(unreachableLoop));
  }

  @Test
  public void testEpsilonCyclesCount() {
    final var automaton = new Automaton();
    automaton.addStartState(0);
    automaton.addEpsilonTransition(0, 1);
    automaton.addEpsilonTransition(1, 0);
    automaton.addFinalState(1);

    assertFalse(Analysis.isAcyclic(automaton));
    assertFalse(Analysis.isFinite(automaton));
  }

  @Test
  public void testIsEquivalent() {
    final Automaton abStarAb = Operations.concatenate(
      Operations.star(Operations.union(OperationsTest.letter("a"), OperationsTest.letter("b"))),
      Operations.concatenate(OperationsTest.letter("a"), OperationsTest.letter("b"))
    );
    assertTrue(Analysis.isEquivalent(abStarAb, DeterminizerTest.endsInAb()));
    assertTrue(Analysis.isEquivalent(DeterminizerTest.endsInAb(), abStarAb));
    assertFalse(Analysis.isEquivalent(abStarAb, OperationsTest.evenLength()));
    assertFalse(Analysis.isEquivalent(OperationsTest.letter("a"), OperationsTest.letter("b")));
    assertTrue(Analysis.isEquivalent(MinimizerTest.redundantFinals(), Operations.union(
      OperationsTest.letter("a"),
      OperationsTest.letter("b")
    )));
  }

  @Test
  public void testIsEquivalentAcrossAlphabets() {
    final Automaton withDeadEdge = OperationsTest.letter("a");
    withDeadEdge.addTransition(0, "b", 2);
    assertTrue(Analysis.isEquivalent(OperationsTest.letter("a"), withDeadEdge));

    final var emptyOverA = new Automaton();
    emptyOverA.addStartState(0);
    emptyOverA.addTransition(0, "a", 1);
    final var emptyOverB = new Automaton();
    emptyOverB.addStartState(0);
    emptyOverB.addSymbol(Symbol.of("b"));
    assertTrue(Analysis.isEquivalent(emptyOverA, emptyOverB));
  }

  @Test
  public void testIsEquivalentWithSameSizeDifferentShape() {
    // Both minimal with 2 states: `a` versus `a*`-with-`b`-exit variants
    final Automaton aPlus = OperationsTest.letter("a");
    aPlus.addTransition(1, "a", 1);
    final Automaton aThenB = OperationsTest.letter("a");
    aThenB.addTransition(1, "b", 1);
    assertFalse(Analysis.isEquivalent(aPlus, aThenB));
  }

  @Test
  public void testReachability() {
    final Automaton automaton = MinimizerTest.redundantFinals();
    automaton.addTransition(0, "c", 3);
    automaton.addTransition(7, "a", 1);

    assertThat(Analysis.reachableStates(automaton), containsInAnyOrder(0, 1, 2, 3));
    assertThat(Analysis.coReachableStates(automaton), containsInAnyOrder(0, 1, 2, 7));
  }

  @Test
  public void testAcceptedWords() {
    final List<String> words = Analysis
      .acceptedWords(AutomatonTest.abStarCOrD(), 3)
      .stream()
      .map(word -> word.stream().map(Symbol::toString).collect(Collectors.joining()))
      .collect(Collectors.toList());
    assertThat(words, contains("ac", "ad", "abc", "abd"));

    assertThat(Analysis.acceptedWords(AutomatonTest.abStarCOrD(), 1), empty());
    assertThat(Analysis.acceptedWords(OperationsTest.evenLength(), 0), contains(List.<Symbol>of()));
    assertThrows(
      IllegalArgumentException.class,
      () -> Analysis.acceptedWords(OperationsTest.evenLength(), -1)
    );
  }

  @Test
  public void testAcceptedWordsMatchBruteForce() {
    final Automaton nfa = DeterminizerTest.endsInAb();
    final List<List<Symbol>> expected = Words
      .upTo(nfa.alphabet(), 5)
      .stream()
      .filter(nfa::accepts)
      .collect(Collectors.toList());
    assertEquals(expected, Analysis.acceptedWords(nfa, 5));
  }
}
