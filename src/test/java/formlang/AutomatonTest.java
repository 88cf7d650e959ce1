package formlang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import formlang.util.IntSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;

public class AutomatonTest {

  /**
   * Accepts {@code a b* (c|d)}.
   */
  static Automaton abStarCOrD() {
    final var nfa = new Automaton();
    nfa.addTransition(0, "a", 1);
    nfa.addTransition(1, "b", 1);
    nfa.addTransition(1, "c", 2);
    nfa.addTransition(1, "d", 3);
    nfa.addStartState(0);
    nfa.addFinalState(2);
    nfa.addFinalState(3);
    return nfa;
  }

  @Test
  public void testAcceptsScenario() {
    final Automaton nfa = abStarCOrD();
    assertTrue(nfa.accepts(Symbol.word("a", "b", "c")));
    assertTrue(nfa.accepts(Symbol.word("a", "c")));
    assertTrue(nfa.accepts(Symbol.word("a", "b", "b", "d")));
    assertFalse(nfa.accepts(Symbol.word("b")));
    assertFalse(nfa.accepts(Symbol.word("a")));
    assertFalse(nfa.accepts(List.of()));
  }

  @Test
  public void testUnknownSymbolRejects() {
    final Automaton nfa = abStarCOrD();
    assertFalse(nfa.accepts(Symbol.word("a", "z")));
    assertFalse(nfa.accepts(Symbol.word("z")));
  }

  @Test
  public void testRegistration() {
    final var automaton = new Automaton();
    final int q0 = automaton.state("q0");
    assertEquals(q0, automaton.state("q0"));
    final int q1 = automaton.state("q1");
    assertTrue(q0 != q1);

    final int fresh = automaton.freshState();
    assertFalse(automaton.states().contains(fresh + 1));
    automaton.addTransition(7, "x", 8);
    assertThat(automaton.states(), is(Set.of(q0, q1, fresh, 7, 8)));
    assertFalse(automaton.addState(7));
    assertEquals("q1", automaton.stateName(q1));
    assertEquals("7", automaton.stateName(7));
    assertNull(automaton.stateValue(7));

    assertThrows(IllegalArgumentException.class, () -> automaton.addState(-1));
  }

  @Test
  public void testAddTransitionIsIdempotent() {
    final var automaton = new Automaton();
    assertTrue(automaton.addTransition(0, "a", 1));
    assertFalse(automaton.addTransition(0, "a", 1));
    assertEquals(1, automaton.numberOfTransitions());

    assertTrue(automaton.removeTransition(0, Symbol.of("a"), 1));
    assertFalse(automaton.removeTransition(0, Symbol.of("a"), 1));
    assertEquals(0, automaton.numberOfTransitions());

    // Removing the only edge on a symbol keeps the symbol in the alphabet
    assertThat(automaton.alphabet(), contains(Symbol.of("a")));
  }

  @Test
  public void testEpsilonClosure() {
    final var automaton = new Automaton();
    automaton.addEpsilonTransition(0, 1);
    automaton.addEpsilonTransition(1, 2);
    automaton.addEpsilonTransition(2, 0);
    automaton.addTransition(2, "a", 3);
    automaton.addEpsilonTransition(3, 4);

    assertEquals(IntSet.of(0, 1, 2), automaton.epsilonClosure(0));
    assertEquals(IntSet.of(3, 4), automaton.epsilonClosure(3));
    assertEquals(IntSet.of(4), automaton.epsilonClosure(4));
    assertEquals(IntSet.of(0, 1, 2, 4), automaton.epsilonClosure(List.of(1, 4)));
  }

  @Test
  public void testEpsilonAcceptance() {
    final var automaton = new Automaton();
    automaton.addStartState(0);
    automaton.addEpsilonTransition(0, 1);
    automaton.addFinalState(1);
    automaton.addTransition(1, "a", 2);
    automaton.addEpsilonTransition(2, 1);

    assertTrue(automaton.accepts(List.of()));
    assertTrue(automaton.accepts(Symbol.word("a", "a", "a")));
    assertFalse(automaton.accepts(Symbol.word("b")));
    assertThat(automaton.alphabet(), contains(Symbol.of("a")));
  }

  @Test
  public void testNoStartStateAcceptsNothing() {
    final var automaton = new Automaton();
    automaton.addFinalState(0);
    automaton.addTransition(0, "a", 0);
    assertFalse(automaton.accepts(List.of()));
    assertFalse(automaton.accepts(Symbol.word("a")));
  }

  @Test
  public void testDeterministicAndTotal() {
    final Automaton nfa = abStarCOrD();
    assertTrue(nfa.isDeterministic());
    assertFalse(nfa.isTotal());

    nfa.addTransition(1, "b", 2);
    assertFalse(nfa.isDeterministic());

    final var epsilon = new Automaton();
    epsilon.addStartState(0);
    epsilon.addEpsilonTransition(0, 1);
    assertFalse(epsilon.isDeterministic());

    final var twoStarts = new Automaton();
    twoStarts.addStartState(0);
    twoStarts.addStartState(1);
    assertFalse(twoStarts.isDeterministic());

    final var total = new Automaton();
    total.addStartState(0);
    total.addTransition(0, "a", 1);
    total.addTransition(1, "a", 0);
    assertTrue(total.isTotal());
  }

  @Test
  public void testCopyIsIndependent() {
    final Automaton nfa = abStarCOrD();
    final Automaton copy = nfa.copy();
    copy.addTransition(0, "b", 2);
    copy.removeFinalState(3);

    assertFalse(nfa.accepts(Symbol.word("b")));
    assertTrue(copy.accepts(Symbol.word("b")));
    assertTrue(nfa.accepts(Symbol.word("a", "d")));
    assertFalse(copy.accepts(Symbol.word("a", "d")));
  }

  @Test
  public void testToMap() {
    final Automaton nfa = abStarCOrD();
    nfa.addEpsilonTransition(0, 2);
    final Map<Integer, Map<Label, Set<Integer>>> map = nfa.toMap();
    assertThat(map.get(1).get(Symbol.of("b")), is(Set.of(1)));
    assertThat(map.get(0).get(Epsilon.INSTANCE), is(Set.of(2)));
    assertNull(map.get(2));
    assertThat(nfa.targets(2, Symbol.of("a")), is(empty()));
  }

  @Test
  public void testSymbols() {
    assertEquals(Symbol.of("a"), new Symbol("a"));
    assertEquals(Symbol.of(Symbol.of(1)), Symbol.of(1));
    assertThat(Symbol.chars("ab"), contains(Symbol.of('a'), Symbol.of('b')));
    assertThrows(IllegalArgumentException.class, () -> new Symbol(Epsilon.INSTANCE));
    assertThrows(NullPointerException.class, () -> new Symbol(null));
    assertFalse(Epsilon.INSTANCE.equals(Symbol.of("epsilon")));
  }

  @Test
  public void testDotGraph() {
    final var automaton = new Automaton();
    final int q0 = automaton.state("q0");
    final int q1 = automaton.state("q1");
    automaton.addStartState(q0);
    automaton.addFinalState(q1);
    automaton.addTransition(q0, "<a>", q1);
    automaton.addEpsilonTransition(q1, q0);

    final String dot = automaton.dotGraph("fsm");
    assertThat(dot, containsString("digraph \"fsm\" {"));
    assertThat(dot, containsString("\"" + q0 + "\" [shape = circle, label = <q0>];"));
    assertThat(dot, containsString("\"" + q1 + "\" [shape = doublecircle, label = <q1>];"));
    assertThat(dot, containsString("\"_start0\" -> \"" + q0 + "\";"));
    assertThat(dot, containsString("\"" + q0 + "\" -> \"" + q1 + "\" [label = <&lt;a&gt;>];"));
    assertThat(dot, containsString("\"" + q1 + "\" -> \"" + q0 + "\" [label = <&epsilon;>];"));
  }

  @Test
  public void testToStringNamesStates() {
    final var automaton = new Automaton();
    automaton.addStartState(automaton.state("s"));
    automaton.addTransition(automaton.state("s"), "x", automaton.state("t"));
    automaton.addFinalState(automaton.state("t"));
    assertEquals(
      "Automaton(states=2, start={s}, final={t}, transitions=[s -x-> t])",
      automaton.toString()
    );
  }
}
