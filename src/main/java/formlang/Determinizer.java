package formlang;

import formlang.util.IntSet;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset (powerset) construction.
 *
 * <p>Each state of the output stands for a set of input states, identified by
 * the sorted sequence of their handles so that equal sets always collapse into
 * one output state. The output may be exponentially larger than the input;
 * that is inherent to the problem.
 */
public final class Determinizer {

  private static final Logger logger = LoggerFactory.getLogger(Determinizer.class);

  private Determinizer() { }

  /**
   * Construct a deterministic automaton accepting the same language.
   *
   * <p>The start state is the epsilon closure of all input start states. The
   * work list is first-in-first-out and symbols are tried in alphabet order,
   * so the numbering of the output is reproducible. A composite state is final
   * if any of its members is. Empty successor sets produce no transition, so
   * the output is not necessarily total.
   *
   * @param nfa any automaton (epsilon edges and many start states allowed)
   * @return equivalent deterministic automaton with the same alphabet
   */
  public static Automaton determinize(Automaton nfa) {
    final var dfa = new Automaton();
    final Set<Symbol> alphabet = nfa.alphabet();
    final Set<Integer> finals = nfa.finalStates();
    alphabet.forEach(dfa::addSymbol);

    // All `IntSet`s here are powerset states
    final Map<IntSet, Integer> seenStates = new HashMap<>();
    final var toVisit = new LinkedList<IntSet>();

    final IntSet initialState = nfa.epsilonClosure(nfa.startStates());
    final int initial = dfa.state(initialState);
    dfa.addStartState(initial);
    seenStates.put(initialState, initial);
    toVisit.addLast(initialState);

    while (!toVisit.isEmpty()) {
      final IntSet powerState = toVisit.removeFirst();
      final int from = seenStates.get(powerState);

      if (powerState.intersects(finals)) {
        dfa.addFinalState(from);
      }

      for (Symbol symbol : alphabet) {
        final IntSet outState = nfa.step(powerState, symbol);
        if (outState.isEmpty()) {
          continue;
        }

        Integer to = seenStates.get(outState);
        if (to == null) {
          to = dfa.state(outState);
          seenStates.put(outState, to);
          toVisit.addLast(outState);
        }
        dfa.addTransition(from, symbol, to);
      }
    }

    logger.debug(
      "Determinized {} states into {} states over {} symbols",
      nfa.numberOfStates(),
      dfa.numberOfStates(),
      alphabet.size()
    );
    return dfa;
  }
}
