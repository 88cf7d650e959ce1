package formlang.regex;

import formlang.Automaton;
import formlang.Symbol;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of an automaton into a regular expression by eliminating states
 * one at a time.
 *
 * <p>Edges are labelled with expressions. Removing a state {@code q} with a
 * self loop {@code l} replaces every path {@code p -r1-> q -r2-> s} with the
 * edge {@code p -(r1.(l)*.r2)-> s}, merged by union with any edge already
 * going from {@code p} to {@code s}.
 */
public final class StateElimination {

  private static final Logger logger = LoggerFactory.getLogger(StateElimination.class);

  // Keys are source states, values map target states to edge labels
  private final Map<Integer, Map<Integer, Regex>> outgoing = new LinkedHashMap<>();

  // Keys are target states, values are source states
  private final Map<Integer, Set<Integer>> incoming = new LinkedHashMap<>();

  private StateElimination() { }

  /**
   * Build an expression for the language of an automaton.
   *
   * <p>A fresh start state gets epsilon edges to the original start states and
   * the original final states get epsilon edges to a fresh final state. The
   * original states are then eliminated, each time picking the one with the
   * fewest outgoing edges (self loops not counted, ties broken by smallest
   * handle). The input is not modified.
   *
   * @param automaton any automaton
   * @return expression accepting the same words; {@link Regex.EmptySet} if
   *   the automaton accepts nothing
   */
  public static Regex toRegex(Automaton automaton) {
    final var elimination = new StateElimination();

    // Pick handles outside of those used by the automaton
    final Automaton scratch = automaton.copy();
    final int start = scratch.freshState();
    final int accept = scratch.freshState();

    automaton.transitions().forEach(t -> {
      final Regex label = t.label() instanceof Symbol symbol
        ? new Regex.Letter(symbol)
        : Regex.epsilon();
      elimination.addEdge(t.from(), t.to(), label);
    });
    automaton.startStates().forEach(s -> elimination.addEdge(start, s, Regex.epsilon()));
    automaton.finalStates().forEach(s -> elimination.addEdge(s, accept, Regex.epsilon()));

    final Set<Integer> remaining = new LinkedHashSet<>(automaton.states());
    while (!remaining.isEmpty()) {
      final int state = elimination.nextToEliminate(remaining);
      remaining.remove(state);
      elimination.eliminate(state);
    }

    final Regex regex = elimination.edge(start, accept);
    final Regex result = regex == null ? Regex.empty() : regex;
    logger.debug(
      "Eliminated {} states into an expression with {} symbols",
      automaton.numberOfStates(),
      result.numberOfSymbols()
    );
    return result;
  }

  private Regex edge(int from, int to) {
    return outgoing.getOrDefault(from, Collections.emptyMap()).get(to);
  }

  private void addEdge(int from, int to, Regex label) {
    final Regex existing = edge(from, to);
    outgoing
      .computeIfAbsent(from, k -> new LinkedHashMap<>())
      .put(to, existing == null ? label : Regex.or(existing, label));
    incoming.computeIfAbsent(to, k -> new LinkedHashSet<>()).add(from);
  }

  private int nextToEliminate(Set<Integer> remaining) {
    int best = -1;
    int bestDegree = Integer.MAX_VALUE;
    for (int state : remaining) {
      final Map<Integer, Regex> out = outgoing.getOrDefault(state, Collections.emptyMap());
      final int degree = out.size() - (out.containsKey(state) ? 1 : 0);
      if (degree < bestDegree || (degree == bestDegree && state < best)) {
        best = state;
        bestDegree = degree;
      }
    }
    return best;
  }

  private void eliminate(int state) {
    final Map<Integer, Regex> out = outgoing.getOrDefault(state, Collections.emptyMap());
    final Regex loop = out.get(state);
    final Regex middle = loop == null ? Regex.epsilon() : Regex.star(loop);

    for (int source : incoming.getOrDefault(state, Collections.emptySet())) {
      if (source == state) {
        continue;
      }
      final Regex into = edge(source, state);
      for (Map.Entry<Integer, Regex> entry : out.entrySet()) {
        final int target = entry.getKey();
        if (target == state) {
          continue;
        }
        addEdge(source, target, Regex.concat(Regex.concat(into, middle), entry.getValue()));
      }
    }

    // Detach the state
    for (int source : incoming.getOrDefault(state, Collections.emptySet())) {
      final Map<Integer, Regex> sourceOut = outgoing.get(source);
      if (sourceOut != null) {
        sourceOut.remove(state);
      }
    }
    for (int target : out.keySet()) {
      final Set<Integer> targetIn = incoming.get(target);
      if (targetIn != null) {
        targetIn.remove(state);
      }
    }
    outgoing.remove(state);
    incoming.remove(state);
  }
}
