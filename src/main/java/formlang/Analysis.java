package formlang;

import formlang.util.IntSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decision procedures and graph queries over automata.
 *
 * <p>Epsilon edges count as edges everywhere: a cycle made only of epsilon
 * edges is still a cycle.
 */
public final class Analysis {

  private static final Logger logger = LoggerFactory.getLogger(Analysis.class);

  private Analysis() { }

  /**
   * States reachable from some start state (start states included).
   *
   * @return fresh mutable set, in order of discovery
   */
  public static Set<Integer> reachableStates(Automaton a) {
    final var reached = new LinkedHashSet<Integer>(a.startStates());
    final var toVisit = new LinkedList<Integer>(a.startStates());
    while (!toVisit.isEmpty()) {
      for (Set<Integer> targets : a.outgoing(toVisit.removeFirst()).values()) {
        for (int target : targets) {
          if (reached.add(target)) {
            toVisit.addLast(target);
          }
        }
      }
    }
    return reached;
  }

  /**
   * States from which some final state is reachable (final states included).
   *
   * @return fresh mutable set
   */
  public static Set<Integer> coReachableStates(Automaton a) {
    final Map<Integer, List<Integer>> predecessors = new HashMap<>();
    a.transitions().forEach(t ->
      predecessors.computeIfAbsent(t.to(), k -> new ArrayList<>()).add(t.from())
    );

    final var reached = new LinkedHashSet<Integer>(a.finalStates());
    final var toVisit = new LinkedList<Integer>(a.finalStates());
    while (!toVisit.isEmpty()) {
      for (int source : predecessors.getOrDefault(toVisit.removeFirst(), List.of())) {
        if (reached.add(source)) {
          toVisit.addLast(source);
        }
      }
    }
    return reached;
  }

  /**
   * Does the automaton accept no word at all?
   */
  public static boolean isEmpty(Automaton a) {
    for (int state : reachableStates(a)) {
      if (a.isFinalState(state)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Does the automaton accept finitely many words?
   *
   * <p>The language is infinite exactly when a cycle goes through a state that
   * is both reachable and co-reachable.
   */
  public static boolean isFinite(Automaton a) {
    final Set<Integer> useful = reachableStates(a);
    useful.retainAll(coReachableStates(a));
    return !hasCycle(a, useful);
  }

  /**
   * Is the part of the graph reachable from the start states free of cycles?
   *
   * <p>Unlike {@link #isFinite}, cycles through dead states count.
   */
  public static boolean isAcyclic(Automaton a) {
    return !hasCycle(a, reachableStates(a));
  }

  /**
   * Do two automata accept the same language?
   *
   * <p>Both sides are determinized, completed over the union of their
   * alphabets, and minimized. The minimal automata are then walked in lockstep
   * from their start states, building a bijection between states; any finality
   * mismatch, one-sided transition or conflicting pair means the languages
   * differ. Automata over different alphabets are compared, never refused.
   *
   * @param a first automaton, any shape
   * @param b second automaton, any shape
   * @return whether both accept exactly the same words
   */
  public static boolean isEquivalent(Automaton a, Automaton b) {
    final var symbols = new LinkedHashSet<Symbol>(a.alphabet());
    symbols.addAll(b.alphabet());
    final Automaton left = canonical(a, symbols);
    final Automaton right = canonical(b, symbols);

    if (left.numberOfStates() != right.numberOfStates()) {
      logger.debug(
        "Not equivalent: minimal automata have {} and {} states",
        left.numberOfStates(),
        right.numberOfStates()
      );
      return false;
    }

    final var leftToRight = new HashMap<Integer, Integer>();
    final var rightToLeft = new HashMap<Integer, Integer>();
    final var toVisit = new LinkedList<int[]>();
    final int leftStart = left.startStates().iterator().next();
    final int rightStart = right.startStates().iterator().next();
    leftToRight.put(leftStart, rightStart);
    rightToLeft.put(rightStart, leftStart);
    toVisit.add(new int[] { leftStart, rightStart });

    while (!toVisit.isEmpty()) {
      final int[] pair = toVisit.removeFirst();
      if (left.isFinalState(pair[0]) != right.isFinalState(pair[1])) {
        return false;
      }
      for (Symbol symbol : symbols) {
        final Integer leftNext = left.target(pair[0], symbol);
        final Integer rightNext = right.target(pair[1], symbol);
        if (leftNext == null || rightNext == null) {
          if ((leftNext == null) != (rightNext == null)) {
            return false;
          }
          continue;
        }
        final Integer knownRight = leftToRight.get(leftNext);
        final Integer knownLeft = rightToLeft.get(rightNext);
        if (knownRight == null && knownLeft == null) {
          leftToRight.put(leftNext, rightNext);
          rightToLeft.put(rightNext, leftNext);
          toVisit.addLast(new int[] { leftNext, rightNext });
        } else if (!rightNext.equals(knownRight) || !leftNext.equals(knownLeft)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * All accepted words of length at most {@code maxLength}, shortest first.
   *
   * <p>Words of equal length come out in the order the search meets them,
   * which follows the alphabet order.
   *
   * @param a any automaton
   * @param maxLength bound on word length
   * @return accepted words, each once
   * @throws IllegalArgumentException if the bound is negative
   */
  public static List<List<Symbol>> acceptedWords(Automaton a, int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("negative length bound: " + maxLength);
    }

    // Only configurations from which a final state can still be reached matter
    final Set<Integer> live = coReachableStates(a);
    final var output = new ArrayList<List<Symbol>>();

    List<Map.Entry<List<Symbol>, IntSet>> layer = new ArrayList<>();
    layer.add(Map.entry(List.of(), a.epsilonClosure(a.startStates())));
    for (int length = 0; length <= maxLength && !layer.isEmpty(); length++) {
      final List<Map.Entry<List<Symbol>, IntSet>> nextLayer = new ArrayList<>();
      for (var entry : layer) {
        final List<Symbol> word = entry.getKey();
        final IntSet configuration = entry.getValue();
        if (configuration.intersects(a.finalStates())) {
          output.add(word);
        }
        if (length == maxLength) {
          continue;
        }
        for (Symbol symbol : a.alphabet()) {
          final IntSet next = a.step(configuration, symbol);
          if (next.intersects(live)) {
            final var longer = new ArrayList<Symbol>(word);
            longer.add(symbol);
            nextLayer.add(Map.entry(List.copyOf(longer), next));
          }
        }
      }
      layer = nextLayer;
    }
    return output;
  }

  private static Automaton canonical(Automaton a, Collection<Symbol> symbols) {
    return Minimizer.minimize(Operations.complete(Determinizer.determinize(a), symbols));
  }

  /**
   * Iterative depth-first search for a cycle among some states.
   *
   * @param a automaton whose edges are followed
   * @param within states the search is restricted to
   */
  private static boolean hasCycle(Automaton a, Set<Integer> within) {
    // Absent: not visited yet, false: on the current path, true: finished
    final var finished = new HashMap<Integer, Boolean>();

    for (int root : within) {
      if (finished.containsKey(root)) {
        continue;
      }
      final var path = new ArrayDeque<Iterator<Integer>>();
      final var pathStates = new ArrayDeque<Integer>();
      finished.put(root, false);
      path.push(successors(a, root, within).iterator());
      pathStates.push(root);

      while (!path.isEmpty()) {
        final Iterator<Integer> iterator = path.peek();
        if (!iterator.hasNext()) {
          path.pop();
          finished.put(pathStates.pop(), true);
          continue;
        }
        final int next = iterator.next();
        final Boolean status = finished.get(next);
        if (status == null) {
          finished.put(next, false);
          path.push(successors(a, next, within).iterator());
          pathStates.push(next);
        } else if (!status) {
          return true;
        }
      }
    }
    return false;
  }

  private static List<Integer> successors(Automaton a, int state, Set<Integer> within) {
    final var output = new ArrayList<Integer>();
    for (Set<Integer> targets : a.outgoing(state).values()) {
      for (int target : targets) {
        if (within.contains(target)) {
          output.add(target);
        }
      }
    }
    return output;
  }
}
