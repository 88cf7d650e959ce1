package formlang;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Automaton algebra.
 *
 * <p>Every operation returns a new automaton; operands are never modified.
 * Binary operations first copy their operands onto disjoint state handles.
 */
public final class Operations {

  private Operations() { }

  /**
   * Accepts the words accepted by either operand.
   *
   * <p>A fresh start state has epsilon edges to the start states of both
   * operands; final states are those of both operands.
   */
  public static Automaton union(Automaton a, Automaton b) {
    final var union = new Automaton();
    final Map<Integer, Integer> fromA = copyInto(union, a);
    final Map<Integer, Integer> fromB = copyInto(union, b);

    final int start = union.freshState();
    union.addStartState(start);
    for (int aStart : a.startStates()) {
      union.addEpsilonTransition(start, fromA.get(aStart));
    }
    for (int bStart : b.startStates()) {
      union.addEpsilonTransition(start, fromB.get(bStart));
    }
    a.finalStates().forEach(s -> union.addFinalState(fromA.get(s)));
    b.finalStates().forEach(s -> union.addFinalState(fromB.get(s)));
    return union;
  }

  /**
   * Accepts the words made of a word accepted by {@code a} followed by a word
   * accepted by {@code b}.
   *
   * <p>Every final state of {@code a} gets an epsilon edge to every start state
   * of {@code b}. The final states are those of {@code b}, plus those of
   * {@code a} when {@code b} accepts the empty word.
   */
  public static Automaton concatenate(Automaton a, Automaton b) {
    final var concatenation = new Automaton();
    final Map<Integer, Integer> fromA = copyInto(concatenation, a);
    final Map<Integer, Integer> fromB = copyInto(concatenation, b);

    a.startStates().forEach(s -> concatenation.addStartState(fromA.get(s)));
    for (int aFinal : a.finalStates()) {
      for (int bStart : b.startStates()) {
        concatenation.addEpsilonTransition(fromA.get(aFinal), fromB.get(bStart));
      }
    }
    b.finalStates().forEach(s -> concatenation.addFinalState(fromB.get(s)));
    if (b.accepts(List.of())) {
      a.finalStates().forEach(s -> concatenation.addFinalState(fromA.get(s)));
    }
    return concatenation;
  }

  /**
   * Kleene star: zero or more repetitions of words accepted by {@code a}.
   *
   * <p>A fresh start and a fresh final state are added. The new start links to
   * the old starts and to the new final (for the empty word); old finals link
   * back to the old starts and on to the new final. All links are epsilon.
   */
  public static Automaton star(Automaton a) {
    final var star = new Automaton();
    final Map<Integer, Integer> fromA = copyInto(star, a);

    final int start = star.freshState();
    final int accept = star.freshState();
    star.addStartState(start);
    star.addFinalState(accept);
    star.addEpsilonTransition(start, accept);
    for (int oldStart : a.startStates()) {
      star.addEpsilonTransition(start, fromA.get(oldStart));
    }
    for (int oldFinal : a.finalStates()) {
      for (int oldStart : a.startStates()) {
        star.addEpsilonTransition(fromA.get(oldFinal), fromA.get(oldStart));
      }
      star.addEpsilonTransition(fromA.get(oldFinal), accept);
    }
    return star;
  }

  /**
   * Product construction: accepts the words accepted by both operands.
   *
   * <p>Only the pairs reachable from the pair of start states are built. A pair
   * has a transition on a symbol when both components do, and is final when
   * both components are.
   *
   * @throws PreconditionException if an operand is not deterministic and total
   */
  public static Automaton intersect(Automaton a, Automaton b) {
    PreconditionException.requireTotal(a, "intersect");
    PreconditionException.requireTotal(b, "intersect");

    record Pair(int left, int right) {
      @Override
      public String toString() {
        return "(" + left + ", " + right + ")";
      }
    }

    final var product = new Automaton();
    final var symbols = new LinkedHashSet<Symbol>(a.alphabet());
    symbols.addAll(b.alphabet());
    symbols.forEach(product::addSymbol);

    final var seen = new HashMap<Pair, Integer>();
    final var toVisit = new LinkedList<Pair>();
    final var initial = new Pair(a.startStates().iterator().next(), b.startStates().iterator().next());
    product.addStartState(product.state(initial));
    seen.put(initial, product.state(initial));
    toVisit.add(initial);

    while (!toVisit.isEmpty()) {
      final Pair pair = toVisit.removeFirst();
      final int from = seen.get(pair);
      if (a.isFinalState(pair.left()) && b.isFinalState(pair.right())) {
        product.addFinalState(from);
      }
      for (Symbol symbol : symbols) {
        final Integer left = a.target(pair.left(), symbol);
        final Integer right = b.target(pair.right(), symbol);
        if (left == null || right == null) {
          continue;
        }
        final var next = new Pair(left, right);
        Integer to = seen.get(next);
        if (to == null) {
          to = product.state(next);
          seen.put(next, to);
          toVisit.addLast(next);
        }
        product.addTransition(from, symbol, to);
      }
    }
    return product;
  }

  /**
   * Accepts exactly the words over the alphabet of {@code a} that {@code a}
   * rejects.
   *
   * @throws PreconditionException if the operand is not deterministic and total
   */
  public static Automaton complement(Automaton a) {
    PreconditionException.requireTotal(a, "complement");
    final Automaton complement = a.copy();
    for (int state : a.states()) {
      if (a.isFinalState(state)) {
        complement.removeFinalState(state);
      } else {
        complement.addFinalState(state);
      }
    }
    return complement;
  }

  /**
   * Make a deterministic automaton total over its own alphabet.
   *
   * @see #complete(Automaton, Collection)
   */
  public static Automaton complete(Automaton a) {
    return complete(a, Set.of());
  }

  /**
   * Make a deterministic automaton total, optionally widening its alphabet.
   *
   * <p>Missing transitions are sent to a single new non-final state which
   * loops on every symbol. No state is added if nothing is missing.
   *
   * @param a deterministic automaton
   * @param extraSymbols symbols to add to the alphabet first
   * @return total copy of {@code a}
   * @throws PreconditionException if the operand is not deterministic
   */
  public static Automaton complete(Automaton a, Collection<Symbol> extraSymbols) {
    PreconditionException.requireDeterministic(a, "complete");
    final Automaton completed = a.copy();
    extraSymbols.forEach(completed::addSymbol);

    Integer sink = null;
    for (int state : new ArrayList<>(completed.states())) {
      for (Symbol symbol : completed.alphabet()) {
        if (completed.targets(state, symbol).isEmpty()) {
          if (sink == null) {
            sink = completed.freshState();
          }
          completed.addTransition(state, symbol, sink);
        }
      }
    }
    if (sink != null) {
      for (Symbol symbol : completed.alphabet()) {
        completed.addTransition(sink, symbol, sink);
      }
    }
    return completed;
  }

  /**
   * Accepts the mirror images of the words accepted by {@code a}.
   */
  public static Automaton reverse(Automaton a) {
    final var reversed = new Automaton();
    final Map<Integer, Integer> fromA = copyStates(reversed, a);
    a.alphabet().forEach(reversed::addSymbol);
    a.transitions().forEach(t ->
      reversed.addTransition(fromA.get(t.to()), t.label(), fromA.get(t.from()))
    );
    a.finalStates().forEach(s -> reversed.addStartState(fromA.get(s)));
    a.startStates().forEach(s -> reversed.addFinalState(fromA.get(s)));
    return reversed;
  }

  /**
   * Accepts the words accepted by {@code a} but not by {@code b}.
   *
   * <p>Both operands are determinized and completed over the union of their
   * alphabets, then {@code a} is intersected with the complement of {@code b}.
   */
  public static Automaton difference(Automaton a, Automaton b) {
    final var symbols = new LinkedHashSet<Symbol>(a.alphabet());
    symbols.addAll(b.alphabet());
    final Automaton left = complete(Determinizer.determinize(a), symbols);
    final Automaton right = complete(Determinizer.determinize(b), symbols);
    return intersect(left, complement(right));
  }

  /**
   * Keep only the states that are reachable from a start state and from which
   * a final state is reachable.
   */
  public static Automaton trim(Automaton a) {
    final Set<Integer> useful = Analysis.reachableStates(a);
    useful.retainAll(Analysis.coReachableStates(a));

    final var trimmed = new Automaton();
    a.alphabet().forEach(trimmed::addSymbol);
    final var fromA = new HashMap<Integer, Integer>();
    for (int state : a.states()) {
      if (useful.contains(state)) {
        fromA.put(state, trimmed.freshState());
      }
    }
    a.transitions()
      .filter(t -> useful.contains(t.from()) && useful.contains(t.to()))
      .forEach(t -> trimmed.addTransition(fromA.get(t.from()), t.label(), fromA.get(t.to())));
    a.startStates().stream().filter(useful::contains).forEach(s -> trimmed.addStartState(fromA.get(s)));
    a.finalStates().stream().filter(useful::contains).forEach(s -> trimmed.addFinalState(fromA.get(s)));
    return trimmed;
  }

  /**
   * Copy all states and edges of {@code source} onto fresh handles of
   * {@code target}. Start and final states are not copied.
   *
   * @return mapping from source handles to target handles
   */
  static Map<Integer, Integer> copyInto(Automaton target, Automaton source) {
    final Map<Integer, Integer> mapping = copyStates(target, source);
    source.alphabet().forEach(target::addSymbol);
    source.transitions().forEach(t ->
      target.addTransition(mapping.get(t.from()), t.label(), mapping.get(t.to()))
    );
    return mapping;
  }

  // Values are dropped: they are only unique within their own automaton
  private static Map<Integer, Integer> copyStates(Automaton target, Automaton source) {
    final var mapping = new HashMap<Integer, Integer>();
    for (int state : source.states()) {
      mapping.put(state, target.freshState());
    }
    return mapping;
  }
}
