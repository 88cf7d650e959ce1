package formlang;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Nondeterministic transition relation: a multi-map from a source state and a
 * label to the set of targets reachable along that label.
 *
 * <p>Targets are plain state handles for automata and richer values (eg. a
 * state paired with an output word) for transducers. Queries about unknown
 * states or labels give empty results instead of failing.
 *
 * @param <V> targets of the relation
 */
public final class TransitionRelation<V> {

  /**
   * Single edge of the relation.
   *
   * @param from source state
   * @param label symbol or epsilon
   * @param to target
   */
  public record Transition<V>(int from, Label label, V to) { }

  // Outer map keyed by source state, inner by label
  private final Map<Integer, Map<Label, Set<V>>> edges = new LinkedHashMap<>();
  private final Set<Symbol> symbols = new LinkedHashSet<>();
  private int size = 0;

  /**
   * Add an edge, registering its symbol (if any) in the alphabet.
   *
   * @param from source state
   * @param label symbol or epsilon
   * @param to target
   * @return whether the edge was new
   */
  public boolean add(int from, Label label, V to) {
    if (label instanceof Symbol symbol) {
      symbols.add(symbol);
    }
    final boolean added = edges
      .computeIfAbsent(from, k -> new LinkedHashMap<>())
      .computeIfAbsent(label, k -> new LinkedHashSet<>())
      .add(to);
    if (added) {
      size++;
    }
    return added;
  }

  /**
   * Remove an edge. The alphabet is left untouched.
   *
   * @return whether the edge was present
   */
  public boolean remove(int from, Label label, V to) {
    final Map<Label, Set<V>> byLabel = edges.get(from);
    if (byLabel == null) {
      return false;
    }
    final Set<V> targets = byLabel.get(label);
    if (targets == null || !targets.remove(to)) {
      return false;
    }
    if (targets.isEmpty()) {
      byLabel.remove(label);
    }
    if (byLabel.isEmpty()) {
      edges.remove(from);
    }
    size--;
    return true;
  }

  /**
   * Targets of a state along a label.
   *
   * @return unmodifiable view, empty if nothing matches
   */
  public Set<V> targets(int state, Label label) {
    final Map<Label, Set<V>> byLabel = edges.get(state);
    if (byLabel == null) {
      return Collections.emptySet();
    }
    final Set<V> targets = byLabel.get(label);
    return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
  }

  /**
   * Outgoing edges of a state, grouped by label.
   *
   * @return unmodifiable view, empty if the state has no outgoing edges
   */
  public Map<Label, Set<V>> outgoing(int state) {
    final Map<Label, Set<V>> byLabel = edges.get(state);
    return byLabel == null ? Collections.emptyMap() : Collections.unmodifiableMap(byLabel);
  }

  /**
   * All edges, grouped by source state in insertion order.
   */
  public Stream<Transition<V>> all() {
    return edges
      .entrySet()
      .stream()
      .flatMap(fromEntry ->
        fromEntry
          .getValue()
          .entrySet()
          .stream()
          .flatMap(labelEntry ->
            labelEntry
              .getValue()
              .stream()
              .map(to -> new Transition<V>(fromEntry.getKey(), labelEntry.getKey(), to))
          )
      );
  }

  /**
   * No epsilon edges and at most one target per state and symbol.
   */
  public boolean isDeterministic() {
    for (Map<Label, Set<V>> byLabel : edges.values()) {
      for (var entry : byLabel.entrySet()) {
        if (entry.getKey().isEpsilon() || entry.getValue().size() > 1) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Declare a symbol without adding an edge for it.
   *
   * @return whether the symbol was new
   */
  public boolean addSymbol(Symbol symbol) {
    return symbols.add(symbol);
  }

  /**
   * Symbols seen on edges (or declared), in insertion order.
   */
  public Set<Symbol> symbols() {
    return Collections.unmodifiableSet(symbols);
  }

  public int size() {
    return size;
  }

  public TransitionRelation<V> copy() {
    final var copy = new TransitionRelation<V>();
    copy.symbols.addAll(symbols);
    all().forEach(t -> copy.add(t.from(), t.label(), t.to()));
    return copy;
  }
}
