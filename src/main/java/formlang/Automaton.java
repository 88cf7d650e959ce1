package formlang;

import formlang.util.IntSet;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finite automaton, possibly nondeterministic and with epsilon transitions.
 *
 * <p>There is a single automaton type; being deterministic or total is a
 * property which can be checked ({@link #isDeterministic}, {@link #isTotal})
 * and which some operations require. States are integer handles (see
 * {@link StateRegistry}). Referencing a state or symbol which has not been
 * seen before registers it.
 *
 * <p>Instances are mutable while being built, but none of the algorithms in
 * this package mutate their inputs: they all return fresh automata. Mutation is
 * not thread-safe; concurrent read-only use is.
 */
public final class Automaton implements DotGraph<Integer, Label> {

  private final StateRegistry registry;
  private final TransitionRelation<Integer> relation;
  private final Set<Integer> startStates;
  private final Set<Integer> finalStates;

  public Automaton() {
    this(new StateRegistry(), new TransitionRelation<>(), new LinkedHashSet<>(), new LinkedHashSet<>());
  }

  private Automaton(
    StateRegistry registry,
    TransitionRelation<Integer> relation,
    Set<Integer> startStates,
    Set<Integer> finalStates
  ) {
    this.registry = registry;
    this.relation = relation;
    this.startStates = startStates;
    this.finalStates = finalStates;
  }

  /**
   * Independent copy (same handles, same values).
   */
  public Automaton copy() {
    return new Automaton(
      registry.copy(),
      relation.copy(),
      new LinkedHashSet<>(startStates),
      new LinkedHashSet<>(finalStates)
    );
  }

  // ---------------------------------------------------------------- building

  /**
   * Look up (or register) the state carrying a value.
   *
   * @param value user-visible value of the state
   * @return handle of the state
   */
  public int state(Object value) {
    return registry.state(value);
  }

  /**
   * Register a brand new state without any value.
   *
   * @return handle of the state
   */
  public int freshState() {
    return registry.freshState();
  }

  /**
   * Register a state by handle; no-op if it is already present.
   *
   * @return whether the state was new
   */
  public boolean addState(int state) {
    return registry.register(state);
  }

  public boolean addStartState(int state) {
    registry.register(state);
    return startStates.add(state);
  }

  public boolean removeStartState(int state) {
    return startStates.remove(state);
  }

  public boolean addFinalState(int state) {
    registry.register(state);
    return finalStates.add(state);
  }

  public boolean removeFinalState(int state) {
    return finalStates.remove(state);
  }

  /**
   * Declare a symbol as part of the alphabet without using it on an edge.
   *
   * @return whether the symbol was new
   */
  public boolean addSymbol(Symbol symbol) {
    return relation.addSymbol(symbol);
  }

  /**
   * Add an edge, registering both endpoints and the label's symbol.
   *
   * @param from source state
   * @param label symbol or epsilon
   * @param to target state
   * @return whether the edge was new
   */
  public boolean addTransition(int from, Label label, int to) {
    registry.register(from);
    registry.register(to);
    return relation.add(from, label, to);
  }

  /**
   * Add a symbol edge, wrapping a raw value into a {@link Symbol}.
   */
  public boolean addTransition(int from, Object symbol, int to) {
    return addTransition(from, symbol instanceof Label label ? label : Symbol.of(symbol), to);
  }

  public boolean addEpsilonTransition(int from, int to) {
    return addTransition(from, Epsilon.INSTANCE, to);
  }

  public boolean removeTransition(int from, Label label, int to) {
    return relation.remove(from, label, to);
  }

  // ---------------------------------------------------------------- queries

  /**
   * All states, in registration order.
   */
  public Set<Integer> states() {
    return registry.handles();
  }

  public Set<Integer> startStates() {
    return Collections.unmodifiableSet(startStates);
  }

  public Set<Integer> finalStates() {
    return Collections.unmodifiableSet(finalStates);
  }

  public boolean isStartState(int state) {
    return startStates.contains(state);
  }

  public boolean isFinalState(int state) {
    return finalStates.contains(state);
  }

  /**
   * The alphabet: symbols on edges plus declared ones, in insertion order.
   * Never contains epsilon.
   */
  public Set<Symbol> alphabet() {
    return relation.symbols();
  }

  /**
   * Value attached to a state ({@code null} if it has none).
   */
  public Object stateValue(int state) {
    return registry.value(state);
  }

  /**
   * Display name of a state: its value if it has one, else its handle.
   */
  public String stateName(int state) {
    return registry.name(state);
  }

  public int numberOfStates() {
    return registry.size();
  }

  public int numberOfTransitions() {
    return relation.size();
  }

  /**
   * Targets of a state along a label; empty if there are none.
   */
  public Set<Integer> targets(int state, Label label) {
    return relation.targets(state, label);
  }

  /**
   * Outgoing edges of a state, grouped by label.
   */
  public Map<Label, Set<Integer>> outgoing(int state) {
    return relation.outgoing(state);
  }

  /**
   * The only target of a deterministic transition.
   *
   * @return target state, or {@code null} if there is no such transition
   */
  public Integer target(int state, Symbol symbol) {
    final Set<Integer> targets = relation.targets(state, symbol);
    return targets.isEmpty() ? null : targets.iterator().next();
  }

  public Stream<TransitionRelation.Transition<Integer>> transitions() {
    return relation.all();
  }

  public boolean containsTransition(int from, Label label, int to) {
    return relation.targets(from, label).contains(to);
  }

  /**
   * Snapshot of the transition relation as nested maps.
   *
   * @return state to label to targets
   */
  public Map<Integer, Map<Label, Set<Integer>>> toMap() {
    final var output = new LinkedHashMap<Integer, Map<Label, Set<Integer>>>();
    relation.all().forEach(t ->
      output
        .computeIfAbsent(t.from(), k -> new LinkedHashMap<>())
        .computeIfAbsent(t.label(), k -> new LinkedHashSet<>())
        .add(t.to())
    );
    return output;
  }

  /**
   * No epsilon edge, exactly one start state, and at most one target per
   * state and symbol.
   */
  public boolean isDeterministic() {
    return startStates.size() == 1 && relation.isDeterministic();
  }

  /**
   * Deterministic, with exactly one target for every state and every symbol
   * of the alphabet.
   */
  public boolean isTotal() {
    if (!isDeterministic()) {
      return false;
    }
    for (int state : states()) {
      for (Symbol symbol : alphabet()) {
        if (relation.targets(state, symbol).size() != 1) {
          return false;
        }
      }
    }
    return true;
  }

  // ---------------------------------------------------------------- acceptance

  /**
   * Epsilon closure of a set of states.
   *
   * <p>Fixpoint of following epsilon edges; always contains the input states.
   *
   * @param states states from which to start
   * @return states reachable using only epsilon edges
   */
  public IntSet epsilonClosure(Collection<Integer> states) {
    final var closure = new HashSet<Integer>(states);
    final var toVisit = new ArrayDeque<Integer>(states);

    while (!toVisit.isEmpty()) {
      for (int target : relation.targets(toVisit.pop(), Epsilon.INSTANCE)) {
        if (closure.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return IntSet.of(closure);
  }

  public IntSet epsilonClosure(int state) {
    return epsilonClosure(List.of(state));
  }

  /**
   * States reached by consuming one symbol from a configuration, followed by
   * the epsilon closure.
   *
   * @param configuration current set of states
   * @param symbol symbol to consume
   * @return next configuration (empty if nothing matches)
   */
  public IntSet step(IntSet configuration, Symbol symbol) {
    final var next = new HashSet<Integer>();
    configuration.stream().forEach(state -> next.addAll(relation.targets(state, symbol)));
    return epsilonClosure(next);
  }

  /**
   * Check whether the automaton accepts a word.
   *
   * <p>Symbols outside the alphabet have no transitions, so they make the
   * word rejected. The cost is {@code O(|word| * |states|^2)} in the worst
   * case; determinize first when running many words through the same
   * nondeterministic automaton.
   *
   * @param word sequence of input symbols
   * @return whether some run ends in a final state
   */
  public boolean accepts(List<Symbol> word) {
    IntSet configuration = epsilonClosure(startStates);
    for (Symbol symbol : word) {
      if (configuration.isEmpty()) {
        return false;
      }
      configuration = step(configuration, symbol);
    }
    return configuration.intersects(finalStates);
  }

  public boolean accepts(Symbol... word) {
    return accepts(Arrays.asList(word));
  }

  // ---------------------------------------------------------------- rendering

  @Override
  public Stream<Vertex<Integer>> vertices() {
    return states()
      .stream()
      .map(state -> new Vertex<>(state, startStates.contains(state), finalStates.contains(state)));
  }

  @Override
  public Stream<Edge<Integer, Label>> edges() {
    return relation
      .all()
      .map(t -> new Edge<>(t.from(), t.to(), t.label()));
  }

  @Override
  public String renderEdgeLabel(Edge<Integer, Label> edge) {
    return edge.label().dotLabel();
  }

  @Override
  public String renderVertexLabel(Vertex<Integer> vertex) {
    return registry
      .name(vertex.id())
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }

  @Override
  public String toString() {
    final String transitions = relation
      .all()
      .map(t -> registry.name(t.from()) + " -" + t.label() + "-> " + registry.name(t.to()))
      .collect(Collectors.joining(", ", "[", "]"));
    return "Automaton(states=" + numberOfStates()
      + ", start=" + names(startStates)
      + ", final=" + names(finalStates)
      + ", transitions=" + transitions + ")";
  }

  private String names(Set<Integer> states) {
    return states
      .stream()
      .map(registry::name)
      .collect(Collectors.joining(", ", "{", "}"));
  }
}
