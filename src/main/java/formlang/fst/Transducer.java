package formlang.fst;

import formlang.Automaton;
import formlang.Epsilon;
import formlang.Label;
import formlang.StateRegistry;
import formlang.Symbol;
import formlang.TransitionRelation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finite state transducer: an automaton whose edges also emit output words.
 *
 * <p>An edge reads one input symbol (or nothing, for epsilon) and appends its
 * output word to the translation. Translating a word explores every run that
 * consumes all of it and ends in a final state.
 */
public final class Transducer {

  private static final Logger logger = LoggerFactory.getLogger(Transducer.class);

  /**
   * Target of an edge.
   *
   * @param target state reached
   * @param output symbols emitted while taking the edge
   */
  public record Output(int target, List<Symbol> output) {

    public Output {
      output = List.copyOf(output);
    }
  }

  private final StateRegistry registry = new StateRegistry();
  private final TransitionRelation<Output> relation = new TransitionRelation<>();
  private final Set<Integer> startStates = new LinkedHashSet<>();
  private final Set<Integer> finalStates = new LinkedHashSet<>();
  private final Set<Symbol> outputSymbols = new LinkedHashSet<>();

  public int state(Object value) {
    return registry.state(value);
  }

  public int freshState() {
    return registry.freshState();
  }

  public boolean addStartState(int state) {
    registry.register(state);
    return startStates.add(state);
  }

  public boolean addFinalState(int state) {
    registry.register(state);
    return finalStates.add(state);
  }

  /**
   * Add an edge.
   *
   * @param from source state
   * @param input symbol read, or epsilon to read nothing
   * @param to target state
   * @param output symbols written
   * @return whether the edge was new
   */
  public boolean addTransition(int from, Label input, int to, List<Symbol> output) {
    registry.register(from);
    registry.register(to);
    outputSymbols.addAll(output);
    return relation.add(from, input, new Output(to, output));
  }

  public Set<Integer> states() {
    return registry.handles();
  }

  public Set<Integer> startStates() {
    return Collections.unmodifiableSet(startStates);
  }

  public Set<Integer> finalStates() {
    return Collections.unmodifiableSet(finalStates);
  }

  public Set<Symbol> inputSymbols() {
    return relation.symbols();
  }

  public Set<Symbol> outputSymbols() {
    return Collections.unmodifiableSet(outputSymbols);
  }

  public int numberOfTransitions() {
    return relation.size();
  }

  /**
   * All translations of a word.
   *
   * <p>Epsilon edges are only followed while the translation built so far is
   * shorter than {@code maxOutputLength}; this is what keeps epsilon cycles
   * with output from generating forever. Translations are returned once
   * each, shortest search paths first.
   *
   * @param word input word
   * @param maxOutputLength bound on output length for following epsilon edges
   * @return distinct translations
   * @throws IllegalArgumentException if the bound is negative
   */
  public List<List<Symbol>> translate(List<Symbol> word, int maxOutputLength) {
    if (maxOutputLength < 0) {
      throw new IllegalArgumentException("negative output length bound: " + maxOutputLength);
    }

    // Position in the input, output so far, current state
    record Configuration(int consumed, List<Symbol> generated, int state) { }

    final var translations = new LinkedHashSet<List<Symbol>>();
    final var seen = new HashSet<Configuration>();
    final var toVisit = new LinkedList<Configuration>();
    for (int start : startStates) {
      final var initial = new Configuration(0, List.of(), start);
      seen.add(initial);
      toVisit.add(initial);
    }

    while (!toVisit.isEmpty()) {
      final Configuration current = toVisit.removeFirst();
      final List<Configuration> next = new ArrayList<>();

      if (current.consumed() == word.size()) {
        if (finalStates.contains(current.state())) {
          translations.add(current.generated());
        }
      } else {
        for (Output edge : relation.targets(current.state(), word.get(current.consumed()))) {
          next.add(new Configuration(
            current.consumed() + 1,
            append(current.generated(), edge.output()),
            edge.target()
          ));
        }
      }

      if (current.generated().size() < maxOutputLength) {
        for (Output edge : relation.targets(current.state(), Epsilon.INSTANCE)) {
          next.add(new Configuration(
            current.consumed(),
            append(current.generated(), edge.output()),
            edge.target()
          ));
        }
      }

      for (Configuration configuration : next) {
        if (seen.add(configuration)) {
          toVisit.addLast(configuration);
        }
      }
    }

    logger.debug("Translated {} into {} words ({} configurations)", word, translations.size(), seen.size());
    return new ArrayList<>(translations);
  }

  /**
   * Transducer translating a word by either of two transducers.
   *
   * <p>States of both operands are copied onto disjoint handles; start and
   * final states are those of both operands.
   */
  public Transducer union(Transducer other) {
    final var union = new Transducer();
    final Map<Integer, Integer> fromThis = union.copyFrom(this);
    final Map<Integer, Integer> fromOther = union.copyFrom(other);
    startStates.forEach(s -> union.addStartState(fromThis.get(s)));
    finalStates.forEach(s -> union.addFinalState(fromThis.get(s)));
    other.startStates.forEach(s -> union.addStartState(fromOther.get(s)));
    other.finalStates.forEach(s -> union.addFinalState(fromOther.get(s)));
    return union;
  }

  /**
   * Identity transducer over the language of an automaton: every accepted
   * word translates to itself and rejected words have no translation.
   */
  public static Transducer identity(Automaton automaton) {
    final var transducer = new Transducer();
    final var mapping = new HashMap<Integer, Integer>();
    for (int state : automaton.states()) {
      mapping.put(state, transducer.freshState());
    }
    automaton.transitions().forEach(t ->
      transducer.addTransition(
        mapping.get(t.from()),
        t.label(),
        mapping.get(t.to()),
        t.label() instanceof Symbol symbol ? List.of(symbol) : List.of()
      )
    );
    automaton.startStates().forEach(s -> transducer.addStartState(mapping.get(s)));
    automaton.finalStates().forEach(s -> transducer.addFinalState(mapping.get(s)));
    return transducer;
  }

  private Map<Integer, Integer> copyFrom(Transducer source) {
    final var mapping = new HashMap<Integer, Integer>();
    for (int state : source.states()) {
      mapping.put(state, freshState());
    }
    source.relation.all().forEach(t ->
      addTransition(
        mapping.get(t.from()),
        t.label(),
        mapping.get(t.to().target()),
        t.to().output()
      )
    );
    return mapping;
  }

  private static List<Symbol> append(List<Symbol> prefix, List<Symbol> suffix) {
    if (suffix.isEmpty()) {
      return prefix;
    }
    final var output = new ArrayList<Symbol>(prefix.size() + suffix.size());
    output.addAll(prefix);
    output.addAll(suffix);
    return List.copyOf(output);
  }
}
