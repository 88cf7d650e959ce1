package formlang;

import formlang.util.IntSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimization of deterministic automata by partition refinement.
 */
public final class Minimizer {

  private static final Logger logger = LoggerFactory.getLogger(Minimizer.class);

  private Minimizer() { }

  /**
   * Compute the minimal deterministic automaton accepting the same language.
   *
   * <p>A partial input is first completed with one absorbing non-final state.
   * Unreachable states are ignored. After merging equivalent states, the part
   * from which no final state can be reached is dropped along with every edge
   * into it; if that part is the start, the output is a single non-final state
   * with no edges. The output is unique up to the naming of states.
   *
   * @param dfa deterministic automaton
   * @return minimal equivalent automaton (same alphabet)
   * @throws PreconditionException if the input is not deterministic
   */
  public static Automaton minimize(Automaton dfa) {
    PreconditionException.requireDeterministic(dfa, "minimize");
    final Automaton total = dfa.isTotal() ? dfa : Operations.complete(dfa);
    final int initial = total.startStates().iterator().next();
    final Set<SortedSet<Integer>> partition = refine(total);

    // Mapping from states to the part containing them
    final Map<Integer, SortedSet<Integer>> stateToPart = new HashMap<>();
    for (final SortedSet<Integer> part : partition) {
      for (final int state : part) {
        stateToPart.put(state, part);
      }
    }

    // Quotient graph, in order of discovery from the start
    final var quotient = new LinkedHashMap<SortedSet<Integer>, Map<Symbol, SortedSet<Integer>>>();
    final var toVisit = new LinkedList<SortedSet<Integer>>();
    toVisit.add(stateToPart.get(initial));
    quotient.put(stateToPart.get(initial), new LinkedHashMap<>());
    while (!toVisit.isEmpty()) {
      final var part = toVisit.removeFirst();
      final int representative = part.first();
      for (Symbol symbol : total.alphabet()) {
        final var targetPart = stateToPart.get(total.target(representative, symbol));
        quotient.get(part).put(symbol, targetPart);
        if (!quotient.containsKey(targetPart)) {
          quotient.put(targetPart, new LinkedHashMap<>());
          toVisit.addLast(targetPart);
        }
      }
    }

    final Set<SortedSet<Integer>> live = liveParts(quotient, total.finalStates());

    final var minimized = new Automaton();
    total.alphabet().forEach(minimized::addSymbol);
    final var handles = new HashMap<SortedSet<Integer>, Integer>();
    for (final var part : quotient.keySet()) {
      if (live.contains(part) || part == stateToPart.get(initial)) {
        handles.put(part, minimized.state(IntSet.of(part)));
      }
    }
    minimized.addStartState(handles.get(stateToPart.get(initial)));

    for (final var entry : quotient.entrySet()) {
      final var part = entry.getKey();
      if (!live.contains(part)) {
        continue;
      }
      final int from = handles.get(part);
      if (total.isFinalState(part.first())) {
        minimized.addFinalState(from);
      }
      for (final var transition : entry.getValue().entrySet()) {
        if (live.contains(transition.getValue())) {
          minimized.addTransition(from, transition.getKey(), handles.get(transition.getValue()));
        }
      }
    }

    logger.debug(
      "Minimized {} states into {} states ({} parts before dropping dead states)",
      dfa.numberOfStates(),
      minimized.numberOfStates(),
      quotient.size()
    );
    return minimized;
  }

  /**
   * Partition the reachable states of a deterministic automaton into classes
   * of language-equivalent states.
   *
   * @param dfa deterministic automaton (completed internally if partial)
   * @return partition of the states reachable from the start
   * @throws PreconditionException if the input is not deterministic
   */
  public static Set<SortedSet<Integer>> partition(Automaton dfa) {
    PreconditionException.requireDeterministic(dfa, "partition");
    if (!dfa.isTotal()) {
      // Drop the sink: it is not a state of the caller's automaton
      final Automaton total = Operations.complete(dfa);
      final Set<Integer> own = dfa.states();
      final var output = new LinkedHashSet<SortedSet<Integer>>();
      for (SortedSet<Integer> part : refine(total)) {
        final var kept = part
          .stream()
          .filter(own::contains)
          .collect(Collectors.toCollection(TreeSet::new));
        if (!kept.isEmpty()) {
          output.add(kept);
        }
      }
      return output;
    }
    return refine(dfa);
  }

  /**
   * Hopcroft-style refinement of {final, non-final} over the reachable states
   * of a total deterministic automaton.
   *
   * <p>Parts are split by the pre-image of a splitter along one symbol. When a
   * part that is still waiting to be used as a splitter splits, both halves
   * wait; otherwise only the smaller half needs to.
   */
  private static Set<SortedSet<Integer>> refine(Automaton dfa) {
    final Set<Integer> reachable = Analysis.reachableStates(dfa);

    // Keys are target states and values are mappings from symbols to source states
    final Map<Integer, Map<Symbol, Set<Integer>>> reversedTransitions = new HashMap<>();
    for (final int fromState : reachable) {
      for (final var entry : dfa.outgoing(fromState).entrySet()) {
        final Symbol symbol = (Symbol) entry.getKey();
        for (final int toState : entry.getValue()) {
          reversedTransitions
            .computeIfAbsent(toState, k -> new HashMap<>())
            .computeIfAbsent(symbol, k -> new HashSet<>())
            .add(fromState);
        }
      }
    }

    // Set up initial partition
    final var partition = new LinkedHashSet<SortedSet<Integer>>();
    final var accepting = new TreeSet<Integer>();
    final var rejecting = new TreeSet<Integer>();
    for (final int state : reachable) {
      (dfa.isFinalState(state) ? accepting : rejecting).add(state);
    }
    partition.add(accepting);
    partition.add(rejecting);
    partition.removeIf(Set::isEmpty);

    // Mapping from states to parts in the partition
    final var stateToPart = new HashMap<Integer, SortedSet<Integer>>();
    for (final var part : partition) {
      for (final var state : part) {
        stateToPart.put(state, part);
      }
    }

    // Worklist of splitters
    final var toVisit = new LinkedHashSet<SortedSet<Integer>>(partition);

    while (!toVisit.isEmpty()) {
      final var splitter = toVisit.iterator().next();
      toVisit.remove(splitter);

      // Pre-images of the splitter, one per symbol
      final var preImages = new LinkedHashMap<Symbol, Set<Integer>>();
      for (final int state : splitter) {
        final var incoming = reversedTransitions.get(state);
        if (incoming != null) {
          for (final var entry : incoming.entrySet()) {
            preImages
              .computeIfAbsent(entry.getKey(), k -> new HashSet<>())
              .addAll(entry.getValue());
          }
        }
      }

      for (final Set<Integer> preImage : preImages.values()) {
        for (final int containedState : new ArrayList<>(preImage)) {
          final var oldPart = stateToPart.get(containedState);

          final var inPreImage = new TreeSet<Integer>();
          final var notInPreImage = new TreeSet<Integer>();
          for (final int state : oldPart) {
            (preImage.contains(state) ? inPreImage : notInPreImage).add(state);
          }

          // Nothing to refine
          if (notInPreImage.isEmpty()) {
            continue;
          }

          partition.remove(oldPart);
          partition.add(inPreImage);
          partition.add(notInPreImage);
          for (final int state : inPreImage) {
            stateToPart.put(state, inPreImage);
          }
          for (final int state : notInPreImage) {
            stateToPart.put(state, notInPreImage);
          }

          if (toVisit.remove(oldPart)) {
            toVisit.add(inPreImage);
            toVisit.add(notInPreImage);
          } else if (inPreImage.size() < notInPreImage.size()) {
            toVisit.add(inPreImage);
          } else {
            toVisit.add(notInPreImage);
          }
        }
      }
    }

    return partition;
  }

  /**
   * Parts of the quotient graph from which some final part is reachable.
   */
  private static Set<SortedSet<Integer>> liveParts(
    Map<SortedSet<Integer>, Map<Symbol, SortedSet<Integer>>> quotient,
    Set<Integer> finalStates
  ) {
    final var reversed = new HashMap<SortedSet<Integer>, List<SortedSet<Integer>>>();
    for (final var entry : quotient.entrySet()) {
      for (final var target : entry.getValue().values()) {
        reversed.computeIfAbsent(target, k -> new ArrayList<>()).add(entry.getKey());
      }
    }

    final var live = new HashSet<SortedSet<Integer>>();
    final var toVisit = new LinkedList<SortedSet<Integer>>();
    for (final var part : quotient.keySet()) {
      if (finalStates.contains(part.first())) {
        live.add(part);
        toVisit.add(part);
      }
    }
    while (!toVisit.isEmpty()) {
      for (final var source : reversed.getOrDefault(toVisit.removeFirst(), List.of())) {
        if (live.add(source)) {
          toVisit.addLast(source);
        }
      }
    }
    return live;
  }
}
