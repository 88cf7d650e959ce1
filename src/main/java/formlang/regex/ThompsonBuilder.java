package formlang.regex;

import formlang.Automaton;
import formlang.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regex visitor which builds the equivalent automaton by Thompson's
 * construction.
 *
 * <p>Each sub-expression becomes a fragment with exactly one start state and
 * exactly one accepting state, with no edge into the start or out of the
 * accepting state. Fragments are glued together using epsilon edges only, so
 * the size of the automaton is linear in the size of the expression.
 */
public class ThompsonBuilder implements RegexVisitor<ThompsonBuilder.Fragment> {

  private static final Logger logger = LoggerFactory.getLogger(ThompsonBuilder.class);

  /**
   * Partially built automaton for a sub-expression.
   *
   * @param start state where the fragment is entered
   * @param accept state where the fragment is left
   */
  public record Fragment(int start, int accept) { }

  protected final Automaton automaton;

  protected ThompsonBuilder(Automaton automaton) {
    this.automaton = automaton;
  }

  /**
   * Build the automaton of an expression.
   *
   * <p>The output has one start state, one final state and may contain
   * epsilon edges. Its alphabet is the set of symbols in the expression.
   *
   * @param regex expression to convert
   * @return fresh automaton accepting the language of the expression
   */
  public static Automaton toAutomaton(Regex regex) {
    final var builder = new ThompsonBuilder(new Automaton());
    final Fragment fragment = regex.accept(builder);
    builder.automaton.addStartState(fragment.start());
    builder.automaton.addFinalState(fragment.accept());
    logger.debug(
      "Built {} states and {} transitions for {}",
      builder.automaton.numberOfStates(),
      builder.automaton.numberOfTransitions(),
      regex
    );
    return builder.automaton;
  }

  /**
   * Summon a fresh state.
   *
   * @return fresh state handle
   */
  protected int freshState() {
    return automaton.freshState();
  }

  private Fragment fresh() {
    return new Fragment(freshState(), freshState());
  }

  @Override
  public Fragment visitLetter(Symbol symbol) {
    final Fragment fragment = fresh();
    automaton.addTransition(fragment.start(), symbol, fragment.accept());
    return fragment;
  }

  @Override
  public Fragment visitEpsilon() {
    final Fragment fragment = fresh();
    automaton.addEpsilonTransition(fragment.start(), fragment.accept());
    return fragment;
  }

  @Override
  public Fragment visitEmptySet() {
    return fresh();
  }

  @Override
  public Fragment visitConcatenation(Fragment lhs, Fragment rhs) {
    automaton.addEpsilonTransition(lhs.accept(), rhs.start());
    return new Fragment(lhs.start(), rhs.accept());
  }

  /**
   * Both branches hang off a fresh start and lead into a fresh shared accept.
   */
  @Override
  public Fragment visitUnion(Fragment lhs, Fragment rhs) {
    final Fragment fragment = fresh();
    automaton.addEpsilonTransition(fragment.start(), lhs.start());
    automaton.addEpsilonTransition(fragment.start(), rhs.start());
    automaton.addEpsilonTransition(lhs.accept(), fragment.accept());
    automaton.addEpsilonTransition(rhs.accept(), fragment.accept());
    return fragment;
  }

  @Override
  public Fragment visitKleeneStar(Fragment arg) {
    final Fragment fragment = fresh();
    automaton.addEpsilonTransition(fragment.start(), arg.start());
    automaton.addEpsilonTransition(fragment.start(), fragment.accept());
    automaton.addEpsilonTransition(arg.accept(), arg.start());
    automaton.addEpsilonTransition(arg.accept(), fragment.accept());
    return fragment;
  }
}
