package formlang;

/**
 * An automaton handed to an operation lacks a structural property that the
 * operation needs. Callers are expected to compose the fix explicitly (eg.
 * determinize or complete first); operations never repair their input.
 */
public class PreconditionException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 4127601846531139873L;

  /**
   * Structural properties operations may require.
   */
  public enum Requirement {

    /**
     * No epsilon edges, one start state, at most one target per state and symbol.
     */
    DETERMINISTIC("not deterministic", "determinize"),

    /**
     * Deterministic, with a target for every state and every alphabet symbol.
     */
    TOTAL("not total", "complete");

    private final String condition;
    private final String remedy;

    Requirement(String condition, String remedy) {
      this.condition = condition;
      this.remedy = remedy;
    }
  }

  /**
   * Property that was missing.
   */
  public final Requirement requirement;

  /**
   * Name of the operation that was refused.
   */
  public final String operation;

  public PreconditionException(Requirement requirement, String operation) {
    super(
      "automaton is " + requirement.condition + "; " + requirement.remedy
        + " it before calling " + operation
    );
    this.requirement = requirement;
    this.operation = operation;
  }

  /**
   * Check that an automaton is deterministic.
   *
   * @param automaton automaton to check
   * @param operation name of the calling operation (for the message)
   */
  static void requireDeterministic(Automaton automaton, String operation) {
    if (!automaton.isDeterministic()) {
      throw new PreconditionException(Requirement.DETERMINISTIC, operation);
    }
  }

  /**
   * Check that an automaton is deterministic and total.
   *
   * @param automaton automaton to check
   * @param operation name of the calling operation (for the message)
   */
  static void requireTotal(Automaton automaton, String operation) {
    requireDeterministic(automaton, operation);
    if (!automaton.isTotal()) {
      throw new PreconditionException(Requirement.TOTAL, operation);
    }
  }
}
