package formlang.codegen;

/**
 * Word acceptor backed by generated bytecode.
 *
 * <p>Implementations are generated at runtime by {@link CompiledAutomaton}
 * and hold no state, so a single instance may be shared between threads.
 */
public interface CompiledAcceptor {

  /**
   * Run a word through the automaton.
   *
   * @param word symbols, each given by its index in the compiled alphabet
   * @return whether the automaton accepts the word (out-of-range indices
   *   are rejected)
   */
  boolean accepts(int[] word);
}
