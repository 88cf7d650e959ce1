package formlang.codegen;

import formlang.Automaton;
import formlang.PreconditionException;
import formlang.Symbol;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic automaton compiled into JVM bytecode.
 *
 * <p>The generated class is loaded as a hidden class, so it becomes
 * unreachable (and can be unloaded) along with the {@code CompiledAutomaton}
 * that owns it. Compilation takes a snapshot: later changes to the source
 * automaton are not reflected.
 */
public final class CompiledAutomaton {

  private static final Logger logger = LoggerFactory.getLogger(CompiledAutomaton.class);

  private static final String CLASS_NAME = "formlang/codegen/CompiledAcceptor$Generated";

  private final List<Symbol> alphabet;
  private final Map<Symbol, Integer> symbolIndices;
  private final CompiledAcceptor acceptor;

  private CompiledAutomaton(List<Symbol> alphabet, CompiledAcceptor acceptor) {
    this.alphabet = Collections.unmodifiableList(alphabet);
    this.symbolIndices = new HashMap<>();
    for (int i = 0; i < alphabet.size(); i++) {
      symbolIndices.put(alphabet.get(i), i);
    }
    this.acceptor = acceptor;
  }

  /**
   * Compile a deterministic automaton.
   *
   * <p>Symbol indices follow the order of {@link Automaton#alphabet()}. Only
   * states reachable from the start are emitted.
   *
   * @param dfa deterministic automaton, total or not
   * @return compiled acceptor for the same language
   * @throws PreconditionException if the automaton is not deterministic
   * @throws IllegalStateException if the bytecode cannot be generated or loaded
   */
  public static CompiledAutomaton compile(Automaton dfa) {
    if (!dfa.isDeterministic()) {
      throw new PreconditionException(PreconditionException.Requirement.DETERMINISTIC, "compile");
    }
    final var alphabet = new ArrayList<Symbol>(dfa.alphabet());

    final byte[] classBytes;
    try {
      classBytes = generateAcceptorClass(dfa, alphabet).toByteArray();
    } catch (RuntimeException e) {
      // eg. `MethodTooLargeException` for very large automata
      throw new IllegalStateException("could not generate bytecode for automaton", e);
    }

    final CompiledAcceptor acceptor;
    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      acceptor = (CompiledAcceptor) constructor.invoke();
    } catch (Error e) {
      throw e;
    } catch (Throwable e) {
      throw new IllegalStateException("could not load generated acceptor", e);
    }

    logger.debug(
      "Compiled automaton with {} states into {} bytes of bytecode",
      dfa.numberOfStates(),
      classBytes.length
    );
    return new CompiledAutomaton(alphabet, acceptor);
  }

  /**
   * Generate a class implementing {@link CompiledAcceptor}.
   *
   * @param dfa deterministic automaton
   * @param alphabet symbols, in the order of their indices
   * @return class writer holding the finished class
   */
  static ClassWriter generateAcceptorClass(Automaton dfa, List<Symbol> alphabet) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      CLASS_NAME,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.ACCEPTOR_CLASS_NAME }
    );

    // Constructor takes no arguments: the class has no state
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` method
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC | Opcodes.ACC_FINAL);
      mv.visitCode();
      new AcceptorCodegen(mv, dfa, alphabet).visitAutomaton();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  /**
   * Check whether the automaton accepts a word.
   *
   * @param word symbols; any symbol outside the alphabet makes it rejected
   * @return whether the word is accepted
   */
  public boolean accepts(List<Symbol> word) {
    final int[] indices = new int[word.size()];
    for (int i = 0; i < indices.length; i++) {
      final Integer index = symbolIndices.get(word.get(i));
      if (index == null) {
        return false;
      }
      indices[i] = index;
    }
    return acceptor.accepts(indices);
  }

  /**
   * Check whether the automaton accepts a word given as symbol indices.
   *
   * @see #alphabet()
   */
  public boolean accepts(int[] word) {
    return acceptor.accepts(word);
  }

  /**
   * Index of a symbol in the compiled alphabet.
   *
   * @return index, or {@code -1} if the symbol is not in the alphabet
   */
  public int symbolIndex(Symbol symbol) {
    return symbolIndices.getOrDefault(symbol, -1);
  }

  /**
   * Compiled alphabet, in index order.
   */
  public List<Symbol> alphabet() {
    return alphabet;
  }

  /**
   * Underlying generated acceptor.
   */
  public CompiledAcceptor acceptor() {
    return acceptor;
  }
}
