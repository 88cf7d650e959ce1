package formlang.codegen;

import formlang.Analysis;
import formlang.Automaton;
import formlang.Symbol;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Generates the body of {@link CompiledAcceptor#accepts}.
 *
 * <p>States of the automaton map onto blocks of the method's control-flow
 * graph and transitions become jumps between blocks. Each block advances the
 * offset, returns if the input is exhausted, and otherwise branches on the
 * next symbol index.
 */
class AcceptorCodegen extends BytecodeHelpers {

  private final Automaton dfa;
  private final Map<Symbol, Integer> symbolIndices;

  /**
   * Offset for argument of type {@code int[]}, the input word.
   */
  private final int wordLocal = 1;

  /**
   * Offset for the local of type {@code int} holding the position in the word.
   */
  private final int offsetLocal = 2;

  /**
   * Offset for the local of type {@code int} holding the length of the word.
   */
  private final int lengthLocal = 3;

  /**
   * One block per state reachable from the start.
   */
  private final Map<Integer, Label> stateLabels = new LinkedHashMap<>();

  private final Label returnSuccess = new Label();
  private final Label returnFailure = new Label();

  AcceptorCodegen(MethodVisitor mv, Automaton dfa, List<Symbol> alphabet) {
    super(mv);
    this.dfa = dfa;
    this.symbolIndices = new LinkedHashMap<>();
    for (int i = 0; i < alphabet.size(); i++) {
      symbolIndices.put(alphabet.get(i), i);
    }
    for (int state : Analysis.reachableStates(dfa)) {
      stateLabels.put(state, new Label());
    }
  }

  void visitAutomaton() {
    // offset = -1; length = word.length
    visitConstantInt(-1);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);
    mv.visitVarInsn(Opcodes.ALOAD, wordLocal);
    mv.visitInsn(Opcodes.ARRAYLENGTH);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);

    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(dfa.startStates().iterator().next()));

    for (Map.Entry<Integer, Label> entry : stateLabels.entrySet()) {
      mv.visitLabel(entry.getValue());
      visitState(entry.getKey());
    }

    mv.visitLabel(returnSuccess);
    visitReturnBoolean(true);
    mv.visitLabel(returnFailure);
    visitReturnBoolean(false);
  }

  private void visitState(int state) {
    // Advance, and stop at the end of the word
    mv.visitIincInsn(offsetLocal, 1);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
    mv.visitJumpInsn(Opcodes.IF_ICMPGE, dfa.isFinalState(state) ? returnSuccess : returnFailure);

    // Sorted by symbol index
    final var transitions = new TreeMap<Integer, Label>();
    for (Map.Entry<Symbol, Integer> symbol : symbolIndices.entrySet()) {
      final Integer target = dfa.target(state, symbol.getKey());
      if (target != null) {
        transitions.put(symbol.getValue(), stateLabels.get(target));
      }
    }

    mv.visitVarInsn(Opcodes.ALOAD, wordLocal);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    mv.visitInsn(Opcodes.IALOAD);
    visitLookupBranch(
      returnFailure,
      transitions.keySet().stream().mapToInt(Integer::intValue).toArray(),
      transitions.values().toArray(new Label[0])
    );
  }
}
