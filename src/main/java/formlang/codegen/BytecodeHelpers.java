package formlang.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Superclass with utility methods for emitting compact bytecode.
 *
 * <p>A method body must fit in 64KB of code, and every state of a compiled
 * automaton adds a block to a single method, so shorter instruction sequences
 * directly raise the size of automata that can be compiled.
 */
class BytecodeHelpers {

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Pop the {@code int} at the top of the stack and jump to the label paired
   * with it, or to {@code dflt} when it matches none of the values.
   *
   * <p>Equivalent to {@code mv.visitLookupSwitchInsn(dflt, values, labels)},
   * which is a very long instruction. Zero or one values become plain
   * conditional jumps and a run of consecutive values becomes a
   * {@code tableswitch}.
   *
   * @param dflt label to jump to if nothing else matches
   * @param values test values in the switch (sorted in ascending order)
   * @param labels labels to jump to, one per value
   */
  protected void visitLookupBranch(Label dflt, int[] values, Label[] labels) {
    switch (values.length) {
      case 0:
        mv.visitInsn(Opcodes.POP);
        break;

      case 1:
        if (values[0] == 0) {
          mv.visitJumpInsn(Opcodes.IFEQ, labels[0]);
        } else {
          visitConstantInt(values[0]);
          mv.visitJumpInsn(Opcodes.IF_ICMPEQ, labels[0]);
        }
        break;

      default:
        if (values[values.length - 1] - values[0] == values.length - 1) {
          mv.visitTableSwitchInsn(values[0], values[values.length - 1], dflt, labels);
        } else {
          mv.visitLookupSwitchInsn(dflt, values, labels);
        }
        return;
    }
    mv.visitJumpInsn(Opcodes.GOTO, dflt);
  }

  /**
   * Push an integer constant onto the stack, using the shortest instruction
   * that can encode it.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    if (-1 <= constant && constant <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + constant);
    } else if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }

  /**
   * Return a constant boolean from the method.
   */
  protected void visitReturnBoolean(boolean value) {
    mv.visitInsn(value ? Opcodes.ICONST_1 : Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
  }
}
