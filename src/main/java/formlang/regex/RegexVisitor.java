package formlang.regex;

import formlang.Symbol;

/**
 * Bottom-up traversal of a regular expression operator tree.
 *
 * <p>Children are visited before their parent, so each method receives the
 * already-computed results for the sub-expressions.
 *
 * @param <R> output from traversing the tree
 */
public interface RegexVisitor<R> {

  /**
   * Matches exactly one symbol.
   *
   * @param symbol symbol to match
   */
  R visitLetter(Symbol symbol);

  /**
   * Empty expression, matching only the empty word.
   */
  R visitEpsilon();

  /**
   * Matches nothing at all.
   */
  R visitEmptySet();

  /**
   * Matches a concatenation of two expressions.
   *
   * @param lhs first expression to match
   * @param rhs second expression to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches either of two expressions.
   *
   * @param lhs first alternative
   * @param rhs second alternative
   */
  R visitUnion(R lhs, R rhs);

  /**
   * Matches an expression zero or more times.
   *
   * @param arg expression to repeat
   */
  R visitKleeneStar(R arg);
}
