package formlang.regex;

import formlang.Automaton;
import formlang.Symbol;

/**
 * Regular expression, as an operator tree.
 *
 * <p>The record constructors build nodes exactly as given. The static
 * factories ({@link #symbol}, {@link #concat}, {@link #or}, {@link #star}, ...)
 * also apply the trivial identities of the empty set and the empty word, which
 * keeps trees produced by {@link StateElimination} readable.
 */
public interface Regex {

  /**
   * Traverse the tree bottom-up.
   *
   * @param visitor operations to apply at each node
   * @return result computed for the root
   */
  <R> R accept(RegexVisitor<R> visitor);

  /**
   * Single symbol.
   */
  record Letter(Symbol symbol) implements Regex {

    public Letter {
      if (symbol == null) {
        throw new IllegalArgumentException("letter needs a symbol");
      }
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitLetter(symbol);
    }

    @Override
    public String toString() {
      return symbol.toString();
    }
  }

  /**
   * The empty word.
   */
  record Epsilon() implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitEpsilon();
    }

    @Override
    public String toString() {
      return "$";
    }
  }

  /**
   * The empty language.
   */
  record EmptySet() implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitEmptySet();
    }

    @Override
    public String toString() {
      return "∅";
    }
  }

  record Concatenation(Regex lhs, Regex rhs) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitConcatenation(lhs.accept(visitor), rhs.accept(visitor));
    }

    @Override
    public String toString() {
      return "(" + lhs + "." + rhs + ")";
    }
  }

  record Union(Regex lhs, Regex rhs) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitUnion(lhs.accept(visitor), rhs.accept(visitor));
    }

    @Override
    public String toString() {
      return "(" + lhs + "|" + rhs + ")";
    }
  }

  record KleeneStar(Regex arg) implements Regex {

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitKleeneStar(arg.accept(visitor));
    }

    @Override
    public String toString() {
      return "(" + arg + ")*";
    }
  }

  static Regex symbol(Object value) {
    return new Letter(Symbol.of(value));
  }

  static Regex epsilon() {
    return new Epsilon();
  }

  static Regex empty() {
    return new EmptySet();
  }

  /**
   * Concatenation, absorbing the empty set and dropping empty words.
   */
  static Regex concat(Regex lhs, Regex rhs) {
    if (lhs instanceof EmptySet || rhs instanceof EmptySet) {
      return empty();
    } else if (lhs instanceof Epsilon) {
      return rhs;
    } else if (rhs instanceof Epsilon) {
      return lhs;
    }
    return new Concatenation(lhs, rhs);
  }

  /**
   * Union, dropping empty sets and duplicate alternatives.
   */
  static Regex or(Regex lhs, Regex rhs) {
    if (lhs instanceof EmptySet || lhs.equals(rhs)) {
      return rhs;
    } else if (rhs instanceof EmptySet) {
      return lhs;
    }
    return new Union(lhs, rhs);
  }

  /**
   * Kleene star, collapsing repeated stars and stars of trivial languages.
   */
  static Regex star(Regex arg) {
    if (arg instanceof EmptySet || arg instanceof Epsilon) {
      return epsilon();
    } else if (arg instanceof KleeneStar) {
      return arg;
    }
    return new KleeneStar(arg);
  }

  default Regex concatenate(Regex other) {
    return new Concatenation(this, other);
  }

  default Regex union(Regex other) {
    return new Union(this, other);
  }

  default Regex kleeneStar() {
    return new KleeneStar(this);
  }

  /**
   * Number of symbol leaves in the tree.
   */
  default int numberOfSymbols() {
    return accept(new RegexVisitor<Integer>() {
      public Integer visitLetter(Symbol symbol) {
        return 1;
      }

      public Integer visitEpsilon() {
        return 0;
      }

      public Integer visitEmptySet() {
        return 0;
      }

      public Integer visitConcatenation(Integer lhs, Integer rhs) {
        return lhs + rhs;
      }

      public Integer visitUnion(Integer lhs, Integer rhs) {
        return lhs + rhs;
      }

      public Integer visitKleeneStar(Integer arg) {
        return arg;
      }
    });
  }

  /**
   * Number of concatenation, union and star nodes in the tree.
   */
  default int numberOfOperators() {
    return accept(new RegexVisitor<Integer>() {
      public Integer visitLetter(Symbol symbol) {
        return 0;
      }

      public Integer visitEpsilon() {
        return 0;
      }

      public Integer visitEmptySet() {
        return 0;
      }

      public Integer visitConcatenation(Integer lhs, Integer rhs) {
        return lhs + rhs + 1;
      }

      public Integer visitUnion(Integer lhs, Integer rhs) {
        return lhs + rhs + 1;
      }

      public Integer visitKleeneStar(Integer arg) {
        return arg + 1;
      }
    });
  }

  /**
   * Thompson automaton for this expression.
   *
   * @see ThompsonBuilder#toAutomaton(Regex)
   */
  default Automaton toAutomaton() {
    return ThompsonBuilder.toAutomaton(this);
  }
}
