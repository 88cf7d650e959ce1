package formlang;

/**
 * Label on a transition: either an input {@link Symbol} or the {@link Epsilon}
 * sentinel.
 */
public interface Label {

  /**
   * Label for a DOT graph transition.
   */
  String dotLabel();

  /**
   * Whether the transition can be taken without consuming input.
   */
  default boolean isEpsilon() {
    return false;
  }
}
