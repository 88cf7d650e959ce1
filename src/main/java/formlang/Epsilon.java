package formlang;

/**
 * Reserved label of transitions that consume no input.
 *
 * <p>Never a member of an alphabet.
 */
public enum Epsilon implements Label {
  INSTANCE;

  @Override
  public String dotLabel() {
    return "&epsilon;";
  }

  @Override
  public boolean isEpsilon() {
    return true;
  }

  @Override
  public String toString() {
    return "epsilon";
  }
}
