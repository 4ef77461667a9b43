package exm.ppl.common.lang;

/**
 * Target frameworks code can be generated for
 */
public enum Target {
  TURING("turing"),
  GEN("gen"),
  PYRO("pyro");

  private final String id;

  private Target(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  /**
   * @return target with the given id, ignoring case, or null
   */
  public static Target fromId(String id) {
    for (Target t: values()) {
      if (t.id.equalsIgnoreCase(id)) {
        return t;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return id;
  }
}
