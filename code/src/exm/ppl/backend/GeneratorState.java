package exm.ppl.backend;

import exm.ppl.common.Settings;

/**
 * Mutable state of one translation for one backend.  Never shared
 * between generators.
 */
public class GeneratorState {
  private final String tempPrefix;
  private int tempCounter = 0;

  public GeneratorState() {
    this(Settings.get(Settings.TEMP_PREFIX));
  }

  public GeneratorState(String tempPrefix) {
    this.tempPrefix = tempPrefix;
  }

  /**
   * @return fresh temporary name, __tmp0, __tmp1, ...
   */
  public String newTemp() {
    return tempPrefix + (tempCounter++);
  }

  public int tempCount() {
    return tempCounter;
  }
}
