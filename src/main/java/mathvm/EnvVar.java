package mathvm;

public enum EnvVar {
  MATHVM_IR_VERIFY("Set to \"0\" to skip verification between passes."),
  MATHVM_IR_DUMP("Set to \"1\" to log the IR after every pass."),
  MATHVM_IR_MAX_ROUNDS("Maximum number of rounds when running passes until a fixpoint.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public boolean isSetToZero() {
    return isAvailable() && isSetToValue("0");
  }

  public boolean isSetToOne() {
    return isAvailable() && isSetToValue("1");
  }

  public boolean isSetToValue(String varValue) {
    String value = getValue();
    return value != null && value.equals(varValue);
  }

  /**
   * Parses the value as a decimal integer, {@code defaultValue} if the variable is not set.
   *
   * @throws IrError if the variable is set to something that isn't an integer
   */
  public int intValue(int defaultValue) {
    if (!isAvailable()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(getValue().trim());
    } catch (NumberFormatException e) {
      throw new IrError(
          String.format(
              "%s must be an integer, was '%s'. %s", name(), getValue(), description));
    }
  }

  private String getValue() {
    return System.getenv(this.name());
  }

  public boolean isAvailable() {
    return System.getenv().containsKey(this.name());
  }
}
