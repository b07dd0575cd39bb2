package mathvm.ir;

/** The types a function may declare to return. {@code BOT} means it returns no value. */
public enum VarType {
  BOT("none"),
  INT("int"),
  DOUBLE("float"),
  PTR("pointer");

  public final String string;

  VarType(String string) {
    this.string = string;
  }
}
