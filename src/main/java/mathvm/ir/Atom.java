package mathvm.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.primitives.UnsignedLongs;

/**
 * A leaf expression, evaluated without sub-evaluations. Atoms are immutable values: two atoms of
 * the same kind and value are equal, and an atom may appear in several places of a function.
 */
public abstract class Atom extends Expression {

  Atom(IrKind kind) {
    super(kind);
  }

  public static IntLiteral integer(long value) {
    return new IntLiteral(value);
  }

  public static FloatLiteral floating(double value) {
    return new FloatLiteral(value);
  }

  /** A raw address. */
  public static PointerLiteral pointer(long address) {
    return new PointerLiteral(address, false);
  }

  /** The address of entry {@code index} of the owning function's literal pool. */
  public static PointerLiteral pooledString(int index) {
    checkArgument(index >= 0, "Negative literal pool index %s", index);
    return new PointerLiteral(index, true);
  }

  public static Variable variable(long id) {
    return new Variable(id);
  }

  public static final class IntLiteral extends Atom {
    public final long value;

    public IntLiteral(long value) {
      super(IrKind.INT);
      this.value = value;
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitIntLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      return value == ((IntLiteral) o).value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }
  }

  public static final class FloatLiteral extends Atom {
    public final double value;

    public FloatLiteral(double value) {
      super(IrKind.DOUBLE);
      this.value = value;
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitFloatLiteral(this);
    }

    // Bitwise comparison, so that NaN literals equal themselves and 0.0 differs from -0.0.
    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      return Double.doubleToLongBits(value) == Double.doubleToLongBits(((FloatLiteral) o).value);
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }
  }

  public static final class PointerLiteral extends Atom {
    /** Either a raw address or, if {@link #isPooledString}, an index into the literal pool. */
    public final long value;

    public final boolean isPooledString;

    public PointerLiteral(long value, boolean isPooledString) {
      super(IrKind.PTR);
      this.value = value;
      this.isPooledString = isPooledString;
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitPointerLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      PointerLiteral that = (PointerLiteral) o;
      return value == that.value && isPooledString == that.isPooledString;
    }

    @Override
    public int hashCode() {
      return 31 * Long.hashCode(value) + Boolean.hashCode(isPooledString);
    }
  }

  /**
   * Refers to a variable of the owning function. The id is an unsigned 64 bit number and only
   * unique within that function. Variables don't carry a type, it follows from the context.
   */
  public static final class Variable extends Atom {
    public final long id;

    public Variable(long id) {
      super(IrKind.VARIABLE);
      this.id = id;
    }

    /** The id rendered as an unsigned number. */
    public String idString() {
      return UnsignedLongs.toString(id);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      return id == ((Variable) o).id;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(id);
    }
  }
}
