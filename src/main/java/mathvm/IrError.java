package mathvm;

/** Basic error class in this project. */
public class IrError extends RuntimeException {

  public IrError(String message) {
    super(message);
  }
}
