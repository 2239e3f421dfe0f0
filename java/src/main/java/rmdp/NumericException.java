package rmdp;

/** A linear system derived from the model could not be solved. */
public class NumericException extends RuntimeException {
  public NumericException(String message, Throwable cause) {
    super(message, cause);
  }
}
