package rmdp;

/** The model is malformed in a way that prevents resolving a transition or reward. */
public class ModelException extends RuntimeException {
  public ModelException(String message) {
    super(message);
  }
}
