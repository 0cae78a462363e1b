package cal.prim;

/**
 * An exception indicating that some input could not be understood.
 */
public class MalformedDataException extends Exception {
  public MalformedDataException(String message) {
    super(message);
  }

  public MalformedDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
