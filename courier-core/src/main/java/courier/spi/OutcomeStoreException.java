package courier.spi;

/**
 * Unchecked wrapper for outcome log persistence failures.
 */
public class OutcomeStoreException extends RuntimeException {

  public OutcomeStoreException(String message) {
    super(message);
  }

  public OutcomeStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
