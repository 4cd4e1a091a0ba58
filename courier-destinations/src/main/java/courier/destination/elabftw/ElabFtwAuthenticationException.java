package courier.destination.elabftw;

/**
 * eLabFTW rejected the API key (HTTP 401).
 */
public class ElabFtwAuthenticationException extends ElabFtwException {

  public ElabFtwAuthenticationException(String message) {
    super(message);
  }
}
