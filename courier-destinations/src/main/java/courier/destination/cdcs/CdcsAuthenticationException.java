package courier.destination.cdcs;

/**
 * CDCS rejected the API token (HTTP 401 or 403).
 */
public class CdcsAuthenticationException extends CdcsException {

  public CdcsAuthenticationException(String message) {
    super(message);
  }
}
