package courier.destination.cdcs;

import java.io.IOException;

/**
 * A CDCS REST call failed or returned an unexpected payload.
 */
public class CdcsException extends IOException {

  public CdcsException(String message) {
    super(message);
  }

  public CdcsException(String message, Throwable cause) {
    super(message, cause);
  }
}
