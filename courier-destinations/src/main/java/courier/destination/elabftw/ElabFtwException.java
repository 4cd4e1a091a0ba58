package courier.destination.elabftw;

import java.io.IOException;

/**
 * An eLabFTW API call failed or returned an unexpected payload.
 */
public class ElabFtwException extends IOException {

  public ElabFtwException(String message) {
    super(message);
  }

  public ElabFtwException(String message, Throwable cause) {
    super(message, cause);
  }
}
