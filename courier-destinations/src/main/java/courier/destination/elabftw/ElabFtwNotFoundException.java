package courier.destination.elabftw;

/**
 * The requested eLabFTW resource does not exist (HTTP 404).
 */
public class ElabFtwNotFoundException extends ElabFtwException {

  public ElabFtwNotFoundException(String message) {
    super(message);
  }
}
