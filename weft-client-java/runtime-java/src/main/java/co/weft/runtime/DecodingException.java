package co.weft.runtime;

/**
 * Wire data does not match the shape the generated type expects.
 */
public class DecodingException extends RuntimeException {

  public DecodingException(String message) {
    super(message);
  }

  public DecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
