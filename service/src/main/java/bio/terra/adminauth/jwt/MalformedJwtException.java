package bio.terra.adminauth.jwt;

/** A token that cannot be split into segments or whose segments do not decode. */
public class MalformedJwtException extends RuntimeException {
  public MalformedJwtException(String message) {
    super(message);
  }

  public MalformedJwtException(String message, Throwable cause) {
    super(message, cause);
  }
}
