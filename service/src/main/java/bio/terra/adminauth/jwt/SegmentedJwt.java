package bio.terra.adminauth.jwt;

/** The three base64url segments of a compact JWT, still encoded. */
public record SegmentedJwt(String header, String payload, String signature) {

  /** The bytes the signature covers: {@code header + "." + payload}. */
  public String signingInput() {
    return header + "." + payload;
  }
}
