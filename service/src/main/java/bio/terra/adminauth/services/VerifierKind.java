package bio.terra.adminauth.services;

import bio.terra.adminauth.exception.AuthErrorCode;

/** The kinds of incoming credential the verifier accepts. They differ only in naming and codes. */
public enum VerifierKind {
  ID_TOKEN(
      "ID token",
      "an ID token",
      "https://securetoken.google.com/",
      "https://firebase.google.com/docs/auth/admin/verify-id-tokens",
      AuthErrorCode.ID_TOKEN_INVALID,
      AuthErrorCode.ID_TOKEN_EXPIRED,
      AuthErrorCode.ID_TOKEN_REVOKED),
  SESSION_COOKIE(
      "session cookie",
      "a session cookie",
      "https://session.firebase.google.com/",
      "https://firebase.google.com/docs/auth/admin/manage-cookies",
      AuthErrorCode.SESSION_COOKIE_INVALID,
      AuthErrorCode.SESSION_COOKIE_EXPIRED,
      AuthErrorCode.SESSION_COOKIE_REVOKED);

  private final String shortName;
  private final String articledShortName;
  private final String issuerPrefix;
  private final String docUrl;
  private final AuthErrorCode invalidCode;
  private final AuthErrorCode expiredCode;
  private final AuthErrorCode revokedCode;

  VerifierKind(
      String shortName,
      String articledShortName,
      String issuerPrefix,
      String docUrl,
      AuthErrorCode invalidCode,
      AuthErrorCode expiredCode,
      AuthErrorCode revokedCode) {
    this.shortName = shortName;
    this.articledShortName = articledShortName;
    this.issuerPrefix = issuerPrefix;
    this.docUrl = docUrl;
    this.invalidCode = invalidCode;
    this.expiredCode = expiredCode;
    this.revokedCode = revokedCode;
  }

  public String getShortName() {
    return shortName;
  }

  public String getArticledShortName() {
    return articledShortName;
  }

  public String getIssuerPrefix() {
    return issuerPrefix;
  }

  public String getDocUrl() {
    return docUrl;
  }

  public AuthErrorCode getInvalidCode() {
    return invalidCode;
  }

  public AuthErrorCode getExpiredCode() {
    return expiredCode;
  }

  public AuthErrorCode getRevokedCode() {
    return revokedCode;
  }
}
