package bio.terra.adminauth.services;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.config.AdminAuthSpringConfig;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.models.IdToken;
import java.util.Map;
import javax.annotation.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point of the auth core: mints custom tokens and verifies ID tokens and session cookies,
 * optionally checking that the user is still enabled and the token not revoked.
 *
 * <p>In emulator mode the user check always runs, since emulator tokens carry no signature.
 */
@Service
public class AdminAuthService {
  private final CustomTokenService customTokenService;
  private final TokenVerifier idTokenVerifier;
  private final TokenVerifier sessionCookieVerifier;
  private final TokenRevocationChecker tokenRevocationChecker;

  public AdminAuthService(
      CustomTokenService customTokenService,
      @Qualifier(AdminAuthSpringConfig.ID_TOKEN_VERIFIER) TokenVerifier idTokenVerifier,
      @Qualifier(AdminAuthSpringConfig.SESSION_COOKIE_VERIFIER)
          TokenVerifier sessionCookieVerifier,
      TokenRevocationChecker tokenRevocationChecker) {
    this.customTokenService = customTokenService;
    this.idTokenVerifier = idTokenVerifier;
    this.sessionCookieVerifier = sessionCookieVerifier;
    this.tokenRevocationChecker = tokenRevocationChecker;
  }

  public String createCustomToken(String uid) {
    return customTokenService.createCustomToken(uid);
  }

  public String createCustomTokenWithClaims(String uid, Map<String, Object> developerClaims) {
    return customTokenService.createCustomToken(uid, developerClaims, null);
  }

  /** Verifies an ID token without consulting user state, except in emulator mode. */
  public IdToken verifyIdToken(String idToken) {
    return verify(idTokenVerifier, idToken, false, null);
  }

  public IdToken verifyIdTokenAndCheckRevoked(String idToken) {
    return verify(idTokenVerifier, idToken, true, null);
  }

  public IdToken verifySessionCookie(String sessionCookie) {
    return verify(sessionCookieVerifier, sessionCookie, false, null);
  }

  public IdToken verifySessionCookieAndCheckRevoked(String sessionCookie) {
    return verify(sessionCookieVerifier, sessionCookie, true, null);
  }

  /** Auth operations scoped to one tenant of the project. */
  public TenantAwareAdminAuth forTenant(String tenantId) {
    if (tenantId == null || tenantId.isEmpty()) {
      throw new AdminAuthException(ErrorCode.INVALID_ARGUMENT, "tenantID must not be empty");
    }
    return new TenantAwareAdminAuth(tenantId, this);
  }

  String createCustomTokenForTenant(
      String uid, @Nullable Map<String, Object> developerClaims, String tenantId) {
    return customTokenService.createCustomToken(uid, developerClaims, tenantId);
  }

  IdToken verifyForTenant(
      VerifierKind kind, String token, boolean checkRevoked, String tenantId) {
    var verifier = kind == VerifierKind.ID_TOKEN ? idTokenVerifier : sessionCookieVerifier;
    return verify(verifier, token, checkRevoked, tenantId);
  }

  private IdToken verify(
      TokenVerifier verifier, String token, boolean checkRevoked, @Nullable String tenantId) {
    var verified = verifier.verify(token);

    if (tenantId != null && !tenantId.equals(verified.getTenantId().orElse(""))) {
      throw new AdminAuthException(
          ErrorCode.INVALID_ARGUMENT,
          AuthErrorCode.TENANT_ID_MISMATCH,
          String.format("invalid tenant id: \"%s\"", verified.getTenantId().orElse("")));
    }

    if (checkRevoked || verifier.isEmulator()) {
      return tokenRevocationChecker.checkRevokedOrDisabled(verified, verifier.getKind(), tenantId);
    }
    return verified;
  }
}
