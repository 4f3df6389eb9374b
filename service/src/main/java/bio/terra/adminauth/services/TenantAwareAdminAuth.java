package bio.terra.adminauth.services;

import bio.terra.adminauth.models.IdToken;
import java.util.Map;

/**
 * Auth operations for a single tenant. Minted custom tokens carry the tenant ID, and verified
 * tokens must belong to the tenant. Obtained from {@link AdminAuthService#forTenant(String)}.
 */
public class TenantAwareAdminAuth {
  private final String tenantId;
  private final AdminAuthService adminAuthService;

  TenantAwareAdminAuth(String tenantId, AdminAuthService adminAuthService) {
    this.tenantId = tenantId;
    this.adminAuthService = adminAuthService;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String createCustomToken(String uid) {
    return adminAuthService.createCustomTokenForTenant(uid, null, tenantId);
  }

  public String createCustomTokenWithClaims(String uid, Map<String, Object> developerClaims) {
    return adminAuthService.createCustomTokenForTenant(uid, developerClaims, tenantId);
  }

  public IdToken verifyIdToken(String idToken) {
    return adminAuthService.verifyForTenant(VerifierKind.ID_TOKEN, idToken, false, tenantId);
  }

  public IdToken verifyIdTokenAndCheckRevoked(String idToken) {
    return adminAuthService.verifyForTenant(VerifierKind.ID_TOKEN, idToken, true, tenantId);
  }

  public IdToken verifySessionCookie(String sessionCookie) {
    return adminAuthService.verifyForTenant(
        VerifierKind.SESSION_COOKIE, sessionCookie, false, tenantId);
  }

  public IdToken verifySessionCookieAndCheckRevoked(String sessionCookie) {
    return adminAuthService.verifyForTenant(
        VerifierKind.SESSION_COOKIE, sessionCookie, true, tenantId);
  }
}
