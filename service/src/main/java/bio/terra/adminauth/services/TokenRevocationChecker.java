package bio.terra.adminauth.services;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.dataAccess.UserRecordDAO;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.models.IdToken;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rejects verified tokens whose user is disabled or whose refresh tokens were revoked after the
 * token was issued. Rejections are the kind's invalid-token error wrapping the specific one.
 */
@Slf4j
@Service
public class TokenRevocationChecker {
  private final UserRecordDAO userRecordDAO;

  public TokenRevocationChecker(UserRecordDAO userRecordDAO) {
    this.userRecordDAO = userRecordDAO;
  }

  public IdToken checkRevokedOrDisabled(
      IdToken token, VerifierKind kind, @Nullable String tenantId) {
    var user = userRecordDAO.getUser(tenantId, token.getUid());

    if (user.isDisabled()) {
      log.debug("Rejecting {} of disabled user {}", kind.getShortName(), user.getUid());
      throw wrapInvalid(
          kind,
          new AdminAuthException(
              ErrorCode.INVALID_ARGUMENT, AuthErrorCode.USER_DISABLED, "user has been disabled"));
    }
    if (token.getIssuedAt() * 1000 < user.getTokensValidAfterMillis()) {
      log.debug("Rejecting revoked {} of user {}", kind.getShortName(), user.getUid());
      throw wrapInvalid(
          kind,
          new AdminAuthException(
              ErrorCode.INVALID_ARGUMENT,
              kind.getRevokedCode(),
              kind.getShortName() + " has been revoked"));
    }
    return token;
  }

  private static AdminAuthException wrapInvalid(VerifierKind kind, AdminAuthException cause) {
    return new AdminAuthException(
        ErrorCode.INVALID_ARGUMENT, kind.getInvalidCode(), cause.getMessage(), cause);
  }
}
