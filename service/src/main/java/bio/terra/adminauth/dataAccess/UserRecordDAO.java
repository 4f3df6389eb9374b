package bio.terra.adminauth.dataAccess;

import bio.terra.adminauth.models.UserRecord;
import javax.annotation.Nullable;

/** Read access to user accounts, as far as token revocation checks need it. */
public interface UserRecordDAO {

  /**
   * Looks up a user of the project, or of one of its tenants when {@code tenantId} is given.
   *
   * @throws bio.terra.adminauth.AdminAuthException with {@code USER_NOT_FOUND} when no such user
   *     exists
   */
  UserRecord getUser(@Nullable String tenantId, String uid);
}
