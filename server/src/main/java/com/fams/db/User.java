package com.fams.db;

import com.fams.security.UserAccount;

import java.time.Instant;
import java.util.UUID;

/**
 * Represents a row in the 'user' table.
 *
 * @param userId The unique identifier of the user
 * @param username The login name
 * @param positionId The bound position, null when none is assigned
 * @param createdAt Timestamp when the record was created
 * @param updatedAt Timestamp when the record was last updated
 */
public record User(
        UUID userId,
        String username,
        UUID positionId,
        Instant createdAt,
        Instant updatedAt
) {
    /**
     * Converts this database record to the account view used by the authorization core.
     *
     * @return the UserAccount for this row
     */
    public UserAccount toAccount() {
        return new UserAccount(userId, username, positionId);
    }
}
