package com.fams.operations;

import com.fams.authz.PositionRegistry;
import com.fams.authz.UserPositionBinding;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.Position;
import com.fams.security.SystemPositions;
import com.fams.security.UserAccount;
import com.fams.store.UserDirectory;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.tinylog.Logger;

import java.util.Optional;
import java.util.UUID;

/**
 * Operation class for initializing the system.
 * This installs the built-in positions and a bootstrap administrator bound to the protected
 * System Administrator position. Running it again only fills in what is missing.
 */
public class SystemInitOperation {
    private final PositionRegistry registry;
    private final UserDirectory users;
    private final UserPositionBinding binding;
    private final String adminUsername;

    /**
     * Creates a new SystemInitOperation.
     *
     * @param registry the position registry to seed
     * @param users the user directory holding the bootstrap administrator
     * @param binding the binding used to attach the administrator to its position
     * @param adminUsername login name of the bootstrap administrator
     */
    public SystemInitOperation(
            PositionRegistry registry,
            UserDirectory users,
            UserPositionBinding binding,
            String adminUsername) {
        this.registry = registry;
        this.users = users;
        this.binding = binding;
        this.adminUsername = adminUsername;
    }

    /**
     * Result of the system initialization operation.
     */
    public record InitResult(
            boolean alreadyInitialized,
            UUID adminUserId,
            UUID adminPositionId,
            int positionsCreated,
            String errorMessage) {

        public static InitResult success(UUID adminUserId, UUID adminPositionId, int positionsCreated) {
            return new InitResult(false, adminUserId, adminPositionId, positionsCreated, null);
        }

        @NotNull
        @Contract("_, _ -> new")
        public static InitResult initialized(UUID adminUserId, UUID adminPositionId) {
            return new InitResult(true, adminUserId, adminPositionId, 0, null);
        }

        public static InitResult error(String errorMessage) {
            return new InitResult(false, null, null, 0, errorMessage);
        }

        public boolean isSuccess() {
            return errorMessage == null;
        }
    }

    /**
     * Initialize the system. Idempotent: if every built-in position exists and the administrator
     * is already bound, the result reports that the system was already initialized.
     *
     * @return the initialization result
     */
    public InitResult execute() {
        Logger.info("Executing system initialization operation");

        try {
            StatusOr<Position> adminPositionOr = registry.ensureSystemAdministrator();
            if (adminPositionOr.isNotOk()) {
                Logger.error("Failed to install the System Administrator position: {}",
                        adminPositionOr.getStatus());
                return InitResult.error("System Administrator position could not be installed.");
            }
            Position adminPosition = adminPositionOr.getValue();

            int created = 0;
            for (SystemPositions builtIn : SystemPositions.values()) {
                if (builtIn.fullCatalogGrant()) {
                    continue;
                }
                StatusOr<Optional<Position>> existingOr = registry.findByName(builtIn.displayName());
                if (existingOr.isNotOk()) {
                    Logger.error("Failed to look up position {}: {}",
                            builtIn.displayName(), existingOr.getStatus());
                    return InitResult.error("Position lookup failed.");
                }
                if (existingOr.getValue().isPresent()) {
                    continue;
                }
                StatusOr<Position> createdOr = registry.create(builtIn.draft());
                if (createdOr.isNotOk()) {
                    Logger.error("Failed to create position {}: {}",
                            builtIn.displayName(), createdOr.getStatus());
                    return InitResult.error("Failed to create position " + builtIn.displayName() + ".");
                }
                created++;
            }

            StatusOr<Optional<UserAccount>> adminUserOr = users.loadByUsername(adminUsername);
            if (adminUserOr.isNotOk()) {
                Logger.error("Failed to check for admin user: {}", adminUserOr.getStatus());
                return InitResult.error("Admin user lookup failed.");
            }

            UserAccount adminUser;
            boolean userExisted = adminUserOr.getValue().isPresent();
            if (userExisted) {
                adminUser = adminUserOr.getValue().get();
            } else {
                adminUser = new UserAccount(UUID.randomUUID(), adminUsername, null);
                Status saved = users.save(adminUser);
                if (saved.isError()) {
                    Logger.error("Failed to create admin user: {}", saved);
                    return InitResult.error("Failed to create admin user.");
                }
            }

            boolean alreadyBound = adminPosition.id().equals(adminUser.positionId());
            if (!alreadyBound) {
                Status bound = binding.bind(adminUser.userId(), adminPosition.id());
                if (bound.isError()) {
                    Logger.error("Failed to bind admin user: {}", bound);
                    return InitResult.error("Failed to bind admin user.");
                }
            }

            if (userExisted && alreadyBound && created == 0) {
                Logger.info("System is already initialized");
                return InitResult.initialized(adminUser.userId(), adminPosition.id());
            }

            Logger.info("System initialized successfully ({} positions created)", created);
            return InitResult.success(adminUser.userId(), adminPosition.id(), created);

        } catch (Exception e) {
            String error = "Error during system initialization.";
            Logger.error(e, error);
            return InitResult.error(error);
        }
    }
}
