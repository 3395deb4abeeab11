package com.fams.authz;

import com.fams.common.status.Status;
import com.fams.common.status.StatusCode;
import com.fams.common.status.StatusOr;
import javax.annotation.Nonnull;

/**
 * The failure taxonomy of the authorization core. Each entry maps onto a coarse
 * {@link StatusCode}; the entry name travels as the status reason so callers can tell apart, for
 * example, {@link #POSITION_IN_USE} from {@link #PROTECTED_POSITION}.
 */
public enum AuthzFailure {
  UNKNOWN_PERMISSION(StatusCode.INVALID_ARGUMENT),
  UNKNOWN_POSITION(StatusCode.NOT_FOUND),
  UNKNOWN_USER(StatusCode.NOT_FOUND),
  INVALID_PERMISSION_SET(StatusCode.INVALID_ARGUMENT),
  DUPLICATE_NAME(StatusCode.ALREADY_EXISTS),
  POSITION_IN_USE(StatusCode.FAILED_PRECONDITION),
  PROTECTED_POSITION(StatusCode.FAILED_PRECONDITION),
  NO_POSITION(StatusCode.NOT_FOUND),
  INSUFFICIENT_PERMISSION(StatusCode.PERMISSION_DENIED),
  STORAGE_UNAVAILABLE(StatusCode.UNAVAILABLE);

  private final StatusCode code;

  AuthzFailure(StatusCode code) {
    this.code = code;
  }

  public StatusCode code() {
    return code;
  }

  @Nonnull
  public Status status(String message) {
    return Status.of(code, message).withReason(name());
  }

  @Nonnull
  public Status status(String message, Throwable cause) {
    return Status.of(code, message, cause).withReason(name());
  }

  /** Shorthand for {@code StatusOr.ofStatus(status(message))}. */
  @Nonnull
  public <T> StatusOr<T> error(String message) {
    return StatusOr.ofStatus(status(message));
  }

  /** Returns true if the status was produced by this failure. */
  public boolean matches(Status status) {
    return name().equals(status.getReason());
  }
}
