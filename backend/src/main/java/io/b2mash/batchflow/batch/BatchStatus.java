package io.b2mash.batchflow.batch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.batchflow.exception.InvalidStateException;
import java.util.Arrays;

/**
 * Where a batch currently is in production.
 *
 * <p>Forward path: WAITING → INTERNAL_PRODUCTION or EXTERNAL_WORKSHOP → RETURNED. RETURNED →
 * WAITING is a manual correction, not an error.
 */
public enum BatchStatus {
  WAITING("waiting"),
  INTERNAL_PRODUCTION("internal_production"),
  EXTERNAL_WORKSHOP("external_workshop"),
  RETURNED("returned");

  private final String value;

  BatchStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static BatchStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equals(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Invalid batch status",
                    "Status must be one of waiting, internal_production, external_workshop,"
                        + " returned but got '"
                        + value
                        + "'"));
  }

  /** True while the workshop (or internal line) still holds the batch. */
  public boolean isOpen() {
    return this != RETURNED;
  }

  public boolean isInProduction() {
    return this == INTERNAL_PRODUCTION || this == EXTERNAL_WORKSHOP;
  }

  /**
   * Checks whether a batch may move from this status to {@code target}. Staying in the same status
   * is always allowed (used to re-record observations or the workshop).
   */
  public boolean canTransitionTo(BatchStatus target) {
    if (target == this) {
      return true;
    }
    return switch (this) {
      case WAITING -> target == INTERNAL_PRODUCTION || target == EXTERNAL_WORKSHOP;
      case INTERNAL_PRODUCTION, EXTERNAL_WORKSHOP -> target == RETURNED;
      case RETURNED -> target == WAITING;
    };
  }
}
