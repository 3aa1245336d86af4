package io.b2mash.batchflow.calendar;

import io.b2mash.batchflow.exception.InvalidStateException;
import java.util.Arrays;

public enum CalendarMode {
  /** Half a month: the 1st to the 15th, or the 16th to the last day. */
  BIWEEKLY("biweekly"),
  /** The whole calendar month. */
  MONTHLY("monthly");

  private final String value;

  CalendarMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static CalendarMode fromValue(String value) {
    return Arrays.stream(values())
        .filter(mode -> mode.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Invalid calendar mode",
                    "Mode must be one of biweekly, monthly but got '" + value + "'"));
  }
}
