package io.b2mash.batchflow.calendar;

import io.b2mash.batchflow.batch.Batch;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * A contiguous range of calendar days shown as one grid, either half a month or a full month.
 *
 * @param periodStart first day shown (column 0)
 * @param periodEnd last day shown, inclusive
 * @param mode the kind of period
 */
public record CalendarWindow(LocalDate periodStart, LocalDate periodEnd, CalendarMode mode) {

  private static final int SECOND_HALF_START = 16;

  /** The window of the given mode that contains {@code referenceDate}. */
  public static CalendarWindow containing(LocalDate referenceDate, CalendarMode mode) {
    var month = YearMonth.from(referenceDate);
    if (mode == CalendarMode.MONTHLY) {
      return new CalendarWindow(month.atDay(1), month.atEndOfMonth(), mode);
    }
    if (referenceDate.getDayOfMonth() < SECOND_HALF_START) {
      return new CalendarWindow(month.atDay(1), month.atDay(SECOND_HALF_START - 1), mode);
    }
    return new CalendarWindow(month.atDay(SECOND_HALF_START), month.atEndOfMonth(), mode);
  }

  public int dayCount() {
    return (int) ChronoUnit.DAYS.between(periodStart, periodEnd) + 1;
  }

  /**
   * Steps the window by whole periods: half-months for biweekly, months for monthly. Negative
   * values step backwards.
   */
  public CalendarWindow shift(int periods) {
    if (periods == 0) {
      return this;
    }
    if (mode == CalendarMode.MONTHLY) {
      return containing(periodStart.plusMonths(periods), mode);
    }
    boolean secondHalf = periodStart.getDayOfMonth() >= SECOND_HALF_START;
    int halfIndex = (secondHalf ? 1 : 0) + periods;
    int monthDelta = Math.floorDiv(halfIndex, 2);
    boolean targetSecondHalf = Math.floorMod(halfIndex, 2) == 1;
    var month = YearMonth.from(periodStart).plusMonths(monthDelta);
    return containing(month.atDay(targetSecondHalf ? SECOND_HALF_START : 1), mode);
  }

  public CalendarWindow next() {
    return shift(1);
  }

  public CalendarWindow previous() {
    return shift(-1);
  }

  /** Places a batch using its occupancy dates; empty when it does not overlap the window. */
  public Optional<BatchPlacement> layout(Batch batch) {
    return layout(batch.getCutDate(), batch.occupancyEndDate());
  }

  /**
   * Maps an occupancy interval to grid columns. Offsets are clipped to the window; the span is the
   * number of day boundaries crossed, at least one.
   *
   * <p>The end column is exclusive: a bar covers {@code startColumn} up to but not including
   * {@code startColumn + span}. A batch running past the window therefore ends one column before
   * the last day shown, which clients should draw as continuing beyond the window.
   */
  public Optional<BatchPlacement> layout(LocalDate cutDate, LocalDate endDate) {
    if (cutDate.isAfter(periodEnd) || endDate.isBefore(periodStart)) {
      return Optional.empty();
    }
    int lastColumn = dayCount() - 1;
    int startColumn = clamp(ChronoUnit.DAYS.between(periodStart, cutDate), lastColumn);
    int endColumn = clamp(ChronoUnit.DAYS.between(periodStart, endDate), lastColumn);
    int span = Math.max(1, endColumn - startColumn);
    return Optional.of(new BatchPlacement(startColumn, span));
  }

  private static int clamp(long offset, int lastColumn) {
    return (int) Math.max(0, Math.min(lastColumn, offset));
  }
}
