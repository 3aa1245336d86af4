package io.b2mash.batchflow.calendar;

/**
 * Columns a batch occupies in a calendar window. {@code startColumn} is the zero-based day offset
 * from the window start; both values lie within {@code [0, dayCount - 1]}.
 */
public record BatchPlacement(int startColumn, int span) {}
