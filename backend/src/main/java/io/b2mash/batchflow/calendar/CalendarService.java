package io.b2mash.batchflow.calendar;

import io.b2mash.batchflow.batch.Batch;
import io.b2mash.batchflow.batch.BatchRepository;
import io.b2mash.batchflow.batch.BatchStatus;
import io.b2mash.batchflow.exception.InvalidStateException;
import io.b2mash.batchflow.workshop.Workshop;
import io.b2mash.batchflow.workshop.WorkshopDirectory;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the workshop occupancy calendar. Only the mapping of dates to grid columns and lanes is
 * computed here; batches that collide inside a lane are left for the client to stack.
 */
@Service
public class CalendarService {

  /** Lane of batches produced internally. */
  public static final long INTERNAL_LANE = 0L;

  private static final String INTERNAL_LANE_NAME = "Internal";
  private static final int MAX_OFFSET = 240;

  private final BatchRepository batchRepository;
  private final WorkshopDirectory workshopDirectory;

  public CalendarService(BatchRepository batchRepository, WorkshopDirectory workshopDirectory) {
    this.batchRepository = batchRepository;
    this.workshopDirectory = workshopDirectory;
  }

  // --- DTOs ---

  public record PlacedBatchDto(
      Long batchId, String code, BatchStatus status, int startColumn, int span) {}

  public record LaneDto(long laneKey, String laneName, List<PlacedBatchDto> batches) {}

  public record CalendarWindowResponse(
      LocalDate periodStart,
      LocalDate periodEnd,
      int dayCount,
      String mode,
      List<LaneDto> lanes) {}

  public CalendarWindow computeWindow(LocalDate referenceDate, CalendarMode mode) {
    if (referenceDate == null || mode == null) {
      throw new InvalidStateException(
          "Invalid calendar request", "Both a reference date and a mode are required");
    }
    return CalendarWindow.containing(referenceDate, mode);
  }

  /**
   * Groups batches into lanes keyed by workshop id ({@link #INTERNAL_LANE} for internal work), each
   * lane ordered by cut date.
   */
  public Map<Long, List<Batch>> groupByLane(List<Batch> batches) {
    var lanes = new TreeMap<Long, List<Batch>>();
    for (Batch batch : batches) {
      long laneKey = batch.isInternal() ? INTERNAL_LANE : batch.getWorkshopId();
      lanes.computeIfAbsent(laneKey, key -> new ArrayList<>()).add(batch);
    }
    var byCutDate = Comparator.comparing(Batch::getCutDate).thenComparing(Batch::getId);
    lanes.values().forEach(lane -> lane.sort(byCutDate));
    return lanes;
  }

  /**
   * Lays out every batch overlapping the window that contains {@code referenceDate}, shifted by
   * {@code offset} periods. Lanes come internal first, then in workshop schedule order.
   */
  @Transactional(readOnly = true)
  public CalendarWindowResponse getCalendarWindow(
      LocalDate referenceDate, CalendarMode mode, int offset) {
    if (Math.abs(offset) > MAX_OFFSET) {
      throw new InvalidStateException(
          "Invalid calendar offset",
          "Offset must be between -" + MAX_OFFSET + " and " + MAX_OFFSET);
    }
    var window = computeWindow(referenceDate, mode).shift(offset);

    var candidates =
        batchRepository.findTouchingPeriod(
            window.periodStart(), window.periodEnd(), window.periodStart().minusDays(1));
    var visible = candidates.stream().filter(b -> window.layout(b).isPresent()).toList();

    Map<Long, Workshop> workshops = workshopDirectory.byId();
    var lanes = new ArrayList<LaneDto>();
    groupByLane(visible)
        .forEach(
            (laneKey, laneBatches) -> {
              var placed =
                  laneBatches.stream()
                      .map(
                          batch -> {
                            var placement = window.layout(batch).orElseThrow();
                            return new PlacedBatchDto(
                                batch.getId(),
                                batch.getCode(),
                                batch.getStatus(),
                                placement.startColumn(),
                                placement.span());
                          })
                      .toList();
              lanes.add(new LaneDto(laneKey, laneName(laneKey, workshops), placed));
            });
    lanes.sort(Comparator.comparing((LaneDto lane) -> laneOrder(lane.laneKey(), workshops))
        .thenComparing(LaneDto::laneKey));

    return new CalendarWindowResponse(
        window.periodStart(),
        window.periodEnd(),
        window.dayCount(),
        window.mode().value(),
        lanes);
  }

  private static String laneName(long laneKey, Map<Long, Workshop> workshops) {
    if (laneKey == INTERNAL_LANE) {
      return INTERNAL_LANE_NAME;
    }
    var workshop = workshops.get(laneKey);
    return workshop != null ? workshop.getName() : "Workshop " + laneKey;
  }

  private static int laneOrder(long laneKey, Map<Long, Workshop> workshops) {
    if (laneKey == INTERNAL_LANE) {
      return Integer.MIN_VALUE;
    }
    var workshop = workshops.get(laneKey);
    return workshop != null ? workshop.getScheduleOrder() : Integer.MAX_VALUE;
  }
}
