package io.b2mash.batchflow.calendar;

import io.b2mash.batchflow.calendar.CalendarService.CalendarWindowResponse;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/calendar")
public class CalendarController {

  private final CalendarService calendarService;

  public CalendarController(CalendarService calendarService) {
    this.calendarService = calendarService;
  }

  @GetMapping
  public ResponseEntity<CalendarWindowResponse> getCalendarWindow(
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate referenceDate,
      @RequestParam(defaultValue = "biweekly") String mode,
      @RequestParam(defaultValue = "0") int offset) {
    var response =
        calendarService.getCalendarWindow(referenceDate, CalendarMode.fromValue(mode), offset);
    return ResponseEntity.ok(response);
  }
}
