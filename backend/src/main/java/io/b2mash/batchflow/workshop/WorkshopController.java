package io.b2mash.batchflow.workshop;

import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workshops")
public class WorkshopController {

  private final WorkshopDirectory workshopDirectory;

  public WorkshopController(WorkshopDirectory workshopDirectory) {
    this.workshopDirectory = workshopDirectory;
  }

  @GetMapping
  public ResponseEntity<List<WorkshopResponse>> listWorkshops() {
    var workshops =
        workshopDirectory.listInScheduleOrder().stream().map(WorkshopResponse::from).toList();
    return ResponseEntity.ok(workshops);
  }

  public record WorkshopResponse(Long id, String name, int scheduleOrder, String color) {

    static WorkshopResponse from(Workshop workshop) {
      return new WorkshopResponse(
          workshop.getId(), workshop.getName(), workshop.getScheduleOrder(), workshop.getColor());
    }
  }
}
