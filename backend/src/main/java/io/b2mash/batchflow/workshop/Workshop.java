package io.b2mash.batchflow.workshop;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * External subcontractor master data. Maintained by the workshop registry; this service reads the
 * name and schedule order and uses the row as the per-workshop lock.
 */
@Entity
@Table(name = "workshops")
public class Workshop {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "schedule_order", nullable = false)
  private int scheduleOrder = 1;

  @Column(name = "color", nullable = false, length = 20)
  private String color = "#6B7280";

  protected Workshop() {}

  public Workshop(String name, int scheduleOrder, String color) {
    this.name = name;
    this.scheduleOrder = scheduleOrder;
    this.color = color;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public int getScheduleOrder() {
    return scheduleOrder;
  }

  public String getColor() {
    return color;
  }
}
