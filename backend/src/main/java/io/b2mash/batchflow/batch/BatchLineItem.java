package io.b2mash.batchflow.batch;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "batch_line_items")
public class BatchLineItem {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "batch_id", nullable = false)
  private Long batchId;

  @Column(name = "product_id", nullable = false)
  private Long productId;

  @Column(name = "quantity", nullable = false)
  private int quantity;

  @Column(name = "selected_color", length = 100)
  private String selectedColor;

  @Column(name = "selected_size", length = 50)
  private String selectedSize;

  protected BatchLineItem() {}

  public BatchLineItem(
      Long batchId, Long productId, int quantity, String selectedColor, String selectedSize) {
    this.batchId = batchId;
    this.productId = productId;
    this.quantity = quantity;
    this.selectedColor = selectedColor;
    this.selectedSize = selectedSize;
  }

  public Long getId() {
    return id;
  }

  public Long getBatchId() {
    return batchId;
  }

  public Long getProductId() {
    return productId;
  }

  public int getQuantity() {
    return quantity;
  }

  public String getSelectedColor() {
    return selectedColor;
  }

  public String getSelectedSize() {
    return selectedSize;
  }
}
