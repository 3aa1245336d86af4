package io.b2mash.batchflow.batch.dto;

import io.b2mash.batchflow.batch.BatchLineItem;

public record LineItemResponse(
    Long id, Long productId, int quantity, String selectedColor, String selectedSize) {

  public static LineItemResponse from(BatchLineItem item) {
    return new LineItemResponse(
        item.getId(),
        item.getProductId(),
        item.getQuantity(),
        item.getSelectedColor(),
        item.getSelectedSize());
  }
}
