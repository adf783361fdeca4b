package io.b2mash.siteledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.siteledger.purchase.PurchaseOrder;
import io.b2mash.siteledger.purchase.PurchaseOrderStatus;
import io.b2mash.siteledger.purchase.PurchaseType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record PurchaseOrderResponse(
    UUID id,
    UUID projectId,
    UUID supplierId,
    UUID lotId,
    PurchaseType type,
    String label,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal quantity,
    String unit,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal unitPriceHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal vatRate,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalHt,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal vatAmount,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal totalTtc,
    @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal realAmountHt,
    LocalDate realInvoiceDate,
    LocalDate orderDate,
    LocalDate expectedDeliveryDate,
    PurchaseOrderStatus status,
    String invoiceReference,
    String rejectionReason,
    String comment,
    UUID requestedBy,
    UUID approvedBy,
    Instant approvedAt,
    Instant createdAt,
    Instant updatedAt) {

  public static PurchaseOrderResponse from(PurchaseOrder order) {
    return new PurchaseOrderResponse(
        order.getId(),
        order.getProjectId(),
        order.getSupplierId(),
        order.getLotId(),
        order.getType(),
        order.getLabel(),
        order.getQuantity(),
        order.getUnit(),
        order.getUnitPriceHt(),
        order.getVatRate(),
        order.getTotalHt(),
        order.getVatAmount(),
        order.getTotalTtc(),
        order.getRealAmountHt(),
        order.getRealInvoiceDate(),
        order.getOrderDate(),
        order.getExpectedDeliveryDate(),
        order.getStatus(),
        order.getInvoiceReference(),
        order.getRejectionReason(),
        order.getComment(),
        order.getRequestedBy(),
        order.getApprovedBy(),
        order.getApprovedAt(),
        order.getCreatedAt(),
        order.getUpdatedAt());
  }
}
