package io.b2mash.siteledger.purchase.dto;

import io.b2mash.siteledger.purchase.PurchaseType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/** Partial update of a requested order: null fields are left unchanged. */
public record UpdatePurchaseOrderRequest(
    UUID supplierId,
    UUID lotId,
    PurchaseType type,
    String label,
    BigDecimal quantity,
    String unit,
    BigDecimal unitPriceHt,
    BigDecimal vatRate,
    LocalDate orderDate,
    LocalDate expectedDeliveryDate,
    String comment) {}
