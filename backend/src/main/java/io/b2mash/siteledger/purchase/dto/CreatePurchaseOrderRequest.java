package io.b2mash.siteledger.purchase.dto;

import io.b2mash.siteledger.purchase.PurchaseType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public record CreatePurchaseOrderRequest(
    @NotNull UUID projectId,
    UUID supplierId,
    UUID lotId,
    @NotNull PurchaseType type,
    @NotBlank String label,
    @NotNull @Positive BigDecimal quantity,
    String unit,
    @NotNull @DecimalMin("0") BigDecimal unitPriceHt,
    @NotNull BigDecimal vatRate,
    LocalDate orderDate,
    LocalDate expectedDeliveryDate,
    String comment) {}
