package io.b2mash.siteledger.allocation.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.UUID;

/** {@code allocationPct} defaults to 100 when omitted. */
public record CreateAllocationRequest(
    @NotNull UUID taskId,
    @NotNull UUID lotId,
    @DecimalMin("0") @DecimalMax("100") BigDecimal allocationPct) {}
