package io.b2mash.siteledger.budget.dto;

import java.math.BigDecimal;

public record AmendmentRequest(String reason, BigDecimal amountHt, String impactDescription) {}
