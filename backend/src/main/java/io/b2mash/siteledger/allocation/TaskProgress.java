package io.b2mash.siteledger.allocation;

import java.math.BigDecimal;
import java.util.UUID;

/** Physical progress of a planning task, as reported by the planning system. */
public record TaskProgress(UUID taskId, String title, String status, BigDecimal progressPct) {}
