package io.b2mash.siteledger.lot;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * One lot of a budget tree.
 *
 * @param rolledUpTotalHt the lot's own planned total plus every descendant's
 */
public record LotNode(
    UUID lotId,
    String code,
    String label,
    BigDecimal plannedTotalHt,
    BigDecimal rolledUpTotalHt,
    List<LotNode> children) {}
