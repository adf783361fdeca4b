package io.b2mash.siteledger.money;

import java.math.BigDecimal;

/**
 * Derived amounts of a billing document.
 *
 * @param amountHt ex-tax amount
 * @param vatAmount VAT on {@code amountHt}
 * @param totalTtc tax-inclusive total
 * @param retentionAmount guarantee retention, computed on the ex-tax amount
 * @param netPayable {@code totalTtc - retentionAmount}
 */
public record InvoiceAmounts(
    BigDecimal amountHt,
    BigDecimal vatAmount,
    BigDecimal totalTtc,
    BigDecimal retentionAmount,
    BigDecimal netPayable) {}
