package io.b2mash.siteledger.supplier.dto;

import io.b2mash.siteledger.supplier.SupplierType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record SupplierRequest(
    @NotBlank String name,
    @NotNull SupplierType type,
    @Pattern(regexp = TAX_ID_PATTERN, message = "SIRET must be 14 digits, spaces allowed")
        String taxId,
    String contactName,
    String email,
    String phone) {

  /** 14 digits in any spacing, or blank. Spaces are stripped when the supplier is saved. */
  public static final String TAX_ID_PATTERN = "(?: *\\d){14} *|\\s*";
}
