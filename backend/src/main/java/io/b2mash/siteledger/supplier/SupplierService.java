package io.b2mash.siteledger.supplier;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.exception.ResourceConflictException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.supplier.dto.SupplierRequest;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SupplierService {

  private static final Logger log = LoggerFactory.getLogger(SupplierService.class);

  private final SupplierRepository supplierRepository;
  private final AuditService auditService;

  public SupplierService(SupplierRepository supplierRepository, AuditService auditService) {
    this.supplierRepository = supplierRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Supplier create(SupplierRequest request, UUID actorId) {
    var supplier = new Supplier(request.name(), request.type(), request.taxId());
    requireUniqueTaxId(supplier.getTaxId(), null);
    supplier.setContact(request.contactName(), request.email(), request.phone());
    supplier = supplierRepository.save(supplier);
    log.info(
        "Created supplier {} ({}) type {}",
        supplier.getId(),
        supplier.getName(),
        supplier.getType());
    journal(supplier, AuditAction.CREATE, "Supplier created: " + supplier.getName(), actorId);
    return supplier;
  }

  @Transactional
  public Supplier update(UUID supplierId, SupplierRequest request, UUID actorId) {
    var supplier = get(supplierId);
    requireUniqueTaxId(Supplier.normalizeTaxId(request.taxId()), supplierId);
    supplier.updateDetails(
        request.name(),
        request.type(),
        request.taxId(),
        request.contactName(),
        request.email(),
        request.phone());
    supplier = supplierRepository.save(supplier);
    log.info("Updated supplier {}", supplierId);
    journal(supplier, AuditAction.UPDATE, "Supplier updated", actorId);
    return supplier;
  }

  @Transactional
  public Supplier setActive(UUID supplierId, boolean active, UUID actorId) {
    var supplier = get(supplierId);
    if (active) {
      supplier.activate();
    } else {
      supplier.deactivate();
    }
    supplier = supplierRepository.save(supplier);
    log.info("Supplier {} active={}", supplierId, active);
    journal(
        supplier,
        AuditAction.UPDATE,
        active ? "Supplier reactivated" : "Supplier deactivated",
        actorId);
    return supplier;
  }

  @Transactional
  public void delete(UUID supplierId, UUID actorId) {
    var supplier = get(supplierId);
    supplier.softDelete(actorId);
    supplierRepository.save(supplier);
    log.info("Soft-deleted supplier {}", supplierId);
    journal(supplier, AuditAction.DELETE, "Supplier deleted", actorId);
  }

  @Transactional(readOnly = true)
  public Supplier get(UUID supplierId) {
    return supplierRepository
        .findLiveById(supplierId)
        .orElseThrow(() -> new ResourceNotFoundException("Supplier", supplierId));
  }

  @Transactional(readOnly = true)
  public List<Supplier> list(boolean activeOnly) {
    return supplierRepository.findAllLive(activeOnly);
  }

  private void requireUniqueTaxId(String taxId, UUID ownId) {
    if (taxId == null) {
      return;
    }
    supplierRepository
        .findLiveByTaxId(taxId)
        .filter(existing -> !existing.getId().equals(ownId))
        .ifPresent(
            existing -> {
              throw ResourceConflictException.duplicate("Duplicate supplier", "taxId", taxId);
            });
  }

  private void journal(Supplier supplier, AuditAction action, String detail, UUID actorId) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType("supplier")
            .entityId(supplier.getId())
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(Map.of("type", supplier.getType().name()))
            .build());
  }
}
