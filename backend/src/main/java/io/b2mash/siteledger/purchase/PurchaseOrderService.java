package io.b2mash.siteledger.purchase;

import io.b2mash.siteledger.audit.AuditAction;
import io.b2mash.siteledger.audit.AuditEventBuilder;
import io.b2mash.siteledger.audit.AuditService;
import io.b2mash.siteledger.budget.Budget;
import io.b2mash.siteledger.budget.BudgetRepository;
import io.b2mash.siteledger.exception.BusinessRuleException;
import io.b2mash.siteledger.exception.InvalidStateException;
import io.b2mash.siteledger.exception.ResourceNotFoundException;
import io.b2mash.siteledger.lot.BudgetLot;
import io.b2mash.siteledger.lot.BudgetLotRepository;
import io.b2mash.siteledger.lot.LotPhase;
import io.b2mash.siteledger.purchase.dto.CreatePurchaseOrderRequest;
import io.b2mash.siteledger.purchase.dto.UpdatePurchaseOrderRequest;
import io.b2mash.siteledger.supplier.Supplier;
import io.b2mash.siteledger.supplier.SupplierRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PurchaseOrderService {

  private static final Logger log = LoggerFactory.getLogger(PurchaseOrderService.class);

  private static final String ENTITY_TYPE = "purchase_order";

  private final PurchaseOrderRepository purchaseOrderRepository;
  private final SupplierRepository supplierRepository;
  private final BudgetLotRepository lotRepository;
  private final BudgetRepository budgetRepository;
  private final PurchaseAggregationService aggregationService;
  private final AuditService auditService;

  public PurchaseOrderService(
      PurchaseOrderRepository purchaseOrderRepository,
      SupplierRepository supplierRepository,
      BudgetLotRepository lotRepository,
      BudgetRepository budgetRepository,
      PurchaseAggregationService aggregationService,
      AuditService auditService) {
    this.purchaseOrderRepository = purchaseOrderRepository;
    this.supplierRepository = supplierRepository;
    this.lotRepository = lotRepository;
    this.budgetRepository = budgetRepository;
    this.aggregationService = aggregationService;
    this.auditService = auditService;
  }

  /**
   * Creates a purchase order. A subcontractor supplier forces the order to 0% VAT. When the
   * project's budget does not require approval for the order's total, the order is approved on
   * the spot by its requester.
   *
   * @throws ResourceNotFoundException if the supplier or lot does not exist
   * @throws BusinessRuleException if the supplier is inactive
   */
  @Transactional
  public PurchaseOrder create(CreatePurchaseOrderRequest request, UUID requesterId) {
    Supplier supplier = null;
    if (request.supplierId() != null) {
      supplier = requireActiveSupplier(request.supplierId());
    }
    var budget = budgetRepository.findLiveByProjectId(request.projectId());

    var vatRate = request.vatRate();
    var type = request.type();
    if (supplier != null && supplier.isSubcontractor()) {
      if (vatRate != null && vatRate.signum() != 0) {
        log.warn(
            "Supplier {} is a subcontractor: VAT rate {} forced to 0 (reverse charge)",
            supplier.getId(),
            vatRate);
      }
      vatRate = BigDecimal.ZERO;
      type = PurchaseType.SUBCONTRACTING;
    }

    var order =
        new PurchaseOrder(
            request.projectId(),
            type,
            request.label(),
            request.quantity(),
            request.unitPriceHt(),
            vatRate,
            requesterId);
    if (supplier != null) {
      order.assignSupplier(supplier.getId(), supplier.isSubcontractor());
    }
    if (request.lotId() != null) {
      requireSiteLot(request.lotId(), budget.orElse(null));
      order.assignLot(request.lotId());
    }
    order.schedule(request.orderDate(), request.expectedDeliveryDate());
    order.updateDetails(null, request.unit(), request.comment());

    boolean autoApproved = budget.isPresent() && !budget.get().needsApproval(order.getTotalHt());
    if (autoApproved) {
      order.approve(requesterId);
    }

    order = purchaseOrderRepository.save(order);
    log.info(
        "Created purchase order {} for project {}: {} HT, status {}",
        order.getId(),
        order.getProjectId(),
        order.getTotalHt(),
        order.getStatus());

    var details = new HashMap<String, Object>();
    details.put("total_ht", order.getTotalHt().toPlainString());
    details.put("vat_rate", order.getVatRate().toPlainString());
    details.put("auto_approved", autoApproved);
    journal(
        order,
        AuditAction.CREATE,
        "Purchase order created: " + order.getLabel(),
        requesterId,
        details);
    return order;
  }

  /**
   * Partial update of a requested order. When the resulting supplier is a subcontractor the VAT
   * rate is forced back to 0, whichever field the update touched.
   */
  @Transactional
  public PurchaseOrder update(UUID orderId, UpdatePurchaseOrderRequest request, UUID actorId) {
    var order = get(orderId);
    order.requireEditable("update");
    var before = order.snapshot();

    UUID supplierId = request.supplierId() != null ? request.supplierId() : order.getSupplierId();
    Supplier supplier = null;
    if (supplierId != null) {
      supplier =
          Objects.equals(supplierId, order.getSupplierId())
              ? supplierRepository.findLiveById(supplierId).orElse(null)
              : requireActiveSupplier(supplierId);
    }
    boolean subcontractor = supplier != null && supplier.isSubcontractor();

    var vatRate = request.vatRate();
    if (subcontractor && vatRate != null && vatRate.signum() != 0) {
      log.warn(
          "Supplier {} is a subcontractor: VAT rate {} forced to 0 on order {}",
          supplierId,
          vatRate,
          orderId);
      vatRate = BigDecimal.ZERO;
    }
    var type = subcontractor ? PurchaseType.SUBCONTRACTING : request.type();
    if (subcontractor && vatRate == null) {
      vatRate = BigDecimal.ZERO;
    }
    order.reprice(type, request.quantity(), request.unitPriceHt(), vatRate);
    if (supplierId != null) {
      order.assignSupplier(supplierId, subcontractor);
    }
    if (request.lotId() != null) {
      requireSiteLot(
          request.lotId(), budgetRepository.findLiveByProjectId(order.getProjectId()).orElse(null));
      order.assignLot(request.lotId());
    }
    order.schedule(
        request.orderDate() != null ? request.orderDate() : order.getOrderDate(),
        request.expectedDeliveryDate() != null
            ? request.expectedDeliveryDate()
            : order.getExpectedDeliveryDate());
    order.updateDetails(request.label(), request.unit(), request.comment());

    order = purchaseOrderRepository.save(order);
    log.info("Updated purchase order {}", orderId);

    var after = order.snapshot();
    for (var field : after.keySet()) {
      var oldValue = before.get(field);
      var newValue = after.get(field);
      if (!Objects.equals(oldValue, newValue)) {
        var details = new HashMap<String, Object>();
        details.put("field", field);
        details.put("from", String.valueOf(oldValue));
        details.put("to", String.valueOf(newValue));
        journal(order, AuditAction.UPDATE, field + " changed", actorId, details);
      }
    }
    return order;
  }

  @Transactional
  public PurchaseOrder approve(UUID orderId, UUID approverId) {
    var order = get(orderId);
    order.approve(approverId);
    order = purchaseOrderRepository.save(order);
    log.info("Approved purchase order {}", orderId);
    journal(order, AuditAction.VALIDATE, "Purchase order approved", approverId, Map.of());
    return order;
  }

  @Transactional
  public PurchaseOrder reject(UUID orderId, UUID approverId, String reason) {
    var order = get(orderId);
    order.reject(approverId, reason);
    order = purchaseOrderRepository.save(order);
    log.info("Rejected purchase order {}: {}", orderId, order.getRejectionReason());
    journal(
        order,
        AuditAction.REJECT,
        "Purchase order rejected: " + order.getRejectionReason(),
        approverId,
        Map.of());
    return order;
  }

  @Transactional
  public PurchaseOrder markOrdered(UUID orderId, UUID actorId) {
    var order = get(orderId);
    order.markOrdered();
    order = purchaseOrderRepository.save(order);
    log.info("Purchase order {} sent to supplier", orderId);
    journal(order, AuditAction.UPDATE, "Purchase order placed", actorId, Map.of());
    return order;
  }

  @Transactional
  public PurchaseOrder markReceived(UUID orderId, UUID actorId) {
    var order = get(orderId);
    order.markReceived();
    order = purchaseOrderRepository.save(order);
    log.info("Purchase order {} received", orderId);
    journal(order, AuditAction.UPDATE, "Purchase order received", actorId, Map.of());
    return order;
  }

  @Transactional
  public PurchaseOrder markInvoiced(UUID orderId, String invoiceReference, UUID actorId) {
    var order = get(orderId);
    order.markInvoiced(invoiceReference);
    order = purchaseOrderRepository.save(order);
    log.info("Purchase order {} invoiced under {}", orderId, order.getInvoiceReference());
    journal(
        order,
        AuditAction.INVOICE,
        "Supplier invoice " + order.getInvoiceReference(),
        actorId,
        Map.of());
    return order;
  }

  /** Sets the reconciled amount and invoice date reported by the accounting sync. */
  @Transactional
  public PurchaseOrder applyReconciliation(
      UUID orderId, BigDecimal realAmountHt, LocalDate realInvoiceDate) {
    var order = get(orderId);
    order.applyReconciliation(realAmountHt, realInvoiceDate);
    order = purchaseOrderRepository.save(order);
    log.info(
        "Reconciled purchase order {}: real amount {} (nominal {})",
        orderId,
        order.getRealAmountHt(),
        order.getTotalHt());
    var details = new HashMap<String, Object>();
    details.put("real_amount_ht", order.getRealAmountHt().toPlainString());
    details.put("real_invoice_date", String.valueOf(realInvoiceDate));
    journal(order, AuditAction.UPDATE, "Reconciled with accounting", null, details);
    return order;
  }

  /** Tombstones the order. It stays readable by id through the repository but leaves every sum. */
  @Transactional
  public void delete(UUID orderId, UUID actorId) {
    var order = get(orderId);
    order.softDelete(actorId);
    purchaseOrderRepository.save(order);
    log.info("Soft-deleted purchase order {}", orderId);
    journal(order, AuditAction.DELETE, "Purchase order deleted", actorId, Map.of());
  }

  @Transactional(readOnly = true)
  public PurchaseOrder get(UUID orderId) {
    return purchaseOrderRepository
        .findLiveById(orderId)
        .orElseThrow(() -> new ResourceNotFoundException("PurchaseOrder", orderId));
  }

  @Transactional(readOnly = true)
  public List<PurchaseOrder> listByProject(UUID projectId, PurchaseOrderStatus status) {
    if (status != null) {
      return purchaseOrderRepository.findLiveByProjectIdAndStatus(projectId, status);
    }
    return purchaseOrderRepository.findLiveByProjectId(projectId);
  }

  @Transactional(readOnly = true)
  public List<PurchaseOrder> listPendingApproval() {
    return purchaseOrderRepository.findLiveByStatus(PurchaseOrderStatus.REQUESTED);
  }

  @Transactional(readOnly = true)
  public BigDecimal engagedAmount(UUID projectId) {
    return aggregationService.engagedAmount(projectId);
  }

  @Transactional(readOnly = true)
  public BigDecimal realizedAmount(UUID projectId) {
    return aggregationService.realizedAmount(projectId);
  }

  private Supplier requireActiveSupplier(UUID supplierId) {
    var supplier =
        supplierRepository
            .findLiveById(supplierId)
            .orElseThrow(() -> new ResourceNotFoundException("Supplier", supplierId));
    if (!supplier.isActive()) {
      throw new BusinessRuleException(
          "supplier_inactive",
          "Supplier inactive",
          "Supplier " + supplier.getName() + " is inactive and cannot receive orders");
    }
    return supplier;
  }

  private BudgetLot requireSiteLot(UUID lotId, Budget budget) {
    var lot =
        lotRepository
            .findLiveById(lotId)
            .orElseThrow(() -> new ResourceNotFoundException("BudgetLot", lotId));
    if (lot.getPhase() != LotPhase.SITE
        || (budget != null && !Objects.equals(lot.getBudgetId(), budget.getId()))) {
      throw InvalidStateException.forField(
          "lotId", "Lot " + lot.getCode() + " does not belong to this project's budget");
    }
    return lot;
  }

  private void journal(
      PurchaseOrder order,
      AuditAction action,
      String detail,
      UUID actorId,
      Map<String, Object> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .entityType(ENTITY_TYPE)
            .entityId(order.getId())
            .projectId(order.getProjectId())
            .action(action)
            .detail(detail)
            .actorId(actorId)
            .details(details)
            .build());
  }
}
