package com.warehouse.requisitions.service;

import com.warehouse.requisitions.config.RequisitionProperties;
import com.warehouse.requisitions.dto.RequestedItem;
import com.warehouse.requisitions.dto.RequisitionView;
import com.warehouse.requisitions.dto.StockMovement;
import com.warehouse.requisitions.exception.CodeGenerationFailedException;
import com.warehouse.requisitions.exception.ErrorCode;
import com.warehouse.requisitions.exception.InvalidStateTransitionException;
import com.warehouse.requisitions.exception.PermissionDeniedException;
import com.warehouse.requisitions.exception.RequisitionNotFoundException;
import com.warehouse.requisitions.exception.ValidationException;
import com.warehouse.requisitions.model.*;
import com.warehouse.requisitions.repository.AreaRepository;
import com.warehouse.requisitions.repository.InventoryItemRepository;
import com.warehouse.requisitions.repository.MachineRepository;
import com.warehouse.requisitions.repository.RequisitionRepository;
import com.warehouse.requisitions.repository.UserRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class RequisitionService {

    private static final Logger logger = LoggerFactory.getLogger(RequisitionService.class);

    static final int MAX_NOTE_LENGTH = 2000;

    private final RequisitionRepository requisitionRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final UserRepository userRepository;
    private final MachineRepository machineRepository;
    private final AreaRepository areaRepository;
    private final RequisitionCodeGenerator codeGenerator;
    private final InventoryLedgerService ledger;
    private final AuditService auditService;
    private final TransactionTemplate txTemplate;
    private final Clock clock;
    private final RequisitionProperties properties;

    public RequisitionService(RequisitionRepository requisitionRepository,
            InventoryItemRepository inventoryItemRepository,
            UserRepository userRepository,
            MachineRepository machineRepository,
            AreaRepository areaRepository,
            RequisitionCodeGenerator codeGenerator,
            InventoryLedgerService ledger,
            AuditService auditService,
            PlatformTransactionManager transactionManager,
            Clock clock,
            RequisitionProperties properties) {
        this.requisitionRepository = requisitionRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.userRepository = userRepository;
        this.machineRepository = machineRepository;
        this.areaRepository = areaRepository;
        this.codeGenerator = codeGenerator;
        this.ledger = ledger;
        this.auditService = auditService;
        this.txTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Creates a pending requisition. Each attempt runs in one transaction; only a failure
     * to allocate a code, or a clash on the unique code, is retried, up to {@code requisitions.code.max-attempts} times.
     */
    public RequisitionView submitRequisition(Long requesterId, Long machineId, Long areaId,
            List<RequestedItem> items, String note) {
        int maxAttempts = Math.max(1, properties.getCode().getMaxAttempts());
        CodeGenerationFailedException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            codeGenerator.prepareDay(codeGenerator.today());
            try {
                return txTemplate.execute(status -> create(requesterId, machineId, areaId, items, note));
            } catch (CodeGenerationFailedException e) {
                lastFailure = e;
                logger.warn("Requisition code allocation failed (attempt {}/{}): {}", attempt, maxAttempts,
                        e.getMessage());
            } catch (DataIntegrityViolationException e) {
                if (!isCodeCollision(e)) {
                    throw e;
                }
                lastFailure = new CodeGenerationFailedException("Requisition code already taken", e);
                logger.warn("Requisition code collision (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
            }
        }
        throw lastFailure;
    }

    static boolean isCodeCollision(DataIntegrityViolationException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String constraint = ((ConstraintViolationException) cause).getConstraintName();
                return constraint != null
                        && constraint.toLowerCase(Locale.ROOT).contains(Requisition.CODE_CONSTRAINT);
            }
        }
        return false;
    }

    private RequisitionView create(Long requesterId, Long machineId, Long areaId, List<RequestedItem> items,
            String note) {
        User requester = userRepository.findById(requesterId)
                .orElseThrow(() -> ValidationException.unknownUser(requesterId));
        if (!requester.getRole().canSubmit()) {
            throw new PermissionDeniedException(requester.getUsername(), requester.getRole(), "submit requisitions");
        }

        List<RequestedItem> lines = items == null ? List.of()
                : items.stream()
                        .filter(Objects::nonNull)
                        .filter(line -> line.getQty() != null && line.getQty().signum() > 0)
                        .toList();
        if (lines.isEmpty()) {
            throw ValidationException.emptyRequisition();
        }
        for (RequestedItem line : lines) {
            if (!Quantities.fitsColumn(line.getQty())) {
                throw ValidationException.unsupportedQuantity(ErrorCode.INVALID_INPUT,
                        "Quantity for inventory item " + line.getInventoryItemId(), line.getQty());
            }
        }
        if (note != null && note.length() > MAX_NOTE_LENGTH) {
            throw new ValidationException(ErrorCode.INVALID_INPUT, "Note is longer than " + MAX_NOTE_LENGTH + " characters");
        }

        Map<Long, InventoryItem> inventory = resolveInventory(lines);
        Machine machine = machineId == null ? null
                : machineRepository.findById(machineId)
                        .orElseThrow(() -> ValidationException.unknownReference("Machine", machineId));
        Area area = resolveArea(areaId, machine);

        LocalDateTime now = LocalDateTime.now(clock);
        String code = codeGenerator.nextCode(now.toLocalDate());

        Requisition requisition = new Requisition();
        requisition.setCode(code);
        requisition.setRequester(requester);
        requisition.setMachine(machine);
        requisition.setArea(area);
        requisition.setNote(note);
        requisition.setStatus(RequisitionStatus.PENDING);
        requisition.setCreatedAt(now);
        requisition.setUpdatedAt(now);

        for (RequestedItem line : lines) {
            RequisitionItem item = new RequisitionItem();
            item.setInventoryItem(inventory.get(line.getInventoryItemId()));
            item.setQtyRequested(line.getQty());
            requisition.addItem(item);
        }

        Requisition saved = requisitionRepository.saveAndFlush(requisition);
        auditService.log(requester.getUsername(), "REQUISITION_SUBMITTED",
                code + ", items: " + saved.getItems().size());
        logger.info("Requisition {} submitted by {} with {} item(s)", code, requester.getUsername(),
                saved.getItems().size());
        return RequisitionView.from(saved);
    }

    private Map<Long, InventoryItem> resolveInventory(List<RequestedItem> lines) {
        Set<Long> ids = new LinkedHashSet<>();
        for (RequestedItem line : lines) {
            if (line.getInventoryItemId() == null) {
                throw ValidationException.unknownInventoryItem(null);
            }
            ids.add(line.getInventoryItemId());
        }
        Map<Long, InventoryItem> found = inventoryItemRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(InventoryItem::getId, Function.identity()));
        for (Long id : ids) {
            if (!found.containsKey(id)) {
                throw ValidationException.unknownInventoryItem(id);
            }
        }
        return found;
    }

    private Area resolveArea(Long areaId, Machine machine) {
        Area area = areaId == null ? null
                : areaRepository.findById(areaId)
                        .orElseThrow(() -> ValidationException.unknownReference("Area", areaId));
        if (machine == null || machine.getArea() == null) {
            return area;
        }
        if (area == null) {
            return machine.getArea();
        }
        if (!machine.getArea().getId().equals(area.getId())) {
            throw new ValidationException(ErrorCode.MACHINE_AREA_MISMATCH,
                    "Machine " + machine.getCode() + " belongs to area " + machine.getArea().getCode()
                            + ", not " + area.getCode());
        }
        return area;
    }

    /**
     * Approves or rejects a pending requisition. The requisition row is locked first, then
     * the affected inventory rows in ascending id order. Nothing is written unless every
     * check passes, and a failure in the ledger rolls back the whole decision.
     */
    @Transactional
    public RequisitionView decideRequisition(Long requisitionId, Long approverId, Decision decision,
            Map<Long, BigDecimal> approvedQuantities, String comment) {
        if (decision == null) {
            throw new ValidationException(ErrorCode.INVALID_INPUT, "Decision is required");
        }
        if (comment != null && comment.length() > MAX_NOTE_LENGTH) {
            throw new ValidationException(ErrorCode.INVALID_INPUT, "Comment is longer than " + MAX_NOTE_LENGTH + " characters");
        }

        Requisition requisition = requisitionRepository.findByIdForUpdate(requisitionId)
                .orElseThrow(() -> new RequisitionNotFoundException(requisitionId));
        User approver = userRepository.findById(approverId)
                .orElseThrow(() -> ValidationException.unknownUser(approverId));
        if (!approver.getRole().canDecide()) {
            throw new PermissionDeniedException(approver.getUsername(), approver.getRole(), "decide requisitions");
        }
        if (requisition.getStatus().isTerminal()) {
            logger.warn("Stale decision on {} by {}: already {}", requisition.getCode(), approver.getUsername(),
                    requisition.getStatus());
            throw new InvalidStateTransitionException(requisition.getCode(), requisition.getStatus());
        }

        Map<Long, BigDecimal> granted = switch (decision) {
            case APPROVE -> validateApprovedQuantities(requisition, approvedQuantities);
            case REJECT -> Map.of();
        };

        LocalDateTime now = LocalDateTime.now(clock);
        Approval approval = new Approval();
        approval.setApprover(approver);
        approval.setApproved(decision == Decision.APPROVE);
        approval.setComment(comment);
        approval.setDecidedAt(now);
        requisition.addApproval(approval);

        RequisitionStatus outcome = switch (decision) {
            case APPROVE -> approve(requisition, granted, approver);
            case REJECT -> reject(requisition);
        };
        requisition.setStatus(outcome);
        requisition.setUpdatedAt(now);

        Requisition saved = requisitionRepository.saveAndFlush(requisition);
        auditService.log(approver.getUsername(), "REQUISITION_" + outcome.name(), requisition.getCode());
        logger.info("Requisition {} {} by {}", requisition.getCode(), outcome, approver.getUsername());
        return RequisitionView.from(saved);
    }

    private Map<Long, BigDecimal> validateApprovedQuantities(Requisition requisition,
            Map<Long, BigDecimal> approvedQuantities) {
        Map<Long, RequisitionItem> itemsById = requisition.getItems().stream()
                .collect(Collectors.toMap(RequisitionItem::getId, Function.identity()));
        Map<Long, BigDecimal> granted = new HashMap<>();
        if (approvedQuantities == null) {
            return granted;
        }

        for (Map.Entry<Long, BigDecimal> entry : approvedQuantities.entrySet()) {
            RequisitionItem item = itemsById.get(entry.getKey());
            if (item == null) {
                throw new ValidationException(ErrorCode.INVALID_APPROVED_QUANTITY,
                        "Item " + entry.getKey() + " is not part of requisition " + requisition.getCode());
            }
            BigDecimal qty = entry.getValue() != null ? entry.getValue() : BigDecimal.ZERO;
            if (qty.signum() < 0 || qty.compareTo(item.getQtyRequested()) > 0) {
                throw ValidationException.invalidApprovedQuantity(item.getId(), qty, item.getQtyRequested());
            }
            if (!Quantities.fitsColumn(qty)) {
                throw ValidationException.unsupportedQuantity(ErrorCode.INVALID_APPROVED_QUANTITY,
                        "Approved quantity for item " + item.getId(), qty);
            }
            granted.put(item.getId(), qty);
        }
        return granted;
    }

    private RequisitionStatus approve(Requisition requisition, Map<Long, BigDecimal> granted, User approver) {
        // getId() on the lazy inventory reference does not load the row before it is locked
        List<RequisitionItem> lockOrder = requisition.getItems().stream()
                .sorted(Comparator.comparing((RequisitionItem i) -> i.getInventoryItem().getId())
                        .thenComparing(RequisitionItem::getLineNumber))
                .toList();

        for (RequisitionItem item : lockOrder) {
            BigDecimal qty = granted.getOrDefault(item.getId(), BigDecimal.ZERO);
            if (qty.signum() == 0) {
                item.setQtyApproved(BigDecimal.ZERO);
                item.setShortfall(BigDecimal.ZERO);
                continue;
            }
            StockMovement movement = ledger.decrement(item.getInventoryItem().getId(), qty);
            item.setQtyApproved(movement.getApplied());
            item.setShortfall(movement.getShortfall());
            if (movement.hasShortfall()) {
                auditService.log(approver.getUsername(), "STOCK_SHORTFALL",
                        requisition.getCode() + " " + movement.getSku() + ": approved " + qty
                                + ", issued " + movement.getApplied() + ", short " + movement.getShortfall());
            }
        }

        boolean allGranted = requisition.getItems().stream().allMatch(RequisitionItem::isFullyApproved);
        return allGranted ? RequisitionStatus.APPROVED : RequisitionStatus.PARTIALLY_APPROVED;
    }

    private RequisitionStatus reject(Requisition requisition) {
        for (RequisitionItem item : requisition.getItems()) {
            item.setQtyApproved(BigDecimal.ZERO);
            item.setShortfall(BigDecimal.ZERO);
        }
        return RequisitionStatus.REJECTED;
    }

    @Transactional(readOnly = true)
    public RequisitionView getRequisition(Long id) {
        return requisitionRepository.findById(id)
                .map(RequisitionView::from)
                .orElseThrow(() -> new RequisitionNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<RequisitionView> listByRequester(Long requesterId) {
        return requisitionRepository.findByRequesterIdOrderByCreatedAtDesc(requesterId).stream()
                .map(RequisitionView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RequisitionView> listPending() {
        return requisitionRepository.findByStatusOrderByCreatedAtAsc(RequisitionStatus.PENDING).stream()
                .map(RequisitionView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RequisitionView> listHistory(Integer limit) {
        return requisitionRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, effectiveLimit(limit))).stream()
                .map(RequisitionView::from)
                .toList();
    }

    int effectiveLimit(Integer limit) {
        RequisitionProperties.History history = properties.getHistory();
        if (limit == null || limit <= 0) {
            return history.getDefaultLimit();
        }
        return Math.min(limit, history.getMaxLimit());
    }
}
