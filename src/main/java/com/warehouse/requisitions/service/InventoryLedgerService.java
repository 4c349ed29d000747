package com.warehouse.requisitions.service;

import com.warehouse.requisitions.dto.StockMovement;
import com.warehouse.requisitions.exception.ErrorCode;
import com.warehouse.requisitions.exception.ValidationException;
import com.warehouse.requisitions.model.InventoryItem;
import com.warehouse.requisitions.repository.InventoryItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
public class InventoryLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(InventoryLedgerService.class);

    private final InventoryItemRepository itemRepository;

    public InventoryLedgerService(InventoryItemRepository itemRepository) {
        this.itemRepository = itemRepository;
    }

    /**
     * Takes up to {@code qty} out of stock. The item row stays locked until the caller's
     * transaction ends, so concurrent approvals on the same SKU are applied one after
     * the other. When stock is short only what is there is taken and the rest is
     * reported as shortfall; stock never goes below zero.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockMovement decrement(Long itemId, BigDecimal qty) {
        if (qty == null || qty.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_APPROVED_QUANTITY,
                    "Decrement quantity must be positive, got " + qty + " for item " + itemId);
        }
        if (!Quantities.fitsColumn(qty)) {
            throw ValidationException.unsupportedQuantity(ErrorCode.INVALID_APPROVED_QUANTITY,
                    "Decrement for item " + itemId, qty);
        }

        InventoryItem item = itemRepository.findByIdForUpdate(itemId)
                .orElseThrow(() -> ValidationException.unknownInventoryItem(itemId));

        BigDecimal available = item.getStock() != null ? item.getStock().max(BigDecimal.ZERO) : BigDecimal.ZERO;
        BigDecimal applied = qty.min(available);
        BigDecimal shortfall = qty.subtract(applied);
        BigDecimal stockAfter = available.subtract(applied);

        item.setStock(stockAfter);
        itemRepository.save(item);

        if (shortfall.signum() > 0) {
            logger.warn("Stock short for {}: wanted {}, took {}, short by {}", item.getSku(), qty, applied, shortfall);
        } else {
            logger.debug("Stock for {} reduced by {} to {}", item.getSku(), applied, stockAfter);
        }
        return new StockMovement(item.getId(), item.getSku(), qty, applied, shortfall, stockAfter);
    }

    @Transactional(readOnly = true)
    public BigDecimal get(Long itemId) {
        return itemRepository.findById(itemId)
                .map(InventoryItem::getStock)
                .orElseThrow(() -> ValidationException.unknownInventoryItem(itemId));
    }

    @Transactional(readOnly = true)
    public List<InventoryItem> listAll() {
        return itemRepository.findAll(Sort.by("sku"));
    }
}
