package com.warehouse.requisitions.service;

import com.warehouse.requisitions.dto.StockMovement;
import com.warehouse.requisitions.exception.ErrorCode;
import com.warehouse.requisitions.exception.ValidationException;
import com.warehouse.requisitions.model.InventoryItem;
import com.warehouse.requisitions.repository.InventoryItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryLedgerServiceTest {

    @Mock
    private InventoryItemRepository itemRepository;

    @InjectMocks
    private InventoryLedgerService ledger;

    private InventoryItem filter;

    @BeforeEach
    void setUp() {
        filter = new InventoryItem();
        filter.setId(10L);
        filter.setSku("SKU-001");
        filter.setDescription("Filter");
        filter.setStock(new BigDecimal("10"));
    }

    @Test
    void decrement_ShouldTakeFullQuantityWhenStockSuffices() {
        when(itemRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(filter));

        StockMovement movement = ledger.decrement(10L, new BigDecimal("2"));

        assertEquals(0, new BigDecimal("2").compareTo(movement.getApplied()));
        assertEquals(0, BigDecimal.ZERO.compareTo(movement.getShortfall()));
        assertFalse(movement.hasShortfall());
        assertEquals(0, new BigDecimal("8").compareTo(filter.getStock()));
        verify(itemRepository, times(1)).save(filter);
    }

    @Test
    void decrement_ShouldReportShortfallAndStopAtZero() {
        filter.setStock(BigDecimal.ONE);
        when(itemRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(filter));

        StockMovement movement = ledger.decrement(10L, new BigDecimal("3"));

        assertEquals(0, BigDecimal.ONE.compareTo(movement.getApplied()));
        assertEquals(0, new BigDecimal("2").compareTo(movement.getShortfall()));
        assertTrue(movement.hasShortfall());
        assertEquals(0, BigDecimal.ZERO.compareTo(filter.getStock()));
        assertEquals(0, BigDecimal.ZERO.compareTo(movement.getStockAfter()));
    }

    @Test
    void decrement_ShouldApplyNothingWhenOutOfStock() {
        filter.setStock(BigDecimal.ZERO);
        when(itemRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(filter));

        StockMovement movement = ledger.decrement(10L, new BigDecimal("4"));

        assertEquals(0, BigDecimal.ZERO.compareTo(movement.getApplied()));
        assertEquals(0, new BigDecimal("4").compareTo(movement.getShortfall()));
        assertEquals(0, BigDecimal.ZERO.compareTo(filter.getStock()));
    }

    @Test
    void decrement_ShouldHandleFractionalQuantities() {
        filter.setStock(new BigDecimal("2.500"));
        when(itemRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(filter));

        StockMovement movement = ledger.decrement(10L, new BigDecimal("0.75"));

        assertEquals(0, new BigDecimal("1.75").compareTo(filter.getStock()));
        assertEquals(0, new BigDecimal("0.75").compareTo(movement.getApplied()));
    }

    @Test
    void decrement_ShouldRejectNonPositiveQuantity() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> ledger.decrement(10L, BigDecimal.ZERO));

        assertEquals(ErrorCode.INVALID_APPROVED_QUANTITY, ex.getErrorCode());
        verifyNoInteractions(itemRepository);
    }

    @Test
    void decrement_ShouldFailForUnknownItem() {
        when(itemRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        ValidationException ex = assertThrows(ValidationException.class,
                () -> ledger.decrement(99L, BigDecimal.ONE));

        assertEquals(ErrorCode.UNKNOWN_INVENTORY_ITEM, ex.getErrorCode());
        verify(itemRepository, never()).save(any());
    }

    @Test
    void get_ShouldReturnCurrentStock() {
        when(itemRepository.findById(10L)).thenReturn(Optional.of(filter));

        assertEquals(0, new BigDecimal("10").compareTo(ledger.get(10L)));
    }

    @Test
    void decrement_ShouldRejectQuantityFinerThanStockColumn() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> ledger.decrement(10L, new BigDecimal("0.0005")));

        assertEquals(ErrorCode.INVALID_APPROVED_QUANTITY, ex.getErrorCode());
        verify(itemRepository, never()).findByIdForUpdate(any());
        assertEquals(0, BigDecimal.TEN.compareTo(filter.getStock()));
    }
}
