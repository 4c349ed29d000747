package com.warehouse.requisitions.service;

import com.warehouse.requisitions.config.RequisitionProperties;
import com.warehouse.requisitions.exception.CodeGenerationFailedException;
import com.warehouse.requisitions.model.RequisitionCodeSequence;
import com.warehouse.requisitions.repository.RequisitionCodeSequenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RequisitionCodeGeneratorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 5);

    @Mock
    private RequisitionCodeSequenceRepository sequenceRepository;
    @Mock
    private PlatformTransactionManager transactionManager;

    private RequisitionCodeGenerator generator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-05T23:30:00Z"), ZoneOffset.UTC);
        generator = new RequisitionCodeGenerator(sequenceRepository, transactionManager, clock,
                new RequisitionProperties());
    }

    @Test
    void format_ShouldPadSequenceToFourDigits() {
        assertEquals("REQ-20250105-0007", RequisitionCodeGenerator.format(DAY, 7));
        assertEquals("REQ-20251231-9999", RequisitionCodeGenerator.format(LocalDate.of(2025, 12, 31), 9999));
    }

    @Test
    void today_ShouldFollowConfiguredClock() {
        assertEquals(DAY, generator.today());
    }

    @Test
    void nextCode_ShouldIncrementDailyCounter() {
        RequisitionCodeSequence sequence = sequence(4);
        when(sequenceRepository.findByDayForUpdate(DAY)).thenReturn(Optional.of(sequence));

        String code = generator.nextCode(DAY);

        assertEquals("REQ-20250105-0005", code);
        assertEquals(5, sequence.getIssuedCount());
        verify(sequenceRepository).save(sequence);
    }

    @Test
    void nextCode_ShouldStartAtOneForFreshDay() {
        when(sequenceRepository.findByDayForUpdate(DAY)).thenReturn(Optional.of(sequence(0)));

        assertEquals("REQ-20250105-0001", generator.nextCode(DAY));
    }

    @Test
    void nextCode_ShouldFailWhenDayIsExhausted() {
        RequisitionCodeSequence sequence = sequence(RequisitionCodeGenerator.MAX_DAILY_SEQUENCE);
        when(sequenceRepository.findByDayForUpdate(DAY)).thenReturn(Optional.of(sequence));

        assertThrows(CodeGenerationFailedException.class, () -> generator.nextCode(DAY));
        assertEquals(RequisitionCodeGenerator.MAX_DAILY_SEQUENCE, sequence.getIssuedCount());
        verify(sequenceRepository, never()).save(any());
    }

    @Test
    void nextCode_ShouldFailWhenLockTimesOut() {
        when(sequenceRepository.findByDayForUpdate(DAY))
                .thenThrow(new PessimisticLockingFailureException("lock timeout"));

        CodeGenerationFailedException ex = assertThrows(CodeGenerationFailedException.class,
                () -> generator.nextCode(DAY));
        assertTrue(ex.isRetryable());
    }

    @Test
    void nextCode_ShouldFailWhenDayWasNotPrepared() {
        when(sequenceRepository.findByDayForUpdate(DAY)).thenReturn(Optional.empty());

        assertThrows(CodeGenerationFailedException.class, () -> generator.nextCode(DAY));
    }

    @Test
    void prepareDay_ShouldInsertMissingDay() {
        when(sequenceRepository.existsById(DAY)).thenReturn(false);

        generator.prepareDay(DAY);

        verify(sequenceRepository).insertDay(DAY);
    }

    @Test
    void prepareDay_ShouldLeaveExistingDayAlone() {
        when(sequenceRepository.existsById(DAY)).thenReturn(true);

        generator.prepareDay(DAY);

        verify(sequenceRepository, never()).insertDay(any());
    }

    @Test
    void prepareDay_ShouldAcceptDayInsertedConcurrently() {
        when(sequenceRepository.existsById(DAY)).thenReturn(false, true);
        when(sequenceRepository.insertDay(DAY)).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertDoesNotThrow(() -> generator.prepareDay(DAY));
        verify(sequenceRepository, times(1)).insertDay(DAY);
    }

    @Test
    void prepareDay_ShouldGiveUpWhenInsertKeepsFailing() {
        when(sequenceRepository.existsById(DAY)).thenReturn(false);
        when(sequenceRepository.insertDay(DAY)).thenThrow(new DataIntegrityViolationException("connection lost"));

        assertThrows(CodeGenerationFailedException.class, () -> generator.prepareDay(DAY));
        verify(sequenceRepository, times(5)).insertDay(DAY);
    }

    private static RequisitionCodeSequence sequence(int issued) {
        RequisitionCodeSequence sequence = new RequisitionCodeSequence();
        sequence.setSequenceDay(DAY);
        sequence.setIssuedCount(issued);
        return sequence;
    }
}
