package com.warehouse.requisitions.repository;

import com.warehouse.requisitions.model.RequisitionCodeSequence;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class RequisitionCodeSequenceRepositoryTest {

    @Autowired
    private RequisitionCodeSequenceRepository sequenceRepository;

    @Test
    void insertDay_ShouldCreateCounterAtZero() {
        LocalDate day = LocalDate.of(2025, 3, 14);

        assertEquals(1, sequenceRepository.insertDay(day));
        Optional<RequisitionCodeSequence> locked = sequenceRepository.findByDayForUpdate(day);

        assertTrue(locked.isPresent());
        assertEquals(0, locked.get().getIssuedCount());
        assertTrue(sequenceRepository.existsById(day));
        assertFalse(sequenceRepository.existsById(day.plusDays(1)));
    }

    @Test
    void findByDayForUpdate_ShouldSeeIncrementedCounter() {
        LocalDate day = LocalDate.of(2025, 3, 15);
        sequenceRepository.insertDay(day);
        RequisitionCodeSequence sequence = sequenceRepository.findByDayForUpdate(day).orElseThrow();
        sequence.setIssuedCount(sequence.getIssuedCount() + 1);
        sequenceRepository.saveAndFlush(sequence);

        assertEquals(1, sequenceRepository.findByDayForUpdate(day).orElseThrow().getIssuedCount());
    }
}
