package com.warehouse.requisitions.repository;

import com.warehouse.requisitions.model.RequisitionCodeSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Optional;

public interface RequisitionCodeSequenceRepository extends JpaRepository<RequisitionCodeSequence, LocalDate> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM RequisitionCodeSequence s WHERE s.sequenceDay = :day")
    Optional<RequisitionCodeSequence> findByDayForUpdate(@Param("day") LocalDate day);

    // Plain insert: save() would merge and could overwrite a row another transaction just created
    @Modifying
    @Query(value = "INSERT INTO requisition_code_sequences (sequence_day, issued_count) VALUES (:day, 0)", nativeQuery = true)
    int insertDay(@Param("day") LocalDate day);
}
