package com.warehouse.requisitions.repository;

import com.warehouse.requisitions.model.Requisition;
import com.warehouse.requisitions.model.RequisitionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RequisitionRepository extends JpaRepository<Requisition, Long> {
    Optional<Requisition> findByCode(String code);

    List<Requisition> findByRequesterIdOrderByCreatedAtDesc(Long requesterId);

    List<Requisition> findByStatusOrderByCreatedAtAsc(RequisitionStatus status);

    List<Requisition> findAllByOrderByCreatedAtDesc(Pageable pageable);

    long countByStatus(RequisitionStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Requisition r WHERE r.id = :id")
    Optional<Requisition> findByIdForUpdate(@Param("id") Long id);
}
