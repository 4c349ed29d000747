package com.warehouse.requisitions.repository;

import com.warehouse.requisitions.model.Approval;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ApprovalRepository extends JpaRepository<Approval, Long> {
    long countByRequisitionId(Long requisitionId);

    // Rows of [requisition createdAt, first decidedAt]
    @Query("SELECT r.createdAt, MIN(a.decidedAt) FROM Approval a JOIN a.requisition r GROUP BY r.id, r.createdAt")
    List<Object[]> findDecisionTimes();
}
