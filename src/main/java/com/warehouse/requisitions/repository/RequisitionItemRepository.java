package com.warehouse.requisitions.repository;

import com.warehouse.requisitions.model.RequisitionItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface RequisitionItemRepository extends JpaRepository<RequisitionItem, Long> {

    // Rows of [sku, description, total requested], largest total first
    @Query("SELECT inv.sku, inv.description, SUM(ri.qtyRequested) FROM RequisitionItem ri JOIN ri.inventoryItem inv "
            + "GROUP BY inv.sku, inv.description ORDER BY SUM(ri.qtyRequested) DESC, inv.sku ASC")
    List<Object[]> sumRequestedBySku(Pageable pageable);
}
