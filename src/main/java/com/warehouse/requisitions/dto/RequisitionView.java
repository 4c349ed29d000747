package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.Area;
import com.warehouse.requisitions.model.Machine;
import com.warehouse.requisitions.model.Requisition;
import com.warehouse.requisitions.model.RequisitionStatus;
import com.warehouse.requisitions.model.User;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Detached snapshot of a requisition, built while the persistence context is still open.
 */
@Value
@Builder
public class RequisitionView {
    Long id;
    String code;
    RequisitionStatus status;
    Long requesterId;
    String requesterName;
    Long machineId;
    String machineName;
    Long areaId;
    String areaName;
    String note;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    List<RequisitionItemView> items;
    List<ApprovalView> approvals;

    public static RequisitionView from(Requisition requisition) {
        User requester = requisition.getRequester();
        Machine machine = requisition.getMachine();
        Area area = requisition.getArea();
        return RequisitionView.builder()
                .id(requisition.getId())
                .code(requisition.getCode())
                .status(requisition.getStatus())
                .requesterId(requester.getId())
                .requesterName(requester.getFullName() != null ? requester.getFullName() : requester.getUsername())
                .machineId(machine != null ? machine.getId() : null)
                .machineName(machine != null ? machine.getName() : null)
                .areaId(area != null ? area.getId() : null)
                .areaName(area != null ? area.getName() : null)
                .note(requisition.getNote())
                .createdAt(requisition.getCreatedAt())
                .updatedAt(requisition.getUpdatedAt())
                .items(requisition.getItems().stream().map(RequisitionItemView::from).toList())
                .approvals(requisition.getApprovals().stream().map(ApprovalView::from).toList())
                .build();
    }
}
