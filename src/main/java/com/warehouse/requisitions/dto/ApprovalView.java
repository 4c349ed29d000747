package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.Approval;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class ApprovalView {
    Long id;
    Long approverId;
    String approverUsername;
    boolean approved;
    String comment;
    LocalDateTime decidedAt;

    public static ApprovalView from(Approval approval) {
        return ApprovalView.builder()
                .id(approval.getId())
                .approverId(approval.getApprover().getId())
                .approverUsername(approval.getApprover().getUsername())
                .approved(approval.isApproved())
                .comment(approval.getComment())
                .decidedAt(approval.getDecidedAt())
                .build();
    }
}
