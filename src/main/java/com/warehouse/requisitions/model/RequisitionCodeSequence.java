package com.warehouse.requisitions.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;

/**
 * Per-day counter behind requisition codes. The row is locked for the duration of the
 * creating transaction, so codes for one day are handed out strictly one at a time.
 */
@Entity
@Table(name = "requisition_code_sequences")
@Data
public class RequisitionCodeSequence {
    @Id
    @Column(name = "sequence_day")
    private LocalDate sequenceDay;

    @Column(name = "issued_count", nullable = false)
    private int issuedCount;
}
