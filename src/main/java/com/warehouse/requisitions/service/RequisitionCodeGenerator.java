package com.warehouse.requisitions.service;

import com.warehouse.requisitions.config.RequisitionProperties;
import com.warehouse.requisitions.exception.CodeGenerationFailedException;
import com.warehouse.requisitions.model.RequisitionCodeSequence;
import com.warehouse.requisitions.repository.RequisitionCodeSequenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Hands out codes of the form {@code REQ-YYYYMMDD-NNNN}, NNNN counting from 1 per
 * calendar day in the configured zone.
 */
@Service
public class RequisitionCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(RequisitionCodeGenerator.class);

    public static final int MAX_DAILY_SEQUENCE = 9999;

    private final RequisitionCodeSequenceRepository sequenceRepository;
    private final TransactionTemplate dayRowTx;
    private final Clock clock;
    private final int maxAttempts;

    public RequisitionCodeGenerator(RequisitionCodeSequenceRepository sequenceRepository,
            PlatformTransactionManager transactionManager, Clock clock, RequisitionProperties properties) {
        this.sequenceRepository = sequenceRepository;
        this.dayRowTx = new TransactionTemplate(transactionManager);
        this.dayRowTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.maxAttempts = Math.max(1, properties.getCode().getMaxAttempts());
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Makes sure the counter row for {@code day} exists. Runs in its own short transaction
     * and must be called before the creating transaction is opened. A concurrent insert of
     * the same day counts as success.
     */
    public void prepareDay(LocalDate day) {
        DataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                dayRowTx.executeWithoutResult(status -> {
                    if (!sequenceRepository.existsById(day)) {
                        sequenceRepository.insertDay(day);
                        logger.info("Opened requisition code sequence for {}", day);
                    }
                });
                return;
            } catch (DataAccessException e) {
                lastFailure = e;
                if (sequenceRepository.existsById(day)) {
                    return;
                }
                logger.warn("Could not open code sequence for {} (attempt {}/{}): {}", day, attempt, maxAttempts,
                        e.getMessage());
            }
        }
        throw new CodeGenerationFailedException(
                "Could not open code sequence for " + day + " after " + maxAttempts + " attempts", lastFailure);
    }

    /**
     * Increments the day's counter under a row lock held until the caller commits, so the
     * counter and the requisition carrying the code are written or discarded together.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String nextCode(LocalDate day) {
        RequisitionCodeSequence sequence;
        try {
            sequence = sequenceRepository.findByDayForUpdate(day)
                    .orElseThrow(() -> new CodeGenerationFailedException("No code sequence open for " + day));
        } catch (PessimisticLockingFailureException e) {
            throw new CodeGenerationFailedException("Timed out waiting for the code sequence of " + day, e);
        }

        int next = sequence.getIssuedCount() + 1;
        if (next > MAX_DAILY_SEQUENCE) {
            throw new CodeGenerationFailedException("All " + MAX_DAILY_SEQUENCE + " requisition codes for " + day + " are used");
        }
        sequence.setIssuedCount(next);
        sequenceRepository.save(sequence);
        return format(day, next);
    }

    public static String format(LocalDate day, int sequence) {
        return String.format("REQ-%s-%04d", day.format(DateTimeFormatter.BASIC_ISO_DATE), sequence);
    }
}
