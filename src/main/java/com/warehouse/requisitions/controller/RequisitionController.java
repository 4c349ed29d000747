package com.warehouse.requisitions.controller;

import com.google.zxing.WriterException;
import com.warehouse.requisitions.dto.DecisionRequest;
import com.warehouse.requisitions.dto.RequisitionView;
import com.warehouse.requisitions.dto.SubmitRequisitionRequest;
import com.warehouse.requisitions.service.AppUserPrincipal;
import com.warehouse.requisitions.service.QrCodeService;
import com.warehouse.requisitions.service.RequisitionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/requisitions")
public class RequisitionController {

    private static final Logger logger = LoggerFactory.getLogger(RequisitionController.class);

    private final RequisitionService requisitionService;
    private final QrCodeService qrCodeService;

    public RequisitionController(RequisitionService requisitionService, QrCodeService qrCodeService) {
        this.requisitionService = requisitionService;
        this.qrCodeService = qrCodeService;
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('REQUESTER', 'ADMINISTRATOR')")
    public ResponseEntity<RequisitionView> submit(@AuthenticationPrincipal AppUserPrincipal principal,
            @Valid @RequestBody SubmitRequisitionRequest request) {
        logger.debug("Submit requisition by {} with {} line(s)", principal.getUsername(), request.getItems().size());
        RequisitionView created = requisitionService.submitRequisition(principal.getId(), request.getMachineId(),
                request.getAreaId(), request.getItems(), request.getNote());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/{id}/decision")
    @PreAuthorize("hasAnyRole('APPROVER', 'ADMINISTRATOR')")
    public RequisitionView decide(@AuthenticationPrincipal AppUserPrincipal principal,
            @PathVariable Long id,
            @Valid @RequestBody DecisionRequest request) {
        return requisitionService.decideRequisition(id, principal.getId(), request.getDecision(),
                request.getApprovedQuantities(), request.getComment());
    }

    @GetMapping("/{id}")
    public RequisitionView get(@PathVariable Long id) {
        return requisitionService.getRequisition(id);
    }

    @GetMapping("/mine")
    public List<RequisitionView> mine(@AuthenticationPrincipal AppUserPrincipal principal) {
        return requisitionService.listByRequester(principal.getId());
    }

    @GetMapping("/pending")
    @PreAuthorize("hasAnyRole('APPROVER', 'ADMINISTRATOR')")
    public List<RequisitionView> pending() {
        return requisitionService.listPending();
    }

    @GetMapping("/history")
    public List<RequisitionView> history(@RequestParam(required = false) Integer limit) {
        return requisitionService.listHistory(limit);
    }

    @GetMapping(value = "/{id}/qr", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> pickSlipQr(@PathVariable Long id,
            @RequestParam(defaultValue = "200") int size) throws WriterException, IOException {
        RequisitionView requisition = requisitionService.getRequisition(id);
        byte[] png = qrCodeService.generatePickSlipQr(requisition.getCode(), size);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(png);
    }
}
