package com.warehouse.requisitions.controller;

import com.warehouse.requisitions.dto.RequisitionKpis;
import com.warehouse.requisitions.service.ReportService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/reports")
@PreAuthorize("hasAnyRole('APPROVER', 'ADMINISTRATOR')")
public class ReportController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/history.csv")
    public ResponseEntity<byte[]> historyCsv(@RequestParam(required = false) Integer limit) {
        byte[] csv = reportService.exportHistoryCsv(limit).getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"requisition-history.csv\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv);
    }

    @GetMapping("/history.xlsx")
    public ResponseEntity<byte[]> historyXlsx(@RequestParam(required = false) Integer limit) throws IOException {
        byte[] xlsx = reportService.exportHistoryXlsx(limit);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"requisition-history.xlsx\"")
                .contentType(XLSX)
                .body(xlsx);
    }

    @GetMapping("/kpis")
    public RequisitionKpis kpis() {
        return reportService.kpis();
    }
}
