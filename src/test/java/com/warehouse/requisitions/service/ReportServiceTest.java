package com.warehouse.requisitions.service;

import com.warehouse.requisitions.dto.HistoryRow;
import com.warehouse.requisitions.dto.RequisitionItemView;
import com.warehouse.requisitions.dto.RequisitionKpis;
import com.warehouse.requisitions.dto.RequisitionView;
import com.warehouse.requisitions.model.RequisitionStatus;
import com.warehouse.requisitions.repository.ApprovalRepository;
import com.warehouse.requisitions.repository.RequisitionItemRepository;
import com.warehouse.requisitions.repository.RequisitionRepository;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    @Mock
    private RequisitionService requisitionService;
    @Mock
    private RequisitionRepository requisitionRepository;
    @Mock
    private RequisitionItemRepository requisitionItemRepository;
    @Mock
    private ApprovalRepository approvalRepository;

    @InjectMocks
    private ReportService reportService;

    @Test
    void historyRows_ShouldFlattenRequisitionLines() {
        when(requisitionService.listHistory(500)).thenReturn(List.of(requisition()));

        List<HistoryRow> rows = reportService.historyRows(500);

        assertEquals(2, rows.size());
        assertEquals("REQ-20250314-0001", rows.get(0).getCode());
        assertEquals("SKU-001", rows.get(0).getSku());
        assertEquals("SKU-002", rows.get(1).getSku());
        assertEquals(RequisitionStatus.PARTIALLY_APPROVED, rows.get(1).getStatus());
    }

    @Test
    void exportHistoryCsv_ShouldWriteHeaderAndQuoteSpecialCharacters() {
        when(requisitionService.listHistory(null)).thenReturn(List.of(requisition()));

        String csv = reportService.exportHistoryCsv(null);
        String[] lines = csv.split("\r\n");

        assertEquals(3, lines.length);
        assertEquals("code,requester,area,machine,sku,description,qty_requested,qty_approved,status,created_at", lines[0]);
        assertEquals("REQ-20250314-0001,Floor Requester,Area A,Cutter 1,SKU-001,\"Filter, oil\",3,2,PARTIALLY_APPROVED,2025-03-14T10:15:30",
                lines[1]);
        assertTrue(lines[2].contains("\"M8 \"\"hex\"\" screw\""));
    }

    @Test
    void escape_ShouldLeavePlainValuesUntouched() {
        assertEquals("", ReportService.escape(null));
        assertEquals("plain", ReportService.escape("plain"));
        assertEquals("2.5", ReportService.escape(new BigDecimal("2.500")));
        assertEquals("\"a\nb\"", ReportService.escape("a\nb"));
    }

    @Test
    void exportHistoryXlsx_ShouldWriteOneSheetRowPerLine() throws IOException {
        when(requisitionService.listHistory(null)).thenReturn(List.of(requisition()));

        byte[] bytes = reportService.exportHistoryXlsx(null);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = workbook.getSheet(ReportService.HISTORY_SHEET);
            assertNotNull(sheet);
            assertEquals(2, sheet.getLastRowNum());

            Row header = sheet.getRow(0);
            assertEquals("code", header.getCell(0).getStringCellValue());
            assertEquals("created_at", header.getCell(9).getStringCellValue());

            Row first = sheet.getRow(1);
            assertEquals("REQ-20250314-0001", first.getCell(0).getStringCellValue());
            assertEquals("Filter, oil", first.getCell(5).getStringCellValue());
            assertEquals(3.0, first.getCell(6).getNumericCellValue());
            assertEquals(2.0, first.getCell(7).getNumericCellValue());
            assertEquals("PARTIALLY_APPROVED", first.getCell(8).getStringCellValue());
            assertEquals(LocalDateTime.of(2025, 3, 14, 10, 15, 30), first.getCell(9).getLocalDateTimeCellValue());

            assertEquals("M8 \"hex\" screw", sheet.getRow(2).getCell(5).getStringCellValue());
        }
    }

    @Test
    void exportHistoryXlsx_ShouldWriteOnlyHeaderWhenHistoryIsEmpty() throws IOException {
        when(requisitionService.listHistory(5)).thenReturn(List.of());

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(reportService.exportHistoryXlsx(5)))) {
            Sheet sheet = workbook.getSheet(ReportService.HISTORY_SHEET);
            assertEquals(0, sheet.getLastRowNum());
            assertEquals("qty_requested", sheet.getRow(0).getCell(6).getStringCellValue());
        }
    }

    @Test
    void kpis_ShouldAggregateStatusesDecisionTimeAndTopItems() {
        when(requisitionRepository.countByStatus(any())).thenReturn(0L);
        when(requisitionRepository.countByStatus(RequisitionStatus.PENDING)).thenReturn(2L);
        when(requisitionRepository.countByStatus(RequisitionStatus.APPROVED)).thenReturn(3L);
        when(approvalRepository.findDecisionTimes()).thenReturn(List.of(
                new Object[] {LocalDateTime.of(2025, 3, 14, 8, 0), LocalDateTime.of(2025, 3, 14, 10, 0)},
                new Object[] {LocalDateTime.of(2025, 3, 14, 8, 0), LocalDateTime.of(2025, 3, 14, 12, 0)}));
        when(requisitionItemRepository.sumRequestedBySku(any(Pageable.class))).thenReturn(List.<Object[]>of(
                new Object[] {"SKU-002", "M8 Screw", new BigDecimal("40")},
                new Object[] {"SKU-001", "Filter", new BigDecimal("6")}));

        RequisitionKpis kpis = reportService.kpis();

        assertEquals(5L, kpis.getTotalRequisitions());
        assertEquals(2L, kpis.getCountByStatus().get(RequisitionStatus.PENDING));
        assertEquals(0L, kpis.getCountByStatus().get(RequisitionStatus.CANCELLED));
        assertEquals(3.0, kpis.getAverageHoursToDecision(), 0.0001);
        assertEquals(2, kpis.getTopRequestedItems().size());
        assertEquals("SKU-002", kpis.getTopRequestedItems().get(0).getSku());
    }

    @Test
    void kpis_ShouldLeaveAverageEmptyWhenNothingDecided() {
        when(requisitionRepository.countByStatus(any())).thenReturn(0L);
        when(approvalRepository.findDecisionTimes()).thenReturn(List.of());
        when(requisitionItemRepository.sumRequestedBySku(any(Pageable.class))).thenReturn(List.of());

        RequisitionKpis kpis = reportService.kpis();

        assertEquals(0L, kpis.getTotalRequisitions());
        assertNull(kpis.getAverageHoursToDecision());
        assertTrue(kpis.getTopRequestedItems().isEmpty());
    }

    private static RequisitionView requisition() {
        return RequisitionView.builder()
                .id(1L)
                .code("REQ-20250314-0001")
                .status(RequisitionStatus.PARTIALLY_APPROVED)
                .requesterId(1L)
                .requesterName("Floor Requester")
                .areaName("Area A")
                .machineName("Cutter 1")
                .createdAt(LocalDateTime.of(2025, 3, 14, 10, 15, 30))
                .items(List.of(
                        RequisitionItemView.builder().lineNumber(1).sku("SKU-001").description("Filter, oil")
                                .qtyRequested(new BigDecimal("3")).qtyApproved(new BigDecimal("2.000")).build(),
                        RequisitionItemView.builder().lineNumber(2).sku("SKU-002").description("M8 \"hex\" screw")
                                .qtyRequested(new BigDecimal("10")).qtyApproved(BigDecimal.ZERO).build()))
                .approvals(List.of())
                .build();
    }
}
