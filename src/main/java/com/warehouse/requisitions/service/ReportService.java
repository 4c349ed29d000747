package com.warehouse.requisitions.service;

import com.warehouse.requisitions.dto.HistoryRow;
import com.warehouse.requisitions.dto.RequisitionKpis;
import com.warehouse.requisitions.dto.RequisitionView;
import com.warehouse.requisitions.model.RequisitionStatus;
import com.warehouse.requisitions.repository.ApprovalRepository;
import com.warehouse.requisitions.repository.RequisitionItemRepository;
import com.warehouse.requisitions.repository.RequisitionRepository;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only projections over requisition history.
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    static final int TOP_ITEMS = 10;
    static final String HISTORY_SHEET = "Requisitions";

    private static final String[] HISTORY_COLUMNS = {
            "code", "requester", "area", "machine", "sku", "description",
            "qty_requested", "qty_approved", "status", "created_at"
    };

    private final RequisitionService requisitionService;
    private final RequisitionRepository requisitionRepository;
    private final RequisitionItemRepository requisitionItemRepository;
    private final ApprovalRepository approvalRepository;

    public ReportService(RequisitionService requisitionService,
            RequisitionRepository requisitionRepository,
            RequisitionItemRepository requisitionItemRepository,
            ApprovalRepository approvalRepository) {
        this.requisitionService = requisitionService;
        this.requisitionRepository = requisitionRepository;
        this.requisitionItemRepository = requisitionItemRepository;
        this.approvalRepository = approvalRepository;
    }

    // One row per line item of the most recent requisitions
    public List<HistoryRow> historyRows(Integer limit) {
        List<HistoryRow> rows = new ArrayList<>();
        for (RequisitionView requisition : requisitionService.listHistory(limit)) {
            requisition.getItems().forEach(item -> rows.add(new HistoryRow(
                    requisition.getCode(),
                    requisition.getRequesterName(),
                    requisition.getAreaName(),
                    requisition.getMachineName(),
                    item.getSku(),
                    item.getDescription(),
                    item.getQtyRequested(),
                    item.getQtyApproved(),
                    requisition.getStatus(),
                    requisition.getCreatedAt())));
        }
        return rows;
    }

    public String exportHistoryCsv(Integer limit) {
        StringBuilder csv = new StringBuilder();
        appendLine(csv, (Object[]) HISTORY_COLUMNS);
        for (HistoryRow row : historyRows(limit)) {
            appendLine(csv,
                    row.getCode(),
                    row.getRequester(),
                    row.getArea(),
                    row.getMachine(),
                    row.getSku(),
                    row.getDescription(),
                    row.getQtyRequested(),
                    row.getQtyApproved(),
                    row.getStatus(),
                    row.getCreatedAt() != null ? row.getCreatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null);
        }
        return csv.toString();
    }

    public byte[] exportHistoryXlsx(Integer limit) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(HISTORY_SHEET);
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));

            Row header = sheet.createRow(0);
            for (int i = 0; i < HISTORY_COLUMNS.length; i++) {
                header.createCell(i).setCellValue(HISTORY_COLUMNS[i]);
            }

            int rowIndex = 1;
            for (HistoryRow row : historyRows(limit)) {
                Row sheetRow = sheet.createRow(rowIndex++);
                setText(sheetRow, 0, row.getCode());
                setText(sheetRow, 1, row.getRequester());
                setText(sheetRow, 2, row.getArea());
                setText(sheetRow, 3, row.getMachine());
                setText(sheetRow, 4, row.getSku());
                setText(sheetRow, 5, row.getDescription());
                setNumber(sheetRow, 6, row.getQtyRequested());
                setNumber(sheetRow, 7, row.getQtyApproved());
                setText(sheetRow, 8, row.getStatus() != null ? row.getStatus().name() : null);
                if (row.getCreatedAt() != null) {
                    Cell created = sheetRow.createCell(9);
                    created.setCellValue(row.getCreatedAt());
                    created.setCellStyle(dateStyle);
                }
            }
            sheet.createFreezePane(0, 1);

            workbook.write(out);
            return out.toByteArray();
        }
    }

    public RequisitionKpis kpis() {
        Map<RequisitionStatus, Long> byStatus = new EnumMap<>(RequisitionStatus.class);
        long total = 0;
        for (RequisitionStatus status : RequisitionStatus.values()) {
            long count = requisitionRepository.countByStatus(status);
            byStatus.put(status, count);
            total += count;
        }

        List<RequisitionKpis.TopItem> topItems = new ArrayList<>();
        for (Object[] row : requisitionItemRepository.sumRequestedBySku(PageRequest.of(0, TOP_ITEMS))) {
            topItems.add(new RequisitionKpis.TopItem((String) row[0], (String) row[1], (BigDecimal) row[2]));
        }

        return new RequisitionKpis(total, byStatus, averageHoursToDecision(), topItems);
    }

    private Double averageHoursToDecision() {
        List<Object[]> decisionTimes = approvalRepository.findDecisionTimes();
        if (decisionTimes.isEmpty()) {
            return null;
        }
        long totalSeconds = 0;
        for (Object[] row : decisionTimes) {
            totalSeconds += Duration.between((LocalDateTime) row[0], (LocalDateTime) row[1]).getSeconds();
        }
        return totalSeconds / 3600.0 / decisionTimes.size();
    }

    private static void appendLine(StringBuilder csv, Object... values) {
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append(escape(values[i]));
        }
        csv.append("\r\n");
    }

    // Blank cells are left out of the row
    private static void setText(Row row, int column, String value) {
        if (value != null) {
            row.createCell(column).setCellValue(value);
        }
    }

    private static void setNumber(Row row, int column, BigDecimal value) {
        if (value != null) {
            row.createCell(column).setCellValue(value.doubleValue());
        }
    }

    static String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof BigDecimal ? ((BigDecimal) value).stripTrailingZeros().toPlainString() : value.toString();
        if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }
}
