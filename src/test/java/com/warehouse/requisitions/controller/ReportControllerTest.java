package com.warehouse.requisitions.controller;

import com.warehouse.requisitions.model.UserRole;
import com.warehouse.requisitions.service.AppUserPrincipal;
import com.warehouse.requisitions.service.ReportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ReportControllerTest {

    private static final AppUserPrincipal REQUESTER = new AppUserPrincipal(1L, "requester1", "x", UserRole.REQUESTER);
    private static final AppUserPrincipal APPROVER = new AppUserPrincipal(2L, "approver1", "x", UserRole.APPROVER);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportService reportService;

    @Test
    void historyXlsx_ShouldDownloadWorkbookForApprover() throws Exception {
        byte[] workbook = {0x50, 0x4B, 0x03, 0x04};
        when(reportService.exportHistoryXlsx(100)).thenReturn(workbook);

        mockMvc.perform(get("/api/reports/history.xlsx").param("limit", "100").with(user(APPROVER)))
                .andExpect(status().isOk())
                .andExpect(content().contentType(ReportController.XLSX))
                .andExpect(header().string("Content-Disposition", containsString("requisition-history.xlsx")))
                .andExpect(content().bytes(workbook));
    }

    @Test
    void historyXlsx_ShouldBeForbiddenForRequester() throws Exception {
        mockMvc.perform(get("/api/reports/history.xlsx").with(user(REQUESTER)))
                .andExpect(status().isForbidden());

        verify(reportService, never()).exportHistoryXlsx(any());
    }

    @Test
    void historyCsv_ShouldDownloadTextForApprover() throws Exception {
        when(reportService.exportHistoryCsv(null)).thenReturn("code\r\n");

        mockMvc.perform(get("/api/reports/history.csv").with(user(APPROVER)))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("requisition-history.csv")))
                .andExpect(content().string("code\r\n"));
    }
}
