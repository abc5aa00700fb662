package com.eyelevel.catalogingestion.controller;

import com.eyelevel.catalogingestion.dto.cleanup.CleanupReport;
import com.eyelevel.catalogingestion.dto.cleanup.ExpiredSweepStats;
import com.eyelevel.catalogingestion.dto.cleanup.OrphanSweepStats;
import com.eyelevel.catalogingestion.service.cleanup.CleanupService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MaintenanceController.class)
class MaintenanceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CleanupService cleanupService;

    @Test
    void reportsBothSweeps() throws Exception {
        ExpiredSweepStats expired = new ExpiredSweepStats();
        expired.setUploadsDeleted(2);
        expired.setProductsDeleted(40);
        OrphanSweepStats orphaned = new OrphanSweepStats();
        orphaned.setOrphanedDeleted(3);
        when(cleanupService.cleanupExpired(true)).thenReturn(new CleanupReport(expired, orphaned));

        mockMvc.perform(post("/maintenance/cleanup-expired").param("include_orphaned", "true"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.expired.uploads_deleted").value(2))
               .andExpect(jsonPath("$.response.expired.products_deleted").value(40))
               .andExpect(jsonPath("$.response.orphaned.orphaned_deleted").value(3))
               .andExpect(jsonPath("$.display_message").value("Cleanup finished: 2 expired session(s) reclaimed."));
    }

    @Test
    void orphanSweepIsOptIn() throws Exception {
        when(cleanupService.cleanupExpired(false)).thenReturn(new CleanupReport(new ExpiredSweepStats(), null));

        mockMvc.perform(post("/maintenance/cleanup-expired"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.orphaned").doesNotExist());
    }
}
