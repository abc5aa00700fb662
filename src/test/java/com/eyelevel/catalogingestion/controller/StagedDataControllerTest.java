package com.eyelevel.catalogingestion.controller;

import com.eyelevel.catalogingestion.dto.staged.PageResult;
import com.eyelevel.catalogingestion.dto.staged.StagedDeletionResult;
import com.eyelevel.catalogingestion.dto.staged.StagedFamilyResponse;
import com.eyelevel.catalogingestion.dto.staged.StagedProductPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationPatch;
import com.eyelevel.catalogingestion.dto.staged.StagedVariationResponse;
import com.eyelevel.catalogingestion.exception.StagedDataFrozenException;
import com.eyelevel.catalogingestion.exception.apiclient.ConflictException;
import com.eyelevel.catalogingestion.model.ImportStatus;
import com.eyelevel.catalogingestion.service.staging.StagedDataService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StagedDataController.class)
class StagedDataControllerTest {

    private static final String UPLOAD_ID = "9d3c2b1a-0f4e-4a8b-b6c7-d5e4f3a2b1c0";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StagedDataService stagedDataService;

    @Test
    void listsFamiliesOfLatestSessionForWorkspace() throws Exception {
        StagedFamilyResponse family = new StagedFamilyResponse(7L, UPLOAD_ID, "HARBOR COLLECTION", null, null, 3, 60,
                                                               true, ImportStatus.PENDING);
        when(stagedDataService.listFamilies("showroom", null, 0, 25))
                .thenReturn(new PageResult<>(List.of(family), 1, 0, 25));

        mockMvc.perform(get("/staged/families").header("X-Workspace-Id", "showroom").param("limit", "25"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.total").value(1))
               .andExpect(jsonPath("$.response.limit").value(25))
               .andExpect(jsonPath("$.response.items[0].name").value("HARBOR COLLECTION"))
               .andExpect(jsonPath("$.response.items[0].upload_id").value(UPLOAD_ID))
               .andExpect(jsonPath("$.response.items[0].import_status").value("pending"));
    }

    @Test
    void passesProductFiltersThrough() throws Exception {
        when(stagedDataService.listProducts("default", UPLOAD_ID, 7L, 200, null))
                .thenReturn(PageResult.empty(200, 50));

        mockMvc.perform(get("/staged/products").param("upload_id", UPLOAD_ID).param("family_id", "7")
                                                .param("offset", "200"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.offset").value(200));
    }

    @Test
    void nonNumericOffsetIsBadRequest() throws Exception {
        mockMvc.perform(get("/staged/products").param("offset", "abc"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.display_message").value("Invalid parameter type provided."));
    }

    @Test
    void patchBindsSnakeCaseBody() throws Exception {
        when(stagedDataService.updateProduct(eq(11L), any())).thenReturn(null);

        mockMvc.perform(patch("/staged/products/{productId}", 11L)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"model_number\":\"4411B\",\"base_price\":139900,\"import_status\":\"approved\",\"version\":2}"))
               .andExpect(status().isOk());

        ArgumentCaptor<StagedProductPatch> captor = ArgumentCaptor.forClass(StagedProductPatch.class);
        verify(stagedDataService).updateProduct(eq(11L), captor.capture());
        assertThat(captor.getValue().getModelNumber()).isEqualTo("4411B");
        assertThat(captor.getValue().getBasePrice()).isEqualTo(139900L);
        assertThat(captor.getValue().getImportStatus()).isEqualTo(ImportStatus.APPROVED);
        assertThat(captor.getValue().getVersion()).isEqualTo(2L);
        assertThat(captor.getValue().getName()).isNull();
    }

    @Test
    void invalidPatchIsRejectedBeforeService() throws Exception {
        mockMvc.perform(patch("/staged/products/{productId}", 11L)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"name\":\"\",\"base_price\":-1}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.display_message").value("Invalid input provided."));

        verifyNoInteractions(stagedDataService);
    }

    @Test
    void editingFrozenSessionIs403() throws Exception {
        when(stagedDataService.updateProduct(eq(11L), any()))
                .thenThrow(new StagedDataFrozenException("Staged data of upload " + UPLOAD_ID
                                                         + " is imported and can no longer be changed."));

        mockMvc.perform(patch("/staged/products/{productId}", 11L)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"name\":\"Late edit\"}"))
               .andExpect(status().isForbidden());
    }

    @Test
    void staleVersionIs409() throws Exception {
        when(stagedDataService.updateVariation(eq(5L), any()))
                .thenThrow(new ConflictException("Staged variation 5 was modified concurrently."));

        mockMvc.perform(patch("/staged/variations/{variationId}", 5L)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"is_available\":false,\"version\":0}"))
               .andExpect(status().isConflict());

        ArgumentCaptor<StagedVariationPatch> captor = ArgumentCaptor.forClass(StagedVariationPatch.class);
        verify(stagedDataService).updateVariation(eq(5L), captor.capture());
        assertThat(captor.getValue().getAvailable()).isFalse();
    }

    @Test
    void deleteProductReportsCascade() throws Exception {
        when(stagedDataService.deleteProduct(11L)).thenReturn(new StagedDeletionResult(11L, 2, 3));

        mockMvc.perform(delete("/staged/products/{productId}", 11L))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.variations_deleted").value(2))
               .andExpect(jsonPath("$.display_message").value("Product deleted with 2 variation(s) and 3 image(s)."));
    }

    @Test
    void listsVariationsOfProduct() throws Exception {
        when(stagedDataService.listVariations(11L)).thenReturn(List.of(
                new StagedVariationResponse(5L, 11L, "4411SB", "SB", "Harbor Sofa SB", 0L, true, 75, 0L)));

        mockMvc.perform(get("/staged/products/{productId}/variations", 11L))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response[0].sku").value("4411SB"))
               .andExpect(jsonPath("$.response[0].is_available").value(true));
    }

    @Test
    void nonPositiveIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/staged/products/{productId}", 0L)).andExpect(status().isBadRequest());

        verifyNoInteractions(stagedDataService);
    }
}
