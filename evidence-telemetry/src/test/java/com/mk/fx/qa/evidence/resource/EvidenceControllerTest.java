package com.mk.fx.qa.evidence.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.evidence.dto.EvidenceExport;
import com.mk.fx.qa.evidence.model.CollectionView;
import com.mk.fx.qa.evidence.model.EvidenceFilter;
import com.mk.fx.qa.evidence.model.EvidenceItem;
import com.mk.fx.qa.evidence.model.EvidenceStateException;
import com.mk.fx.qa.evidence.model.EvidenceSummary;
import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.RetentionResult;
import com.mk.fx.qa.evidence.model.StorageStats;
import com.mk.fx.qa.evidence.store.EvidenceStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = EvidenceController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class})
class EvidenceControllerTest {

  private static final String EXEC = "exec-1";

  @Autowired MockMvc mvc;

  @MockBean EvidenceStore evidenceStore;

  private static CollectionView view() {
    var item =
        new EvidenceItem(
            "log_0a1b2c3d",
            EvidenceType.LOG,
            "scn-1",
            null,
            "console",
            "log evidence",
            Instant.parse("2026-01-01T10:00:00Z"),
            "logs/exec-1/log_0a1b2c3d_1767261600000.log.gz",
            42,
            Map.of("compressed", true),
            List.of("log"));
    return new CollectionView(
        EXEC,
        Instant.parse("2026-01-01T09:59:00Z"),
        null,
        Map.of("browser", "chromium"),
        List.of(item),
        EvidenceSummary.of(List.of(item), 0));
  }

  @Test
  void getCollection_found_returnsItemsAndSummary() throws Exception {
    when(evidenceStore.getCollection(eq(EXEC), any())).thenReturn(Optional.of(view()));

    mvc.perform(get("/api/evidence/{executionId}", EXEC))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.executionId").value(EXEC))
        .andExpect(jsonPath("$.items[0].id").value("log_0a1b2c3d"))
        .andExpect(jsonPath("$.items[0].type").value("log"))
        .andExpect(jsonPath("$.summary.totalItems").value(1))
        .andExpect(jsonPath("$.summary.byType.log").value(1));
  }

  @Test
  void getCollection_filterParams_passedToStore() throws Exception {
    when(evidenceStore.getCollection(eq(EXEC), any())).thenReturn(Optional.of(view()));

    mvc.perform(
            get("/api/evidence/{executionId}", EXEC)
                .param("type", "screenshot", "log")
                .param("scenario", "scn-1")
                .param("from", "2026-01-01T00:00:00Z"))
        .andExpect(status().isOk());

    ArgumentCaptor<EvidenceFilter> captor = ArgumentCaptor.forClass(EvidenceFilter.class);
    verify(evidenceStore).getCollection(eq(EXEC), captor.capture());
    EvidenceFilter filter = captor.getValue();
    assertEquals(
        Set.of(EvidenceType.SCREENSHOT, EvidenceType.LOG), filter.types());
    assertEquals(Set.of("scn-1"), filter.scenarioIds());
    assertEquals(
        Instant.parse("2026-01-01T00:00:00Z"), filter.start());
  }

  @Test
  void getCollection_unknownType_returnsBadRequest() throws Exception {
    mvc.perform(get("/api/evidence/{executionId}", EXEC).param("type", "hologram"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid Argument"));
    verifyNoInteractions(evidenceStore);
  }

  @Test
  void getCollection_notFound_returns404() throws Exception {
    when(evidenceStore.getCollection(eq("missing"), any())).thenReturn(Optional.empty());

    mvc.perform(get("/api/evidence/{executionId}", "missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"));
  }

  @Test
  void getSummary_found_returnsExport() throws Exception {
    var export =
        EvidenceExport.builder()
            .executionId(EXEC)
            .totalItems(3)
            .scenarios(2)
            .failedStepEvidence(1)
            .byType(Map.of("log", 3))
            .build();
    when(evidenceStore.exportSummary(EXEC)).thenReturn(Optional.of(export));

    mvc.perform(get("/api/evidence/{executionId}/summary", EXEC))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalItems").value(3))
        .andExpect(jsonPath("$.scenarios").value(2))
        .andExpect(jsonPath("$.failedStepEvidence").value(1));
  }

  @Test
  void getContent_found_returnsBytes() throws Exception {
    byte[] body = "console: ready".getBytes(StandardCharsets.UTF_8);
    when(evidenceStore.getEvidenceContent(EXEC, "log_1")).thenReturn(Optional.of(body));

    mvc.perform(get("/api/evidence/{executionId}/items/{itemId}/content", EXEC, "log_1"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
        .andExpect(content().bytes(body));
  }

  @Test
  void getContent_missing_returns404() throws Exception {
    when(evidenceStore.getEvidenceContent(EXEC, "nope")).thenReturn(Optional.empty());

    mvc.perform(get("/api/evidence/{executionId}/items/{itemId}/content", EXEC, "nope"))
        .andExpect(status().isNotFound());
  }

  @Test
  void getContent_readFailure_returns500() throws Exception {
    when(evidenceStore.getEvidenceContent(EXEC, "log_1")).thenThrow(new IOException("disk gone"));

    mvc.perform(get("/api/evidence/{executionId}/items/{itemId}/content", EXEC, "log_1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Storage Error"));
  }

  @Test
  void clearEvidence_known_returns204() throws Exception {
    when(evidenceStore.clearEvidence(EXEC)).thenReturn(true);

    mvc.perform(delete("/api/evidence/{executionId}", EXEC)).andExpect(status().isNoContent());
  }

  @Test
  void clearEvidence_unknown_returns404() throws Exception {
    when(evidenceStore.clearEvidence("missing")).thenReturn(false);

    mvc.perform(delete("/api/evidence/{executionId}", "missing")).andExpect(status().isNotFound());
  }

  @Test
  void stateConflict_returns409() throws Exception {
    when(evidenceStore.exportSummary(EXEC))
        .thenThrow(new EvidenceStateException("Execution exec-1 is FINALIZING, not COLLECTING"));

    mvc.perform(get("/api/evidence/{executionId}/summary", EXEC))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("Conflict"));
  }

  @Test
  void getStorageStats_returnsUsage() throws Exception {
    var stats =
        new StorageStats(
            2, 300, 1, 1, Map.of("logs", new StorageStats.DirectoryUsage(2, 300)));
    when(evidenceStore.getStorageStats()).thenReturn(stats);

    mvc.perform(get("/api/evidence/storage"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalFiles").value(2))
        .andExpect(jsonPath("$.byDirectory.logs.bytes").value(300));
  }

  @Test
  void applyRetention_returnsCounts() throws Exception {
    when(evidenceStore.cleanupOldEvidence())
        .thenReturn(new RetentionResult(Instant.parse("2026-01-01T00:00:00Z"), 1, 4, 0));

    mvc.perform(post("/api/evidence/retention"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.manifestsRemoved").value(1))
        .andExpect(jsonPath("$.filesRemoved").value(4));
  }
}
