package com.mk.fx.qa.evidence.resource;

import com.mk.fx.qa.evidence.model.EvidenceFilter;
import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.RetentionResult;
import com.mk.fx.qa.evidence.model.StorageStats;
import com.mk.fx.qa.evidence.store.EvidenceStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Evidence", description = "Read and maintenance endpoints for collected test evidence")
@RestController
@RequestMapping("/api/evidence")
@RequiredArgsConstructor
public class EvidenceController {

  private final EvidenceStore evidenceStore;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Collections
  // -----------------------------------------------------
  @Operation(
      summary = "Get evidence collection",
      description =
          "Returns the collection of an execution, optionally filtered by type, scenario, tag and"
              + " time range. Completed executions are read from their manifest.")
  @GetMapping("/{executionId}")
  public ResponseEntity<?> getCollection(
      @PathVariable String executionId,
      @RequestParam(required = false) List<String> type,
      @RequestParam(required = false) List<String> scenario,
      @RequestParam(required = false) List<String> tag,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    var filter = new EvidenceFilter(types(type), asSet(scenario), asSet(tag), from, to);
    return evidenceStore
        .getCollection(executionId, filter)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Evidence for {} not found", executionId);
              return responseFactory.notFound(executionId);
            });
  }

  @Operation(summary = "Get evidence summary", description = "Reporting summary of an execution.")
  @GetMapping("/{executionId}/summary")
  public ResponseEntity<?> getSummary(@PathVariable String executionId) {
    return evidenceStore
        .exportSummary(executionId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> responseFactory.notFound(executionId));
  }

  @Operation(
      summary = "Download evidence content",
      description = "Returns the stored bytes of one item, decompressed.")
  @GetMapping("/{executionId}/items/{itemId}/content")
  public ResponseEntity<?> getContent(@PathVariable String executionId, @PathVariable String itemId)
      throws IOException {
    var content = evidenceStore.getEvidenceContent(executionId, itemId);
    if (content.isEmpty()) {
      return responseFactory.error(
          HttpStatus.NOT_FOUND,
          "Not Found",
          "Evidence item " + itemId + " not found for execution " + executionId);
    }
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_OCTET_STREAM).body(content.get());
  }

  @Operation(
      summary = "Clear evidence",
      description = "Deletes the stored files and manifest of an execution.")
  @DeleteMapping("/{executionId}")
  public ResponseEntity<?> clearEvidence(@PathVariable String executionId) {
    boolean cleared = evidenceStore.clearEvidence(executionId);
    log.info("Clear requested for {} -> {}", executionId, cleared);
    return cleared ? ResponseEntity.noContent().build() : responseFactory.notFound(executionId);
  }

  // -----------------------------------------------------
  // Storage maintenance
  // -----------------------------------------------------
  @Operation(summary = "Storage statistics", description = "Disk usage below the evidence root.")
  @GetMapping("/storage")
  public ResponseEntity<StorageStats> getStorageStats() {
    return responseFactory.ok(evidenceStore.getStorageStats());
  }

  @Operation(
      summary = "Apply retention",
      description = "Deletes collections and archives older than the retention window.")
  @PostMapping("/retention")
  public ResponseEntity<RetentionResult> applyRetention() {
    return responseFactory.ok(evidenceStore.cleanupOldEvidence());
  }

  private static Set<EvidenceType> types(List<String> keys) {
    if (keys == null) {
      return Set.of();
    }
    return keys.stream().map(EvidenceType::fromKey).collect(Collectors.toSet());
  }

  private static Set<String> asSet(List<String> values) {
    return values == null ? Set.of() : Set.copyOf(values);
  }
}
