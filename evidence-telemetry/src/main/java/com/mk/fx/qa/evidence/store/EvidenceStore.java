package com.mk.fx.qa.evidence.store;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.evidence.cfg.EvidenceStoreCfg;
import com.mk.fx.qa.evidence.collector.Collector;
import com.mk.fx.qa.evidence.collector.CollectorFactory;
import com.mk.fx.qa.evidence.collector.CollectorOptions;
import com.mk.fx.qa.evidence.collector.StepCollector;
import com.mk.fx.qa.evidence.dto.EvidenceExport;
import com.mk.fx.qa.evidence.model.CollectionState;
import com.mk.fx.qa.evidence.model.CollectionView;
import com.mk.fx.qa.evidence.model.EvidenceCollection;
import com.mk.fx.qa.evidence.model.EvidenceFilter;
import com.mk.fx.qa.evidence.model.EvidenceItem;
import com.mk.fx.qa.evidence.model.EvidenceManifest;
import com.mk.fx.qa.evidence.model.EvidencePayload;
import com.mk.fx.qa.evidence.model.EvidenceStateException;
import com.mk.fx.qa.evidence.model.EvidenceSummary;
import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.RetentionResult;
import com.mk.fx.qa.evidence.model.StepStatus;
import com.mk.fx.qa.evidence.model.StorageStats;
import com.mk.fx.qa.evidence.utils.EnvironmentInfo;
import com.mk.fx.qa.evidence.utils.EvidenceUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Central service that orchestrates evidence collection for test executions.
 *
 * <p>Responsibilities:
 * - Creates one {@link Collector} per registered {@link CollectorFactory} when an execution
 *   starts, and drives them through {@code initialize -> collect -> finalize}.
 * - Fans scenario and step collection out to the collectors on a bounded worker pool. A failing
 *   collector contributes nothing and never fails the batch.
 * - Persists returned payloads below the evidence root (gzip for text-like types) and folds them
 *   into the execution's {@link EvidenceCollection}, evicting the oldest items once the storage
 *   budget is exceeded.
 * - On completion writes a checksummed manifest and, when enabled, an archive.
 * - Applies the retention policy at startup and on demand.
 *
 * <p>Lifecycle per execution: UNINITIALIZED → COLLECTING → FINALIZING → COMPLETED. Calls that
 * do not fit the current state raise {@link EvidenceStateException}.
 *
 * <p>Thread-safety: executions are independent. Within one execution, folding items and
 * enforcing the budget are serialized by the lock of its {@link ExecutionContext}.
 */
@Slf4j
@Service
public class EvidenceStore {

  private static final Set<EvidenceType> FAILED_STEP_TYPES =
      EnumSet.of(
          EvidenceType.SCREENSHOT,
          EvidenceType.LOG,
          EvidenceType.NETWORK,
          EvidenceType.PERFORMANCE,
          EvidenceType.METRICS);
  private static final Set<EvidenceType> STEP_TYPES = EnumSet.of(EvidenceType.METRICS);
  private static final List<String> EXTRA_DIRECTORIES = List.of("archives", "temp");

  private final EvidenceStoreCfg properties;
  private final Map<EvidenceType, CollectorFactory> factories;
  private final Path root;
  private final ThreadPoolExecutor executor;
  private final ExecutionRegistry registry;
  private final EvidenceFileWriter files;
  private final ManifestWriter manifests;
  private final EvidenceArchiver archiver;
  private final RetentionCleaner retention;
  private final StorageScanner scanner;
  private final AtomicBoolean accepting;

  /**
   * Creates the store with the provided configuration and collector factories.
   *
   * @throws IllegalStateException if more than one factory is registered for the same type
   */
  public EvidenceStore(
      EvidenceStoreCfg properties, List<CollectorFactory> factories, ObjectMapper mapper) {
    this.properties = properties;
    this.factories = initialiseFactories(factories);
    this.root = properties.rootPath();
    this.executor = createExecutor(properties.getConcurrency());
    this.registry = new ExecutionRegistry();
    this.files = new EvidenceFileWriter(root, properties.isCompress());
    this.manifests = new ManifestWriter(root, mapper, files);
    this.archiver = new EvidenceArchiver(root, mapper, files, manifests);
    this.retention = new RetentionCleaner(root, files, manifests, archiver);
    this.scanner = new StorageScanner(root);
    this.accepting = new AtomicBoolean(true);
  }

  @PostConstruct
  void initialise() {
    log.info(
        "EvidenceStore initialised with root={} maxSizeMb={} compress={} archive={}"
            + " deleteAfterArchive={} retentionDays={} concurrency={} collectors={}",
        root,
        properties.getMaxSizeMb(),
        properties.isCompress(),
        properties.isArchive(),
        properties.isDeleteAfterArchive(),
        properties.getRetentionDays(),
        properties.getConcurrency(),
        factories.keySet());
    createLayout();
    cleanupOldEvidence();
  }

  private ThreadPoolExecutor createExecutor(int concurrency) {
    var counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("evidence-collector-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(concurrency, threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Evidence store is shut down");
        });
    return pool;
  }

  private Map<EvidenceType, CollectorFactory> initialiseFactories(List<CollectorFactory> available) {
    Map<EvidenceType, CollectorFactory> map = new EnumMap<>(EvidenceType.class);
    for (CollectorFactory factory : available) {
      Objects.requireNonNull(factory, "Collector factory entry cannot be null");
      var type = Objects.requireNonNull(factory.type(), "Collector factory must declare its type");
      var existing = map.putIfAbsent(type, factory);
      if (existing != null) {
        throw new IllegalStateException("Multiple collector factories registered for type " + type);
      }
    }
    return Collections.unmodifiableMap(map);
  }

  private void createLayout() {
    try {
      Files.createDirectories(root);
      for (EvidenceType type : EvidenceType.values()) {
        Files.createDirectories(root.resolve(type.directory()));
      }
      for (String extra : EXTRA_DIRECTORIES) {
        Files.createDirectories(root.resolve(extra));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create evidence layout under " + root, e);
    }
  }

  // -----------------------------------------------------
  // Collection lifecycle
  // -----------------------------------------------------

  public CollectionView startCollection(String executionId) {
    return startCollection(executionId, Map.of(), List.of());
  }

  /**
   * Starts collecting evidence for {@code executionId}.
   *
   * <p>One collector is created per registered factory and initialized. If any collector cannot
   * be initialized the execution is discarded and the failure propagates.
   *
   * @param metadata free-form execution attributes, merged over the host facts
   * @param tags tags attached to the execution and handed to every collector
   * @throws EvidenceStateException if the store is shut down or the id already has a collection
   * @throws java.io.UncheckedIOException if a collector cannot create its output location
   */
  public CollectionView startCollection(
      String executionId, Map<String, Object> metadata, List<String> tags) {
    requireId(executionId);
    if (!accepting.get()) {
      throw new EvidenceStateException("Evidence store is shut down");
    }

    Map<String, Object> collectionMetadata = new LinkedHashMap<>();
    collectionMetadata.put("host", EnvironmentInfo.host());
    collectionMetadata.put("platform", EnvironmentInfo.platform());
    collectionMetadata.put("runtime", EnvironmentInfo.runtime());
    collectionMetadata.put("triggeredBy", EnvironmentInfo.triggeredBy());
    if (metadata != null) {
      collectionMetadata.putAll(metadata);
    }
    if (tags != null && !tags.isEmpty()) {
      collectionMetadata.put("tags", List.copyOf(tags));
    }

    var options = new CollectorOptions(root, collectionMetadata, tags);
    List<Collector> collectors = new ArrayList<>();
    for (CollectorFactory factory : factories.values()) {
      collectors.add(factory.create());
    }
    var context =
        new ExecutionContext(
            executionId,
            new EvidenceCollection(executionId, Instant.now(), collectionMetadata),
            collectors,
            options);
    if (!registry.register(context)) {
      throw new EvidenceStateException("Execution " + executionId + " already has a collection");
    }

    try {
      for (Collector collector : collectors) {
        collector.initialize(executionId, options);
      }
    } catch (RuntimeException e) {
      log.error("Failed to initialize collectors for execution {}", executionId, e);
      collectors.forEach(EvidenceStore::releaseQuietly);
      registry.remove(executionId);
      throw e;
    }

    context.transition(CollectionState.UNINITIALIZED, CollectionState.COLLECTING);
    log.info(
        "Evidence collection started for {} with collectors={}",
        executionId,
        collectors.stream().map(c -> c.type().key()).toList());
    return context.getCollection().view();
  }

  /**
   * Collects scenario evidence from every collector in parallel.
   *
   * @return the items added for this scenario, before any eviction
   */
  public List<EvidenceItem> collectForScenario(
      String executionId, String scenarioId, String scenarioName) {
    var context = requireActive(executionId);
    context.collecting().readLock().lock();
    try {
      context.requireCollecting();

      List<EvidencePayload> payloads =
          fanOut(
              context.getCollectors(),
              "scenario " + scenarioId,
              c -> c.collectForScenario(scenarioId, scenarioName));
      List<EvidenceItem> items = persist(context, scenarioId, null, null, payloads);
      fold(context, items);
      log.debug("Collected {} items for scenario {} of {}", items.size(), scenarioId, executionId);
      return items;
    } finally {
      context.collecting().readLock().unlock();
    }
  }

  /**
   * Collects step evidence from the step-capable collectors whose type is relevant for {@code
   * status}: failed steps reach screenshot, log, network, performance and metrics collectors,
   * every other step only the metrics collector.
   */
  public List<EvidenceItem> collectForStep(
      String executionId, String scenarioId, String stepId, String stepText, StepStatus status) {
    var context = requireActive(executionId);
    Set<EvidenceType> relevant = status == StepStatus.FAILED ? FAILED_STEP_TYPES : STEP_TYPES;
    List<StepCollector> targets =
        context.getCollectors().stream()
            .filter(c -> c instanceof StepCollector && relevant.contains(c.type()))
            .map(StepCollector.class::cast)
            .toList();

    context.collecting().readLock().lock();
    try {
      context.requireCollecting();

      List<EvidencePayload> payloads =
          fanOut(
              targets,
              "step " + stepId,
              c -> c.collectForStep(scenarioId, stepId, stepText, status));
      List<EvidenceItem> items = persist(context, scenarioId, stepId, status, payloads);
      fold(context, items);
      return items;
    } finally {
      context.collecting().readLock().unlock();
    }
  }

  /**
   * Finalizes every collector in parallel, stamps the end time, writes the manifest and archives
   * when configured. Waits for collect calls already in flight; collectors are released afterwards.
   *
   * @return the final view of the collection
   */
  public CollectionView completeCollection(String executionId) {
    var context = requireActive(executionId);
    context.collecting().writeLock().lock();
    try {
      context.transition(CollectionState.COLLECTING, CollectionState.FINALIZING);
    } finally {
      context.collecting().writeLock().unlock();
    }
    Instant started = Instant.now();

    run(context.getCollectors(), "finalize", c -> c.finalize(executionId));
    context.getCollection().complete(Instant.now());
    CollectionView view = context.getCollection().view();

    try {
      EvidenceManifest manifest = manifests.write(view);
      if (properties.isArchive()) {
        archiver.archive(manifest, properties.isDeleteAfterArchive());
      }
    } catch (UncheckedIOException e) {
      log.error("Failed to persist manifest or archive for {}", executionId, e);
    }

    context.getCollectors().forEach(EvidenceStore::releaseQuietly);
    context.transition(CollectionState.FINALIZING, CollectionState.COMPLETED);
    registry.complete(executionId, view);
    log.info(
        "Evidence collection completed for {} in {}ms: items={}, size={}, byType={}",
        executionId,
        Duration.between(started, Instant.now()).toMillis(),
        view.summary().totalItems(),
        EvidenceUtils.humanReadableBytes(view.summary().totalSize()),
        view.summary().byType());
    return view;
  }

  // -----------------------------------------------------
  // Queries
  // -----------------------------------------------------

  /** Lifecycle state of a known execution. */
  public Optional<CollectionState> getState(String executionId) {
    var context = registry.active(executionId);
    if (context.isPresent()) {
      return Optional.of(context.get().getState());
    }
    return registry.view(executionId).map(v -> CollectionState.COMPLETED);
  }

  public Optional<CollectionView> getCollection(String executionId) {
    return getCollection(executionId, EvidenceFilter.NONE);
  }

  /**
   * Returns the collection narrowed by {@code filter}, with the summary recomputed for the
   * matching items. Executions no longer held in memory are read from their manifest.
   */
  public Optional<CollectionView> getCollection(String executionId, EvidenceFilter filter) {
    Optional<CollectionView> view = registry.view(executionId);
    if (view.isEmpty()) {
      view = manifests.read(executionId).map(EvidenceManifest::toView);
    }
    return view.map(v -> applyFilter(v, filter == null ? EvidenceFilter.NONE : filter));
  }

  /**
   * Reads the stored bytes of one item, gunzipped when it was compressed.
   *
   * @return empty when the execution or the item is unknown, or the item has no stored file
   * @throws IOException when the file exists in the collection but cannot be read
   */
  public Optional<byte[]> getEvidenceContent(String executionId, String itemId)
      throws IOException {
    var item =
        getCollection(executionId)
            .flatMap(v -> v.items().stream().filter(i -> i.id().equals(itemId)).findFirst());
    if (item.isEmpty() || !item.get().persisted()) {
      return Optional.empty();
    }
    return Optional.of(files.read(item.get()));
  }

  /** Reporting summary of one execution. */
  public Optional<EvidenceExport> exportSummary(String executionId) {
    return getCollection(executionId).map(this::toExport);
  }

  public StorageStats getStorageStats() {
    return scanner.scan();
  }

  /**
   * Returns the collector of the given class serving an active execution, so hosts can feed it
   * directly (custom metrics, browser probes).
   */
  public <T extends Collector> Optional<T> findCollector(String executionId, Class<T> type) {
    return registry
        .active(executionId)
        .flatMap(
            c -> c.getCollectors().stream().filter(type::isInstance).map(type::cast).findFirst());
  }

  // -----------------------------------------------------
  // Maintenance
  // -----------------------------------------------------

  /**
   * Deletes every stored file and the manifest of {@code executionId} and forgets it. An active
   * execution has its collectors released without finalizing.
   *
   * @return false when the execution is unknown
   */
  public boolean clearEvidence(String executionId) {
    Optional<CollectionView> view = getCollection(executionId);
    Optional<ExecutionContext> active = registry.remove(executionId);
    active.ifPresent(c -> c.getCollectors().forEach(EvidenceStore::releaseQuietly));
    if (view.isEmpty()) {
      return false;
    }

    int deleted = 0;
    for (EvidenceItem item : view.get().items()) {
      if (files.delete(item)) {
        deleted++;
      }
    }
    try {
      Files.deleteIfExists(manifests.path(executionId));
    } catch (IOException e) {
      log.warn("Failed to delete manifest of {}: {}", executionId, e.getMessage());
    }
    log.info("Evidence cleared for {}: {} files deleted", executionId, deleted);
    return true;
  }

  /** Applies the retention policy now. */
  public RetentionResult cleanupOldEvidence() {
    RetentionResult result = retention.clean(properties.getRetentionDays(), Instant.now());
    log.info(
        "Retention cleanup (cutoff {}): manifests={}, files={}, archives={}",
        result.cutoff(),
        result.manifestsRemoved(),
        result.filesRemoved(),
        result.archivesRemoved());
    return result;
  }

  /**
   * Restores the manifest of an archive into {@code targetDir}.
   *
   * @return path of the written {@code manifest_<executionId>.json}
   */
  public Path extractArchive(Path archivePath, Path targetDir) throws IOException {
    return archiver.extract(archivePath, targetDir);
  }

  /**
   * Stops accepting executions and shuts the worker pool down, waiting briefly for running
   * collector calls.
   */
  public void shutdown() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    log.info("Shutting down EvidenceStore ({} active executions)", registry.activeCount());
    executor.shutdown();
    try {
      if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  // -----------------------------------------------------
  // Internals
  // -----------------------------------------------------

  private ExecutionContext requireActive(String executionId) {
    requireId(executionId);
    return registry
        .active(executionId)
        .orElseThrow(
            () -> {
              String reason =
                  registry.view(executionId).isPresent() ? "already completed" : "not started";
              return new EvidenceStateException("Execution " + executionId + " is " + reason);
            });
  }

  private static void requireId(String executionId) {
    if (executionId == null || executionId.isBlank()) {
      throw new IllegalArgumentException("executionId must not be blank");
    }
  }

  private <C extends Collector> List<EvidencePayload> fanOut(
      List<C> collectors, String what, Function<C, List<EvidencePayload>> call) {
    List<CompletableFuture<List<EvidencePayload>>> futures = new ArrayList<>();
    for (C collector : collectors) {
      futures.add(
          CompletableFuture.supplyAsync(() -> call.apply(collector), executor)
              .handle(
                  (result, error) -> {
                    if (error != null) {
                      log.warn(
                          "{} collector failed during {}: {}",
                          collector.type().key(),
                          what,
                          describe(error));
                      return List.<EvidencePayload>of();
                    }
                    return result == null ? List.<EvidencePayload>of() : result;
                  }));
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

    List<EvidencePayload> payloads = new ArrayList<>();
    futures.forEach(f -> payloads.addAll(f.join()));
    return payloads;
  }

  private <C extends Collector> void run(List<C> collectors, String what, Consumer<C> call) {
    fanOut(
        collectors,
        what,
        c -> {
          call.accept(c);
          return List.of();
        });
  }

  private List<EvidenceItem> persist(
      ExecutionContext context,
      String scenarioId,
      String stepId,
      StepStatus status,
      List<EvidencePayload> payloads) {
    List<EvidenceItem> items = new ArrayList<>(payloads.size());
    for (EvidencePayload payload : payloads) {
      String itemId = context.nextItemId(payload.type(), scenarioId, stepId);
      items.add(
          files.persist(context.getExecutionId(), itemId, scenarioId, stepId, status, payload));
    }
    return items;
  }

  /** Adds {@code items} and evicts oldest-first while the collection exceeds the budget. */
  private void fold(ExecutionContext context, List<EvidenceItem> items) {
    context.lock().lock();
    try {
      context.getCollection().addAll(items);
      long limit = properties.maxSizeBytes();
      List<EvidenceItem> evicted = context.getCollection().evictOldestUntil(limit, files::delete);
      if (!evicted.isEmpty()) {
        log.warn(
            "Evidence of {} exceeded {} bytes, evicted {} oldest items: {}",
            context.getExecutionId(),
            limit,
            evicted.size(),
            evicted.stream().map(EvidenceItem::id).toList());
      }
    } finally {
      context.lock().unlock();
    }
  }

  private static CollectionView applyFilter(CollectionView view, EvidenceFilter filter) {
    if (filter == EvidenceFilter.NONE) {
      return view;
    }
    List<EvidenceItem> matching = view.items().stream().filter(filter::matches).toList();
    return new CollectionView(
        view.executionId(),
        view.startTime(),
        view.endTime(),
        view.metadata(),
        matching,
        EvidenceSummary.of(matching, view.summary().duration()));
  }

  private EvidenceExport toExport(CollectionView view) {
    EvidenceSummary summary = view.summary();
    int scenarios = (int) view.items().stream().map(EvidenceItem::scenarioId).distinct().count();
    int failedStepEvidence =
        (int)
            view.items().stream()
                .filter(i -> StepStatus.FAILED.key().equals(i.metadata().get("stepStatus")))
                .count();

    Map<String, Object> environment = new LinkedHashMap<>();
    for (String key : List.of("environment", "browser", "host", "platform", "runtime")) {
      Object value = view.metadata().get(key);
      if (value != null) {
        environment.put(key, value);
      }
    }
    Map<String, Object> storage = new LinkedHashMap<>();
    storage.put("retentionDays", properties.getRetentionDays());
    storage.put("compressionEnabled", properties.isCompress());
    storage.put("maxSizeBytes", properties.maxSizeBytes());

    return EvidenceExport.builder()
        .executionId(view.executionId())
        .startTime(view.startTime())
        .endTime(view.endTime())
        .durationMs(summary.duration())
        .totalItems(summary.totalItems())
        .totalSize(summary.totalSize())
        .totalSizeHuman(EvidenceUtils.humanReadableBytes(summary.totalSize()))
        .byType(summary.byType())
        .scenarios(scenarios)
        .failedStepEvidence(failedStepEvidence)
        .environment(environment)
        .storage(storage)
        .build();
  }

  private static void releaseQuietly(Collector collector) {
    try {
      collector.clear();
    } catch (RuntimeException e) {
      log.warn("Failed to release {} collector: {}", collector.type().key(), e.getMessage());
    }
  }

  private static String describe(Throwable error) {
    Throwable cause =
        error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
