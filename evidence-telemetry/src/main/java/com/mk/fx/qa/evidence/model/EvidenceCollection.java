package com.mk.fx.qa.evidence.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Per-execution aggregate root.
 *
 * <p>Every mutation of the item list recomputes {@link EvidenceSummary} while holding the
 * collection lock, so readers never observe a summary that disagrees with the items.
 */
public final class EvidenceCollection {

  private final String executionId;
  private final Instant startTime;
  private final Map<String, Object> metadata;
  private final ReentrantLock lock = new ReentrantLock();
  private final List<EvidenceItem> items = new ArrayList<>();

  private Instant endTime;
  private EvidenceSummary summary;

  public EvidenceCollection(String executionId, Instant startTime, Map<String, Object> metadata) {
    this.executionId = Objects.requireNonNull(executionId, "executionId");
    this.startTime = Objects.requireNonNull(startTime, "startTime");
    this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    this.summary = EvidenceSummary.of(List.of(), 0);
  }

  public String executionId() {
    return executionId;
  }

  public Instant startTime() {
    return startTime;
  }

  public Map<String, Object> metadata() {
    return metadata;
  }

  public void addAll(List<EvidenceItem> newItems) {
    if (newItems.isEmpty()) {
      return;
    }
    lock.lock();
    try {
      items.addAll(newItems);
      refreshSummary();
    } finally {
      lock.unlock();
    }
  }

  public boolean remove(String itemId) {
    lock.lock();
    try {
      boolean removed = items.removeIf(i -> i.id().equals(itemId));
      if (removed) {
        refreshSummary();
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes oldest items until the total size fits {@code maxBytes} or nothing is left.
   *
   * <p>Ties on timestamp are broken by insertion order. {@code onEvict} runs under the lock for
   * each removed item, before the summary is recomputed.
   *
   * @return the evicted items in eviction order
   */
  public List<EvidenceItem> evictOldestUntil(long maxBytes, Consumer<EvidenceItem> onEvict) {
    lock.lock();
    try {
      List<EvidenceItem> evicted = new ArrayList<>();
      while (summary.totalSize() > maxBytes && !items.isEmpty()) {
        EvidenceItem oldest =
            items.stream().min(Comparator.comparing(EvidenceItem::timestamp)).orElseThrow();
        items.remove(oldest);
        onEvict.accept(oldest);
        evicted.add(oldest);
        refreshSummary();
      }
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  public void complete(Instant end) {
    lock.lock();
    try {
      this.endTime = end;
      refreshSummary();
    } finally {
      lock.unlock();
    }
  }

  public Optional<Instant> endTime() {
    lock.lock();
    try {
      return Optional.ofNullable(endTime);
    } finally {
      lock.unlock();
    }
  }

  public Optional<EvidenceItem> find(String itemId) {
    lock.lock();
    try {
      return items.stream().filter(i -> i.id().equals(itemId)).findFirst();
    } finally {
      lock.unlock();
    }
  }

  public List<EvidenceItem> items() {
    lock.lock();
    try {
      return List.copyOf(items);
    } finally {
      lock.unlock();
    }
  }

  public EvidenceSummary summary() {
    lock.lock();
    try {
      return summary;
    } finally {
      lock.unlock();
    }
  }

  /** Consistent copy of items, summary and timing taken under one lock acquisition. */
  public CollectionView view() {
    lock.lock();
    try {
      return new CollectionView(executionId, startTime, endTime, metadata, List.copyOf(items), summary);
    } finally {
      lock.unlock();
    }
  }

  private void refreshSummary() {
    long duration = endTime == null ? 0 : Duration.between(startTime, endTime).toMillis();
    summary = EvidenceSummary.of(items, duration);
  }
}
