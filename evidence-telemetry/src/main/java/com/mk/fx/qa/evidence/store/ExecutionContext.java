package com.mk.fx.qa.evidence.store;

import static com.mk.fx.qa.evidence.utils.EvidenceUtils.md5Prefix;

import com.mk.fx.qa.evidence.collector.Collector;
import com.mk.fx.qa.evidence.collector.CollectorOptions;
import com.mk.fx.qa.evidence.model.CollectionState;
import com.mk.fx.qa.evidence.model.EvidenceCollection;
import com.mk.fx.qa.evidence.model.EvidenceStateException;
import com.mk.fx.qa.evidence.model.EvidenceType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.Getter;

/**
 * In-memory state of one execution: its collection, its collectors and its lifecycle state.
 *
 * <p>State transitions and item id allocation happen under {@link #lock()}. Collect calls hold
 * the read side of {@link #collecting()} from the state check until their items are folded in;
 * finalization takes the write side, so it starts only after in-flight collect calls are done.
 */
final class ExecutionContext {

  @Getter private final String executionId;
  @Getter private final EvidenceCollection collection;
  @Getter private final List<Collector> collectors;
  @Getter private final CollectorOptions options;
  private final ReentrantLock lock = new ReentrantLock();
  private final ReentrantReadWriteLock collecting = new ReentrantReadWriteLock();
  private final Map<String, Integer> idSequence = new HashMap<>();

  @Getter private volatile CollectionState state = CollectionState.UNINITIALIZED;

  ExecutionContext(
      String executionId,
      EvidenceCollection collection,
      List<Collector> collectors,
      CollectorOptions options) {
    this.executionId = executionId;
    this.collection = collection;
    this.collectors = List.copyOf(collectors);
    this.options = options;
  }

  ReentrantLock lock() {
    return lock;
  }

  ReentrantReadWriteLock collecting() {
    return collecting;
  }

  /** Moves to {@code target} when the current state is {@code expected}, otherwise throws. */
  void transition(CollectionState expected, CollectionState target) {
    lock.lock();
    try {
      if (state != expected) {
        throw new EvidenceStateException(
            "Execution " + executionId + " is " + state + ", expected " + expected);
      }
      state = target;
    } finally {
      lock.unlock();
    }
  }

  void requireCollecting() {
    CollectionState current = state;
    if (current != CollectionState.COLLECTING) {
      throw new EvidenceStateException(
          "Execution " + executionId + " is " + current + ", not COLLECTING");
    }
  }

  /**
   * Item id {@code <type>_<md5 prefix of "<type>_<scenarioId>[_<stepId>]">}. A repeat within the
   * same execution gets a {@code _<n>} suffix.
   */
  String nextItemId(EvidenceType type, String scenarioId, String stepId) {
    String seed = type.key() + "_" + scenarioId + (stepId == null ? "" : "_" + stepId);
    String base = type.key() + "_" + md5Prefix(seed, 8);
    lock.lock();
    try {
      int n = idSequence.merge(base, 1, Integer::sum);
      return n == 1 ? base : base + "_" + n;
    } finally {
      lock.unlock();
    }
  }
}
