package com.mk.fx.qa.evidence.store;

import com.mk.fx.qa.evidence.model.CollectionView;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of executions known to the store.
 *
 * <p>Active executions keep their full {@link ExecutionContext}. Once completed only the final
 * {@link CollectionView} is kept; collectors and buffers are released.
 */
final class ExecutionRegistry {

  private final Map<String, ExecutionContext> active = new ConcurrentHashMap<>();
  private final Map<String, CollectionView> completed = new ConcurrentHashMap<>();

  /**
   * Registers a new active execution.
   *
   * @return false when the id is already active or completed
   */
  boolean register(ExecutionContext context) {
    if (completed.containsKey(context.getExecutionId())) {
      return false;
    }
    return active.putIfAbsent(context.getExecutionId(), context) == null;
  }

  Optional<ExecutionContext> active(String executionId) {
    return Optional.ofNullable(active.get(executionId));
  }

  /** Marks the execution as completed with its final view and drops the active context. */
  void complete(String executionId, CollectionView finalView) {
    completed.put(executionId, finalView);
    active.remove(executionId);
  }

  /** Live view for active executions or the final one for completed executions. */
  Optional<CollectionView> view(String executionId) {
    ExecutionContext context = active.get(executionId);
    if (context != null) {
      return Optional.of(context.getCollection().view());
    }
    return Optional.ofNullable(completed.get(executionId));
  }

  /** Forgets the execution entirely. */
  Optional<ExecutionContext> remove(String executionId) {
    completed.remove(executionId);
    return Optional.ofNullable(active.remove(executionId));
  }

  int activeCount() {
    return active.size();
  }
}
