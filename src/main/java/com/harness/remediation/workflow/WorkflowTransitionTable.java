package com.harness.remediation.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * State -> (signal -> next state). Lookups for pairs that are not in the
 * table fail, so an unexpected signal can never silently skip a state.
 */
public final class WorkflowTransitionTable {

  private final Map<WorkflowState, Map<WorkflowSignal, WorkflowState>> transitions;

  private WorkflowTransitionTable(Map<WorkflowState, Map<WorkflowSignal, WorkflowState>> transitions) {
    this.transitions = transitions;
  }

  public static WorkflowTransitionTable remediationWorkflow() {
    return new Builder()
        .on(WorkflowState.NOTIFY_ENTRY, WorkflowSignal.PROCEED, WorkflowState.CLASSIFY)
        .on(WorkflowState.CLASSIFY, WorkflowSignal.PARAMETER_GROUP, WorkflowState.PARAMETER_GROUP)
        .on(WorkflowState.CLASSIFY, WorkflowSignal.BACKUP_RETENTION, WorkflowState.BACKUP_RETENTION)
        .on(WorkflowState.CLASSIFY, WorkflowSignal.DELETION_PROTECTION,
            WorkflowState.DELETION_PROTECTION)
        .on(WorkflowState.CLASSIFY, WorkflowSignal.UNMATCHED, WorkflowState.UNKNOWN_DIRECTIVE)
        .remediation(WorkflowState.PARAMETER_GROUP)
        .remediation(WorkflowState.BACKUP_RETENTION)
        .remediation(WorkflowState.DELETION_PROTECTION)
        .on(WorkflowState.EXECUTED, WorkflowSignal.PROCEED, WorkflowState.NOTIFY_EXIT)
        .on(WorkflowState.NOT_FOUND_FALLBACK, WorkflowSignal.PROCEED, WorkflowState.NOTIFY_EXIT)
        .on(WorkflowState.UNKNOWN_DIRECTIVE, WorkflowSignal.PROCEED, WorkflowState.NOTIFY_EXIT)
        .build();
  }

  public WorkflowState next(WorkflowState current, WorkflowSignal signal) {
    WorkflowState next = transitions.getOrDefault(current, Map.of()).get(signal);
    if (next == null) {
      throw new IllegalStateException(
          "No transition from " + current + " on " + signal);
    }
    return next;
  }

  public Map<WorkflowSignal, WorkflowState> transitionsFrom(WorkflowState state) {
    return Collections.unmodifiableMap(transitions.getOrDefault(state, Map.of()));
  }

  static final class Builder {

    private final Map<WorkflowState, Map<WorkflowSignal, WorkflowState>> transitions =
        new EnumMap<>(WorkflowState.class);

    Builder on(WorkflowState from, WorkflowSignal signal, WorkflowState to) {
      if (from.isTerminal()) {
        throw new IllegalArgumentException("Terminal state " + from + " has no transitions");
      }
      WorkflowState previous = transitions
          .computeIfAbsent(from, k -> new EnumMap<>(WorkflowSignal.class))
          .putIfAbsent(signal, to);
      if (previous != null) {
        throw new IllegalArgumentException(
            "Duplicate transition from " + from + " on " + signal);
      }
      return this;
    }

    Builder remediation(WorkflowState state) {
      return on(state, WorkflowSignal.REMEDIATED, WorkflowState.EXECUTED)
          .on(state, WorkflowSignal.RESOURCE_NOT_FOUND, WorkflowState.NOT_FOUND_FALLBACK);
    }

    WorkflowTransitionTable build() {
      return new WorkflowTransitionTable(transitions);
    }
  }
}
