package com.github.motionfsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable state x event -> state lookup. Targets live in a dense 2-D array indexed by the
 * ordinals of {@link SystemState} and {@link SystemEvent}, so every target is by construction a
 * valid state. A null slot means the event is rejected in that state.
 * 
 * The table is fully hydrated when {@link Builder#build()} returns and never modified after.
 */
public final class TransitionTable {
  private static final int stateCount = SystemState.values().length;
  private static final int eventCount = SystemEvent.values().length;

  private final SystemState[][] targets;
  private final List<Transition> transitions;

  private TransitionTable(final SystemState[][] targets) {
    this.targets = targets;
    final List<Transition> edges = new ArrayList<>();
    for (final SystemState from : SystemState.values()) {
      for (final SystemEvent event : SystemEvent.values()) {
        final SystemState to = targets[from.ordinal()][event.ordinal()];
        if (to != null) {
          edges.add(new Transition(from, event, to));
        }
      }
    }
    this.transitions = Collections.unmodifiableList(edges);
  }

  /**
   * The motion pipeline lifecycle: idle, bring up the planner, plan, execute, with obstacle and
   * error detours. Note that OBSTACLE_CLEARED is deliberately left without an edge.
   */
  public static TransitionTable motionPipeline() {
    return newBuilder()
        .on(SystemState.IDLE, SystemEvent.START_MOVEIT, SystemState.MOVEIT_STARTING)
        .on(SystemState.IDLE, SystemEvent.RESET_REQUEST, SystemState.IDLE)
        .on(SystemState.IDLE, SystemEvent.ERROR_OCCURRED, SystemState.ERROR)

        .on(SystemState.MOVEIT_STARTING, SystemEvent.MOVEIT_READY, SystemState.PLANNING)
        .on(SystemState.MOVEIT_STARTING, SystemEvent.MOVEIT_FAILED, SystemState.ERROR)
        .on(SystemState.MOVEIT_STARTING, SystemEvent.ERROR_OCCURRED, SystemState.ERROR)
        .on(SystemState.MOVEIT_STARTING, SystemEvent.STOP_REQUEST, SystemState.IDLE)

        .on(SystemState.PLANNING, SystemEvent.PLANNING_SUCCESS, SystemState.EXECUTING)
        .on(SystemState.PLANNING, SystemEvent.PLANNING_FAILED, SystemState.ERROR)
        .on(SystemState.PLANNING, SystemEvent.ERROR_OCCURRED, SystemState.ERROR)
        .on(SystemState.PLANNING, SystemEvent.OBSTACLE_APPEARED, SystemState.OBSTACLE_DETECTED)
        .on(SystemState.PLANNING, SystemEvent.STOP_REQUEST, SystemState.IDLE)

        .on(SystemState.EXECUTING, SystemEvent.EXECUTION_COMPLETE, SystemState.IDLE)
        .on(SystemState.EXECUTING, SystemEvent.OBSTACLE_APPEARED, SystemState.OBSTACLE_DETECTED)
        .on(SystemState.EXECUTING, SystemEvent.STOP_REQUEST, SystemState.IDLE)
        .on(SystemState.EXECUTING, SystemEvent.ERROR_OCCURRED, SystemState.ERROR)

        .on(SystemState.OBSTACLE_DETECTED, SystemEvent.START_PLANNING, SystemState.PLANNING)
        .on(SystemState.OBSTACLE_DETECTED, SystemEvent.STOP_REQUEST, SystemState.IDLE)
        .on(SystemState.OBSTACLE_DETECTED, SystemEvent.ERROR_OCCURRED, SystemState.ERROR)

        .on(SystemState.ERROR, SystemEvent.RESET_REQUEST, SystemState.IDLE)
        .on(SystemState.ERROR, SystemEvent.STOP_REQUEST, SystemState.IDLE)
        .build();
  }

  /**
   * Returns the target state for firing event in from, or null if that event is not supported
   * there.
   */
  public SystemState lookup(final SystemState from, final SystemEvent event) {
    if (from == null || event == null) {
      return null;
    }
    return targets[from.ordinal()][event.ordinal()];
  }

  /**
   * True iff the table holds exactly the edge from -(event)-> to.
   */
  public boolean isValid(final SystemState from, final SystemState to, final SystemEvent event) {
    final SystemState target = lookup(from, event);
    return target != null && target == to;
  }

  public boolean hasState(final SystemState state) {
    return state != null;
  }

  /**
   * Events accepted while in the given state, in declaration order.
   */
  public Set<SystemEvent> eventsFrom(final SystemState state) {
    final Set<SystemEvent> events = EnumSet.noneOf(SystemEvent.class);
    if (state != null) {
      for (final SystemEvent event : SystemEvent.values()) {
        if (targets[state.ordinal()][event.ordinal()] != null) {
          events.add(event);
        }
      }
    }
    return Collections.unmodifiableSet(events);
  }

  public List<Transition> transitions() {
    return transitions;
  }

  public int size() {
    return transitions.size();
  }

  @Override
  public String toString() {
    return "TransitionTable [size=" + transitions.size() + ", transitions=" + transitions + "]";
  }

  static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Collects edges and freezes them into a {@link TransitionTable}. Registering the same edge twice
   * is harmless; pointing the same state/event pair at two different targets is a programming
   * error.
   */
  static final class Builder {
    private final SystemState[][] targets = new SystemState[stateCount][eventCount];

    Builder on(final SystemState from, final SystemEvent event, final SystemState to) {
      if (from == null || event == null || to == null) {
        throw new IllegalArgumentException(
            String.format("Null edge members are illegal: %s -(%s)-> %s", from, event, to));
      }
      final SystemState existing = targets[from.ordinal()][event.ordinal()];
      if (existing != null && existing != to) {
        throw new IllegalArgumentException(String.format(
            "Conflicting edges for %s on %s: %s vs %s", from, event, existing, to));
      }
      targets[from.ordinal()][event.ordinal()] = to;
      return this;
    }

    TransitionTable build() {
      final SystemState[][] frozen = new SystemState[stateCount][];
      for (int i = 0; i < stateCount; i++) {
        frozen[i] = targets[i].clone();
      }
      return new TransitionTable(frozen);
    }

    private Builder() {}
  }
}
