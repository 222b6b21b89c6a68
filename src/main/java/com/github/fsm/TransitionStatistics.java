package com.github.fsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Simple statistics holder for a state machine instance. Like the instance itself, this is not
 * thread-safe.
 */
public final class TransitionStatistics {
  private final long startMillis = System.currentTimeMillis();
  private final String machineId;
  private final int routeHistoryLimit;
  int transitionSuccesses;
  int transitionFailures;
  long lastTransitionMillis;
  // oldest first, bounded at routeHistoryLimit
  private final Deque<StateTimePair> boundedStateRoute = new ArrayDeque<>();

  TransitionStatistics(final String machineId, final int routeHistoryLimit) {
    this.machineId = machineId;
    this.routeHistoryLimit = routeHistoryLimit;
  }

  void enter(final String state) {
    final long now = System.currentTimeMillis();
    final StateTimePair previous = boundedStateRoute.peekLast();
    if (previous != null) {
      previous.elapsedMillis = now - previous.startMillis;
    }
    if (routeHistoryLimit == 0) {
      return;
    }
    if (boundedStateRoute.size() == routeHistoryLimit) {
      boundedStateRoute.pollFirst();
    }
    final StateTimePair pair = new StateTimePair();
    pair.state = state;
    pair.startMillis = now;
    boundedStateRoute.addLast(pair);
  }

  public String getMachineId() {
    return machineId;
  }

  public int getTransitionSuccesses() {
    return transitionSuccesses;
  }

  public int getTransitionFailures() {
    return transitionFailures;
  }

  public long getLastTransitionMillis() {
    return lastTransitionMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  /**
   * The most recently visited states, oldest first.
   */
  public List<StateTimePair> getRoute() {
    return Collections.unmodifiableList(new ArrayList<>(boundedStateRoute));
  }

  @Override
  public String toString() {
    return "TransitionStatistics [machineId=" + machineId + ", transitionSuccesses="
        + transitionSuccesses + ", transitionFailures=" + transitionFailures
        + ", lastTransitionMillis=" + lastTransitionMillis + ", aliveTimeMillis="
        + getAliveTimeMillis() + "]";
  }

  public final static class StateTimePair {
    String state;
    long startMillis;
    // 0 while the state is still the current one
    long elapsedMillis;

    public String getState() {
      return state;
    }

    public long getStartMillis() {
      return startMillis;
    }

    public long getElapsedMillis() {
      return elapsedMillis;
    }

    @Override
    public String toString() {
      return "StateTimePair [state=" + state + ", elapsedMillis=" + elapsedMillis + "]";
    }
  }

}
