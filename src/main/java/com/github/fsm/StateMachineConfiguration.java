package com.github.fsm;

/**
 * This class encapsulates the configuration parameters for a StateMachine instance. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. routeHistoryLimit bounds the number of visited states remembered in
 * {@link TransitionStatistics#getRoute()}. If this is not set, the last 100 states are kept. 0
 * turns route tracking off.<br>
 * 2. statisticsEnabled switches off all transition bookkeeping when false.<br>
 *
 * @author gaurav
 */
public final class StateMachineConfiguration {
  static final int DEFAULT_ROUTE_HISTORY_LIMIT = 100;

  private final int routeHistoryLimit;
  private final boolean statisticsEnabled;

  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(DEFAULT_ROUTE_HISTORY_LIMIT, true);
  }

  public int getRouteHistoryLimit() {
    return routeHistoryLimit;
  }

  public boolean isStatisticsEnabled() {
    return statisticsEnabled;
  }

  public final static class StateMachineConfigurationBuilder {
    private int routeHistoryLimit = DEFAULT_ROUTE_HISTORY_LIMIT;
    private boolean statisticsEnabled = true;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder routeHistoryLimit(final int routeHistoryLimit) {
      this.routeHistoryLimit = routeHistoryLimit;
      return this;
    }

    public StateMachineConfigurationBuilder statisticsEnabled(final boolean statisticsEnabled) {
      this.statisticsEnabled = statisticsEnabled;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(routeHistoryLimit, statisticsEnabled);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (routeHistoryLimit < 0) {
      messages.append("routeHistoryLimit cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [routeHistoryLimit=" + routeHistoryLimit
        + ", statisticsEnabled=" + statisticsEnabled + "]";
  }

  private StateMachineConfiguration(final int routeHistoryLimit,
      final boolean statisticsEnabled) {
    this.routeHistoryLimit = routeHistoryLimit;
    this.statisticsEnabled = statisticsEnabled;
  }

}
