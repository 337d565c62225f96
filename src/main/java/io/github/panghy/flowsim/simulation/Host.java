package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.Task;

import java.time.Duration;

/**
 * Orchestrator-side state of a registered host.
 */
final class Host {

  private final HostId id;
  private final HostProcess process;
  private final boolean client;
  private HostContext context;
  private boolean up = true;
  private Duration clockSkew = Duration.ZERO;
  private Task mainTask;
  private int incarnation;

  Host(HostId id, HostProcess process, boolean client) {
    this.id = id;
    this.process = process;
    this.client = client;
  }

  HostId getId() {
    return id;
  }

  HostProcess getProcess() {
    return process;
  }

  boolean isClient() {
    return client;
  }

  HostContext getContext() {
    return context;
  }

  void setContext(HostContext context) {
    this.context = context;
  }

  boolean isUp() {
    return up;
  }

  void setUp(boolean up) {
    this.up = up;
  }

  Duration getClockSkew() {
    return clockSkew;
  }

  void setClockSkew(Duration clockSkew) {
    this.clockSkew = clockSkew;
  }

  Task getMainTask() {
    return mainTask;
  }

  /**
   * Records the top-level task of a new incarnation of this host.
   */
  void started(Task mainTask) {
    this.mainTask = mainTask;
    incarnation++;
  }

  int getIncarnation() {
    return incarnation;
  }
}
