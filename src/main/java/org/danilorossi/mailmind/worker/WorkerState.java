package org.danilorossi.mailmind.worker;

public enum WorkerState {
  DISCONNECTED,
  CONNECTING,
  DRAINING,
  IDLING,
  STOPPED
}
