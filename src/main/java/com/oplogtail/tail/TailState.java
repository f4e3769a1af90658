package com.oplogtail.tail;

public enum TailState {
  CREATED,
  RUNNING,
  DRAINING,
  STOPPED
}
