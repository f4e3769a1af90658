package com.oplogtail.tail;

public enum OrderingGuarantee {
  /** Log-origin operations are dispatched in log order regardless of fetch latency. */
  ORDERED,
  /** Operations are dispatched as soon as their fetch completes. */
  UNORDERED
}
