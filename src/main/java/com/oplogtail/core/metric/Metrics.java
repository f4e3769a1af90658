package com.oplogtail.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class Metrics {

  private final MeterRegistry registry;
  private final String tailerName;
  private final String operatorName;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public Metrics(MeterRegistry registry, String tailerName, String operatorName) {
    this.registry = registry != null ? registry : new SimpleMeterRegistry();
    this.tailerName = tailerName;
    this.operatorName = operatorName;
  }

  public void inc(String name) {
    counters.computeIfAbsent(name, this::register).increment();
  }

  public double count(String name) {
    Counter counter = counters.get(name);
    return counter != null ? counter.count() : 0d;
  }

  private Counter register(String name) {
    return Counter.builder("oplogtail." + name)
        .tag("tailer", tailerName)
        .tag("operator", operatorName)
        .register(registry);
  }
}
