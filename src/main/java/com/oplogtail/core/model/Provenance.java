package com.oplogtail.core.model;

public enum Provenance {
  LOG,
  DIRECT_READ
}
