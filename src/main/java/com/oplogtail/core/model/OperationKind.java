package com.oplogtail.core.model;

public enum OperationKind {
  INSERT,
  UPDATE,
  DELETE,
  DROP
}
