package com.oplogtail.tail;

import com.oplogtail.core.model.Operation;

/** Told exactly once per operation when it has been dispatched, filtered out or dropped. */
@FunctionalInterface
interface SettlementListener {

  void settled(Operation operation);
}
