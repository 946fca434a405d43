package com.atlas.journal.dto;

/**
 * Outcome of draining the pending fix buffer into the sink.
 *
 * @param delivered fixes handed to the sink during this flush
 * @param remaining fixes still buffered afterwards
 * @param interrupted whether the flush was cut short by an interrupt
 */
public record FlushReport(int delivered, int remaining, boolean interrupted) {

  public boolean isComplete() {
    return remaining == 0 && !interrupted;
  }
}
