package com.gentoro.geocontext.materialize;

/**
 * Summary of a {@link WriteSynchronizer#drain} call.
 *
 * @param writes writes pulled and confirmed
 * @param flushes flush cycles, the final partial batch included
 */
public record SynchronizationReport(int writes, int flushes) {}
