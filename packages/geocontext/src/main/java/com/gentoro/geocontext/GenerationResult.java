package com.gentoro.geocontext;

/**
 * Outcome of one generation run.
 *
 * @param items qualifying items placed in the tree
 * @param writes writes issued and confirmed
 * @param flushes flush cycles of the synchronizer
 * @param createdNodes nodes that did not exist yet
 * @param reusedNodes existing nodes matched by name
 * @param skipped true when the run returned early because no item qualified
 */
public record GenerationResult(
    int items, int writes, int flushes, int createdNodes, int reusedNodes, boolean skipped) {

  static GenerationResult skippedRun() {
    return new GenerationResult(0, 0, 0, 0, 0, true);
  }
}
