package com.gentoro.geocontext;

import com.gentoro.geocontext.dataset.ExternalItem;
import com.gentoro.geocontext.dataset.FilterResult;
import com.gentoro.geocontext.dataset.HierarchyBuilder;
import com.gentoro.geocontext.dataset.HierarchyNode;
import com.gentoro.geocontext.dataset.ItemFilter;
import com.gentoro.geocontext.dataset.KeyPathHierarchyBuilder;
import com.gentoro.geocontext.exception.ErrorDetails;
import com.gentoro.geocontext.exception.ExceptionUtil;
import com.gentoro.geocontext.exception.FilterException;
import com.gentoro.geocontext.exception.GeoContextException;
import com.gentoro.geocontext.exception.StateException;
import com.gentoro.geocontext.graph.GraphNodeRef;
import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.layout.Layout;
import com.gentoro.geocontext.materialize.FlushListener;
import com.gentoro.geocontext.materialize.HierarchyMaterializer;
import com.gentoro.geocontext.materialize.SynchronizationReport;
import com.gentoro.geocontext.materialize.WriteSynchronizer;
import com.gentoro.geocontext.progress.Progression;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Fills a context with the tree described by a {@link Layout} and a list of items.
 *
 * <p>Two entry points exist:
 *
 * <ul>
 *   <li>{@link #generate} takes items that already qualify and reports progress. An empty list
 *       still runs and ends at 100%.
 *   <li>{@link #generateFromReferences} takes raw item ids, filters them while the reference
 *       context is initialized, and returns without touching the tree when nothing qualifies.
 * </ul>
 *
 * <p>Failures are logged and rethrown unchanged. Nothing is rolled back: already flushed batches
 * stay in the graph and are reused by the next run.
 */
public class GeoContextGenerator {
  private static final org.slf4j.Logger log =
      com.gentoro.geocontext.logging.LoggingService.getLogger(GeoContextGenerator.class);

  static final double PROGRESS_ACCEPT_ITEMS = 10;
  static final double PROGRESS_BUILD_TREE = 10;
  static final double PROGRESS_CREATE_GRAPH = 80;

  private final GraphStore store;
  private final HierarchyMaterializer materializer;
  private final WriteSynchronizer synchronizer;
  private final Function<Layout, HierarchyBuilder> builders;
  private final ItemFilter filter;
  private final String referenceContextName;
  private final Executor executor;

  public GeoContextGenerator(
      GraphStore store,
      WriteSynchronizer synchronizer,
      ItemFilter filter,
      String referenceContextName,
      Executor executor) {
    this(
        store,
        synchronizer,
        KeyPathHierarchyBuilder::new,
        filter,
        referenceContextName,
        executor);
  }

  public GeoContextGenerator(
      GraphStore store,
      WriteSynchronizer synchronizer,
      Function<Layout, HierarchyBuilder> builders,
      ItemFilter filter,
      String referenceContextName,
      Executor executor) {
    this.store = Objects.requireNonNull(store, "store");
    this.materializer = new HierarchyMaterializer(store);
    this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
    this.builders = Objects.requireNonNull(builders, "builders");
    this.filter = filter;
    this.referenceContextName = referenceContextName;
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public GenerationResult generate(GraphNodeRef context, Layout layout, List<ExternalItem> items) {
    return generate(context, layout, items, new Progression());
  }

  /**
   * Materialize {@code items} below {@code context}.
   *
   * <p>Progress: 10% once the items are accepted, 10% more once they are grouped, then each full
   * batch adds {@code 80 * batchSize / items.size()}, and the run ends at 100%.
   */
  public GenerationResult generate(
      GraphNodeRef context, Layout layout, List<ExternalItem> items, Progression progression) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(layout, "layout");
    Objects.requireNonNull(items, "items");
    Progression progress = progression != null ? progression : new Progression();

    progress.begin("Generating context " + context.name());
    progress.set(PROGRESS_ACCEPT_ITEMS);
    long started = System.nanoTime();
    try {
      HierarchyNode tree = builders.apply(layout).build(items);
      progress.advance(PROGRESS_BUILD_TREE);

      double increment =
          items.isEmpty()
              ? 0
              : PROGRESS_CREATE_GRAPH * synchronizer.settings().batchSize() / items.size();
      GenerationResult result =
          materialize(
              context,
              layout,
              tree,
              items.size(),
              (size, partial) -> {
                if (!partial) {
                  progress.advance(increment);
                }
              });

      progress.complete(
          Map.of(
              "items", result.items(),
              "writes", result.writes(),
              "createdNodes", result.createdNodes()));
      logCompletion(context, result, started);
      return result;
    } catch (RuntimeException e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      progress.fail(details.message(), details.toAttributes());
      log.error("Generation of context '{}' failed", context.name(), e);
      throw e;
    }
  }

  /**
   * Filter {@code referenceIds} down to items carrying every layout key and materialize them
   * below {@code context}. The filter and the initialization of the reference context run in
   * parallel.
   *
   * @throws FilterException when the filter fails; the graph is left untouched
   */
  public GenerationResult generateFromReferences(
      GraphNodeRef context, Layout layout, List<Long> referenceIds) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(layout, "layout");
    Objects.requireNonNull(referenceIds, "referenceIds");
    if (filter == null) {
      throw new StateException("No item filter configured; use generate() with filtered items");
    }
    long started = System.nanoTime();

    CompletableFuture<FilterResult> filtered =
        CompletableFuture.supplyAsync(
            () -> filter.filterQualifying(referenceIds, layout.keys()), executor);
    CompletableFuture<GraphNodeRef> referenceContext =
        referenceContextName == null
            ? CompletableFuture.completedFuture(null)
            : CompletableFuture.supplyAsync(
                () -> store.ensureContext(referenceContextName), executor);

    FilterResult qualifying;
    try {
      qualifying = await(filtered, "filter", FilterException::new);
      await(referenceContext, "reference context", StateException::new);
    } catch (RuntimeException e) {
      log.error("Preparing generation of context '{}' failed", context.name(), e);
      throw e;
    }

    if (qualifying.valid().isEmpty()) {
      log.info(
          "No qualifying item among {} reference(s); context '{}' left untouched",
          referenceIds.size(),
          context.name());
      return GenerationResult.skippedRun();
    }
    if (!qualifying.invalid().isEmpty()) {
      log.info(
          "Skipping {} reference(s) missing one of {}",
          qualifying.invalid().size(),
          layout.keys());
    }

    try {
      HierarchyNode tree = builders.apply(layout).build(qualifying.valid());
      GenerationResult result =
          materialize(context, layout, tree, qualifying.valid().size(), null);
      logCompletion(context, result, started);
      return result;
    } catch (RuntimeException e) {
      log.error("Generation of context '{}' failed", context.name(), e);
      throw e;
    }
  }

  private GenerationResult materialize(
      GraphNodeRef context,
      Layout layout,
      HierarchyNode tree,
      int itemCount,
      FlushListener listener) {
    HierarchyMaterializer.Cursor cursor =
        materializer.materialize(context, context, tree, layout, 0);
    SynchronizationReport report = synchronizer.drain(cursor, listener);
    return new GenerationResult(
        itemCount,
        report.writes(),
        report.flushes(),
        cursor.createdNodes(),
        cursor.reusedNodes(),
        false);
  }

  private static <T> T await(
      CompletableFuture<T> future,
      String what,
      BiFunction<String, Throwable, GeoContextException> wrapper) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      throw ExceptionUtil.rethrowIfUnchecked(
          cause, t -> wrapper.apply("The " + what + " step failed", t));
    }
  }

  private static void logCompletion(GraphNodeRef context, GenerationResult result, long started) {
    log.info(
        "Context '{}' generated: {} item(s), {} write(s) in {} flush(es), {} node(s) created, {}"
            + " reused ({} ms)",
        context.name(),
        result.items(),
        result.writes(),
        result.flushes(),
        result.createdNodes(),
        result.reusedNodes(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
  }
}
