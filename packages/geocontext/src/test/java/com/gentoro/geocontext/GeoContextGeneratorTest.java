package com.gentoro.geocontext;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.geocontext.dataset.ExternalItem;
import com.gentoro.geocontext.dataset.FilterResult;
import com.gentoro.geocontext.dataset.ItemFilter;
import com.gentoro.geocontext.dataset.JsonItemCatalog;
import com.gentoro.geocontext.dataset.RequiredAttributeItemFilter;
import com.gentoro.geocontext.exception.FilterException;
import com.gentoro.geocontext.exception.NotFoundException;
import com.gentoro.geocontext.exception.StateException;
import com.gentoro.geocontext.graph.GraphNodeRef;
import com.gentoro.geocontext.graph.GraphStore;
import com.gentoro.geocontext.graph.memory.InMemoryGraphStore;
import com.gentoro.geocontext.layout.Layout;
import com.gentoro.geocontext.layout.LayoutLevel;
import com.gentoro.geocontext.materialize.SynchronizerSettings;
import com.gentoro.geocontext.materialize.WriteSynchronizer;
import com.gentoro.geocontext.progress.ProgressSink;
import com.gentoro.geocontext.progress.Progression;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GeoContextGeneratorTest {

  private static final Layout LAYOUT =
      new Layout(
          List.of(
              new LayoutLevel("building", "building", "hasBuilding"),
              new LayoutLevel("floor", "floor", "hasFloor")));

  @Mock private GraphStore mockStore;

  private InMemoryGraphStore store;
  private ExecutorService executor;
  private GraphNodeRef context;

  @BeforeEach
  void setUp() {
    store = new InMemoryGraphStore("generator-test");
    store.initialize();
    executor = Executors.newFixedThreadPool(2);
    context = store.ensureContext("BuildingContext");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    store.shutdown();
  }

  private GeoContextGenerator generator(GraphStore graphStore, int batchSize, ItemFilter filter) {
    return new GeoContextGenerator(
        graphStore,
        new WriteSynchronizer(
            new SynchronizerSettings(batchSize, Duration.ofMillis(1), Duration.ofSeconds(5))),
        filter,
        "BIMObjectContext",
        executor);
  }

  private static ExternalItem item(long id, String name, String building, String floor) {
    return new ExternalItem(id, name, Map.of("building", building, "floor", floor));
  }

  @Test
  void emptyGraphGetsBuildingFloorAndItem() {
    GenerationResult result =
        generator(store, 300, null)
            .generate(context, LAYOUT, List.of(item(1, "Chair", "B1", "F1")));

    assertEquals(3, result.writes());
    assertEquals(1, result.flushes());
    assertEquals(2, result.createdNodes());
    assertFalse(result.skipped());
    GraphNodeRef b1 = store.findChild(context, "hasBuilding", "B1").orElseThrow();
    GraphNodeRef f1 = store.findChild(b1, "hasFloor", "F1").orElseThrow();
    assertEquals(List.of(1L), store.referencesOf(f1));
  }

  @Test
  void existingBuildingOnlyAddsFloorAndItem() {
    GraphNodeRef b1 = store.createNode("B1", "building");
    store.attach(context, b1, "hasBuilding", context).issued().join();

    GenerationResult result =
        generator(store, 300, null)
            .generate(context, LAYOUT, List.of(item(1, "Chair", "B1", "F1")));

    assertEquals(2, result.writes());
    assertEquals(1, result.reusedNodes());
    assertEquals(1, store.resolveChildren(context, "hasBuilding").size());
  }

  @Test
  void repeatedRunAddsNoNodesOrRelations() {
    List<ExternalItem> items =
        List.of(
            item(1, "Chair", "B1", "F1"),
            item(2, "Desk", "B1", "F2"),
            item(3, "Door", "B2", "F1"));
    GeoContextGenerator generator = generator(store, 2, null);
    generator.generate(context, LAYOUT, items);
    long nodes = store.attachedNodeCount();
    int relations = store.relationCount();
    int references = store.referenceCount();

    GenerationResult second = generator.generate(context, LAYOUT, items);

    assertEquals(0, second.createdNodes());
    assertEquals(nodes, store.attachedNodeCount());
    assertEquals(relations, store.relationCount());
    assertEquals(references, store.referenceCount());
  }

  @Test
  void progressAdvancesPerFullBatch() {
    GeoContextGenerator generator = generator(store, 2, null);
    generator.generate(context, LAYOUT, List.of(item(0, "Seed", "B1", "F1")));
    List<ExternalItem> items =
        IntStream.rangeClosed(1, 6)
            .mapToObj(i -> item(i, "item-" + i, "B1", "F1"))
            .toList();
    RecordingSink sink = new RecordingSink();

    GenerationResult result =
        generator.generate(context, LAYOUT, items, new Progression(sink));

    assertEquals(6, result.writes());
    assertEquals(3, result.flushes());
    assertEquals(List.of(10L, 20L, 47L, 73L, 100L), sink.steps);
    assertTrue(sink.began);
    assertTrue(sink.ended);
  }

  @Test
  void emptyItemListStillCompletes() {
    RecordingSink sink = new RecordingSink();

    GenerationResult result =
        generator(store, 300, null)
            .generate(context, LAYOUT, List.of(), new Progression(sink));

    assertEquals(0, result.writes());
    assertEquals(0, result.flushes());
    assertFalse(result.skipped());
    assertEquals(List.of(10L, 20L, 100L), sink.steps);
    assertEquals(0, store.relationCount());
  }

  @Test
  void failingRunReportsErrorAndRethrows() {
    RecordingSink sink = new RecordingSink();
    GraphNodeRef missing = new GraphNodeRef("ctx-404", "Nowhere", "geographicContext");

    assertThrows(
        NotFoundException.class,
        () ->
            generator(store, 300, null)
                .generate(
                    missing, LAYOUT, List.of(item(1, "Chair", "B1", "F1")), new Progression(sink)));
    assertTrue(sink.failed);
    assertFalse(sink.ended);
    assertTrue(sink.errorSummary.contains("ctx-404"));
    assertEquals("NotFoundException", sink.errorAttrs.get("error"));
    assertEquals("NOT_FOUND", sink.errorAttrs.get("code"));
    assertEquals("ctx-404", sink.errorAttrs.get("node"));
    assertEquals(20L, sink.errorAttrs.get("percent"));
  }

  @Test
  void referencesWithoutQualifyingItemLeaveTheGraphUntouched() {
    when(mockStore.ensureContext("BIMObjectContext"))
        .thenReturn(new GraphNodeRef("ctx-bim", "BIMObjectContext", "geographicContext"));
    ItemFilter filter = (ids, keys) -> new FilterResult(List.of(), ids);

    GenerationResult result =
        generator(mockStore, 300, filter).generateFromReferences(context, LAYOUT, List.of(3L, 7L));

    assertTrue(result.skipped());
    verify(mockStore).ensureContext("BIMObjectContext");
    verify(mockStore, never()).resolveChildren(any(), anyString());
    verify(mockStore, never()).createNode(anyString(), anyString());
    verify(mockStore, never()).attach(any(), any(), anyString(), any());
    verify(mockStore, never())
        .attachExternalReference(any(), any(), anyLong(), anyString(), anyString());
  }

  @Test
  void referencesAreFilteredBeforeMaterialization() throws Exception {
    JsonItemCatalog catalog;
    try (InputStream in = getClass().getClassLoader().getResourceAsStream("catalog.json")) {
      catalog = JsonItemCatalog.load(in);
    }

    GenerationResult result =
        generator(store, 2, new RequiredAttributeItemFilter(catalog))
            .generateFromReferences(context, LAYOUT, List.of(1L, 2L, 3L, 4L, 99L));

    assertEquals(3, result.items());
    GraphNodeRef b1 = store.findChild(context, "hasBuilding", "B1").orElseThrow();
    GraphNodeRef f1 = store.findChild(b1, "hasFloor", "F1").orElseThrow();
    GraphNodeRef f2 = store.findChild(b1, "hasFloor", "F2").orElseThrow();
    assertEquals(List.of(1L), store.referencesOf(f1));
    assertEquals(List.of(2L), store.referencesOf(f2));
    assertTrue(store.findChild(context, "hasBuilding", "B2").isPresent());
    assertEquals(3, store.referenceCount());
  }

  @Test
  void filterFailureIsReportedAsFilterException() {
    ItemFilter broken =
        (ids, keys) -> {
          throw new IllegalStateException("catalog offline");
        };

    FilterException e =
        assertThrows(
            FilterException.class,
            () ->
                generator(store, 300, broken)
                    .generateFromReferences(context, LAYOUT, List.of(1L)));
    assertEquals("catalog offline", e.getCause().getMessage());
    assertEquals(0, store.relationCount());
  }

  @Test
  void generationFromReferencesNeedsAFilter() {
    assertThrows(
        StateException.class,
        () -> generator(store, 300, null).generateFromReferences(context, LAYOUT, List.of(1L)));
  }

  private static final class RecordingSink implements ProgressSink {
    private final List<Long> steps = new ArrayList<>();
    private boolean began;
    private boolean ended;
    private boolean failed;
    private String errorSummary;
    private Map<String, Object> errorAttrs = Map.of();

    @Override
    public void beginStage(String id, String label, long totalWork) {
      began = true;
    }

    @Override
    public void step(String id, long completed, String message, Map<String, Object> attrs) {
      steps.add(completed);
    }

    @Override
    public void endStageOk(String id, Map<String, Object> attrs) {
      ended = true;
    }

    @Override
    public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
      failed = true;
      this.errorSummary = errorSummary;
      this.errorAttrs = attrs;
    }
  }
}
