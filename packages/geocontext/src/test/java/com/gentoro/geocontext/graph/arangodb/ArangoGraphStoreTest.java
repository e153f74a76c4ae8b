package com.gentoro.geocontext.graph.arangodb;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.geocontext.exception.StateException;
import com.gentoro.geocontext.graph.GraphNodeRef;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArangoGraphStoreTest {

  @Mock private Configuration configuration;

  private ArangoGraphStore store;

  @BeforeEach
  void setUp() {
    lenient()
        .when(configuration.getString("geocontext.store.arangodb.database", ""))
        .thenReturn("");
    lenient()
        .when(configuration.getString("geocontext.store.arangodb.databasePrefix", "geocontext_"))
        .thenReturn("geocontext_");
    store = new ArangoGraphStore(configuration, "Site 42");
  }

  @Test
  void databaseNameIsDerivedFromProject() {
    assertEquals("geocontext_site_42", store.getDatabaseName());
    assertEquals("arangodb", store.getDriverName());
  }

  @Test
  void configuredDatabaseNameWins() {
    when(configuration.getString("geocontext.store.arangodb.database", ""))
        .thenReturn("campus");

    assertEquals("campus", new ArangoGraphStore(configuration, "Site 42").getDatabaseName());
  }

  @Test
  void operationsRequireInitialization() {
    GraphNodeRef context = new GraphNodeRef("nodes/ctx_BuildingContext", "BuildingContext", "x");

    assertFalse(store.isInitialized());
    assertNull(store.getDatabase());
    assertThrows(StateException.class, () -> store.ensureContext("BuildingContext"));
    assertThrows(StateException.class, () -> store.resolveChildren(context, "hasBuilding"));
    assertThrows(StateException.class, () -> store.createNode("B1", "building"));
  }

  @Test
  void shutdownWhenNotInitialized() {
    assertDoesNotThrow(() -> store.shutdown());
  }

  @Test
  void sanitizesDatabaseNames() {
    assertEquals("campus_north", ArangoGraphStore.sanitize("Campus North"));
    assertEquals("p_42", ArangoGraphStore.sanitize("42"));
  }

  @Test
  void sanitizesDocumentKeys() {
    assertEquals(
        "ctx_BIMObjectContext", ArangoGraphStore.sanitizeDocumentKey("ctx_BIMObjectContext"));
    assertEquals("k_1st_floor", ArangoGraphStore.sanitizeDocumentKey("1st floor"));
    assertEquals("k_hidden", ArangoGraphStore.sanitizeDocumentKey("_hidden"));
    assertThrows(IllegalArgumentException.class, () -> ArangoGraphStore.sanitizeDocumentKey(""));
  }

  @Test
  void edgeKeyIsStablePerEndpointsAndLabel() {
    String key = ArangoGraphStore.edgeKey("nodes/n_1", "nodes/n_2", "hasFloor");

    assertTrue(key.matches("nodes_n_1_hasFloor_nodes_n_2_[0-9a-f]{12}"), key);
    assertEquals(key, ArangoGraphStore.edgeKey("nodes/n_1", "nodes/n_2", "hasFloor"));
    assertNotEquals(key, ArangoGraphStore.edgeKey("nodes/n_1", "nodes/n_2", "hasRoom"));
  }

  @Test
  void edgeKeysStayDistinctWhenSanitizingOrTruncatingCollides() {
    assertNotEquals(
        ArangoGraphStore.edgeKey("nodes/n_1", "nodes/n_2", "has Floor"),
        ArangoGraphStore.edgeKey("nodes/n_1", "nodes/n_2", "has_Floor"));

    String longName = "nodes/" + "x".repeat(300);
    String first = ArangoGraphStore.edgeKey("nodes/n_1", longName + "a", "hasFloor");
    String second = ArangoGraphStore.edgeKey("nodes/n_1", longName + "b", "hasFloor");
    assertNotEquals(first, second);
    assertEquals(254, first.length());
    assertTrue(first.matches("[a-zA-Z][a-zA-Z0-9_\\-]*"));
  }
}
