package com.gentoro.geocontext.layout;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.geocontext.ConfigurationProvider;
import com.gentoro.geocontext.exception.ConfigException;
import com.gentoro.geocontext.exception.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LayoutTest {

  private static final Layout BUILDING_FLOOR =
      new Layout(
          List.of(
              new LayoutLevel("building", "building", "hasBuilding"),
              new LayoutLevel("floor", "floor", "hasFloor")));

  @Test
  void indexesLevelsByDepth() {
    assertEquals(2, BUILDING_FLOOR.depth());
    assertEquals("building", BUILDING_FLOOR.nodeType(0));
    assertEquals("hasFloor", BUILDING_FLOOR.relation(1));
    assertEquals("floor", BUILDING_FLOOR.key(1));
    assertEquals(List.of("building", "floor"), BUILDING_FLOOR.keys());
    assertEquals(Layout.DEFAULT_REFERENCE_RELATION, BUILDING_FLOOR.referenceRelation());
  }

  @Test
  void rejectsDepthOutsideOfLayout() {
    assertThrows(ValidationException.class, () -> BUILDING_FLOOR.relation(2));
    assertThrows(ValidationException.class, () -> BUILDING_FLOOR.nodeType(-1));
  }

  @Test
  void rejectsEmptyIncompleteOrDuplicateLevels() {
    assertThrows(ValidationException.class, () -> new Layout(List.of()));
    assertThrows(
        ValidationException.class,
        () -> new Layout(List.of(new LayoutLevel("building", " ", "hasBuilding"))));
    assertThrows(
        ValidationException.class,
        () ->
            new Layout(
                List.of(
                    new LayoutLevel("building", "building", "hasBuilding"),
                    new LayoutLevel("building", "wing", "hasWing"))));
  }

  @Test
  void readsLayoutFromConfiguration() {
    Configuration config = new BaseConfiguration();
    config.setProperty("geocontext.layout.keys", List.of("building", "floor"));
    config.setProperty("geocontext.layout.types", List.of("building", "floor"));
    config.setProperty("geocontext.layout.relations", List.of("hasBuilding", "hasFloor"));
    config.setProperty("geocontext.layout.referenceRelation", "hasItem");

    Layout layout = Layout.fromConfiguration(config, "geocontext.layout");

    assertEquals(
        new Layout(
            List.of(
                new LayoutLevel("building", "building", "hasBuilding"),
                new LayoutLevel("floor", "floor", "hasFloor")),
            "hasItem"),
        layout);
  }

  @Test
  void configurationWithListsOfDifferentLengthIsRejected() {
    Configuration config = new BaseConfiguration();
    config.setProperty("geocontext.layout.keys", List.of("building", "floor"));
    config.setProperty("geocontext.layout.types", List.of("building"));
    config.setProperty("geocontext.layout.relations", List.of("hasBuilding", "hasFloor"));

    ConfigException e =
        assertThrows(
            ConfigException.class, () -> Layout.fromConfiguration(config, "geocontext.layout"));
    assertTrue(e.getMessage().contains("types=1"));
  }

  @Test
  void missingConfigurationIsAConfigError() {
    Configuration config = new BaseConfiguration();
    assertThrows(
        ConfigException.class, () -> Layout.fromConfiguration(config, "geocontext.layout"));
  }

  @Test
  void duplicateKeysInConfigurationAreAConfigError(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("layout.yaml");
    Files.writeString(
        file,
        String.join(
            "\n",
            "geocontext:",
            "  layout:",
            "    keys: [zone, zone, floor]",
            "    types: [zone, zone, floor]",
            "    relations: [hasZone, hasZone, hasFloor]",
            ""));
    Configuration config = new ConfigurationProvider(file.toString()).config();
    assertEquals(3, config.getList(String.class, "geocontext.layout.keys").size());

    ConfigException e =
        assertThrows(
            ConfigException.class, () -> Layout.fromConfiguration(config, "geocontext.layout"));
    assertInstanceOf(ValidationException.class, e.getCause());
  }
}
