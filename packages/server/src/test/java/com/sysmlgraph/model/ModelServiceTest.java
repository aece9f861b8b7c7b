package com.sysmlgraph.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.sysmlgraph.exception.AlreadyExistsException;
import com.sysmlgraph.exception.NotFoundException;
import com.sysmlgraph.exception.ValidationException;
import com.sysmlgraph.graph.SysmlEdge;
import com.sysmlgraph.graph.SysmlNode;
import com.sysmlgraph.graph.driver.memory.InMemoryGraphDriver;
import com.sysmlgraph.spec.Compartment;
import com.sysmlgraph.spec.ElementSpec;
import com.sysmlgraph.spec.InternalTransition;
import com.sysmlgraph.spec.NodeSpec;
import com.sysmlgraph.spec.OwnedPart;
import com.sysmlgraph.spec.OwnedState;
import com.sysmlgraph.spec.Position;
import com.sysmlgraph.spec.RelationshipSpec;
import com.sysmlgraph.spec.SpecField;
import com.sysmlgraph.spec.SysmlModel;
import com.sysmlgraph.spec.SysmlParameter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ModelServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private InMemoryGraphDriver driver;
  private ModelService service;

  @BeforeEach
  void setUp() {
    driver = new InMemoryGraphDriver("model-test");
    service = new ModelService(driver, Clock.fixed(NOW, ZoneOffset.UTC), ModelSettings.DEFAULTS);
  }

  private void create(String kind, String id) {
    service.createElement(kind, new ElementSpec(id, id.toUpperCase()));
  }

  private NodeSpec node(SysmlModel model, String id) {
    return model.nodes().stream()
        .filter(n -> id.equals(n.spec().getId()))
        .findFirst()
        .orElseThrow(() -> new AssertionError("node " + id + " not in model"));
  }

  @Nested
  class Elements {

    @Test
    void testCreateElementStoresLabelsAndTimestamps() {
      service.createElement(
          "part-definition", new ElementSpec("p1", "Engine").set(SpecField.STATUS, "draft"));

      SysmlNode stored = driver.findNode("p1").orElseThrow();
      assertEquals(List.of("SysMLElement", "PartDefinition"), stored.getLabels());
      assertEquals("2024-05-01T10:00:00Z", stored.getString("createdAt").orElseThrow());
      assertEquals("2024-05-01T10:00:00Z", stored.getString("updatedAt").orElseThrow());

      NodeSpec found = service.findElement("p1").orElseThrow();
      assertEquals("part-definition", found.kind());
      assertEquals("draft", found.spec().get(SpecField.STATUS));
    }

    @Test
    void testCreateElementOmitsClearedFields() {
      service.createElement(
          "state-usage",
          new ElementSpec("s1", "S")
              .set(SpecField.INTERNAL_TRANSITIONS, List.of())
              .set(SpecField.ENTRY_ACTION, null));

      SysmlNode stored = driver.findNode("s1").orElseThrow();
      assertFalse(stored.getProperties().containsKey("internalTransitions"));
      assertFalse(stored.getProperties().containsKey("entryAction"));
      assertThat(stored.toMap()).doesNotContainValue(null);
    }

    @Test
    void testCreateElementFromNodeSpec() {
      service.createElement(new NodeSpec("item-usage", new ElementSpec("i1", "Fuel")));

      assertTrue(service.findElement("i1").isPresent());
    }

    @Test
    void testCreateElementValidation() {
      assertThrows(
          ValidationException.class,
          () -> service.createElement("part-definition", new ElementSpec(null, "x")));
      assertThrows(
          ValidationException.class,
          () -> service.createElement("part-definition", new ElementSpec("x", "")));
      assertThrows(
          ValidationException.class,
          () -> service.createElement("PartDefinition", new ElementSpec("x", "X")));
      assertThrows(
          ValidationException.class, () -> service.createElement("part-definition", null));
    }

    @Test
    void testDuplicateIdRejected() {
      create("part-definition", "p1");

      assertThrows(AlreadyExistsException.class, () -> create("part-usage", "p1"));
    }

    @Test
    @DisplayName("Kinds no viewpoint lists are accepted unless strict mode is on")
    void testUnknownKinds() {
      assertDoesNotThrow(() -> create("custom-block", "c1"));

      ModelService strict =
          new ModelService(driver, Clock.fixed(NOW, ZoneOffset.UTC), new ModelSettings(true, true));
      ValidationException e =
          assertThrows(
              ValidationException.class,
              () -> strict.createElement("custom-block", new ElementSpec("c2", "C2")));
      assertEquals("custom-block", e.getContext().get("kind"));
    }

    @Test
    void testTimestampsCanBeDisabled() {
      ModelService plain =
          new ModelService(driver, Clock.fixed(NOW, ZoneOffset.UTC), new ModelSettings(false, false));
      plain.createElement("part-usage", new ElementSpec("p", "P"));

      assertFalse(driver.findNode("p").orElseThrow().getProperties().containsKey("createdAt"));
    }

    @Test
    void testUpdateElementMergesAndClears() {
      service.createElement(
          "state-definition",
          new ElementSpec("s1", "Idle")
              .set(SpecField.DESCRIPTION, "Waiting")
              .set(SpecField.INTERNAL_TRANSITIONS, List.of(new InternalTransition("tick", null, null))));

      service.updateElement(
          "s1",
          new ElementSpec("ignored", null)
              .set(SpecField.STATUS, "approved")
              .set(SpecField.INTERNAL_TRANSITIONS, List.of()));

      ElementSpec stored = service.findElement("s1").orElseThrow().spec();
      assertEquals("s1", stored.getId());
      assertEquals("Idle", stored.getName());
      assertEquals("Waiting", stored.getDescription());
      assertEquals("approved", stored.get(SpecField.STATUS));
      assertFalse(stored.isDefined(SpecField.INTERNAL_TRANSITIONS));
      assertTrue(driver.findNode("ignored").isEmpty());
    }

    @Test
    void testUpdateMissingElement() {
      NotFoundException e =
          assertThrows(
              NotFoundException.class, () -> service.updateElement("nope", new ElementSpec()));
      assertEquals("nope", e.getContext().get("id"));
    }

    @Test
    void testDeleteElementRemovesRelationships() {
      create("requirement-definition", "r1");
      create("requirement-usage", "r2");
      service.createRelationship(new RelationshipSpec(null, "definition", "r2", "r1"));

      assertTrue(service.deleteElement("r1"));

      assertTrue(service.findElement("r1").isEmpty());
      assertTrue(driver.findEdges(List.of()).isEmpty());
      assertFalse(service.deleteElement("r1"));
    }

    @Test
    void testUpdateElementPositionKeepsOtherViewpoints() {
      create("part-usage", "p1");

      service.updateElementPosition("p1", "sysml.usageStructure", new Position(1, 2));
      service.updateElementPosition("p1", "sysml.structuralDefinition", new Position(5, 6));
      service.updateElementPosition("p1", "sysml.usageStructure", new Position(3, 4));

      Map<String, Position> positions = service.findElement("p1").orElseThrow().spec().getPositions();
      assertEquals(
          Map.of(
              "sysml.usageStructure", new Position(3, 4),
              "sysml.structuralDefinition", new Position(5, 6)),
          positions);
      assertThrows(
          NotFoundException.class,
          () -> service.updateElementPosition("missing", "sysml.state", new Position(0, 0)));
    }
  }

  @Nested
  class Relationships {

    @BeforeEach
    void elements() {
      create("state-usage", "s1");
      create("state-usage", "s2");
    }

    @Test
    void testCreateRelationshipDerivesId() {
      RelationshipSpec created =
          service.createRelationship(
              new RelationshipSpec(null, "transition", "s1", "s2")
                  .withLabel("go")
                  .withProperty("trigger", "start"));

      assertEquals("s1-transition-s2", created.getId());
      SysmlEdge edge = driver.findEdge("s1-transition-s2").orElseThrow();
      assertEquals("TRANSITION", edge.getRelType());
      assertEquals("start", edge.getProperties().getString("trigger").orElseThrow());
      assertEquals("2024-05-01T10:00:00Z", edge.getProperties().getString("createdAt").orElseThrow());
    }

    @Test
    void testCreateRelationshipRequiresEndpoints() {
      assertThrows(
          NotFoundException.class,
          () -> service.createRelationship(new RelationshipSpec("t", "transition", "s1", "zz")));
      assertThrows(
          ValidationException.class,
          () -> service.createRelationship(new RelationshipSpec("t", "Transition", "s1", "s2")));
      assertThrows(
          ValidationException.class,
          () -> service.createRelationship(new RelationshipSpec("t", "transition", null, "s2")));
    }

    @Test
    void testUpdateAndDeleteRelationship() {
      service.createRelationship(new RelationshipSpec("t1", "transition", "s1", "s2"));

      service.updateRelationship(
          "t1", new RelationshipSpec().withLabel("retry").withProperty("guard", "ok"));

      RelationshipSpec read = service.fetchModel(null).relationships().get(0);
      assertEquals("retry", read.getLabel());
      assertEquals(Map.of("guard", "ok"), read.getProperties());

      assertThrows(
          NotFoundException.class,
          () -> service.updateRelationship("missing", new RelationshipSpec()));
      assertTrue(service.deleteRelationship("t1"));
      assertFalse(service.deleteRelationship("t1"));
    }
  }

  @Nested
  class FetchModel {

    @Test
    void testViewpointFiltersNodesAndRelationships() {
      create("requirement-definition", "r1");
      create("requirement-usage", "r2");
      create("part-usage", "p1");
      service.createRelationship(new RelationshipSpec(null, "satisfy", "p1", "r2"));
      service.createRelationship(new RelationshipSpec(null, "definition", "r2", "r1"));

      SysmlModel model = service.fetchModel("sysml.requirement");

      assertThat(model.nodes()).extracting(n -> n.spec().getId()).containsExactly("r1", "r2");
      assertThat(model.relationships()).extracting(RelationshipSpec::getId)
          .containsExactly("p1-satisfy-r2");
    }

    @Test
    void testUnknownOrMissingViewpointReturnsEverything() {
      create("requirement-usage", "r1");
      create("part-usage", "p1");

      assertEquals(2, service.fetchModel("no-such-viewpoint").nodes().size());
      assertEquals(2, service.fetchModel(null).nodes().size());
      assertEquals(2, service.fetchModel("").nodes().size());
    }

    @Test
    void testDiagramsAreNotElements() {
      create("part-usage", "p1");
      driver.createNode(
          new SysmlNode(
              List.of("Diagram"), new com.sysmlgraph.graph.GraphProperties().putText("id", "d1")));

      assertThat(service.fetchModel(null).nodes()).extracting(NodeSpec::kind)
          .containsExactly("part-usage");
    }

    @Test
    void testCompositionShowsAsOwnedPart() {
      create("part-definition", "vehicle");
      create("part-definition", "engine");

      OwnedUsageResult result =
          service.createComposition("vehicle", "engine", "mainEngine", CompositionType.COMPOSITION);

      String partId = "vehicle-part-" + NOW.toEpochMilli();
      assertEquals(partId, result.usageId());
      assertEquals(partId + "-definition-engine", result.definitionRelId());
      assertEquals("vehicle-composition-" + partId, result.compositionRelId());

      SysmlModel model = service.fetchModel("sysml.structuralDefinition");
      List<OwnedPart> parts = node(model, "vehicle").spec().get(SpecField.PARTS);
      assertEquals(
          List.of(new OwnedPart(partId, "mainEngine", "engine", "ENGINE", null, "COMPOSITION")),
          parts);
      assertEquals("part-usage", node(model, partId).kind());
      assertThat(model.relationships()).extracting(RelationshipSpec::getType)
          .containsExactlyInAnyOrder("definition", "composition");

      assertTrue(service.deleteComposition(partId));
      assertFalse(node(service.fetchModel(null), "vehicle").spec().isDefined(SpecField.PARTS));
      assertTrue(driver.findEdges(List.of()).isEmpty());
      assertFalse(service.deleteComposition("vehicle"));
    }

    @Test
    void testAggregation() {
      create("part-definition", "fleet");
      create("part-definition", "truck");

      OwnedUsageResult result =
          service.createComposition("fleet", "truck", "trucks", CompositionType.fromEdgeKind("aggregation"));

      assertTrue(result.compositionRelId().startsWith("fleet-aggregation-"));
      assertEquals(
          "AGGREGATION",
          node(service.fetchModel(null), "fleet").spec().get(SpecField.PARTS).get(0).relationshipType());
      assertThrows(ValidationException.class, () -> CompositionType.fromEdgeKind("ownership"));
    }

    @Test
    void testCompositionRequiresExistingElements() {
      create("part-definition", "vehicle");

      assertThrows(
          NotFoundException.class,
          () -> service.createComposition("vehicle", "ghost", "x", CompositionType.COMPOSITION));
      assertEquals(1, service.fetchModel(null).nodes().size());
    }

    @Test
    void testStatesOfStateMachine() {
      create("state-machine", "sm");
      create("state-definition", "idle");

      OwnedUsageResult result = service.createStateInStateMachine("sm", "idle", "Idle");

      String stateId = "sm-state-" + NOW.toEpochMilli();
      assertEquals(stateId, result.usageId());
      assertEquals("sm-composition-" + stateId, result.compositionRelId());
      List<OwnedState> states = node(service.fetchModel("sysml.state"), "sm").spec().get(SpecField.STATES);
      assertEquals(List.of(new OwnedState(stateId, "Idle", "idle", "IDLE", "COMPOSITION")), states);

      assertTrue(service.deleteStateFromStateMachine(stateId));
      assertFalse(service.deleteStateFromStateMachine(stateId));
      assertThrows(
          NotFoundException.class, () -> service.createStateInStateMachine("sm", "busy", "Busy"));
    }

    @Test
    @DisplayName("Action usages inherit definition parameters and local ones override by name")
    void testParameterInheritanceAndCompartments() {
      service.createElement(
          "action-definition",
          new ElementSpec("drive", "Drive")
              .set(
                  SpecField.PARAMETERS,
                  List.of(
                      new SysmlParameter("speed", "Real", "in"),
                      new SysmlParameter("distance", "Real", "out"))));
      service.createElement(
          "action-usage",
          new ElementSpec("driveHome", "Drive home")
              .set(SpecField.PARAMETERS, List.of(new SysmlParameter("speed", "Integer", "in"))));
      service.createRelationship(new RelationshipSpec(null, "definition", "driveHome", "drive"));

      SysmlModel model = service.fetchModel("sysml.behaviorControl");

      ElementSpec usage = node(model, "driveHome").spec();
      assertEquals(
          List.of(
              new SysmlParameter("distance", "Real", "out", null, true),
              new SysmlParameter("speed", "Integer", "in", null, false)),
          usage.getParameters());
      assertEquals(
          List.of(
              new Compartment(
                  "inputs", List.of(new Compartment.Item("speed", "Integer", null, false))),
              new Compartment(
                  "outputs", List.of(new Compartment.Item("distance", "Real", false, true)))),
          usage.get(SpecField.COMPARTMENTS));

      ElementSpec definition = node(model, "drive").spec();
      assertEquals(2, definition.get(SpecField.COMPARTMENTS).size());
      assertNull(definition.getParameters().get(0).inherited());
    }

    @Test
    void testUsageWithoutDefinitionKeepsLocalParameters() {
      service.createElement(
          "calculation-usage",
          new ElementSpec("calc", "Calc")
              .set(SpecField.PARAMETERS, List.of(new SysmlParameter("r", null, "inout"))));

      ElementSpec spec = node(service.fetchModel(null), "calc").spec();

      assertNull(spec.getParameters().get(0).inherited());
      List<Compartment> compartments = spec.get(SpecField.COMPARTMENTS);
      assertThat(compartments).extracting(Compartment::title).containsExactly("inputs", "outputs");
      assertEquals("", compartments.get(0).items().get(0).value());
    }

    @Test
    void testElementsWithoutParametersGetNoCompartments() {
      create("action-definition", "a");

      assertFalse(node(service.fetchModel(null), "a").spec().isDefined(SpecField.COMPARTMENTS));
    }

    @Test
    void testCorruptFieldDoesNotBreakFetch() {
      create("part-definition", "p1");
      driver.mergeNodeProperties(
          "p1", new com.sysmlgraph.graph.GraphProperties().putText("ports", "{oops"));

      ElementSpec spec = node(service.fetchModel(null), "p1").spec();

      assertFalse(spec.isDefined(SpecField.PORTS));
      assertEquals("P1", spec.getName());
    }
  }
}
