package com.sysmlgraph.diagram;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.sysmlgraph.exception.NotFoundException;
import com.sysmlgraph.exception.SerializationException;
import com.sysmlgraph.exception.ValidationException;
import com.sysmlgraph.graph.GraphProperties;
import com.sysmlgraph.graph.PropertyValue;
import com.sysmlgraph.graph.SysmlNode;
import com.sysmlgraph.graph.driver.GraphDriver;
import com.sysmlgraph.logging.LoggingService;
import com.sysmlgraph.spec.Position;
import com.sysmlgraph.utility.JacksonUtility;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Stores diagrams as {@value #DIAGRAM_LABEL} nodes next to the model.
 *
 * <p>Element ids and positions are kept as JSON text, the same way the codec stores structured
 * element fields. Diagrams are not elements: they never show up in {@code fetchModel}.
 */
public class DiagramService {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DiagramService.class);

  public static final String DIAGRAM_LABEL = "Diagram";
  public static final String DEFAULT_NAME = "Untitled Diagram";

  private static final JavaType ELEMENT_IDS_TYPE =
      JacksonUtility.typeOf(new TypeReference<List<String>>() {});
  private static final JavaType POSITIONS_TYPE =
      JacksonUtility.typeOf(new TypeReference<Map<String, Position>>() {});

  private final GraphDriver driver;
  private final Clock clock;

  public DiagramService(GraphDriver driver) {
    this(driver, Clock.systemUTC());
  }

  public DiagramService(GraphDriver driver, Clock clock) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Store a new diagram. A missing id becomes {@code diagram-<epoch millis>}, a missing name
   * {@value #DEFAULT_NAME}.
   */
  public Diagram createDiagram(Diagram draft) {
    ensureReady();
    Diagram spec = draft != null ? draft : Diagram.draft(null, null);
    String now = now();
    Diagram diagram =
        new Diagram(
            isBlank(spec.id()) ? "diagram-" + clock.millis() : spec.id(),
            isBlank(spec.name()) ? DEFAULT_NAME : spec.name(),
            spec.viewpointId() != null ? spec.viewpointId() : "",
            spec.elementIds(),
            spec.positions(),
            now,
            now);
    driver.createNode(new SysmlNode(List.of(DIAGRAM_LABEL), toProperties(diagram)));
    log.debug("Created diagram {} ('{}')", diagram.id(), diagram.name());
    return diagram;
  }

  /** Diagrams, most recently updated first; only those of the viewpoint when one is given. */
  public List<Diagram> fetchDiagrams(String viewpointId) {
    ensureReady();
    return driver.findNodesByLabel(DIAGRAM_LABEL).stream()
        .map(n -> fromProperties(n.getProperties()))
        .filter(d -> isBlank(viewpointId) || viewpointId.equals(d.viewpointId()))
        .sorted(
            Comparator.comparing(
                Diagram::updatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
        .collect(Collectors.toList());
  }

  public Optional<Diagram> fetchDiagram(String diagramId) {
    ensureReady();
    return findDiagramNode(diagramId).map(n -> fromProperties(n.getProperties()));
  }

  /**
   * Rename the diagram or move it to another viewpoint; {@code null} leaves a value unchanged.
   *
   * @throws NotFoundException when no diagram has the id
   */
  public Diagram updateDiagram(String diagramId, String name, String viewpointId) {
    return mutate(
        diagramId,
        d ->
            new Diagram(
                d.id(),
                name != null ? name : d.name(),
                viewpointId != null ? viewpointId : d.viewpointId(),
                d.elementIds(),
                d.positions(),
                d.createdAt(),
                d.updatedAt()));
  }

  /** @return false when no diagram has the id */
  public boolean deleteDiagram(String diagramId) {
    ensureReady();
    if (findDiagramNode(diagramId).isEmpty()) return false;
    return driver.deleteNode(diagramId);
  }

  /** Append element ids, skipping those already shown. */
  public Diagram addElementsToDiagram(String diagramId, List<String> elementIds) {
    if (elementIds == null) throw new ValidationException("Element ids are required");
    return mutate(
        diagramId,
        d -> {
          LinkedHashSet<String> ids = new LinkedHashSet<>(d.elementIds());
          for (String id : elementIds) {
            if (!isBlank(id)) ids.add(id);
          }
          return withElements(d, new ArrayList<>(ids), d.positions());
        });
  }

  /** Remove the element id; its stored position is kept. */
  public Diagram removeElementFromDiagram(String diagramId, String elementId) {
    return mutate(
        diagramId,
        d -> {
          List<String> ids = new ArrayList<>(d.elementIds());
          ids.removeIf(id -> id.equals(elementId));
          return withElements(d, ids, d.positions());
        });
  }

  public Diagram updateElementPositionInDiagram(
      String diagramId, String elementId, Position position) {
    if (isBlank(elementId)) throw new ValidationException("Element id is required");
    if (position == null) throw new ValidationException("Position is required");
    return mutate(
        diagramId,
        d -> {
          Map<String, Position> positions = new LinkedHashMap<>(d.positions());
          positions.put(elementId, position);
          return withElements(d, d.elementIds(), positions);
        });
  }

  /** Replace every stored position of the diagram. */
  public Diagram updateDiagramPositions(String diagramId, Map<String, Position> positions) {
    if (positions == null) throw new ValidationException("Positions are required");
    return mutate(diagramId, d -> withElements(d, d.elementIds(), positions));
  }

  private Diagram mutate(String diagramId, UnaryOperator<Diagram> change) {
    ensureReady();
    SysmlNode node =
        findDiagramNode(diagramId)
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "Diagram with id " + diagramId + " not found", Map.of("id", diagramId)));
    Diagram changed = change.apply(fromProperties(node.getProperties()));
    Diagram stamped =
        new Diagram(
            changed.id(),
            changed.name(),
            changed.viewpointId(),
            changed.elementIds(),
            changed.positions(),
            changed.createdAt(),
            now());
    GraphProperties updates = toProperties(stamped);
    updates.remove("id");
    driver.mergeNodeProperties(diagramId, updates);
    return stamped;
  }

  private static Diagram withElements(
      Diagram d, List<String> elementIds, Map<String, Position> positions) {
    return new Diagram(
        d.id(), d.name(), d.viewpointId(), elementIds, positions, d.createdAt(), d.updatedAt());
  }

  private Optional<SysmlNode> findDiagramNode(String diagramId) {
    if (diagramId == null) return Optional.empty();
    return driver.findNode(diagramId).filter(n -> n.hasLabel(DIAGRAM_LABEL));
  }

  static GraphProperties toProperties(Diagram d) {
    GraphProperties props = new GraphProperties();
    props.putText("id", d.id());
    props.putText("name", d.name());
    props.putText("viewpointId", d.viewpointId() != null ? d.viewpointId() : "");
    props.put("elementIds", PropertyValue.json(JacksonUtility.toJson(d.elementIds())));
    props.put("positions", PropertyValue.json(JacksonUtility.toJson(d.positions())));
    if (d.createdAt() != null) props.putText("createdAt", d.createdAt());
    if (d.updatedAt() != null) props.putText("updatedAt", d.updatedAt());
    return props;
  }

  static Diagram fromProperties(GraphProperties props) {
    String id = props.getString("id").orElse(null);
    return new Diagram(
        id,
        props.getString("name").orElse(null),
        props.getString("viewpointId").orElse(""),
        readJson(props, "elementIds", ELEMENT_IDS_TYPE, id),
        readJson(props, "positions", POSITIONS_TYPE, id),
        props.getString("createdAt").orElse(null),
        props.getString("updatedAt").orElse(null));
  }

  private static <T> T readJson(GraphProperties props, String key, JavaType type, String id) {
    Optional<String> json = props.getString(key).filter(s -> !s.isEmpty());
    if (json.isEmpty()) return null;
    try {
      return JacksonUtility.fromJson(json.get(), type);
    } catch (SerializationException e) {
      log.warn("Failed to parse {} of diagram {}; treating it as empty", key, id, e);
      return null;
    }
  }

  private String now() {
    return Instant.now(clock).toString();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }

  private void ensureReady() {
    if (!driver.isInitialized()) driver.initialize();
  }
}
