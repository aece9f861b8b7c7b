package com.sysmlgraph.model;

import com.sysmlgraph.exception.NotFoundException;
import com.sysmlgraph.exception.ValidationException;
import com.sysmlgraph.graph.GraphProperties;
import com.sysmlgraph.graph.SysmlEdge;
import com.sysmlgraph.graph.SysmlNode;
import com.sysmlgraph.graph.driver.GraphDriver;
import com.sysmlgraph.logging.LoggingService;
import com.sysmlgraph.mapping.DecodeResult;
import com.sysmlgraph.mapping.KindTranslator;
import com.sysmlgraph.mapping.PropertyCodec;
import com.sysmlgraph.spec.Compartment;
import com.sysmlgraph.spec.ElementSpec;
import com.sysmlgraph.spec.NodeSpec;
import com.sysmlgraph.spec.OwnedPart;
import com.sysmlgraph.spec.OwnedState;
import com.sysmlgraph.spec.Position;
import com.sysmlgraph.spec.RelationshipSpec;
import com.sysmlgraph.spec.SpecField;
import com.sysmlgraph.spec.SysmlModel;
import com.sysmlgraph.spec.SysmlParameter;
import com.sysmlgraph.viewpoint.Viewpoint;
import com.sysmlgraph.viewpoint.ViewpointRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads and writes the SysML model held by a {@link GraphDriver}.
 *
 * <p>All conversions go through {@link PropertyCodec} and {@link KindTranslator}; this class adds
 * what the codec deliberately leaves out: validation of ids and kinds, existence checks,
 * timestamps, and the read-side decorations of {@link #fetchModel(String)}.
 */
public class ModelService {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ModelService.class);

  static final String PART_USAGE_LABEL = KindTranslator.kindToLabel("part-usage");
  static final String STATE_USAGE_LABEL = KindTranslator.kindToLabel("state-usage");
  static final String STATE_MACHINE_LABEL = KindTranslator.kindToLabel("state-machine");
  static final String DEFINITION_REL = KindTranslator.edgeKindToRelType("definition");

  private static final List<String> OWNERSHIP_RELS =
      List.of(CompositionType.COMPOSITION.relType(), CompositionType.AGGREGATION.relType());
  private static final Set<String> INHERITING_KINDS = Set.of("action-usage", "calculation-usage");
  private static final Set<String> COMPARTMENT_KINDS =
      Set.of("action-definition", "action-usage", "calculation-usage");

  private final GraphDriver driver;
  private final Clock clock;
  private final ModelSettings settings;

  public ModelService(GraphDriver driver) {
    this(driver, Clock.systemUTC(), ModelSettings.DEFAULTS);
  }

  public ModelService(GraphDriver driver, Clock clock, ModelSettings settings) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.settings = settings != null ? settings : ModelSettings.DEFAULTS;
  }

  // ---------------------------------------------------------------------------------------------
  // Read
  // ---------------------------------------------------------------------------------------------

  /**
   * Fetch every element and relationship, restricted to what the viewpoint shows.
   *
   * <p>A blank or unknown viewpoint id applies no filter. Returned elements carry their owned
   * parts, the owned states of state machines, parameters inherited from their definition and
   * input/output compartments.
   */
  public SysmlModel fetchModel(String viewpointId) {
    ensureReady();
    Optional<Viewpoint> viewpoint = ViewpointRegistry.getViewpointById(viewpointId);
    if (viewpointId != null && !viewpointId.isBlank() && viewpoint.isEmpty()) {
      log.debug("Unknown viewpoint '{}'; returning the unfiltered model", viewpointId);
    }

    Set<String> nodeLabels =
        viewpoint
            .map(vp -> vp.includeNodeKinds().stream().map(KindTranslator::kindToLabel))
            .map(s -> s.collect(Collectors.toSet()))
            .orElse(Set.of());
    List<String> relTypes =
        viewpoint
            .map(vp -> vp.includeEdgeKinds().stream().map(KindTranslator::edgeKindToRelType))
            .map(s -> s.collect(Collectors.toList()))
            .orElse(List.of());

    List<NodeSpec> nodes = new ArrayList<>();
    for (SysmlNode node : driver.findNodesByLabel(KindTranslator.ELEMENT_LABEL)) {
      if (!nodeLabels.isEmpty() && !node.hasAnyLabel(nodeLabels)) continue;
      nodes.add(toNodeSpec(node));
    }

    List<RelationshipSpec> relationships = new ArrayList<>();
    for (SysmlEdge edge : driver.findEdges(relTypes)) {
      if (!isElement(edge.getFromId()) || !isElement(edge.getToId())) continue;
      relationships.add(
          PropertyCodec.decodeRelationship(
              edge.getRelType(), edge.getFromId(), edge.getToId(), edge.getProperties()));
    }
    log.debug(
        "Fetched {} nodes and {} relationships for viewpoint '{}'",
        nodes.size(),
        relationships.size(),
        viewpointId);
    return new SysmlModel(nodes, relationships);
  }

  /** A single element without read-side decorations. */
  public Optional<NodeSpec> findElement(String id) {
    ensureReady();
    return findElementNode(id)
        .map(n -> new NodeSpec(n.getKind().orElse(null), PropertyCodec.decode(n.getProperties())));
  }

  private NodeSpec toNodeSpec(SysmlNode node) {
    String kind = node.getKind().orElse(null);
    DecodeResult decoded = PropertyCodec.decodeWithDiagnostics(node.getProperties());
    if (!decoded.isClean()) {
      log.warn("Element {} decoded with {} skipped fields", node.getId(), decoded.issues().size());
    }
    ElementSpec spec = decoded.spec();

    List<OwnedPart> parts = ownedParts(node);
    if (!parts.isEmpty()) spec.set(SpecField.PARTS, parts);

    if (node.hasLabel(STATE_MACHINE_LABEL)) {
      List<OwnedState> states = ownedStates(node);
      if (!states.isEmpty()) spec.set(SpecField.STATES, states);
    }

    if (INHERITING_KINDS.contains(kind)) {
      inheritParameters(node, spec);
    }

    if (COMPARTMENT_KINDS.contains(kind) && spec.getParameters() != null) {
      List<Compartment> compartments = toCompartments(spec.getParameters());
      if (!compartments.isEmpty()) spec.set(SpecField.COMPARTMENTS, compartments);
    }
    return new NodeSpec(kind, spec);
  }

  private List<OwnedPart> ownedParts(SysmlNode owner) {
    List<OwnedPart> parts = new ArrayList<>();
    for (SysmlEdge ownership : driver.findOutgoingEdges(owner.getId(), OWNERSHIP_RELS)) {
      Optional<SysmlNode> usage =
          driver.findNode(ownership.getToId()).filter(n -> n.hasLabel(PART_USAGE_LABEL));
      if (usage.isEmpty()) continue;
      for (SysmlNode definition : definitionsOf(usage.get())) {
        parts.add(
            new OwnedPart(
                usage.get().getId(),
                usage.get().getString(PropertyCodec.NAME).orElse(null),
                definition.getId(),
                definition.getString(PropertyCodec.NAME).orElse(null),
                usage.get().getString("multiplicity").orElse(null),
                ownership.getRelType()));
      }
    }
    return parts;
  }

  private List<OwnedState> ownedStates(SysmlNode stateMachine) {
    List<OwnedState> states = new ArrayList<>();
    for (SysmlEdge ownership : driver.findOutgoingEdges(stateMachine.getId(), OWNERSHIP_RELS)) {
      Optional<SysmlNode> usage =
          driver.findNode(ownership.getToId()).filter(n -> n.hasLabel(STATE_USAGE_LABEL));
      if (usage.isEmpty()) continue;
      for (SysmlNode definition : definitionsOf(usage.get())) {
        states.add(
            new OwnedState(
                usage.get().getId(),
                usage.get().getString(PropertyCodec.NAME).orElse(null),
                definition.getId(),
                definition.getString(PropertyCodec.NAME).orElse(null),
                ownership.getRelType()));
      }
    }
    return states;
  }

  private List<SysmlNode> definitionsOf(SysmlNode usage) {
    List<SysmlNode> definitions = new ArrayList<>();
    for (SysmlEdge edge : driver.findOutgoingEdges(usage.getId(), List.of(DEFINITION_REL))) {
      driver.findNode(edge.getToId()).filter(SysmlNode::isElement).ifPresent(definitions::add);
    }
    return definitions;
  }

  /**
   * Parameters of the usage's definition come first, flagged inherited, unless a local parameter
   * with the same name overrides them. Local parameters follow, flagged not inherited.
   */
  private void inheritParameters(SysmlNode usage, ElementSpec spec) {
    List<SysmlNode> definitions = definitionsOf(usage);
    if (definitions.isEmpty()) return;
    List<SysmlParameter> inherited =
        PropertyCodec.decode(definitions.get(0).getProperties()).getParameters();
    if (inherited == null) return;

    List<SysmlParameter> local =
        spec.getParameters() != null ? spec.getParameters() : List.of();
    Set<String> localNames = new HashSet<>();
    for (SysmlParameter p : local) localNames.add(p.name());

    List<SysmlParameter> merged = new ArrayList<>();
    for (SysmlParameter p : inherited) {
      if (!localNames.contains(p.name())) merged.add(p.withInherited(true));
    }
    for (SysmlParameter p : local) {
      merged.add(p.withInherited(false));
    }
    spec.set(SpecField.PARAMETERS, merged);
  }

  static List<Compartment> toCompartments(List<SysmlParameter> parameters) {
    List<Compartment> compartments = new ArrayList<>();
    List<Compartment.Item> inputs = new ArrayList<>();
    List<Compartment.Item> outputs = new ArrayList<>();
    for (SysmlParameter p : parameters) {
      boolean inherited = Boolean.TRUE.equals(p.inherited());
      Compartment.Item item =
          new Compartment.Item(
              p.name(), p.type() != null ? p.type() : "", inherited ? Boolean.FALSE : null, inherited);
      if (p.isInput()) inputs.add(item);
      if (p.isOutput()) outputs.add(item);
    }
    if (!inputs.isEmpty()) compartments.add(new Compartment("inputs", inputs));
    if (!outputs.isEmpty()) compartments.add(new Compartment("outputs", outputs));
    return compartments;
  }

  // ---------------------------------------------------------------------------------------------
  // Elements
  // ---------------------------------------------------------------------------------------------

  public void createElement(NodeSpec nodeSpec) {
    Objects.requireNonNull(nodeSpec, "nodeSpec");
    createElement(nodeSpec.kind(), nodeSpec.spec());
  }

  /**
   * Store a new element.
   *
   * @throws ValidationException when id or name is missing or the kind is not acceptable
   * @throws com.sysmlgraph.exception.AlreadyExistsException when the id is taken
   */
  public void createElement(String kind, ElementSpec spec) {
    ensureReady();
    if (spec == null) throw new ValidationException("Element spec is required");
    requireText(spec.getId(), "id");
    requireText(spec.getName(), "name");
    checkNodeKind(kind);

    GraphProperties props = PropertyCodec.encode(spec);
    stamp(props, true);
    driver.createNode(SysmlNode.element(kind, props));
    log.debug("Created {} element {}", kind, spec.getId());
  }

  /**
   * Merge the defined fields of {@code updates} into a stored element. The id never changes;
   * fields defined as {@code null} are removed.
   *
   * @throws NotFoundException when no element has the id
   */
  public void updateElement(String id, ElementSpec updates) {
    ensureReady();
    requireText(id, "id");
    if (updates == null) throw new ValidationException("Element updates are required");

    GraphProperties props = PropertyCodec.encode(updates);
    props.remove(PropertyCodec.ID);
    stamp(props, false);
    if (findElementNode(id).isEmpty() || !driver.mergeNodeProperties(id, props)) {
      throw new NotFoundException("Element with id " + id + " not found", Map.of("id", id));
    }
    log.debug("Updated element {} ({} properties)", id, props.size());
  }

  /**
   * Delete an element together with every relationship attached to it.
   *
   * @return false when no element has the id
   */
  public boolean deleteElement(String id) {
    ensureReady();
    if (findElementNode(id).isEmpty()) {
      log.debug("Element {} not found; nothing to delete", id);
      return false;
    }
    return driver.deleteNode(id);
  }

  /** Store the element's layout position for one viewpoint, keeping the other viewpoints. */
  public void updateElementPosition(String elementId, String viewpointId, Position position) {
    ensureReady();
    requireText(viewpointId, "viewpointId");
    if (position == null) throw new ValidationException("Position is required");
    SysmlNode node =
        findElementNode(elementId)
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "Element with id " + elementId + " not found", Map.of("id", elementId)));

    Map<String, Position> current = PropertyCodec.decode(node.getProperties()).getPositions();
    Map<String, Position> positions =
        current != null ? new LinkedHashMap<>(current) : new LinkedHashMap<>();
    positions.put(viewpointId, position);

    GraphProperties props =
        PropertyCodec.encode(new ElementSpec().set(SpecField.POSITIONS, positions));
    driver.mergeNodeProperties(elementId, props);
  }

  // ---------------------------------------------------------------------------------------------
  // Relationships
  // ---------------------------------------------------------------------------------------------

  /**
   * Store a relationship between two existing elements. A missing id becomes {@code
   * <source>-<type>-<target>}.
   *
   * @throws NotFoundException when the source or the target element does not exist
   */
  public RelationshipSpec createRelationship(RelationshipSpec spec) {
    ensureReady();
    if (spec == null) throw new ValidationException("Relationship spec is required");
    requireText(spec.getSource(), "source");
    requireText(spec.getTarget(), "target");
    checkEdgeKind(spec.getType());
    if (spec.getId() == null || spec.getId().isEmpty()) {
      spec.setId(spec.getSource() + "-" + spec.getType() + "-" + spec.getTarget());
    }
    if (findElementNode(spec.getSource()).isEmpty()
        || findElementNode(spec.getTarget()).isEmpty()) {
      throw new NotFoundException(
          "Failed to create relationship. Source or target not found.",
          Map.of("source", spec.getSource(), "target", spec.getTarget()));
    }

    GraphProperties props = PropertyCodec.encodeRelationship(spec);
    stamp(props, true);
    SysmlEdge edge =
        SysmlEdge.relationship(
            spec.getId(), spec.getType(), spec.getSource(), spec.getTarget(), props);
    if (!driver.createEdge(edge)) {
      throw new NotFoundException(
          "Failed to create relationship. Source or target not found.",
          Map.of("source", spec.getSource(), "target", spec.getTarget()));
    }
    log.debug("Created relationship {}", edge);
    return spec;
  }

  /**
   * Merge label and extra properties of {@code updates} into a stored relationship. Type and
   * endpoints never change.
   *
   * @throws NotFoundException when no relationship has the id
   */
  public void updateRelationship(String id, RelationshipSpec updates) {
    ensureReady();
    requireText(id, "id");
    if (updates == null) throw new ValidationException("Relationship updates are required");
    GraphProperties props = PropertyCodec.encodeRelationship(updates);
    props.remove(PropertyCodec.ID);
    stamp(props, false);
    if (!driver.mergeEdgeProperties(id, props)) {
      throw new NotFoundException("Relationship with id " + id + " not found", Map.of("id", id));
    }
  }

  /** @return false when no relationship has the id */
  public boolean deleteRelationship(String id) {
    ensureReady();
    return driver.deleteEdge(id);
  }

  // ---------------------------------------------------------------------------------------------
  // Owned usages
  // ---------------------------------------------------------------------------------------------

  /**
   * Make {@code targetId} a part of {@code sourceId}: creates a part usage named {@code
   * partName}, a {@code DEFINITION} relationship from the usage to the target definition and a
   * composition or aggregation relationship from the source to the usage.
   *
   * @throws NotFoundException when the source or the target element does not exist
   */
  public OwnedUsageResult createComposition(
      String sourceId, String targetId, String partName, CompositionType compositionType) {
    ensureReady();
    requireText(sourceId, "sourceId");
    requireText(targetId, "targetId");
    requireText(partName, "partName");
    CompositionType type =
        compositionType != null ? compositionType : CompositionType.COMPOSITION;
    if (findElementNode(sourceId).isEmpty() || findElementNode(targetId).isEmpty()) {
      throw new NotFoundException(
          "Failed to create composition. Source or target not found.",
          Map.of("sourceId", sourceId, "targetId", targetId));
    }

    String partUsageId = sourceId + "-part-" + clock.millis();
    String definitionRelId = partUsageId + "-definition-" + targetId;
    String compositionRelId = sourceId + "-" + type.edgeKind() + "-" + partUsageId;
    createOwnedUsage(
        "part-usage", partUsageId, partName, targetId, definitionRelId, type, sourceId,
        compositionRelId);
    log.debug("Created {} {} of {} -> {}", type.edgeKind(), partUsageId, sourceId, targetId);
    return new OwnedUsageResult(partUsageId, definitionRelId, compositionRelId);
  }

  /** Remove a part usage created by {@link #createComposition} with its relationships. */
  public boolean deleteComposition(String partUsageId) {
    return deleteUsage(partUsageId, PART_USAGE_LABEL);
  }

  /**
   * Add a state to a state machine: creates a state usage named {@code stateName}, a {@code
   * DEFINITION} relationship to the state definition and a composition from the state machine.
   *
   * @throws NotFoundException when the state machine or the state definition does not exist
   */
  public OwnedUsageResult createStateInStateMachine(
      String stateMachineId, String stateDefinitionId, String stateName) {
    ensureReady();
    requireText(stateMachineId, "stateMachineId");
    requireText(stateDefinitionId, "stateDefinitionId");
    requireText(stateName, "stateName");
    if (findElementNode(stateMachineId).isEmpty()
        || findElementNode(stateDefinitionId).isEmpty()) {
      throw new NotFoundException(
          "Failed to create state in state machine. State machine or state definition not found.",
          Map.of("stateMachineId", stateMachineId, "stateDefinitionId", stateDefinitionId));
    }

    String stateUsageId = stateMachineId + "-state-" + clock.millis();
    String definitionRelId = stateUsageId + "-definition-" + stateDefinitionId;
    String compositionRelId = stateMachineId + "-composition-" + stateUsageId;
    createOwnedUsage(
        "state-usage",
        stateUsageId,
        stateName,
        stateDefinitionId,
        definitionRelId,
        CompositionType.COMPOSITION,
        stateMachineId,
        compositionRelId);
    return new OwnedUsageResult(stateUsageId, definitionRelId, compositionRelId);
  }

  /** Remove a state usage created by {@link #createStateInStateMachine} with its relationships. */
  public boolean deleteStateFromStateMachine(String stateUsageId) {
    return deleteUsage(stateUsageId, STATE_USAGE_LABEL);
  }

  private void createOwnedUsage(
      String usageKind,
      String usageId,
      String usageName,
      String definitionId,
      String definitionRelId,
      CompositionType ownership,
      String ownerId,
      String ownershipRelId) {
    GraphProperties usageProps = PropertyCodec.encode(new ElementSpec(usageId, usageName));
    stamp(usageProps, true);
    driver.createNode(SysmlNode.element(usageKind, usageProps));

    GraphProperties defProps = new GraphProperties().putText(PropertyCodec.ID, definitionRelId);
    stamp(defProps, true);
    driver.createEdge(
        SysmlEdge.relationship(definitionRelId, "definition", usageId, definitionId, defProps));

    GraphProperties ownProps = new GraphProperties().putText(PropertyCodec.ID, ownershipRelId);
    stamp(ownProps, true);
    driver.createEdge(
        SysmlEdge.relationship(ownershipRelId, ownership.edgeKind(), ownerId, usageId, ownProps));
  }

  private boolean deleteUsage(String usageId, String label) {
    ensureReady();
    Optional<SysmlNode> usage = driver.findNode(usageId).filter(n -> n.hasLabel(label));
    if (usage.isEmpty()) {
      log.debug("No {} with id {}; nothing to delete", label, usageId);
      return false;
    }
    return driver.deleteNode(usageId);
  }

  // ---------------------------------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------------------------------

  private Optional<SysmlNode> findElementNode(String id) {
    if (id == null) return Optional.empty();
    return driver.findNode(id).filter(SysmlNode::isElement);
  }

  private boolean isElement(String id) {
    return findElementNode(id).isPresent();
  }

  private void stamp(GraphProperties props, boolean created) {
    if (!settings.timestamps()) return;
    String now = Instant.now(clock).toString();
    if (created) props.putText(PropertyCodec.CREATED_AT, now);
    props.putText(PropertyCodec.UPDATED_AT, now);
  }

  private void checkNodeKind(String kind) {
    checkKind(kind, ViewpointRegistry.isKnownNodeKind(kind), "element kind");
  }

  private void checkEdgeKind(String kind) {
    checkKind(kind, ViewpointRegistry.isKnownEdgeKind(kind), "relationship type");
  }

  private void checkKind(String kind, boolean known, String what) {
    if (!KindTranslator.isWellFormedKind(kind)) {
      throw new ValidationException(
          "Invalid " + what + " '" + kind + "': expected lowercase words joined by hyphens",
          Map.of("kind", String.valueOf(kind)));
    }
    if (known) return;
    if (settings.strictKinds()) {
      throw new ValidationException(
          "Unknown " + what + " '" + kind + "'", Map.of("kind", kind));
    }
    log.warn("{} '{}' is not listed by any viewpoint", what, kind);
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isEmpty()) {
      throw new ValidationException("'" + field + "' is required", Map.of("field", field));
    }
  }

  private void ensureReady() {
    if (!driver.isInitialized()) driver.initialize();
  }
}
