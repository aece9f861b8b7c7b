package com.sysmlgraph.viewpoint;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed catalog of the SysML v2 viewpoints offered to clients.
 *
 * <p>The catalog is built when the class is initialized and never changes afterwards; every
 * accessor returns immutable values, so the registry can be read from any thread without
 * synchronization. Unknown viewpoint ids are not errors: lookups return empty results.
 */
public final class ViewpointRegistry {

  public static final Viewpoint STRUCTURAL_DEFINITION =
      new Viewpoint(
          "sysml.structuralDefinition",
          "Structural Definition Viewpoint",
          "Focuses on part/action/port/item definitions and the specialization chains that tie"
              + " them together.",
          List.of(
              "part-definition",
              // part usages are the intermediate nodes of compositions
              "part-usage",
              "action-definition",
              "port-definition",
              "item-definition",
              "attribute-definition",
              "connection-definition",
              "constraint-definition",
              "calculation-definition"),
          List.of(
              "specialization",
              "definition",
              "dependency",
              "flow-connection",
              "composition",
              "aggregation"));

  public static final Viewpoint USAGE_STRUCTURE =
      new Viewpoint(
          "sysml.usageStructure",
          "Usage Structure Viewpoint",
          "Shows part, port, action, and item usages mapped back to their definitions.",
          List.of("part-usage", "port-usage", "action-usage", "item-usage"),
          List.of(
              "definition",
              "dependency",
              "allocate",
              "action-flow",
              "flow-connection",
              "composition",
              "aggregation"));

  public static final Viewpoint BEHAVIOR_CONTROL =
      new Viewpoint(
          "sysml.behaviorControl",
          "Behavior & Control Viewpoint",
          "Captures actions and control nodes with succession (temporal ordering), action flows,"
              + " item flows, and their definitions as specified in SysML v2.",
          List.of("action-definition", "action-usage", "activity-control", "perform-action"),
          List.of(
              "definition",
              "succession",
              "succession-as-usage",
              "action-flow",
              "item-flow",
              "dependency"));

  public static final Viewpoint INTERACTION =
      new Viewpoint(
          "sysml.interaction",
          "Interaction Viewpoint",
          "Sequence lifelines and messages for interaction scenarios.",
          List.of("sequence-lifeline"),
          List.of("message"));

  public static final Viewpoint STATE =
      new Viewpoint(
          "sysml.state",
          "State Viewpoint",
          "State machines, state definitions/usages, transitions, and actions.",
          List.of(
              "state-machine", "state-definition", "state-usage", "action-definition", "action-usage"),
          List.of("transition", "composition", "aggregation", "definition"));

  public static final Viewpoint REQUIREMENT =
      new Viewpoint(
          "sysml.requirement",
          "Requirement Viewpoint",
          "Requirement definitions and usages with satisfy/refine/verify relationships.",
          List.of("requirement-definition", "requirement-usage"),
          List.of("satisfy", "refine", "verify", "dependency"));

  public static final Viewpoint USE_CASE =
      new Viewpoint(
          "sysml.useCase",
          "Use Case Viewpoint",
          "Use case definitions and usages with actors, includes, and extends relationships as"
              + " described in SysML v2.",
          List.of("use-case-definition", "use-case-usage"),
          List.of("include", "extend", "dependency", "definition"));

  private static final List<Viewpoint> ALL =
      List.of(
          STRUCTURAL_DEFINITION,
          USAGE_STRUCTURE,
          BEHAVIOR_CONTROL,
          INTERACTION,
          STATE,
          REQUIREMENT,
          USE_CASE);

  private static final Set<String> NODE_KINDS = collectNodeKinds();
  private static final Set<String> EDGE_KINDS = collectEdgeKinds();

  private ViewpointRegistry() {}

  /** Every viewpoint, in presentation order. */
  public static List<Viewpoint> all() {
    return ALL;
  }

  public static Optional<Viewpoint> getViewpointById(String id) {
    if (id == null) return Optional.empty();
    for (Viewpoint vp : ALL) {
      if (vp.id().equals(id)) return Optional.of(vp);
    }
    return Optional.empty();
  }

  /** Kinds of the viewpoint, or {@link ViewpointTypes#EMPTY} when the id is unknown. */
  public static ViewpointTypes getAvailableTypesForViewpoint(String id) {
    return getViewpointById(id)
        .map(vp -> new ViewpointTypes(vp.includeNodeKinds(), vp.includeEdgeKinds()))
        .orElse(ViewpointTypes.EMPTY);
  }

  /** Whether any viewpoint lists the node kind. */
  public static boolean isKnownNodeKind(String kind) {
    return kind != null && NODE_KINDS.contains(kind);
  }

  /** Whether any viewpoint lists the edge kind. */
  public static boolean isKnownEdgeKind(String kind) {
    return kind != null && EDGE_KINDS.contains(kind);
  }

  private static Set<String> collectNodeKinds() {
    Set<String> kinds = new LinkedHashSet<>();
    ALL.forEach(vp -> kinds.addAll(vp.includeNodeKinds()));
    return Set.copyOf(kinds);
  }

  private static Set<String> collectEdgeKinds() {
    Set<String> kinds = new LinkedHashSet<>();
    ALL.forEach(vp -> kinds.addAll(vp.includeEdgeKinds()));
    return Set.copyOf(kinds);
  }
}
