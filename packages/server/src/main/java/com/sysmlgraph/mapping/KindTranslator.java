package com.sysmlgraph.mapping;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Translates kebab-case element and relationship kinds to the naming conventions of the graph
 * store and back.
 *
 * <p>Node kinds become PascalCase labels ({@code part-definition} -> {@code PartDefinition}),
 * edge kinds become SCREAMING_SNAKE_CASE relationship types ({@code control-flow} -> {@code
 * CONTROL_FLOW}). Every method is total: input that does not follow the convention produces a
 * string without complaint, so callers restrict kinds to those published by the viewpoint
 * registry before relying on a round trip.
 */
public final class KindTranslator {

  /** Label carried by every element node in addition to its kind-specific label. */
  public static final String ELEMENT_LABEL = "SysMLElement";

  private static final String DEFINITION_SUFFIX = "-definition";
  private static final String USAGE_SUFFIX = "-usage";
  private static final Pattern KEBAB_CASE = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

  private KindTranslator() {}

  /** {@code part-definition} -> {@code PartDefinition}. */
  public static String kindToLabel(String kind) {
    StringBuilder sb = new StringBuilder(kind.length());
    for (String segment : kind.split("-", -1)) {
      if (segment.isEmpty()) continue;
      sb.append(Character.toUpperCase(segment.charAt(0))).append(segment, 1, segment.length());
    }
    return sb.toString();
  }

  /** {@code PartDefinition} -> {@code part-definition}. */
  public static String labelToNodeKind(String label) {
    StringBuilder sb = new StringBuilder(label.length() + 4);
    for (int i = 0; i < label.length(); i++) {
      char c = label.charAt(i);
      if (Character.isUpperCase(c)) {
        sb.append('-').append(Character.toLowerCase(c));
      } else {
        sb.append(c);
      }
    }
    // the hyphen inserted ahead of the leading capital
    if (sb.length() > 0 && sb.charAt(0) == '-') {
      sb.deleteCharAt(0);
    }
    return sb.toString();
  }

  /** {@code control-flow} -> {@code CONTROL_FLOW}. */
  public static String edgeKindToRelType(String kind) {
    return kind.replace('-', '_').toUpperCase(Locale.ROOT);
  }

  /** {@code CONTROL_FLOW} -> {@code control-flow}. */
  public static String relTypeToEdgeKind(String relType) {
    return relType.replace('_', '-').toLowerCase(Locale.ROOT);
  }

  /** Generic label first, kind-specific label second. */
  public static List<String> getNodeLabels(String kind) {
    return List.of(ELEMENT_LABEL, kindToLabel(kind));
  }

  public static Optional<ElementKind> getElementKind(String kind) {
    if (kind.endsWith(DEFINITION_SUFFIX)) {
      return Optional.of(ElementKind.DEFINITION);
    }
    if (kind.endsWith(USAGE_SUFFIX)) {
      return Optional.of(ElementKind.USAGE);
    }
    return Optional.empty();
  }

  /** Lowercase alphanumeric words joined by single hyphens. */
  public static boolean isWellFormedKind(String kind) {
    return kind != null && KEBAB_CASE.matcher(kind).matches();
  }
}
