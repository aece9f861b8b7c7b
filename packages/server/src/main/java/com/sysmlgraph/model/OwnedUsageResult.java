package com.sysmlgraph.model;

/**
 * Ids produced when a usage is created inside its owner.
 *
 * @param usageId id of the new part or state usage node
 * @param definitionRelId id of the usage's {@code DEFINITION} relationship
 * @param compositionRelId id of the owner's {@code COMPOSITION}/{@code AGGREGATION} relationship
 */
public record OwnedUsageResult(String usageId, String definitionRelId, String compositionRelId) {}
