package de.julielab.kgraph.graph;

import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.LoadIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The outcome of merging one source descriptor into a graph store.
 */
public class MergeReport {
	/**
	 * Identifiers of the relationships created or confirmed during this merge. It is used to tell apart an
	 * assertion stated twice within the same source from an assertion that was already in the graph before.
	 */
	public final Set<String> createdRelationshipsCache = new HashSet<>();
	public final String sourceName;
	public int numEntitiesCreated = 0;
	public int numEntitiesUpdated = 0;
	public int numRelationshipsCreated = 0;
	/**
	 * Assertions resolving to a relationship that already existed before the merge.
	 */
	public int numRelationshipsExisting = 0;
	/**
	 * Assertions stated more than once in the merged source.
	 */
	public int numDuplicateAssertions = 0;
	/**
	 * Literal values of individuals that are neither declared in the source nor known to the graph.
	 */
	public int numLiteralsSkipped = 0;
	private final List<LoadIssue> issues = new ArrayList<>();

	public MergeReport(String sourceName) {
		this.sourceName = sourceName;
	}

	public void addIssue(IssueType type, String message) {
		issues.add(new LoadIssue(type, sourceName, message));
	}

	public List<LoadIssue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public long getNumIssues(IssueType type) {
		return issues.stream().filter(i -> i.getType() == type).count();
	}

	public void addCreatedRelationship(String type, String sourceId, String targetId) {
		createdRelationshipsCache.add(getRelationshipIdentifier(type, sourceId, targetId));
	}

	public boolean relationshipAlreadyWasCreated(String type, String sourceId, String targetId) {
		return createdRelationshipsCache.contains(getRelationshipIdentifier(type, sourceId, targetId));
	}

	static String getRelationshipIdentifier(String type, String sourceId, String targetId) {
		return sourceId + "-" + type + "->" + targetId;
	}

	@Override
	public String toString() {
		return "MergeReport{" +
				"sourceName='" + sourceName + '\'' +
				", numEntitiesCreated=" + numEntitiesCreated +
				", numEntitiesUpdated=" + numEntitiesUpdated +
				", numRelationshipsCreated=" + numRelationshipsCreated +
				", numRelationshipsExisting=" + numRelationshipsExisting +
				", numDuplicateAssertions=" + numDuplicateAssertions +
				", numLiteralsSkipped=" + numLiteralsSkipped +
				", issues=" + issues.size() +
				'}';
	}
}
