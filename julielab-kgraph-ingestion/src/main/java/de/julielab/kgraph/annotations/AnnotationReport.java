package de.julielab.kgraph.annotations;

import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.LoadIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of applying one annotation mapping to a graph store.
 */
public class AnnotationReport {
	public final String sourceName;
	public int numMatchedKeys = 0;
	public int numUnmatchedKeys = 0;
	/**
	 * Annotation fields written to entity annotations.
	 */
	public int numAppliedFields = 0;
	/**
	 * Annotation fields not written because the entity has an explicit property with the same key.
	 */
	public int numSkippedFields = 0;
	private final List<LoadIssue> issues = new ArrayList<>();

	public AnnotationReport(String sourceName) {
		this.sourceName = sourceName;
	}

	public void addIssue(IssueType type, String message) {
		issues.add(new LoadIssue(type, sourceName, message));
	}

	public List<LoadIssue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	@Override
	public String toString() {
		return "AnnotationReport{" +
				"sourceName='" + sourceName + '\'' +
				", numMatchedKeys=" + numMatchedKeys +
				", numUnmatchedKeys=" + numUnmatchedKeys +
				", numAppliedFields=" + numAppliedFields +
				", numSkippedFields=" + numSkippedFields +
				'}';
	}
}
