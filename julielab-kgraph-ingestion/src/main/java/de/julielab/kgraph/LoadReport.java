package de.julielab.kgraph;

import de.julielab.kgraph.annotations.AnnotationReport;
import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.LoadIssue;
import de.julielab.kgraph.graph.MergeReport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of one load batch: the reports of the merged ontology sources and applied annotation sources, the
 * files that were skipped and all issues in the order they occurred.
 */
public class LoadReport {
	private final List<MergeReport> mergeReports = new ArrayList<>();
	private final List<AnnotationReport> annotationReports = new ArrayList<>();
	private final List<Path> loadedFiles = new ArrayList<>();
	private final List<Path> skippedFiles = new ArrayList<>();
	private final List<LoadIssue> issues = new ArrayList<>();
	private LoaderState finalState;

	void addMergeReport(Path file, MergeReport report) {
		mergeReports.add(report);
		loadedFiles.add(file);
		issues.addAll(report.getIssues());
	}

	void addAnnotationReport(Path file, AnnotationReport report) {
		annotationReports.add(report);
		loadedFiles.add(file);
		issues.addAll(report.getIssues());
	}

	void addSkippedFile(Path file, LoadIssue issue) {
		skippedFiles.add(file);
		issues.add(issue);
	}

	void addIssue(LoadIssue issue) {
		issues.add(issue);
	}

	void setFinalState(LoaderState finalState) {
		this.finalState = finalState;
	}

	public List<MergeReport> getMergeReports() {
		return Collections.unmodifiableList(mergeReports);
	}

	public List<AnnotationReport> getAnnotationReports() {
		return Collections.unmodifiableList(annotationReports);
	}

	/**
	 * @return The files that were read successfully, in the order they were processed.
	 */
	public List<Path> getLoadedFiles() {
		return Collections.unmodifiableList(loadedFiles);
	}

	public List<Path> getSkippedFiles() {
		return Collections.unmodifiableList(skippedFiles);
	}

	public List<LoadIssue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public List<LoadIssue> getIssues(IssueType type) {
		return issues.stream().filter(i -> i.getType() == type).collect(Collectors.toList());
	}

	public LoaderState getFinalState() {
		return finalState;
	}

	public boolean hasIssues() {
		return !issues.isEmpty();
	}

	@Override
	public String toString() {
		return "LoadReport{" +
				"loadedFiles=" + loadedFiles.size() +
				", skippedFiles=" + skippedFiles.size() +
				", issues=" + issues.size() +
				", finalState=" + finalState +
				'}';
	}
}
