package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class LoadIssue {
    @JsonProperty("type")
    private final IssueType type;
    @JsonProperty("source")
    private final String source;
    @JsonProperty("message")
    private final String message;

    public LoadIssue(IssueType type, String source, String message) {
        this.type = type;
        this.source = source;
        this.message = message;
    }

    public IssueType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LoadIssue loadIssue = (LoadIssue) o;
        return type == loadIssue.type && Objects.equals(source, loadIssue.source) && Objects.equals(message, loadIssue.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, source, message);
    }

    @Override
    public String toString() {
        return type + " [" + source + "]: " + message;
    }
}
