package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An object property assertion between two individuals, given by their local names.
 */
public class ImportAssertion {
    @JsonProperty("subject")
    public String subject;
    @JsonProperty("predicate")
    public String predicate;
    @JsonProperty("predicateIri")
    public String predicateIri;
    @JsonProperty("object")
    public String object;

    public ImportAssertion(String subject, String predicate, String object) {
        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
    }

    public ImportAssertion(String subject, String predicate, String predicateIri, String object) {
        this(subject, predicate, object);
        this.predicateIri = predicateIri;
    }

    @Override
    public String toString() {
        return subject + " -" + predicate + "-> " + object;
    }
}
