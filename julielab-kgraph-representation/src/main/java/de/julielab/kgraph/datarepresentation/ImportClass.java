package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A class declaration read from an ontology source. Classes are kept for reference only, they do not become
 * entities.
 */
public class ImportClass {
    @JsonProperty("name")
    public String name;
    @JsonProperty("iri")
    public String iri;
    @JsonProperty("superClasses")
    public List<String> superClasses = new ArrayList<>();

    public ImportClass(String name, String iri) {
        this.name = name;
        this.iri = iri;
    }

    @Override
    public String toString() {
        return "ImportClass{" + "name='" + name + '\'' + ", superClasses=" + superClasses + '}';
    }
}
