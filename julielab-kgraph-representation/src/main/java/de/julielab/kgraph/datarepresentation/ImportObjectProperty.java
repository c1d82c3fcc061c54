package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ImportObjectProperty {
    @JsonProperty("name")
    public String name;
    @JsonProperty("iri")
    public String iri;
    @JsonProperty("domain")
    public String domain;
    @JsonProperty("range")
    public String range;

    public ImportObjectProperty(String name, String iri) {
        this.name = name;
        this.iri = iri;
    }

    @Override
    public String toString() {
        return "ImportObjectProperty{" + "name='" + name + '\'' + ", domain='" + domain + '\'' + ", range='" + range + '\'' + '}';
    }
}
