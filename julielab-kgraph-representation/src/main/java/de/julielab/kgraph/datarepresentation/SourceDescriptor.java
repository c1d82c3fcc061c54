package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * <p>
 * The intermediate representation of one ontology source. It is produced by parsing a single file and consumed by
 * merging it into a graph store. A descriptor is never persisted.
 * </p>
 * <p>
 * Individuals are keyed by their local name and keep the order in which they first appeared in the source.
 * </p>
 */
public class SourceDescriptor {
    @JsonProperty("sourceName")
    public String sourceName;
    @JsonProperty("namespaces")
    public Map<String, String> namespaces = new LinkedHashMap<>();
    @JsonProperty("classes")
    public Map<String, ImportClass> classes = new LinkedHashMap<>();
    @JsonProperty("objectProperties")
    public Map<String, ImportObjectProperty> objectProperties = new LinkedHashMap<>();
    @JsonProperty("individuals")
    public Map<String, ImportIndividual> individuals = new LinkedHashMap<>();
    @JsonProperty("assertions")
    public List<ImportAssertion> assertions = new ArrayList<>();

    public SourceDescriptor(String sourceName) {
        this.sourceName = sourceName;
    }

    public ImportIndividual getOrCreateIndividual(String name, String iri) {
        ImportIndividual individual = individuals.get(name);
        if (individual == null) {
            individual = new ImportIndividual(name, iri);
            individuals.put(name, individual);
        } else if (individual.iri == null) {
            individual.iri = iri;
        }
        return individual;
    }

    @JsonIgnore
    public List<ImportIndividual> getDeclaredIndividuals() {
        return individuals.values().stream().filter(i -> i.declared).collect(Collectors.toList());
    }

    public void addAssertion(ImportAssertion assertion) {
        assertions.add(assertion);
    }

    @Override
    public String toString() {
        return "SourceDescriptor{" +
                "sourceName='" + sourceName + '\'' +
                ", classes=" + classes.size() +
                ", objectProperties=" + objectProperties.size() +
                ", individuals=" + individuals.size() +
                ", assertions=" + assertions.size() +
                '}';
    }
}
