package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * An individual as read from an ontology source. The <tt>name</tt> is the local name of the individual's IRI and
 * serves as the external key of the entity created from it.
 * </p>
 * <p>
 * An individual is <tt>declared</tt> if the source types it, e.g. as <tt>owl:NamedIndividual</tt> or through a
 * typed node element. Undeclared individuals only collect literal assertions made about individuals declared
 * somewhere else.
 * </p>
 */
public class ImportIndividual {
    @JsonProperty("name")
    public String name;
    @JsonProperty("iri")
    public String iri;
    @JsonProperty("classTags")
    public List<String> classTags = new ArrayList<>();
    @JsonProperty("literals")
    public Map<String, PropertyValue> literals = new LinkedHashMap<>();
    @JsonProperty("declared")
    public boolean declared;

    public ImportIndividual(String name, String iri) {
        this.name = name;
        this.iri = iri;
    }

    public void addClassTag(String classTag) {
        if (classTag != null && !classTags.contains(classTag))
            classTags.add(classTag);
    }

    /**
     * @return The first class tag or null if the individual has none.
     */
    public String getPrimaryType() {
        return classTags.isEmpty() ? null : classTags.get(0);
    }

    @Override
    public String toString() {
        return "ImportIndividual{" +
                "name='" + name + '\'' +
                ", classTags=" + classTags +
                ", literals=" + literals +
                ", declared=" + declared +
                '}';
    }
}
