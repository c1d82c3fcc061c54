package de.julielab.kgraph.datarepresentation;

import de.julielab.kgraph.datarepresentation.util.GraphJsonSerializer;
import org.junit.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class EntityTest {

    @Test
    public void testAnnotationsDoNotOverrideExplicitProperties() {
        Entity entity = new Entity("ent0", "john", "Patient", "John");
        entity.mergeProperties(Map.of("age", PropertyValue.of(45, "onto.owl")));
        Set<String> rejected = entity.mergeAnnotations(Map.of("age", PropertyValue.of(99, "ann.xlsx"),
                "riskLevel", PropertyValue.of("high", "ann.xlsx")));

        assertThat(rejected).containsExactly("age");
        assertThat(entity.getEffectiveValue("age")).hasValueSatisfying(v -> assertThat(v.getValue()).isEqualTo(45L));
        assertThat(entity.getEffectiveValue("riskLevel")).hasValueSatisfying(v -> assertThat(v.getValue()).isEqualTo("high"));
        assertThat(entity.getEffectiveValue("unknown")).isEmpty();
    }

    @Test
    public void testCopyIsIndependent() {
        Entity entity = new Entity("ent0", "john", null, "John");
        assertThat(entity.getType()).isEqualTo("Entity");
        Entity copy = entity.copy();
        copy.setProperty("age", PropertyValue.of(1, "api"));
        copy.setType("Patient");
        copy.addSource("api");
        assertThat(entity.getProperties()).isEmpty();
        assertThat(entity.getType()).isEqualTo("Entity");
        assertThat(entity.getSources()).isEmpty();
    }

    @Test
    public void testJson() {
        Entity entity = new Entity("ent3", "diabetes", "Disease", "Diabetes");
        entity.addSource("onto.owl");
        String json = GraphJsonSerializer.toJson(entity);
        assertThat(json).startsWith("{\"id\":\"ent3\",\"externalKey\":\"diabetes\",\"type\":\"Disease\",\"name\":\"Diabetes\"");
        assertThat(json).contains("\"sources\":[\"onto.owl\"]");
        // empty bags are left out
        assertThat(json).doesNotContain("annotations");
    }
}
