package de.julielab.kgraph.annotations;

import de.julielab.kgraph.datarepresentation.AnnotationMapping;
import de.julielab.kgraph.datarepresentation.Entity;
import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.LoadIssue;
import de.julielab.kgraph.datarepresentation.PropertyValue;
import de.julielab.kgraph.graph.GraphStore;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

public class AnnotationApplierTest {

    private GraphStore store;
    private AnnotationApplier applier;

    @Before
    public void setup() {
        store = new GraphStore();
        store.upsertEntity("Diabetes", "Disease", Map.of("icdCode", "E11"), "healthcare.owl");
        store.upsertEntity("InsulinTherapy", "Treatment", null, "healthcare.owl");
        applier = new AnnotationApplier(store);
    }

    private static PropertyValue value(Object value) {
        return PropertyValue.of(value, null);
    }

    @Test
    public void testAnnotationsDoNotOverrideExplicitProperties() {
        AnnotationMapping mapping = new AnnotationMapping("annotations.xlsx");
        mapping.put("Diabetes", "severity", value("chronic"));
        mapping.put("Diabetes", "icdCode", value("E10"));
        AnnotationReport report = applier.apply(mapping);

        assertThat(report.numMatchedKeys).isEqualTo(1);
        assertThat(report.numAppliedFields).isEqualTo(1);
        assertThat(report.numSkippedFields).isEqualTo(1);
        assertThat(report.getIssues()).isEmpty();

        Entity diabetes = store.findByName("Diabetes").orElseThrow();
        assertThat(diabetes.getAnnotation("severity").orElseThrow().getValue()).isEqualTo("chronic");
        assertThat(diabetes.getAnnotation("severity").orElseThrow().getSource()).isEqualTo("annotations.xlsx");
        assertThat(diabetes.getEffectiveValue("icdCode").orElseThrow().getValue()).isEqualTo("E11");
        assertThat(diabetes.getAnnotations()).doesNotContainKey("icdCode");
        assertThat(diabetes.getSources()).containsExactly("healthcare.owl", "annotations.xlsx");
    }

    @Test
    public void testLaterAnnotationSourcesOverrideEarlierOnes() {
        AnnotationMapping first = new AnnotationMapping("a.xlsx");
        first.put("Diabetes", "severity", value("mild"));
        applier.apply(first);
        AnnotationMapping second = new AnnotationMapping("b.xlsx");
        second.put("Diabetes", "severity", value("chronic"));
        applier.apply(second);

        assertThat(store.findByName("Diabetes").orElseThrow().getAnnotation("severity").orElseThrow())
                .extracting(PropertyValue::getValue, PropertyValue::getSource)
                .containsExactly("chronic", "b.xlsx");
    }

    @Test
    public void testKeyMatching() {
        AnnotationMapping mapping = new AnnotationMapping("annotations.xlsx");
        mapping.put("insulintherapy", "route", value("subcutaneous"));
        mapping.put("  DIABETES ", "chronic", value(true));
        mapping.put("Asthma", "severity", value("mild"));
        AnnotationReport report = applier.apply(mapping);

        assertThat(report.numMatchedKeys).isEqualTo(2);
        assertThat(report.numUnmatchedKeys).isEqualTo(1);
        assertThat(report.getIssues()).extracting(LoadIssue::getType).containsExactly(IssueType.UNMATCHED_ANNOTATION);
        assertThat(report.getIssues().get(0).getMessage()).contains("Asthma");
        assertThat(store.findByName("InsulinTherapy").orElseThrow().getAnnotation("route")).isPresent();
        assertThat(store.findByName("Diabetes").orElseThrow().getAnnotation("chronic").orElseThrow().getValue()).isEqualTo(true);
        assertThat(store.getNumEntities()).isEqualTo(2);
    }

    @Test
    public void testUnkeyedSheetsAreReported() {
        AnnotationMapping mapping = new AnnotationMapping("annotations.xlsx");
        mapping.addUnkeyedSheet("Notes");
        AnnotationReport report = applier.apply(mapping);
        assertThat(report.getIssues()).extracting(LoadIssue::getType).containsExactly(IssueType.UNKEYED_SHEET);
        assertThat(report.getIssues().get(0).getMessage()).contains("Notes");
    }

    @Test
    public void testMissingDependency() {
        AnnotationReport report = applier.apply(AnnotationMapping.dependencyMissing("annotations.xlsx"));
        assertThat(report.getIssues()).extracting(LoadIssue::getType, LoadIssue::getSource)
                .containsExactly(tuple(IssueType.DEPENDENCY_MISSING, "annotations.xlsx"));
        assertThat(report.numMatchedKeys).isZero();
    }
}
