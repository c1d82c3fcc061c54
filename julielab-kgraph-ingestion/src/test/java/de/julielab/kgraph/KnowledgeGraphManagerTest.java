package de.julielab.kgraph;

import de.julielab.kgraph.datarepresentation.Direction;
import de.julielab.kgraph.datarepresentation.Entity;
import de.julielab.kgraph.datarepresentation.GraphStatistics;
import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.LoadIssue;
import de.julielab.kgraph.datarepresentation.RelatedEntity;
import de.julielab.kgraph.datarepresentation.Relationship;
import de.julielab.kgraph.datarepresentation.SourceDescriptor;
import de.julielab.kgraph.graph.DanglingReferenceException;
import de.julielab.kgraph.graph.GraphIntegrityException;
import de.julielab.kgraph.graph.GraphStore;
import de.julielab.kgraph.graph.MergeReport;
import de.julielab.kgraph.options.IngestionOptions;
import de.julielab.kgraph.relations.RelationMapping;
import de.julielab.kgraph.relations.RelationVocabulary;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static de.julielab.kgraph.sources.WorkbookTestUtils.sheets;
import static de.julielab.kgraph.sources.WorkbookTestUtils.writeWorkbook;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class KnowledgeGraphManagerTest {
    private static final Path ONTOLOGIES = Paths.get("src/test/resources/ontologies");
    private static final Path HEALTHCARE = ONTOLOGIES.resolve("healthcare.owl");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path writeOntology(String fileName, String individual, String severity) throws IOException {
        String owl = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
                "<rdf:RDF xmlns:rdf=\"http://www.w3.org/1999/02/22-rdf-syntax-ns#\"\n" +
                "         xmlns:owl=\"http://www.w3.org/2002/07/owl#\"\n" +
                "         xmlns:hc=\"http://example.org/healthcare#\">\n" +
                "    <owl:NamedIndividual rdf:about=\"http://example.org/healthcare#" + individual + "\">\n" +
                "        <rdf:type rdf:resource=\"http://example.org/healthcare#Disease\"/>\n" +
                "        <hc:severity>" + severity + "</hc:severity>\n" +
                "    </owl:NamedIndividual>\n" +
                "</rdf:RDF>\n";
        Path file = folder.getRoot().toPath().resolve(fileName);
        Files.writeString(file, owl);
        return file;
    }

    private Path writeAnnotations(String fileName) throws IOException {
        return writeAnnotations(folder.getRoot().toPath().resolve(fileName));
    }

    private static Path writeAnnotations(Path file) throws IOException {
        Map<String, Object[][]> sheets = sheets();
        sheets.put("Diseases", new Object[][]{
                {"name", "severity", "icdCode"},
                {"Diabetes", "chronic", "E10"},
                {"Asthma", "mild", null}
        });
        return writeWorkbook(file, sheets);
    }

    @Test
    public void testLoadHealthcareOntology() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        assertThat(manager.getState()).isEqualTo(LoaderState.EMPTY);
        LoadReport report = manager.loadOntologies(HEALTHCARE);

        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        assertThat(report.getFinalState()).isEqualTo(LoaderState.READY);
        assertThat(report.hasIssues()).isFalse();
        assertThat(report.getLoadedFiles()).containsExactly(HEALTHCARE);

        GraphStatistics stats = manager.stats();
        assertThat(stats.getTotalEntities()).isEqualTo(2);
        assertThat(stats.getTotalRelationships()).isEqualTo(1);
        assertThat(stats.getRelationshipCount("treatsDisease")).isEqualTo(1);

        Entity insulin = manager.findByName("InsulinTherapy").orElseThrow();
        assertThat(insulin.getType()).isEqualTo("Treatment");
        assertThat(insulin.getProperty("dosageUnits").orElseThrow().getValue()).isEqualTo(10L);
        List<RelatedEntity> related = manager.getRelated(insulin.getId(), Collections.singleton("treatsDisease"), Direction.OUTGOING);
        assertThat(related).extracting(r -> r.getEntity().getName()).containsExactly("Diabetes");
    }

    @Test
    public void testPropertiesOfSeveralSourcesAreUnited() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        manager.loadOntologies(ONTOLOGIES.resolve("patients-b.owl"), ONTOLOGIES.resolve("patients-a.owl"));

        assertThat(manager.stats().getTotalEntities()).isEqualTo(1);
        Entity patient = manager.findByName("Patient1").orElseThrow();
        assertThat(patient.getType()).isEqualTo("Patient");
        assertThat(patient.getProperties()).containsKeys("age", "gender", "bloodType", "smoker");
        assertThat(patient.getProperty("age").orElseThrow().getValue()).isEqualTo(45L);
        assertThat(patient.getProperty("smoker").orElseThrow().getValue()).isEqualTo(true);
        assertThat(patient.getSources()).containsExactly("patients-a.owl", "patients-b.owl");
        assertThat(manager.getLoadedSources()).containsExactly("patients-a.owl", "patients-b.owl");
    }

    @Test
    public void testQueryByType() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        manager.loadOntologies(HEALTHCARE, ONTOLOGIES.resolve("patients-a.owl"));
        assertThat(manager.query("Disease")).extracting(Entity::getName).containsExactly("Diabetes");
        assertThat(manager.query(null, null, Map.of("icdCode", "E11"))).extracting(Entity::getName).containsExactly("Diabetes");
        assertThat(manager.query("Patient", null, Map.of("age", 45.0))).hasSize(1);
        assertThat(manager.search("female", null)).extracting(Entity::getName).containsExactly("Patient1");
    }

    @Test
    public void testAnnotations() throws Exception {
        Path annotations = writeAnnotations("annotations.xlsx");
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.load(List.of(HEALTHCARE), List.of(annotations));

        Entity diabetes = manager.findByName("Diabetes").orElseThrow();
        assertThat(diabetes.getEffectiveValue("severity").orElseThrow().getValue()).isEqualTo("chronic");
        // the ontology value wins over the annotation
        assertThat(diabetes.getEffectiveValue("icdCode").orElseThrow().getValue()).isEqualTo("E11");
        assertThat(manager.stats().getTotalRelationships()).isEqualTo(1);
        assertThat(manager.stats().getTotalEntities()).isEqualTo(2);

        assertThat(report.getAnnotationReports()).hasSize(1);
        assertThat(report.getIssues()).extracting(LoadIssue::getType, LoadIssue::getSource)
                .containsExactly(tuple(IssueType.UNMATCHED_ANNOTATION, "annotations.xlsx"));
        assertThat(report.getLoadedFiles()).containsExactly(HEALTHCARE, annotations);
        assertThat(manager.getLoadedSources()).containsExactly("healthcare.owl", "annotations.xlsx");
    }

    @Test
    public void testAnnotationsAreAppliedAfterAllOntologies() throws Exception {
        Path annotations = writeAnnotations("a-annotations.xlsx");
        Path ontology = writeOntology("z-asthma.owl", "Asthma", "moderate");
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.load(List.of(ontology, HEALTHCARE), List.of(annotations));
        assertThat(report.getIssues()).isEmpty();
        Entity asthma = manager.findByName("Asthma").orElseThrow();
        assertThat(asthma.getProperty("severity").orElseThrow().getValue()).isEqualTo("moderate");
        assertThat(asthma.getAnnotations()).isEmpty();
    }

    @Test
    public void testDisabledAnnotationSupport() throws Exception {
        Path annotations = writeAnnotations("annotations.xlsx");
        KnowledgeGraphManager manager = new KnowledgeGraphManager(new IngestionOptions(false));
        LoadReport report = manager.load(List.of(HEALTHCARE), List.of(annotations));

        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        assertThat(report.getIssues()).extracting(LoadIssue::getType).containsExactly(IssueType.DEPENDENCY_MISSING);
        assertThat(manager.findByName("Diabetes").orElseThrow().getAnnotations()).isEmpty();
        assertThat(manager.stats().getTotalEntities()).isEqualTo(2);

        // no issue if there is nothing to read
        assertThat(manager.loadOntologies(HEALTHCARE).hasIssues()).isFalse();
    }

    @Test
    public void testLoadingTwiceChangesNothing() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        manager.loadOntologies(HEALTHCARE);
        String json = manager.exportGraphAsJson();
        LoadReport report = manager.loadOntologies(HEALTHCARE);

        assertThat(manager.stats().getTotalEntities()).isEqualTo(2);
        assertThat(manager.stats().getTotalRelationships()).isEqualTo(1);
        assertThat(report.getMergeReports().get(0).numEntitiesCreated).isZero();
        assertThat(report.getMergeReports().get(0).numRelationshipsExisting).isEqualTo(1);
        assertThat(manager.exportGraphAsJson()).isEqualTo(json);
    }

    @Test
    public void testSameFileTwiceInOneBatch() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.loadOntologies(HEALTHCARE, HEALTHCARE);
        assertThat(report.getMergeReports()).hasSize(1);
    }

    @Test
    public void testLoadOrderDoesNotMatter() throws Exception {
        Path first = writeOntology("a-diabetes.owl", "Diabetes", "mild");
        Path second = writeOntology("b-diabetes.owl", "Diabetes", "chronic");

        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        manager.loadOntologies(second, HEALTHCARE, first);
        KnowledgeGraphManager reversed = new KnowledgeGraphManager();
        reversed.loadOntologies(first, second, HEALTHCARE);

        // files are processed by name, the last one wins
        assertThat(manager.findByName("Diabetes").orElseThrow().getProperty("severity").orElseThrow().getValue())
                .isEqualTo("chronic");
        assertThat(manager.exportGraphAsJson()).isEqualTo(reversed.exportGraphAsJson());
        assertThat(manager.getLoadedSources()).containsExactly("a-diabetes.owl", "b-diabetes.owl", "healthcare.owl");
    }

    @Test
    public void testDanglingReference() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.loadOntologies(ONTOLOGIES.resolve("dangling.owl"));

        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        assertThat(manager.stats().getTotalRelationships()).isZero();
        assertThat(manager.findByName("Patient3")).isPresent();
        assertThat(report.getIssues(IssueType.DANGLING_REFERENCE)).hasSize(1);
        assertThat(report.getIssues()).hasSize(1);
        assertThat(manager.checkIntegrity()).isEmpty();
    }

    @Test
    public void testDanglingReferenceResolvedByEarlierSource() throws Exception {
        Path disease = writeOntology("a-unknown.owl", "UnknownDisease", "unknown");
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.loadOntologies(ONTOLOGIES.resolve("dangling.owl"), disease);
        assertThat(report.hasIssues()).isFalse();
        assertThat(manager.stats().getRelationshipCount("hasDisease")).isEqualTo(1);
    }

    @Test
    public void testBrokenFilesAreSkipped() {
        Path malformed = ONTOLOGIES.resolve("malformed.owl");
        Path notRdf = ONTOLOGIES.resolve("not-rdf.xml");
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.loadOntologies(malformed, HEALTHCARE, notRdf);

        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        assertThat(report.getSkippedFiles()).containsExactlyInAnyOrder(malformed, notRdf);
        assertThat(report.getIssues(IssueType.PARSE_ERROR)).extracting(LoadIssue::getSource)
                .containsExactlyInAnyOrder("malformed.owl", "not-rdf.xml");
        assertThat(report.getLoadedFiles()).containsExactly(HEALTHCARE);
        assertThat(manager.stats().getTotalEntities()).isEqualTo(2);
        assertThat(manager.getLoadedSources()).containsExactly("healthcare.owl");
    }

    @Test
    public void testLoadDirectory() throws Exception {
        Path dir = folder.newFolder("sources").toPath();
        Files.copy(HEALTHCARE, dir.resolve("healthcare.owl"));
        Files.copy(ONTOLOGIES.resolve("patients-a.owl"), dir.resolve("patients-a.owl"));
        Files.writeString(dir.resolve("notes.txt"), "not a source");
        Path sub = Files.createDirectory(dir.resolve("more"));
        Files.copy(ONTOLOGIES.resolve("patients-b.owl"), sub.resolve("patients-b.owl"));
        writeAnnotations(dir.resolve("annotations.xlsx"));

        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.loadDirectory(dir);
        assertThat(report.getLoadedFiles()).extracting(p -> p.getFileName().toString())
                .containsExactly("healthcare.owl", "patients-a.owl", "annotations.xlsx");
        assertThat(manager.findByName("Patient1").orElseThrow().getProperties()).doesNotContainKey("bloodType");

        IngestionOptions options = new IngestionOptions();
        options.recursive = true;
        KnowledgeGraphManager recursive = new KnowledgeGraphManager(options);
        recursive.loadDirectory(dir);
        assertThat(recursive.findByName("Patient1").orElseThrow().getProperties()).containsKey("bloodType");

        assertThatThrownBy(() -> manager.loadDirectory(dir.resolve("notes.txt"))).isInstanceOf(IOException.class);
    }

    @Test
    public void testCustomRelationMappings() throws Exception {
        IngestionOptions options = new IngestionOptions();
        options.relationMappings.add(new RelationMapping("hasDisease", "diagnosedWith"));
        KnowledgeGraphManager manager = new KnowledgeGraphManager(options);
        manager.loadOntologies(ONTOLOGIES.resolve("dangling.owl"), writeOntology("a-unknown.owl", "UnknownDisease", "x"));
        assertThat(manager.stats().getRelationshipsByType()).containsOnlyKeys("diagnosedWith");
    }

    @Test
    public void testWrites() throws Exception {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        manager.loadOntologies(HEALTHCARE);
        String patient = manager.addEntity("Patient", "Patient2", Map.of("age", 61));
        String diabetes = manager.findByName("Diabetes").orElseThrow().getId();
        String rel = manager.addRelationship("has_disease", patient, diabetes);
        assertThat(manager.addRelationship("hasDisease", patient, diabetes, Map.of("since", 2020))).isEqualTo(rel);

        assertThat(manager.getRelated(diabetes)).extracting(r -> r.getEntity().getName(), RelatedEntity::getDirection)
                .containsExactly(tuple("InsulinTherapy", Direction.INCOMING), tuple("Patient2", Direction.INCOMING));
        assertThat(manager.getRelated(diabetes, "hasDisease")).hasSize(1);
        assertThat(manager.getEntity(patient).orElseThrow().getSources()).containsExactly("api");

        assertThatThrownBy(() -> manager.addRelationship("hasDisease", patient, "ent404"))
                .isInstanceOf(DanglingReferenceException.class);

        assertThat(manager.removeEntity(diabetes)).isTrue();
        assertThat(manager.stats().getTotalRelationships()).isZero();
        assertThat(manager.removeRelationship(rel)).isFalse();
        assertThat(manager.checkIntegrity()).isEmpty();
        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
    }

    @Test
    public void testExportGraphAsJson() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        manager.loadOntologies(HEALTHCARE);
        String json = manager.exportGraphAsJson();
        assertThat(json).contains("\"name\":\"Diabetes\"", "\"type\":\"treatsDisease\"", "\"totalEntities\":2");
        Relationship relationship = manager.getStore().getRelationships().get(0);
        assertThat(json).contains("\"sourceId\":\"" + relationship.getSourceId() + "\"");
    }

    @Test
    public void testArgumentOrderOfLoadCalls() {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.load(Arrays.asList(ONTOLOGIES.resolve("patients-b.owl"), HEALTHCARE,
                ONTOLOGIES.resolve("patients-a.owl")), null);
        assertThat(report.getLoadedFiles()).extracting(p -> p.getFileName().toString())
                .containsExactly("healthcare.owl", "patients-a.owl", "patients-b.owl");
    }

    @Test
    public void testIntegrityViolationFailsTheManager() {
        GraphStore corrupted = new GraphStore(RelationVocabulary.createDefault()) {
            @Override
            public List<String> checkIntegrity() {
                return List.of("relationship rel1 points to the missing entity ent9");
            }
        };
        KnowledgeGraphManager manager = new KnowledgeGraphManager(new IngestionOptions(), corrupted);
        assertThatThrownBy(() -> manager.loadOntologies(HEALTHCARE)).isInstanceOf(GraphIntegrityException.class)
                .hasMessageContaining("ent9");
        assertThat(manager.getState()).isEqualTo(LoaderState.FAILED);

        // loads and writes are refused
        assertThatThrownBy(() -> manager.loadOntologies(ONTOLOGIES.resolve("patients-a.owl")))
                .isInstanceOf(IllegalStateException.class).isNotInstanceOf(GraphIntegrityException.class);
        assertThatThrownBy(() -> manager.addEntity("Patient", "Patient2", null)).isInstanceOf(IllegalStateException.class);
        String diabetes = manager.findByName("Diabetes").orElseThrow().getId();
        String insulin = manager.findByName("InsulinTherapy").orElseThrow().getId();
        assertThatThrownBy(() -> manager.addRelationship("treatsDisease", insulin, diabetes))
                .isInstanceOf(IllegalStateException.class);

        // reads still work
        assertThat(manager.query("Disease")).extracting(Entity::getName).containsExactly("Diabetes");
        assertThat(manager.getEntity(diabetes)).isPresent();
        assertThat(manager.stats().getTotalEntities()).isEqualTo(2);
        assertThat(manager.findByName("Patient2")).isEmpty();
        assertThat(manager.getState()).isEqualTo(LoaderState.FAILED);
    }

    @Test
    public void testUnexpectedErrorRestoresTheState() {
        GraphStore store = new GraphStore(RelationVocabulary.createDefault()) {
            @Override
            public MergeReport mergeDescriptor(SourceDescriptor descriptor) {
                if (descriptor.sourceName.equals("patients-a.owl"))
                    throw new UnsupportedOperationException("cannot merge " + descriptor.sourceName);
                return super.mergeDescriptor(descriptor);
            }
        };
        KnowledgeGraphManager manager = new KnowledgeGraphManager(new IngestionOptions(), store);
        assertThatThrownBy(() -> manager.loadOntologies(ONTOLOGIES.resolve("patients-a.owl")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(manager.getState()).isEqualTo(LoaderState.EMPTY);

        manager.loadOntologies(HEALTHCARE);
        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        assertThatThrownBy(() -> manager.loadOntologies(ONTOLOGIES.resolve("patients-b.owl"), ONTOLOGIES.resolve("patients-a.owl")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        // files merged before the error are kept
        assertThat(manager.getLoadedSources()).containsExactly("healthcare.owl");

        // the next batch is accepted
        LoadReport report = manager.loadOntologies(ONTOLOGIES.resolve("patients-b.owl"));
        assertThat(report.getFinalState()).isEqualTo(LoaderState.READY);
        assertThat(manager.findByName("Patient1")).isPresent();
        assertThat(manager.getLoadedSources()).containsExactly("healthcare.owl", "patients-b.owl");
    }

    @Test
    public void testUnreadableWorkbookIsSkipped() throws Exception {
        Path corrupt = folder.getRoot().toPath().resolve("a-corrupt.xlsx");
        Files.writeString(corrupt, "this is not a workbook");
        Path annotations = writeAnnotations("b-annotations.xlsx");
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        LoadReport report = manager.load(List.of(HEALTHCARE), List.of(annotations, corrupt));

        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        assertThat(report.getSkippedFiles()).containsExactly(corrupt);
        assertThat(report.getIssues(IssueType.PARSE_ERROR)).extracting(LoadIssue::getSource).containsExactly("a-corrupt.xlsx");
        assertThat(manager.findByName("Diabetes").orElseThrow().getEffectiveValue("severity").orElseThrow().getValue())
                .isEqualTo("chronic");
    }

    @Test
    public void testWritesWithoutLoadMakeTheManagerReady() throws Exception {
        KnowledgeGraphManager manager = new KnowledgeGraphManager();
        assertThat(manager.getState()).isEqualTo(LoaderState.EMPTY);
        assertThatThrownBy(() -> manager.addRelationship("hasDisease", "ent1", "ent2"))
                .isInstanceOf(DanglingReferenceException.class);
        assertThat(manager.getState()).isEqualTo(LoaderState.EMPTY);

        String patient = manager.addEntity("Patient", "Patient1", Map.of("age", 45));
        assertThat(manager.getState()).isEqualTo(LoaderState.READY);
        String diabetes = manager.addEntity("Disease", "Diabetes", null);
        manager.addRelationship("hasDisease", patient, diabetes);
        assertThat(manager.getState()).isEqualTo(LoaderState.READY);

        KnowledgeGraphManager other = new KnowledgeGraphManager();
        other.addEntity("Disease", "Asthma", null);
        other.loadOntologies(HEALTHCARE);
        assertThat(other.getState()).isEqualTo(LoaderState.READY);
        assertThat(other.stats().getTotalEntities()).isEqualTo(3);
    }
}
