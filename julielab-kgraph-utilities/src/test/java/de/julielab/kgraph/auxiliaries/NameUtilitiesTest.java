package de.julielab.kgraph.auxiliaries;

import org.junit.Test;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class NameUtilitiesTest {
    @Test
    public void localNameOfIris() {
        assertThat(NameUtilities.localName("http://example.org/healthcare#Diabetes")).isEqualTo("Diabetes");
        assertThat(NameUtilities.localName("http://example.org/healthcare/Diabetes")).isEqualTo("Diabetes");
        assertThat(NameUtilities.localName("#Diabetes")).isEqualTo("Diabetes");
        assertThat(NameUtilities.localName("http://example.org/healthcare/")).isEqualTo("healthcare");
    }

    @Test
    public void localNameOfQualifiedNames() {
        Map<String, String> namespaces = Collections.singletonMap("hc", "http://example.org/healthcare#");
        assertThat(NameUtilities.localName("hc:Diabetes", namespaces)).isEqualTo("Diabetes");
        // unknown prefixes are not stripped
        assertThat(NameUtilities.localName("xy:Diabetes", namespaces)).isEqualTo("xy:Diabetes");
        assertThat(NameUtilities.localName(" Diabetes ", namespaces)).isEqualTo("Diabetes");
        assertThat(NameUtilities.localName("  ", namespaces)).isNull();
    }

    @Test
    public void normalizeKey() {
        assertThat(NameUtilities.normalizeKey("  Insulin   Therapy ")).isEqualTo("insulin therapy");
        assertThat(NameUtilities.normalizeKey("DIABETES")).isEqualTo(NameUtilities.normalizeKey("diabetes"));
        assertThatIllegalArgumentException().isThrownBy(() -> NameUtilities.normalizeKey(" "));
    }

    @Test
    public void normalizeRelationName() {
        assertThat(NameUtilities.normalizeRelationName("has_disease")).isEqualTo("hasdisease");
        assertThat(NameUtilities.normalizeRelationName("HAS-DISEASE")).isEqualTo("hasdisease");
        assertThat(NameUtilities.normalizeRelationName("hasDisease")).isEqualTo("hasdisease");
    }
}
