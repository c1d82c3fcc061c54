package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A scalar property value of an entity or relationship. The value is one of the kinds of {@link ValueKind} and
 * carries the name of the source that set it. Instances are immutable.
 */
@JsonPropertyOrder({"kind", "value", "source"})
public final class PropertyValue {

    private static final Set<String> XSD_INTEGER_TYPES = ImmutableSet.of("integer", "int", "long", "short", "byte",
            "nonnegativeinteger", "positiveinteger", "negativeinteger", "nonpositiveinteger", "unsignedint",
            "unsignedlong", "unsignedshort", "unsignedbyte");
    private static final Set<String> XSD_DECIMAL_TYPES = ImmutableSet.of("decimal", "double", "float");

    @JsonProperty("kind")
    private final ValueKind kind;
    @JsonProperty("value")
    private final Object value;
    @JsonProperty("source")
    private final String source;

    private PropertyValue(ValueKind kind, Object value, String source) {
        if (value == null)
            throw new IllegalArgumentException("A property value must not be null.");
        this.kind = kind;
        this.value = value;
        this.source = source;
    }

    public static PropertyValue ofString(String value, String source) {
        return new PropertyValue(ValueKind.STRING, value, source);
    }

    public static PropertyValue ofNumber(Number value, String source) {
        return new PropertyValue(ValueKind.NUMBER, normalizeNumber(value), source);
    }

    public static PropertyValue ofBoolean(boolean value, String source) {
        return new PropertyValue(ValueKind.BOOLEAN, value, source);
    }

    /**
     * Wraps a plain Java value. Supported are strings, numbers and booleans. An existing <tt>PropertyValue</tt> is
     * returned with the given source.
     *
     * @param value  The value to wrap.
     * @param source The provenance of the value.
     * @return The property value.
     * @throws IllegalArgumentException If <tt>value</tt> is null or of an unsupported type.
     */
    public static PropertyValue of(Object value, String source) {
        if (value instanceof PropertyValue)
            return ((PropertyValue) value).withSource(source);
        if (value instanceof String)
            return ofString((String) value, source);
        if (value instanceof Number)
            return ofNumber((Number) value, source);
        if (value instanceof Boolean)
            return ofBoolean((Boolean) value, source);
        throw new IllegalArgumentException("Property values must be strings, numbers or booleans but got "
                + (value == null ? "null" : value.getClass().getName() + " (" + value + ")") + ".");
    }

    /**
     * Creates a property value from the lexical form of an XML literal and its <tt>rdf:datatype</tt>. XML Schema
     * booleans and numeric types are converted to their kind, everything else becomes a string. A lexical form that
     * is not valid for its declared datatype is kept as a string.
     *
     * @param lexical  The literal text.
     * @param datatype The datatype IRI or qualified name, may be null.
     * @param source   The provenance of the value.
     * @return The property value.
     */
    public static PropertyValue fromLiteral(String lexical, String datatype, String source) {
        String text = lexical.trim();
        String type = datatypeLocalName(datatype);
        if (type == null)
            return ofString(text, source);
        if (type.equals("boolean")) {
            if (text.equals("true") || text.equals("1"))
                return ofBoolean(true, source);
            if (text.equals("false") || text.equals("0"))
                return ofBoolean(false, source);
            return ofString(text, source);
        }
        try {
            if (XSD_INTEGER_TYPES.contains(type))
                return ofNumber(new BigInteger(text), source);
            if (XSD_DECIMAL_TYPES.contains(type))
                return ofNumber(Double.valueOf(text), source);
        } catch (NumberFormatException e) {
            // invalid lexical form for the datatype, keep the text
            return ofString(text, source);
        }
        return ofString(text, source);
    }

    private static String datatypeLocalName(String datatype) {
        if (StringUtils.isBlank(datatype))
            return null;
        int pos = Math.max(datatype.lastIndexOf('#'), datatype.lastIndexOf(':'));
        return datatype.substring(pos + 1).trim().toLowerCase(Locale.ROOT);
    }

    private static Number normalizeNumber(Number number) {
        if (number == null)
            throw new IllegalArgumentException("A numeric property value must not be null.");
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte)
            return number.longValue();
        if (number instanceof BigInteger) {
            BigInteger bi = (BigInteger) number;
            return bi.bitLength() < 64 ? (Number) bi.longValue() : (Number) new BigDecimal(bi).doubleValue();
        }
        return number.doubleValue();
    }

    public ValueKind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public String getSource() {
        return source;
    }

    @JsonIgnore
    public String asString() {
        return String.valueOf(value);
    }

    /**
     * @return The numeric value or null if this is not a number.
     */
    @JsonIgnore
    public Number asNumber() {
        return kind == ValueKind.NUMBER ? (Number) value : null;
    }

    public PropertyValue withSource(String source) {
        if (Objects.equals(this.source, source))
            return this;
        return new PropertyValue(kind, value, source);
    }

    /**
     * Compares kind and value, ignoring the provenance. Numbers are compared by their numeric value so that
     * <tt>3</tt> matches <tt>3.0</tt>.
     *
     * @param other The value to compare with.
     * @return Whether both values are equal disregarding their sources.
     */
    public boolean matches(PropertyValue other) {
        if (other == null || kind != other.kind)
            return false;
        if (kind == ValueKind.NUMBER)
            return Double.compare(((Number) value).doubleValue(), ((Number) other.value).doubleValue()) == 0;
        return value.equals(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyValue that = (PropertyValue) o;
        return kind == that.kind && value.equals(that.value) && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, source);
    }

    @Override
    public String toString() {
        return asString();
    }
}
