package info.isaksson.erland.fmuhandler.xml;

import info.isaksson.erland.fmuhandler.error.DuplicateVariableException;
import info.isaksson.erland.fmuhandler.error.InvalidValueException;
import info.isaksson.erland.fmuhandler.error.MalformedXmlException;
import info.isaksson.erland.fmuhandler.error.ModelDescriptionParseException;
import info.isaksson.erland.fmuhandler.error.VariableNotFoundException;
import info.isaksson.erland.fmuhandler.model.Causality;
import info.isaksson.erland.fmuhandler.model.ScalarVariable;
import info.isaksson.erland.fmuhandler.model.ScalarVariableQuery;
import info.isaksson.erland.fmuhandler.model.ValueType;
import info.isaksson.erland.fmuhandler.model.Variability;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ModelDescriptionDocumentTest {

    static byte[] canonicalFixture() throws IOException {
        try (InputStream in = ModelDescriptionDocumentTest.class.getResourceAsStream("/modelDescription-canonical.xml")) {
            assertNotNull(in, "fixture missing");
            return in.readAllBytes();
        }
    }

    static final String TWO_PARAMETERS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <fmiModelDescription fmiVersion="2.0" modelName="m" guid="{1}">
              <ModelVariables>
                <ScalarVariable name="A" valueReference="0" causality="parameter" variability="fixed">
                  <Real start="1.0"/>
                </ScalarVariable>
                <ScalarVariable name="B" valueReference="1" causality="parameter" variability="fixed">
                  <Real start="2.0"/>
                </ScalarVariable>
              </ModelVariables>
              <ModelStructure/>
            </fmiModelDescription>
            """;

    private static ModelDescriptionDocument parse(String xml) {
        return ModelDescriptionDocument.parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> names(ModelDescriptionDocument doc) {
        return doc.scalarVariables().stream().map(v -> v.name).collect(Collectors.toList());
    }

    @Test
    void canonicalDocumentRoundTripsByteIdentically() throws Exception {
        byte[] original = canonicalFixture();
        ModelDescriptionDocument doc = ModelDescriptionDocument.parse(original);

        byte[] out = doc.toXmlBytes();
        assertEquals(new String(original, StandardCharsets.UTF_8), new String(out, StandardCharsets.UTF_8));
        assertArrayEquals(original, out);
        assertArrayEquals(out, doc.toXmlBytes());
    }

    @Test
    void serializationIsIdempotentForNonCanonicalInput() {
        ModelDescriptionDocument first = parse(TWO_PARAMETERS);
        byte[] once = first.toXmlBytes();
        byte[] twice = ModelDescriptionDocument.parse(once).toXmlBytes();
        assertArrayEquals(once, twice);
        assertTrue(new String(once, StandardCharsets.UTF_8).startsWith(ModelDescriptionWriter.DECLARATION + "\n"));
    }

    @Test
    void parsesAllValueTypesInDeclarationOrder() throws Exception {
        ModelDescriptionDocument doc = ModelDescriptionDocument.parse(canonicalFixture());

        assertEquals("Demo", doc.modelName());
        assertEquals("2.0", doc.fmiVersion());
        assertEquals("{8c4e810f-3df3-4a00-8276-176fa3c9f000}", doc.guid());
        assertEquals(List.of("Var1", "count", "enabled", "label", "mode", "y", "x"), names(doc));

        ScalarVariable var1 = doc.getVariableByName("Var1");
        assertEquals(ValueType.REAL, var1.valueType);
        assertEquals(1.5, var1.start.asReal());
        assertEquals("m", var1.unit());
        assertEquals("Spring length", var1.description);
        assertEquals(Causality.PARAMETER, var1.causality);
        assertEquals(Variability.FIXED, var1.variability);

        assertEquals(3, doc.getVariableByName("count").start.asInteger());
        assertTrue(doc.getVariableByName("enabled").start.asBoolean());
        assertEquals("hello world", doc.getVariableByName("label").start.asString());
        ScalarVariable mode = doc.getVariableByName("mode");
        assertEquals(ValueType.ENUMERATION, mode.valueType);
        assertEquals(1, mode.start.asInteger());
        assertEquals("Mode", mode.facets.get("declaredType"));

        ScalarVariable y = doc.getVariableByName("y");
        assertNull(y.start);
        assertEquals(Causality.OUTPUT, y.causality);
        assertEquals(Causality.LOCAL, doc.getVariableByName("x").effectiveCausality());
    }

    @Test
    void setStartValueIsVisibleThroughGetAndSerialization() {
        ModelDescriptionDocument doc = parse(TWO_PARAMETERS);

        ScalarVariable updated = doc.setStartValue("A", 42);
        assertEquals(42.0, updated.start.asReal());
        assertEquals(42.0, doc.getVariableByName("A").start.asReal());

        ModelDescriptionDocument reparsed = ModelDescriptionDocument.parse(doc.toXmlBytes());
        assertEquals(42.0, reparsed.getVariableByName("A").start.asReal());
        assertEquals(2.0, reparsed.getVariableByName("B").start.asReal());
    }

    @Test
    void setStartValueRoundTripsForEveryNonRealType() throws Exception {
        ModelDescriptionDocument doc = ModelDescriptionDocument.parse(canonicalFixture());

        assertEquals(7, doc.setStartValue("count", 7).start.asInteger());
        assertFalse(doc.setStartValue("enabled", false).start.asBoolean());
        assertEquals("a & <b>", doc.setStartValue("label", "a & <b>").start.asString());
        assertEquals(0, doc.setStartValue("mode", 0).start.asInteger());

        assertEquals(7, doc.getVariableByName("count").start.asInteger());
        assertFalse(doc.getVariableByName("enabled").start.asBoolean());
        assertEquals("a & <b>", doc.getVariableByName("label").start.asString());
        assertEquals(0, doc.getVariableByName("mode").start.asInteger());

        String xml = doc.toXmlString();
        assertTrue(xml.contains("<Boolean start=\"false\"/>"), xml);
        assertTrue(xml.contains("<String start=\"a &amp; &lt;b&gt;\"/>"), xml);

        ModelDescriptionDocument reparsed = ModelDescriptionDocument.parse(doc.toXmlBytes());
        ScalarVariable count = reparsed.getVariableByName("count");
        assertEquals(ValueType.INTEGER, count.valueType);
        assertEquals(7, count.start.asInteger());
        assertEquals("10", count.facets.get("max"));
        assertFalse(reparsed.getVariableByName("enabled").start.asBoolean());
        assertEquals("a & <b>", reparsed.getVariableByName("label").start.asString());
        ScalarVariable mode = reparsed.getVariableByName("mode");
        assertEquals(ValueType.ENUMERATION, mode.valueType);
        assertEquals(0, mode.start.asInteger());
        assertEquals("Mode", mode.facets.get("declaredType"));
        assertEquals(1.5, reparsed.getVariableByName("Var1").start.asReal());
        assertTrue(reparsed.validate().valid, reparsed.validate().summary());
    }

    @Test
    void setStartValueRejectsWrongTypesAndLeavesDocumentUnchanged() throws Exception {
        ModelDescriptionDocument doc = ModelDescriptionDocument.parse(canonicalFixture());
        byte[] before = doc.toXmlBytes();

        InvalidValueException e = assertThrows(InvalidValueException.class, () -> doc.setStartValue("Var1", "abc"));
        assertEquals("Var1", e.getVariableName());
        assertEquals(ValueType.REAL, e.getExpectedType());
        assertThrows(InvalidValueException.class, () -> doc.setStartValue("Var1", true));
        assertThrows(InvalidValueException.class, () -> doc.setStartValue("count", 2.5));
        assertThrows(InvalidValueException.class, () -> doc.setStartValue("enabled", "yes"));
        assertThrows(InvalidValueException.class, () -> doc.setStartValue("label", 7));

        assertArrayEquals(before, doc.toXmlBytes());
    }

    @Test
    void setStartValueOnVariableWithoutStartAddsTheAttribute() throws Exception {
        ModelDescriptionDocument doc = ModelDescriptionDocument.parse(canonicalFixture());
        doc.setStartValue("y", 2.5);
        assertTrue(doc.toXmlString().contains("<Real start=\"2.5\"/>"));
    }

    @Test
    void unknownNamesRaiseNotFound() {
        ModelDescriptionDocument doc = parse(TWO_PARAMETERS);
        VariableNotFoundException e = assertThrows(VariableNotFoundException.class, () -> doc.getVariableByName("nope"));
        assertEquals("nope", e.getVariableName());
        assertThrows(VariableNotFoundException.class, () -> doc.setStartValue("nope", 1));
        assertTrue(doc.findVariable("nope").isEmpty());
        assertTrue(doc.findVariable("A").isPresent());
    }

    @Test
    void deleteRemovesVariableAndSecondDeleteFails() {
        ModelDescriptionDocument doc = parse(TWO_PARAMETERS);

        ScalarVariable removed = doc.deleteVariable("A");
        assertEquals("A", removed.name);
        assertEquals(List.of("B"), names(doc));
        assertThrows(VariableNotFoundException.class, () -> doc.getVariableByName("A"));
        assertThrows(VariableNotFoundException.class, () -> doc.deleteVariable("A"));

        String xml = doc.toXmlString();
        assertFalse(xml.contains("name=\"A\""));
        assertTrue(xml.contains("name=\"B\""));
        assertTrue(doc.validate().valid, doc.validate().summary());
    }

    @Test
    void deleteRemovesTheLineOfTheElement() throws Exception {
        ModelDescriptionDocument doc = ModelDescriptionDocument.parse(canonicalFixture());
        doc.deleteVariable("label");
        String xml = doc.toXmlString();
        assertTrue(xml.contains("      <Boolean start=\"true\"/>\n"
                + "    </ScalarVariable>\n"
                + "    <ScalarVariable causality=\"parameter\" name=\"mode\""), xml);
    }

    @Test
    void allVariablesCanBeDeleted() {
        ModelDescriptionDocument doc = parse(TWO_PARAMETERS);
        doc.deleteVariable("A");
        doc.deleteVariable("B");
        assertEquals(0, doc.size());
        assertTrue(doc.validate().valid);
    }

    @Test
    void addVariableAppendsWithSiblingIndentation() {
        ModelDescriptionDocument doc = parse(TWO_PARAMETERS);
        ScalarVariable c = ScalarVariable.builder("C", 2, ValueType.INTEGER)
                .causality(Causality.PARAMETER)
                .variability(Variability.FIXED)
                .startValue(5)
                .build();

        doc.addVariable(c);

        assertEquals(List.of("A", "B", "C"), names(doc));
        String xml = doc.toXmlString();
        assertTrue(xml.contains("</ScalarVariable>\n"
                + "    <ScalarVariable causality=\"parameter\" name=\"C\" valueReference=\"2\" variability=\"fixed\">\n"
                + "      <Integer start=\"5\"/>\n"
                + "    </ScalarVariable>\n"
                + "  </ModelVariables>"), xml);
        assertTrue(doc.validate().valid);
        assertThrows(DuplicateVariableException.class, () -> doc.addVariable(c));
    }

    @Test
    void updateVariableRenamesAndChangesType() {
        ModelDescriptionDocument doc = parse(TWO_PARAMETERS);

        doc.updateVariable("A", v -> v.toBuilder().name("A2").valueType(ValueType.INTEGER).startValue(7).build());

        assertEquals(List.of("A2", "B"), names(doc));
        assertThrows(VariableNotFoundException.class, () -> doc.getVariableByName("A"));
        assertEquals(7, doc.getVariableByName("A2").start.asInteger());
        assertTrue(doc.toXmlString().contains("<Integer start=\"7\"/>"));
        assertThrows(DuplicateVariableException.class,
                () -> doc.updateVariable("A2", v -> v.toBuilder().name("B").build()));
        assertEquals(List.of("A2", "B"), names(doc));
    }

    @Test
    void queryMatchesInDeclarationOrder() throws Exception {
        ModelDescriptionDocument doc = ModelDescriptionDocument.parse(canonicalFixture());

        List<ScalarVariable> parameters = doc.query(ScalarVariableQuery.any().withCausality(Causality.PARAMETER));
        assertEquals(List.of("Var1", "count", "enabled", "label", "mode"),
                parameters.stream().map(v -> v.name).collect(Collectors.toList()));

        List<ScalarVariable> reals = doc.query(ScalarVariableQuery.any().withValueType(ValueType.REAL).withStart(0));
        assertEquals(1, reals.size());
        assertEquals("x", reals.get(0).name);

        assertEquals(7, doc.query(ScalarVariableQuery.any()).size());
    }

    @Test
    void duplicateNamesAreRejected() {
        String xml = TWO_PARAMETERS.replace("name=\"B\"", "name=\"A\"");
        ModelDescriptionParseException e = assertThrows(ModelDescriptionParseException.class, () -> parse(xml));
        assertEquals("A", e.getVariableName());
    }

    @Test
    void structuralProblemsAreParseErrors() {
        assertThrows(ModelDescriptionParseException.class, () -> parse("<other/>"));
        assertThrows(ModelDescriptionParseException.class,
                () -> parse("<fmiModelDescription fmiVersion=\"2.0\"/>"));
        assertThrows(ModelDescriptionParseException.class,
                () -> parse("<fmiModelDescription><ModelVariables/></fmiModelDescription>"));
        assertThrows(ModelDescriptionParseException.class,
                () -> parse(TWO_PARAMETERS.replace(" valueReference=\"0\"", "")));
        assertThrows(ModelDescriptionParseException.class,
                () -> parse(TWO_PARAMETERS.replace("valueReference=\"0\"", "valueReference=\"zero\"")));
        assertThrows(ModelDescriptionParseException.class,
                () -> parse(TWO_PARAMETERS.replace("valueReference=\"0\" causality=\"parameter\"",
                        "valueReference=\"0\" causality=\"sometimes\"")));
        assertThrows(ModelDescriptionParseException.class,
                () -> parse(TWO_PARAMETERS.replace("<Real start=\"1.0\"/>", "<Real start=\"1.0\"/><Integer/>")));
        assertThrows(ModelDescriptionParseException.class,
                () -> parse(TWO_PARAMETERS.replace("<Real start=\"1.0\"/>", "<Complex/>")));
    }

    @Test
    void badStartLiteralIsInvalidValue() {
        InvalidValueException e = assertThrows(InvalidValueException.class,
                () -> parse(TWO_PARAMETERS.replace("start=\"1.0\"", "start=\"one\"")));
        assertEquals("A", e.getVariableName());
    }

    @Test
    void malformedXmlCarriesPosition() {
        MalformedXmlException e = assertThrows(MalformedXmlException.class,
                () -> parse("<fmiModelDescription>\n  <ModelVariables>\n</fmiModelDescription>"));
        assertTrue(e.getLine() >= 2, "line " + e.getLine());
        assertThrows(MalformedXmlException.class,
                () -> parse("<!DOCTYPE x [<!ENTITY a \"b\">]><fmiModelDescription/>"));
    }

    @Test
    void validateReportsSchemaViolationsWithoutThrowing() {
        ModelDescriptionDocument doc = parse(TWO_PARAMETERS);
        doc.updateVariable("A", v -> v.withFacet("min", "abc"));

        ValidationResult result = doc.validate();
        assertFalse(result.valid);
        assertFalse(result.errors().isEmpty());
    }
}
