package com.owldsl.definition;

import com.owldsl.config.CnlConfiguration;
import com.owldsl.expression.AtomicClass;
import com.owldsl.expression.ClassExpression;
import com.owldsl.expression.Conjunction;
import com.owldsl.expression.Disjunction;
import com.owldsl.expression.PropertyRef;
import com.owldsl.expression.Restriction;
import com.owldsl.rendering.DiagnosticKind;
import com.owldsl.rendering.ExpressionRenderer;
import com.owldsl.rendering.TemplateEntry;
import com.owldsl.rendering.TemplateRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionComposerTest {

    private static final String NS = "http://example.org/fma#";

    private static final PropertyRef CONDUIT_FOR = new PropertyRef(NS + "conduit_for", "conduit for");
    private static final PropertyRef HAS_PART = new PropertyRef(NS + "has_part", "has part");

    private static final AtomicClass VESTIBULAR_AQUEDUCT = cls("vestibular_aqueduct", "vestibular aqueduct");
    private static final AtomicClass FORAMEN = cls("foramen_of_skull", "foramen of skull");
    private static final AtomicClass VEIN = cls("vein_of_vestibular_aqueduct", "vein of vestibular aqueduct");
    private static final AtomicClass BONE = cls("bone", "bone");
    private static final AtomicClass CARTILAGE = cls("cartilage", "cartilage");

    private static final ClassExpression AQUEDUCT_DEFINITION =
            Conjunction.of(FORAMEN, Restriction.some(CONDUIT_FOR, VEIN));

    private static AtomicClass cls(String localName, String label) {
        return new AtomicClass(NS + localName, label);
    }

    private static CnlConfiguration.Builder fmaConfiguration() {
        return CnlConfiguration.builder()
                .explicitPhrasing(CONDUIT_FOR.getIri(),
                        new TemplateEntry("is a conduit for {}", "is a conduit for {}", "What is {} a conduit for?"))
                .explicitPhrasing(HAS_PART.getIri(),
                        new TemplateEntry("has {} as a part", "has {} as parts", "What are the parts of {}?"));
    }

    private static DefinitionComposer composer(CnlConfiguration configuration) {
        return new DefinitionComposer(new ExpressionRenderer(new TemplateRegistry(configuration)));
    }

    @Test
    void testVestibularAqueductDefinition() {
        ClassDefinition definition = composer(fmaConfiguration().build())
                .composeDefinition(VESTIBULAR_AQUEDUCT, null, AQUEDUCT_DEFINITION, "FMA");

        assertEquals("The vestibular aqueduct is defined in FMA as a foramen of skull that is a conduit for "
                        + "a vein of vestibular aqueduct. It is a foramen of skull. "
                        + "It is a conduit for a vein of vestibular aqueduct.",
                definition.getText());
        assertNull(definition.getTextualDefinition());
        assertTrue(definition.getDiagnostics().isEmpty());
    }

    @Test
    void testRestrictionsOnSamePropertyShareOneSentence() {
        AtomicClass heart = cls("heart", "heart");
        ClassExpression definition = Conjunction.of(cls("organ", "organ"),
                Restriction.some(HAS_PART, cls("apex", "apex")),
                Restriction.some(CONDUIT_FOR, VEIN),
                Restriction.some(HAS_PART, cls("base", "base")));

        ClassDefinition composed = composer(fmaConfiguration().build())
                .composeDefinition(heart, null, definition, "FMA");

        assertTrue(composed.getText().endsWith("It is an organ. It has an apex and a base as parts. "
                + "It is a conduit for a vein of vestibular aqueduct."), composed.getText());
        assertEquals("It has an apex and a base as parts.", composed.getPrompts().get("What are the parts of the heart?"));
        assertEquals(3, composed.getPrompts().size());
    }

    @Test
    void testPrompts() {
        ClassDefinition definition = composer(fmaConfiguration().build())
                .composeDefinition(VESTIBULAR_AQUEDUCT, null, AQUEDUCT_DEFINITION, "FMA");
        Map<String, String> prompts = definition.getPrompts();

        assertEquals(2, prompts.size());
        assertEquals("It is a conduit for a vein of vestibular aqueduct.",
                prompts.get("What is the vestibular aqueduct a conduit for?"));
        assertEquals(definition.getText(), prompts.get("What is the vestibular aqueduct?"));
        assertEquals("What is the vestibular aqueduct?", List.copyOf(prompts.keySet()).get(1));
    }

    @Test
    void testTextualDefinitionComesFirst() {
        ClassDefinition definition = composer(fmaConfiguration().build()).composeDefinition(VESTIBULAR_AQUEDUCT,
                "Canal in the petrous part of the temporal bone", AQUEDUCT_DEFINITION, "FMA");

        assertTrue(definition.getText().startsWith("Canal in the petrous part of the temporal bone. The vestibular"));
        assertEquals("Canal in the petrous part of the temporal bone", definition.getTextualDefinition());
        assertTrue(definition.getLogicalDefinition().startsWith("The vestibular aqueduct is defined in FMA"));
    }

    @Test
    void testEquivalenceMarkedViceVersa() {
        AtomicClass skeletal = cls("skeletal_element", "skeletal element");
        ClassDefinition definition = composer(fmaConfiguration().build()).composeDefinition(skeletal, null,
                List.of(Disjunction.of(BONE, CARTILAGE)), List.of(Restriction.some(HAS_PART, BONE)), "FMA");

        assertEquals("The skeletal element is defined in FMA as a bone or a cartilage and vice versa. "
                + "It is a bone or a cartilage. It has a bone as a part.", definition.getText());
    }

    @Test
    void testSubsumptionNeverSaysViceVersa() {
        ClassDefinition definition = composer(fmaConfiguration().build())
                .composeDefinition(VESTIBULAR_AQUEDUCT, null, AQUEDUCT_DEFINITION, "FMA");

        assertFalse(definition.getText().contains("vice versa"));
    }

    @Test
    void testWithoutOntologyLabel() {
        ClassDefinition definition = composer(fmaConfiguration().build())
                .composeDefinition(VESTIBULAR_AQUEDUCT, null, FORAMEN, null);

        assertEquals("The vestibular aqueduct is defined as a foramen of skull. It is a foramen of skull.",
                definition.getText());
    }

    @Test
    void testUnresolvedPropertyIsLeftOut() {
        PropertyRef unlabelled = new PropertyRef(NS + "R_42", null);
        ClassDefinition definition = composer(fmaConfiguration().build()).composeDefinition(VESTIBULAR_AQUEDUCT,
                null, Conjunction.of(FORAMEN, Restriction.some(unlabelled, BONE)), "FMA");

        assertEquals("The vestibular aqueduct is defined in FMA as a foramen of skull. It is a foramen of skull.",
                definition.getText());
        assertTrue(definition.getDiagnostics().stream()
                .anyMatch(d -> d.getKind() == DiagnosticKind.UNRESOLVED_PROPERTY && (NS + "R_42").equals(d.getSubject())));
    }

    @Test
    void testTooDeepPartIsTruncated() {
        ClassExpression deep = Restriction.some(HAS_PART,
                Restriction.some(HAS_PART, Restriction.some(HAS_PART, Restriction.some(HAS_PART, BONE))));
        ClassDefinition definition = composer(fmaConfiguration().maxRenderDepth(3).build())
                .composeDefinition(VESTIBULAR_AQUEDUCT, null, Conjunction.of(FORAMEN, deep), "FMA");

        assertTrue(definition.getText().contains("It is a foramen of skull."));
        assertTrue(definition.getText().endsWith("It " + DefinitionComposer.TRUNCATION_MARKER));
        assertTrue(definition.getDiagnostics().stream().anyMatch(d -> d.getKind() == DiagnosticKind.DEPTH_TRUNCATED));
    }

    @Test
    void testSkippedRoleIsNotEnumerated() {
        PropertyRef developsFrom = new PropertyRef(NS + "develops_from", "develops from");
        ClassDefinition definition = composer(fmaConfiguration().skipRole("develops_from").build())
                .composeDefinition(VESTIBULAR_AQUEDUCT, null,
                        Conjunction.of(FORAMEN, Restriction.some(developsFrom, BONE)), "FMA");

        assertFalse(definition.getText().contains("develops"));
        assertTrue(definition.getDiagnostics().stream().anyMatch(d -> d.getKind() == DiagnosticKind.SKIPPED_PROPERTY));
    }

    @Test
    void testNothingToSay() {
        ClassDefinition definition = composer(CnlConfiguration.empty())
                .composeDefinition(VESTIBULAR_AQUEDUCT, null, List.of(), List.of(), "FMA");

        assertTrue(definition.isEmpty());
        assertTrue(definition.getPrompts().isEmpty());
    }

    @Test
    void testTextualDefinitionOnly() {
        ClassDefinition definition = composer(CnlConfiguration.empty())
                .composeDefinition(VESTIBULAR_AQUEDUCT, "A small canal", List.of(), List.of(), "FMA");

        assertEquals("A small canal.", definition.getText());
        assertEquals("A small canal.", definition.getPrompts().get("What is the vestibular aqueduct?"));
    }
}
