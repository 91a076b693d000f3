package com.example.xtractor.application.extraction;

import com.example.xtractor.domain.model.LgaNode;
import com.example.xtractor.domain.model.StateNode;
import com.example.xtractor.domain.model.WardNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentBuilderTest {

    private ExtractionContext context;
    private DocumentBuilder builder;

    @BeforeEach
    void setUp() {
        context = new ExtractionContext();
        builder = new DocumentBuilder(context, 5);
    }

    /**
     * Verifies that States are deduplicated by normalized name and kept in first-seen order.
     */
    @Test
    void statesAreCreatedOnceAndKeptInFirstSeenOrder() {
        StateNode kano = builder.findOrCreateState("Kano");
        builder.findOrCreateState("ABIA");
        StateNode again = builder.findOrCreateState(" kano ");

        assertThat(again).isSameAs(kano);
        assertThat(builder.document().states()).extracting(StateNode::name).containsExactly("KANO", "ABIA");
    }

    /**
     * Verifies that a repeated LGA moves the current-LGA pointer back to the existing node.
     */
    @Test
    void repeatedLgaMovesTheCursorInsteadOfAppending() {
        StateNode state = builder.findOrCreateState("ABIA");
        LgaNode first = builder.findOrCreateLga(state, "Aba North", "01");
        builder.findOrCreateLga(state, "Aba South", "02");

        LgaNode repeated = builder.findOrCreateLga(state, "ABA NORTH", "01");

        assertThat(repeated).isSameAs(first);
        assertThat(context.currentLga()).isSameAs(first);
        assertThat(state.lgas()).extracting(LgaNode::name).containsExactly("ABA NORTH", "ABA SOUTH");
    }

    /**
     * Ensures LGAs keep insertion order even when codes are not ascending.
     */
    @Test
    void insertionOrderIgnoresCodeOrder() {
        StateNode state = builder.findOrCreateState("ABIA");
        builder.findOrCreateLga(state, "Ohafia", "09");
        builder.findOrCreateLga(state, "Arochukwu", "03");

        assertThat(state.lgas()).extracting(LgaNode::code).containsExactly("09", "03");
    }

    /**
     * Ensures a ward with an already seen name and code is not appended again.
     */
    @Test
    void duplicateWardsAreRejected() {
        StateNode state = builder.findOrCreateState("ABIA");
        LgaNode lga = builder.findOrCreateLga(state, "Aba North", "01");

        builder.findOrCreateWard(lga, "Eziama", "01");
        builder.findOrCreateWard(lga, "EZIAMA ", "01");
        builder.findOrCreateWard(lga, "Ariaria", "02");

        assertThat(lga.wards()).hasSize(2);
        assertThat(lga.wards().get(1).name()).isEqualTo("ARIARIA");
    }

    /**
     * Verifies that LGA identity includes the owning State.
     */
    @Test
    void sameLgaNameInAnotherStateIsADifferentEntity() {
        StateNode abia = builder.findOrCreateState("ABIA");
        StateNode imo = builder.findOrCreateState("IMO");

        LgaNode first = builder.findOrCreateLga(abia, "Isiala", "01");
        LgaNode second = builder.findOrCreateLga(imo, "Isiala", "01");

        assertThat(second).isNotSameAs(first);
        assertThat(abia.lgas()).hasSize(1);
        assertThat(imo.lgas()).hasSize(1);
    }

    /**
     * Verifies that missing codes are generated from initials and take part in identity.
     */
    @Test
    void missingCodesAreGeneratedFromInitials() {
        StateNode state = builder.findOrCreateState("ABIA");
        LgaNode lga = builder.findOrCreateLga(state, "Isiala Ngwa North", null);
        builder.findOrCreateWard(lga, "Amaise Anara", " ");

        assertThat(lga.code()).isEqualTo("INN");
        assertThat(lga.wards().get(0).code()).isEqualTo("AA");
        assertThat(builder.findOrCreateLga(state, "ISIALA NGWA NORTH", null)).isSameAs(lga);
    }

    /**
     * Verifies that generated codes are deterministic, bounded and fall back to XX.
     */
    @Test
    void generatedCodesAreDeterministicAndBounded() {
        assertThat(DocumentBuilder.generateCode("NORTH EAST", 5)).isEqualTo("NE");
        assertThat(DocumentBuilder.generateCode("north-east", 5)).isEqualTo("NE");
        assertThat(DocumentBuilder.generateCode("A B C D E F G", 5)).isEqualTo("ABCDE");
        assertThat(DocumentBuilder.generateCode("---", 5)).isEqualTo("XX");
        assertThat(DocumentBuilder.generateCode(null, 5)).isEqualTo("XX");
        assertThat(DocumentBuilder.generateCode("NORTH EAST", 5))
                .isEqualTo(DocumentBuilder.generateCode("NORTH EAST", 5));
    }

    /**
     * Ensures wards cannot be attached to an LGA the builder never created.
     */
    @Test
    void wardsCannotBeAttachedToForeignLgas() {
        LgaNode foreign = new LgaNode("ELSEWHERE", "01");

        assertThrows(IllegalArgumentException.class, () -> builder.findOrCreateWard(foreign, "WARD", "01"));
    }

    /**
     * Verifies that a repeated ward lookup returns the node stored in the tree.
     */
    @Test
    void repeatedWardReturnsTheNodeAlreadyInTheTree() {
        StateNode state = builder.findOrCreateState("ABIA");
        LgaNode lga = builder.findOrCreateLga(state, "Aba North", "01");

        WardNode first = builder.findOrCreateWard(lga, "Eziama", "01");
        WardNode again = builder.findOrCreateWard(lga, "eziama", "01");

        assertThat(again).isSameAs(first);
        assertThat(lga.wards()).hasSize(1);
        assertThat(lga.wards().get(0)).isSameAs(first);
    }
}
