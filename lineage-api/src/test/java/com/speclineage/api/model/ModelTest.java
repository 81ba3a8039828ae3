package com.speclineage.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelTest {

    @Test
    @DisplayName("Float and string ids map to the same script")
    void scriptIdNormalization() {
        assertThat(ScriptId.parse(4711.0)).contains(ScriptId.of("4711"));
        assertThat(ScriptId.parse("12.0")).contains(ScriptId.of("12"));
        assertThat(ScriptId.parse(Double.NaN)).isEmpty();
        assertThat(ScriptId.parse(" None ")).isEmpty();
        assertThat(ScriptId.parse("")).isEmpty();
        assertThat(ScriptId.parse("a.0b")).contains(ScriptId.of("a.0b"));
    }

    @Test
    @DisplayName("Numeric ids keep their exact value whatever the number type")
    void exactNumericIds() {
        assertThat(ScriptId.parse(9007199254740993L)).contains(ScriptId.of("9007199254740993"));
        assertThat(ScriptId.parse(new BigInteger("123456789012345678901234567890")))
                .contains(ScriptId.of("123456789012345678901234567890"));
        assertThat(ScriptId.parse(new BigDecimal("12.50"))).contains(ScriptId.of("12.5"));
        assertThat(ScriptId.parse(1.0e20)).contains(ScriptId.of("100000000000000000000"));
        assertThat(ScriptId.parse(0.0)).contains(ScriptId.of("0"));
        assertThat(ScriptId.parse(2.5)).contains(ScriptId.of("2.5"));
    }

    @Test
    @DisplayName("A chain never repeats an id")
    void chainRejectsRepeats() {
        assertThatThrownBy(() -> DerivationChain.of("3", "2", "3"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DerivationChain(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Chains keep newest-first order and expose the root-first view")
    void chainOrder() {
        DerivationChain chain = DerivationChain.of("4", "2", "1");

        assertThat(chain.head()).isEqualTo(ScriptId.of("4"));
        assertThat(chain.root()).isEqualTo(ScriptId.of("1"));
        assertThat(chain.rootFirst()).containsExactly(ScriptId.of("1"), ScriptId.of("2"), ScriptId.of("4"));
        assertThat(chain.format()).isEqualTo("4 -> 2 -> 1");
    }

    @Test
    @DisplayName("Inverse swaps refinement and fixes the symmetric labels")
    void labelInverse() {
        assertThat(RelationLabel.S1_REFINES_S2.inverse()).isEqualTo(RelationLabel.S2_REFINES_S1);
        assertThat(RelationLabel.S2_REFINES_S1.inverse()).isEqualTo(RelationLabel.S1_REFINES_S2);
        for (RelationLabel label : RelationLabel.values()) {
            assertThat(label.inverse().inverse()).isEqualTo(label);
        }
        assertThat(RelationLabel.EQUIVALENT.inverse()).isEqualTo(RelationLabel.EQUIVALENT);
    }

    @Test
    @DisplayName("Wire names parse back, including the legacy solver error token")
    void wireNames() {
        for (RelationLabel label : RelationLabel.values()) {
            assertThat(RelationLabel.fromWireName(label.wireName())).isEqualTo(label);
        }
        assertThat(RelationLabel.fromWireName("Z3_ERROR")).isEqualTo(RelationLabel.ERROR);
        assertThat(RelationLabel.targetLabels()).doesNotContain(RelationLabel.UNKNOWN, RelationLabel.ERROR);
    }

    @Test
    @DisplayName("Tally percentages are relative to all labels")
    void tally() {
        LabelTally tally = LabelTally.of(List.of(
                new ConsecutiveResult(ScriptId.of("3"), List.of(RelationLabel.EQUIVALENT, RelationLabel.ERROR)),
                new ConsecutiveResult(ScriptId.of("9"), List.of(RelationLabel.EQUIVALENT, RelationLabel.UNKNOWN))));

        assertThat(tally.total()).isEqualTo(4);
        assertThat(tally.percentage(RelationLabel.EQUIVALENT)).isEqualTo(50.0);
        assertThat(new LabelTally().percentage(RelationLabel.EQUIVALENT)).isZero();
    }
}
