package com.speclineage.oracle;

import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class OracleOutputParserTest {

    @Test
    @DisplayName("First answer line decides the status")
    void firstAnswerWins() {
        assertThat(OracleOutputParser.parseStatus("unsat\nsat\n")).isEqualTo(OracleStatus.UNSAT);
        assertThat(OracleOutputParser.parseStatus("sat\r\n")).isEqualTo(OracleStatus.SAT);
        assertThat(OracleOutputParser.parseStatus("unknown\n")).isEqualTo(OracleStatus.UNKNOWN);
    }

    @Test
    @DisplayName("An error line anywhere makes the exchange an error")
    void errorAnywhere() {
        String output = "sat\n(error \"line 3 column 1: unknown constant x\")\n";

        assertThat(OracleOutputParser.hasError(output)).isTrue();
        assertThat(OracleOutputParser.parseStatus(output)).isEqualTo(OracleStatus.ERROR);
    }

    @Test
    @DisplayName("Output without an answer is unknown")
    void noAnswer() {
        assertThat(OracleOutputParser.parseStatus("")).isEqualTo(OracleStatus.UNKNOWN);
        assertThat(OracleOutputParser.parseStatus("(model)\nsatisfiable\n")).isEqualTo(OracleStatus.UNKNOWN);
    }

    @Test
    void collectsEveryCheckToken() {
        assertThat(OracleOutputParser.checkTokens("sat\n(model)\nunsat\nunknown\n"))
                .containsExactly("sat", "unsat", "unknown");
    }

    @Test
    @DisplayName("Standard error can raise an error but never answers")
    void standardErrorOnlyForErrors() {
        assertThat(OracleOutputParser.parseStatus("", "unsat\n")).isEqualTo(OracleStatus.UNKNOWN);
        assertThat(OracleOutputParser.parseStatus("sat\n", "(error \"bad\")\n")).isEqualTo(OracleStatus.ERROR);
        assertThat(OracleOutputParser.hasError(
                new OracleResult(OracleStatus.SAT, "sat\n", "(error \"bad\")", Duration.ZERO))).isTrue();
    }
}
