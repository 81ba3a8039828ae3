package com.speclineage.chains;

import com.speclineage.api.exceptions.MalformedInputException;
import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.DerivationChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainTableTest {

    private final ChainSet chains = new ChainSet(List.of(
            DerivationChain.of("4", "2", "1"),
            DerivationChain.of("9")));

    @Test
    @DisplayName("Chain table joins members newest first")
    void chainTableLayout(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("fmp_edit_paths_chain.csv");

        ChainTable.write(file, chains);

        assertThat(Files.readAllLines(file)).containsExactly(
                "id,chain_length,derivation_chain",
                "4,3,4 -> 2 -> 1",
                "9,1,9");
        assertThat(ChainTable.read(file)).isEqualTo(chains);
    }

    @Test
    @DisplayName("Chain list holds members oldest first")
    void chainListLayout(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("fmp_edit_paths_chain_list.csv");

        ChainTable.writeList(file, chains);

        assertThat(Files.readAllLines(file)).contains("4,3,\"['1', '2', '4']\"");
        assertThat(ChainTable.readList(file)).isEqualTo(chains);
    }

    @Test
    @DisplayName("Chain repeating an id is malformed input")
    void repeatedIdRejected(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bad.csv");
        Files.writeString(file, "id,chain_length,derivation_chain\n1,3,1 -> 2 -> 1\n");

        assertThatThrownBy(() -> ChainTable.read(file))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("row 2");
    }

    @Test
    void overviewFigures() {
        ChainSet.Overview overview = chains.overview();

        assertThat(overview.chainCount()).isEqualTo(2);
        assertThat(overview.maxLength()).isEqualTo(3);
        assertThat(overview.initialScriptCount()).isEqualTo(2);
        assertThat(overview.lengthAtLeastFivePercent()).isZero();
    }
}
