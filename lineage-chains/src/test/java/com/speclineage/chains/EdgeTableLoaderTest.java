package com.speclineage.chains;

import com.speclineage.api.exceptions.MalformedInputException;
import com.speclineage.api.model.EdgeTable;
import com.speclineage.api.model.ScriptId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EdgeTableLoaderTest {

    private final EdgeTableLoader loader = new EdgeTableLoader();

    @Test
    @DisplayName("JSON lines: float ids are normalized and NaN parents are roots")
    void jsonLines(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("fmp.json");
        Files.writeString(file, """
                {"id": 1.0, "parent": NaN, "smtlib": "(check-sat)"}
                {"id": 2.0, "parent": 1.0}

                {"id": "3", "parent": "2"}
                {"id": 4, "parent": null}
                """);

        EdgeTable table = loader.load(file);

        assertThat(table.ids()).extracting(ScriptId::value).containsExactly("1", "2", "3", "4");
        assertThat(table.parentOf(ScriptId.of("1"))).isEmpty();
        assertThat(table.parentOf(ScriptId.of("2"))).contains(ScriptId.of("1"));
        assertThat(table.parentOf(ScriptId.of("3"))).contains(ScriptId.of("2"));
        assertThat(table.parentOf(ScriptId.of("4"))).isEmpty();
    }

    @Test
    @DisplayName("JSON integer ids beyond double precision keep every digit")
    void largeIntegerIds(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("big.json");
        Files.writeString(file, """
                {"id": 9007199254740992, "parent": NaN}
                {"id": 9007199254740993, "parent": 9007199254740992}
                {"id": 123456789012345678901234567890, "parent": 9007199254740993}
                """);

        EdgeTable table = loader.load(file);

        assertThat(table.ids()).extracting(ScriptId::value).containsExactly(
                "9007199254740992", "9007199254740993", "123456789012345678901234567890");
        assertThat(table.parentOf(ScriptId.of("9007199254740993"))).contains(ScriptId.of("9007199254740992"));
        assertThat(table.parentOf(ScriptId.of("123456789012345678901234567890")))
                .contains(ScriptId.of("9007199254740993"));
    }

    @Test
    @DisplayName("CSV with id and parent columns")
    void csv(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("edges.csv");
        Files.writeString(file, "id,parent\n1,\n2,1.0\n3,nan\n");

        EdgeTable table = loader.load(file);

        assertThat(table.size()).isEqualTo(3);
        assertThat(table.parentOf(ScriptId.of("2"))).contains(ScriptId.of("1"));
        assertThat(table.parentOf(ScriptId.of("3"))).isEmpty();
    }

    @Test
    @DisplayName("Invalid JSON line is malformed input")
    void invalidJson(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{\"id\": 1}\n{not json\n");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("line 2");
    }

    @Test
    void rowWithoutIdIsMalformed(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("noid.json");
        Files.writeString(file, "{\"parent\": 1}\n");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(MalformedInputException.class);
    }

    @Test
    void missingFileIsMalformed(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.json")))
                .isInstanceOf(MalformedInputException.class);
    }
}
