package ai.eigloo.questionnaire.diagram.external;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalReferencesLoaderTest {

    @TempDir
    Path tempDir;

    private ExternalReferencesLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ExternalReferencesLoader();
    }

    @Test
    void testLoadsFlagsAndNumerics() throws IOException {
        Path file = tempDir.resolve("externals.json");
        Files.writeString(file, "{\"flags\": [\"fever_flag\", \"cough_flag\"], \"numeric\": [\"bmi\"], \"version\": 2}");

        ExternalReferences references = loader.load(file);

        assertThat(references.flags()).containsExactlyInAnyOrder("fever_flag", "cough_flag");
        assertThat(references.isFlagReference("fever_flag")).isTrue();
        assertThat(references.isNumericReference("bmi")).isTrue();
        assertThat(references.isNumericReference("fever_flag")).isFalse();
        assertThat(references.numeric()).containsExactly("bmi");
    }

    @Test
    void testMissingSectionsAreEmpty() {
        ExternalReferences references = loader.load(stream("{\"flags\": [\"a\"]}"));

        assertThat(references.flags()).containsExactly("a");
        assertThat(references.numeric()).isEmpty();
    }

    @Test
    void testMissingFileYieldsEmptyRegistry() {
        ExternalReferences references = loader.load(tempDir.resolve("absent.json"));

        assertThat(references.flags()).isEmpty();
        assertThat(references.numeric()).isEmpty();
    }

    @Test
    void testMalformedJsonYieldsEmptyRegistry() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"flags\": [");

        assertThat(loader.load(file)).isEqualTo(ExternalReferences.empty());
        assertThat(loader.load(stream(""))).isEqualTo(ExternalReferences.empty());
    }

    @Test
    void testNullPathYieldsEmptyRegistry() {
        assertThat(loader.load((Path) null)).isEqualTo(ExternalReferences.empty());
    }

    @Test
    void testNoneOracleKnowsNothing() {
        ExternalReferenceOracle oracle = ExternalReferenceOracle.none();

        assertThat(oracle.isFlagReference("anything")).isFalse();
        assertThat(oracle.isNumericReference(null)).isFalse();
    }

    private static ByteArrayInputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
