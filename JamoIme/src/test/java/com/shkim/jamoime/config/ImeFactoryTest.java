package com.shkim.jamoime.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.io.TempDir;

import com.shkim.jamoime.core.DisplayMode;
import com.shkim.jamoime.core.JamoCommitPolicy;
import com.shkim.jamoime.core.NonJamoCommitPolicy;
import com.shkim.jamoime.core.OrderMode;
import com.shkim.jamoime.core.ProcessorConfig;
import com.shkim.jamoime.core.TransitionCommitPolicy;
import com.shkim.jamoime.ime.ConfigurableKoreanIme;
import com.shkim.jamoime.ime.ImeResult;
import com.shkim.jamoime.ime.KoreanIme;
import com.shkim.jamoime.layout.CheonJiIn;
import com.shkim.jamoime.layout.StandardDubeolsik;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ImeFactoryTest {

    private String minimal;

    @BeforeAll
    void setUp() throws IOException {
        minimal = ConfigurationLoaderTest.readResource("/documents/minimal.json");
    }

    private static ConfigurationException.Kind failure(String json) {
        return assertThrows(ConfigurationException.class, () -> ImeFactory.create(ConfigurationLoader.load(json))).getKind();
    }

    @Test
    void minimalDocumentBuildsWorkingIme() {
        ConfigurableKoreanIme ime = ImeFactory.create(ConfigurationLoader.load(minimal));
        assertEquals("minimal", ime.getIdentifier());
        assertEquals("최소 배열", ime.getName());

        ime.input("g");
        ime.input("a");
        ImeResult trail = ime.input("n");
        assertEquals("", trail.committed());
        assertEquals("간", trail.composing());
        ImeResult split = ime.input("a");
        assertEquals("가", split.committed());
        assertEquals("나", split.composing());
        ImeResult dot = ime.input(".");
        assertEquals("나", dot.committed());
        assertEquals(".", dot.composing());
    }

    @Test
    void configValuesAreMapped() {
        ProcessorConfig config = ImeFactory.create(ConfigurationLoader.load(minimal)).getProcessor().config();
        ProcessorConfig expected = new ProcessorConfig.Builder()
                .setOrderMode(OrderMode.SEQUENTIAL)
                .setJamoCommitPolicy(JamoCommitPolicy.SYLLABLE)
                .setNonJamoCommitPolicy(NonJamoCommitPolicy.CHARACTER)
                .setTransitionCommitPolicy(TransitionCommitPolicy.ALWAYS)
                .setDisplayMode(DisplayMode.MODERN_MULTIPLE)
                .setSupportStandaloneCluster(false)
                .build();
        assertEquals(expected, config);
    }

    @Test
    void invalidEnumeratedValuesHaveTheirOwnKinds() {
        assertEquals(ConfigurationException.Kind.INVALID_ORDER_MODE,
                failure(minimal.replace("\"sequential\"", "\"diagonal\"")));
        assertEquals(ConfigurationException.Kind.INVALID_COMMIT_POLICY,
                failure(minimal.replace("\"syllable\"", "\"word\"")));
        assertEquals(ConfigurationException.Kind.INVALID_COMMIT_POLICY,
                failure(minimal.replace("\"always\"", "\"sometimes\"")));
        assertEquals(ConfigurationException.Kind.INVALID_DISPLAY_MODE,
                failure(minimal.replace("\"modernMultiple\"", "\"cursive\"")));
    }

    @Test
    void missingJamoAutomatonIsReported() {
        String json = minimal.replace("\"jongseong\": {", "\"unused\": {");
        assertEquals(ConfigurationException.Kind.MISSING_AUTOMATON, failure(json));
    }

    @Test
    void brokenTablesAreInvalidDocuments() {
        assertEquals(ConfigurationException.Kind.INVALID_DOCUMENT,
                failure(minimal.replace("{\"from\": \"\", \"input\": \"ㅏ\", \"to\": \"ㅏ\"}", "{\"from\": \"\", \"input\": \"ㅏ\"}")));
        assertEquals(ConfigurationException.Kind.INVALID_DOCUMENT,
                failure(minimal.replace("{\"jongseong\": \"ㄱ\", \"moved\": \"ㄱ\"}", "{\"jongseong\": \"ㄱ\"}")));
        assertEquals(ConfigurationException.Kind.INVALID_DOCUMENT,
                failure(minimal.replace("\"g\": {\"identifier\": \"ㄱ\", ", "\"g\": {")));
    }

    @Test
    void nullTableEntriesAreInvalidDocuments() {
        assertEquals(ConfigurationException.Kind.INVALID_DOCUMENT,
                failure(minimal.replace("{\"from\": \"\", \"input\": \"ㅏ\", \"to\": \"ㅏ\"}", "null")));
        assertEquals(ConfigurationException.Kind.INVALID_DOCUMENT,
                failure(minimal.replace("{\"jongseong\": \"ㄱ\", \"moved\": \"ㄱ\"}", "null")));
        assertEquals(ConfigurationException.Kind.INVALID_DOCUMENT,
                failure(minimal.replace("\"nonJamo\": {", "\"backspace\": {\"transitions\": [null]},\n    \"nonJamo\": {")));
    }

    @Test
    void createsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("minimal.json");
        Files.write(file, minimal.getBytes(StandardCharsets.UTF_8));
        assertEquals("minimal", ImeFactory.createFromFile(file).getIdentifier());
        assertEquals(ConfigurationException.Kind.RESOURCE_NOT_FOUND,
                assertThrows(ConfigurationException.class, () -> ImeFactory.createFromFile(dir.resolve("absent.json"))).getKind());
    }

    @Test
    void createsFromResource() {
        assertEquals("최소 배열", ImeFactory.createFromResource("/documents/minimal.json").getName());
        assertEquals(ConfigurationException.Kind.RESOURCE_NOT_FOUND,
                assertThrows(ConfigurationException.class, () -> ImeFactory.createFromResource("/documents/absent.json")).getKind());
    }

    @Test
    void bundledDubeolsikMatchesBuiltInLayout() {
        String[] keys = {"d", "k", "s", "s", "u", "d", "g", "k", "t", "p", "d", "y", ".", "R", "h", "k", "f", "r", "l"};
        assertSameBehaviour(StandardDubeolsik.create(), ImeFactory.createFromPreset(Preset.STANDARD_DUBEOLSIK), keys);
    }

    @Test
    void bundledCheonJiInMatchesBuiltInLayout() {
        String[] keys = {"e", "2", "3", "x", "s", "s", "1", "2", "1", "x", "x", "3", "2", "w", "w", "q", "2", "3", "1", "2",
                "c", "c", "w", "2", "w", "s", "s", "1", "a", "a", "1"};
        assertSameBehaviour(CheonJiIn.create(), ImeFactory.createFromPreset(Preset.CHEONJIIN), keys);
    }

    private static void assertSameBehaviour(KoreanIme expected, KoreanIme actual, String[] keys) {
        for (String key : keys) {
            assertEquals(expected.input(key), actual.input(key), key);
        }
        for (int i = 0; i < keys.length; i++) {
            assertEquals(expected.backspace(), actual.backspace());
        }
        assertEquals(expected.getLayout(), actual.getLayout());
        assertEquals(expected.getProcessor().config(), actual.getProcessor().config());
    }
}
