package edictjava;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EdictConfigTest {

    @Test
    public void defaultsPointAtDictsDirectory() {
        EdictConfig config = EdictConfig.defaults();

        assertEquals("dicts", config.getDictDir());
        assertEquals("deinflect.dat", config.getDeinflectFile());
        assertEquals("edict2", config.getEdictFile());
        assertEquals("enamdict", config.getEnamdictFile());
        assertEquals(StandardCharsets.UTF_8, config.charset());
        assertEquals(Deinflector.DEFAULT_MAX_SUFFIX_LENGTH, config.getMaxSuffixLength());
        assertTrue(config.hasNames());
    }

    @Test
    public void missingPropertiesFallBackToDefaults() throws Exception {
        String json = "{\"dictDir\": \"/srv/edict\", \"charset\": \"EUC-JP\"}";

        EdictConfig config = EdictConfig.fromJson(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals("/srv/edict", config.getDictDir());
        assertEquals("EUC-JP", config.getCharset());
        assertEquals("edict2", config.getEdictFile());
        assertTrue(config.hasNames());
    }

    @Test
    public void emptyNameFileDisablesNames() throws Exception {
        String json = "{\"enamdict\": \"\"}";

        EdictConfig config = EdictConfig.fromJson(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertFalse(config.hasNames());
        assertFalse(EdictConfig.defaults().withoutNames().hasNames());
    }

    @Test
    public void writtenConfigReadsBackEqual(@TempDir Path dir) throws Exception {
        EdictConfig config = EdictConfig.defaults().withDictDir(dir.toString()).withoutNames();
        File file = dir.resolve(EdictConfig.CONFIG_FILE).toFile();

        config.writeJson(file);

        assertEquals(config, EdictConfig.fromJson(file));
        assertTrue(Files.readString(file.toPath()).contains("\"maxSuffixLength\""));
    }

    @Test
    public void invalidValuesAreRejected() {
        String zeroLength = "{\"maxSuffixLength\": 0}";
        String badCharset = "{\"charset\": \"no-such-charset\"}";

        assertThrows(IOException.class, () -> EdictConfig.fromJson(
                new ByteArrayInputStream(zeroLength.getBytes(StandardCharsets.UTF_8))));
        assertThrows(IOException.class, () -> EdictConfig.fromJson(
                new ByteArrayInputStream(badCharset.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    public void loadWithoutConfigFileGivesDefaults() throws Exception {
        assertEquals(EdictConfig.defaults(), EdictConfig.load());
    }
}
