package edictjava;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Locations and tuning of the lexicon data, read once at startup and passed to
 * {@link Lexicon#load(EdictConfig)}.
 *
 * <p>JSON form (all properties optional):</p>
 * <pre>{@code
 * {
 *   "dictDir": "dicts",
 *   "deinflect": "deinflect.dat",
 *   "edict": "edict2",
 *   "enamdict": "enamdict",
 *   "charset": "UTF-8",
 *   "maxSuffixLength": 9
 * }
 * }</pre>
 *
 * <p>Setting {@code "enamdict"} to an empty string disables the name dictionary.</p>
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class EdictConfig {
    /**
     * Default configuration file name, looked up under {@code dicts/}.
     */
    public static final String CONFIG_FILE = "edict_config.json";

    private static final String DEFAULT_DIR = "dicts";
    private static final String DEFAULT_DEINFLECT = "deinflect.dat";
    private static final String DEFAULT_EDICT = "edict2";
    private static final String DEFAULT_ENAMDICT = "enamdict";
    private static final String DEFAULT_CHARSET = "UTF-8";

    private final String dictDir;
    private final String deinflectFile;
    private final String edictFile;
    private final String enamdictFile;
    private final String charset;
    private final int maxSuffixLength;

    @JsonCreator
    public EdictConfig(@JsonProperty("dictDir") String dictDir,
                       @JsonProperty("deinflect") String deinflectFile,
                       @JsonProperty("edict") String edictFile,
                       @JsonProperty("enamdict") String enamdictFile,
                       @JsonProperty("charset") String charset,
                       @JsonProperty("maxSuffixLength") Integer maxSuffixLength) {
        this.dictDir = dictDir != null ? dictDir : DEFAULT_DIR;
        this.deinflectFile = deinflectFile != null ? deinflectFile : DEFAULT_DEINFLECT;
        this.edictFile = edictFile != null ? edictFile : DEFAULT_EDICT;
        this.enamdictFile = enamdictFile != null ? enamdictFile : DEFAULT_ENAMDICT;
        this.charset = charset != null ? charset : DEFAULT_CHARSET;
        this.maxSuffixLength = maxSuffixLength != null ? maxSuffixLength : Deinflector.DEFAULT_MAX_SUFFIX_LENGTH;

        Charset.forName(this.charset); // fail early on unknown charsets
        if (this.maxSuffixLength < 1) {
            throw new IllegalArgumentException("maxSuffixLength must be positive: " + this.maxSuffixLength);
        }
    }

    /**
     * @return configuration reading {@code dicts/deinflect.dat}, {@code dicts/edict2} and
     * {@code dicts/enamdict} as UTF-8
     */
    public static EdictConfig defaults() {
        return new EdictConfig(null, null, null, null, null, null);
    }

    /**
     * Resolves the configuration to use.
     *
     * <ol>
     *   <li>{@code dicts/edict_config.json} in the working directory</li>
     *   <li>{@code /dicts/edict_config.json} on the classpath</li>
     *   <li>{@link #defaults()}</li>
     * </ol>
     *
     * @return the configuration
     * @throws IOException if a configuration file exists but cannot be read or parsed
     */
    public static EdictConfig load() throws IOException {
        Path fsPath = Paths.get(DEFAULT_DIR, CONFIG_FILE);
        if (Files.exists(fsPath)) {
            return fromJson(fsPath.toFile());
        }
        try (InputStream in = EdictConfig.class.getResourceAsStream("/" + DEFAULT_DIR + "/" + CONFIG_FILE)) {
            if (in != null) return fromJson(in);
        }
        return defaults();
    }

    public static EdictConfig fromJson(File jsonFile) throws IOException {
        return new ObjectMapper().readValue(jsonFile, EdictConfig.class);
    }

    public static EdictConfig fromJson(InputStream in) throws IOException {
        return new ObjectMapper().readValue(in, EdictConfig.class);
    }

    /**
     * Writes this configuration as pretty-printed JSON.
     *
     * @param out destination file
     * @throws IOException if writing fails
     */
    public void writeJson(File out) throws IOException {
        new ObjectMapper().writerWithDefaultPrettyPrinter().writeValue(out, this);
    }

    /**
     * Returns a copy without the name dictionary.
     *
     * @return new configuration
     */
    public EdictConfig withoutNames() {
        return new EdictConfig(dictDir, deinflectFile, edictFile, "", charset, maxSuffixLength);
    }

    /**
     * Returns a copy reading all files from {@code dir}.
     *
     * @param dir dictionary directory (filesystem path or classpath prefix)
     * @return new configuration
     */
    public EdictConfig withDictDir(String dir) {
        return new EdictConfig(dir, deinflectFile, edictFile, enamdictFile, charset, maxSuffixLength);
    }

    @JsonProperty("dictDir")
    public String getDictDir() {
        return dictDir;
    }

    @JsonProperty("deinflect")
    public String getDeinflectFile() {
        return deinflectFile;
    }

    @JsonProperty("edict")
    public String getEdictFile() {
        return edictFile;
    }

    /**
     * @return name dictionary file, empty when names are disabled
     */
    @JsonProperty("enamdict")
    public String getEnamdictFile() {
        return enamdictFile;
    }

    @JsonIgnore
    public boolean hasNames() {
        return !enamdictFile.isEmpty();
    }

    @JsonProperty("charset")
    public String getCharset() {
        return charset;
    }

    @JsonProperty("maxSuffixLength")
    public int getMaxSuffixLength() {
        return maxSuffixLength;
    }

    @JsonIgnore
    public Charset charset() {
        return Charset.forName(charset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdictConfig)) return false;
        EdictConfig that = (EdictConfig) o;
        return maxSuffixLength == that.maxSuffixLength
                && dictDir.equals(that.dictDir)
                && deinflectFile.equals(that.deinflectFile)
                && edictFile.equals(that.edictFile)
                && enamdictFile.equals(that.enamdictFile)
                && charset.equals(that.charset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dictDir, deinflectFile, edictFile, enamdictFile, charset, maxSuffixLength);
    }

    @Override
    public String toString() {
        return "EdictConfig{dictDir=" + dictDir + ", deinflect=" + deinflectFile + ", edict=" + edictFile
                + ", enamdict=" + enamdictFile + ", charset=" + charset
                + ", maxSuffixLength=" + maxSuffixLength + "}";
    }
}
