package edictjavacli;

import edictjava.EdictConfig;
import edictjava.EdictParseException;
import edictjava.Lexicon;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;

/**
 * Options shared by every subcommand that needs the dictionaries.
 */
public class LexiconOptions {

    @Option(names = {"-c", "--config"}, paramLabel = "<file>",
            description = "JSON configuration (default: dicts/edict_config.json, then built-in defaults)")
    File configFile;

    @Option(names = {"-d", "--dict-dir"}, paramLabel = "<dir>",
            description = "Directory holding deinflect.dat, edict2 and enamdict")
    String dictDir;

    @Option(names = {"--no-names"}, description = "Do not load the name dictionary")
    boolean noNames;

    @Option(names = {"-v", "--verbose"}, description = "Log dictionary loading to stderr")
    boolean verbose;

    EdictConfig resolveConfig() throws IOException {
        EdictConfig config = configFile != null ? EdictConfig.fromJson(configFile) : EdictConfig.load();
        if (dictDir != null) {
            config = config.withDictDir(dictDir);
        }
        if (noNames) {
            config = config.withoutNames();
        }
        return config;
    }

    Lexicon loadLexicon(EdictConfig config) throws IOException, EdictParseException {
        Lexicon.setVerboseLogging(verbose);
        return Lexicon.load(config);
    }
}
