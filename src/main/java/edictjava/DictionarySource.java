package edictjava;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads lexicon data files, first from the filesystem under a base directory, then
 * from the classpath under {@code /baseDir/}.
 */
final class DictionarySource {

    private DictionarySource() {
    }

    /**
     * Reads the whole content of a data file.
     *
     * @param basePath directory (filesystem) or resource prefix (classpath)
     * @param filename file name inside {@code basePath}
     * @param charset  encoding of the file
     * @return the file content
     * @throws FileNotFoundException if neither location has the file
     * @throws IOException           if reading fails
     */
    static String readText(String basePath, String filename, Charset charset) throws IOException {
        final Path fsPath = Paths.get(basePath, filename);
        if (Files.exists(fsPath)) {
            return Files.readString(fsPath, charset);
        }

        final String resPath = "/" + basePath + "/" + filename;
        try (InputStream in = DictionarySource.class.getResourceAsStream(resPath)) {
            if (in == null) throw new FileNotFoundException("Missing resource: " + resPath +
                    " (also checked FS: " + fsPath.toAbsolutePath() + ")");
            return new String(in.readAllBytes(), charset);
        }
    }

    /**
     * Reads and parses the rule file named by {@code config}.
     */
    static RuleIndex loadRules(EdictConfig config) throws IOException, EdictParseException {
        return RuleIndex.parse(readText(config.getDictDir(), config.getDeinflectFile(), config.charset()));
    }

    /**
     * Reads and parses a dictionary file of {@code config}'s directory.
     */
    static DictionaryIndex loadDictionary(EdictConfig config, String filename)
            throws IOException, EdictParseException {
        return DictionaryIndex.parse(readText(config.getDictDir(), filename, config.charset()));
    }
}
