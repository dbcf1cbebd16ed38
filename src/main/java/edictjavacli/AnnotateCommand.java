package edictjavacli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edictjava.Annotator;
import edictjava.EdictConfig;
import edictjava.Lexicon;
import htmlhelper.StoryText;
import picocli.CommandLine.*;

import java.io.File;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand building the sub-dictionary of a text.
 */
@Command(name = "annotate", description = "\033[1;34mList the dictionary entries of the words in a text\033[0m",
        mixinStandardHelpOptions = true)
public class AnnotateCommand implements Callable<Integer> {

    @Mixin
    private LexiconOptions lexiconOptions = new LexiconOptions();

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file (default: stdin)")
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    private File output;

    @Option(names = {"-n", "--names"}, description = "Also list name dictionary entries")
    private boolean names;

    @Option(names = {"--html"}, description = "Input is story HTML; ruby readings and markup are dropped")
    private boolean html;

    @Option(names = {"--json"}, description = "Write {\"edict\": [...], \"enamdict\": [...]} instead of lines")
    private boolean json;

    @Option(names = {"--in-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Input encoding")
    private String inEncoding;

    private static final Logger LOGGER = Logger.getLogger(AnnotateCommand.class.getName());

    @Override
    public Integer call() {
        try {
            String text = input != null
                    ? Files.readString(input.toPath(), Charset.forName(inEncoding))
                    : new String(System.in.readAllBytes(), Charset.forName(inEncoding));
            if (html) {
                text = StoryText.toText(text);
            }

            // the name dictionary is only required with --names
            EdictConfig config = lexiconOptions.resolveConfig();
            Lexicon lexicon = lexiconOptions.loadLexicon(names ? config : config.withoutNames());
            List<String> edict = lexicon.annotate(text);
            List<String> enamdict = names ? lexicon.annotateNames(text) : List.of();

            String rendered = json ? renderJson(edict, enamdict) : renderLines(edict, enamdict);
            if (output != null) {
                Files.writeString(output.toPath(), rendered, StandardCharsets.UTF_8);
                System.err.println("ℹ️ " + edict.size() + " entries"
                        + (names ? " + " + enamdict.size() + " names" : "") + " written to " + output);
            } else {
                System.out.write(rendered.getBytes(StandardCharsets.UTF_8));
                System.out.flush();
            }
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during annotation", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    private String renderLines(List<String> edict, List<String> enamdict) {
        if (!names) {
            return Annotator.export(edict);
        }
        return Annotator.export(edict) + "\n" + Annotator.export(enamdict);
    }

    static String renderJson(List<String> edict, List<String> enamdict) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = mapper.createObjectNode();
        ArrayNode words = root.putArray("edict");
        edict.forEach(words::add);
        ArrayNode nameLines = root.putArray("enamdict");
        enamdict.forEach(nameLines::add);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
    }
}
