package edictjavacli;

import com.fasterxml.jackson.databind.ObjectMapper;
import edictjava.Lexicon;
import edictjava.LookupMatch;
import picocli.CommandLine.*;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand looking up single words, reporting the inflections removed to reach each entry.
 */
@Command(name = "lookup", description = "\033[1;34mLook up words, undoing their inflections\033[0m",
        mixinStandardHelpOptions = true)
public class LookupCommand implements Callable<Integer> {

    @Mixin
    private LexiconOptions lexiconOptions = new LexiconOptions();

    @Parameters(arity = "1..*", paramLabel = "<word>", description = "Words to look up, e.g. 食べた")
    private List<String> words;

    @Option(names = {"--json"}, description = "Write matches as JSON")
    private boolean json;

    private static final Logger LOGGER = Logger.getLogger(LookupCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        try {
            Lexicon lexicon = lexiconOptions.loadLexicon(lexiconOptions.resolveConfig().withoutNames());

            Map<String, List<LookupMatch>> results = new LinkedHashMap<>();
            for (String word : words) {
                results.put(word, lexicon.lookup(word.trim()));
            }

            if (json) {
                ObjectMapper mapper = new ObjectMapper();
                String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(results);
                System.out.write((out + "\n").getBytes(StandardCharsets.UTF_8));
            } else {
                StringBuilder sb = new StringBuilder();
                for (Map.Entry<String, List<LookupMatch>> e : results.entrySet()) {
                    sb.append(BLUE).append(e.getKey()).append(RESET).append('\n');
                    if (e.getValue().isEmpty()) {
                        sb.append("  (no match)\n");
                    }
                    for (LookupMatch m : e.getValue()) {
                        sb.append("  ").append(m).append('\n');
                    }
                }
                System.out.write(sb.toString().getBytes(StandardCharsets.UTF_8));
            }
            System.out.flush();

            boolean anyMatch = results.values().stream().anyMatch(l -> !l.isEmpty());
            return anyMatch ? 0 : 2;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during lookup", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
