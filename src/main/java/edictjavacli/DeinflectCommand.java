package edictjavacli;

import edictjava.Candidate;
import edictjava.Deinflector;
import edictjava.EdictConfig;
import edictjava.Lexicon;
import edictjava.RuleIndex;
import picocli.CommandLine.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand listing every deinflection candidate of a word, without dictionary lookup.
 */
@Command(name = "deinflect", description = "\033[1;34mList the candidate dictionary forms of a word\033[0m",
        mixinStandardHelpOptions = true)
public class DeinflectCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "<word>", description = "Inflected word, e.g. 書かなかった")
    private String word;

    @Option(names = {"-r", "--rules"}, paramLabel = "<file>",
            description = "Rule file (default: deinflect.dat from the configuration)")
    private File rulesFile;

    @Option(names = {"-c", "--config"}, paramLabel = "<file>", description = "JSON configuration")
    private File configFile;

    @Option(names = {"--limit"}, paramLabel = "<n>", defaultValue = "10000",
            description = "Stop after this many candidates (default: ${DEFAULT-VALUE})")
    private int limit;

    private static final Logger LOGGER = Logger.getLogger(DeinflectCommand.class.getName());

    @Override
    public Integer call() {
        try {
            EdictConfig config = configFile != null ? EdictConfig.fromJson(configFile) : EdictConfig.load();
            RuleIndex rules = rulesFile != null
                    ? RuleIndex.load(rulesFile.toPath(), config.charset())
                    : Lexicon.loadRules(config);
            Deinflector deinflector = new Deinflector(rules, config.getMaxSuffixLength());

            StringBuilder sb = new StringBuilder();
            int count = 0;
            Iterator<Candidate> it = deinflector.deinflect(word.trim());
            while (it.hasNext() && count < limit) {
                sb.append(it.next()).append('\n');
                count++;
            }
            if (it.hasNext()) {
                System.err.println("⚠️ Stopped after " + limit + " candidates; the rule file may contain a cycle");
            }
            System.out.write(sb.toString().getBytes(StandardCharsets.UTF_8));
            System.out.flush();
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during deinflection", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
