package edictjavacli;

import edictjava.EdictConfig;
import edictjava.Lexicon;
import picocli.CommandLine.*;

import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand loading the lexicon and printing its size; a quick check that the data
 * files parse.
 */
@Command(name = "stats", description = "\033[1;34mLoad the dictionaries and print their sizes\033[0m",
        mixinStandardHelpOptions = true)
public class StatsCommand implements Callable<Integer> {

    @Mixin
    private LexiconOptions lexiconOptions = new LexiconOptions();

    private static final Logger LOGGER = Logger.getLogger(StatsCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        try {
            EdictConfig config = lexiconOptions.resolveConfig();
            long t0 = System.nanoTime();
            Lexicon lexicon = lexiconOptions.loadLexicon(config);
            long ms = (System.nanoTime() - t0) / 1_000_000;

            System.out.println("Configuration : " + config);
            System.out.println("Rules         : " + lexicon.getRules().ruleCount()
                    + " rules, " + lexicon.getRules().suffixCount() + " suffixes, "
                    + lexicon.getRules().reasons().size() + " reasons, longest suffix "
                    + lexicon.getRules().maxSuffixLength());
            System.out.println("EDICT2        : " + lexicon.getWords().entryCount()
                    + " entries, " + lexicon.getWords().keyCount() + " keys");
            if (lexicon.hasNames()) {
                System.out.println("ENAMDICT      : " + lexicon.getNames().entryCount()
                        + " entries, " + lexicon.getNames().keyCount() + " keys");
            }
            System.out.println(BLUE + "Loaded in " + ms + " ms" + RESET);
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error while loading dictionaries", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
