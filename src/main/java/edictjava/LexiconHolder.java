package edictjava;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-lived access point to the current {@link Lexicon} of a service.
 *
 * <p>The lexicon is held in an {@link AtomicReference}. {@link #reload()} builds a
 * complete replacement from the configuration before swapping it in, so readers
 * always see either the old or the new lexicon, never a partially built one. A
 * failed reload leaves the current lexicon in place.</p>
 */
public final class LexiconHolder {
    private static final Logger LOGGER = Logger.getLogger(LexiconHolder.class.getName());

    /**
     * Builds a lexicon from a configuration; {@link Lexicon#load(EdictConfig)} in production.
     */
    @FunctionalInterface
    public interface Loader {
        Lexicon load(EdictConfig config) throws IOException, EdictParseException;
    }

    private final EdictConfig config;
    private final Loader loader;
    private final AtomicReference<Lexicon> current;

    private LexiconHolder(EdictConfig config, Loader loader, Lexicon initial) {
        this.config = config;
        this.loader = loader;
        this.current = new AtomicReference<>(initial);
    }

    /**
     * Loads the initial lexicon. Fails, and so refuses to start the caller, if any data
     * file is missing or malformed.
     *
     * @param config data locations
     * @return holder with a fully loaded lexicon
     * @throws IOException         if a file is missing or unreadable
     * @throws EdictParseException if a file is malformed
     */
    public static LexiconHolder open(EdictConfig config) throws IOException, EdictParseException {
        return open(config, Lexicon::load);
    }

    /**
     * Variant of {@link #open(EdictConfig)} with a custom loader.
     */
    public static LexiconHolder open(EdictConfig config, Loader loader) throws IOException, EdictParseException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(loader, "loader");
        Lexicon initial = Objects.requireNonNull(loader.load(config), "loader returned null");
        return new LexiconHolder(config, loader, initial);
    }

    /**
     * @return the lexicon currently in service
     */
    public Lexicon get() {
        return current.get();
    }

    public EdictConfig getConfig() {
        return config;
    }

    /**
     * Rebuilds the lexicon from the data files and swaps it in.
     *
     * @return the new lexicon
     * @throws IOException         if a file is missing or unreadable; the old lexicon stays
     * @throws EdictParseException if a file is malformed; the old lexicon stays
     */
    public Lexicon reload() throws IOException, EdictParseException {
        Lexicon fresh;
        try {
            fresh = Objects.requireNonNull(loader.load(config), "loader returned null");
        } catch (IOException | EdictParseException e) {
            LOGGER.log(Level.WARNING, "Reload failed, keeping current lexicon", e);
            throw e;
        }
        Lexicon previous = current.getAndSet(fresh);
        LOGGER.info(() -> "Reloaded lexicon: " + previous + " → " + fresh);
        return fresh;
    }

    /**
     * Word sub-dictionary of {@code text} against the current lexicon.
     */
    public List<String> annotate(String text) {
        return current.get().annotate(text);
    }

    /**
     * Name sub-dictionary of {@code text} against the current lexicon.
     */
    public List<String> annotateNames(String text) {
        return current.get().annotateNames(text);
    }
}
