package edictjava;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class LexiconHolderTest {

    private static final String RULES = "#h\npast\nた\tる\t384\t0\n";

    private static Lexicon lexicon(String entry) throws EdictParseException {
        return new Lexicon(RuleIndex.parse(RULES), DictionaryIndex.parse("h\n" + entry + "\n"), null,
                Deinflector.DEFAULT_MAX_SUFFIX_LENGTH);
    }

    @Test
    public void reloadSwapsInFreshLexicon() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        LexiconHolder holder = LexiconHolder.open(EdictConfig.defaults(), config ->
                loads.incrementAndGet() == 1
                        ? lexicon("見る [みる] /(v1) to see/")
                        : lexicon("見る [みる] /(v1) to look/"));

        assertEquals(List.of("見る [みる] /(v1) to see/"), holder.annotate("見た"));
        Lexicon before = holder.get();

        Lexicon after = holder.reload();

        assertNotSame(before, after);
        assertSame(after, holder.get());
        assertEquals(List.of("見る [みる] /(v1) to look/"), holder.annotate("見た"));
    }

    @Test
    public void failedReloadKeepsCurrentLexicon() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        LexiconHolder holder = LexiconHolder.open(EdictConfig.defaults(), config -> {
            if (loads.incrementAndGet() > 1) {
                throw new IOException("disk gone");
            }
            return lexicon("見る [みる] /(v1) to see/");
        });
        Lexicon before = holder.get();

        assertThrows(IOException.class, holder::reload);

        assertSame(before, holder.get());
        assertEquals(List.of("見る [みる] /(v1) to see/"), holder.annotate("見た"));
    }

    @Test
    public void openFailsWhenInitialLoadFails() {
        assertThrows(EdictParseException.class, () -> LexiconHolder.open(EdictConfig.defaults(),
                config -> {
                    throw EdictParseException.format(2, " /", "broken");
                }));
    }

    @Test
    public void lexiconWithoutNamesAnnotatesNoNames() throws Exception {
        LexiconHolder holder = LexiconHolder.open(EdictConfig.defaults(), config -> lexicon("日本 /(n) Japan/"));

        assertTrue(holder.annotateNames("日本").isEmpty());
    }

    @Test
    public void readersSeeACompleteLexiconWhileReloading() throws Exception {
        LexiconHolder holder = LexiconHolder.open(EdictConfig.defaults(), config -> lexicon("見る [みる] /(v1) to see/"));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<String>>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                if (i % 20 == 0) {
                    holder.reload();
                }
                results.add(pool.submit(() -> holder.annotate("見た")));
            }
            for (Future<List<String>> f : results) {
                assertEquals(List.of("見る [みる] /(v1) to see/"), f.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
