package gotham.chess.engine.search;

import gotham.chess.engine.book.BookPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SearchConfigTest {

    @Test
    public void defaultsMatchTheTacticalEngine() {
        SearchConfig cfg = SearchConfig.defaults();
        assertEquals(4, cfg.baseDepth);
        assertEquals(5, cfg.maxDepth());
        assertEquals(3, cfg.quiescenceDepth);
        assertEquals(8, cfg.noisyCap);
        assertEquals(4, new SearchConfig.Builder().adaptiveDepth(false).build().maxDepth());
    }

    @Test
    public void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().baseDepth(-1).build());
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().noisyCap(-1).build());
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().quiescenceDepth(-2).build());
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().defaultTimeNs(0).build());
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().bookPolicy(null).build());
        assertThrows(IllegalArgumentException.class, () -> new SearchConfig.Builder().baseDepth(70).build());
    }

    @Test
    public void invalidBookPolicyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BookPolicy(-1, 1, 0, true));
        assertThrows(IllegalArgumentException.class, () -> new BookPolicy(20, 1, 101, true));
    }

    @Test
    public void budgetFallsBackToTheDefaultAndIsCapped() {
        SearchConfig cfg = SearchConfig.defaults();
        assertEquals(Duration.ofSeconds(1).toNanos(), TimeControl.computeBudgetNs(0, cfg));
        assertEquals(Duration.ofSeconds(1).toNanos(), TimeControl.computeBudgetNs(-5, cfg));
        assertEquals(Duration.ofMillis(250).toNanos(), TimeControl.computeBudgetNs(250, cfg));
        assertEquals(Duration.ofSeconds(120).toNanos(), TimeControl.computeBudgetNs(Duration.ofHours(1).toMillis(), cfg));
    }

    @Test
    public void unboundedBudgetIsCappedWithoutOverflow() {
        SearchConfig cfg = SearchConfig.defaults();
        assertEquals(Duration.ofSeconds(120).toNanos(), TimeControl.computeBudgetNs(Long.MAX_VALUE, cfg));
        assertEquals(Duration.ofSeconds(120).toNanos(), TimeControl.computeBudgetNs(Long.MAX_VALUE / 1000, cfg));
    }
}
