package com.tilemerge.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.tilemerge.core.ai.SearchConstraints.SearchMode;
import org.junit.jupiter.api.Test;

class SearchConstraintsTest {

    @Test
    void defaultsMatchTunedValues() {
        SearchConstraints defaults = SearchConstraints.defaults();

        assertEquals(1e-4, defaults.probabilityThreshold());
        assertEquals(6, defaults.cacheDepth());
        assertEquals(3, defaults.minDepthLimit());
        assertEquals(1, defaults.parallelSplitDepth());
        assertEquals(SearchMode.PAR, defaults.mode());
    }

    @Test
    void withersReplaceSingleField() {
        SearchConstraints constraints = SearchConstraints.defaults().withMode(SearchMode.SEQ).withCacheDepth(0);

        assertEquals(SearchMode.SEQ, constraints.mode());
        assertEquals(0, constraints.cacheDepth());
        assertEquals(1e-4, constraints.probabilityThreshold());
    }

    @Test
    void rejectsInvalidValues() {
        SearchConstraints defaults = SearchConstraints.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withProbabilityThreshold(-0.1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withProbabilityThreshold(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> defaults.withCacheDepth(-1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withMinDepthLimit(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withParallelSplitDepth(-1));
        assertThrows(NullPointerException.class, () -> defaults.withMode(null));
    }
}
