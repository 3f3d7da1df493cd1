package com.wordchains.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic Fisher-Yates shuffle driven by a mulberry32 generator seeded from text.
 * The same seed text always yields the same order, in any process.
 */
public final class SeededShuffle {

    private SeededShuffle() {
    }

    /**
     * Shuffle a copy of the given items using the seed text.
     *
     * @param items    The items to shuffle (not modified)
     * @param seedText A stable seed, usually a puzzle id or user id
     * @return A new list holding a permutation of the items
     */
    public static <T> List<T> shuffle(List<T> items, String seedText) {
        List<T> result = new ArrayList<>(items);
        Mulberry32 random = new Mulberry32(hash(seedText));
        for (int i = result.size() - 1; i > 0; i--) {
            int j = (int) Math.floor(random.next() * (i + 1));
            Collections.swap(result, i, j);
        }
        return result;
    }

    /**
     * Fold the seed text into a signed 32-bit integer, h = (h << 5) - h + c per UTF-16 unit.
     */
    public static int hash(String seedText) {
        int h = 0;
        for (int i = 0; i < seedText.length(); i++) {
            h = (h << 5) - h + seedText.charAt(i);
        }
        return h;
    }

    /**
     * 32-bit mulberry32 generator producing doubles in [0, 1).
     */
    public static final class Mulberry32 {
        private int state;

        public Mulberry32(int seed) {
            this.state = seed;
        }

        public double next() {
            state += 0x6D2B79F5;
            int x = state;
            x = (x ^ (x >>> 15)) * (x | 1);
            x ^= x + (x ^ (x >>> 7)) * (x | 61);
            return ((x ^ (x >>> 14)) & 0xFFFFFFFFL) / 4294967296.0;
        }
    }
}
