package com.example.tieredcache.loadgen;

import java.util.Random;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.JDKRandomGenerator;

/**
 * Picks the next key a load-generator thread requests. Instances are not thread-safe; give each
 * thread its own.
 */
public abstract class KeyWorkload {

    public abstract String nextKey();

    /** Popularity follows a Zipf law over {@code universe} keys: rank 1 is the hottest. */
    public static KeyWorkload zipf(int universe, double exponent, long seed) {
        JDKRandomGenerator rng = new JDKRandomGenerator();
        rng.setSeed(seed);
        ZipfDistribution zipf = new ZipfDistribution(rng, universe, exponent);
        return new KeyWorkload() {
            @Override
            public String nextKey() {
                return "key-" + zipf.sample();
            }
        };
    }

    /** {@code hotRatio} of requests go to the first {@code hotKeys} keys, the rest to the cold tail. */
    public static KeyWorkload hotCold(int totalKeys, int hotKeys, double hotRatio, long seed) {
        if (hotKeys <= 0 || hotKeys >= totalKeys) {
            throw new IllegalArgumentException("hotKeys must be between 1 and totalKeys - 1");
        }
        Random rand = new Random(seed);
        return new KeyWorkload() {
            @Override
            public String nextKey() {
                if (rand.nextDouble() < hotRatio) {
                    return "key-" + rand.nextInt(hotKeys);
                }
                return "key-" + (hotKeys + rand.nextInt(totalKeys - hotKeys));
            }
        };
    }

    /** Every request hits one key, to watch expiry under a stampede. */
    public static KeyWorkload herd(String key) {
        return new KeyWorkload() {
            @Override
            public String nextKey() {
                return key;
            }
        };
    }
}
