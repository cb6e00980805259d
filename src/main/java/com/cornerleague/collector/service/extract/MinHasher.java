package com.cornerleague.collector.service.extract;

import com.cornerleague.collector.util.TextNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.SplittableRandom;

/**
 * MinHash sketches over word shingles. Seeds are fixed, so signatures are comparable across restarts.
 */
@Component
public class MinHasher {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final int numPermutations;
    private final int shingleSize;
    private final long[] seeds;

    public MinHasher(
            @Value("${dedup.permutations:128}") int numPermutations,
            @Value("${dedup.shingle-size:3}") int shingleSize
    ) {
        if (numPermutations <= 0) throw new IllegalArgumentException("dedup.permutations must be > 0");
        this.numPermutations = numPermutations;
        this.shingleSize = Math.max(1, shingleSize);
        this.seeds = new long[numPermutations];
        SplittableRandom random = new SplittableRandom(0x5EED_C0DEL);
        for (int i = 0; i < numPermutations; i++) {
            seeds[i] = random.nextLong();
        }
    }

    public int numPermutations() {
        return numPermutations;
    }

    public long[] signature(String text) {
        String[] words = TextNormalizer.normalizeForHash(text).split(" ");
        long[] sig = new long[numPermutations];
        Arrays.fill(sig, Long.MAX_VALUE);

        if (words.length == 0 || (words.length == 1 && words[0].isEmpty())) {
            return sig;
        }

        int shingles = Math.max(1, words.length - shingleSize + 1);
        for (int s = 0; s < shingles; s++) {
            int end = Math.min(words.length, s + shingleSize);
            long h = fnv1a(words, s, end);
            for (int i = 0; i < numPermutations; i++) {
                long v = mix(h ^ seeds[i]);
                if (v < sig[i]) sig[i] = v;
            }
        }
        return sig;
    }

    public static double similarity(long[] a, long[] b) {
        if (a.length != b.length || a.length == 0) return 0.0;
        int equal = 0;
        for (int i = 0; i < a.length; i++) {
            if (a[i] == b[i]) equal++;
        }
        return (double) equal / a.length;
    }

    public static String encode(long[] signature) {
        ByteBuffer buf = ByteBuffer.allocate(signature.length * Long.BYTES);
        for (long v : signature) buf.putLong(v);
        return Base64.getEncoder().encodeToString(buf.array());
    }

    public static long[] decode(String encoded) {
        ByteBuffer buf = ByteBuffer.wrap(Base64.getDecoder().decode(encoded));
        long[] out = new long[buf.remaining() / Long.BYTES];
        for (int i = 0; i < out.length; i++) out[i] = buf.getLong();
        return out;
    }

    private static long fnv1a(String[] words, int from, int to) {
        long h = FNV_OFFSET;
        for (int w = from; w < to; w++) {
            if (w > from) {
                h ^= ' ';
                h *= FNV_PRIME;
            }
            for (byte b : words[w].getBytes(StandardCharsets.UTF_8)) {
                h ^= (b & 0xff);
                h *= FNV_PRIME;
            }
        }
        return h;
    }

    // splitmix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
