package com.eainde.policylens.sentinel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp similarity over characters: {@code 2·M / T}, where {@code M} is the total
 * size of the matching blocks found by recursively taking the longest common substring and
 * {@code T} is the combined length of both texts.
 *
 * <p>No element is treated as junk, so results are stable regardless of how often a
 * character repeats.</p>
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {
    }

    /**
     * @return similarity in [0,1]; 1.0 for two empty texts
     */
    public static double ratio(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        int total = left.length() + right.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(left, right) / total;
    }

    /**
     * Total size of the matching blocks between {@code a} and {@code b}.
     */
    static int matchingCharacters(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return 0;

        Map<Character, int[]> positions = positions(b);
        int[] lengths = new int[b.length() + 1];
        int[] nextLengths = new int[b.length() + 1];

        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];

            int[] match = longestMatch(a, positions, alo, ahi, blo, bhi, lengths, nextLengths);
            int i = match[0], j = match[1], size = match[2];
            if (size == 0) continue;

            matched += size;
            if (alo < i && blo < j) {
                queue.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                queue.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest common block in {@code a[alo:ahi]} and {@code b[blo:bhi]}; ties go to the block
     * starting earliest in {@code a}, then earliest in {@code b}.
     *
     * <p>{@code lengths[j + 1]} holds the length of the match ending at {@code a[i - 1]} and
     * {@code b[j]}; entries touched for one row are cleared before the next.</p>
     */
    private static int[] longestMatch(String a, Map<Character, int[]> positions,
                                      int alo, int ahi, int blo, int bhi,
                                      int[] lengths, int[] nextLengths) {
        int bestI = alo, bestJ = blo, bestSize = 0;
        List<Integer> touched = new ArrayList<>();
        List<Integer> nextTouched = new ArrayList<>();

        for (int i = alo; i < ahi; i++) {
            int[] js = positions.get(a.charAt(i));
            if (js != null) {
                for (int j : js) {
                    if (j < blo) continue;
                    if (j >= bhi) break;
                    int k = lengths[j] + 1;
                    nextLengths[j + 1] = k;
                    nextTouched.add(j + 1);
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            for (int index : touched) lengths[index] = 0;
            touched.clear();

            int[] swap = lengths;
            lengths = nextLengths;
            nextLengths = swap;
            List<Integer> swapTouched = touched;
            touched = nextTouched;
            nextTouched = swapTouched;
        }
        for (int index : touched) lengths[index] = 0;
        return new int[]{bestI, bestJ, bestSize};
    }

    private static Map<Character, int[]> positions(String b) {
        Map<Character, List<Integer>> lists = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            lists.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }
        Map<Character, int[]> positions = new HashMap<>(lists.size() * 2);
        lists.forEach((c, list) -> positions.put(c, list.stream().mapToInt(Integer::intValue).toArray()));
        return positions;
    }
}
