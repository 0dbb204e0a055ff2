package ai.lawdiff.align;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ratcliff/Obershelp pattern matching over the code points of two strings.
 *
 * <p>The longest common run is located first (earliest in {@code a}, then earliest in {@code b} on ties) and the
 * procedure recurses on the unmatched text to its left and right. No elements are treated as junk.
 */
final class SequenceMatcher {

    private final int[] a;
    private final int[] b;
    private final Map<Integer, List<Integer>> positionsInB = new HashMap<>();
    private List<MatchingBlock> matchingBlocks;

    SequenceMatcher(String a, String b) {
        this.a = a.codePoints().toArray();
        this.b = b.codePoints().toArray();
        for (int j = 0; j < this.b.length; j++) {
            positionsInB.computeIfAbsent(this.b[j], key -> new ArrayList<>()).add(j);
        }
    }

    int lengthA() {
        return a.length;
    }

    int lengthB() {
        return b.length;
    }

    String textA(int start, int end) {
        return new String(a, start, end - start);
    }

    String textB(int start, int end) {
        return new String(b, start, end - start);
    }

    /**
     * Matching blocks in ascending order, adjacent blocks merged, without the zero-size sentinel.
     */
    List<MatchingBlock> matchingBlocks() {
        if (matchingBlocks != null) {
            return matchingBlocks;
        }
        List<MatchingBlock> found = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[] {0, a.length, 0, b.length});
        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int aLow = range[0];
            int aHigh = range[1];
            int bLow = range[2];
            int bHigh = range[3];
            MatchingBlock block = findLongestMatch(aLow, aHigh, bLow, bHigh);
            if (block.size() == 0) {
                continue;
            }
            found.add(block);
            if (aLow < block.aStart() && bLow < block.bStart()) {
                queue.push(new int[] {aLow, block.aStart(), bLow, block.bStart()});
            }
            int aEnd = block.aStart() + block.size();
            int bEnd = block.bStart() + block.size();
            if (aEnd < aHigh && bEnd < bHigh) {
                queue.push(new int[] {aEnd, aHigh, bEnd, bHigh});
            }
        }
        found.sort(Comparator.comparingInt(MatchingBlock::aStart).thenComparingInt(MatchingBlock::bStart));

        List<MatchingBlock> merged = new ArrayList<>();
        for (MatchingBlock block : found) {
            if (!merged.isEmpty()) {
                MatchingBlock last = merged.get(merged.size() - 1);
                if (last.aStart() + last.size() == block.aStart() && last.bStart() + last.size() == block.bStart()) {
                    merged.set(merged.size() - 1, new MatchingBlock(last.aStart(), last.bStart(),
                            last.size() + block.size()));
                    continue;
                }
            }
            merged.add(block);
        }
        matchingBlocks = Collections.unmodifiableList(merged);
        return matchingBlocks;
    }

    int matchedLength() {
        int total = 0;
        for (MatchingBlock block : matchingBlocks()) {
            total += block.size();
        }
        return total;
    }

    private MatchingBlock findLongestMatch(int aLow, int aHigh, int bLow, int bHigh) {
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        // runLengths.get(j) = length of the common run ending at a[i - 1] and b[j]
        Map<Integer, Integer> runLengths = new HashMap<>();
        for (int i = aLow; i < aHigh; i++) {
            Map<Integer, Integer> next = new HashMap<>();
            for (int j : positionsInB.getOrDefault(a[i], List.of())) {
                if (j < bLow) {
                    continue;
                }
                if (j >= bHigh) {
                    break;
                }
                int k = runLengths.getOrDefault(j - 1, 0) + 1;
                next.put(j, k);
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            runLengths = next;
        }
        return new MatchingBlock(bestI, bestJ, bestSize);
    }
}
