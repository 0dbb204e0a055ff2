package ai.lawdiff.align;

import java.util.ArrayList;
import java.util.List;

/**
 * Similarity ratio and character-level diff between two article texts, both derived from the same
 * Ratcliff/Obershelp matching blocks.
 */
public class TextSimilarity {

    /**
     * Returns {@code 2 * M / (|a| + |b|)} where {@code M} is the number of matched code points; {@code 0} when either
     * text is empty. The operands are matched in a canonical order (shorter first, then lexicographic), so
     * {@code ratio(a, b) == ratio(b, a)}.
     */
    public double ratio(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        boolean swap = a.length() > b.length() || (a.length() == b.length() && a.compareTo(b) > 0);
        SequenceMatcher matcher = swap ? new SequenceMatcher(b, a) : new SequenceMatcher(a, b);
        int total = matcher.lengthA() + matcher.lengthB();
        return 2.0 * matcher.matchedLength() / total;
    }

    /**
     * Splits the transition from {@code oldText} to {@code newText} into equal, deleted and inserted spans. A replaced
     * region yields its deleted span before its inserted span.
     */
    public List<DiffSpan> diff(String oldText, String newText) {
        String a = oldText == null ? "" : oldText;
        String b = newText == null ? "" : newText;
        SequenceMatcher matcher = new SequenceMatcher(a, b);
        List<DiffSpan> spans = new ArrayList<>();
        int i = 0;
        int j = 0;
        List<MatchingBlock> blocks = new ArrayList<>(matcher.matchingBlocks());
        blocks.add(new MatchingBlock(matcher.lengthA(), matcher.lengthB(), 0));
        for (MatchingBlock block : blocks) {
            if (i < block.aStart()) {
                spans.add(new DiffSpan(DiffSpanType.DELETED, matcher.textA(i, block.aStart())));
            }
            if (j < block.bStart()) {
                spans.add(new DiffSpan(DiffSpanType.INSERTED, matcher.textB(j, block.bStart())));
            }
            if (block.size() > 0) {
                spans.add(new DiffSpan(DiffSpanType.EQUAL,
                        matcher.textA(block.aStart(), block.aStart() + block.size())));
            }
            i = block.aStart() + block.size();
            j = block.bStart() + block.size();
        }
        return spans;
    }
}
