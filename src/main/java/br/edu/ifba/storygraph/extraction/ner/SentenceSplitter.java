package br.edu.ifba.storygraph.extraction.ner;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Punctuation-based sentence boundaries, used when no sentence model is configured.
 */
final class SentenceSplitter {

    // a run of text up to and including terminal punctuation and closing quotes, or the tail
    private static final Pattern SENTENCE = Pattern.compile("[^.!?\\n]+(?:[.!?]+[\"'”’)]*|\\n|$)");

    private SentenceSplitter() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return [start, end) offsets of each non-blank sentence, trimmed
     */
    @NotNull
    static List<int[]> spans(@NotNull String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher matcher = SENTENCE.matcher(text);
        while (matcher.find()) {
            int start = matcher.start();
            int end = matcher.end();
            while (start < end && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
                end--;
            }
            if (end > start) {
                spans.add(new int[] {start, end});
            }
        }
        return spans;
    }
}
