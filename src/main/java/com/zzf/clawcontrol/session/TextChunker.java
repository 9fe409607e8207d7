package com.zzf.clawcontrol.session;

import java.util.ArrayList;
import java.util.List;

public final class TextChunker {

    private TextChunker() {
    }

    /**
     * Split {@code text} into pieces of at most {@code limit} chars, never between the two
     * halves of a surrogate pair. A non-positive limit returns the text whole.
     */
    public static List<String> chunk(String text, int limit) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        if (limit <= 0 || text.length() <= limit) {
            chunks.add(text);
            return chunks;
        }
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(text.length(), start + limit);
            if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1)) && end - 1 > start) {
                end--;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        return chunks;
    }
}
