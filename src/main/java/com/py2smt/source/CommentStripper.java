package com.py2smt.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes comments from source text before it is parsed.
 * <p>
 * Line comments run from the first {@code #} on a line to its end. Triple-quoted blocks
 * are treated as comments: the text is split on {@code """} and every odd-indexed piece is
 * dropped. Neither pass knows about string literals, so a {@code #} inside a quoted string
 * also starts a comment.
 */
public class CommentStripper {

    private static final String BLOCK_DELIMITER = "\"\"\"";

    public String strip(String source) {
        String[] lines = source.split("\n", -1);
        StringBuilder withoutLineComments = new StringBuilder(source.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                withoutLineComments.append('\n');
            }
            String line = lines[i];
            int hash = line.indexOf('#');
            withoutLineComments.append(hash >= 0 ? line.substring(0, hash) : line);
        }

        List<String> segments = splitOnBlockDelimiter(withoutLineComments.toString());
        StringBuilder result = new StringBuilder(withoutLineComments.length());
        for (int i = 0; i < segments.size(); i += 2) {
            result.append(segments.get(i));
        }
        return result.toString();
    }

    private List<String> splitOnBlockDelimiter(String text) {
        List<String> segments = new ArrayList<>();
        int start = 0;
        int next;
        while ((next = text.indexOf(BLOCK_DELIMITER, start)) >= 0) {
            segments.add(text.substring(start, next));
            start = next + BLOCK_DELIMITER.length();
        }
        segments.add(text.substring(start));
        return segments;
    }
}
