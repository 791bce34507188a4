package com.javainsight.engine.concurrency;

import com.javainsight.engine.model.InsightModel.ConcurrencyWarning;
import com.javainsight.engine.model.InsightModel.TextRange;
import com.javainsight.engine.text.LineIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags blocking or re-entrant calls inside {@code synchronized} blocks.
 *
 * Works on raw text: comments and string literals are not recognized, so hazard-looking text
 * inside them is reported as well.
 */
public class LockHazardDetector {

    static final String BINDER_MESSAGE = "Binder call inside synchronized block may block other threads.";
    static final String HANDLER_MESSAGE = "Handler post/send inside synchronized block can cause lock inversion.";
    static final String NESTED_MESSAGE = "Nested synchronized blocks detected.";

    private static final Pattern SYNCHRONIZED = Pattern.compile("\\bsynchronized\\b");
    private static final Pattern BINDER_CALL =
        Pattern.compile("(transact\\s*\\(|linkToDeath\\s*\\(|asBinder\\s*\\(|queryLocalInterface\\s*\\()");
    private static final Pattern HANDLER_CALL =
        Pattern.compile("\\b(post|postDelayed|sendMessage|sendMessageAtTime)\\s*\\(");

    /** Braced block following a {@code synchronized} keyword. Body is [bodyStart, bodyEnd). */
    record LockBlock(int keywordOffset, int bodyStart, int bodyEnd, int line) {}

    public List<ConcurrencyWarning> detect(String source) {
        LineIndex lines = LineIndex.build(source);
        List<ConcurrencyWarning> warnings = new ArrayList<>();
        for (LockBlock block : findLockBlocks(source, lines)) {
            String body = source.substring(block.bodyStart(), block.bodyEnd());
            // closing brace included
            TextRange range = new TextRange(block.keywordOffset(), block.bodyEnd() + 1);
            if (BINDER_CALL.matcher(body).find()) {
                warnings.add(new ConcurrencyWarning(range, block.line(), BINDER_MESSAGE));
            }
            if (HANDLER_CALL.matcher(body).find()) {
                warnings.add(new ConcurrencyWarning(range, block.line(), HANDLER_MESSAGE));
            }
            if (SYNCHRONIZED.matcher(body).find()) {
                warnings.add(new ConcurrencyWarning(range, block.line(), NESTED_MESSAGE));
            }
        }
        return warnings;
    }

    static List<LockBlock> findLockBlocks(String source, LineIndex lines) {
        List<LockBlock> blocks = new ArrayList<>();
        Matcher matcher = SYNCHRONIZED.matcher(source);
        while (matcher.find()) {
            int keyword = matcher.start();
            int brace = source.indexOf('{', keyword);
            if (brace == -1) {
                continue;
            }
            int depth = 1;
            for (int i = brace + 1; i < source.length(); i++) {
                char ch = source.charAt(i);
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                    if (depth == 0) {
                        blocks.add(new LockBlock(keyword, brace + 1, i, lines.offsetToLine(keyword)));
                        break;
                    }
                }
            }
        }
        return blocks;
    }
}
