package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Inserts blank lines after code lines and collapses or drops existing
 * blank lines. Lines inside multi-line tokens and lines continued with a
 * trailing backslash are never split or joined.
 */
public class BlankLineStep implements FormattingStep {

    static final double INSERT_PROBABILITY = 0.2;
    static final double COLLAPSE_PROBABILITY = 0.5;
    static final double REMOVE_PROBABILITY = 0.2;

    private final Tokenizer tokenizer;

    public BlankLineStep(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public FormattingOperation operation() {
        return FormattingOperation.BLANK_LINES;
    }

    @Override
    public String apply(String source, Language language, Random random) {
        LineIndex index = new LineIndex(tokenizer.tokenize(source, language));
        int count = index.lineCount();
        List<String> out = new ArrayList<>(count + 8);

        int line = 1;
        while (line <= count) {
            if (index.isBlank(line) && !continues(index, line - 1)) {
                int end = line;
                while (end + 1 <= count && index.isBlank(end + 1)) {
                    end++;
                }
                int run = end - line + 1;
                if (run >= 2 && random.nextDouble() < COLLAPSE_PROBABILITY) {
                    out.add(index.lineText(line));
                } else {
                    boolean drop = run == 1 && line < count && random.nextDouble() < REMOVE_PROBABILITY;
                    for (int l = line; l <= end && !drop; l++) {
                        out.add(index.lineText(l));
                    }
                }
                line = end + 1;
                continue;
            }

            out.add(index.lineText(line));
            if (line < count && index.hasCode(line) && !continues(index, line)
                    && random.nextDouble() < INSERT_PROBABILITY) {
                out.add("");
            }
            line++;
        }
        return String.join("\n", out);
    }

    /**
     * True when the next line is glued to this one: a trailing backslash, or
     * a string or comment still open at the end of the line.
     */
    private static boolean continues(LineIndex index, int line) {
        if (line < 1) {
            return false;
        }
        return index.lineText(line).stripTrailing().endsWith("\\") || index.endsInsideToken(line);
    }
}
