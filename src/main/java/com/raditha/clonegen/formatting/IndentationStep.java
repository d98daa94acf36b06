package com.raditha.clonegen.formatting;

import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.lexer.Tokenizer;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Re-expresses indentation with a different unit: a tab, or 2, 3 or 4
 * spaces. Every line keeps its nesting level, and continuation lines keep
 * any alignment spaces beyond whole levels.
 */
public class IndentationStep implements FormattingStep {

    private static final List<String> UNITS = List.of("\t", "  ", "   ", "    ");

    private final Tokenizer tokenizer;

    public IndentationStep(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public FormattingOperation operation() {
        return FormattingOperation.INDENTATION;
    }

    @Override
    public String apply(String source, Language language, Random random) {
        LineIndex index = new LineIndex(tokenizer.tokenize(source, language));
        IndentStyle style = detect(index);
        if (style == null) {
            return source;
        }

        List<String> targets = new ArrayList<>(UNITS);
        targets.remove(style.tabs ? "\t" : " ".repeat(style.unit));
        String target = targets.get(random.nextInt(targets.size()));

        StringBuilder out = new StringBuilder(source.length());
        for (int line = 1; line <= index.lineCount(); line++) {
            if (line > 1) {
                out.append('\n');
            }
            String text = index.lineText(line);
            String indent = index.indentation(line);
            if (indent.isEmpty() || index.startsInsideToken(line) || index.isBlank(line)) {
                out.append(text);
                continue;
            }
            out.append(remap(indent, style, target)).append(text.substring(indent.length()));
        }
        return out.toString();
    }

    private static String remap(String indent, IndentStyle style, String target) {
        if (style.tabs) {
            int levels = 0;
            while (levels < indent.length() && indent.charAt(levels) == '\t') {
                levels++;
            }
            return target.repeat(levels) + indent.substring(levels);
        }
        int levels = indent.length() / style.unit;
        return target.repeat(levels) + " ".repeat(indent.length() % style.unit);
    }

    /**
     * Current indentation unit, or null when the snippet has no indentation
     * or mixes tabs and spaces.
     */
    private IndentStyle detect(LineIndex index) {
        boolean sawTabs = false;
        boolean sawSpaces = false;
        int unit = 0;
        Token previousLast = null;
        for (int line = 1; line <= index.lineCount(); line++) {
            if (index.startsInsideToken(line) || index.isBlank(line)) {
                continue;
            }
            String indent = index.indentation(line);
            boolean continuation = index.bracketDepthAtStart(line) > 0
                    || (previousLast != null && previousLast.is("\\"));
            if (index.hasCode(line)) {
                previousLast = index.lastCode(line);
            }
            if (indent.isEmpty()) {
                continue;
            }
            boolean tabs = indent.indexOf('\t') >= 0;
            boolean spaces = indent.indexOf(' ') >= 0;
            if (tabs && spaces && !continuation) {
                return null;
            }
            sawTabs |= tabs;
            sawSpaces |= spaces && !tabs;
            if (!tabs && !continuation) {
                unit = gcd(unit, indent.length());
            }
        }
        if (sawTabs && sawSpaces && unit > 0) {
            return null;
        }
        if (sawTabs) {
            return new IndentStyle(true, 1);
        }
        return unit > 0 ? new IndentStyle(false, unit) : null;
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    private record IndentStyle(boolean tabs, int unit) {
    }
}
