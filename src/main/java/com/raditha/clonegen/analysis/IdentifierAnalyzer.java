package com.raditha.clonegen.analysis;

import com.raditha.clonegen.lexer.LanguageProfile;
import com.raditha.clonegen.lexer.LineIndex;
import com.raditha.clonegen.model.IdentifierCategory;
import com.raditha.clonegen.model.IdentifierOccurrence;
import com.raditha.clonegen.model.Language;
import com.raditha.clonegen.model.OccurrenceContext;
import com.raditha.clonegen.model.Token;
import com.raditha.clonegen.model.TokenKind;
import com.raditha.clonegen.model.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts renameable identifiers from a token stream.
 * <p>
 * Only {@code IDENTIFIER} tokens are considered, so names inside strings and
 * comments are never reported. A name is renameable when it is not a builtin,
 * not a dunder name, never appears on an import line, as an annotation, or
 * inside an interpolated string, and has at least one unqualified occurrence.
 * Every occurrence of a renameable name is reported so that renaming stays
 * consistent, except Python keyword arguments passed to a callee that is not
 * declared in the snippet: {@code sorted(items, key=key)} must keep its
 * {@code key=} even when the parameter {@code key} is renamed.
 */
public class IdentifierAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(IdentifierAnalyzer.class);

    private static final Pattern WORD = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Set<String> MEMBER_OPERATORS = Set.of(".", "->", "?.", "::");
    private static final Set<String> SELF_REFERENCES = Set.of("self", "this");
    private static final Set<OccurrenceContext> EXCLUDING = EnumSet.of(
            OccurrenceContext.IMPORT, OccurrenceContext.ANNOTATION);
    private static final Set<OccurrenceContext> QUALIFIED = EnumSet.of(
            OccurrenceContext.MEMBER_ACCESS, OccurrenceContext.KEYWORD_ARGUMENT);
    private static final String NOT_A_CALL = "";

    private final CategoryHeuristic heuristic;

    public IdentifierAnalyzer() {
        this(new NamingConventionHeuristic());
    }

    public IdentifierAnalyzer(CategoryHeuristic heuristic) {
        this.heuristic = heuristic;
    }

    /**
     * Extract every occurrence of every renameable identifier, in source order.
     */
    public List<IdentifierOccurrence> extractIdentifiers(TokenStream stream) {
        LanguageProfile profile = LanguageProfile.of(stream.language());
        List<Integer> codeIndices = codeIndices(stream);
        boolean[] importFlags = importFlags(stream, codeIndices, profile);
        Set<String> placeholders = interpolatedNames(stream);

        List<Candidate> candidates = new ArrayList<>();
        Map<String, NameEvidence> evidence = new HashMap<>();
        Deque<String> callParens = new ArrayDeque<>();
        Set<String> declared = new HashSet<>();

        for (int c = 0; c < codeIndices.size(); c++) {
            Token token = stream.get(codeIndices.get(c));
            Token prev = codeAt(stream, codeIndices, c - 1);
            Token prev2 = codeAt(stream, codeIndices, c - 2);
            Token next = codeAt(stream, codeIndices, c + 1);

            trackParens(token, prev, prev2, callParens);

            if (token.kind() != TokenKind.IDENTIFIER || !isCandidateName(token.text(), profile)) {
                continue;
            }

            OccurrenceContext context = contextOf(prev, prev2, next, importFlags[c], callParens, profile);
            String callee = context == OccurrenceContext.KEYWORD_ARGUMENT ? callParens.peek() : null;
            candidates.add(new Candidate(token, codeIndices.get(c), context, callee));
            if (context == OccurrenceContext.CLASS_DECLARATION || context == OccurrenceContext.FUNCTION_DECLARATION) {
                declared.add(token.text());
            }

            NameEvidence found = new NameEvidence(
                    context == OccurrenceContext.CLASS_DECLARATION,
                    context == OccurrenceContext.FUNCTION_DECLARATION,
                    next != null && next.is("("),
                    prev != null && prev.kind() == TokenKind.KEYWORD && prev.is("new"));
            evidence.merge(token.text(), found, NameEvidence::merge);
        }

        Set<String> renameable = renameableNames(candidates, placeholders);
        Map<String, IdentifierCategory> categories = new HashMap<>();
        for (String name : renameable) {
            categories.put(name, heuristic.categorize(name, evidence.getOrDefault(name, NameEvidence.none())));
        }

        List<IdentifierOccurrence> occurrences = new ArrayList<>();
        for (Candidate candidate : candidates) {
            String name = candidate.token.text();
            if (renameable.contains(name) && followsDeclaredCallee(candidate, declared)) {
                occurrences.add(new IdentifierOccurrence(name, categories.get(name), candidate.token.span(),
                        candidate.context, candidate.tokenIndex));
            }
        }
        logger.debug("Found {} renameable names ({} occurrences)", renameable.size(), occurrences.size());
        return occurrences;
    }

    /**
     * Every identifier text present in the stream, renameable or not.
     * Generated names must avoid all of them.
     */
    public Set<String> allNames(TokenStream stream) {
        Set<String> names = new HashSet<>();
        for (Token token : stream.tokens()) {
            if (token.kind() == TokenKind.IDENTIFIER || token.kind() == TokenKind.KEYWORD) {
                names.add(token.text());
            }
        }
        names.addAll(interpolatedNames(stream));
        return names;
    }

    /**
     * A keyword argument is tied to the callee's parameter list, so it may only
     * be renamed together with a function or class declared in this snippet.
     */
    private static boolean followsDeclaredCallee(Candidate candidate, Set<String> declared) {
        return candidate.context != OccurrenceContext.KEYWORD_ARGUMENT || declared.contains(candidate.callee);
    }

    private boolean isCandidateName(String name, LanguageProfile profile) {
        if (profile.isBuiltin(name)) {
            return false;
        }
        return !(name.length() > 4 && name.startsWith("__") && name.endsWith("__"));
    }

    private Set<String> renameableNames(List<Candidate> candidates, Set<String> placeholders) {
        Set<String> excluded = new HashSet<>(placeholders);
        Set<String> unqualified = new LinkedHashSet<>();
        for (Candidate candidate : candidates) {
            if (EXCLUDING.contains(candidate.context)) {
                excluded.add(candidate.token.text());
            } else if (!QUALIFIED.contains(candidate.context)) {
                unqualified.add(candidate.token.text());
            }
        }
        unqualified.removeAll(excluded);
        return unqualified;
    }

    private OccurrenceContext contextOf(Token prev, Token prev2, Token next, boolean onImportLine,
            Deque<String> callParens, LanguageProfile profile) {
        if (onImportLine) {
            return OccurrenceContext.IMPORT;
        }
        if (prev == null) {
            return OccurrenceContext.REFERENCE;
        }
        if (prev.is("@")) {
            return OccurrenceContext.ANNOTATION;
        }
        if (prev.kind() == TokenKind.KEYWORD && profile.isTypeDeclarationKeyword(prev.text())) {
            return OccurrenceContext.CLASS_DECLARATION;
        }
        if (prev.kind() == TokenKind.KEYWORD && (prev.is("def") || prev.is("function"))) {
            return OccurrenceContext.FUNCTION_DECLARATION;
        }
        if (MEMBER_OPERATORS.contains(prev.text())) {
            boolean selfQualified = prev2 != null && SELF_REFERENCES.contains(prev2.text()) && !prev.is("::");
            return selfQualified ? OccurrenceContext.REFERENCE : OccurrenceContext.MEMBER_ACCESS;
        }
        if (profile.language() == Language.PYTHON && next != null && next.is("=")
                && !callParens.isEmpty() && !NOT_A_CALL.equals(callParens.peek())) {
            return OccurrenceContext.KEYWORD_ARGUMENT;
        }
        return OccurrenceContext.REFERENCE;
    }

    /**
     * Track the callee of the innermost open parenthesis: the name before it
     * for a call, {@code ")"} or {@code "]"} for a call on an expression, and
     * {@link #NOT_A_CALL} for a grouping, a literal or a {@code def} or
     * {@code class} header.
     */
    private void trackParens(Token token, Token prev, Token prev2, Deque<String> callParens) {
        if (token.kind() != TokenKind.PUNCTUATION) {
            return;
        }
        if (token.is("(") || token.is("[") || token.is("{")) {
            boolean call = token.is("(") && prev != null
                    && (prev.kind() == TokenKind.IDENTIFIER || prev.is(")") || prev.is("]"))
                    && (prev2 == null || !(prev2.is("def") || prev2.is("class")));
            callParens.push(call ? prev.text() : NOT_A_CALL);
        } else if ((token.is(")") || token.is("]") || token.is("}")) && !callParens.isEmpty()) {
            callParens.pop();
        }
    }

    /**
     * Flag, per code token, whether it belongs to an import-like statement
     * ({@code import}, {@code from}, {@code package}, {@code using} or a C
     * preprocessor directive).
     */
    static boolean[] importFlags(TokenStream stream, List<Integer> codeIndices, LanguageProfile profile) {
        boolean[] flags = new boolean[codeIndices.size()];
        boolean inImport = false;
        boolean preprocessor = false;
        int depth = 0;
        Token prev = null;
        for (int c = 0; c < codeIndices.size(); c++) {
            Token token = stream.get(codeIndices.get(c));
            boolean startsLine = prev == null || prev.endLine() < token.line();
            boolean continued = prev != null && prev.is("\\");
            boolean directive = startsLine && !continued && token.is("#") && hasPreprocessor(profile.language());
            boolean newStatement = startsLine && !continued && (depth == 0 || preprocessor || directive);
            if (newStatement) {
                preprocessor = directive;
                inImport = directive
                        || (token.kind() == TokenKind.KEYWORD && profile.isImportKeyword(token.text()));
            } else if (!inImport && token.kind() == TokenKind.KEYWORD && profile.isImportKeyword(token.text())
                    && prev != null && (prev.is(";") || prev.is("{") || prev.is("}"))) {
                inImport = true;
            } else if (inImport && !preprocessor && prev != null && prev.is(";")) {
                inImport = token.kind() == TokenKind.KEYWORD && profile.isImportKeyword(token.text());
            }
            flags[c] = inImport;
            if (token.kind() == TokenKind.PUNCTUATION) {
                depth = Math.max(0, depth + LineIndex.bracketDelta(token.text()));
            }
            prev = token;
        }
        return flags;
    }

    static boolean hasPreprocessor(Language language) {
        return language == Language.C || language == Language.CPP;
    }

    /**
     * Names referenced from Python f-string or JavaScript template
     * placeholders. Renaming them would desynchronise the string contents.
     */
    private Set<String> interpolatedNames(TokenStream stream) {
        Set<String> names = new HashSet<>();
        for (Token token : stream.tokens()) {
            if (token.kind() != TokenKind.LITERAL_STRING) {
                continue;
            }
            String text = token.text();
            boolean template;
            if (stream.language() == Language.PYTHON) {
                int firstQuote = firstQuote(text);
                template = firstQuote > 0 && text.substring(0, firstQuote).toLowerCase(Locale.ROOT).contains("f");
            } else {
                template = stream.language() == Language.JAVASCRIPT && text.startsWith("`");
            }
            if (template) {
                collectPlaceholderWords(text, names);
            }
        }
        return names;
    }

    private static int firstQuote(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                return i;
            }
        }
        return -1;
    }

    private static void collectPlaceholderWords(String text, Set<String> names) {
        int depth = 0;
        StringBuilder inside = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                if (depth == 0 && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                    i++;
                    continue;
                }
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) {
                    Matcher matcher = WORD.matcher(inside);
                    while (matcher.find()) {
                        names.add(matcher.group());
                    }
                    inside.setLength(0);
                }
            } else if (depth > 0) {
                inside.append(c);
            }
        }
    }

    static List<Integer> codeIndices(TokenStream stream) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < stream.size(); i++) {
            if (stream.get(i).isCode()) {
                indices.add(i);
            }
        }
        return indices;
    }

    private static Token codeAt(TokenStream stream, List<Integer> codeIndices, int c) {
        if (c < 0 || c >= codeIndices.size()) {
            return null;
        }
        return stream.get(codeIndices.get(c));
    }

    private record Candidate(Token token, int tokenIndex, OccurrenceContext context, String callee) {
    }
}
