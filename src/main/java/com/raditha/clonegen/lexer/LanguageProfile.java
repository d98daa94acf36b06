package com.raditha.clonegen.lexer;

import com.raditha.clonegen.model.Language;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lexical and naming tables for one language.
 * <p>
 * Operators are kept sorted longest first so that the tokenizer can match
 * compound operators atomically.
 */
public final class LanguageProfile {

    private static final Map<Language, LanguageProfile> PROFILES = new EnumMap<>(Language.class);

    private static final List<String> C_FAMILY_OPERATORS = List.of(
            "<<=", ">>=", "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "?", "+", "-", "*", "/", "%", "=", "<", ">", "!", "~", "&", "|", "^");

    private static final Set<String> C_FAMILY_CONTROL = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "default", "try", "catch", "finally");

    private static final Set<String> C_FAMILY_EXIT = Set.of("return", "break", "continue", "throw", "goto");

    static {
        PROFILES.put(Language.PYTHON, python());
        PROFILES.put(Language.JAVA, java());
        PROFILES.put(Language.JAVASCRIPT, javascript());
        PROFILES.put(Language.CPP, cpp());
        PROFILES.put(Language.C, c());
    }

    private final Language language;
    private final Set<String> keywords;
    private final Set<String> builtins;
    private final List<String> operators;
    private final Set<String> boolLiterals;
    private final Set<String> nullLiterals;
    private final Set<String> controlKeywords;
    private final Set<String> exitKeywords;
    private final Set<String> typeDeclarationKeywords;
    private final Set<String> importKeywords;

    private LanguageProfile(Builder builder) {
        this.language = builder.language;
        this.keywords = Set.copyOf(builder.keywords);
        this.builtins = Set.copyOf(builder.builtins);
        List<String> ops = new ArrayList<>(builder.operators);
        ops.sort(Comparator.comparingInt(String::length).reversed());
        this.operators = List.copyOf(ops);
        this.boolLiterals = Set.copyOf(builder.boolLiterals);
        this.nullLiterals = Set.copyOf(builder.nullLiterals);
        this.controlKeywords = Set.copyOf(builder.controlKeywords);
        this.exitKeywords = Set.copyOf(builder.exitKeywords);
        this.typeDeclarationKeywords = Set.copyOf(builder.typeDeclarationKeywords);
        this.importKeywords = Set.copyOf(builder.importKeywords);
    }

    public static LanguageProfile of(Language language) {
        return PROFILES.get(language);
    }

    public Language language() {
        return language;
    }

    public boolean isKeyword(String word) {
        return keywords.contains(word);
    }

    public boolean isBuiltin(String word) {
        return builtins.contains(word);
    }

    public boolean isBoolLiteral(String word) {
        return boolLiterals.contains(word);
    }

    public boolean isNullLiteral(String word) {
        return nullLiterals.contains(word);
    }

    /**
     * Keywords that open or continue a control-flow construct.
     */
    public boolean isControlKeyword(String word) {
        return controlKeywords.contains(word);
    }

    /**
     * Keywords that leave the current block or function.
     */
    public boolean isExitKeyword(String word) {
        return exitKeywords.contains(word);
    }

    /**
     * Control-flow keywords in the broad sense: branching, looping and exits.
     */
    public boolean isControlFlowKeyword(String word) {
        return controlKeywords.contains(word) || exitKeywords.contains(word);
    }

    public boolean isTypeDeclarationKeyword(String word) {
        return typeDeclarationKeywords.contains(word);
    }

    public boolean isImportKeyword(String word) {
        return importKeywords.contains(word);
    }

    /**
     * Operators sorted longest first.
     */
    public List<String> operators() {
        return operators;
    }

    public String lineCommentPrefix() {
        return language == Language.PYTHON ? "#" : "//";
    }

    public boolean hasBlockComments() {
        return language != Language.PYTHON;
    }

    private static LanguageProfile python() {
        Builder b = new Builder(Language.PYTHON);
        b.keywords = Set.of("and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del",
                "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda",
                "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");
        b.builtins = Set.of("print", "len", "range", "int", "str", "float", "list", "dict", "set", "tuple", "bool",
                "type", "isinstance", "open", "enumerate", "zip", "map", "filter", "sorted", "sum", "min", "max",
                "abs", "any", "all", "iter", "next", "super", "object", "input", "round", "reversed", "hasattr",
                "getattr", "setattr", "format", "repr", "id", "hash", "self", "cls", "staticmethod", "classmethod",
                "property", "Exception", "ValueError", "TypeError", "KeyError", "IndexError", "RuntimeError",
                "AttributeError", "ZeroDivisionError", "StopIteration", "NotImplementedError", "match", "case");
        b.operators = List.of("**=", "//=", ">>=", "<<=", "->", ":=", "**", "//", "==", "!=", "<=", ">=", "<<",
                ">>", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
                "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "=");
        b.boolLiterals = Set.of("True", "False");
        b.nullLiterals = Set.of("None");
        b.controlKeywords = Set.of("if", "elif", "else", "for", "while", "try", "except", "finally", "with");
        b.exitKeywords = Set.of("return", "break", "continue", "raise", "pass", "yield");
        b.typeDeclarationKeywords = Set.of("class");
        b.importKeywords = Set.of("import", "from");
        return b.build();
    }

    private static LanguageProfile java() {
        Builder b = new Builder(Language.JAVA);
        b.keywords = Set.of("abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
                "const", "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally",
                "float", "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long",
                "native", "new", "package", "private", "protected", "public", "return", "short", "static",
                "strictfp", "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try",
                "void", "volatile", "while");
        b.builtins = Set.of("var", "record", "yield", "sealed", "permits", "String", "Object", "Integer", "Long",
                "Double", "Float", "Boolean", "Character", "Byte", "Short", "Math", "System", "List", "Map", "Set",
                "ArrayList", "HashMap", "HashSet", "LinkedList", "Arrays", "Collections", "Optional", "Objects",
                "Stream", "Collectors", "Random", "StringBuilder", "Iterator", "Iterable", "Comparable", "Runnable",
                "Thread", "Exception", "RuntimeException", "IllegalArgumentException", "IllegalStateException",
                "NullPointerException", "Override", "Deprecated", "SuppressWarnings", "FunctionalInterface",
                "out", "err", "println", "print", "printf", "length", "size", "equals", "hashCode", "toString",
                "get", "put", "add", "remove", "contains", "isEmpty", "main", "valueOf", "parseInt", "format",
                "stream", "collect", "forEach", "charAt", "substring", "indexOf", "append", "compareTo");
        b.operators = new ArrayList<>(C_FAMILY_OPERATORS);
        b.operators.addAll(List.of(">>>=", ">>>", "::"));
        b.boolLiterals = Set.of("true", "false");
        b.nullLiterals = Set.of("null");
        b.controlKeywords = C_FAMILY_CONTROL;
        b.exitKeywords = C_FAMILY_EXIT;
        b.typeDeclarationKeywords = Set.of("class", "interface", "enum");
        b.importKeywords = Set.of("import", "package");
        return b.build();
    }

    private static LanguageProfile javascript() {
        Builder b = new Builder(Language.JAVASCRIPT);
        b.keywords = Set.of("async", "await", "break", "case", "catch", "class", "const", "continue", "debugger",
                "default", "delete", "do", "else", "export", "extends", "finally", "for", "function", "if",
                "import", "in", "instanceof", "let", "new", "of", "return", "static", "super", "switch", "this",
                "throw", "try", "typeof", "var", "void", "while", "with", "yield");
        b.builtins = Set.of("console", "log", "Math", "JSON", "Object", "Array", "String", "Number", "Boolean",
                "Promise", "Map", "Set", "Date", "Error", "RegExp", "Symbol", "undefined", "NaN", "Infinity",
                "parseInt", "parseFloat", "isNaN", "require", "module", "exports", "window", "document",
                "setTimeout", "setInterval", "clearTimeout", "length", "push", "pop", "shift", "map", "filter",
                "reduce", "forEach", "then", "keys", "values", "arguments", "globalThis", "process", "get", "set");
        b.operators = new ArrayList<>(C_FAMILY_OPERATORS);
        b.operators.addAll(List.of(">>>=", ">>>", "===", "!==", "=>", "**", "**=", "?.", "??", "??=", "&&=",
                "||=", "..."));
        b.boolLiterals = Set.of("true", "false");
        b.nullLiterals = Set.of("null");
        b.controlKeywords = C_FAMILY_CONTROL;
        b.exitKeywords = Set.of("return", "break", "continue", "throw");
        b.typeDeclarationKeywords = Set.of("class");
        b.importKeywords = Set.of("import");
        return b.build();
    }

    private static LanguageProfile cpp() {
        Builder b = new Builder(Language.CPP);
        b.keywords = Set.of("alignas", "alignof", "auto", "bool", "break", "case", "catch", "char", "class",
                "const", "constexpr", "const_cast", "continue", "decltype", "default", "delete", "do", "double",
                "dynamic_cast", "else", "enum", "explicit", "extern", "float", "for", "friend", "goto", "if",
                "inline", "int", "long", "mutable", "namespace", "new", "noexcept", "operator", "private",
                "protected", "public", "register", "reinterpret_cast", "return", "short", "signed", "sizeof",
                "static", "static_assert", "static_cast", "struct", "switch", "template", "this", "throw", "try",
                "typedef", "typeid", "typename", "union", "unsigned", "using", "virtual", "void", "volatile",
                "while");
        b.builtins = cLibrary(Set.of("std", "cout", "cin", "cerr", "endl", "string", "vector", "map", "set",
                "pair", "make_pair", "unique_ptr", "shared_ptr", "make_unique", "make_shared", "size", "push_back",
                "begin", "end", "move", "swap", "sort", "find", "max", "min", "abs", "override", "final"));
        b.operators = new ArrayList<>(C_FAMILY_OPERATORS);
        b.operators.addAll(List.of("::", "->*", ".*", "<=>", "..."));
        b.boolLiterals = Set.of("true", "false");
        b.nullLiterals = Set.of("nullptr", "NULL");
        b.controlKeywords = C_FAMILY_CONTROL;
        b.exitKeywords = C_FAMILY_EXIT;
        b.typeDeclarationKeywords = Set.of("class", "struct", "enum", "union", "namespace");
        b.importKeywords = Set.of("using");
        return b.build();
    }

    private static LanguageProfile c() {
        Builder b = new Builder(Language.C);
        b.keywords = Set.of("auto", "break", "case", "char", "const", "continue", "default", "do", "double",
                "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long", "register",
                "restrict", "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
                "union", "unsigned", "void", "volatile", "while", "_Bool", "bool");
        b.builtins = cLibrary(Set.of());
        b.operators = new ArrayList<>(C_FAMILY_OPERATORS);
        b.operators.add("...");
        b.boolLiterals = Set.of("true", "false");
        b.nullLiterals = Set.of("NULL");
        b.controlKeywords = Set.of("if", "else", "for", "while", "do", "switch", "case", "default");
        b.exitKeywords = C_FAMILY_EXIT;
        b.typeDeclarationKeywords = Set.of("struct", "enum", "union");
        b.importKeywords = Set.of();
        return b.build();
    }

    private static Set<String> cLibrary(Set<String> extra) {
        Set<String> names = new java.util.HashSet<>(Set.of("printf", "scanf", "malloc", "calloc", "realloc",
                "free", "strlen", "strcpy", "strncpy", "strcmp", "strcat", "memcpy", "memset", "FILE", "fopen",
                "fclose", "fprintf", "sprintf", "snprintf", "puts", "getchar", "putchar", "exit", "main",
                "size_t", "stdin", "stdout", "stderr", "EOF", "assert", "int8_t", "int16_t", "int32_t",
                "int64_t", "uint8_t", "uint16_t", "uint32_t", "uint64_t"));
        names.addAll(extra);
        return names;
    }

    private static final class Builder {
        private final Language language;
        private Set<String> keywords = Set.of();
        private Set<String> builtins = Set.of();
        private List<String> operators = List.of();
        private Set<String> boolLiterals = Set.of();
        private Set<String> nullLiterals = Set.of();
        private Set<String> controlKeywords = Set.of();
        private Set<String> exitKeywords = Set.of();
        private Set<String> typeDeclarationKeywords = Set.of();
        private Set<String> importKeywords = Set.of();

        private Builder(Language language) {
            this.language = language;
        }

        private LanguageProfile build() {
            return new LanguageProfile(this);
        }
    }
}
