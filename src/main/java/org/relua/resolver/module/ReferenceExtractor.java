package org.relua.resolver.module;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scans Lua source text for {@code require} calls and classifies each one.
 *
 * <p>This is a lightweight lexical scan. It does not parse Lua, but it does skip comments
 * ({@code --}, {@code --[[ ]]}, {@code --[==[ ]==]}) and string literals so that text inside
 * them is never mistaken for a reference. Method-style calls ({@code obj.require},
 * {@code obj:require}) are not references; a bare {@code require} that is not called
 * (e.g. {@code local r = require}) is ignored.</p>
 *
 * <p>Recognized static forms are {@code require("m")}, {@code require('m')},
 * {@code require "m"}, {@code require 'm'}, {@code require [[m]]} and
 * {@code require([[m]])}. Anything computed at runtime is reported as
 * {@link ModuleReference.Dynamic}; syntactically broken calls and literals that are not
 * module names are reported as {@link ModuleReference.Malformed}.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public final class ReferenceExtractor {

    private static final String KEYWORD = "require";
    private static final int MAX_EXPRESSION_LENGTH = 80;

    /**
     * Extracts all {@code require} occurrences from the given text.
     *
     * @param content The raw file text.
     * @return The references in source order, duplicates preserved.
     */
    public ExtractionResult extract(String content) {
        Cursor cursor = new Cursor(content);
        List<ModuleReference> references = new ArrayList<>();
        char previous = 0;
        char beforePrevious = 0;

        while (!cursor.atEnd()) {
            char c = cursor.peek();
            if (c == '-' && cursor.peek(1) == '-') {
                cursor.skipComment();
                continue;
            }
            if (c == '"' || c == '\'' || cursor.atLongBracket()) {
                cursor.readLiteral();
                beforePrevious = previous;
                previous = '"';
                continue;
            }
            if (isIdentifierStart(c)) {
                int start = cursor.pos;
                String word = cursor.readWord();
                boolean memberAccess = (previous == '.' && beforePrevious != '.') || previous == ':';
                if (KEYWORD.equals(word) && !memberAccess) {
                    ModuleReference reference = parseCall(cursor, cursor.lineAt(start));
                    if (reference != null) {
                        references.add(reference);
                    }
                }
                beforePrevious = previous;
                previous = 'a';
                continue;
            }
            if (!Character.isWhitespace(c)) {
                beforePrevious = previous;
                previous = c;
            }
            cursor.pos++;
        }
        return new ExtractionResult(references);
    }

    private ModuleReference parseCall(Cursor cursor, int line) {
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            return null;
        }
        char c = cursor.peek();
        if (c == '(') {
            int open = cursor.pos;
            cursor.pos++;
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                return new ModuleReference.Malformed(line, "unterminated argument list");
            }
            if (cursor.peek() == ')') {
                cursor.pos++;
                return new ModuleReference.Malformed(line, "missing module name");
            }
            if (!cursor.atStringStart()) {
                return new ModuleReference.Dynamic(line, cursor.expressionFrom(open));
            }
            String value = cursor.readLiteral();
            if (value == null) {
                return new ModuleReference.Malformed(line, "unterminated string literal");
            }
            cursor.skipWhitespace();
            if (!cursor.atEnd() && cursor.peek() == ')') {
                cursor.pos++;
                return literal(value, line);
            }
            return new ModuleReference.Dynamic(line, cursor.expressionFrom(open));
        }
        if (cursor.atStringStart()) {
            String value = cursor.readLiteral();
            if (value == null) {
                return new ModuleReference.Malformed(line, "unterminated string literal");
            }
            return literal(value, line);
        }
        if (c == '{') {
            return new ModuleReference.Dynamic(line, cursor.expressionFrom(cursor.pos));
        }
        return null;
    }

    private static ModuleReference literal(String value, int line) {
        if (ModuleNames.isValid(value)) {
            return new ModuleReference.Identifier(value, line);
        }
        return new ModuleReference.Malformed(line, "not a module name: '" + value + "'");
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Position within the scanned text plus the lexical helpers that move it.
     */
    private static final class Cursor {
        private final String text;
        private final int[] newlines;
        private int pos;

        Cursor(String text) {
            this.text = text;
            int[] offsets = new int[16];
            int count = 0;
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    if (count == offsets.length) {
                        offsets = Arrays.copyOf(offsets, count * 2);
                    }
                    offsets[count++] = i;
                }
            }
            this.newlines = Arrays.copyOf(offsets, count);
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        char peek(int ahead) {
            int index = pos + ahead;
            return index < text.length() ? text.charAt(index) : 0;
        }

        /** 1-based line number of the given offset. */
        int lineAt(int offset) {
            int index = Arrays.binarySearch(newlines, offset);
            // an offset is never a newline here, so the insertion point counts the lines above it
            return (index < 0 ? -index - 1 : index) + 1;
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        String readWord() {
            int start = pos;
            while (!atEnd() && isIdentifierPart(peek())) {
                pos++;
            }
            return text.substring(start, pos);
        }

        boolean atStringStart() {
            if (atEnd()) {
                return false;
            }
            char c = peek();
            return c == '"' || c == '\'' || atLongBracket();
        }

        boolean atLongBracket() {
            return longBracketLevel() >= 0;
        }

        /**
         * Returns the level of a long bracket opening at the cursor ({@code [[} is 0,
         * {@code [=[} is 1), or -1 if there is none.
         */
        private int longBracketLevel() {
            if (atEnd() || peek() != '[') {
                return -1;
            }
            int level = 0;
            while (peek(1 + level) == '=') {
                level++;
            }
            return peek(1 + level) == '[' ? level : -1;
        }

        /**
         * Reads a quoted or long-bracket string and returns its value, or {@code null}
         * if the literal is not terminated.
         */
        String readLiteral() {
            int level = longBracketLevel();
            return level >= 0 ? readLongBracket(level) : readQuoted();
        }

        private String readQuoted() {
            char quote = peek();
            pos++;
            StringBuilder value = new StringBuilder();
            while (!atEnd()) {
                char c = peek();
                if (c == quote) {
                    pos++;
                    return value.toString();
                }
                if (c == '\n') {
                    return null;
                }
                if (c == '\\' && pos + 1 < text.length()) {
                    char escaped = text.charAt(pos + 1);
                    if (escaped == '\\' || escaped == '"' || escaped == '\'') {
                        value.append(escaped);
                    } else {
                        value.append(c).append(escaped);
                    }
                    pos += 2;
                    continue;
                }
                value.append(c);
                pos++;
            }
            return null;
        }

        private String readLongBracket(int level) {
            String close = "]" + "=".repeat(level) + "]";
            int contentStart = pos + level + 2;
            int end = text.indexOf(close, contentStart);
            if (end < 0) {
                pos = text.length();
                return null;
            }
            String value = text.substring(contentStart, end);
            pos = end + close.length();
            return value.startsWith("\n") ? value.substring(1) : value;
        }

        void skipComment() {
            pos += 2;
            if (atLongBracket()) {
                readLongBracket(longBracketLevel());
                return;
            }
            int end = text.indexOf('\n', pos);
            pos = end < 0 ? text.length() : end;
        }

        String expressionFrom(int start) {
            int end = text.indexOf('\n', start);
            String expression = text.substring(start, end < 0 ? text.length() : end).trim();
            return expression.length() > MAX_EXPRESSION_LENGTH
                    ? expression.substring(0, MAX_EXPRESSION_LENGTH) + "..."
                    : expression;
        }
    }
}
