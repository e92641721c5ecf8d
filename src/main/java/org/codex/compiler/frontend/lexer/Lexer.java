package org.codex.compiler.frontend.lexer;

import org.codex.compiler.diagnostics.CompilationException;
import org.codex.compiler.diagnostics.ErrorKind;
import org.codex.runtime.model.Identifiers;
import org.codex.runtime.model.Modifier;
import org.codex.runtime.model.ModifierSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splits a notation source into lines and classifies each of them.
 * <p>
 * Comments start with {@code //} and run to the end of the line. Each remaining line is split at its
 * first space into a head token and an optional tail, and classified in this order: blank,
 * deprecation annotation, variant, module start, module end, alias, symbol.
 * <p>
 * Variants are checked before module starts, so <code>.l {</code> is a variant whose value is a brace
 * rather than a module with an invalid name.
 */
public class Lexer {

    private static final String COMMENT = "//";
    private static final String DEPRECATED = "@deprecated";
    private static final String ALIAS_MARKER = "@=";
    private static final String DEEP_SUFFIX = ".*";

    private final String fileName;

    /**
     * @param fileName The logical file name used in error messages.
     */
    public Lexer(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Classifies every line of the source.
     * @param source The full source text.
     * @return One {@link Line} per source line, blank lines included.
     * @throws CompilationException on the first malformed line.
     */
    public List<Line> lex(String source) {
        List<Line> lines = new ArrayList<>();
        List<String> rows = source.lines().collect(Collectors.toList());
        for (int i = 0; i < rows.size(); i++) {
            int number = i + 1;
            String text = rows.get(i);
            try {
                lines.add(tokenize(text, number));
            } catch (LexicalException e) {
                throw new CompilationException(e.kind(), fileName, number, e.getMessage());
            }
        }
        return lines;
    }

    /**
     * Classifies a single line.
     * @param text       The raw line, comments included.
     * @param lineNumber The 1-based line number to record on the result.
     * @return The classified line.
     * @throws LexicalException if the line is malformed.
     */
    public Line tokenize(String text, int lineNumber) throws LexicalException {
        int comment = text.indexOf(COMMENT);
        String line = (comment >= 0 ? text.substring(0, comment) : text).strip();
        if (line.isEmpty()) {
            return new Line.Blank(lineNumber);
        }

        int space = line.indexOf(' ');
        String head = space < 0 ? line : line.substring(0, space);
        String tail = space < 0 ? null : line.substring(space + 1).strip();

        if (head.startsWith(DEPRECATED) && head.endsWith(":")) {
            return deprecation(lineNumber, head.substring(DEPRECATED.length(), head.length() - 1), tail);
        }
        if (head.equals("}") && tail == null) {
            return new Line.ModuleEnd(lineNumber);
        }
        if (head.startsWith(".")) {
            ModifierSet modifiers = parseModifiers(head.substring(1));
            if (tail == null || tail.isEmpty()) {
                throw new LexicalException(ErrorKind.MISSING_VALUE, "missing value for variant '" + head + "'");
            }
            return new Line.Variant(lineNumber, modifiers, EscapeDecoder.decode(tail));
        }
        if ("{".equals(tail)) {
            validateIdentifier(head);
            return new Line.ModuleStart(lineNumber, head);
        }
        if (head.contains(ALIAS_MARKER) || (tail != null && tail.startsWith(ALIAS_MARKER))) {
            return alias(lineNumber, line);
        }
        validateIdentifier(head);
        String value = tail == null || tail.isEmpty() ? null : EscapeDecoder.decode(tail);
        return new Line.Symbol(lineNumber, head, value);
    }

    private Line deprecation(int lineNumber, String inner, String tail) throws LexicalException {
        ModifierSet modifiers = null;
        if (!inner.isEmpty()) {
            if (!inner.startsWith("(") || !inner.endsWith(")") || inner.length() < 3) {
                throw new LexicalException(ErrorKind.MALFORMED_MODIFIER_ANNOTATION,
                        "malformed modifier in deprecation: '" + inner + "'");
            }
            modifiers = parseModifiers(inner.substring(1, inner.length() - 1));
        }
        if (tail == null || tail.isEmpty()) {
            throw new LexicalException(ErrorKind.MISSING_DEPRECATION_MESSAGE, "missing deprecation message");
        }
        return new Line.Deprecated(lineNumber, modifiers, tail);
    }

    private Line alias(int lineNumber, String line) throws LexicalException {
        int marker = line.indexOf(ALIAS_MARKER);
        String name = line.substring(0, marker).strip();
        String target = line.substring(marker + ALIAS_MARKER.length()).strip();
        validateIdentifier(name);
        if (target.isEmpty()) {
            throw new LexicalException(ErrorKind.MISSING_VALUE, "missing target for alias '" + name + "'");
        }

        boolean deep = target.endsWith(DEEP_SUFFIX);
        if (deep) {
            target = target.substring(0, target.length() - DEEP_SUFFIX.length());
        }

        String[] segments = target.split("\\.", -1);
        Set<String> seen = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (int i = 0; i < segments.length; i++) {
            validateIdentifier(segments[i]);
            if (i == 0) continue;
            if (!seen.add(segments[i])) {
                throw new LexicalException(ErrorKind.DUPLICATE_MODIFIER,
                        "duplicate modifier '" + segments[i] + "' in alias target");
            }
            path.add(segments[i]);
        }
        return new Line.Alias(lineNumber, name, segments[0], List.copyOf(path), deep);
    }

    /**
     * Parses a dotted modifier path. Segments may carry the optional marker.
     */
    static ModifierSet parseModifiers(String dotted) throws LexicalException {
        ModifierSet result = ModifierSet.EMPTY;
        for (String segment : dotted.split("\\.", -1)) {
            String bare = segment.endsWith(String.valueOf(Modifier.OPTIONAL_MARKER))
                    ? segment.substring(0, segment.length() - 1)
                    : segment;
            validateIdentifier(bare);
            if (result.contains(bare)) {
                throw new LexicalException(ErrorKind.DUPLICATE_MODIFIER, "duplicate modifier '" + bare + "' in '" + dotted + "'");
            }
            result = result.insertRaw(segment);
        }
        return result;
    }

    private static void validateIdentifier(String text) throws LexicalException {
        if (!Identifiers.isValid(text)) {
            throw new LexicalException(ErrorKind.INVALID_IDENTIFIER, "invalid identifier: \"" + text + "\"");
        }
    }
}
