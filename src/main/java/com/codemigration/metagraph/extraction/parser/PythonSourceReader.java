package com.codemigration.metagraph.extraction.parser;

import com.codemigration.metagraph.exception.MalformedInputException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns Python source into a tree of logical statements.
 *
 * <p>A logical statement spans physical lines while brackets are open, a triple-quoted string is
 * open, or a line ends with a backslash. Comments are dropped; string literals are kept verbatim.
 * Blocks are nested under the statement whose text ends with {@code ':'}.
 */
final class PythonSourceReader {

    static final class Statement {
        final int indent;
        final String text;
        final int line;
        final List<Statement> body = new ArrayList<>();

        Statement(int indent, String text, int line) {
            this.indent = indent;
            this.text = text;
            this.line = line;
        }

        boolean opensBlock() {
            return text.endsWith(":");
        }
    }

    private final String path;

    private PythonSourceReader(String path) {
        this.path = path;
    }

    static List<Statement> read(String path, String contents) {
        PythonSourceReader reader = new PythonSourceReader(path);
        return reader.nest(reader.logicalLines(contents));
    }

    private List<Statement> logicalLines(String contents) {
        List<Statement> statements = new ArrayList<>();
        String[] lines = contents.split("\n", -1);
        StringBuilder buffer = new StringBuilder();
        Deque<Character> brackets = new ArrayDeque<>();
        boolean continuing = false;
        boolean inString = false;
        boolean triple = false;
        char quote = 0;
        int stringLine = 0;
        int indent = 0;
        int startLine = 0;

        for (int n = 0; n < lines.length; n++) {
            String raw = lines[n].endsWith("\r") ? lines[n].substring(0, lines[n].length() - 1) : lines[n];
            int pos = 0;
            if (!continuing) {
                String stripped = raw.strip();
                if (stripped.isEmpty() || stripped.startsWith("#")) {
                    continue;
                }
                indent = indentOf(raw);
                startLine = n + 1;
                buffer.setLength(0);
                pos = firstNonBlank(raw);
            } else {
                buffer.append('\n');
            }

            boolean escapedNewline = false;
            for (int i = pos; i < raw.length(); i++) {
                char c = raw.charAt(i);
                if (inString) {
                    if (c == '\\') {
                        if (i == raw.length() - 1) {
                            escapedNewline = true;
                            buffer.append(c);
                        } else {
                            buffer.append(c).append(raw.charAt(i + 1));
                            i++;
                        }
                        continue;
                    }
                    if (triple && raw.startsWith(String.valueOf(quote).repeat(3), i)) {
                        buffer.append(quote).append(quote).append(quote);
                        i += 2;
                        inString = false;
                        continue;
                    }
                    if (!triple && c == quote) {
                        inString = false;
                    }
                    buffer.append(c);
                    continue;
                }
                if (c == '#') {
                    break;
                }
                if (c == '"' || c == '\'') {
                    inString = true;
                    quote = c;
                    stringLine = n + 1;
                    triple = raw.startsWith(String.valueOf(c).repeat(3), i);
                    if (triple) {
                        buffer.append(c).append(c).append(c);
                        i += 2;
                    } else {
                        buffer.append(c);
                    }
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    brackets.push(c);
                } else if (c == ')' || c == ']' || c == '}') {
                    if (brackets.isEmpty() || brackets.pop() != opening(c)) {
                        throw new MalformedInputException(path, n + 1, "unmatched '" + c + "'");
                    }
                }
                buffer.append(c);
            }

            if (inString && !triple && !escapedNewline) {
                throw new MalformedInputException(path, stringLine, "unterminated string literal");
            }
            if (inString || !brackets.isEmpty()) {
                continuing = true;
                continue;
            }
            String text = buffer.toString().strip();
            if (text.endsWith("\\")) {
                buffer.setLength(buffer.lastIndexOf("\\"));
                continuing = true;
                continue;
            }
            statements.add(new Statement(indent, text, startLine));
            continuing = false;
        }

        if (inString) {
            throw new MalformedInputException(path, stringLine, "unterminated triple-quoted string");
        }
        if (!brackets.isEmpty()) {
            throw new MalformedInputException(path, startLine, "'" + brackets.peek() + "' was never closed");
        }
        if (continuing) {
            throw new MalformedInputException(path, startLine, "unexpected end of file after line continuation");
        }
        return statements;
    }

    private List<Statement> nest(List<Statement> flat) {
        Statement root = new Statement(-1, "", 0);
        Deque<Statement> parents = new ArrayDeque<>();
        Deque<Integer> indents = new ArrayDeque<>();
        parents.push(root);
        indents.push(0);
        Statement previous = null;

        for (Statement statement : flat) {
            if (previous != null && previous.opensBlock()) {
                if (statement.indent <= indents.peek()) {
                    throw new MalformedInputException(path, statement.line,
                        "expected an indented block after line " + previous.line);
                }
                indents.push(statement.indent);
                parents.push(previous);
            } else if (statement.indent > indents.peek()) {
                throw new MalformedInputException(path, statement.line, "unexpected indent");
            } else {
                while (statement.indent < indents.peek()) {
                    indents.pop();
                    parents.pop();
                }
                if (statement.indent != indents.peek()) {
                    throw new MalformedInputException(path, statement.line,
                        "unindent does not match any outer indentation level");
                }
            }
            parents.peek().body.add(statement);
            previous = statement;
        }
        if (previous != null && previous.opensBlock()) {
            throw new MalformedInputException(path, previous.line, "expected an indented block at end of file");
        }
        return root.body;
    }

    private static char opening(char closing) {
        return switch (closing) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    private static int indentOf(String line) {
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = (column / 8 + 1) * 8;
            } else if (c == '\f') {
                column = 0;
            } else {
                break;
            }
        }
        return column;
    }

    private static int firstNonBlank(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    // ================================================================
    // Text helpers shared with the parser
    // ================================================================

    /**
     * Index of the bracket closing the one at {@code open}, skipping string literals; -1 if none.
     */
    static int matchingClose(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Index of the first {@code target} outside brackets and strings, at or after {@code from}; -1 if none.
     */
    static int indexOfTopLevel(String text, char target, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int next;
        while ((next = indexOfTopLevel(text, separator, start)) >= 0) {
            parts.add(text.substring(start, next).strip());
            start = next + 1;
        }
        parts.add(text.substring(start).strip());
        parts.removeIf(String::isEmpty);
        return parts;
    }
}
