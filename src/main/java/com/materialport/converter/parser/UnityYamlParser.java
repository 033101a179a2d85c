package com.materialport.converter.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Value;

/**
 * Parser for the YAML dialect Unity writes its serialized assets in.
 *
 * Supported: {@code %} directives, {@code --- !u!<classId> &<fileId>}
 * document headers, block mappings, block sequences (including the compact
 * form where {@code -} sits at the parent key's indentation), flow mappings
 * and sequences, plain, quoted and block scalars. Tags and anchors are
 * dropped wherever they appear. A repeated key keeps its last value.
 */
public class UnityYamlParser {
    private static final Logger log = LoggerFactory.getLogger(UnityYamlParser.class);

    private static final Pattern HEADER_PATTERN = Pattern.compile(
            "^---\\s*(?:!u!(\\d+))?\\s*(?:&(-?\\d+))?.*$"
    );

    public List<YamlDocument> parse(String source) {
        List<YamlDocument> documents = new ArrayList<>();
        List<Line> current = new ArrayList<>();
        String classId = null;
        String fileId = null;
        boolean inDocument = false;

        int lineNum = 0;
        for (String raw : source.split("\r?\n", -1)) {
            lineNum++;

            if (raw.startsWith("%") || raw.startsWith("...")) {
                continue;
            }
            if (raw.startsWith("---")) {
                if (inDocument || !current.isEmpty()) {
                    documents.add(buildDocument(classId, fileId, current));
                }
                Matcher header = HEADER_PATTERN.matcher(raw.trim());
                classId = header.matches() ? header.group(1) : null;
                fileId = header.matches() ? header.group(2) : null;
                current = new ArrayList<>();
                inDocument = true;
                continue;
            }

            String stripped = raw.stripTrailing();
            String content = stripped.stripLeading();
            if (content.isEmpty() || content.startsWith("#")) {
                continue;
            }
            current.add(new Line(lineNum, stripped.length() - content.length(), content));
        }

        if (inDocument || !current.isEmpty()) {
            documents.add(buildDocument(classId, fileId, current));
        }
        log.trace("Parsed {} YAML documents", documents.size());
        return documents;
    }

    private YamlDocument buildDocument(String classId, String fileId, List<Line> lines) {
        YamlNode root = lines.isEmpty()
                ? new YamlNode.Mapping()
                : new BlockParser(lines).parseDocument();
        return new YamlDocument(classId, fileId, root);
    }

    @Value
    private static class Line {
        int number;
        int indent;
        String content;
    }

    /**
     * Recursive descent over the indented lines of one document.
     */
    private static final class BlockParser {
        private final List<Line> lines;
        private int pos = 0;

        private BlockParser(List<Line> lines) {
            this.lines = new ArrayList<>(lines);
        }

        YamlNode parseDocument() {
            YamlNode root = parseBlock(lines.get(0).getIndent());
            if (pos < lines.size()) {
                Line stray = lines.get(pos);
                throw new MaterialParseException("Unexpected content: " + stray.getContent(), stray.getNumber());
            }
            return root;
        }

        private Line peek() {
            return pos < lines.size() ? lines.get(pos) : null;
        }

        private YamlNode parseBlock(int indent) {
            Line line = peek();
            if (line == null || line.getIndent() < indent) {
                return new YamlNode.Scalar("");
            }
            return isSequenceItem(line.getContent())
                    ? parseSequence(line.getIndent())
                    : parseMapping(line.getIndent());
        }

        private YamlNode.Mapping parseMapping(int indent) {
            YamlNode.Mapping mapping = new YamlNode.Mapping();

            while (pos < lines.size()) {
                Line line = lines.get(pos);
                if (line.getIndent() < indent || (line.getIndent() == indent && isSequenceItem(line.getContent()))) {
                    break;
                }
                if (line.getIndent() > indent) {
                    throw new MaterialParseException("Unexpected indentation", line.getNumber());
                }

                int separator = findKeySeparator(line.getContent());
                if (separator < 0) {
                    throw new MaterialParseException("Expected 'key: value' but found: " + line.getContent(), line.getNumber());
                }
                String key = unquote(line.getContent().substring(0, separator).trim());
                String rest = line.getContent().substring(separator + 1).trim();
                pos++;
                mapping.put(key, parseValue(rest, indent, line));
            }
            return mapping;
        }

        private YamlNode.Sequence parseSequence(int indent) {
            List<YamlNode> items = new ArrayList<>();

            while (pos < lines.size()) {
                Line line = lines.get(pos);
                if (line.getIndent() != indent || !isSequenceItem(line.getContent())) {
                    break;
                }

                String rest = line.getContent().substring(1);
                String item = rest.strip();
                if (item.isEmpty()) {
                    pos++;
                    Line next = peek();
                    items.add(next != null && next.getIndent() > indent
                            ? parseBlock(next.getIndent())
                            : new YamlNode.Scalar(""));
                    continue;
                }

                boolean nested = isSequenceItem(item)
                        || (!isFlowStart(item) && findKeySeparator(item) >= 0);
                if (nested) {
                    // Re-read "- key: value" as a mapping that starts at the item's column.
                    int itemIndent = indent + 1 + (rest.length() - rest.stripLeading().length());
                    lines.set(pos, new Line(line.getNumber(), itemIndent, item));
                    items.add(parseBlock(itemIndent));
                } else {
                    pos++;
                    items.add(parseValue(item, indent, line));
                }
            }
            return new YamlNode.Sequence(items);
        }

        private YamlNode parseValue(String rest, int indent, Line line) {
            String value = stripProperties(rest);

            if (value.isEmpty()) {
                Line next = peek();
                if (next != null && next.getIndent() > indent) {
                    return parseBlock(next.getIndent());
                }
                if (next != null && next.getIndent() == indent && isSequenceItem(next.getContent())) {
                    return parseSequence(indent);
                }
                return new YamlNode.Scalar("");
            }

            if (isFlowStart(value)) {
                String flow = joinFlowContinuation(value, indent);
                return new FlowParser(flow, line.getNumber()).parse();
            }

            if (value.startsWith("|") || value.startsWith(">")) {
                return new YamlNode.Scalar(readBlockScalar(indent, value.startsWith("|")));
            }

            StringBuilder text = new StringBuilder(stripComment(value));
            while (peek() != null && peek().getIndent() > indent) {
                text.append(' ').append(stripComment(peek().getContent()));
                pos++;
            }
            return new YamlNode.Scalar(unquote(text.toString()));
        }

        private String joinFlowContinuation(String value, int indent) {
            StringBuilder flow = new StringBuilder(value);
            while (bracketDepth(flow) > 0 && peek() != null && peek().getIndent() > indent) {
                flow.append(' ').append(peek().getContent());
                pos++;
            }
            return flow.toString();
        }

        private String readBlockScalar(int indent, boolean literal) {
            List<String> parts = new ArrayList<>();
            while (peek() != null && peek().getIndent() > indent) {
                parts.add(peek().getContent());
                pos++;
            }
            return String.join(literal ? "\n" : " ", parts);
        }
    }

    /**
     * Parser for one {@code {...}} or {@code [...]} value.
     */
    private static final class FlowParser {
        private final String text;
        private final int line;
        private int pos = 0;

        private FlowParser(String text, int line) {
            this.text = text;
            this.line = line;
        }

        YamlNode parse() {
            YamlNode node = parseNode();
            skipWhitespace();
            if (pos < text.length()) {
                log.trace("Ignoring trailing flow content on line {}: {}", line, text.substring(pos));
            }
            return node;
        }

        private YamlNode parseNode() {
            skipWhitespace();
            if (pos >= text.length()) {
                return new YamlNode.Scalar("");
            }
            char c = text.charAt(pos);
            if (c == '{') {
                return parseMapping();
            }
            if (c == '[') {
                return parseSequence();
            }
            return new YamlNode.Scalar(parseScalar(false));
        }

        private YamlNode.Mapping parseMapping() {
            YamlNode.Mapping mapping = new YamlNode.Mapping();
            pos++;
            while (true) {
                skipWhitespace();
                if (pos >= text.length()) {
                    throw new MaterialParseException("Unterminated flow mapping", line);
                }
                if (text.charAt(pos) == '}') {
                    pos++;
                    return mapping;
                }

                String key = parseScalar(true);
                skipWhitespace();
                YamlNode value = new YamlNode.Scalar("");
                if (pos < text.length() && text.charAt(pos) == ':') {
                    pos++;
                    value = parseNode();
                }
                mapping.put(key, value);
                expectSeparator('}');
            }
        }

        private YamlNode.Sequence parseSequence() {
            List<YamlNode> items = new ArrayList<>();
            pos++;
            while (true) {
                skipWhitespace();
                if (pos >= text.length()) {
                    throw new MaterialParseException("Unterminated flow sequence", line);
                }
                if (text.charAt(pos) == ']') {
                    pos++;
                    return new YamlNode.Sequence(items);
                }
                items.add(parseNode());
                expectSeparator(']');
            }
        }

        private void expectSeparator(char close) {
            skipWhitespace();
            if (pos < text.length() && text.charAt(pos) == ',') {
                pos++;
            } else if (pos < text.length() && text.charAt(pos) != close) {
                throw new MaterialParseException("Unexpected '" + text.charAt(pos) + "' in flow collection", line);
            }
        }

        private String parseScalar(boolean key) {
            skipWhitespace();
            if (pos < text.length() && (text.charAt(pos) == '"' || text.charAt(pos) == '\'')) {
                return parseQuoted(text.charAt(pos));
            }
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == ',' || c == '}' || c == ']') {
                    break;
                }
                if (key && c == ':' && (pos + 1 >= text.length() || " ,}]".indexOf(text.charAt(pos + 1)) >= 0)) {
                    break;
                }
                pos++;
            }
            return stripProperties(text.substring(start, pos).trim());
        }

        private String parseQuoted(char quote) {
            StringBuilder sb = new StringBuilder();
            pos++;
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == quote) {
                    if (quote == '\'' && pos < text.length() && text.charAt(pos) == '\'') {
                        sb.append('\'');
                        pos++;
                        continue;
                    }
                    return sb.toString();
                }
                if (c == '\\' && quote == '"' && pos < text.length()) {
                    sb.append(text.charAt(pos++));
                    continue;
                }
                sb.append(c);
            }
            throw new MaterialParseException("Unterminated quoted scalar", line);
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }
    }

    static boolean isSequenceItem(String content) {
        return content.equals("-") || content.startsWith("- ") || content.startsWith("-\t");
    }

    private static boolean isFlowStart(String value) {
        return value.startsWith("{") || value.startsWith("[");
    }

    /**
     * Index of the ':' that ends a block mapping key, or -1.
     */
    static int findKeySeparator(String content) {
        char quote = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if ((c == '"' || c == '\'') && i == 0) {
                quote = c;
            } else if (c == ':' && (i + 1 == content.length() || Character.isWhitespace(content.charAt(i + 1)))) {
                return i;
            } else if (c == '{' || c == '[') {
                return -1;
            }
        }
        return -1;
    }

    /**
     * Drops leading tags ({@code !u!21}, {@code !!float}) and anchors ({@code &123}).
     */
    static String stripProperties(String value) {
        String result = value.trim();
        while (result.startsWith("!") || result.startsWith("&")) {
            int space = result.indexOf(' ');
            if (space < 0) {
                return "";
            }
            result = result.substring(space + 1).trim();
        }
        return result;
    }

    private static String stripComment(String value) {
        if (value.startsWith("\"") || value.startsWith("'")) {
            return value;
        }
        int comment = value.indexOf(" #");
        return comment < 0 ? value : value.substring(0, comment).trim();
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                String inner = value.substring(1, value.length() - 1);
                return first == '\'' ? inner.replace("''", "'") : inner.replace("\\\"", "\"");
            }
        }
        return value;
    }

    private static int bracketDepth(CharSequence flow) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < flow.length(); i++) {
            char c = flow.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
            }
        }
        return depth;
    }
}
