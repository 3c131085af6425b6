package io.issuebridge.doc;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts between flat text with a small inline markup dialect and the
 * tracker's rich-text document tree.
 *
 * <p>Recognised markup: {@code **bold**}, {@code _italic_}, {@code `code`},
 * blank-line paragraph breaks, {@code - }/{@code * } bullet lines and
 * {@code N. } numbered lines. The reverse direction keeps text content and
 * list structure but drops marks, so a round trip is not formatting-preserving.
 */
public final class DocumentConverter {
    private static final Pattern BLOCK_SPLIT = Pattern.compile("\\n[ \\t]*\\n\\s*");
    private static final Pattern NUMBERED = Pattern.compile("^\\d+\\.\\s.*");
    private static final Pattern NUMBER_PREFIX = Pattern.compile("^\\d+\\.\\s");

    private DocumentConverter() {
    }

    public static Document textToDocument(String text) {
        if (text == null || text.isEmpty()) {
            return Document.empty();
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        List<DocNode> blocks = new ArrayList<>();
        for (String block : BLOCK_SPLIT.split(normalized)) {
            if (block.isBlank()) {
                continue;
            }
            String[] lines = block.split("\n", -1);
            List<String> nonEmpty = new ArrayList<>();
            for (String line : lines) {
                if (!line.isBlank()) {
                    nonEmpty.add(line.trim());
                }
            }
            if (nonEmpty.stream().allMatch(DocumentConverter::isBulletLine)) {
                blocks.add(listNode(DocNode.BULLET_LIST, nonEmpty, true));
            } else if (nonEmpty.stream().allMatch(line -> NUMBERED.matcher(line).matches())) {
                blocks.add(listNode(DocNode.ORDERED_LIST, nonEmpty, false));
            } else {
                blocks.add(paragraph(lines));
            }
        }
        return Document.of(blocks);
    }

    public static String documentToText(Document document) {
        if (document == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        appendNodes(document.content(), out);
        return out.toString();
    }

    static List<DocNode> parseInline(String line) {
        List<DocNode> nodes = new ArrayList<>();
        StringBuilder plain = new StringBuilder();
        int i = 0;
        while (i < line.length()) {
            int consumed = tryMark(line, i, "**", DocMark.strong(), nodes, plain);
            if (consumed == 0) {
                consumed = tryMark(line, i, "_", DocMark.em(), nodes, plain);
            }
            if (consumed == 0) {
                consumed = tryMark(line, i, "`", DocMark.code(), nodes, plain);
            }
            if (consumed > 0) {
                i += consumed;
                continue;
            }
            int next = nextDelimiter(line, i + 1);
            int end = next < 0 ? line.length() : next;
            plain.append(line, i, end);
            i = end;
        }
        flushPlain(nodes, plain);
        return nodes;
    }

    private static int tryMark(String line, int start, String delimiter, DocMark mark,
                               List<DocNode> nodes, StringBuilder plain) {
        if (!line.startsWith(delimiter, start)) {
            return 0;
        }
        int bodyStart = start + delimiter.length();
        // Shortest non-empty body: search for the closing delimiter after at least one char.
        int close = line.indexOf(delimiter, bodyStart + 1);
        if (close < 0) {
            return 0;
        }
        flushPlain(nodes, plain);
        nodes.add(DocNode.text(line.substring(bodyStart, close), mark));
        return close + delimiter.length() - start;
    }

    private static int nextDelimiter(String line, int from) {
        int best = -1;
        for (String delimiter : new String[]{"**", "_", "`"}) {
            int idx = line.indexOf(delimiter, from);
            if (idx >= 0 && (best < 0 || idx < best)) {
                best = idx;
            }
        }
        return best;
    }

    private static void flushPlain(List<DocNode> nodes, StringBuilder plain) {
        if (plain.length() > 0) {
            nodes.add(DocNode.text(plain.toString()));
            plain.setLength(0);
        }
    }

    private static boolean isBulletLine(String trimmed) {
        return trimmed.startsWith("- ") || trimmed.startsWith("* ");
    }

    private static DocNode listNode(String type, List<String> lines, boolean bullet) {
        List<DocNode> items = new ArrayList<>(lines.size());
        for (String line : lines) {
            String body = bullet ? line.substring(2) : NUMBER_PREFIX.matcher(line).replaceFirst("");
            DocNode paragraph = DocNode.block(DocNode.PARAGRAPH, List.of(DocNode.text(body)));
            items.add(DocNode.block(DocNode.LIST_ITEM, List.of(paragraph)));
        }
        return DocNode.block(type, items);
    }

    private static DocNode paragraph(String[] lines) {
        List<DocNode> content = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                content.add(DocNode.hardBreak());
            }
            content.addAll(parseInline(lines[i]));
        }
        return DocNode.block(DocNode.PARAGRAPH, content);
    }

    private static void appendNodes(List<DocNode> nodes, StringBuilder out) {
        for (DocNode node : nodes) {
            String type = node.type() == null ? "" : node.type();
            switch (type) {
                case DocNode.TEXT -> {
                    if (node.text() != null) {
                        out.append(node.text());
                    }
                }
                case DocNode.HARD_BREAK -> out.append('\n');
                case DocNode.PARAGRAPH -> {
                    if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
                        out.append('\n');
                    }
                    appendNodes(node.content(), out);
                    out.append('\n');
                }
                case DocNode.BULLET_LIST, DocNode.ORDERED_LIST -> {
                    boolean ordered = DocNode.ORDERED_LIST.equals(type);
                    int index = 1;
                    for (DocNode item : node.content()) {
                        StringBuilder itemText = new StringBuilder();
                        appendNodes(item.content(), itemText);
                        out.append(ordered ? index + ". " : "- ")
                                .append(itemText.toString().trim())
                                .append('\n');
                        index++;
                    }
                }
                default -> appendNodes(node.content(), out);
            }
        }
    }
}
