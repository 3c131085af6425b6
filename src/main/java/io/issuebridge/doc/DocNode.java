package io.issuebridge.doc;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record DocNode(
        String type,
        List<DocNode> content,
        String text,
        List<DocMark> marks,
        Map<String, Object> attrs
) {
    public static final String PARAGRAPH = "paragraph";
    public static final String BULLET_LIST = "bulletList";
    public static final String ORDERED_LIST = "orderedList";
    public static final String LIST_ITEM = "listItem";
    public static final String TEXT = "text";
    public static final String HARD_BREAK = "hardBreak";

    public DocNode {
        content = content == null ? List.of() : List.copyOf(content);
        marks = marks == null ? List.of() : List.copyOf(marks);
        // Remote attrs may hold null values, which Map.copyOf rejects.
        attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    public static DocNode block(String type, List<DocNode> content) {
        return new DocNode(type, content, null, null, null);
    }

    public static DocNode text(String text) {
        return new DocNode(TEXT, null, text, null, null);
    }

    public static DocNode text(String text, DocMark mark) {
        return new DocNode(TEXT, null, text, List.of(mark), null);
    }

    public static DocNode hardBreak() {
        return new DocNode(HARD_BREAK, null, null, null, null);
    }

    public boolean hasType(String expected) {
        return expected.equals(type);
    }
}
