package io.issuebridge.doc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Document(
        String type,
        int version,
        List<DocNode> content
) {
    public static final String DOC = "doc";

    public Document {
        type = type == null || type.isBlank() ? DOC : type;
        version = version <= 0 ? 1 : version;
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static Document of(List<DocNode> content) {
        return new Document(DOC, 1, content);
    }

    public static Document empty() {
        return of(List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return content.isEmpty();
    }
}
