package io.issuebridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.issuebridge.doc.Document;
import io.issuebridge.doc.DocumentConverter;
import io.issuebridge.model.Comment;
import io.issuebridge.model.Component;
import io.issuebridge.model.FetchMode;
import io.issuebridge.model.IssueFull;
import io.issuebridge.model.IssuePayload;
import io.issuebridge.model.IssueSummary;
import io.issuebridge.model.Project;
import io.issuebridge.model.TrackerUser;
import io.issuebridge.model.Transition;
import io.issuebridge.model.Version;
import io.issuebridge.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class IssueMapper {
    static final String UNKNOWN = "Unknown";
    private static final Set<String> STANDARD_FIELDS = FetchMode.standardFieldNames();

    private IssueMapper() {
    }

    static IssueFull toFull(JsonNode issue) {
        JsonNode fields = issue.path("fields");
        return new IssueFull(
                issue.path("key").asText(""),
                issue.path("id").asText(""),
                fields.path("summary").asText(""),
                fields.path("status").path("name").asText(UNKNOWN),
                fields.path("issuetype").path("name").asText(UNKNOWN),
                toDocument(fields.path("description")),
                toUser(fields.path("assignee")),
                toUser(fields.path("reporter")),
                textOrNull(fields.path("priority").path("name")),
                stringList(fields.path("labels")),
                fields.path("created").asText(""),
                fields.path("updated").asText(""),
                fields.path("project").path("key").asText(""),
                components(fields.path("components")),
                versions(fields.path("fixVersions")),
                customFields(fields),
                comments(fields.path("comment").path("comments")),
                transitions(issue.path("transitions"))
        );
    }

    static IssueSummary toSummary(JsonNode issue) {
        JsonNode fields = issue.path("fields");
        return new IssueSummary(
                issue.path("key").asText(""),
                issue.path("id").asText(""),
                fields.path("summary").asText(""),
                fields.path("status").path("name").asText(UNKNOWN),
                fields.path("issuetype").path("name").asText(UNKNOWN)
        );
    }

    static TrackerUser toUser(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return new TrackerUser(
                node.path("accountId").asText(""),
                node.path("displayName").asText(""),
                textOrNull(node.path("emailAddress")),
                node.path("active").asBoolean(true)
        );
    }

    static Project toProject(JsonNode node) {
        return new Project(
                node.path("id").asText(""),
                node.path("key").asText(""),
                node.path("name").asText(""),
                node.path("projectTypeKey").asText("")
        );
    }

    static Comment toComment(JsonNode node) {
        return new Comment(
                node.path("id").asText(""),
                toUser(node.path("author")),
                toDocument(node.path("body")),
                node.path("created").asText(""),
                node.path("updated").asText("")
        );
    }

    static List<Transition> transitions(JsonNode node) {
        List<Transition> out = new ArrayList<>();
        if (!node.isArray()) {
            return out;
        }
        for (JsonNode t : node) {
            out.add(new Transition(
                    t.path("id").asText(""),
                    t.path("name").asText(""),
                    t.path("to").path("id").asText(""),
                    t.path("to").path("name").asText("")
            ));
        }
        return out;
    }

    static Document toDocument(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return DocumentConverter.textToDocument(node.asText());
        }
        try {
            return Jsons.compact().treeToValue(node, Document.class);
        } catch (JsonProcessingException e) {
            throw new TrackerException(
                    TrackerException.Kind.INVALID_RESPONSE,
                    "Malformed rich-text document",
                    null,
                    null,
                    false,
                    e
            );
        }
    }

    static ObjectNode toFields(IssuePayload payload, boolean update) {
        ObjectNode fields = Jsons.compact().createObjectNode();
        if (payload.projectKey() != null) {
            fields.putObject("project").put("key", payload.projectKey());
        }
        if (payload.issueType() != null) {
            fields.putObject("issuetype").put("name", payload.issueType());
        }
        if (payload.title() != null) {
            fields.put("summary", payload.title());
        }
        if (payload.hasDescription()) {
            Document doc = payload.descriptionDocument() != null
                    ? payload.descriptionDocument()
                    : DocumentConverter.textToDocument(payload.descriptionText());
            fields.set("description", Jsons.compact().valueToTree(doc));
        }
        if (payload.assigneeAccountId() != null) {
            if (update && payload.assigneeAccountId().isEmpty()) {
                fields.putNull("assignee");
            } else {
                fields.putObject("assignee").put("accountId", payload.assigneeAccountId());
            }
        }
        if (payload.priority() != null) {
            fields.putObject("priority").put("name", payload.priority());
        }
        if (payload.labels() != null) {
            ArrayNode labels = fields.putArray("labels");
            payload.labels().forEach(labels::add);
        }
        if (payload.components() != null) {
            ArrayNode components = fields.putArray("components");
            payload.components().forEach(name -> components.addObject().put("name", name));
        }
        if (payload.customFields() != null) {
            for (Map.Entry<String, Object> entry : payload.customFields().entrySet()) {
                fields.set(entry.getKey(), Jsons.compact().valueToTree(entry.getValue()));
            }
        }
        return fields;
    }

    private static Map<String, JsonNode> customFields(JsonNode fields) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        if (!fields.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            if (name.startsWith("customfield_") || !STANDARD_FIELDS.contains(name)) {
                out.put(name, entry.getValue());
            }
        }
        return out;
    }

    private static List<Component> components(JsonNode node) {
        List<Component> out = new ArrayList<>();
        for (JsonNode c : node) {
            out.add(new Component(c.path("id").asText(""), c.path("name").asText("")));
        }
        return out;
    }

    private static List<Version> versions(JsonNode node) {
        List<Version> out = new ArrayList<>();
        for (JsonNode v : node) {
            out.add(new Version(v.path("id").asText(""), v.path("name").asText(""), v.path("released").asBoolean(false)));
        }
        return out;
    }

    private static List<Comment> comments(JsonNode node) {
        List<Comment> out = new ArrayList<>();
        for (JsonNode c : node) {
            out.add(toComment(c));
        }
        return out;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> out = new ArrayList<>();
        for (JsonNode v : node) {
            out.add(v.asText());
        }
        return out;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
