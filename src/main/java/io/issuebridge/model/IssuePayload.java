package io.issuebridge.model;

import io.issuebridge.doc.Document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// A null member is not transmitted; an empty assigneeAccountId on update unassigns the issue.
public record IssuePayload(
        String projectKey,
        String issueType,
        String title,
        String descriptionText,
        Document descriptionDocument,
        String assigneeAccountId,
        String priority,
        List<String> labels,
        List<String> components,
        Map<String, Object> customFields
) {
    public IssuePayload {
        labels = labels == null ? null : List.copyOf(labels);
        components = components == null ? null : List.copyOf(components);
        customFields = customFields == null ? null : new LinkedHashMap<>(customFields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasDescription() {
        return descriptionText != null || descriptionDocument != null;
    }

    public static final class Builder {
        private String projectKey;
        private String issueType;
        private String title;
        private String descriptionText;
        private Document descriptionDocument;
        private String assigneeAccountId;
        private String priority;
        private List<String> labels;
        private List<String> components;
        private Map<String, Object> customFields;

        private Builder() {
        }

        public Builder projectKey(String projectKey) {
            this.projectKey = projectKey;
            return this;
        }

        public Builder issueType(String issueType) {
            this.issueType = issueType;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String text) {
            this.descriptionText = text;
            this.descriptionDocument = null;
            return this;
        }

        public Builder description(Document document) {
            this.descriptionDocument = document;
            this.descriptionText = null;
            return this;
        }

        public Builder assigneeAccountId(String assigneeAccountId) {
            this.assigneeAccountId = assigneeAccountId;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder components(List<String> components) {
            this.components = components;
            return this;
        }

        public Builder customField(String name, Object value) {
            if (customFields == null) {
                customFields = new LinkedHashMap<>();
            }
            customFields.put(name, value);
            return this;
        }

        public IssuePayload build() {
            return new IssuePayload(
                    projectKey,
                    issueType,
                    title,
                    descriptionText,
                    descriptionDocument,
                    assigneeAccountId,
                    priority,
                    labels,
                    components,
                    customFields
            );
        }
    }
}
