package com.apilifecycle.openapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One OpenAPI document plus the sub-documents mounted below it.
 *
 * Mounts form a tree that may share sub-trees (the same node mounted twice) and may even
 * contain cycles; {@link SchemaAnnotator} handles both. Nodes compare by identity.
 */
public final class SchemaNode {

    /** Inline mount list understood by {@link #fromDocument(ObjectNode)}. */
    public static final String MOUNTS_EXTENSION = "x-mounts";

    private final ObjectNode document;
    private final List<Mount> mounts = new ArrayList<>();

    public SchemaNode(ObjectNode document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    /**
     * Wraps a document and, recursively, the documents listed in its {@code x-mounts} array:
     * <pre>
     * "x-mounts": [ { "prefix": "/v1", "document": { "paths": { ... } } } ]
     * </pre>
     * The nested documents are wrapped in place, so annotations show up in the original tree.
     */
    public static SchemaNode fromDocument(ObjectNode document) {
        SchemaNode node = new SchemaNode(document);
        JsonNode mounts = document.path(MOUNTS_EXTENSION);
        for (JsonNode mount : mounts) {
            String prefix = mount.path("prefix").asText(null);
            JsonNode child = mount.path("document");
            if (prefix == null || !(child instanceof ObjectNode childDocument)) {
                throw new IllegalArgumentException(MOUNTS_EXTENSION + " entries need a prefix and a document object");
            }
            node.mount(prefix, fromDocument(childDocument));
        }
        return node;
    }

    public SchemaNode mount(String prefix, SchemaNode child) {
        mounts.add(new Mount(prefix, child));
        return this;
    }

    public ObjectNode document() {
        return document;
    }

    public List<Mount> mounts() {
        return Collections.unmodifiableList(mounts);
    }

    public record Mount(String prefix, SchemaNode child) {
        public Mount {
            Objects.requireNonNull(prefix, "prefix");
            Objects.requireNonNull(child, "child");
        }
    }
}
