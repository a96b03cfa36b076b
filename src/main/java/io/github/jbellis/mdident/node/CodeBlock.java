package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fenced or indented code block. {@code language} is the first word of the fence info string,
 * or {@code null} when there is none.
 */
public record CodeBlock(String language, String code, Map<String, Object> metadata, NodeId id) implements Node {
    public CodeBlock {
        Objects.requireNonNull(code, "code");
        if (language != null && language.isBlank()) {
            language = null;
        }
        metadata = Metadata.copyOf(metadata);
    }

    public static CodeBlock draft(String language, String code) {
        return new CodeBlock(language, code, Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CODE_BLOCK;
    }

    public Optional<String> languageOpt() {
        return Optional.ofNullable(language);
    }

    @Override
    public CodeBlock withId(NodeId newId) {
        return new CodeBlock(language, code, metadata, newId);
    }

    @Override
    public CodeBlock withMetadata(Map<String, ?> newMetadata) {
        return new CodeBlock(language, code, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCodeBlock(this);
    }
}
