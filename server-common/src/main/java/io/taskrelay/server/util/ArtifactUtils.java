package io.taskrelay.server.util;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.DataPart;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.TextPart;
import org.jspecify.annotations.Nullable;

/**
 * Factory methods for the artifacts agents report, and for reading them back.
 */
public final class ArtifactUtils {

    private ArtifactUtils() {
    }

    /**
     * Creates an artifact with a generated id.
     *
     * @param parts the content of the artifact
     * @param name a human-readable name
     * @param description an optional description
     * @return the artifact
     */
    public static Artifact newArtifact(List<Part<?>> parts, String name, @Nullable String description) {
        return new Artifact(UUID.randomUUID().toString(), name, description, parts);
    }

    public static Artifact newArtifact(List<Part<?>> parts, String name) {
        return newArtifact(parts, name, null);
    }

    /**
     * Creates an artifact holding a single {@link TextPart}.
     */
    public static Artifact newTextArtifact(String name, String text, @Nullable String description) {
        return newArtifact(List.of(new TextPart(text)), name, description);
    }

    public static Artifact newTextArtifact(String name, String text) {
        return newTextArtifact(name, text, null);
    }

    /**
     * Creates an artifact holding a single {@link DataPart}.
     */
    public static Artifact newDataArtifact(String name, Map<String, Object> data, @Nullable String description) {
        return newArtifact(List.of(new DataPart(data)), name, description);
    }

    public static Artifact newDataArtifact(String name, Map<String, Object> data) {
        return newDataArtifact(name, data, null);
    }

    /**
     * Creates one text chunk of an artifact that is streamed in pieces. All chunks of the same
     * artifact share its id.
     */
    public static Artifact textChunk(String artifactId, String text) {
        return Artifact.builder()
                .artifactId(artifactId)
                .parts(new TextPart(text))
                .build();
    }

    /**
     * @return the text parts of the artifact, concatenated in order
     */
    public static String getTextContent(Artifact artifact) {
        StringBuilder sb = new StringBuilder();
        for (Part<?> part : artifact.parts()) {
            if (part instanceof TextPart textPart) {
                sb.append(textPart.text());
            }
        }
        return sb.toString();
    }
}
