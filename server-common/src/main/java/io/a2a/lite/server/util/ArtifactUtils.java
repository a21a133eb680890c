package io.a2a.lite.server.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import io.a2a.lite.spec.Artifact;
import io.a2a.lite.spec.DataPart;
import io.a2a.lite.spec.Part;
import io.a2a.lite.spec.TextPart;

/**
 * Utility functions for creating artifacts and applying them to a task's artifact list.
 */
public final class ArtifactUtils {

    private ArtifactUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates a new Artifact object containing only a single TextPart.
     *
     * @param name The human-readable name of the artifact.
     * @param text The text content of the artifact.
     * @param index The position of the artifact in the task's artifact stream.
     * @return A new {@code Artifact} object.
     */
    public static Artifact newTextArtifact(String name, String text, int index) {
        return Artifact.builder()
                .name(name)
                .parts(new TextPart(text))
                .index(index)
                .build();
    }

    /**
     * Creates a new Artifact object containing only a single DataPart.
     *
     * @param name The human-readable name of the artifact.
     * @param data The structured data content of the artifact.
     * @param index The position of the artifact in the task's artifact stream.
     * @return A new {@code Artifact} object.
     */
    public static Artifact newDataArtifact(String name, Map<String, Object> data, int index) {
        return Artifact.builder()
                .name(name)
                .parts(new DataPart(data))
                .index(index)
                .build();
    }

    /**
     * Applies an artifact to the current artifact list of a task.
     * <p>
     * An artifact with {@code append} set extends the parts of the artifact stored at the same
     * index and takes over its {@code lastChunk} flag. Any other artifact replaces the one at its
     * index. An artifact for an index not seen yet is added. The result is ordered by index.
     *
     * @param artifacts the current artifacts
     * @param artifact the artifact to apply
     * @return the new artifact list
     */
    public static List<Artifact> applyArtifact(List<Artifact> artifacts, Artifact artifact) {
        List<Artifact> result = new ArrayList<>(artifacts);
        for (int i = 0; i < result.size(); i++) {
            Artifact existing = result.get(i);
            if (existing.index() != artifact.index()) {
                continue;
            }
            if (artifact.isAppend()) {
                List<Part<?>> parts = new ArrayList<>(existing.parts());
                parts.addAll(artifact.parts());
                result.set(i, Artifact.builder(existing)
                        .parts(parts)
                        .append(null)
                        .lastChunk(artifact.lastChunk())
                        .build());
            } else {
                result.set(i, artifact);
            }
            return result;
        }
        result.add(artifact);
        result.sort(Comparator.comparingInt(Artifact::index));
        return result;
    }
}
