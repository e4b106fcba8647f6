package com.swarmmind.core.model;

import java.io.Serializable;

/**
 * Output produced while executing a decision.
 *
 * @param kind    what the artifact is
 * @param content textual payload (analysis text, diff, technique description)
 * @param path    file path for code changes (nullable)
 * @param url     link for pull requests (nullable)
 */
public record Artifact(
    ArtifactKind kind,
    String content,
    String path,
    String url
) implements Serializable {

    public static Artifact analysis(String content) {
        return new Artifact(ArtifactKind.ANALYSIS, content, null, null);
    }

    public static Artifact technique(String content) {
        return new Artifact(ArtifactKind.TECHNIQUE, content, null, null);
    }

    public static Artifact codeChange(String path, String content) {
        return new Artifact(ArtifactKind.CODE_CHANGE, content, path, null);
    }
}
