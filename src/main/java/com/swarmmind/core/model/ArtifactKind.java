package com.swarmmind.core.model;

public enum ArtifactKind {
    CODE_CHANGE,
    PR_URL,
    ANALYSIS,
    TECHNIQUE
}
