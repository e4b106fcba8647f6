package com.swarmmind.core.channel;

public enum PheromoneKind {
    KNOWLEDGE,
    CODE,
    PR,
    TECHNIQUE
}
