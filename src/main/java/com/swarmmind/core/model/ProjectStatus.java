package com.swarmmind.core.model;

public enum ProjectStatus {
    PROPOSED,
    ACTIVE,
    COMPLETED
}
