package com.swarmmind.core.model;

import java.io.Serializable;

/**
 * A proposed edit produced by the reasoning collaborator.
 *
 * @param path        file to change
 * @param original    text to replace (empty for a new file)
 * @param modified    replacement text
 * @param explanation what the change does
 */
public record CodePatch(
    String path,
    String original,
    String modified,
    String explanation
) implements Serializable {}
