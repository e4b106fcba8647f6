package com.swarmmind.core.model;

import java.util.List;
import java.util.regex.Pattern;

public enum IssueDifficulty {
    EASY,
    MEDIUM,
    HARD;

    private static final Pattern EASY_LABEL = Pattern.compile("good.first|beginner|easy", Pattern.CASE_INSENSITIVE);
    private static final Pattern HARD_LABEL = Pattern.compile("complex|hard|expert", Pattern.CASE_INSENSITIVE);

    /**
     * Derives difficulty from issue labels. A hard label wins over an easy one.
     */
    public static IssueDifficulty fromLabels(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return MEDIUM;
        }
        if (labels.stream().anyMatch(l -> HARD_LABEL.matcher(l).find())) {
            return HARD;
        }
        if (labels.stream().anyMatch(l -> EASY_LABEL.matcher(l).find())) {
            return EASY;
        }
        return MEDIUM;
    }
}
