package com.swarmmind.core.model;

import java.io.Serializable;
import java.util.Optional;

/**
 * Actions an agent can decide on, one record per {@link ActionType}. Each carries only the
 * fields its kind needs; callers branch on {@link #type()}.
 */
public sealed interface AgentAction extends Serializable
        permits AgentAction.StudyRepo, AgentAction.FixIssue, AgentAction.WriteCode, AgentAction.Refactor,
                AgentAction.Document, AgentAction.ShareTechnique, AgentAction.ContributePr,
                AgentAction.ExploreTopic {

    ActionType type();

    /**
     * The {@code owner/repo} this action operates on, if any.
     */
    default Optional<String> repository() {
        return Optional.empty();
    }

    /** Short human-readable label, used in logs and the CLI. */
    String describe();

    record StudyRepo(String owner, String repo, String topic) implements AgentAction {
        public StudyRepo(String owner, String repo) {
            this(owner, repo, null);
        }
        @Override public ActionType type() { return ActionType.STUDY_REPO; }
        @Override public Optional<String> repository() { return Optional.of(owner + "/" + repo); }
        @Override public String describe() { return "study " + owner + "/" + repo; }
    }

    record FixIssue(String owner, String repo, int issueNumber) implements AgentAction {
        @Override public ActionType type() { return ActionType.FIX_ISSUE; }
        @Override public Optional<String> repository() { return Optional.of(owner + "/" + repo); }
        @Override public String describe() { return "fix " + owner + "/" + repo + "#" + issueNumber; }
    }

    record WriteCode(String description, String targetRepo) implements AgentAction {
        @Override public ActionType type() { return ActionType.WRITE_CODE; }
        @Override public Optional<String> repository() { return Optional.ofNullable(targetRepo); }
        @Override public String describe() { return "write code: " + description; }
    }

    record Refactor(String owner, String repo, String target) implements AgentAction {
        @Override public ActionType type() { return ActionType.REFACTOR; }
        @Override public Optional<String> repository() { return Optional.of(owner + "/" + repo); }
        @Override public String describe() { return "refactor " + owner + "/" + repo; }
    }

    record Document(String owner, String repo, String target) implements AgentAction {
        @Override public ActionType type() { return ActionType.DOCUMENT; }
        @Override public Optional<String> repository() { return Optional.of(owner + "/" + repo); }
        @Override public String describe() { return "document " + owner + "/" + repo; }
    }

    record ShareTechnique(String technique, String sourceRepo) implements AgentAction {
        public ShareTechnique(String technique) {
            this(technique, null);
        }
        @Override public ActionType type() { return ActionType.SHARE_TECHNIQUE; }
        @Override public String describe() { return "share: " + technique; }
    }

    record ContributePr(String owner, String repo, String description) implements AgentAction {
        @Override public ActionType type() { return ActionType.CONTRIBUTE_PR; }
        @Override public Optional<String> repository() { return Optional.of(owner + "/" + repo); }
        @Override public String describe() { return "contribute to " + owner + "/" + repo; }
    }

    record ExploreTopic(String topic) implements AgentAction {
        @Override public ActionType type() { return ActionType.EXPLORE_TOPIC; }
        @Override public String describe() { return "explore " + topic; }
    }
}
