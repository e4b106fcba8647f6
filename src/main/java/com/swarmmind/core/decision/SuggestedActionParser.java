package com.swarmmind.core.decision;

import com.swarmmind.core.model.AgentAction;
import com.swarmmind.core.model.DiscoveredIssue;
import com.swarmmind.core.model.DiscoveredRepo;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the free-text actions suggested by a thought into structured
 * {@link AgentAction}s.
 * <p>
 * Recognised intents: study, share, explore, refactor, document. Fixing issues
 * and contributing pull requests are not done autonomously, so those intents
 * become a {@code study_repo} on the repository they refer to.
 */
@Component
public class SuggestedActionParser {

    private static final Pattern REPO_REF = Pattern.compile("([a-zA-Z0-9_-]+)/([a-zA-Z0-9_.-]+)");
    private static final Pattern ISSUE_REF = Pattern.compile("#(\\d+)");
    private static final Pattern PR_WORD = Pattern.compile("\\bpr\\b|pull request");
    private static final Pattern SHARE_PREFIX = Pattern.compile("^share_technique:?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXPLORE_PREFIX = Pattern.compile("^explore_topic:?\\s*", Pattern.CASE_INSENSITIVE);

    static final String DEFAULT_TECHNIQUE = "engineering insight";
    static final String DEFAULT_TOPIC = "distributed systems";

    public Optional<AgentAction> parse(String suggestion, List<DiscoveredRepo> repos, List<DiscoveredIssue> issues) {
        if (suggestion == null || suggestion.isBlank()) {
            return Optional.empty();
        }
        String text = suggestion.trim();
        String lower = text.toLowerCase(Locale.ROOT);

        if (lower.startsWith("fix_issue") || lower.contains("fix issue") || lower.contains("fix_issue")) {
            return studyInsteadOfFix(text, repos, issues);
        }
        if (lower.startsWith("study") || lower.contains("study_repo")) {
            return study(text, lower, repos);
        }
        if (lower.startsWith("share_technique") || lower.contains("share")) {
            String technique = SHARE_PREFIX.matcher(text).replaceFirst("").trim();
            return Optional.of(new AgentAction.ShareTechnique(technique.isEmpty() ? DEFAULT_TECHNIQUE : technique));
        }
        if (lower.startsWith("explore_topic") || lower.contains("explore")) {
            String topic = EXPLORE_PREFIX.matcher(text).replaceFirst("").trim();
            return Optional.of(new AgentAction.ExploreTopic(topic.isEmpty() ? DEFAULT_TOPIC : topic));
        }
        if (lower.contains("contribute") || PR_WORD.matcher(lower).find()) {
            return studyInsteadOfFix(text, repos, issues);
        }
        if (lower.contains("refactor")) {
            return repoRef(text).map(m -> new AgentAction.Refactor(m.group(1), m.group(2), text));
        }
        if (lower.contains("document")) {
            return repoRef(text).map(m -> new AgentAction.Document(m.group(1), m.group(2), text));
        }
        return Optional.empty();
    }

    private Optional<AgentAction> study(String text, String lower, List<DiscoveredRepo> repos) {
        Optional<Matcher> ref = repoRef(text);
        if (ref.isPresent()) {
            var m = ref.get();
            Optional<DiscoveredRepo> known = findRepo(repos, m.group(1), m.group(2));
            if (known.isPresent()) {
                return known.map(SuggestedActionParser::studyOf);
            }
            // "study_file:src/main.rs" names a path inside a repo, not a repo
            if (!lower.startsWith("study_file")) {
                return Optional.of(new AgentAction.StudyRepo(m.group(1), m.group(2)));
            }
        }
        return repos.stream().findFirst().map(SuggestedActionParser::studyOf);
    }

    private Optional<AgentAction> studyInsteadOfFix(String text, List<DiscoveredRepo> repos,
                                                    List<DiscoveredIssue> issues) {
        Matcher issueRef = ISSUE_REF.matcher(text);
        if (issueRef.find()) {
            int number = Integer.parseInt(issueRef.group(1));
            Optional<AgentAction> fromIssue = issues.stream()
                    .filter(i -> i.number() == number)
                    .findFirst()
                    .map(i -> new AgentAction.StudyRepo(i.owner(), i.repo()));
            if (fromIssue.isPresent()) {
                return fromIssue;
            }
        }
        Optional<Matcher> ref = repoRef(text);
        if (ref.isPresent()) {
            Optional<DiscoveredRepo> known = findRepo(repos, ref.get().group(1), ref.get().group(2));
            if (known.isPresent()) {
                return known.map(SuggestedActionParser::studyOf);
            }
        }
        return repos.stream().findFirst().map(SuggestedActionParser::studyOf);
    }

    private static Optional<Matcher> repoRef(String text) {
        Matcher m = REPO_REF.matcher(text);
        return m.find() ? Optional.of(m) : Optional.empty();
    }

    private static Optional<DiscoveredRepo> findRepo(List<DiscoveredRepo> repos, String owner, String repo) {
        return repos.stream()
                .filter(r -> r.owner().equalsIgnoreCase(owner) && r.repo().equalsIgnoreCase(repo))
                .findFirst();
    }

    private static AgentAction studyOf(DiscoveredRepo repo) {
        return new AgentAction.StudyRepo(repo.owner(), repo.repo());
    }
}
