package com.swarmmind.core.external;

import com.swarmmind.core.model.DiscoveredIssue;

import java.util.List;

/**
 * Lists open issues of a repository. Returns an empty list on failure.
 */
public interface IssueDiscovery {

    List<DiscoveredIssue> listIssues(String owner, String repo, int limit);
}
