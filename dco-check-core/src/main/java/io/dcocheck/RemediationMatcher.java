package io.dcocheck;

import java.util.List;

/**
 * Checks whether a commit has been remediated: some remediation targets its SHA and was
 * declared by its author or committer.
 */
public class RemediationMatcher {

	public boolean matches(List<Remediation> remediations, Commit commit) {
		return remediations.stream()
			.anyMatch(r -> r.targetSha().equals(commit.sha())
					&& commit.isAuthoredOrCommittedBy(r.declarant().name(), r.declarant().email()));
	}

}
