package io.dcocheck;

import java.util.List;

/**
 * Checks whether any sign-off matches the author or the committer of a commit. Both the
 * name and the email must match, ignoring case.
 */
public class SignOffMatcher {

	public boolean matches(List<SignOff> signOffs, Commit commit) {
		return signOffs.stream().anyMatch(s -> commit.isAuthoredOrCommittedBy(s.name(), s.email()));
	}

}
