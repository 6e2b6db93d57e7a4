package io.dcocheck;

import java.util.List;

/**
 * Input of a DCO check.
 *
 * @param commits pull request commits, in the order returned by GitHub
 * @param config effective repository configuration
 * @param headRef name of the pull request head branch
 * @param members logins of users exempted from signing off
 */
public record CheckInput(List<Commit> commits, EffectiveConfig config, String headRef, List<String> members) {

	public CheckInput {
		commits = List.copyOf(commits);
		members = List.copyOf(members);
	}

}
