package io.dcocheck;

import org.jspecify.annotations.Nullable;

/**
 * Repository configuration with every default resolved.
 *
 * @param individualRemediationAllowed whether individual remediation commits are allowed
 * @param thirdPartyRemediationAllowed whether third-party remediation commits are allowed
 * @param membersSignOffRequired whether organization members must sign off their commits
 */
public record EffectiveConfig(boolean individualRemediationAllowed, boolean thirdPartyRemediationAllowed,
		boolean membersSignOffRequired) {

	private static final EffectiveConfig DEFAULTS = new EffectiveConfig(false, false, true);

	/**
	 * Configuration used when the repository does not provide one.
	 */
	public static EffectiveConfig defaults() {
		return DEFAULTS;
	}

	/**
	 * Merge the configuration provided by the repository with the defaults. Missing
	 * sections and missing fields fall back to their default value.
	 * @param config repository configuration (null if the repository has none)
	 * @return effective configuration
	 */
	public static EffectiveConfig from(@Nullable RepositoryConfig config) {
		if (config == null) {
			return DEFAULTS;
		}

		boolean individual = DEFAULTS.individualRemediationAllowed();
		boolean thirdParty = DEFAULTS.thirdPartyRemediationAllowed();
		RepositoryConfig.AllowRemediationCommits remediation = config.allowRemediationCommits();
		if (remediation != null) {
			individual = orDefault(remediation.individual(), individual);
			thirdParty = orDefault(remediation.thirdParty(), thirdParty);
		}

		boolean members = DEFAULTS.membersSignOffRequired();
		if (config.require() != null) {
			members = orDefault(config.require().members(), members);
		}

		return new EffectiveConfig(individual, thirdParty, members);
	}

	private static boolean orDefault(@Nullable Boolean value, boolean defaultValue) {
		return value != null ? value : defaultValue;
	}

}
