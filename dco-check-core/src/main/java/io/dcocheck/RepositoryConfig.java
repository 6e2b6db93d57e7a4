package io.dcocheck;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Repository configuration as read from {@code .github/dco.yml}.
 *
 * <p>
 * Every field is optional. Use {@link EffectiveConfig#from(RepositoryConfig)} to obtain the
 * configuration with defaults applied.
 *
 * <pre>
 * allowRemediationCommits:
 *   individual: true
 *   thirdParty: true
 * require:
 *   members: false
 * </pre>
 *
 * @param allowRemediationCommits remediation commits section
 * @param require require section
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryConfig(
		@JsonProperty("allowRemediationCommits") @Nullable AllowRemediationCommits allowRemediationCommits,
		@JsonProperty("require") @Nullable Require require) {

	/**
	 * Remediation commits section.
	 *
	 * @param individual whether individual remediation commits are allowed (default: false)
	 * @param thirdParty whether third-party remediation commits are allowed (default: false)
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record AllowRemediationCommits(@JsonProperty("individual") @Nullable Boolean individual,
			@JsonProperty("thirdParty") @Nullable Boolean thirdParty) {
	}

	/**
	 * Require section.
	 *
	 * @param members whether organization members are required to sign off (default: true)
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Require(@JsonProperty("members") @Nullable Boolean members) {
	}

}
