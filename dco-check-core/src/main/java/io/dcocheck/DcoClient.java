package io.dcocheck;

import java.util.List;
import java.util.Optional;

/**
 * Operations on the code hosting platform needed to run DCO checks.
 *
 * <p>
 * Every operation acts on behalf of the GitHub App installation identified by the request
 * context. Failures are reported as unchecked exceptions.
 */
public interface DcoClient {

	/**
	 * Get the commits between two commits, in the order returned by GitHub.
	 * @param ctx request context
	 * @param baseSha base commit SHA
	 * @param headSha head commit SHA
	 * @return commits reachable from head but not from base
	 */
	List<Commit> compareCommits(RequestContext ctx, String baseSha, String headSha);

	/**
	 * Get the repository DCO configuration ({@code .github/dco.yml}).
	 * @param ctx request context
	 * @return configuration, or empty when the repository has none
	 */
	Optional<RepositoryConfig> getConfig(RequestContext ctx);

	/**
	 * Check whether a user is a member of an organization.
	 * @param ctx request context
	 * @param organization organization login
	 * @param username user login
	 * @return true if the user is a member
	 */
	boolean isOrganizationMember(RequestContext ctx, String organization, String username);

	/**
	 * Create a check run in the repository.
	 * @param ctx request context
	 * @param checkRun completed check run
	 */
	void createCheckRun(RequestContext ctx, CheckRun checkRun);

}
