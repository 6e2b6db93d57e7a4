package io.dcocheck;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * {@link DcoClient} decorator caching organization membership lookups.
 *
 * <p>
 * Entries expire one hour after being loaded. Concurrent lookups of the same
 * organization and user share a single request to the wrapped client; failed lookups
 * are not cached. Every other operation is passed through.
 */
public final class CachingDcoClient implements DcoClient {

	/**
	 * Default time a membership lookup result is kept.
	 */
	public static final Duration DEFAULT_MEMBERSHIP_TTL = Duration.ofHours(1);

	private final DcoClient delegate;

	private final Cache<MembershipKey, Boolean> memberships;

	public CachingDcoClient(DcoClient delegate) {
		this(delegate, DEFAULT_MEMBERSHIP_TTL);
	}

	public CachingDcoClient(DcoClient delegate, Duration membershipTtl) {
		this.delegate = delegate;
		this.memberships = Caffeine.newBuilder().expireAfterWrite(membershipTtl).maximumSize(100_000).build();
	}

	@Override
	public List<Commit> compareCommits(RequestContext ctx, String baseSha, String headSha) {
		return delegate.compareCommits(ctx, baseSha, headSha);
	}

	@Override
	public Optional<RepositoryConfig> getConfig(RequestContext ctx) {
		return delegate.getConfig(ctx);
	}

	@Override
	public boolean isOrganizationMember(RequestContext ctx, String organization, String username) {
		return memberships.get(new MembershipKey(organization, username),
				key -> delegate.isOrganizationMember(ctx, key.organization(), key.username()));
	}

	@Override
	public void createCheckRun(RequestContext ctx, CheckRun checkRun) {
		delegate.createCheckRun(ctx, checkRun);
	}

	private record MembershipKey(String organization, String username) {
	}

}
