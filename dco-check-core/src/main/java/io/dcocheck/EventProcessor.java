package io.dcocheck;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides what to do with each webhook event and reports the result as a check run.
 *
 * <p>
 * Handled events:
 * <ul>
 * <li>{@code pull_request} opened or synchronized: runs the DCO check on the pull request
 * commits</li>
 * <li>{@code check_run} requested action {@code override}: sets the check result to
 * passed</li>
 * <li>{@code merge_group} checks requested: sets the check result to passed, as the check
 * already passed before the pull request entered the merge queue</li>
 * </ul>
 * Any other event is ignored.
 */
public class EventProcessor {

	private static final Logger logger = LoggerFactory.getLogger(EventProcessor.class);

	/**
	 * Name of the check displayed in GitHub.
	 */
	public static final String CHECK_NAME = "DCO";

	static final String CHECK_PASSED_TITLE = "Check passed!";

	static final String CHECK_FAILED_TITLE = "Check failed";

	static final String MERGE_GROUP_SUMMARY = "Check result set to passed for the merge group";

	static final String OVERRIDE_ACTION_IDENTIFIER = "override";

	static final String OVERRIDE_ACTION_LABEL = "Set DCO to pass";

	static final String OVERRIDE_ACTION_DESCRIPTION = "Manually set DCO check result to passed";

	static final String OVERRIDE_SUMMARY = "Check result was manually set to passed";

	private final DcoClient client;

	private final DcoCheckEngine engine;

	private final CheckSummaryRenderer renderer;

	public EventProcessor(DcoClient client) {
		this(client, new DcoCheckEngine(), new CheckSummaryRenderer());
	}

	public EventProcessor(DcoClient client, DcoCheckEngine engine, CheckSummaryRenderer renderer) {
		this.client = client;
		this.engine = engine;
		this.renderer = renderer;
	}

	/**
	 * Process a webhook event.
	 * @param event parsed webhook event
	 * @throws DcoCheckException if any step needed to process the event fails
	 */
	public void process(WebhookEvent event) {
		if (event instanceof PullRequestEvent pullRequestEvent) {
			processPullRequestEvent(pullRequestEvent);
		}
		else if (event instanceof CheckRunEvent checkRunEvent) {
			processCheckRunEvent(checkRunEvent);
		}
		else if (event instanceof MergeGroupEvent mergeGroupEvent) {
			processMergeGroupEvent(mergeGroupEvent);
		}
		else {
			logger.debug("Ignoring event of type {}", event.getClass().getSimpleName());
		}
	}

	private void processPullRequestEvent(PullRequestEvent event) {
		Instant startedAt = Instant.now();
		if (event.action() != PullRequestEvent.Action.OPENED && event.action() != PullRequestEvent.Action.SYNCHRONIZE) {
			logger.debug("Ignoring pull_request event with action {}", event.action());
			return;
		}

		RequestContext ctx = event.context();
		PullRequestEvent.PullRequest pullRequest = event.pullRequest();

		List<Commit> commits;
		try {
			commits = client.compareCommits(ctx, pullRequest.base().sha(), pullRequest.head().sha());
		}
		catch (RuntimeException e) {
			throw new DcoCheckException("error getting pull request commits", e);
		}

		EffectiveConfig config;
		try {
			config = EffectiveConfig.from(client.getConfig(ctx).orElse(null));
		}
		catch (RuntimeException e) {
			throw new DcoCheckException("error getting repository configuration", e);
		}

		List<String> members = List.of();
		if (!config.membersSignOffRequired()) {
			try {
				members = collectMembers(event, commits);
			}
			catch (RuntimeException e) {
				throw new DcoCheckException("error collecting members", e);
			}
		}

		CheckOutput output = engine.check(new CheckInput(commits, config, pullRequest.head().ref(), members));

		CheckRun checkRun;
		if (output.passed()) {
			checkRun = new CheckRun(CHECK_NAME, pullRequest.head().sha(), CheckRunConclusion.SUCCESS,
					CHECK_PASSED_TITLE, renderer.render(output), List.of(), startedAt, Instant.now());
		}
		else {
			CheckRunAction override = new CheckRunAction(OVERRIDE_ACTION_LABEL, OVERRIDE_ACTION_DESCRIPTION,
					OVERRIDE_ACTION_IDENTIFIER);
			checkRun = new CheckRun(CHECK_NAME, pullRequest.head().sha(), CheckRunConclusion.ACTION_REQUIRED,
					CHECK_FAILED_TITLE, renderer.render(output), List.of(override), startedAt, Instant.now());
		}
		createCheckRun(ctx, checkRun);

		logger.info("DCO check for {}/{}@{}: {} commits, {} with errors", ctx.owner(), ctx.repo(),
				pullRequest.head().sha(), commits.size(), output.numCommitsWithErrors());
	}

	/**
	 * Collect the logins of the users not required to sign off their commits. For
	 * organization repositories, these are the authors of verified commits who belong to
	 * the organization. Otherwise, the repository owner is the only member.
	 */
	private List<String> collectMembers(PullRequestEvent event, List<Commit> commits) {
		if (event.organization() == null) {
			return List.of(event.repository().owner().login());
		}

		String organization = event.organization().login();
		RequestContext ctx = event.context();
		List<String> members = new ArrayList<>();
		Set<String> checked = new HashSet<>();
		for (Commit commit : commits) {
			if (!commit.isVerified() || commit.author() == null || commit.author().login() == null) {
				continue;
			}
			String login = commit.author().login();
			if (checked.add(login) && client.isOrganizationMember(ctx, organization, login)) {
				members.add(login);
			}
		}
		return members;
	}

	private void processCheckRunEvent(CheckRunEvent event) {
		Instant startedAt = Instant.now();
		if (event.action() != CheckRunEvent.Action.REQUESTED_ACTION || event.requestedAction() == null
				|| !OVERRIDE_ACTION_IDENTIFIER.equals(event.requestedAction().identifier())) {
			logger.debug("Ignoring check_run event with action {}", event.action());
			return;
		}

		RequestContext ctx = event.context();
		String headSha = event.checkRun().headSha();
		createCheckRun(ctx, new CheckRun(CHECK_NAME, headSha, CheckRunConclusion.SUCCESS, OVERRIDE_SUMMARY,
				OVERRIDE_SUMMARY, List.of(), startedAt, Instant.now()));
		logger.info("DCO check for {}/{}@{} manually set to passed", ctx.owner(), ctx.repo(), headSha);
	}

	private void processMergeGroupEvent(MergeGroupEvent event) {
		Instant startedAt = Instant.now();
		if (event.action() != MergeGroupEvent.Action.CHECKS_REQUESTED) {
			logger.debug("Ignoring merge_group event with action {}", event.action());
			return;
		}

		RequestContext ctx = event.context();
		String headSha = event.mergeGroup().headCommit().id();
		createCheckRun(ctx, new CheckRun(CHECK_NAME, headSha, CheckRunConclusion.SUCCESS, MERGE_GROUP_SUMMARY,
				MERGE_GROUP_SUMMARY, List.of(), startedAt, Instant.now()));
		logger.info("DCO check for merge group {}/{}@{} set to passed", ctx.owner(), ctx.repo(), headSha);
	}

	private void createCheckRun(RequestContext ctx, CheckRun checkRun) {
		try {
			client.createCheckRun(ctx, checkRun);
		}
		catch (RuntimeException e) {
			throw new DcoCheckException("error creating check run", e);
		}
	}

}
