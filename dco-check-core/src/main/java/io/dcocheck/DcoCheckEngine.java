package io.dcocheck;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the DCO check over the commits of a pull request.
 *
 * <p>
 * The check runs in two passes. Remediations are first collected from every commit, so a
 * later commit can remediate an earlier one. Each commit is then evaluated in order:
 * <ol>
 * <li>Exempt commits (merge, bot, trusted member) pass without further checks</li>
 * <li>Author and committer emails must be valid</li>
 * <li>At least one sign-off must be present</li>
 * <li>With valid emails, some sign-off must match the author or the committer</li>
 * <li>A commit that did not pass through its own sign-off passes if a remediation applies
 * to it, discarding the errors found in the previous steps</li>
 * </ol>
 *
 * <p>
 * The check has no side effects and never fails: it always produces a complete
 * {@link CheckOutput}.
 */
public class DcoCheckEngine {

	private static final Logger logger = LoggerFactory.getLogger(DcoCheckEngine.class);

	private final CommitClassifier classifier;

	private final EmailValidator emailValidator;

	private final SignOffExtractor signOffExtractor;

	private final SignOffMatcher signOffMatcher;

	private final RemediationCollector remediationCollector;

	private final RemediationMatcher remediationMatcher;

	public DcoCheckEngine() {
		this(new CommitClassifier(), new EmailValidator(), new SignOffExtractor(), new SignOffMatcher(),
				new RemediationCollector(), new RemediationMatcher());
	}

	public DcoCheckEngine(CommitClassifier classifier, EmailValidator emailValidator,
			SignOffExtractor signOffExtractor, SignOffMatcher signOffMatcher,
			RemediationCollector remediationCollector, RemediationMatcher remediationMatcher) {
		this.classifier = classifier;
		this.emailValidator = emailValidator;
		this.signOffExtractor = signOffExtractor;
		this.signOffMatcher = signOffMatcher;
		this.remediationCollector = remediationCollector;
		this.remediationMatcher = remediationMatcher;
	}

	/**
	 * Run the DCO check.
	 * @param input commits, configuration, head branch and trusted members
	 * @return check output with one entry per commit, in input order
	 */
	public CheckOutput check(CheckInput input) {
		EffectiveConfig config = input.config();
		List<Remediation> remediations = remediationCollector.collect(input.commits(), config);

		List<CommitCheckOutput> results = new ArrayList<>(input.commits().size());
		for (Commit commit : input.commits()) {
			results.add(checkCommit(commit, config, input.members(), remediations));
		}

		CheckOutput output = CheckOutput.of(results, config, input.headRef());
		logger.debug("DCO check completed: {} commits, {} with errors", results.size(),
				output.numCommitsWithErrors());
		return output;
	}

	private CommitCheckOutput checkCommit(Commit commit, EffectiveConfig config, List<String> members,
			List<Remediation> remediations) {
		Optional<CommitSuccessReason> skipReason = classifier.classify(commit, config, members);
		if (skipReason.isPresent()) {
			logger.debug("commit {} skipped: {}", commit.sha(), skipReason.get().getDescription());
			return new CommitCheckOutput(commit, List.of(), skipReason.get());
		}

		List<CommitError> errors = new ArrayList<>(emailValidator.validate(commit));
		boolean emailsAreValid = errors.isEmpty();

		List<SignOff> signOffs = signOffExtractor.extract(commit.message());
		if (signOffs.isEmpty()) {
			errors.add(CommitError.SIGN_OFF_NOT_FOUND);
		}

		@Nullable CommitSuccessReason successReason = null;
		if (emailsAreValid && !signOffs.isEmpty()) {
			if (signOffMatcher.matches(signOffs, commit)) {
				successReason = CommitSuccessReason.VALID_SIGN_OFF;
			}
			else {
				errors.add(CommitError.SIGN_OFF_MISMATCH);
			}
		}

		if (successReason == null && remediationMatcher.matches(remediations, commit)) {
			errors.clear();
			successReason = CommitSuccessReason.VALID_SIGN_OFF_IN_REMEDIATION_COMMIT;
		}

		logger.debug("commit {} processed: errors={}, successReason={}, author={}, committer={}, signOffs={}",
				commit.sha(), errors, successReason, commit.author(), commit.committer(), signOffs);
		return new CommitCheckOutput(commit, errors, successReason);
	}

}
