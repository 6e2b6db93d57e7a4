package io.dcocheck;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * {@link DcoClient} backed by the GitHub REST API.
 *
 * <p>
 * Converts GitHub API JSON responses to the check model at the client boundary.
 * Requests are authenticated with the access token of the installation in the request
 * context.
 */
public class GitHubDcoClient implements DcoClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubDcoClient.class);

	/**
	 * Location of the repository configuration file.
	 */
	public static final String CONFIG_FILE_PATH = ".github/dco.yml";

	private static final int COMMITS_PER_PAGE = 100;

	private final GitHubClient httpClient;

	private final GitHubAppTokenProvider tokenProvider;

	private final ObjectMapper objectMapper;

	private final ObjectMapper yamlMapper;

	public GitHubDcoClient(GitHubClient httpClient, GitHubAppTokenProvider tokenProvider, ObjectMapper objectMapper,
			ObjectMapper yamlMapper) {
		this.httpClient = httpClient;
		this.tokenProvider = tokenProvider;
		this.objectMapper = objectMapper;
		this.yamlMapper = yamlMapper;
	}

	@Override
	public List<Commit> compareCommits(RequestContext ctx, String baseSha, String headSha) {
		String authorization = tokenProvider.installationAuthorization(ctx.installationId());
		String basePath = repoPath(ctx) + "/compare/" + encode(baseSha) + "..." + encode(headSha);

		List<Commit> commits = new ArrayList<>();
		int page = 1;
		while (true) {
			JsonNode response = readTree(
					httpClient.get(basePath + "?per_page=" + COMMITS_PER_PAGE + "&page=" + page, authorization));
			JsonNode pageCommits = response.path("commits");
			for (JsonNode node : pageCommits) {
				commits.add(parseCommit(node));
			}

			int totalCommits = response.path("total_commits").asInt(commits.size());
			if (pageCommits.size() < COMMITS_PER_PAGE || commits.size() >= totalCommits) {
				break;
			}
			page++;
		}

		logger.debug("Fetched {} commits for {}/{} ({}...{})", commits.size(), ctx.owner(), ctx.repo(), baseSha,
				headSha);
		RateLimitInfo rateLimit = httpClient.getLastRateLimitInfo();
		if (rateLimit != null && rateLimit.isExceeded()) {
			logger.warn("Rate limit exhausted for installation {}, resets at {}", ctx.installationId(),
					rateLimit.getResetTime());
		}
		return commits;
	}

	@Override
	public Optional<RepositoryConfig> getConfig(RequestContext ctx) {
		String authorization = tokenProvider.installationAuthorization(ctx.installationId());
		String response;
		try {
			response = httpClient.get(repoPath(ctx) + "/contents/" + CONFIG_FILE_PATH, authorization);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isNotFound()) {
				logger.debug("No configuration file found in {}/{}", ctx.owner(), ctx.repo());
				return Optional.empty();
			}
			throw e;
		}

		String content = readTree(response).path("content").asText("");
		String yaml = new String(Base64.getMimeDecoder().decode(content), StandardCharsets.UTF_8);
		if (yaml.isBlank()) {
			return Optional.empty();
		}
		try {
			return Optional.ofNullable(yamlMapper.readValue(yaml, RepositoryConfig.class));
		}
		catch (IOException e) {
			throw new UncheckedIOException("invalid configuration file " + CONFIG_FILE_PATH, e);
		}
	}

	@Override
	public boolean isOrganizationMember(RequestContext ctx, String organization, String username) {
		String authorization = tokenProvider.installationAuthorization(ctx.installationId());
		try {
			httpClient.get("/orgs/" + encode(organization) + "/members/" + encode(username), authorization);
			return true;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isNotFound()) {
				return false;
			}
			throw e;
		}
	}

	@Override
	public void createCheckRun(RequestContext ctx, CheckRun checkRun) {
		String authorization = tokenProvider.installationAuthorization(ctx.installationId());
		try {
			String body = objectMapper.writeValueAsString(checkRunRequestBody(checkRun));
			httpClient.post(repoPath(ctx) + "/check-runs", body, authorization);
		}
		catch (IOException e) {
			throw new UncheckedIOException("error serializing check run", e);
		}
		logger.debug("Created check run {} ({}) for {} in {}/{}", checkRun.name(), checkRun.conclusion().getApiValue(),
				checkRun.headSha(), ctx.owner(), ctx.repo());
	}

	ObjectNode checkRunRequestBody(CheckRun checkRun) {
		ObjectNode body = objectMapper.createObjectNode();
		body.put("name", checkRun.name());
		body.put("head_sha", checkRun.headSha());
		body.put("status", CheckRun.STATUS_COMPLETED);
		body.put("conclusion", checkRun.conclusion().getApiValue());
		body.put("started_at", checkRun.startedAt().truncatedTo(ChronoUnit.SECONDS).toString());
		body.put("completed_at", checkRun.completedAt().truncatedTo(ChronoUnit.SECONDS).toString());

		ObjectNode output = body.putObject("output");
		output.put("title", checkRun.title());
		output.put("summary", checkRun.summary());

		ArrayNode actions = body.putArray("actions");
		for (CheckRunAction action : checkRun.actions()) {
			ObjectNode node = actions.addObject();
			node.put("label", action.label());
			node.put("description", action.description());
			node.put("identifier", action.identifier());
		}
		return body;
	}

	Commit parseCommit(JsonNode node) {
		JsonNode commit = node.path("commit");
		JsonNode verification = commit.path("verification").path("verified");
		return new Commit(node.path("sha").asText(), parseUser(commit.path("author"), node.path("author")),
				parseUser(commit.path("committer"), node.path("committer")), commit.path("message").asText(""),
				node.path("parents").size() > 1, verification.isBoolean() ? verification.booleanValue() : null,
				node.path("html_url").asText(""));
	}

	/**
	 * Build a user from the git identity of a commit and the matching GitHub account, when
	 * GitHub could link one.
	 */
	private @Nullable GitUser parseUser(JsonNode gitIdentity, JsonNode account) {
		if (!gitIdentity.isObject()) {
			return null;
		}
		boolean bot = "Bot".equals(account.path("type").asText(""));
		String login = account.hasNonNull("login") ? account.get("login").asText() : null;
		return new GitUser(gitIdentity.path("name").asText(""), gitIdentity.path("email").asText(""), bot, login);
	}

	private JsonNode readTree(String response) {
		try {
			return objectMapper.readTree(response);
		}
		catch (IOException e) {
			throw new UncheckedIOException("invalid GitHub API response", e);
		}
	}

	private static String repoPath(RequestContext ctx) {
		return "/repos/" + encode(ctx.owner()) + "/" + encode(ctx.repo());
	}

	private static String encode(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8);
	}

}
