package io.dcocheck.server;

/**
 * Server configuration. Defaults apply to any setting not provided in the configuration
 * file or the environment.
 */
public class ServerConfig {

	public static final String DEFAULT_SERVER_ADDR = "localhost:9000";

	public static final int DEFAULT_WORKER_THREADS = 8;

	/**
	 * Address the server listens on, as {@code host:port}.
	 */
	private String serverAddr = DEFAULT_SERVER_ADDR;

	/**
	 * Number of threads processing webhook deliveries.
	 */
	private int workerThreads = DEFAULT_WORKER_THREADS;

	private GitHubAppConfig githubApp = new GitHubAppConfig();

	public String getServerAddr() {
		return serverAddr;
	}

	public void setServerAddr(String serverAddr) {
		this.serverAddr = serverAddr;
	}

	public int getWorkerThreads() {
		return workerThreads;
	}

	public void setWorkerThreads(int workerThreads) {
		this.workerThreads = workerThreads;
	}

	public GitHubAppConfig getGithubApp() {
		return githubApp;
	}

	public void setGithubApp(GitHubAppConfig githubApp) {
		this.githubApp = githubApp;
	}

	@Override
	public String toString() {
		return "ServerConfig{serverAddr=" + serverAddr + ", workerThreads=" + workerThreads + ", githubApp="
				+ githubApp + "}";
	}

}
