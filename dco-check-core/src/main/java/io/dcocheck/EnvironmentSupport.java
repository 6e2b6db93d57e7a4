package io.dcocheck;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves environment variables from the system environment, falling back to a
 * {@code .env} file in the current working directory. The {@code .env} file is loaded
 * once and cached for the lifetime of the process.
 */
public final class EnvironmentSupport {

	private static final Dotenv DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		return DOTENV.get(name);
	}

	/**
	 * Get all the variables whose name starts with the prefix provided.
	 * @param prefix name prefix (e.g. {@code DCO_CHECK_})
	 * @return matching variables sorted by name
	 */
	public static Map<String, String> getAllWithPrefix(String prefix) {
		Map<String, String> result = new TreeMap<>();
		for (DotenvEntry entry : DOTENV.entries()) {
			if (entry.getKey().startsWith(prefix)) {
				result.put(entry.getKey(), DOTENV.get(entry.getKey()));
			}
		}
		return result;
	}

}
