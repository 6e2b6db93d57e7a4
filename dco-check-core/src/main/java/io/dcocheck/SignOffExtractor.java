package io.dcocheck;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the {@code Signed-off-by} trailers from a commit message.
 */
public class SignOffExtractor {

	/**
	 * {@code Signed-off-by: Name <email>}, one per line, case-insensitive. The email is
	 * the last bracketed part of the line, everything before it is the name. Both groups
	 * are trimmed after matching. Neither group crosses a line break and the email holds no
	 * bracket.
	 */
	private static final Pattern SIGN_OFF = Pattern.compile("^Signed-off-by:([^\\r\\n]*)<([^<>\\r\\n]*)>[ \\t\\r]*$",
			Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

	/**
	 * Get the sign-offs found in the message provided.
	 * @param message commit message
	 * @return sign-offs in the order they appear (empty if none was found)
	 */
	public List<SignOff> extract(String message) {
		List<SignOff> signOffs = new ArrayList<>();

		Matcher matcher = SIGN_OFF.matcher(message);
		while (matcher.find()) {
			String name = matcher.group(1).trim();
			String email = matcher.group(2).trim();
			if (name.isEmpty() || email.isEmpty()) {
				continue;
			}
			signOffs.add(new SignOff(name, email));
		}

		return signOffs;
	}

}
