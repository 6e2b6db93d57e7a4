package io.dcocheck;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Git identity attached to a commit as its author or committer.
 *
 * @param name the name recorded in the commit
 * @param email the email recorded in the commit
 * @param bot whether the GitHub account linked to this identity is a bot
 * @param login the GitHub username linked to this identity (null when the email is not
 * associated with any account)
 */
public record GitUser(String name, String email, boolean bot, @Nullable String login) {

	/**
	 * Create an identity that is not linked to any GitHub account.
	 */
	public static GitUser of(String name, String email) {
		return new GitUser(name, email, false, null);
	}

	/**
	 * Returns true if this user has the given name and email, ignoring case in both.
	 * @param otherName name to compare
	 * @param otherEmail email to compare
	 * @return true when both name and email match
	 */
	public boolean hasIdentity(String otherName, String otherEmail) {
		return name.toLowerCase(Locale.ROOT).equals(otherName.toLowerCase(Locale.ROOT))
				&& email.toLowerCase(Locale.ROOT).equals(otherEmail.toLowerCase(Locale.ROOT));
	}

	/**
	 * Returns true if this user and the other one share the same identity.
	 */
	public boolean hasIdentity(GitUser other) {
		return hasIdentity(other.name(), other.email());
	}

}
