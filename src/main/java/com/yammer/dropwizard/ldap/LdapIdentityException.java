package com.yammer.dropwizard.ldap;

/**
 * A username did not resolve to exactly one directory entry.
 */
public class LdapIdentityException extends LdapClientException {
	private static final long serialVersionUID = 1L;

	private final String username;
	private final int matches;

	public LdapIdentityException(String message, String username, int matches) {
		super(message);
		this.username = username;
		this.matches = matches;
	}

	public String getUsername() {
		return username;
	}

	public int getMatches() {
		return matches;
	}
}
