package com.yammer.dropwizard.ldap;

import java.util.Map;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of a password check for a username that resolved to exactly one directory entry. The entry's attributes
 * are present whether or not the password was accepted.
 */
public final class AuthenticationResult {
	private final boolean authenticated;
	private final ImmutableMap<String, String> attributes;
	private final LdapClientException failure;

	private AuthenticationResult(boolean authenticated, Map<String, String> attributes,
			LdapClientException failure) {
		this.authenticated = authenticated;
		this.attributes = ImmutableMap.copyOf(attributes);
		this.failure = failure;
	}

	public static AuthenticationResult authenticated(Map<String, String> attributes) {
		return new AuthenticationResult(true, attributes, null);
	}

	public static AuthenticationResult rejected(Map<String, String> attributes, LdapClientException failure) {
		return new AuthenticationResult(false, attributes, checkNotNull(failure));
	}

	public boolean isAuthenticated() {
		return authenticated;
	}

	public ImmutableMap<String, String> getAttributes() {
		return attributes;
	}

	/**
	 * Why the password was rejected. Empty when {@link #isAuthenticated()}.
	 */
	public Optional<LdapClientException> getFailure() {
		return Optional.ofNullable(failure);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("authenticated", authenticated)
				.add("attributes", attributes)
				.add("failure", failure)
				.omitNullValues()
				.toString();
	}
}
