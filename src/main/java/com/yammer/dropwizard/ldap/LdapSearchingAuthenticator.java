package com.yammer.dropwizard.ldap;

import java.util.IllegalFormatException;
import java.util.List;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.unboundid.ldap.sdk.DereferencePolicy;
import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchScope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Search-then-bind authentication. The connection is bound as the service identity when a call starts and again
 * when it returns, whatever the outcome.
 */
public class LdapSearchingAuthenticator {
	private static final Logger LOG = LoggerFactory.getLogger(LdapSearchingAuthenticator.class);

	static final String DN_ATTRIBUTE = "dn";

	protected final LdapConfiguration configuration;
	private final LdapConnectionManager connections;
	private final LdapBinder binder;

	public LdapSearchingAuthenticator(LdapConfiguration configuration, LdapConnectionManager connections,
			LdapBinder binder) {
		this.configuration = checkNotNull(configuration);
		this.connections = checkNotNull(connections);
		this.binder = checkNotNull(binder);
	}

	public AuthenticationResult authenticate(String username, String password) throws LdapClientException {
		checkNotNull(username);
		checkNotNull(password);

		binder.bind();
		Exception primary = null;
		try {
			return authenticateAsService(username, password);
		} catch (LdapClientException | RuntimeException e) {
			primary = e;
			throw e;
		} finally {
			restoreServiceBind(primary);
		}
	}

	private AuthenticationResult authenticateAsService(String username, String password)
			throws LdapClientException {
		final SearchResultEntry entry = searchForUser(username);
		final ImmutableMap<String, String> attributes = extractAttributes(entry);

		if (password.isEmpty()) {
			// an empty password turns the probe into an unauthenticated bind
			return AuthenticationResult.rejected(attributes,
					new LdapProtocolException(String.format("Empty password for %s", entry.getDN())));
		}
		try {
			binder.bind(entry.getDN(), password);
		} catch (LdapClientException e) {
			LOG.debug("{} failed to authenticate. {}", username, e.getMessage());
			return AuthenticationResult.rejected(attributes, e);
		}
		LOG.debug("{} authenticated as {}", username, entry.getDN());
		return AuthenticationResult.authenticated(attributes);
	}

	private SearchResultEntry searchForUser(String username) throws LdapClientException {
		final String filter = userFilter(username);
		LOG.debug("Searching for user with filter {}", filter);

		final List<SearchResultEntry> entries;
		try {
			final SearchRequest request = new SearchRequest(configuration.getBase(), SearchScope.SUB,
					DereferencePolicy.NEVER, 0, 0, false, filter, requestedAttributes());
			entries = connections.current().search(request).getSearchEntries();
		} catch (LDAPException e) {
			throw new LdapProtocolException(String.format("Search for user %s failed", username), e);
		}

		if (entries.isEmpty()) {
			throw new LdapIdentityException("User does not exist", username, 0);
		}
		if (entries.size() > 1) {
			throw new LdapIdentityException("Too many entries returned", username, entries.size());
		}
		return entries.get(0);
	}

	private String userFilter(String username) throws LdapConfigurationException {
		try {
			return String.format(configuration.getUserFilter(), Filter.encodeValue(username));
		} catch (IllegalFormatException e) {
			throw new LdapConfigurationException(
					String.format("Invalid user filter %s", configuration.getUserFilter()), e);
		}
	}

	private String[] requestedAttributes() {
		final Set<String> attributes = configuration.getAttributes();
		return Iterables.toArray(Iterables.concat(attributes, List.of(DN_ATTRIBUTE)), String.class);
	}

	private ImmutableMap<String, String> extractAttributes(SearchResultEntry entry) {
		final ImmutableMap.Builder<String, String> attributes = ImmutableMap.builder();
		for (String name : configuration.getAttributes()) {
			attributes.put(name, Strings.nullToEmpty(entry.getAttributeValue(name)));
		}
		return attributes.build();
	}

	private void restoreServiceBind(Exception primary) {
		try {
			binder.bind();
		} catch (LdapClientException e) {
			LOG.warn("Could not restore the service bind after authentication", e);
			if (primary != null) {
				primary.addSuppressed(e);
			}
		}
	}
}
