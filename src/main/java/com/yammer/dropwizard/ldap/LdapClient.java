package com.yammer.dropwizard.ldap;

import java.io.Closeable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Authenticates username/password pairs against a directory server over a single connection.
 *
 * <p>A client is not thread-safe. Callers that share one must serialize every call on it, as
 * {@link UserResourceAuthenticator} and {@link LdapHealthCheck} do by locking the client.
 */
public class LdapClient implements LdapAuthenticationProvider, Closeable {
	private static final Logger LOG = LoggerFactory.getLogger(LdapClient.class);

	private final LdapConnectionManager connections;
	private final LdapBinder binder;
	private final LdapSearchingAuthenticator authenticator;

	/**
	 * Creates a disconnected client. {@link #bind()} connects on demand.
	 */
	public LdapClient(LdapConfiguration configuration) {
		this(configuration, new UnboundIdDirectoryConnector());
	}

	public LdapClient(LdapConfiguration configuration, DirectoryConnector connector) {
		checkNotNull(configuration);
		this.connections = new LdapConnectionManager(configuration, checkNotNull(connector));
		this.binder = new LdapBinder(configuration, connections);
		this.authenticator = new LdapSearchingAuthenticator(configuration, connections, binder);
	}

	/**
	 * Connects and binds as the service identity. On failure nothing is left open.
	 */
	public static LdapClient open(LdapConfiguration configuration) throws LdapClientException {
		return open(configuration, new UnboundIdDirectoryConnector());
	}

	public static LdapClient open(LdapConfiguration configuration, DirectoryConnector connector)
			throws LdapClientException {
		final LdapClient client = new LdapClient(configuration, connector);
		try {
			client.connect();
			client.bind();
			return client;
		} catch (LdapClientException e) {
			client.close();
			throw e;
		}
	}

	public void connect() throws LdapConnectionException {
		connections.connect();
	}

	public boolean isConnected() {
		return connections.isConnected();
	}

	@Override
	public void bind() throws LdapClientException {
		binder.bind();
	}

	@Override
	public boolean canAuthenticate() {
		try {
			binder.bind();
			return true;
		} catch (LdapClientException err) {
			LOG.debug("Cannot bind as the service identity", err);
		}
		return false;
	}

	@Override
	public AuthenticationResult authenticate(String username, String password) throws LdapClientException {
		return authenticator.authenticate(username, password);
	}

	@Override
	public void close() {
		connections.close();
	}
}
