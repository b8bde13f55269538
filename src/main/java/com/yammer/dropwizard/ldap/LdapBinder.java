package com.yammer.dropwizard.ldap;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;

import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.util.security.Password;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Simple binds over the connection held by a {@link LdapConnectionManager}.
 *
 * <p>The service bind survives one dropped connection: when the server reports the connection closed, the binder
 * reconnects and binds once more before giving up. Probe binds made on behalf of end users are never retried.
 */
public class LdapBinder {
	private static final Logger LOG = LoggerFactory.getLogger(LdapBinder.class);

	/** Consecutive closed-connection failures tolerated by one service bind, the first one included. */
	static final int MAX_DISCONNECTS = 2;

	private final LdapConfiguration configuration;
	private final LdapConnectionManager connections;
	private int disconnectRetryCount;

	public LdapBinder(LdapConfiguration configuration, LdapConnectionManager connections) {
		this.configuration = checkNotNull(configuration);
		this.connections = checkNotNull(connections);
	}

	/**
	 * Binds as the configured service identity.
	 */
	public void bind() throws LdapClientException {
		final String bindDn = configuration.getBindDn();
		final String bindPassword = configuration.getBindPassword();
		if (StringUtils.isEmpty(bindDn) || StringUtils.isEmpty(bindPassword)) {
			throw new LdapConfigurationException("BindDN or BindPassword was not set on client configuration");
		}

		final String password = deobfuscate(bindPassword);
		try {
			while (true) {
				try {
					connections.current().bind(bindDn, password);
					disconnectRetryCount = 0;
					return;
				} catch (LDAPException e) {
					if (!isConnectionClosed(e)) {
						throw new LdapProtocolException(String.format("Service bind as %s failed", bindDn), e);
					}
					if (++disconnectRetryCount >= MAX_DISCONNECTS) {
						throw new LdapConnectionException(
								String.format("Connection closed while binding as %s", bindDn), e);
					}
					LOG.debug("Connection closed while binding as {}, reconnecting", bindDn);
					connections.connect();
				}
			}
		} finally {
			disconnectRetryCount = 0;
		}
	}

	/**
	 * Binds once as {@code dn}, without reconnecting on a closed connection.
	 */
	public void bind(String dn, String password) throws LdapClientException {
		try {
			connections.current().bind(dn, password);
			disconnectRetryCount = 0;
		} catch (LDAPException e) {
			if (isConnectionClosed(e)) {
				throw new LdapConnectionException(String.format("Connection closed while binding as %s", dn), e);
			}
			throw new LdapProtocolException(String.format("Bind as %s failed", dn), e);
		}
	}

	int getDisconnectRetryCount() {
		return disconnectRetryCount;
	}

	static boolean isConnectionClosed(LDAPException e) {
		return ResultCode.SERVER_DOWN.equals(e.getResultCode());
	}

	private static String deobfuscate(String password) {
		if (password.startsWith(Password.__OBFUSCATE)) {
			return Password.deobfuscate(password);
		}
		return password;
	}
}
