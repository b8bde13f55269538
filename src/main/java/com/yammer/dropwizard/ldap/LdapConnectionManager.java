package com.yammer.dropwizard.ldap;

import java.security.GeneralSecurityException;

import javax.net.SocketFactory;
import javax.net.ssl.KeyManager;
import javax.net.ssl.TrustManager;

import com.google.common.primitives.Ints;
import com.unboundid.ldap.sdk.LDAPConnectionOptions;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.util.ssl.HostNameSSLSocketVerifier;
import com.unboundid.util.ssl.SSLUtil;
import com.unboundid.util.ssl.TrustAllTrustManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Owns the one live connection of a client. Connecting always closes the previous connection first.
 */
public class LdapConnectionManager {
	private static final Logger LOG = LoggerFactory.getLogger(LdapConnectionManager.class);

	private final LdapConfiguration configuration;
	private final DirectoryConnector connector;
	private DirectoryConnection connection;

	public LdapConnectionManager(LdapConfiguration configuration, DirectoryConnector connector) {
		this.configuration = checkNotNull(configuration);
		this.connector = checkNotNull(connector);
	}

	public void connect() throws LdapConnectionException {
		close();

		final SocketFactory socketFactory = configuration.isUseSsl() ? sslSocketFactory() : null;
		final String host = configuration.getHost();
		final int port = configuration.getPort();
		LOG.debug("Connecting to {}:{} (ssl: {})", host, port, configuration.isUseSsl());
		try {
			connection = connector.connect(host, port, socketFactory, connectionOptions());
		} catch (LDAPException e) {
			throw new LdapConnectionException(String.format("Could not connect to %s:%d", host, port), e);
		}
	}

	public boolean isConnected() {
		return connection != null;
	}

	/**
	 * The live connection. A missing connection is reported the same way as a closed one.
	 */
	DirectoryConnection current() throws LDAPException {
		if (connection == null) {
			throw new LDAPException(ResultCode.SERVER_DOWN, "Not connected to the directory server");
		}
		return connection;
	}

	public void close() {
		if (connection != null) {
			try {
				connection.close();
			} finally {
				connection = null;
			}
		}
	}

	private SocketFactory sslSocketFactory() throws LdapConnectionException {
		final byte[] caCertificates = configuration.getCaCertificates();
		TrustManager[] trustManagers = null;
		if (caCertificates != null && caCertificates.length > 0) {
			trustManagers = TlsMaterial.trustManagers(caCertificates);
		}
		if (configuration.isInsecureSkipVerify()) {
			trustManagers = new TrustManager[] { new TrustAllTrustManager() };
		}

		KeyManager[] keyManagers = null;
		if (configuration.getClientCertificate() != null) {
			keyManagers = TlsMaterial.keyManagers(configuration.getClientCertificate());
		}

		try {
			return new SSLUtil(keyManagers, trustManagers).createSSLSocketFactory();
		} catch (GeneralSecurityException e) {
			throw new LdapConnectionException("Could not initialise TLS", e);
		}
	}

	private LDAPConnectionOptions connectionOptions() {
		final LDAPConnectionOptions options = new LDAPConnectionOptions();
		options.setConnectTimeoutMillis(Ints.saturatedCast(configuration.getConnectTimeout().toMilliseconds()));
		options.setResponseTimeoutMillis(configuration.getResponseTimeout().toMilliseconds());
		if (configuration.isUseSsl() && !configuration.isInsecureSkipVerify()) {
			options.setSSLSocketVerifier(new HostNameSSLSocketVerifier(false));
		}
		return options;
	}
}
