package com.yammer.dropwizard.ldap;

import java.nio.charset.StandardCharsets;

import javax.net.ssl.SSLSocketFactory;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import com.unboundid.util.ssl.HostNameSSLSocketVerifier;

import io.dropwizard.util.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LdapConnectionManagerTest {
	private FakeDirectoryConnector directory;
	private LdapConfiguration configuration;
	private LdapConnectionManager connections;

	@BeforeEach
	void setUp() {
		directory = new FakeDirectoryConnector();
		configuration = new LdapConfiguration().setHost("ldap.example.com").setPort(1389);
		connections = new LdapConnectionManager(configuration, directory);
	}

	@Test
	void plainConnectionUsesTheDefaultSocketFactory() throws Exception {
		connections.connect();

		assertTrue(connections.isConnected());
		assertNull(directory.getLastSocketFactory());
		assertFalse(directory.getLastOptions().getSSLSocketVerifier() instanceof HostNameSSLSocketVerifier);
	}

	@Test
	void timeoutsArePassedToTheTransport() throws Exception {
		configuration.setConnectTimeout(Duration.seconds(3)).setResponseTimeout(Duration.seconds(20));

		connections.connect();

		assertEquals(3000, directory.getLastOptions().getConnectTimeoutMillis());
		assertEquals(20000L, directory.getLastOptions().getResponseTimeoutMillis());
	}

	@Test
	void connectTimeoutBeyondIntRangeIsCapped() throws Exception {
		configuration.setConnectTimeout(Duration.days(30));

		connections.connect();

		assertEquals(Integer.MAX_VALUE, directory.getLastOptions().getConnectTimeoutMillis());
	}

	@Test
	void sslConnectionVerifiesTheHostName() throws Exception {
		configuration.setUseSsl(true);

		connections.connect();

		assertInstanceOf(SSLSocketFactory.class, directory.getLastSocketFactory());
		assertInstanceOf(HostNameSSLSocketVerifier.class, directory.getLastOptions().getSSLSocketVerifier());
	}

	@Test
	void insecureSslConnectionSkipsHostNameVerification() throws Exception {
		configuration.setUseSsl(true).setInsecureSkipVerify(true);

		connections.connect();

		assertInstanceOf(SSLSocketFactory.class, directory.getLastSocketFactory());
		assertFalse(directory.getLastOptions().getSSLSocketVerifier() instanceof HostNameSSLSocketVerifier);
	}

	@Test
	void malformedCaCertificatesFailBeforeConnecting() {
		configuration.setUseSsl(true).setCaCertificates("not a certificate".getBytes(StandardCharsets.US_ASCII));

		final LdapConnectionException e = assertThrows(LdapConnectionException.class, connections::connect);
		assertEquals("Could not append CA certs from PEM", e.getMessage());
		assertEquals(0, directory.getConnectCount());
		assertFalse(connections.isConnected());
	}

	@Test
	void caCertificatesAreIgnoredWithoutSsl() throws Exception {
		configuration.setCaCertificates("not a certificate".getBytes(StandardCharsets.US_ASCII));

		connections.connect();

		assertTrue(connections.isConnected());
	}

	@Test
	void reconnectingClosesThePreviousConnection() throws Exception {
		connections.connect();
		final FakeDirectoryConnector.FakeDirectoryConnection first = directory.lastConnection();

		connections.connect();

		assertTrue(first.isClosed());
		assertNotSame(first, directory.lastConnection());
		assertFalse(directory.lastConnection().isClosed());
		assertEquals(2, directory.getConnectCount());
	}

	@Test
	void failedConnectLeavesNoConnection() throws Exception {
		connections.connect();
		final FakeDirectoryConnector.FakeDirectoryConnection first = directory.lastConnection();
		directory.failNextConnect(ResultCode.CONNECT_ERROR);

		final LdapConnectionException e = assertThrows(LdapConnectionException.class, connections::connect);

		assertEquals("Could not connect to ldap.example.com:1389", e.getMessage());
		assertTrue(first.isClosed());
		assertFalse(connections.isConnected());
	}

	@Test
	void closeIsIdempotent() throws Exception {
		connections.close();
		connections.connect();
		final FakeDirectoryConnector.FakeDirectoryConnection connection = directory.lastConnection();

		connections.close();
		connections.close();

		assertTrue(connection.isClosed());
		assertFalse(connections.isConnected());
	}

	@Test
	void missingConnectionIsReportedAsServerDown() {
		final LDAPException e = assertThrows(LDAPException.class, connections::current);
		assertEquals(ResultCode.SERVER_DOWN, e.getResultCode());
	}
}
