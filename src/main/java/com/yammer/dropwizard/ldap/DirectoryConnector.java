package com.yammer.dropwizard.ldap;

import javax.net.SocketFactory;

import com.unboundid.ldap.sdk.LDAPConnectionOptions;
import com.unboundid.ldap.sdk.LDAPException;

public interface DirectoryConnector {

	/**
	 * Opens a new, unauthenticated connection to {@code host:port}. A {@code null} socket factory means a plain TCP
	 * connection.
	 */
	DirectoryConnection connect(String host, int port, SocketFactory socketFactory, LDAPConnectionOptions options)
			throws LDAPException;
}
