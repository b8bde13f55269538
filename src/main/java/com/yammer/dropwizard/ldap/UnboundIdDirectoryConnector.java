package com.yammer.dropwizard.ldap;

import javax.net.SocketFactory;

import com.unboundid.ldap.sdk.LDAPConnection;
import com.unboundid.ldap.sdk.LDAPConnectionOptions;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.LDAPSearchException;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResult;

import static com.google.common.base.Preconditions.checkNotNull;

public class UnboundIdDirectoryConnector implements DirectoryConnector {

	@Override
	public DirectoryConnection connect(String host, int port, SocketFactory socketFactory,
			LDAPConnectionOptions options) throws LDAPException {
		return new UnboundIdDirectoryConnection(new LDAPConnection(socketFactory, options, host, port));
	}

	private static final class UnboundIdDirectoryConnection implements DirectoryConnection {
		private final LDAPConnection connection;

		private UnboundIdDirectoryConnection(LDAPConnection connection) {
			this.connection = checkNotNull(connection);
		}

		@Override
		public void bind(String dn, String password) throws LDAPException {
			connection.bind(dn, password);
		}

		@Override
		public SearchResult search(SearchRequest request) throws LDAPSearchException {
			return connection.search(request);
		}

		@Override
		public void close() {
			connection.close();
		}

		@Override
		public String toString() {
			return connection.getHostPort();
		}
	}
}
