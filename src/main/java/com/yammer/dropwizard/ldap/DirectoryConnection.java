package com.yammer.dropwizard.ldap;

import java.io.Closeable;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.LDAPSearchException;
import com.unboundid.ldap.sdk.SearchRequest;
import com.unboundid.ldap.sdk.SearchResult;

/**
 * A single established session with a directory server.
 *
 * <p>Implementations report a closed or lost transport with {@link com.unboundid.ldap.sdk.ResultCode#SERVER_DOWN},
 * and any other failure with the result code the server returned.
 */
public interface DirectoryConnection extends Closeable {

	/**
	 * Performs a simple bind, changing the identity the session is authenticated as.
	 */
	void bind(String dn, String password) throws LDAPException;

	SearchResult search(SearchRequest request) throws LDAPSearchException;

	@Override
	void close();
}
