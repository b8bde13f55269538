package com.yammer.dropwizard.ldap;

import java.util.Optional;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;

/**
 * The directory server rejected a bind or failed a search.
 */
public class LdapProtocolException extends LdapClientException {
	private static final long serialVersionUID = 1L;

	private final ResultCode resultCode;

	public LdapProtocolException(String message) {
		super(message);
		this.resultCode = null;
	}

	public LdapProtocolException(String message, LDAPException cause) {
		super(message, cause);
		this.resultCode = cause.getResultCode();
	}

	public Optional<ResultCode> getResultCode() {
		return Optional.ofNullable(resultCode);
	}
}
