package com.yammer.dropwizard.ldap;

/**
 * The transport to the directory server could not be established, or was lost.
 */
public class LdapConnectionException extends LdapClientException {
	private static final long serialVersionUID = 1L;

	public LdapConnectionException(String message) {
		super(message);
	}

	public LdapConnectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
