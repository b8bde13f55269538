package com.yammer.dropwizard.ldap;

/**
 * Base class of every failure raised by {@link LdapClient}.
 */
public abstract class LdapClientException extends Exception {
	private static final long serialVersionUID = 1L;

	protected LdapClientException(String message) {
		super(message);
	}

	protected LdapClientException(String message, Throwable cause) {
		super(message, cause);
	}
}
