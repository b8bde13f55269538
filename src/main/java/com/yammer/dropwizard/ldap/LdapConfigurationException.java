package com.yammer.dropwizard.ldap;

/**
 * The client configuration cannot support the requested operation, e.g. the service credentials are missing or the
 * user filter is malformed.
 */
public class LdapConfigurationException extends LdapClientException {
	private static final long serialVersionUID = 1L;

	public LdapConfigurationException(String message) {
		super(message);
	}

	public LdapConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
