package com.yammer.dropwizard.ldap;

public interface LdapAuthenticationProvider {

	boolean canAuthenticate();

	void bind() throws LdapClientException;

	AuthenticationResult authenticate(String username, String password) throws LdapClientException;

	void close();

}
