package com.yammer.dropwizard.ldap;

import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import io.dropwizard.auth.basic.BasicCredentials;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

public class UserResourceAuthenticator implements Authenticator<BasicCredentials, User> {
    private static final Logger LOG = LoggerFactory.getLogger(UserResourceAuthenticator.class);

    private final LdapAuthenticationProvider ldapAuthenticator;

    public UserResourceAuthenticator(LdapAuthenticationProvider ldapAuthenticator) {
        this.ldapAuthenticator = checkNotNull(ldapAuthenticator);
    }

    @Override
    public Optional<User> authenticate(BasicCredentials credentials) throws AuthenticationException {
        final String username = credentials.getUsername();
        final AuthenticationResult result;
        try {
            // one call at a time on the shared connection
            synchronized (ldapAuthenticator) {
                result = ldapAuthenticator.authenticate(username, credentials.getPassword());
            }
        } catch (LdapIdentityException e) {
            LOG.debug("{} failed to authenticate. {}", username, e.getMessage());
            return Optional.empty();
        } catch (LdapClientException e) {
            throw new AuthenticationException(
                    String.format("LDAP Authentication failure (username: %s)", username), e);
        }

        if (result.isAuthenticated()) {
            return Optional.of(new User(username, result.getAttributes()));
        }
        final LdapClientException failure = result.getFailure().orElse(null);
        if (failure instanceof LdapConnectionException) {
            throw new AuthenticationException(
                    String.format("LDAP Authentication failure (username: %s)", username), failure);
        }
        LOG.debug("{} failed to authenticate. {}", username, failure);
        return Optional.empty();
    }
}
