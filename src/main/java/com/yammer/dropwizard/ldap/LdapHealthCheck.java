package com.yammer.dropwizard.ldap;

import com.codahale.metrics.health.HealthCheck;

import static com.google.common.base.Preconditions.checkNotNull;

public class LdapHealthCheck extends HealthCheck {
    private final LdapAuthenticationProvider ldapAuthenticator;

    public LdapHealthCheck(LdapAuthenticationProvider ldapAuthenticator) {
        this.ldapAuthenticator = checkNotNull(ldapAuthenticator);
    }

    @Override
    protected Result check() {
        final boolean canAuthenticate;
        synchronized (ldapAuthenticator) {
            canAuthenticate = ldapAuthenticator.canAuthenticate();
        }
        if (canAuthenticate) {
            return Result.healthy();
        }
        return Result.unhealthy("Cannot bind to the LDAP server as the service identity");
    }
}
