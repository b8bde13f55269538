package com.yammer.dropwizard.ldap;

import com.codahale.metrics.health.HealthCheck;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LdapHealthCheckTest {
    private static final String SERVICE_DN = "cn=svc,dc=example,dc=com";

    private final FakeDirectoryConnector directory = new FakeDirectoryConnector().withAccount(SERVICE_DN, "svcpw");

    @Test
    void healthyWhenTheServiceIdentityCanBind() {
        final LdapClient client = new LdapClient(
                new LdapConfiguration().setBindDn(SERVICE_DN).setBindPassword("svcpw"), directory);

        final HealthCheck.Result result = new LdapHealthCheck(client).execute();

        assertTrue(result.isHealthy());
        assertTrue(client.isConnected());
    }

    @Test
    void unhealthyWhenTheServiceIdentityIsRejected() {
        final LdapClient client = new LdapClient(
                new LdapConfiguration().setBindDn(SERVICE_DN).setBindPassword("expired"), directory);

        final HealthCheck.Result result = new LdapHealthCheck(client).execute();

        assertFalse(result.isHealthy());
    }

    @Test
    void unhealthyWithoutServiceCredentials() {
        final LdapClient client = new LdapClient(new LdapConfiguration(), directory);

        assertFalse(new LdapHealthCheck(client).execute().isHealthy());
    }
}
