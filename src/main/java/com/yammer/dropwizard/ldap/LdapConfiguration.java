package com.yammer.dropwizard.ldap;

import java.util.Collection;
import java.util.Set;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import io.dropwizard.util.Duration;

public class LdapConfiguration {

	@NotEmpty
	@JsonProperty
	private String host = "localhost";

	@Min(1)
	@Max(65535)
	@JsonProperty
	private int port = 389;

	@JsonProperty
	private boolean useSsl = false;

	@JsonProperty
	private boolean insecureSkipVerify = false;

	@JsonIgnore
	private byte[] caCertificates;

	@JsonIgnore
	private ClientCertificate clientCertificate;

	@JsonProperty
	private String bindDn;

	@JsonProperty
	private String bindPassword;

	@NotNull
	@JsonProperty
	private String base = "";

	@NotEmpty
	@JsonProperty
	private String userFilter = "(uid=%s)";

	// reserved for group lookups
	@NotEmpty
	@JsonProperty
	private String groupFilter = "(memberUid=%s)";

	@NotNull
	@JsonProperty
	private ImmutableSet<String> attributes = ImmutableSet.of();

	@NotNull
	@Valid
	@JsonProperty
	private Duration connectTimeout = Duration.seconds(10);

	@NotNull
	@Valid
	@JsonProperty
	private Duration responseTimeout = Duration.minutes(5);

	public String getHost() {
		return host;
	}

	public LdapConfiguration setHost(String host) {
		this.host = host;
		return this;
	}

	public int getPort() {
		return port;
	}

	public LdapConfiguration setPort(int port) {
		this.port = port;
		return this;
	}

	public boolean isUseSsl() {
		return useSsl;
	}

	public LdapConfiguration setUseSsl(boolean useSsl) {
		this.useSsl = useSsl;
		return this;
	}

	public boolean isInsecureSkipVerify() {
		return insecureSkipVerify;
	}

	public LdapConfiguration setInsecureSkipVerify(boolean insecureSkipVerify) {
		this.insecureSkipVerify = insecureSkipVerify;
		return this;
	}

	public byte[] getCaCertificates() {
		return caCertificates == null ? null : caCertificates.clone();
	}

	public LdapConfiguration setCaCertificates(byte[] caCertificates) {
		this.caCertificates = caCertificates == null ? null : caCertificates.clone();
		return this;
	}

	public ClientCertificate getClientCertificate() {
		return clientCertificate;
	}

	public LdapConfiguration setClientCertificate(ClientCertificate clientCertificate) {
		this.clientCertificate = clientCertificate;
		return this;
	}

	public String getBindDn() {
		return bindDn;
	}

	public LdapConfiguration setBindDn(String bindDn) {
		this.bindDn = bindDn;
		return this;
	}

	public String getBindPassword() {
		return bindPassword;
	}

	public LdapConfiguration setBindPassword(String bindPassword) {
		this.bindPassword = bindPassword;
		return this;
	}

	public String getBase() {
		return base;
	}

	public LdapConfiguration setBase(String base) {
		this.base = base;
		return this;
	}

	public String getUserFilter() {
		return userFilter;
	}

	public LdapConfiguration setUserFilter(String userFilter) {
		this.userFilter = userFilter;
		return this;
	}

	public String getGroupFilter() {
		return groupFilter;
	}

	public LdapConfiguration setGroupFilter(String groupFilter) {
		this.groupFilter = groupFilter;
		return this;
	}

	public Set<String> getAttributes() {
		return attributes;
	}

	public LdapConfiguration setAttributes(Collection<String> attributes) {
		this.attributes = ImmutableSet.copyOf(attributes);
		return this;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public LdapConfiguration setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
		return this;
	}

	public Duration getResponseTimeout() {
		return responseTimeout;
	}

	public LdapConfiguration setResponseTimeout(Duration responseTimeout) {
		this.responseTimeout = responseTimeout;
		return this;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("host", host)
				.add("port", port)
				.add("useSsl", useSsl)
				.add("insecureSkipVerify", insecureSkipVerify)
				.add("bindDn", bindDn)
				.add("base", base)
				.add("userFilter", userFilter)
				.add("attributes", attributes)
				.toString();
	}
}
