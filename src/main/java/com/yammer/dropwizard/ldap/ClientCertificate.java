package com.yammer.dropwizard.ldap;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Private key and certificate chain presented to the server during the TLS handshake. The leaf certificate comes
 * first.
 */
public final class ClientCertificate {
	private final PrivateKey privateKey;
	private final ImmutableList<X509Certificate> chain;

	public ClientCertificate(PrivateKey privateKey, List<X509Certificate> chain) {
		this.privateKey = checkNotNull(privateKey);
		this.chain = ImmutableList.copyOf(chain);
		checkArgument(!this.chain.isEmpty(), "certificate chain must not be empty");
	}

	public PrivateKey getPrivateKey() {
		return privateKey;
	}

	public ImmutableList<X509Certificate> getChain() {
		return chain;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("subject", chain.get(0).getSubjectX500Principal().getName())
				.add("chainLength", chain.size())
				.toString();
	}
}
