package com.yammer.dropwizard.ldap;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import java.util.UUID;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

/**
 * Turns the in-memory certificate material of {@link LdapConfiguration} into JSSE key and trust managers.
 */
final class TlsMaterial {
	static final String CA_PARSE_ERROR = "Could not append CA certs from PEM";

	private static final String CLIENT_ALIAS = "client";

	private TlsMaterial() {
	}

	static TrustManager[] trustManagers(byte[] pem) throws LdapConnectionException {
		final Collection<? extends Certificate> certificates;
		try {
			certificates = CertificateFactory.getInstance("X.509")
					.generateCertificates(new ByteArrayInputStream(pem));
		} catch (CertificateException e) {
			throw new LdapConnectionException(CA_PARSE_ERROR, e);
		}
		if (certificates.isEmpty()) {
			throw new LdapConnectionException(CA_PARSE_ERROR);
		}

		try {
			final KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
			trustStore.load(null, null);
			int index = 0;
			for (Certificate certificate : certificates) {
				trustStore.setCertificateEntry("ca-" + index++, certificate);
			}
			final TrustManagerFactory factory = TrustManagerFactory
					.getInstance(TrustManagerFactory.getDefaultAlgorithm());
			factory.init(trustStore);
			return factory.getTrustManagers();
		} catch (GeneralSecurityException | IOException e) {
			throw new LdapConnectionException(CA_PARSE_ERROR, e);
		}
	}

	static KeyManager[] keyManagers(ClientCertificate clientCertificate) throws LdapConnectionException {
		// the store never leaves memory, the password only has to match between store and factory
		final char[] password = UUID.randomUUID().toString().toCharArray();
		try {
			final KeyStore keyStore = KeyStore.getInstance("PKCS12");
			keyStore.load(null, null);
			keyStore.setKeyEntry(CLIENT_ALIAS, clientCertificate.getPrivateKey(), password,
					clientCertificate.getChain().toArray(new Certificate[0]));
			final KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
			factory.init(keyStore, password);
			return factory.getKeyManagers();
		} catch (GeneralSecurityException | IOException e) {
			throw new LdapConnectionException("Could not load client certificate " + clientCertificate, e);
		}
	}
}
