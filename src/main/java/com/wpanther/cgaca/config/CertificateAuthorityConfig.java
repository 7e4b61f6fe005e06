package com.wpanther.cgaca.config;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.security.Security;
import java.time.Clock;

/**
 * Shared infrastructure beans for the certificate authority
 */
@Configuration
public class CertificateAuthorityConfig {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    /**
     * Provides a SecureRandom bean for key generation, salts and nonces
     *
     * @return a new SecureRandom instance
     */
    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    /**
     * Time source for issuance, expiry and OCSP windows.
     * Replaced in tests to move time forward.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
