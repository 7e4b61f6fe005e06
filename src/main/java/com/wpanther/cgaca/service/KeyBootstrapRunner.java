package com.wpanther.cgaca.service;

import com.wpanther.cgaca.entity.CaKeyRecord;
import com.wpanther.cgaca.registry.CertificateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Generates the first CA key at startup when enabled and no key is active.
 * Issuance itself never creates keys.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class KeyBootstrapRunner implements ApplicationRunner {

    private final CertificateRegistry registry;
    private final SigningService signingService;

    @Value("${app.ca.bootstrap-key:false}")
    private boolean bootstrapKey;

    @Override
    public void run(ApplicationArguments args) {
        if (!bootstrapKey) {
            return;
        }
        if (registry.getActiveKey().isPresent()) {
            log.debug("Active CA key present, nothing to bootstrap");
            return;
        }
        CaKeyRecord key = signingService.generateKey();
        log.info("Bootstrapped CA signing key {}", key.getId());
    }
}
