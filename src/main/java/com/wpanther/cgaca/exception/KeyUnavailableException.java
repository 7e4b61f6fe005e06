package com.wpanther.cgaca.exception;

/**
 * No usable CA key: none is active, the active one expired, or a referenced key id is unknown.
 */
public class KeyUnavailableException extends CertificateAuthorityException {

    public KeyUnavailableException(String message) {
        super(message);
    }
}
