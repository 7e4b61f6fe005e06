package com.wpanther.cgaca.exception;

public class KeyGenerationException extends CertificateAuthorityException {

    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
