package com.wpanther.cgaca.exception;

public class CryptoException extends CertificateAuthorityException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
