package com.wpanther.cgaca.exception;

/**
 * Base type for failures raised by the certificate authority core.
 * The transport layer maps each subtype to its own response.
 */
public abstract class CertificateAuthorityException extends RuntimeException {

    protected CertificateAuthorityException(String message) {
        super(message);
    }

    protected CertificateAuthorityException(String message, Throwable cause) {
        super(message, cause);
    }
}
