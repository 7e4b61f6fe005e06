package com.wpanther.cgaca.exception;

public class ConflictException extends CertificateAuthorityException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
