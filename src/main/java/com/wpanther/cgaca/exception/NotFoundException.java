package com.wpanther.cgaca.exception;

public class NotFoundException extends CertificateAuthorityException {

    public NotFoundException(String message) {
        super(message);
    }
}
