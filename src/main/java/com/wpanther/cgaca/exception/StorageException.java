package com.wpanther.cgaca.exception;

/**
 * Persistence failure. Registry state may have diverged from what the caller expects.
 */
public class StorageException extends CertificateAuthorityException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
