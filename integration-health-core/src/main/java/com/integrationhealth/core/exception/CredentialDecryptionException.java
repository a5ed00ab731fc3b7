package com.integrationhealth.core.exception;

/**
 * Raised when a stored credential cannot be decrypted. The message never carries key or plaintext material.
 */
public class CredentialDecryptionException extends RuntimeException {

    public CredentialDecryptionException(String message) {
        super(message);
    }

    public CredentialDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
