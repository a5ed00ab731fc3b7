package com.integrationhealth.core.credential;

public interface CredentialDecryptor {

    /**
     * @throws com.integrationhealth.core.exception.CredentialDecryptionException when the value cannot be decrypted
     */
    String decrypt(String workspaceId, String ciphertext, String iv);
}
