package com.integrationhealth.core.credential;

import com.integrationhealth.core.exception.CredentialDecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * AES-256-GCM decryption with a key scoped to the workspace.
 * <p>
 * The workspace key is HMAC-SHA256(masterKey, workspaceId). Stored ciphertext has the form
 * {@code authTagHex:cipherTextHex} and the IV is hex encoded.
 */
public class AesGcmCredentialDecryptor implements CredentialDecryptor {

    private static final Logger logger = LoggerFactory.getLogger(AesGcmCredentialDecryptor.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String KEY_DERIVATION = "HmacSHA256";
    private static final int GCM_TAG_LENGTH = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] masterKey;

    public AesGcmCredentialDecryptor(String masterKeyHex) {
        if (masterKeyHex == null || masterKeyHex.length() != 64) {
            throw new IllegalArgumentException("Encryption master key must be 64 hex characters");
        }
        this.masterKey = HEX.parseHex(masterKeyHex);
    }

    @Override
    public String decrypt(String workspaceId, String ciphertext, String iv) {
        if (ciphertext == null || iv == null) {
            throw new CredentialDecryptionException("Missing ciphertext or IV for workspace " + workspaceId);
        }
        int separator = ciphertext.indexOf(':');
        if (separator < 0) {
            throw new CredentialDecryptionException("Malformed ciphertext for workspace " + workspaceId);
        }

        try {
            byte[] authTag = HEX.parseHex(ciphertext.substring(0, separator));
            byte[] encrypted = HEX.parseHex(ciphertext.substring(separator + 1));
            if (authTag.length != GCM_TAG_LENGTH) {
                throw new CredentialDecryptionException("Malformed auth tag for workspace " + workspaceId);
            }

            // JCE expects the tag appended to the ciphertext
            byte[] sealed = new byte[encrypted.length + authTag.length];
            System.arraycopy(encrypted, 0, sealed, 0, encrypted.length);
            System.arraycopy(authTag, 0, sealed, encrypted.length, authTag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, workspaceKey(workspaceId),
                new GCMParameterSpec(GCM_TAG_LENGTH * 8, HEX.parseHex(iv)));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            logger.debug("Credential decryption failed for workspace {}: {}", workspaceId, e.getClass().getSimpleName());
            throw new CredentialDecryptionException("Failed to decrypt credential for workspace " + workspaceId, e);
        }
    }

    SecretKeySpec workspaceKey(String workspaceId) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(KEY_DERIVATION);
        mac.init(new SecretKeySpec(masterKey, KEY_DERIVATION));
        return new SecretKeySpec(mac.doFinal(workspaceId.getBytes(StandardCharsets.UTF_8)), "AES");
    }
}
