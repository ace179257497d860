package com.telemetry.infrastructure.storage;

import com.telemetry.domain.exception.StorageConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM for endpoint secrets. Format: {@code base64(iv):base64(tag):base64(ciphertext)}.
 */
@Slf4j
@Component
public class SecretCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final StorageProperties properties;
    private final SecureRandom secureRandom = new SecureRandom();

    public SecretCipher(StorageProperties properties) {
        this.properties = properties;
    }

    public String encrypt(String plaintext) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey(), new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext
            int cipherLength = sealed.length - TAG_BITS / 8;
            byte[] ciphertext = new byte[cipherLength];
            byte[] tag = new byte[TAG_BITS / 8];
            System.arraycopy(sealed, 0, ciphertext, 0, cipherLength);
            System.arraycopy(sealed, cipherLength, tag, 0, tag.length);

            Base64.Encoder encoder = Base64.getEncoder();
            return encoder.encodeToString(iv) + ":" + encoder.encodeToString(tag) + ":" + encoder.encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new StorageConfigurationException("Failed to encrypt storage secret", e);
        }
    }

    public String decrypt(String value) {
        String[] parts = value.split(":");
        if (parts.length != 3) {
            throw new StorageConfigurationException("Invalid encrypted format");
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] iv = decoder.decode(parts[0]);
            byte[] tag = decoder.decode(parts[1]);
            byte[] ciphertext = decoder.decode(parts[2]);

            byte[] sealed = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, masterKey(), new GCMParameterSpec(TAG_BITS, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new StorageConfigurationException("Failed to decrypt storage secret", e);
        }
    }

    /**
     * Decrypt when the value looks encrypted, otherwise return it unchanged.
     * Rows written before encryption was introduced hold plaintext secrets.
     */
    public String safeDecrypt(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (!isEncrypted(value)) {
            return value;
        }
        try {
            return decrypt(value);
        } catch (StorageConfigurationException e) {
            log.warn("Stored secret looks encrypted but could not be decrypted, using it as-is: {}", e.getMessage());
            return value;
        }
    }

    boolean isEncrypted(String value) {
        String[] parts = value.split(":");
        if (parts.length != 3) {
            return false;
        }
        Base64.Decoder decoder = Base64.getDecoder();
        try {
            for (String part : parts) {
                decoder.decode(part);
            }
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private SecretKeySpec masterKey() {
        String keyHex = properties.getEncryptionKey();
        if (keyHex == null || keyHex.isBlank()) {
            throw new StorageConfigurationException("storage.encryption-key is not configured");
        }
        if (keyHex.length() != 64) {
            throw new StorageConfigurationException("storage.encryption-key must be 64 hex characters (32 bytes)");
        }
        try {
            return new SecretKeySpec(HexFormat.of().parseHex(keyHex), "AES");
        } catch (IllegalArgumentException e) {
            throw new StorageConfigurationException("storage.encryption-key is not valid hex", e);
        }
    }
}
