package com.flowys.flowys_backend.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;

/**
 * Encrypts connection credentials at rest.
 *
 * AES-256/CBC/PKCS5Padding with a key derived from flowys.integrations.encryption-key (PBKDF2).
 * Stored form is hex(iv) + ":" + hex(ciphertext) of the credential map serialized as JSON.
 */
@Component
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final byte[] SALT = "flowys-credentials".getBytes(StandardCharsets.UTF_8);
    private static final int ITERATIONS = 65_536;
    private static final int IV_LENGTH = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKeySpec key;
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    public CredentialCipher(@Value("${flowys.integrations.encryption-key:default-key-change-in-production-32ch}") String secret,
                            ObjectMapper objectMapper) {
        this.key = deriveKey(secret);
        this.objectMapper = objectMapper;
    }

    public String encrypt(Map<String, Object> credentials) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            byte[] plain = objectMapper.writeValueAsBytes(credentials);
            return HEX.formatHex(iv) + ":" + HEX.formatHex(cipher.doFinal(plain));
        } catch (GeneralSecurityException | JsonProcessingException e) {
            throw new IllegalStateException("Could not encrypt connection credentials", e);
        }
    }

    public Map<String, Object> decrypt(String stored) {
        if (stored == null || stored.indexOf(':') <= 0) {
            throw new IllegalStateException("Stored credentials are malformed");
        }
        int sep = stored.indexOf(':');
        try {
            byte[] iv = HEX.parseHex(stored.substring(0, sep));
            byte[] encrypted = HEX.parseHex(stored.substring(sep + 1));
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(iv));
            return objectMapper.readValue(cipher.doFinal(encrypted), new TypeReference<>() {});
        } catch (GeneralSecurityException | IllegalArgumentException | IOException e) {
            throw new IllegalStateException("Could not decrypt connection credentials", e);
        }
    }

    private static SecretKeySpec deriveKey(String secret) {
        try {
            PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), SALT, ITERATIONS, 256);
            byte[] raw = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
            return new SecretKeySpec(raw, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not derive credential encryption key", e);
        }
    }
}
