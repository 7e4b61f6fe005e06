package com.wpanther.cgaca.crypto;

import com.wpanther.cgaca.exception.CryptoException;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.generators.SCrypt;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Encrypts CA private keys at rest.
 * A 256-bit key is derived from the passphrase with scrypt and used for AES-GCM.
 * The stored blob is: version | log2(N) | r | p | salt | iv | ciphertext+tag, Base64 encoded.
 * The KDF parameters travel with the blob so old keys stay readable after a cost change.
 */
@Component
@Slf4j
public class KeyEncryptionService {

    private static final byte FORMAT_VERSION = 1;
    private static final int HEADER_LENGTH = 4;
    private static final int SALT_LENGTH = 16;
    private static final int IV_LENGTH = 12;
    private static final int KEY_LENGTH = 32;
    private static final int TAG_BITS = 128;

    private final SecureRandom secureRandom;
    private final int costExponent;
    private final int blockSize;
    private final int parallelization;

    public KeyEncryptionService(SecureRandom secureRandom,
                                @Value("${app.ca.kdf.cost:32768}") int cost,
                                @Value("${app.ca.kdf.block-size:8}") int blockSize,
                                @Value("${app.ca.kdf.parallelization:1}") int parallelization) {
        if (cost < 2 || Integer.bitCount(cost) != 1) {
            throw new IllegalArgumentException("scrypt cost must be a power of two greater than 1: " + cost);
        }
        this.secureRandom = secureRandom;
        this.costExponent = Integer.numberOfTrailingZeros(cost);
        this.blockSize = blockSize;
        this.parallelization = parallelization;
    }

    public String encrypt(byte[] plaintext, char[] passphrase) {
        byte[] salt = new byte[SALT_LENGTH];
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(salt);
        secureRandom.nextBytes(iv);

        byte[] header = {FORMAT_VERSION, (byte) costExponent, (byte) blockSize, (byte) parallelization};
        byte[] key = deriveKey(passphrase, salt, costExponent, blockSize, parallelization);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(header);
            byte[] ciphertext = cipher.doFinal(plaintext);

            ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + SALT_LENGTH + IV_LENGTH + ciphertext.length);
            buffer.put(header).put(salt).put(iv).put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to encrypt private key: " + e.getMessage(), e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public byte[] decrypt(String encrypted, char[] passphrase) {
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(encrypted);
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Encrypted private key is not valid Base64", e);
        }
        if (blob.length <= HEADER_LENGTH + SALT_LENGTH + IV_LENGTH || blob[0] != FORMAT_VERSION) {
            throw new CryptoException("Unrecognised encrypted private key format");
        }

        ByteBuffer buffer = ByteBuffer.wrap(blob);
        byte[] header = new byte[HEADER_LENGTH];
        byte[] salt = new byte[SALT_LENGTH];
        byte[] iv = new byte[IV_LENGTH];
        buffer.get(header).get(salt).get(iv);
        byte[] ciphertext = new byte[buffer.remaining()];
        buffer.get(ciphertext);

        byte[] key = deriveKey(passphrase, salt, header[1], header[2], header[3]);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(header);
            return cipher.doFinal(ciphertext);
        } catch (AEADBadTagException e) {
            throw new CryptoException("Failed to decrypt private key: wrong passphrase or tampered data", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to decrypt private key: " + e.getMessage(), e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    private byte[] deriveKey(char[] passphrase, byte[] salt, int logCost, int r, int p) {
        ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(passphrase));
        byte[] passwordBytes = new byte[encoded.remaining()];
        encoded.get(passwordBytes);
        try {
            return SCrypt.generate(passwordBytes, salt, 1 << logCost, r, p, KEY_LENGTH);
        } finally {
            Arrays.fill(passwordBytes, (byte) 0);
            if (encoded.hasArray()) {
                Arrays.fill(encoded.array(), (byte) 0);
            }
        }
    }
}
