package com.wpanther.cgaca.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Locale;

/**
 * Signature algorithms a CA key can be generated for.
 * Keys are exchanged as X.509 SubjectPublicKeyInfo and PKCS#8 encodings.
 */
public enum CaKeyAlgorithm {

    ES256("EC", "SHA256withECDSA", "secp256r1"),
    ED25519("Ed25519", "Ed25519", null);

    private final String keyAlgorithm;
    private final String signatureAlgorithm;
    private final String curve;

    CaKeyAlgorithm(String keyAlgorithm, String signatureAlgorithm, String curve) {
        this.keyAlgorithm = keyAlgorithm;
        this.signatureAlgorithm = signatureAlgorithm;
        this.curve = curve;
    }

    /**
     * Resolves a configured or stored algorithm name
     */
    public static CaKeyAlgorithm fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Key algorithm name is required");
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "ES256":
            case "ECDSA-P256":
            case "ECDSA_P256":
                return ES256;
            case "ED25519":
            case "EDDSA":
                return ED25519;
            default:
                throw new IllegalArgumentException("Unsupported key algorithm: " + name);
        }
    }

    public KeyPair generateKeyPair(SecureRandom random) throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(keyAlgorithm);
        if (curve != null) {
            generator.initialize(new ECGenParameterSpec(curve), random);
        } else {
            generator.initialize(255, random);
        }
        return generator.generateKeyPair();
    }

    public byte[] sign(PrivateKey privateKey, byte[] data) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(signatureAlgorithm);
        signature.initSign(privateKey);
        signature.update(data);
        return signature.sign();
    }

    public boolean verify(PublicKey publicKey, byte[] data, byte[] signatureBytes) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(signatureAlgorithm);
        signature.initVerify(publicKey);
        signature.update(data);
        return signature.verify(signatureBytes);
    }

    public PublicKey decodePublicKey(byte[] encoded) throws GeneralSecurityException {
        return KeyFactory.getInstance(keyAlgorithm).generatePublic(new X509EncodedKeySpec(encoded));
    }

    public PrivateKey decodePrivateKey(byte[] encoded) throws GeneralSecurityException {
        return KeyFactory.getInstance(keyAlgorithm).generatePrivate(new PKCS8EncodedKeySpec(encoded));
    }

    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }
}
