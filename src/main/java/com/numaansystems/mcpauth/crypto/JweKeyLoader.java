package com.numaansystems.mcpauth.crypto;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;

/**
 * Loads the process-wide RSA keypair used to encrypt and decrypt bearer tokens.
 *
 * <p>Accepts a PEM-encoded private key, inline or from a file, in any of the common
 * encodings: PKCS#1 ({@code RSA PRIVATE KEY}, optionally OpenSSL-encrypted), PKCS#8
 * ({@code PRIVATE KEY}) or encrypted PKCS#8 ({@code ENCRYPTED PRIVATE KEY}). The public
 * key is derived from the private key's CRT parameters.</p>
 *
 * <p>Every failure is reported as {@link KeyLoadingException}; the key text itself is
 * never included in messages or logs.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class JweKeyLoader {

    private static final Logger logger = LoggerFactory.getLogger(JweKeyLoader.class);

    private static final Provider BC = new BouncyCastleProvider();

    private JweKeyLoader() {
    }

    /**
     * Loads the keypair from exactly one of an inline PEM string or a PEM file path.
     *
     * @param inlinePem PEM text, may use literal {@code \n} sequences as line breaks
     * @param pemPath path to a PEM file
     * @param passphrase passphrase for encrypted keys, empty or null when unencrypted
     * @return the private key and its derived public key
     * @throws KeyLoadingException if the key cannot be read, decrypted or is not RSA
     */
    public static KeyPair load(String inlinePem, String pemPath, String passphrase) {
        String pem;
        if (inlinePem != null && !inlinePem.isBlank()) {
            pem = inlinePem.replace("\\n", "\n");
        } else if (pemPath != null && !pemPath.isBlank()) {
            pem = readFile(pemPath);
        } else {
            throw new KeyLoadingException("No JWE private key configured");
        }

        KeyPair keyPair = parse(pem, passphrase);
        logger.info("Loaded RSA JWE keypair ({} bit modulus)",
                ((RSAPublicKey) keyPair.getPublic()).getModulus().bitLength());
        return keyPair;
    }

    private static String readFile(String pemPath) {
        Path path = Paths.get(pemPath);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KeyLoadingException("Unable to read JWE private key file: " + path, e);
        }
    }

    static KeyPair parse(String pem, String passphrase) {
        Object parsed;
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            parsed = parser.readObject();
        } catch (IOException e) {
            throw new KeyLoadingException("JWE private key is not valid PEM", e);
        }
        if (parsed == null) {
            throw new KeyLoadingException("JWE private key is empty or not valid PEM");
        }

        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        PrivateKey privateKey;
        try {
            if (parsed instanceof PEMKeyPair keyPair) {
                privateKey = converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            } else if (parsed instanceof PEMEncryptedKeyPair encryptedKeyPair) {
                char[] password = requirePassphrase(passphrase);
                PEMKeyPair decrypted = encryptedKeyPair.decryptKeyPair(
                        new JcePEMDecryptorProviderBuilder().setProvider(BC).build(password));
                privateKey = converter.getPrivateKey(decrypted.getPrivateKeyInfo());
            } else if (parsed instanceof PKCS8EncryptedPrivateKeyInfo encryptedInfo) {
                char[] password = requirePassphrase(passphrase);
                InputDecryptorProvider decryptor =
                        new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(BC).build(password);
                privateKey = converter.getPrivateKey(encryptedInfo.decryptPrivateKeyInfo(decryptor));
            } else if (parsed instanceof PrivateKeyInfo info) {
                privateKey = converter.getPrivateKey(info);
            } else {
                throw new KeyLoadingException("JWE private key PEM does not contain a private key: "
                        + parsed.getClass().getSimpleName());
            }
        } catch (PEMException e) {
            throw new KeyLoadingException("Unable to decode JWE private key", e);
        } catch (IOException | PKCSException | OperatorCreationException e) {
            throw new KeyLoadingException("Unable to decrypt JWE private key, check the passphrase", e);
        }

        if (!(privateKey instanceof RSAPrivateCrtKey rsaKey)) {
            throw new KeyLoadingException("JWE private key must be an RSA key, got " + privateKey.getAlgorithm());
        }

        try {
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            RSAPublicKey publicKey = (RSAPublicKey) keyFactory.generatePublic(
                    new RSAPublicKeySpec(rsaKey.getModulus(), rsaKey.getPublicExponent()));
            return new KeyPair(publicKey, rsaKey);
        } catch (GeneralSecurityException e) {
            throw new KeyLoadingException("Unable to derive the JWE public key", e);
        }
    }

    private static char[] requirePassphrase(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new KeyLoadingException(
                    "JWE private key is encrypted but OAUTH_JWE_PRIVATE_KEY_PASSPHRASE is not set");
        }
        return passphrase.toCharArray();
    }
}
