package com.numaansystems.mcpauth.crypto;

import com.numaansystems.mcpauth.support.TestKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.interfaces.RSAPublicKey;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JweKeyLoader.
 *
 * <p>Covers every supported PEM encoding, inline and file sources, and the failure
 * modes that must stop the application from starting.</p>
 */
class JweKeyLoaderTest {

    private static final String PASSPHRASE = "correct horse battery staple";

    private final KeyPair keyPair = TestKeys.rsa();

    @Test
    @DisplayName("Should load a PKCS#1 key and derive its public key")
    void testPkcs1() {
        KeyPair loaded = JweKeyLoader.load(TestKeys.pkcs1Pem(keyPair.getPrivate()), null, null);

        assertEquals(((RSAPublicKey) keyPair.getPublic()).getModulus(),
                ((RSAPublicKey) loaded.getPublic()).getModulus());
    }

    @Test
    @DisplayName("Should load a PKCS#8 key")
    void testPkcs8() {
        KeyPair loaded = JweKeyLoader.load(TestKeys.pkcs8Pem(keyPair.getPrivate()), "", "");

        assertEquals(keyPair.getPublic(), loaded.getPublic());
    }

    @Test
    @DisplayName("Should decrypt an encrypted PKCS#8 key with its passphrase")
    void testEncryptedPkcs8() {
        String pem = TestKeys.encryptedPkcs8Pem(keyPair.getPrivate(), PASSPHRASE);

        KeyPair loaded = JweKeyLoader.load(pem, null, PASSPHRASE);

        assertEquals(keyPair.getPublic(), loaded.getPublic());
    }

    @Test
    @DisplayName("Should decrypt an OpenSSL-encrypted PKCS#1 key with its passphrase")
    void testEncryptedPkcs1() {
        String pem = TestKeys.encryptedPkcs1Pem(keyPair.getPrivate(), PASSPHRASE);

        KeyPair loaded = JweKeyLoader.load(pem, null, PASSPHRASE);

        assertEquals(keyPair.getPublic(), loaded.getPublic());
    }

    @Test
    @DisplayName("Should accept inline PEM with escaped newlines")
    void testEscapedNewlines() {
        String escaped = TestKeys.pkcs8Pem(keyPair.getPrivate()).replace("\n", "\\n");

        KeyPair loaded = JweKeyLoader.load(escaped, null, null);

        assertEquals(keyPair.getPublic(), loaded.getPublic());
    }

    @Test
    @DisplayName("Should load a key from a file path")
    void testFromFile(@TempDir Path directory) throws Exception {
        Path file = directory.resolve("jwe.pem");
        Files.writeString(file, TestKeys.pkcs8Pem(keyPair.getPrivate()), StandardCharsets.UTF_8);

        KeyPair loaded = JweKeyLoader.load(null, file.toString(), null);

        assertEquals(keyPair.getPublic(), loaded.getPublic());
    }

    @Test
    @DisplayName("Should fail when the key file does not exist")
    void testMissingFile(@TempDir Path directory) {
        String missing = directory.resolve("missing.pem").toString();

        assertThrows(KeyLoadingException.class, () -> JweKeyLoader.load(null, missing, null));
    }

    @Test
    @DisplayName("Should fail on a wrong passphrase without leaking the key")
    void testWrongPassphrase() {
        String pem = TestKeys.encryptedPkcs8Pem(keyPair.getPrivate(), PASSPHRASE);

        KeyLoadingException e = assertThrows(KeyLoadingException.class,
                () -> JweKeyLoader.load(pem, null, "wrong passphrase"));

        assertFalse(e.getMessage().contains("PRIVATE KEY"), "Message must not echo key material");
    }

    @Test
    @DisplayName("Should require a passphrase for an encrypted key")
    void testMissingPassphrase() {
        String pem = TestKeys.encryptedPkcs8Pem(keyPair.getPrivate(), PASSPHRASE);

        assertThrows(KeyLoadingException.class, () -> JweKeyLoader.load(pem, null, ""));
    }

    @Test
    @DisplayName("Should fail on text that is not PEM")
    void testGarbage() {
        assertThrows(KeyLoadingException.class, () -> JweKeyLoader.load("not a key", null, null));
    }

    @Test
    @DisplayName("Should reject a non-RSA key")
    void testNonRsaKey() {
        KeyPair ec = TestKeys.generate("EC", 256);

        assertThrows(KeyLoadingException.class,
                () -> JweKeyLoader.load(TestKeys.pkcs8Pem(ec.getPrivate()), null, null));
    }

    @Test
    @DisplayName("Should fail when no key source is configured")
    void testNoSource() {
        assertThrows(KeyLoadingException.class, () -> JweKeyLoader.load(" ", "", null));
    }
}
