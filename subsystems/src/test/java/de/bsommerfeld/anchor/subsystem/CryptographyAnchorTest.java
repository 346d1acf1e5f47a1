package de.bsommerfeld.anchor.subsystem;

import org.junit.jupiter.api.Test;

import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static org.junit.jupiter.api.Assertions.*;

class CryptographyAnchorTest {

    @Test
    void anchor_shouldSucceedWithPlatformProviders() {
        AnchorReport report = new CryptographyAnchor().anchor();

        assertEquals("cryptography", report.subsystem());
        assertEquals(2, report.outcomes().size());
        assertEquals(0, report.failures(), report.toString());
    }

    @Test
    void anchor_shouldResetDigestWhenHashingThrows() {
        ExplodingDigest digest = new ExplodingDigest();

        AnchorReport report = new CryptographyAnchor(() -> digest,
                () -> KeyPairGenerator.getInstance(CryptographyAnchor.SIGNATURE)).anchor();

        assertTrue(digest.reset);
        assertFalse(report.outcomes().get(0).succeeded());
        assertTrue(report.outcomes().get(1).succeeded());
    }

    @Test
    void anchor_shouldAbsorbMissingSignatureAlgorithm() {
        AnchorReport report = new CryptographyAnchor(() -> MessageDigest.getInstance(CryptographyAnchor.DIGEST),
                () -> {
                    throw new NoSuchAlgorithmException("Ed25519 not available");
                }).anchor();

        assertTrue(report.outcomes().get(0).succeeded());
        assertFalse(report.outcomes().get(1).succeeded());
        assertEquals("java.security.NoSuchAlgorithmException: Ed25519 not available",
                report.outcomes().get(1).detail());
    }

    private static final class ExplodingDigest extends MessageDigest {
        boolean reset;

        ExplodingDigest() {
            super("EXPLODING");
        }

        @Override
        protected void engineUpdate(byte input) {
        }

        @Override
        protected void engineUpdate(byte[] input, int offset, int len) {
        }

        @Override
        protected byte[] engineDigest() {
            throw new IllegalStateException("hardware token removed");
        }

        @Override
        protected void engineReset() {
            reset = true;
        }
    }
}
