package de.bsommerfeld.anchor.subsystem;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.sink.KeepAlive;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.interfaces.EdECPrivateKey;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Cryptography surface: a fixed-size SHA-256 hash and an Ed25519 key pair
 * whose raw private key is exported.
 *
 * <p>
 * The digest is reset and the exported key bytes are wiped in {@code finally}
 * blocks, so neither survives a failing call.
 */
@Singleton
public class CryptographyAnchor extends AbstractSubsystemAnchor {

    static final String DIGEST = "SHA-256";
    static final String SIGNATURE = "Ed25519";
    private static final int BUFFER_SIZE = 32;

    private final Callable<MessageDigest> digests;
    private final Callable<KeyPairGenerator> keyPairs;

    @Inject
    public CryptographyAnchor() {
        this(() -> MessageDigest.getInstance(DIGEST), () -> KeyPairGenerator.getInstance(SIGNATURE));
    }

    CryptographyAnchor(Callable<MessageDigest> digests, Callable<KeyPairGenerator> keyPairs) {
        this.digests = digests;
        this.keyPairs = keyPairs;
    }

    @Override
    public String name() {
        return "cryptography";
    }

    @Override
    protected List<EntryPoint> entryPoints() {
        return List.of(
                new EntryPoint("sha256-fixed-buffer", this::hashFixedBuffer),
                new EntryPoint("ed25519-raw-private-key", this::exportRawPrivateKey));
    }

    private void hashFixedBuffer() throws Exception {
        MessageDigest digest = digests.call();
        try {
            KeepAlive.accept(digest.digest(new byte[BUFFER_SIZE]));
        } finally {
            digest.reset();
        }
    }

    private void exportRawPrivateKey() throws Exception {
        KeyPair pair = keyPairs.call().generateKeyPair();
        byte[] raw = ((EdECPrivateKey) pair.getPrivate()).getBytes().orElseGet(() -> new byte[0]);
        try {
            KeepAlive.accept(pair.getPublic().getEncoded(), raw.length);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }
}
