package org.unicitylabs.hydrator.crypto;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.unicitylabs.hydrator.protocol.Event;
import org.unicitylabs.hydrator.protocol.EventIds;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;

/**
 * Key pair used to sign outbound events, such as a NIP-42 AUTH reply built by a caller
 * after the relay connection surfaces an AUTH challenge.
 */
public class NostrKeyManager {

    private final byte[] privateKey;
    private final String publicKeyHex;

    private NostrKeyManager(byte[] privateKey) {
        this.privateKey = Arrays.copyOf(privateKey, privateKey.length);
        this.publicKeyHex = Hex.encodeHexString(SchnorrSigner.getPublicKey(this.privateKey));
    }

    /**
     * Create key manager from hex-encoded private key.
     *
     * @param privateKeyHex Hex-encoded 32-byte private key
     * @return NostrKeyManager instance
     */
    public static NostrKeyManager fromPrivateKeyHex(String privateKeyHex) {
        try {
            return new NostrKeyManager(Hex.decodeHex(privateKeyHex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string", e);
        }
    }

    /**
     * Generate a new random key pair.
     *
     * @return NostrKeyManager instance with new keys
     */
    public static NostrKeyManager generate() {
        SecureRandom random = new SecureRandom();
        while (true) {
            byte[] candidate = new byte[32];
            random.nextBytes(candidate);
            try {
                return new NostrKeyManager(candidate);
            } catch (IllegalArgumentException outOfRange) {
                // Zero or >= curve order, astronomically unlikely; draw again
            }
        }
    }

    /**
     * Get public key as hex string (32 bytes, x-only).
     */
    public String getPublicKeyHex() {
        return publicKeyHex;
    }

    /**
     * Build and sign an event authored by this key: computes the canonical id and
     * attaches the BIP-340 signature over it.
     *
     * @param createdAt Unix timestamp in seconds
     * @param kind Event kind
     * @param tags Event tags
     * @param content Event content
     * @return Signed event
     */
    public Event signEvent(long createdAt, int kind, List<List<String>> tags, String content) {
        String id = EventIds.computeId(publicKeyHex, createdAt, kind, tags, content);
        try {
            byte[] signature = SchnorrSigner.sign(Hex.decodeHex(id), privateKey);
            return new Event(id, publicKeyHex, createdAt, kind, tags, content, Hex.encodeHexString(signature));
        } catch (DecoderException e) {
            throw new IllegalStateException("Computed id is not hex: " + id, e);
        }
    }

    /**
     * Sign an event with the current time.
     */
    public Event signEvent(int kind, List<List<String>> tags, String content) {
        return signEvent(System.currentTimeMillis() / 1000, kind, tags, content);
    }

    /**
     * Check if a public key matches this key manager's public key.
     */
    public boolean isMyPublicKey(String publicKeyHex) {
        return this.publicKeyHex.equalsIgnoreCase(publicKeyHex);
    }

    /**
     * Clear sensitive data from memory (call when done).
     */
    public void clear() {
        Arrays.fill(privateKey, (byte) 0);
    }

    @Override
    public String toString() {
        return "NostrKeyManager{pubkey=" + Event.abbreviate(publicKeyHex) + '}';
    }
}
