package org.unicitylabs.hydrator.crypto;

import org.apache.commons.codec.binary.Hex;
import org.junit.Test;
import org.unicitylabs.hydrator.protocol.EventVerifier;

import java.util.ArrayList;

import static org.junit.Assert.*;

/**
 * BIP-340 signing and verification.
 */
public class SchnorrSignerTest {

    // BIP-340 test vector 0
    private static final String VECTOR0_SECRET = "0000000000000000000000000000000000000000000000000000000000000003";
    private static final String VECTOR0_PUBKEY = "F9308A019258C31049344F85F89D5229B531C845836F99B08601F113BCE036F9";
    private static final String VECTOR0_MESSAGE = "0000000000000000000000000000000000000000000000000000000000000000";
    private static final String VECTOR0_SIG =
            "E907831F80848D1069A5371B402410364BDF1C5F8307B0084C55F1CE2DCA8215" +
            "25F66A4A85EA8B71E482A74F382D2CE5EBEEE8FDB2172F477DF4900D310536C0";

    @Test
    public void testPublicKeyDerivationMatchesVector() throws Exception {
        byte[] pub = SchnorrSigner.getPublicKey(Hex.decodeHex(VECTOR0_SECRET));
        assertEquals(VECTOR0_PUBKEY.toLowerCase(), Hex.encodeHexString(pub));
    }

    @Test
    public void testVerifiesPublishedVector() throws Exception {
        assertTrue(SchnorrSigner.verify(
                Hex.decodeHex(VECTOR0_SIG),
                Hex.decodeHex(VECTOR0_MESSAGE),
                Hex.decodeHex(VECTOR0_PUBKEY)));
    }

    @Test
    public void testRejectsModifiedVector() throws Exception {
        byte[] sig = Hex.decodeHex(VECTOR0_SIG);
        sig[63] ^= 0x01;
        assertFalse(SchnorrSigner.verify(sig, Hex.decodeHex(VECTOR0_MESSAGE), Hex.decodeHex(VECTOR0_PUBKEY)));

        byte[] message = Hex.decodeHex(VECTOR0_MESSAGE);
        message[0] = 1;
        assertFalse(SchnorrSigner.verify(Hex.decodeHex(VECTOR0_SIG), message, Hex.decodeHex(VECTOR0_PUBKEY)));
    }

    @Test
    public void testSignThenVerify() throws Exception {
        byte[] privateKey = Hex.decodeHex("b7e151628aed2a6abf7158809cf4f3c762e7160f38b4da56a784d9045190cfef");
        byte[] message = new byte[32];
        message[31] = 7;

        byte[] sig = SchnorrSigner.sign(message, privateKey);
        assertEquals(64, sig.length);
        assertTrue(SchnorrSigner.verify(sig, message, SchnorrSigner.getPublicKey(privateKey)));
    }

    @Test
    public void testMalformedInputsReturnFalse() {
        assertFalse(SchnorrSigner.verify(null, new byte[32], new byte[32]));
        assertFalse(SchnorrSigner.verify(new byte[63], new byte[32], new byte[32]));
        // x = 5 is not on secp256k1
        byte[] offCurve = new byte[32];
        offCurve[31] = 5;
        assertFalse(SchnorrSigner.verify(new byte[64], new byte[32], offCurve));
    }

    @Test
    public void testKeyManagerSignsVerifiableEvents() {
        NostrKeyManager keys = NostrKeyManager.generate();
        assertEquals(64, keys.getPublicKeyHex().length());
        assertTrue(keys.isMyPublicKey(keys.getPublicKeyHex().toUpperCase()));
        assertTrue(EventVerifier.verify(keys.signEvent(1, new ArrayList<>(), "hi")));
    }
}
