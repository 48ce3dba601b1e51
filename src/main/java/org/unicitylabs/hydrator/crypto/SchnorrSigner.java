package org.unicitylabs.hydrator.crypto;

import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * BIP-340 Schnorr signatures over secp256k1 using BouncyCastle (pure Java, no JNI).
 * See: https://github.com/bitcoin/bips/blob/master/bip-0340.mediawiki
 *
 * Verification is the hot path: every event coming from a relay goes through
 * {@link #verify(byte[], byte[], byte[])}, and it never throws.
 */
public final class SchnorrSigner {

    private static final ECNamedCurveParameterSpec CURVE_PARAMS = ECNamedCurveTable.getParameterSpec("secp256k1");
    private static final ECCurve CURVE = CURVE_PARAMS.getCurve();
    private static final BigInteger N = CURVE_PARAMS.getN();
    private static final BigInteger P = CURVE.getField().getCharacteristic();
    private static final ECPoint G = CURVE_PARAMS.getG();
    private static final BigInteger SEVEN = BigInteger.valueOf(7);

    /**
     * Derive x-only public key from private key (32 bytes).
     *
     * @param privateKey 32-byte private key
     * @return 32-byte x-only public key
     */
    public static byte[] getPublicKey(byte[] privateKey) {
        BigInteger d = toScalar(privateKey);
        ECPoint point = G.multiply(d).normalize();
        return toBytes32(point.getAffineXCoord().toBigInteger());
    }

    /**
     * Sign a 32-byte message (an event id) using BIP-340 with a deterministic nonce.
     *
     * @param message 32-byte message to sign
     * @param privateKey 32-byte private key
     * @return 64-byte signature (R.x || s)
     */
    public static byte[] sign(byte[] message, byte[] privateKey) {
        if (message.length != 32) {
            throw new IllegalArgumentException("Message must be 32 bytes");
        }
        BigInteger d = toScalar(privateKey);
        ECPoint pub = G.multiply(d).normalize();

        // BIP-340: signing key must correspond to the even-y point
        if (pub.getAffineYCoord().toBigInteger().testBit(0)) {
            d = N.subtract(d);
        }
        byte[] px = toBytes32(pub.getAffineXCoord().toBigInteger());

        byte[] nonceHash = taggedHash("BIP0340/nonce", concat(toBytes32(d), px, message));
        BigInteger k = new BigInteger(1, nonceHash).mod(N);
        if (k.signum() == 0) {
            throw new IllegalStateException("Derived nonce is zero");
        }

        ECPoint r = G.multiply(k).normalize();
        if (r.getAffineYCoord().toBigInteger().testBit(0)) {
            k = N.subtract(k);
        }
        byte[] rx = toBytes32(r.getAffineXCoord().toBigInteger());

        BigInteger e = new BigInteger(1, taggedHash("BIP0340/challenge", concat(rx, px, message))).mod(N);
        BigInteger s = k.add(e.multiply(d)).mod(N);

        return concat(rx, toBytes32(s));
    }

    /**
     * Verify a BIP-340 Schnorr signature.
     *
     * @param signature 64-byte signature
     * @param message 32-byte message
     * @param publicKey 32-byte x-only public key
     * @return true if signature is valid; false on any malformed input
     */
    public static boolean verify(byte[] signature, byte[] message, byte[] publicKey) {
        if (signature == null || message == null || publicKey == null) return false;
        if (signature.length != 64 || message.length != 32 || publicKey.length != 32) return false;

        ECPoint pub = liftX(new BigInteger(1, publicKey));
        if (pub == null) return false;

        byte[] rx = Arrays.copyOfRange(signature, 0, 32);
        BigInteger r = new BigInteger(1, rx);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        if (r.compareTo(P) >= 0 || s.compareTo(N) >= 0) return false;

        BigInteger e = new BigInteger(1, taggedHash("BIP0340/challenge", concat(rx, publicKey, message))).mod(N);

        // R = s*G - e*P
        ECPoint point = G.multiply(s).add(pub.multiply(N.subtract(e))).normalize();
        if (point.isInfinity()) return false;
        if (point.getAffineYCoord().toBigInteger().testBit(0)) return false;
        return point.getAffineXCoord().toBigInteger().equals(r);
    }

    /**
     * BIP-340 lift_x: the even-y point with the given x, or null when x is not on the curve.
     */
    private static ECPoint liftX(BigInteger x) {
        if (x.compareTo(P) >= 0) {
            return null;
        }
        BigInteger c = x.modPow(BigInteger.valueOf(3), P).add(SEVEN).mod(P);
        BigInteger y = c.modPow(P.add(BigInteger.ONE).shiftRight(2), P);
        if (!y.modPow(BigInteger.TWO, P).equals(c)) {
            return null;
        }
        if (y.testBit(0)) {
            y = P.subtract(y);
        }
        return CURVE.createPoint(x, y);
    }

    private static BigInteger toScalar(byte[] privateKey) {
        if (privateKey == null || privateKey.length != 32) {
            throw new IllegalArgumentException("Private key must be 32 bytes");
        }
        BigInteger d = new BigInteger(1, privateKey);
        if (d.signum() == 0 || d.compareTo(N) >= 0) {
            throw new IllegalArgumentException("Private key out of range");
        }
        return d;
    }

    /**
     * Tagged hash as specified in BIP-340.
     */
    private static byte[] taggedHash(String tag, byte[] msg) {
        MessageDigest sha256 = sha256();
        byte[] tagHash = sha256.digest(tag.getBytes(StandardCharsets.UTF_8));
        sha256.update(tagHash);
        sha256.update(tagHash);
        sha256.update(msg);
        return sha256.digest();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Big-endian, left-padded to exactly 32 bytes.
     */
    private static byte[] toBytes32(BigInteger value) {
        byte[] bytes = value.toByteArray();
        if (bytes.length == 32) {
            return bytes;
        }
        if (bytes.length > 32) {
            // Drop the sign byte
            return Arrays.copyOfRange(bytes, bytes.length - 32, bytes.length);
        }
        byte[] padded = new byte[32];
        System.arraycopy(bytes, 0, padded, 32 - bytes.length, bytes.length);
        return padded;
    }

    private static byte[] concat(byte[]... arrays) {
        int totalLength = 0;
        for (byte[] arr : arrays) {
            totalLength += arr.length;
        }
        byte[] result = new byte[totalLength];
        int offset = 0;
        for (byte[] arr : arrays) {
            System.arraycopy(arr, 0, result, offset, arr.length);
            offset += arr.length;
        }
        return result;
    }

    private SchnorrSigner() {
        // Utility class
    }
}
