package com.raditha.mvscan.util;

import org.bouncycastle.crypto.digests.KeccakDigest;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Keccak-256 as used by the EVM (not the NIST SHA3-256 padding).
 */
public final class Keccak256 {

    private static final int WORD_BYTES = 32;

    private Keccak256() {
    }

    public static byte[] hash(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    public static byte[] hash(String text) {
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Function selector: the first four bytes of keccak256(signature) as
     * zero-padded hex, e.g. {@code 0xa9059cbb}.
     */
    public static String selector(String signature) {
        byte[] h = hash(signature);
        long value = ((h[0] & 0xFFL) << 24) | ((h[1] & 0xFFL) << 16) | ((h[2] & 0xFFL) << 8) | (h[3] & 0xFFL);
        return String.format("0x%08x", value);
    }

    /**
     * Storage slot of a mapping element: keccak256(abi.encode(key, baseSlot))
     * with both values encoded as uint256.
     *
     * @throws IllegalArgumentException if either value does not fit in uint256
     */
    public static BigInteger mappingSlot(BigInteger key, BigInteger baseSlot) {
        byte[] encoded = new byte[2 * WORD_BYTES];
        writeWord(key, encoded, 0);
        writeWord(baseSlot, encoded, WORD_BYTES);
        return new BigInteger(1, hash(encoded));
    }

    private static void writeWord(BigInteger value, byte[] target, int offset) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Value does not fit in uint256: " + value);
        }
        byte[] raw = value.toByteArray();
        int start = raw.length > WORD_BYTES ? raw.length - WORD_BYTES : 0;
        int len = raw.length - start;
        System.arraycopy(raw, start, target, offset + WORD_BYTES - len, len);
    }
}
