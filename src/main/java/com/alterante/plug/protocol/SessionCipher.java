package com.alterante.plug.protocol;

import org.bouncycastle.crypto.BlockCipher;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

import java.util.Arrays;

/**
 * AES-128-CBC payload cipher using the BouncyCastle lightweight API.
 *
 * Every device starts with {@link #DEFAULT_KEY} and {@link #DEFAULT_IV}; the
 * authentication handshake replaces the key, the IV never changes.
 */
public final class SessionCipher {

    public static final int BLOCK_SIZE = 16;
    public static final int KEY_SIZE = 16;

    private static final byte[] DEFAULT_KEY = {
            0x09, 0x76, 0x28, 0x34, 0x3F, (byte) 0xE9, (byte) 0x9E, 0x23,
            0x76, 0x5C, 0x15, 0x13, (byte) 0xAC, (byte) 0xCF, (byte) 0x8B, 0x02
    };
    private static final byte[] DEFAULT_IV = {
            0x56, 0x2E, 0x17, (byte) 0x99, 0x6D, 0x09, 0x3D, 0x28,
            (byte) 0xDD, (byte) 0xB3, (byte) 0xBA, 0x69, 0x5A, 0x2E, 0x6F, 0x58
    };

    private SessionCipher() {}

    public static byte[] defaultKey() { return Arrays.copyOf(DEFAULT_KEY, KEY_SIZE); }
    public static byte[] defaultIv()  { return Arrays.copyOf(DEFAULT_IV, BLOCK_SIZE); }

    /** Zero-pad the plaintext to a block multiple and encrypt it. */
    public static byte[] encrypt(byte[] key, byte[] iv, byte[] plaintext) {
        return encryptBlocks(key, iv, Padding.zeroPad(plaintext, BLOCK_SIZE));
    }

    /**
     * Encrypt an already block-aligned plaintext.
     *
     * @throws IllegalArgumentException if the length is not a multiple of the block size
     */
    public static byte[] encryptBlocks(byte[] key, byte[] iv, byte[] aligned) {
        if (aligned.length % BLOCK_SIZE != 0) {
            throw new IllegalArgumentException("plaintext not block aligned: " + aligned.length);
        }
        return process(true, key, iv, aligned);
    }

    /**
     * Decrypt a ciphertext without removing any padding.
     *
     * @throws FrameException if the ciphertext is shorter than one block or not block aligned
     */
    public static byte[] decrypt(byte[] key, byte[] iv, byte[] ciphertext) throws FrameException {
        if (ciphertext.length < BLOCK_SIZE) {
            throw new FrameException("ciphertext too short: " + ciphertext.length);
        }
        if (ciphertext.length % BLOCK_SIZE != 0) {
            throw new FrameException("ciphertext not block aligned: " + ciphertext.length);
        }
        return process(false, key, iv, ciphertext);
    }

    /** Decrypt and trim by the value of the last decrypted byte. */
    public static byte[] decryptAndStrip(byte[] key, byte[] iv, byte[] ciphertext) throws FrameException {
        return Padding.stripByTrailingLength(decrypt(key, iv, ciphertext));
    }

    private static byte[] process(boolean forEncryption, byte[] key, byte[] iv, byte[] input) {
        if (key.length != KEY_SIZE) {
            throw new IllegalArgumentException("key must be " + KEY_SIZE + " bytes, got " + key.length);
        }
        if (iv.length != BLOCK_SIZE) {
            throw new IllegalArgumentException("iv must be " + BLOCK_SIZE + " bytes, got " + iv.length);
        }
        BlockCipher cbc = CBCBlockCipher.newInstance(AESEngine.newInstance());
        cbc.init(forEncryption, new ParametersWithIV(new KeyParameter(key), iv));

        byte[] out = new byte[input.length];
        for (int off = 0; off < input.length; off += BLOCK_SIZE) {
            cbc.processBlock(input, off, out, off);
        }
        return out;
    }
}
