package com.clevertap.symtab.utils;

import com.clevertap.symtab.exceptions.SymbolTableRuntimeException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Accumulates an MD5 digest and renders it as lower case hex.
 */
public class CheckSummer {

    private static final String ALGORITHM = "MD5";

    private final MessageDigest digest;

    public CheckSummer() {
        try {
            digest = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JVM is required to ship MD5.
            throw new SymbolTableRuntimeException(e);
        }
    }

    public CheckSummer update(final byte[] data) {
        digest.update(data);
        return this;
    }

    public CheckSummer update(final byte data) {
        digest.update(data);
        return this;
    }

    public CheckSummer update(final String data) {
        return update(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Completes the digest. The summer is reset afterwards.
     */
    public String digest() {
        return HexFormat.of().formatHex(digest.digest());
    }
}
