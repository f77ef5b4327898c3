package io.gossipledger.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static byte[] sha256(String in) {
        return sha256(in.getBytes(StandardCharsets.UTF_8));
    }

    /** Lower-case hex, two chars per byte. */
    public static String toHex(byte[] b){
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    /**
     * Decode hex text (either case, no prefix).
     *
     * @throws LedgerException with {@link ValidationError#INVALID_ENCODING} if the text is null,
     *                         of odd length or contains a non-hex character
     */
    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new LedgerException(ValidationError.INVALID_ENCODING, "hash is missing");
        }
        int len = hex.length();
        if (len % 2 != 0) {
            throw new LedgerException(ValidationError.INVALID_ENCODING, "odd-length hex: " + abbreviate(hex));
        }
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(hex.charAt(i), 16);
            int lo = Character.digit(hex.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new LedgerException(ValidationError.INVALID_ENCODING, "invalid hex character in " + abbreviate(hex));
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }

    private static String abbreviate(String value) {
        return value.length() <= 16 ? value : value.substring(0, 16) + "...";
    }
}
