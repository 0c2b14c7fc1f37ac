package com.chain.chainledgersystem.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.Security;

@Slf4j
public class CryptoUtil {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final char[] HEX_ARRAY = "0123456789abcdef".toCharArray();

    /**
     * SHA-256，优先使用BouncyCastle提供者
     */
    public static byte[] applySHA256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256", BouncyCastleProvider.PROVIDER_NAME)
                    .digest(data);
        } catch (Exception e) {
            log.debug("BouncyCastle SHA-256不可用，降级使用系统默认提供者: {}", e.getMessage());
            try {
                return MessageDigest.getInstance("SHA-256").digest(data);
            } catch (Exception ex) {
                throw new IllegalStateException("SHA-256算法不可用", ex);
            }
        }
    }

    /**
     * 字符串UTF-8编码后取SHA-256，返回小写十六进制
     */
    public static String sha256Hex(String content) {
        return bytesToHex(applySHA256(content.getBytes(StandardCharsets.UTF_8)));
    }

    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        char[] hexChars = new char[bytes.length * 2];
        for (int j = 0; j < bytes.length; j++) {
            int v = bytes[j] & 0xFF;
            hexChars[j * 2] = HEX_ARRAY[v >>> 4];
            hexChars[j * 2 + 1] = HEX_ARRAY[v & 0x0F];
        }
        return new String(hexChars);
    }

    private CryptoUtil() {
    }
}
