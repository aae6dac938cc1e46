package com.pipeline.etl.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 由内容生成确定性标识（MD5十六进制）
 */
public final class HashIds {

    private HashIds() {}

    public static String md5Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 每个JRE都必须提供MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
