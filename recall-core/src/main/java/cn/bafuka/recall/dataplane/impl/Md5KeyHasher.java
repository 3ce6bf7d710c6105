package cn.bafuka.recall.dataplane.impl;

import cn.bafuka.recall.dataplane.KeyHasher;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 基于 MD5 的指纹生成器
 * 取摘要前 16 位十六进制字符，缓存规模在几十到几百条，碰撞可以忽略
 */
public class Md5KeyHasher implements KeyHasher {

    public static final int FINGERPRINT_LENGTH = 16;

    @Override
    public String fingerprint(String query, String scope) {
        // 全角空格等 Unicode 空白同样去除
        String normalized = query == null ? "" : StringUtils.trimWhitespace(query.toLowerCase(Locale.ROOT));
        String content = (scope == null ? "" : scope) + ":" + normalized;
        String digest = DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8));
        return digest.substring(0, FINGERPRINT_LENGTH);
    }
}
