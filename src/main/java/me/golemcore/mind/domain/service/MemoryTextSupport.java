/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mind.domain.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text helpers shared by extraction, promotion and lifecycle code.
 */
public final class MemoryTextSupport {

    private static final int ENTRY_ID_BYTES = 4;

    private MemoryTextSupport() {
    }

    /**
     * Full SHA-256 hex digest, used as the store fingerprint.
     */
    public static String fingerprint(String content) {
        return hex(sha256(content), Integer.MAX_VALUE);
    }

    /**
     * Stable short id for an entry of the given kind and text.
     */
    public static String entryId(String kind, String text) {
        return hex(sha256(kind + "|" + normalizeForFingerprint(text)), ENTRY_ID_BYTES);
    }

    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\r', ' ').replace('\n', ' ').trim();
    }

    public static String normalizeForFingerprint(String text) {
        return normalizeText(text).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLen - 3)) + "...";
    }

    /**
     * Fast O(n) file reference extraction without regex backtracking. Token
     * format: [A-Za-z0-9_./-]+ + '.' + known extension.
     */
    public static List<String> extractFileReferences(String content) {
        List<String> refs = new ArrayList<>();
        if (content == null) {
            return refs;
        }
        int tokenStart = -1;
        int length = content.length();
        for (int i = 0; i <= length; i++) {
            char ch = i < length ? content.charAt(i) : ' ';
            if (i < length && isFileTokenChar(ch)) {
                if (tokenStart < 0) {
                    tokenStart = i;
                }
                continue;
            }
            if (tokenStart >= 0) {
                appendIfFileReference(content, tokenStart, i, refs);
                tokenStart = -1;
            }
        }
        return refs;
    }

    private static void appendIfFileReference(String content, int start, int end, List<String> refs) {
        int effectiveEnd = trimTrailingDot(content, start, end);
        if (effectiveEnd <= start) {
            return;
        }

        int dotIndex = -1;
        for (int i = effectiveEnd - 1; i > start; i--) {
            if (content.charAt(i) == '.') {
                dotIndex = i;
                break;
            }
        }
        if (dotIndex <= start || dotIndex >= effectiveEnd - 1) {
            return;
        }
        if (!isKnownFileExtension(content, dotIndex + 1, effectiveEnd)) {
            return;
        }
        refs.add(content.substring(start, effectiveEnd));
    }

    private static int trimTrailingDot(String content, int start, int end) {
        int trimmedEnd = end;
        while (trimmedEnd > start && content.charAt(trimmedEnd - 1) == '.') {
            trimmedEnd--;
        }
        return trimmedEnd;
    }

    private static boolean isFileTokenChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
                || (ch >= 'A' && ch <= 'Z')
                || (ch >= '0' && ch <= '9')
                || ch == '_'
                || ch == '.'
                || ch == '/'
                || ch == '-';
    }

    private static boolean isKnownFileExtension(String content, int start, int end) {
        int length = end - start;
        return switch (length) {
        case 1 -> regionEquals(content, start, "c")
                || regionEquals(content, start, "h");
        case 2 -> regionEquals(content, start, "kt")
                || regionEquals(content, start, "md")
                || regionEquals(content, start, "ts")
                || regionEquals(content, start, "js")
                || regionEquals(content, start, "py")
                || regionEquals(content, start, "go")
                || regionEquals(content, start, "rs")
                || regionEquals(content, start, "rb")
                || regionEquals(content, start, "sh");
        case 3 -> regionEquals(content, start, "kts")
                || regionEquals(content, start, "xml")
                || regionEquals(content, start, "yml")
                || regionEquals(content, start, "txt")
                || regionEquals(content, start, "tsx")
                || regionEquals(content, start, "jsx")
                || regionEquals(content, start, "sql")
                || regionEquals(content, start, "cpp")
                || regionEquals(content, start, "css")
                || regionEquals(content, start, "vue");
        case 4 -> regionEquals(content, start, "java")
                || regionEquals(content, start, "yaml")
                || regionEquals(content, start, "json")
                || regionEquals(content, start, "html")
                || regionEquals(content, start, "toml");
        case 6 -> regionEquals(content, start, "groovy")
                || regionEquals(content, start, "gradle");
        case 10 -> regionEquals(content, start, "properties");
        default -> false;
        };
    }

    private static boolean regionEquals(String content, int start, String expected) {
        if (start < 0 || start + expected.length() > content.length()) {
            return false;
        }
        for (int i = 0; i < expected.length(); i++) {
            if (Character.toLowerCase(content.charAt(start + i)) != expected.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static byte[] sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest((content != null ? content : "").getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String hex(byte[] hash, int maxBytes) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < maxBytes && i < hash.length; i++) {
            sb.append(String.format("%02x", hash[i]));
        }
        return sb.toString();
    }
}
