package tech.scytalesystems.tiered_cache_starter.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1740h
 */
@DisplayName("CompressionUtil Tests")
class CompressionUtilTest {

    @Test
    @DisplayName("Should restore the original invalidation payload")
    void testCompressDecompressString() {
        String original = "{\"keys\":[\"user:1\",\"user:2\",\"user:3\"],\"action\":\"EVICT\",\"instanceId\":\"abc\"}";

        String compressed = CompressionUtil.compress(original);

        assertNotEquals(original, compressed);
        assertEquals(original, CompressionUtil.decompress(compressed));
    }

    @Test
    @DisplayName("Should handle empty string")
    void testEmptyString() {
        assertEquals("", CompressionUtil.compress(""));
        assertEquals("", CompressionUtil.decompress(""));
    }

    @Test
    @DisplayName("Should throw exception for null string compression")
    void testNullStringCompression() {
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.compress(null));
    }

    @Test
    @DisplayName("Should throw exception for null string decompression")
    void testNullStringDecompression() {
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.decompress(null));
    }

    @Test
    @DisplayName("Should reject input that is not Base64")
    void testInvalidBase64() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CompressionUtil.decompress("not base64!"));

        assertTrue(e.getMessage().startsWith("Invalid Base64 input"));
    }

    @Test
    @DisplayName("Should reject Base64 input that is not GZIP")
    void testNotGzip() {
        String plain = Base64.getEncoder().encodeToString("plain text".getBytes(StandardCharsets.UTF_8));

        assertThrows(UncheckedIOException.class, () -> CompressionUtil.decompress(plain));
    }

    @Test
    @DisplayName("Should handle large strings")
    void testLargeString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 1000; i++) {
            sb.append("user:").append(i).append(",");
        }
        String original = sb.toString();

        String compressed = CompressionUtil.compress(original);
        String decompressed = CompressionUtil.decompress(compressed);

        assertEquals(original, decompressed);
        assertTrue(compressed.length() < original.length() / 2);
    }

    @Test
    @DisplayName("Should preserve multi-byte characters")
    void testUnicode() {
        String original = "café:ключ:キー";

        assertEquals(original, CompressionUtil.decompress(CompressionUtil.compress(original)));
    }
}
