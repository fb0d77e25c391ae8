package tech.scytalesystems.tiered_cache_starter.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1415h
 * <p>
 * GZIP + Base64 for invalidation messages.
 * <p>
 * A tag invalidation can fan out to thousands of keys, all of which travel in one message; the
 * key strings share long prefixes and compress well. For short key lists the CPU cost outweighs
 * the saving, which is why {@code app.cache.sync.compress-messages} is off by default.
 * <p>
 * Stateless and thread-safe.
 */
public final class CompressionUtil {
    private static final Logger log = LoggerFactory.getLogger(CompressionUtil.class);

    private static final int BUFFER_SIZE = 4096;

    private CompressionUtil() {
    }

    /**
     * Compresses a string using GZIP and encodes it to Base64.
     *
     * @throws IllegalArgumentException if input is null
     * @throws UncheckedIOException if compression fails
     */
    public static String compress(String str) {
        if (str == null) throw new IllegalArgumentException("Input string cannot be null");

        if (str.isEmpty()) return "";

        try (ByteArrayOutputStream byteOutput = new ByteArrayOutputStream();
             GZIPOutputStream gzipOutput = new GZIPOutputStream(byteOutput)) {

            byte[] inputBytes = str.getBytes(StandardCharsets.UTF_8);
            gzipOutput.write(inputBytes);

            // Writes the GZIP trailer
            gzipOutput.finish();

            byte[] compressedBytes = byteOutput.toByteArray();

            if (log.isTraceEnabled()) {
                log.trace("Compressed message: {} bytes → {} bytes", inputBytes.length, compressedBytes.length);
            }

            return Base64.getEncoder().encodeToString(compressedBytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress string (length: " + str.length() + ")", e);
        }
    }

    /**
     * Decodes a Base64 string and decompresses the GZIP payload.
     *
     * @throws IllegalArgumentException if input is null or not Base64
     * @throws UncheckedIOException if the payload is not GZIP
     */
    public static String decompress(String compressed) {
        if (compressed == null) throw new IllegalArgumentException("Input string cannot be null");

        if (compressed.isEmpty()) return "";

        byte[] compressedBytes;
        try {
            compressedBytes = Base64.getDecoder().decode(compressed);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Base64 input: " + e.getMessage(), e);
        }

        try (ByteArrayInputStream byteInput = new ByteArrayInputStream(compressedBytes);
             GZIPInputStream gzipInput = new GZIPInputStream(byteInput);
             ByteArrayOutputStream byteOutput = new ByteArrayOutputStream()) {

            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;

            while ((bytesRead = gzipInput.read(buffer)) != -1) {
                byteOutput.write(buffer, 0, bytesRead);
            }

            return byteOutput.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decompress string (length: " + compressed.length() + ")", e);
        }
    }
}
