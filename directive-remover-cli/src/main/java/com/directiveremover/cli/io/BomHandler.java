package com.directiveremover.cli.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes UTF-8 source files, remembering whether they started with a byte-order mark.
 */
public final class BomHandler {

    static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    /** File content with the BOM stripped. */
    public record DecodedText(String content, boolean hasBom) {}

    private BomHandler() {}

    public static DecodedText read(Path path) throws IOException {
        return decode(Files.readAllBytes(path));
    }

    public static DecodedText decode(byte[] bytes) {
        boolean hasBom = bytes.length >= 3
            && bytes[0] == UTF8_BOM[0]
            && bytes[1] == UTF8_BOM[1]
            && bytes[2] == UTF8_BOM[2];
        String content = hasBom
            ? new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8)
            : new String(bytes, StandardCharsets.UTF_8);
        return new DecodedText(content, hasBom);
    }

    public static void write(Path path, String content, boolean includeBom) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            if (includeBom) {
                out.write(UTF8_BOM);
            }
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
    }
}
