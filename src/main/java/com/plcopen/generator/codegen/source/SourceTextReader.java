package com.plcopen.generator.codegen.source;

import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcopen.generator.codegen.model.input.SourceLocation;

/**
 * Reads the exact source text a location spans. File contents are cached for the lifetime
 * of the reader, so each file is read at most once per run.
 */
public class SourceTextReader {

    private static final Logger log = LoggerFactory.getLogger(SourceTextReader.class);

    private final Path baseDir;
    private final Map<Path, byte[]> cache = new HashMap<>();

    public SourceTextReader() {
        this(null);
    }

    /**
     * @param baseDir directory relative file names are resolved against; {@code null} for the working directory
     */
    public SourceTextReader(Path baseDir) {
        this.baseDir = baseDir;
    }

    /**
     * Text of the byte range, decoded as UTF-8. Empty when the location is not a byte range
     * of a file or has a negative length.
     *
     * @throws IOException if the file cannot be read or the range runs past its end
     */
    public Optional<String> read(SourceLocation location) throws IOException {
        if (location == null || !location.isFileRange()) {
            return Optional.empty();
        }

        Path file = resolve(location.getFileName());
        byte[] bytes = load(file);

        long start = location.getStartOffset();
        long end = location.getEndOffset();
        if (end > bytes.length) {
            throw new EOFException("Range " + start + ".." + end + " exceeds " + file + " (" + bytes.length + " bytes)");
        }
        return Optional.of(new String(bytes, (int) start, (int) (end - start), StandardCharsets.UTF_8));
    }

    private Path resolve(String fileName) {
        Path path = Path.of(fileName);
        return baseDir == null || path.isAbsolute() ? path : baseDir.resolve(path);
    }

    private byte[] load(Path file) throws IOException {
        byte[] bytes = cache.get(file);
        if (bytes == null) {
            log.debug("Reading source file {}", file);
            bytes = Files.readAllBytes(file);
            cache.put(file, bytes);
        }
        return bytes;
    }
}
