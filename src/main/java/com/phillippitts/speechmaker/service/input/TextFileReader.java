package com.phillippitts.speechmaker.service.input;

import com.phillippitts.speechmaker.config.properties.ConversionProperties;
import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.InvalidInputException;
import com.phillippitts.speechmaker.exception.SpeechMakerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads source text files for conversion.
 *
 * <p>Accepts UTF-8 {@code .txt} files up to {@code conversion.max-text-file-size-bytes}. Checks run
 * in this order: exists, not a directory, extension, size, readable, non-blank content.
 * Filesystem failures surface as {@link java.nio.file.FileSystemException} subtypes so the error
 * classifier can map them to ENOENT / EACCES.
 */
@Component
public class TextFileReader {

    private static final Logger LOG = LogManager.getLogger(TextFileReader.class);

    static final String SUPPORTED_EXTENSION = ".txt";
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final ConversionProperties properties;

    public TextFileReader(ConversionProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * @return file content, never blank
     * @throws NoSuchFileException if the file does not exist
     * @throws AccessDeniedException if the file cannot be read
     * @throws InvalidInputException for directories, unsupported types, oversized or empty files
     * @throws IOException for other read failures
     */
    public String read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        if (Files.isDirectory(file)) {
            throw new InvalidInputException("Is a directory: " + file.getFileName(), ErrorCodes.EISDIR);
        }

        String extension = extensionOf(file);
        if (!SUPPORTED_EXTENSION.equals(extension)) {
            throw new InvalidInputException("Unsupported file type: " + (extension.isEmpty() ? "(none)" : extension)
                    + ". Only .txt files are supported.", ErrorCodes.UNSUPPORTED_FILE_TYPE);
        }

        long size = Files.size(file);
        long max = properties.getMaxTextFileSizeBytes();
        if (size > max) {
            throw new InvalidInputException(String.format(Locale.ROOT,
                    "File too large: %.2fMB. Maximum size is %dMB.", size / BYTES_PER_MB,
                    Math.round(max / BYTES_PER_MB)), ErrorCodes.FILE_TOO_LARGE);
        }
        if (!Files.isReadable(file)) {
            throw new AccessDeniedException(file.toString());
        }

        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            throw new SpeechMakerException("Unsupported file type: " + file.getFileName()
                    + " is not valid UTF-8 text", ErrorCodes.UNSUPPORTED_FILE_TYPE, e);
        }
        if (text.isBlank()) {
            throw new InvalidInputException("File is empty or contains no readable text", ErrorCodes.EMPTY_INPUT);
        }
        LOG.info("Read {} ({} bytes, {} chars)", file.getFileName(), size, text.length());
        return text;
    }

    static String extensionOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
