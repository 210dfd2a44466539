package com.phillippitts.speechmaker.service.converter;

import com.phillippitts.speechmaker.exception.ErrorCodes;
import com.phillippitts.speechmaker.exception.SpeechMakerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-process merge of chunk audio into one PCM WAV, used when no external converter is available.
 *
 * <p>Inputs are PCM WAV files or MPEG audio files (the voice engine's native output), which are
 * decoded by {@link Mp3Decoder}. All inputs must end up with the same channels, sample rate and bit
 * depth. The output gets a rebuilt 44-byte RIFF header followed by the samples of the inputs in
 * list order; other WAV chunks (LIST, fact, ...) are dropped. A failed merge leaves no output file.
 */
@Component
public class WavConcatenator {

    private static final Logger LOG = LogManager.getLogger(WavConcatenator.class);

    private static final int RIFF_HEADER_SIZE = 12;
    private static final int CHUNK_HEADER_SIZE = 8;
    private static final int FMT_CHUNK_MIN_SIZE = 16;
    private static final int SNIFF_BYTES = 4;
    private static final long MAX_DATA_BYTES = 0xFFFFFFFFL - 36;

    /** Where the PCM payload of one input lives. */
    record WavSource(Path path, WavFormat format, long dataOffset, long dataLength) {
    }

    /**
     * Concatenates the inputs into {@code output}, overwriting it.
     *
     * @throws SpeechMakerException with {@code MERGE_FAILED} if an input is neither PCM WAV nor
     *         decodable MPEG audio, the formats differ, or I/O fails
     */
    public Path concat(List<Path> orderedInputs, Path output) {
        Objects.requireNonNull(output, "output");
        if (orderedInputs == null || orderedInputs.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }

        WavFormat format = null;
        long totalData = 0;
        boolean done = false;
        try (FileChannel out = FileChannel.open(output, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            out.position(WavFormat.HEADER_SIZE);
            for (Path input : orderedInputs) {
                WavFormat inputFormat;
                if (isMpeg(input)) {
                    Mp3Decoder.Decoded decoded = decodeMpeg(input, out);
                    inputFormat = decoded.format();
                    totalData += decoded.dataLength();
                } else {
                    WavSource source = inspect(input);
                    inputFormat = source.format();
                    if (format != null && !format.equals(inputFormat)) {
                        throw formatMismatch(input, inputFormat, format);
                    }
                    copyData(source, out);
                    totalData += source.dataLength();
                }
                if (format == null) {
                    format = inputFormat;
                } else if (!format.equals(inputFormat)) {
                    throw formatMismatch(input, inputFormat, format);
                }
                if (totalData > MAX_DATA_BYTES) {
                    throw mergeFailed("merged audio exceeds the 4GB WAV limit", null);
                }
            }
            ByteBuffer header = header(format, totalData);
            long pos = 0;
            while (header.hasRemaining()) {
                pos += out.write(header, pos);
            }
            done = true;
        } catch (IOException e) {
            throw mergeFailed("cannot write " + output.getFileName() + ": " + e.getMessage(), e);
        } finally {
            if (!done) {
                deletePartial(output);
            }
        }
        LOG.info("Merged {} audio files into {} ({} data bytes, {})", orderedInputs.size(), output.getFileName(),
                totalData, format);
        return output;
    }

    private static boolean isMpeg(Path input) {
        byte[] head = new byte[SNIFF_BYTES];
        int n = 0;
        try (InputStream in = Files.newInputStream(input)) {
            while (n < head.length) {
                int r = in.read(head, n, head.length - n);
                if (r < 0) {
                    break;
                }
                n += r;
            }
        } catch (IOException e) {
            throw mergeFailed("cannot read " + input.getFileName() + ": " + e.getMessage(), e);
        }
        return Mp3Decoder.isMpeg(head, n);
    }

    private static Mp3Decoder.Decoded decodeMpeg(Path input, FileChannel out) {
        try {
            return Mp3Decoder.decode(input, out);
        } catch (IOException e) {
            throw mergeFailed(e.getMessage(), e);
        }
    }

    private static void deletePartial(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            LOG.warn("Could not delete partial merge output {}: {}", output, e.toString());
        }
    }

    /**
     * Reads the RIFF structure of a file without loading its samples.
     */
    static WavSource inspect(Path input) {
        try (FileChannel ch = FileChannel.open(input, StandardOpenOption.READ)) {
            long size = ch.size();
            ByteBuffer riff = read(ch, 0, RIFF_HEADER_SIZE);
            if (riff == null || !"RIFF".equals(fourCc(riff, 0)) || !"WAVE".equals(fourCc(riff, 8))) {
                throw mergeFailed(input.getFileName() + " is not a WAV or MP3 file", null);
            }

            WavFormat format = null;
            long pos = RIFF_HEADER_SIZE;
            while (pos + CHUNK_HEADER_SIZE <= size) {
                ByteBuffer chunk = read(ch, pos, CHUNK_HEADER_SIZE);
                String id = fourCc(chunk, 0);
                long chunkSize = Integer.toUnsignedLong(chunk.getInt(4));
                long body = pos + CHUNK_HEADER_SIZE;

                if ("fmt ".equals(id)) {
                    ByteBuffer fmt = chunkSize < FMT_CHUNK_MIN_SIZE ? null : read(ch, body, FMT_CHUNK_MIN_SIZE);
                    if (fmt == null) {
                        throw mergeFailed(input.getFileName() + " has a truncated fmt chunk", null);
                    }
                    int tag = Short.toUnsignedInt(fmt.getShort(0));
                    if (tag != WavFormat.PCM_FORMAT_TAG) {
                        throw mergeFailed(input.getFileName() + " is not PCM (format tag " + tag + ")", null);
                    }
                    format = new WavFormat(Short.toUnsignedInt(fmt.getShort(2)), fmt.getInt(4),
                            Short.toUnsignedInt(fmt.getShort(14)));
                } else if ("data".equals(id)) {
                    if (format == null) {
                        throw mergeFailed(input.getFileName() + " has data before fmt", null);
                    }
                    // Streaming writers leave the size at 0 or 0xFFFFFFFF; trust the file length then.
                    long available = size - body;
                    long length = chunkSize == 0 || chunkSize > available ? available : chunkSize;
                    return new WavSource(input, format, body, length);
                }
                pos = body + chunkSize + (chunkSize & 1);
            }
            throw mergeFailed(input.getFileName() + " has no data chunk", null);
        } catch (IOException e) {
            throw mergeFailed("cannot read " + input.getFileName() + ": " + e.getMessage(), e);
        }
    }

    static ByteBuffer header(WavFormat format, long dataLength) {
        ByteBuffer b = ByteBuffer.allocate(WavFormat.HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        b.put("RIFF".getBytes(StandardCharsets.US_ASCII));
        b.putInt((int) (36 + dataLength));
        b.put("WAVE".getBytes(StandardCharsets.US_ASCII));
        b.put("fmt ".getBytes(StandardCharsets.US_ASCII));
        b.putInt(FMT_CHUNK_MIN_SIZE);
        b.putShort((short) WavFormat.PCM_FORMAT_TAG);
        b.putShort((short) format.channels());
        b.putInt(format.sampleRate());
        b.putInt(format.byteRate());
        b.putShort((short) format.blockAlign());
        b.putShort((short) format.bitsPerSample());
        b.put("data".getBytes(StandardCharsets.US_ASCII));
        b.putInt((int) dataLength);
        b.flip();
        return b;
    }

    private static void copyData(WavSource source, FileChannel out) throws IOException {
        try (FileChannel in = FileChannel.open(source.path(), StandardOpenOption.READ)) {
            long position = source.dataOffset();
            long remaining = source.dataLength();
            while (remaining > 0) {
                long n = in.transferTo(position, remaining, out);
                if (n <= 0) {
                    throw new IOException("unexpected end of " + source.path().getFileName());
                }
                position += n;
                remaining -= n;
            }
        }
    }

    /** Reads exactly {@code length} bytes at {@code position}; null if the file is shorter. */
    private static ByteBuffer read(FileChannel ch, long position, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        long pos = position;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, pos);
            if (n < 0) {
                return null;
            }
            pos += n;
        }
        buf.flip();
        return buf;
    }

    private static String fourCc(ByteBuffer buf, int offset) {
        byte[] id = new byte[4];
        for (int i = 0; i < 4; i++) {
            id[i] = buf.get(offset + i);
        }
        return new String(id, StandardCharsets.US_ASCII);
    }

    private static SpeechMakerException formatMismatch(Path input, WavFormat found, WavFormat expected) {
        return mergeFailed("format mismatch in " + input.getFileName() + " (" + found + " vs " + expected + ")", null);
    }

    private static SpeechMakerException mergeFailed(String detail, Throwable cause) {
        return new SpeechMakerException("Audio merging failed: " + detail, ErrorCodes.MERGE_FAILED, cause);
    }
}
