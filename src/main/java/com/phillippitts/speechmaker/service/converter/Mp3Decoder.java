package com.phillippitts.speechmaker.service.converter;

import javazoom.jl.decoder.Bitstream;
import javazoom.jl.decoder.BitstreamException;
import javazoom.jl.decoder.Decoder;
import javazoom.jl.decoder.DecoderException;
import javazoom.jl.decoder.Header;
import javazoom.jl.decoder.SampleBuffer;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes an MPEG audio file (what edge-tts writes) to 16-bit little-endian PCM using JLayer.
 * A leading ID3v2 tag is skipped by the bitstream reader.
 */
final class Mp3Decoder {

    private static final int BITS_PER_SAMPLE = 16;

    /** Layout and byte count of the PCM written for one input. */
    record Decoded(WavFormat format, long dataLength) {
    }

    private Mp3Decoder() {
    }

    /**
     * True for an ID3v2 tag or an MPEG frame sync at the start of the file.
     */
    static boolean isMpeg(byte[] head, int length) {
        if (length >= 3 && head[0] == 'I' && head[1] == 'D' && head[2] == '3') {
            return true;
        }
        return length >= 2 && (head[0] & 0xFF) == 0xFF && (head[1] & 0xE0) == 0xE0;
    }

    /**
     * Decodes every frame of {@code input} and appends the samples to {@code out}.
     *
     * @throws IOException if the file cannot be read, holds no frames, or changes format mid-stream
     */
    static Decoded decode(Path input, WritableByteChannel out) throws IOException {
        WavFormat format = null;
        long written = 0;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(input))) {
            Bitstream bitstream = new Bitstream(in);
            Decoder decoder = new Decoder();
            Header header;
            while ((header = bitstream.readFrame()) != null) {
                SampleBuffer samples = (SampleBuffer) decoder.decodeFrame(header, bitstream);
                WavFormat frameFormat = new WavFormat(samples.getChannelCount(), samples.getSampleFrequency(),
                        BITS_PER_SAMPLE);
                if (format == null) {
                    format = frameFormat;
                } else if (!format.equals(frameFormat)) {
                    throw new IOException(input.getFileName() + " changes format mid-stream");
                }
                written += write(samples, out);
                bitstream.closeFrame();
            }
        } catch (BitstreamException | DecoderException e) {
            throw new IOException("undecodable MPEG audio in " + input.getFileName() + ": " + e.getMessage(), e);
        }
        if (format == null) {
            throw new IOException(input.getFileName() + " contains no MPEG audio frames");
        }
        return new Decoded(format, written);
    }

    private static int write(SampleBuffer samples, WritableByteChannel out) throws IOException {
        short[] pcm = samples.getBuffer();
        int count = samples.getBufferLength();
        ByteBuffer buf = ByteBuffer.allocate(count * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < count; i++) {
            buf.putShort(pcm[i]);
        }
        buf.flip();
        while (buf.hasRemaining()) {
            out.write(buf);
        }
        return count * 2;
    }
}
