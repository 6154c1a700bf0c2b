package org.railyard.pipeline.data.codecs;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Low-level helpers shared by the fixed-layout binary codecs.
 * <p>
 * All numbers are big-endian. Strings are stored as a 4-byte length followed by UTF-8 bytes.
 */
final class BinaryFiles {

    /** Values per buffer when streaming large double arrays through a channel. */
    private static final int BLOCK = 8192;

    private BinaryFiles() {
    }

    static byte[] magic(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Reads the first {@code n} bytes of a file, fewer if the file is shorter.
     */
    static byte[] peek(Path path, int n) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return in.readNBytes(n);
        }
    }

    static void checkMagic(DataInputStream in, byte[] expected, Path path) throws IOException {
        byte[] actual = new byte[expected.length];
        try {
            in.readFully(actual);
        } catch (EOFException e) {
            throw new IOException("File too short to be a " + new String(expected, StandardCharsets.US_ASCII) + " file: " + path, e);
        }
        if (!Arrays.equals(actual, expected)) {
            throw new IOException(String.format("Not a %s file (bad magic bytes): %s",
                    new String(expected, StandardCharsets.US_ASCII), path));
        }
    }

    static void writeString(DataOutputStream out, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    static String readString(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new IOException("Negative string length " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static List<String> readStrings(DataInputStream in, int count) throws IOException {
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(readString(in));
        }
        return names;
    }

    /**
     * @return encoded size of the given strings
     */
    static long stringsSize(List<String> values) {
        long size = 0;
        for (String v : values) {
            size += 4 + v.getBytes(StandardCharsets.UTF_8).length;
        }
        return size;
    }

    static void writeDoubles(DataOutputStream out, double[] values) throws IOException {
        for (double v : values) {
            out.writeDouble(v);
        }
    }

    static double[] readDoubles(DataInputStream in, int count) throws IOException {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = in.readDouble();
        }
        return values;
    }

    /**
     * Writes {@code count} values starting at {@code from} to the channel at {@code position}.
     */
    static void writeDoubles(FileChannel channel, long position, double[] values, int from, int count) throws IOException {
        int done = 0;
        while (done < count) {
            int n = Math.min(BLOCK, count - done);
            ByteBuffer buffer = ByteBuffer.allocate(n * Double.BYTES);
            buffer.asDoubleBuffer().put(values, from + done, n);
            long pos = position + (long) done * Double.BYTES;
            while (buffer.hasRemaining()) {
                pos += channel.write(buffer, pos);
            }
            done += n;
        }
    }

    /**
     * Reads {@code count} values from the channel at {@code position}.
     */
    static double[] readDoubles(FileChannel channel, long position, int count) throws IOException {
        double[] values = new double[count];
        int done = 0;
        while (done < count) {
            int n = Math.min(BLOCK, count - done);
            ByteBuffer buffer = ByteBuffer.allocate(n * Double.BYTES);
            long pos = position + (long) done * Double.BYTES;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, pos);
                if (read < 0) {
                    throw new EOFException("Unexpected end of file at offset " + pos);
                }
                pos += read;
            }
            buffer.flip();
            buffer.asDoubleBuffer().get(values, done, n);
            done += n;
        }
        return values;
    }

    static int checkedRows(long start, long end, long total, Path path) {
        if (start < 0 || end < start || end > total) {
            throw new IndexOutOfBoundsException(String.format(
                    "Range [%d, %d) outside %d rows of %s", start, end, total, path));
        }
        long rows = end - start;
        if (rows > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Range of " + rows + " rows is too large for one chunk");
        }
        return (int) rows;
    }
}
