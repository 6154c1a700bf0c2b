package org.railyard.pipeline.data.codecs;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.IChunkWriteSession;
import org.railyard.pipeline.api.data.IDataCodec;
import org.railyard.pipeline.api.data.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-layout binary table format ({@code .rtab}).
 * <p>
 * Layout:
 * <pre>
 * "RTAB" | int version | int numColumns | long numRows | numColumns x string name
 * column 0: numRows x double | column 1: numRows x double | ...
 * </pre>
 * Because every cell sits at a computable offset, a streamed write pre-sizes the file once
 * and then lets any worker write any row range in place.
 */
public final class ColumnarTableCodec implements IDataCodec<Table> {

    public static final byte[] MAGIC = BinaryFiles.magic("RTAB");
    static final int VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(ColumnarTableCodec.class);

    record Header(List<String> columns, long numRows, long dataOffset) {

        long columnOffset(int column, long row) {
            return dataOffset + ((long) column * numRows + row) * Double.BYTES;
        }
    }

    @Override
    public String getName() {
        return "rtab";
    }

    @Override
    public String getFileExtension() {
        return "rtab";
    }

    @Override
    public Class<Table> getDataType() {
        return Table.class;
    }

    @Override
    public Table read(Path path) throws IOException {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            Header header = readHeader(in, path);
            int rows = BinaryFiles.checkedRows(0, header.numRows(), header.numRows(), path);
            LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
            for (String name : header.columns()) {
                columns.put(name, BinaryFiles.readDoubles(in, rows));
            }
            return Table.of(columns);
        }
    }

    @Override
    public void write(Table data, Path path) throws IOException {
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
            writeHeader(out, data.columnNames(), data.numRows());
            for (String name : data.columnNames()) {
                BinaryFiles.writeDoubles(out, data.column(name));
            }
        }
    }

    @Override
    public long length(Path path) throws IOException {
        return readHeader(path).numRows();
    }

    @Override
    public List<String> readColumnNames(Path path) throws IOException {
        return readHeader(path).columns();
    }

    @Override
    public Table readRange(Path path, long start, long end) throws IOException {
        Header header = readHeader(path);
        int rows = BinaryFiles.checkedRows(start, end, header.numRows(), path);
        LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            for (int c = 0; c < header.columns().size(); c++) {
                columns.put(header.columns().get(c), BinaryFiles.readDoubles(channel, header.columnOffset(c, start), rows));
            }
        }
        return Table.of(columns);
    }

    @Override
    public IChunkWriteSession<Table> initializeWrite(Path path, Table template, long totalLength, ICommunicator comm)
            throws IOException {
        List<String> columns = template.columnNames();
        long dataOffset = headerSize(columns);
        boolean coordinator = comm == null || comm.rank() == 0;
        if (coordinator) {
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
                writeHeader(out, columns, totalLength);
            }
            try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "rw")) {
                file.setLength(dataOffset + (long) columns.size() * totalLength * Double.BYTES);
            }
            log.debug("Allocated {} rows x {} columns in {}", totalLength, columns.size(), path);
        }
        if (comm != null && comm.size() > 1) {
            comm.barrier();
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE);
        return new Session(path, new Header(columns, totalLength, dataOffset), channel);
    }

    private static Header readHeader(Path path) throws IOException {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            return readHeader(in, path);
        }
    }

    private static Header readHeader(DataInputStream in, Path path) throws IOException {
        BinaryFiles.checkMagic(in, MAGIC, path);
        int version = in.readInt();
        if (version != VERSION) {
            throw new IOException("Unsupported rtab version " + version + " in " + path);
        }
        int numColumns = in.readInt();
        long numRows = in.readLong();
        List<String> columns = BinaryFiles.readStrings(in, numColumns);
        return new Header(List.copyOf(columns), numRows, headerSize(columns));
    }

    private static void writeHeader(DataOutputStream out, List<String> columns, long numRows) throws IOException {
        out.write(MAGIC);
        out.writeInt(VERSION);
        out.writeInt(columns.size());
        out.writeLong(numRows);
        for (String name : columns) {
            BinaryFiles.writeString(out, name);
        }
    }

    private static long headerSize(List<String> columns) {
        return MAGIC.length + 4 + 4 + 8 + BinaryFiles.stringsSize(columns);
    }

    private static final class Session implements IChunkWriteSession<Table> {

        private final Path path;
        private final Header header;
        private final FileChannel channel;
        private boolean finalized;

        Session(Path path, Header header, FileChannel channel) {
            this.path = path;
            this.header = header;
            this.channel = channel;
        }

        @Override
        public void writeChunk(Table data, long start, long end) throws IOException {
            if (finalized) {
                throw new IllegalStateException("Write session for " + path + " is already finalized");
            }
            int rows = BinaryFiles.checkedRows(start, end, header.numRows(), path);
            if (data.numRows() != rows) {
                throw new IllegalArgumentException(String.format(
                        "Chunk [%d, %d) carries %d rows", start, end, data.numRows()));
            }
            if (!data.columnNames().equals(header.columns())) {
                throw new IllegalArgumentException(String.format(
                        "Chunk columns %s do not match file columns %s", data.columnNames(), header.columns()));
            }
            for (int c = 0; c < header.columns().size(); c++) {
                double[] values = data.column(header.columns().get(c));
                BinaryFiles.writeDoubles(channel, header.columnOffset(c, start), values, 0, rows);
            }
        }

        @Override
        public void finalizeWrite() throws IOException {
            if (finalized) {
                return;
            }
            finalized = true;
            try {
                channel.force(false);
            } finally {
                channel.close();
            }
        }

        @Override
        public boolean isFinalized() {
            return finalized;
        }

        @Override
        public Path getPath() {
            return path;
        }

        @Override
        public long getTotalLength() {
            return header.numRows();
        }
    }
}
