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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.IChunkWriteSession;
import org.railyard.pipeline.api.data.IDataCodec;
import org.railyard.pipeline.api.data.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-layout binary ensemble format ({@code .rens}).
 * <p>
 * Layout:
 * <pre>
 * "RENS" | int version | int gridSize | long numDistributions | int numAncil | numAncil x string name
 * grid: gridSize x double
 * densities: numDistributions x gridSize x double (row-major)
 * ancil column 0: numDistributions x double | ancil column 1: ...
 * </pre>
 */
public final class EnsembleCodec implements IDataCodec<Ensemble> {

    public static final byte[] MAGIC = BinaryFiles.magic("RENS");
    static final int VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(EnsembleCodec.class);

    record Header(int gridSize, long size, List<String> ancil, long gridOffset) {

        long densityOffset(long row) {
            return gridOffset + (long) gridSize * Double.BYTES + row * gridSize * Double.BYTES;
        }

        long ancilOffset(int column, long row) {
            return densityOffset(size) + ((long) column * size + row) * Double.BYTES;
        }
    }

    @Override
    public String getName() {
        return "rens";
    }

    @Override
    public String getFileExtension() {
        return "rens";
    }

    @Override
    public Class<Ensemble> getDataType() {
        return Ensemble.class;
    }

    @Override
    public Ensemble read(Path path) throws IOException {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            return readFrom(in, path);
        }
    }

    @Override
    public void write(Ensemble data, Path path) throws IOException {
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
            writeTo(out, data);
        }
    }

    @Override
    public long length(Path path) throws IOException {
        return readHeader(path).size();
    }

    @Override
    public Ensemble readRange(Path path, long start, long end) throws IOException {
        Header header = readHeader(path);
        int rows = BinaryFiles.checkedRows(start, end, header.size(), path);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            double[] grid = BinaryFiles.readDoubles(channel, header.gridOffset(), header.gridSize());
            double[] flat = BinaryFiles.readDoubles(channel, header.densityOffset(start), rows * header.gridSize());
            double[][] densities = unflatten(flat, rows, header.gridSize());
            Table ancil = null;
            if (!header.ancil().isEmpty()) {
                LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
                for (int c = 0; c < header.ancil().size(); c++) {
                    columns.put(header.ancil().get(c), BinaryFiles.readDoubles(channel, header.ancilOffset(c, start), rows));
                }
                ancil = Table.of(columns);
            }
            return new Ensemble(grid, densities, ancil);
        }
    }

    @Override
    public List<String> readColumnNames(Path path) throws IOException {
        return readHeader(path).ancil();
    }

    @Override
    public IChunkWriteSession<Ensemble> initializeWrite(Path path, Ensemble template, long totalLength, ICommunicator comm)
            throws IOException {
        List<String> ancil = template.ancilColumns();
        double[] grid = template.getGrid();
        Header header = new Header(grid.length, totalLength, ancil, headerSize(ancil));
        boolean coordinator = comm == null || comm.rank() == 0;
        if (coordinator) {
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
                writeHeader(out, grid.length, totalLength, ancil);
                BinaryFiles.writeDoubles(out, grid);
            }
            try (RandomAccessFile file = new RandomAccessFile(path.toFile(), "rw")) {
                file.setLength(header.ancilOffset(ancil.size(), 0));
            }
            log.debug("Allocated {} distributions on a {}-point grid in {}", totalLength, grid.length, path);
        }
        if (comm != null && comm.size() > 1) {
            comm.barrier();
        }
        return new Session(path, header, grid, FileChannel.open(path, StandardOpenOption.WRITE));
    }

    /**
     * Serializes an ensemble sequentially in this format. Also used inside ensemble dictionaries.
     */
    static void writeTo(DataOutputStream out, Ensemble data) throws IOException {
        List<String> ancil = data.ancilColumns();
        writeHeader(out, data.gridSize(), data.size(), ancil);
        BinaryFiles.writeDoubles(out, data.getGrid());
        for (int i = 0; i < data.size(); i++) {
            BinaryFiles.writeDoubles(out, data.density(i));
        }
        for (String name : ancil) {
            BinaryFiles.writeDoubles(out, data.getAncil().column(name));
        }
    }

    static Ensemble readFrom(DataInputStream in, Path source) throws IOException {
        Header header = readHeader(in, source);
        int rows = BinaryFiles.checkedRows(0, header.size(), header.size(), source);
        double[] grid = BinaryFiles.readDoubles(in, header.gridSize());
        double[][] densities = new double[rows][];
        for (int i = 0; i < rows; i++) {
            densities[i] = BinaryFiles.readDoubles(in, header.gridSize());
        }
        Table ancil = null;
        if (!header.ancil().isEmpty()) {
            LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
            for (String name : header.ancil()) {
                columns.put(name, BinaryFiles.readDoubles(in, rows));
            }
            ancil = Table.of(columns);
        }
        return new Ensemble(grid, densities, ancil);
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
            throw new IOException("Unsupported rens version " + version + " in " + path);
        }
        int gridSize = in.readInt();
        long size = in.readLong();
        int numAncil = in.readInt();
        List<String> ancil = List.copyOf(BinaryFiles.readStrings(in, numAncil));
        return new Header(gridSize, size, ancil, headerSize(ancil));
    }

    private static void writeHeader(DataOutputStream out, int gridSize, long size, List<String> ancil) throws IOException {
        out.write(MAGIC);
        out.writeInt(VERSION);
        out.writeInt(gridSize);
        out.writeLong(size);
        out.writeInt(ancil.size());
        for (String name : ancil) {
            BinaryFiles.writeString(out, name);
        }
    }

    private static long headerSize(List<String> ancil) {
        return MAGIC.length + 4 + 4 + 8 + 4 + BinaryFiles.stringsSize(ancil);
    }

    private static double[][] unflatten(double[] flat, int rows, int width) {
        double[][] result = new double[rows][];
        for (int i = 0; i < rows; i++) {
            result[i] = Arrays.copyOfRange(flat, i * width, (i + 1) * width);
        }
        return result;
    }

    private static final class Session implements IChunkWriteSession<Ensemble> {

        private final Path path;
        private final Header header;
        private final double[] grid;
        private final FileChannel channel;
        private boolean finalized;

        Session(Path path, Header header, double[] grid, FileChannel channel) {
            this.path = path;
            this.header = header;
            this.grid = grid;
            this.channel = channel;
        }

        @Override
        public void writeChunk(Ensemble data, long start, long end) throws IOException {
            if (finalized) {
                throw new IllegalStateException("Write session for " + path + " is already finalized");
            }
            int rows = BinaryFiles.checkedRows(start, end, header.size(), path);
            if (data.size() != rows) {
                throw new IllegalArgumentException(String.format(
                        "Chunk [%d, %d) carries %d distributions", start, end, data.size()));
            }
            if (!Arrays.equals(data.getGrid(), grid)) {
                throw new IllegalArgumentException("Chunk grid does not match the grid of " + path);
            }
            if (!data.ancilColumns().equals(header.ancil())) {
                throw new IllegalArgumentException(String.format(
                        "Chunk ancillary columns %s do not match file columns %s", data.ancilColumns(), header.ancil()));
            }
            int width = header.gridSize();
            double[] flat = new double[rows * width];
            for (int i = 0; i < rows; i++) {
                System.arraycopy(data.density(i), 0, flat, i * width, width);
            }
            BinaryFiles.writeDoubles(channel, header.densityOffset(start), flat, 0, flat.length);
            for (int c = 0; c < header.ancil().size(); c++) {
                double[] values = data.getAncil().column(header.ancil().get(c));
                BinaryFiles.writeDoubles(channel, header.ancilOffset(c, start), values, 0, rows);
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
            return header.size();
        }
    }
}
