package org.railyard.pipeline.data.codecs;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.IChunkWriteSession;
import org.railyard.pipeline.api.data.IDataCodec;
import org.railyard.pipeline.api.data.Table;

import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * Key-columnar JSON table format: one object whose members are the columns, in order.
 * <pre>
 * {"id": [1.0, 2.0], "redshift": [0.31, 1.2]}
 * </pre>
 * Non-finite values are written as the bare tokens {@code NaN}, {@code Infinity} and
 * {@code -Infinity}. The format is whole-file: range reads parse the full file, and a
 * streamed write buffers all chunks until it is finalized.
 */
public final class JsonTableCodec implements IDataCodec<Table> {

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public Class<Table> getDataType() {
        return Table.class;
    }

    @Override
    public Table read(Path path) throws IOException {
        try (JsonReader reader = newReader(path)) {
            LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
            reader.beginObject();
            while (reader.hasNext()) {
                String name = reader.nextName();
                columns.put(name, readArray(reader));
            }
            reader.endObject();
            return Table.of(columns);
        }
    }

    @Override
    public void write(Table data, Path path) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             JsonWriter writer = new JsonWriter(out)) {
            writer.setStrictness(Strictness.LENIENT);
            writer.beginObject();
            for (String name : data.columnNames()) {
                writer.name(name).beginArray();
                for (double v : data.column(name)) {
                    writer.value(v);
                }
                writer.endArray();
            }
            writer.endObject();
        }
    }

    @Override
    public long length(Path path) throws IOException {
        try (JsonReader reader = newReader(path)) {
            reader.beginObject();
            if (!reader.hasNext()) {
                return 0;
            }
            reader.nextName();
            return readArray(reader).length;
        }
    }

    @Override
    public List<String> readColumnNames(Path path) throws IOException {
        try (JsonReader reader = newReader(path)) {
            List<String> names = new ArrayList<>();
            reader.beginObject();
            while (reader.hasNext()) {
                names.add(reader.nextName());
                reader.skipValue();
            }
            return names;
        }
    }

    /**
     * Parses the whole file and slices it. Handles read JSON tables once instead, see
     * {@link #supportsChunkedRead()}.
     */
    @Override
    public Table readRange(Path path, long start, long end) throws IOException {
        Table table = read(path);
        BinaryFiles.checkedRows(start, end, table.numRows(), path);
        return table.slice((int) start, (int) end);
    }

    @Override
    public IChunkWriteSession<Table> initializeWrite(Path path, Table template, long totalLength, ICommunicator comm) {
        return new BufferedWriteSession<>(path, totalLength, Table.empty(template.columnNames()), Table::concat, this::write);
    }

    @Override
    public boolean supportsChunkedRead() {
        return false;
    }

    @Override
    public boolean supportsParallelWrite() {
        return false;
    }

    private static JsonReader newReader(Path path) throws IOException {
        BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        JsonReader reader = new JsonReader(in);
        reader.setStrictness(Strictness.LENIENT);
        return reader;
    }

    private static double[] readArray(JsonReader reader) throws IOException {
        DoubleArrayList values = new DoubleArrayList();
        reader.beginArray();
        while (reader.hasNext()) {
            if (reader.peek() == JsonToken.NULL) {
                reader.nextNull();
                values.add(Double.NaN);
            } else {
                values.add(reader.nextDouble());
            }
        }
        reader.endArray();
        return values.toDoubleArray();
    }
}
