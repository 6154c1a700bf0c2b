package org.railyard.pipeline.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.railyard.junit.extensions.logging.LogWatchExtension;
import org.railyard.pipeline.api.data.Chunk;
import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.InvalidHandleOperationException;
import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.utils.compression.NoneCodec;
import org.railyard.pipeline.utils.compression.ZstdCodec;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DataHandleTest {

    @TempDir
    Path tempDir;

    @Test
    void iterator_slicesInMemoryDataEvenWithAPath() throws Exception {
        TableHandle handle = new TableHandle("x", "x.pq", "test");
        handle.setData(Table.of("a", 1, 2, 3, 4, 5), false);

        List<Chunk<Table>> chunks = new ArrayList<>();
        handle.iterator(2, 0, 1).forEachRemaining(chunks::add);

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0)).isEqualTo(new Chunk<>(0, 2, Table.of("a", 1, 2)));
        assertThat(chunks.get(1)).isEqualTo(new Chunk<>(2, 4, Table.of("a", 3, 4)));
        assertThat(chunks.get(2)).isEqualTo(new Chunk<>(4, 5, Table.of("a", 5)));
    }

    @Test
    void open_streamsRawFileWithoutCaching() throws Exception {
        Path file = tempDir.resolve("raw.rtab");
        TableHandle writer = new TableHandle("raw", file.toString(), "test");
        writer.setData(Table.of("a", 1, 2), false);
        writer.write();

        TableHandle reader = new TableHandle("raw", file.toString(), "test");
        try (InputStream in = reader.open()) {
            assertThat(in.readAllBytes()).isEqualTo(Files.readAllBytes(file));
        }
        assertThat(reader.hasData()).isFalse();

        assertThatThrownBy(() -> new TableHandle("nopath", null, "test").open())
                .isInstanceOf(InvalidHandleOperationException.class);
    }

    @Test
    void iterator_readsChunksFromFile() throws Exception {
        Path file = tempDir.resolve("t.rtab");
        TableHandle writer = new TableHandle("t", file.toString(), "test");
        writer.setData(Table.of("a", 1, 2, 3, 4, 5, 6, 7), false);
        writer.write();

        TableHandle reader = new TableHandle("t", file.toString(), "test");
        List<Chunk<Table>> rank1 = new ArrayList<>();
        reader.iterator(2, 1, 2).forEachRemaining(rank1::add);

        assertThat(reader.hasData()).isFalse();
        assertThat(rank1).extracting(Chunk::start).containsExactly(2L, 6L);
        assertThat(rank1.get(1).data().column("a")).containsExactly(7);
    }

    @Test
    void iterator_emptyWithoutDataAndPath() throws Exception {
        Iterator<Chunk<Table>> it = new TableHandle("x", null, "test").iterator(10, 0, 1);

        assertThat(it.hasNext()).isFalse();
    }

    @Test
    void size_prefersDataThenFile() throws Exception {
        Path file = tempDir.resolve("t.rtab");
        TableHandle handle = new TableHandle("t", file.toString(), "test");
        handle.setData(Table.of("a", 1, 2, 3), false);
        handle.write();

        assertThat(handle.size()).isEqualTo(3);
        handle.clearData();
        assertThat(handle.size()).isEqualTo(3);
        assertThat(new TableHandle("t", null, "test")).satisfies(h ->
                assertThatThrownBy(h::size).isInstanceOf(InvalidHandleOperationException.class));
    }

    @Test
    void read_requiresDataOrPath() {
        assertThatThrownBy(() -> new TableHandle("lonely", null, "test").read())
                .isInstanceOf(InvalidHandleOperationException.class)
                .hasMessageContaining("lonely");
    }

    @Test
    void write_requiresDataAndPath() {
        TableHandle noData = new TableHandle("t", tempDir.resolve("a.rtab").toString(), "test");
        TableHandle noPath = new TableHandle("t", null, "test");
        noPath.setData(Table.of("a", 1.0), false);

        assertThatThrownBy(noData::write).isInstanceOf(InvalidHandleOperationException.class);
        assertThatThrownBy(noPath::write).isInstanceOf(InvalidHandleOperationException.class);
    }

    @Test
    void setData_rejectsWrongPayloadType() {
        TableHandle handle = new TableHandle("t", null, "test");

        assertThatThrownBy(() -> handle.setData("not a table", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rtab");
    }

    @Test
    void chunkedWrite_assemblesFileAndFinalizeIsIdempotent() throws Exception {
        Path file = tempDir.resolve("out/streamed.rtab");
        TableHandle handle = new TableHandle("out", file.toString(), "test");
        handle.setData(Table.empty(List.of("a", "b")), true);
        handle.initializeWrite(4, null);

        handle.setData(Table.builder("a", "b").addRow(3, 30).addRow(4, 40).build(), true);
        handle.writeChunk(2, 4);
        handle.setData(Table.builder("a", "b").addRow(1, 10).addRow(2, 20).build(), true);
        handle.writeChunk(0, 2);
        handle.finalizeWrite();
        byte[] afterFirst = Files.readAllBytes(file);
        handle.finalizeWrite();

        assertThat(Files.readAllBytes(file)).isEqualTo(afterFirst);
        assertThat(handle.hasOpenSession()).isFalse();
        assertThat(handle.wasStreamed()).isTrue();
        Table written = new TableHandle("in", file.toString(), "test").read();
        assertThat(written.column("a")).containsExactly(1, 2, 3, 4);
        assertThat(written.column("b")).containsExactly(10, 20, 30, 40);
    }

    @Test
    void chunkedWrite_stateErrors() throws Exception {
        TableHandle handle = new TableHandle("out", tempDir.resolve("s.rtab").toString(), "test");

        assertThatThrownBy(() -> handle.initializeWrite(3, null)).isInstanceOf(InvalidHandleOperationException.class);
        assertThatThrownBy(() -> handle.writeChunk(0, 1)).isInstanceOf(InvalidHandleOperationException.class);
        assertThatThrownBy(handle::finalizeWrite).isInstanceOf(InvalidHandleOperationException.class);

        handle.setData(Table.empty(List.of("a")), true);
        handle.initializeWrite(3, null);
        assertThatThrownBy(() -> handle.initializeWrite(3, null))
                .isInstanceOf(InvalidHandleOperationException.class)
                .hasMessageContaining("already open");
        handle.setData(Table.of("a", 1.0, 2.0), true);
        assertThatThrownBy(() -> handle.writeChunk(2, 4)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void jsonTable_streamedWriteIsBufferedUntilFinalize() throws Exception {
        Path file = tempDir.resolve("summary.json");
        JsonTableHandle handle = new JsonTableHandle("summary", file.toString(), "test");
        handle.setData(Table.empty(List.of("x")), true);
        handle.initializeWrite(3, null);
        handle.setData(Table.of("x", 3.0), true);
        handle.writeChunk(2, 3);
        handle.setData(Table.of("x", 1.0, 2.0), true);
        handle.writeChunk(0, 2);

        assertThat(file).doesNotExist();
        handle.finalizeWrite();

        assertThat(new JsonTableHandle("s", file.toString(), "test").read().column("x")).containsExactly(1, 2, 3);
    }

    @Test
    void jsonTable_iteratorReadsTheFileOnce() throws Exception {
        Path file = tempDir.resolve("rows.json");
        JsonTableHandle writer = new JsonTableHandle("rows", file.toString(), "test");
        writer.setData(Table.of("x", 1, 2, 3, 4, 5), false);
        writer.write();

        JsonTableHandle reader = new JsonTableHandle("rows", file.toString(), "test");
        Iterator<Chunk<Table>> it = reader.iterator(2, 0, 1);
        assertThat(it.next()).isEqualTo(new Chunk<>(0, 2, Table.of("x", 1, 2)));
        assertThat(reader.hasData()).isTrue();

        Files.delete(file);
        List<Chunk<Table>> rest = new ArrayList<>();
        it.forEachRemaining(rest::add);
        assertThat(rest).extracting(Chunk::start).containsExactly(2L, 4L);
        assertThat(rest.get(1).data().column("x")).containsExactly(5);
    }

    @Test
    void columnNames_readFromHeaderWithoutLoadingData() throws Exception {
        Path file = tempDir.resolve("cols.rtab");
        TableHandle writer = new TableHandle("t", file.toString(), "test");
        writer.setData(Table.builder("ra", "dec", "mag").addRow(1, 2, 3).build(), false);
        writer.write();

        TableHandle reader = new TableHandle("t", file.toString(), "test");

        assertThat(reader.columnNames()).containsExactly("ra", "dec", "mag");
        assertThat(reader.hasData()).isFalse();
    }

    @Test
    void ensembleOrTable_detectsFormatAndRefusesWrites() throws Exception {
        Path ensFile = tempDir.resolve("e.rens");
        EnsembleHandle ens = new EnsembleHandle("e", ensFile.toString(), "test");
        Ensemble ensemble = new Ensemble(new double[] {0, 1}, new double[][] {{1, 0}, {0, 1}}, Table.of("id", 7, 8));
        ens.setData(ensemble, false);
        ens.write();
        Path tabFile = tempDir.resolve("t.rtab");
        TableHandle tab = new TableHandle("t", tabFile.toString(), "test");
        tab.setData(Table.of("zmode", 0.5), false);
        tab.write();

        EnsembleOrTableHandle either = new EnsembleOrTableHandle("in", ensFile.toString(), "test");
        assertThat(either.read()).isEqualTo(ensemble);
        assertThat(either.readChunk(1, 2)).isEqualTo(ensemble.slice(1, 2));
        EnsembleOrTableHandle table = new EnsembleOrTableHandle("in", tabFile.toString(), "test");
        assertThat(table.read()).isEqualTo(Table.of("zmode", 0.5));

        assertThat(either.isWritable()).isFalse();
        assertThatThrownBy(either::write).isInstanceOf(InvalidHandleOperationException.class);
        assertThatThrownBy(() -> either.initializeWrite(1, null)).isInstanceOf(InvalidHandleOperationException.class);
        assertThatThrownBy(() -> either.setData("text", false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void modelHandle_cachesByPathAndForceReadRefreshes() throws Exception {
        ModelCache cache = new ModelCache();
        Path file = tempDir.resolve("m.ser.zst");
        ModelHandle writer = new ModelHandle("m", file.toString(), "test", cache, new ZstdCodec(3));
        Model model = new Model("payload", "some.Creator", 1, Map.of("source", "unit"));
        writer.setData(model, false);
        writer.write();
        assertThat(cache.size()).isEqualTo(1);

        ModelHandle reader = new ModelHandle("m", file.toString(), "test", cache, new NoneCodec());
        Model first = reader.read();
        assertThat(first).isSameAs(model);

        Model reloaded = reader.read(true);
        assertThat(reloaded).isNotSameAs(model).isEqualTo(model);
        assertThat(reloaded.getProvenance()).containsEntry("source", "unit");
    }
}
