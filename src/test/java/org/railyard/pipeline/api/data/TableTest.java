package org.railyard.pipeline.api.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TableTest {

    private static Table abTable() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("a", new double[] {1, 2, 3, 4, 5});
        columns.put("b", new double[] {10, 20, 30, 40, 50});
        return Table.of(columns);
    }

    @Test
    void of_keepsColumnOrderAndCopiesInput() {
        double[] values = {1, 2};
        Table table = Table.of("x", values);
        values[0] = 99;

        assertThat(table.columnNames()).containsExactly("x");
        assertThat(table.column("x")).containsExactly(1, 2);
        assertThat(abTable().columnNames()).containsExactly("a", "b");
    }

    @Test
    void of_rejectsRaggedColumns() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("a", new double[] {1, 2});
        columns.put("b", new double[] {1});

        assertThatThrownBy(() -> Table.of(columns))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    void slice_returnsRequestedRows() {
        Table slice = abTable().slice(1, 3);

        assertThat(slice.numRows()).isEqualTo(2);
        assertThat(slice.column("a")).containsExactly(2, 3);
        assertThat(slice.column("b")).containsExactly(20, 30);
    }

    @Test
    void slice_rejectsOutOfBounds() {
        assertThatThrownBy(() -> abTable().slice(3, 6)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void concat_restoresSlicedTable() {
        Table table = abTable();

        Table joined = Table.concat(List.of(table.slice(0, 2), table.slice(2, 4), table.slice(4, 5)));

        assertThat(joined).isEqualTo(table);
        assertThat(joined.hashCode()).isEqualTo(table.hashCode());
    }

    @Test
    void concat_rejectsDifferentColumns() {
        assertThatThrownBy(() -> Table.concat(List.of(abTable(), Table.of("a", 1.0))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rename_mapsNamesAndRejectsCollisions() {
        Table renamed = abTable().rename(Map.of("a", "alpha"));

        assertThat(renamed.columnNames()).containsExactly("alpha", "b");
        assertThatThrownBy(() -> abTable().rename(Map.of("a", "b"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void selectAndWithColumn() {
        Table table = abTable().select(List.of("b")).withColumn("c", new double[] {0, 0, 0, 0, 1});

        assertThat(table.columnNames()).containsExactly("b", "c");
        assertThat(table.get("c", 4)).isEqualTo(1.0);
        assertThatThrownBy(() -> table.withColumn("d", new double[] {1})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void column_rejectsUnknownName() {
        assertThatThrownBy(() -> abTable().column("zz"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zz");
    }

    @Test
    void builder_collectsRows() {
        Table table = Table.builder("x", "y").addRow(1, 2).addRow(3, 4).build();

        assertThat(table.numRows()).isEqualTo(2);
        assertThat(table.column("y")).containsExactly(2, 4);
        assertThatThrownBy(() -> Table.builder("x").addRow(1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void empty_hasColumnsButNoRows() {
        Table table = Table.empty(List.of("p", "q"));

        assertThat(table.numRows()).isZero();
        assertThat(table.columnNames()).containsExactly("p", "q");
    }
}
