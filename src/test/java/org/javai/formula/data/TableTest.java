package org.javai.formula.data;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TableTest {

    // === ColumnTable ===

    @Test
    void columnTable_keepsColumnOrder() {
        ColumnTable table = ColumnTable.of(Column.of("y", 1.0, 2.0), Column.of("c", "a", "b"));

        assertThat(table.columnNames()).containsExactly("y", "c");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.hasColumn("c")).isTrue();
        assertThat(table.hasColumn("z")).isFalse();
    }

    @Test
    void columnTable_rejectsUnequalLengths() {
        assertThatThrownBy(() -> ColumnTable.of(Column.of("y", 1.0, 2.0), Column.of("c", "a")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void columnTable_rejectsDuplicateNames() {
        assertThatThrownBy(() -> ColumnTable.builder().column(Column.of("y", 1.0)).column(Column.of("y", 2.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate column y");
    }

    @Test
    void columnTable_unknownColumn_listsColumns() {
        ColumnTable table = ColumnTable.of(Column.of("y", 1.0));

        assertThatThrownBy(() -> table.column("x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[y]");
    }

    @Test
    void columnTable_row_readsAcrossColumns() {
        ColumnTable table = ColumnTable.of(Column.of("y", 1.0, 2.0), Column.of("c", "a", "b"));

        Row row = table.row(1);

        assertThat(row.get("c")).isEqualTo("b");
        assertThat(row.getDouble("y")).isEqualTo(2.0);
        assertThatThrownBy(() -> table.row(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void columnTable_select_keepsTypes() {
        ColumnTable table = ColumnTable.of(Column.of("y", 1.0, 2.0, 3.0), Column.of("c", "a", "b", "c"));

        Table selected = table.select(new int[] {0, 2});

        assertThat(selected.rowCount()).isEqualTo(2);
        assertThat(selected.column("y").toDoubles()).containsExactly(1.0, 3.0);
        assertThat(selected.column("c").elementType()).isEqualTo(String.class);
    }

    // === RowTable ===

    @Test
    void rowTable_buildsObjectColumns() {
        RowTable table = RowTable.of(MapRow.of("x", 1.5, "c", "a"), MapRow.of("x", 2.5, "c", "b"));

        Column x = table.column("x");

        assertThat(x.elementType()).isEqualTo(Object.class);
        assertThat(x.toDoubles()).containsExactly(1.5, 2.5);
        assertThat(table.column("x")).isSameAs(x);
    }

    @Test
    void rowTable_allowsMissingValues() {
        RowTable table = RowTable.of(MapRow.of("x", 1.5), MapRow.of("x", null));

        assertThat(table.column("x").isMissing(1)).isTrue();
        assertThat(table.row(1).getDouble("x")).isNaN();
    }

    @Test
    void rowTable_rejectsRowsWithDifferentColumns() {
        assertThatThrownBy(() -> RowTable.of(MapRow.of("x", 1.0), MapRow.of("z", 1.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("row 1");
    }

    @Test
    void rowTable_select_keepsRows() {
        RowTable table = new RowTable(Arrays.asList(MapRow.of("x", 1.0), MapRow.of("x", 2.0), MapRow.of("x", 3.0)));

        assertThat(List.<Object>copyOf(table.select(new int[] {2}).column("x").values())).containsExactly(3.0);
    }

    @Test
    void mapRow_requiresPairs() {
        assertThatThrownBy(() -> MapRow.of("x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mapRow_unknownName_fails() {
        assertThatThrownBy(() -> MapRow.of("x", 1.0).get("y"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no column y");
    }

    @Test
    void emptyRowTable_hasNoColumns() {
        RowTable table = new RowTable(List.of());

        assertThat(table.columnNames()).isEmpty();
        assertThat(table.rowCount()).isZero();
    }
}
