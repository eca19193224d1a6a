package com.energy.anomaly.model;

import com.energy.anomaly.exception.DataException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    private static final List<DatasetColumn> COLUMNS = List.of(DatasetColumn.numeric("consumption"));

    @Test
    void of_nullRow_throwsDataExceptionNamingTheRow() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(Map.of("consumption", 1.0));
        rows.add(null);

        assertThatThrownBy(() -> Dataset.of(COLUMNS, rows))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("Row 1");
    }

    @Test
    void of_nullCell_isKeptAsMissing() {
        Map<String, Object> row = new HashMap<>();
        row.put("consumption", null);

        Dataset dataset = Dataset.of(COLUMNS, List.of(row));

        assertThat(dataset.rowCount()).isEqualTo(1);
        assertThat(dataset.value(0, "consumption")).isNull();
    }

    @Test
    void of_noColumns_throwsDataException() {
        assertThatThrownBy(() -> Dataset.of(List.of(), List.of()))
                .isInstanceOf(DataException.class);
    }
}
