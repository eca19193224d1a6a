package com.energy.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Column metadata as inferred by the dataset loader")
public class DatasetColumn {

    @Schema(description = "Column name", example = "consumption")
    private String name;

    @Schema(description = "Inferred column type", example = "NUMERIC")
    private ColumnType type;

    public static DatasetColumn numeric(String name) {
        return new DatasetColumn(name, ColumnType.NUMERIC);
    }

    public static DatasetColumn timestamp(String name) {
        return new DatasetColumn(name, ColumnType.TIMESTAMP);
    }

    public static DatasetColumn categorical(String name) {
        return new DatasetColumn(name, ColumnType.CATEGORICAL);
    }
}
