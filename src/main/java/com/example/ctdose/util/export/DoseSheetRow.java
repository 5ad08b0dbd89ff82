package com.example.ctdose.util.export;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 剂量表格中的一行
 *
 * 列固定为 HEADERS 中的顺序；空值和空白统一写为 "-"，不存在空单元格。
 */
public final class DoseSheetRow {

    /** 缺失值占位符 */
    public static final String PLACEHOLDER = "-";

    public static final List<String> HEADERS = Collections.unmodifiableList(Arrays.asList(
            "Patient ID",
            "Sex",
            "Birth Date",
            "Age",
            "Protocol",
            "Exam Date",
            "Series Description",
            "Scan Mode",
            "mAs",
            "kV",
            "CTDIvol",
            "DLP",
            "Total DLP",
            "Phantom Type",
            "SSDE",
            "Avg Scan Size"
    ));

    private final List<String> cells;

    public DoseSheetRow(List<String> values) {
        if (values == null || values.size() != HEADERS.size()) {
            throw new IllegalArgumentException("表格行需要 " + HEADERS.size() + " 列, 实际: "
                    + (values == null ? 0 : values.size()));
        }
        List<String> list = new ArrayList<>(values.size());
        for (String value : values) {
            list.add(cell(value));
        }
        this.cells = Collections.unmodifiableList(list);
    }

    /**
     * 空值 -> 占位符
     */
    public static String cell(String value) {
        if (value == null) {
            return PLACEHOLDER;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? PLACEHOLDER : trimmed;
    }

    public List<String> getCells() {
        return cells;
    }

    /**
     * 按列名取值
     */
    public String get(String header) {
        int index = HEADERS.indexOf(header);
        if (index < 0) {
            throw new IllegalArgumentException("未知列: " + header);
        }
        return cells.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DoseSheetRow)) return false;
        return cells.equals(((DoseSheetRow) o).cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells);
    }

    @Override
    public String toString() {
        return "DoseSheetRow" + cells;
    }
}
