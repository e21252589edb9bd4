package com.interpolar.medicationreview.util;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.model.RawTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes space, comma and colon characters from cells
 */
public class CellNormalizer {

    private CellNormalizer() {
    }

    /**
     * null becomes "", every other cell loses its stripped characters
     */
    public static String normalize(String cell) {
        if (cell == null || cell.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(cell.length());
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (!isStripped(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static List<String> normalizeRow(List<String> row) {
        List<String> normalized = new ArrayList<>();
        if (row == null) {
            return normalized;
        }
        for (String cell : row) {
            normalized.add(normalize(cell));
        }
        return normalized;
    }

    /**
     * Normalized copy of the table, the input is left untouched
     */
    public static RawTable normalizeTable(RawTable table) {
        List<List<String>> rows = new ArrayList<>();
        if (table.getRows() != null) {
            for (List<String> row : table.getRows()) {
                rows.add(normalizeRow(row));
            }
        }
        return new RawTable(table.getRaterLabel(), rows);
    }

    public static boolean isEmpty(String cell) {
        return cell == null || cell.isEmpty();
    }

    public static boolean isBlankRow(List<String> row) {
        if (row == null) {
            return true;
        }
        for (String cell : row) {
            if (!isEmpty(cell)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isStripped(char c) {
        for (char stripped : TripleConstants.Cell.STRIPPED_CHARS) {
            if (c == stripped) {
                return true;
            }
        }
        return false;
    }
}
