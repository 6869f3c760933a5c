package com.open_banking_archiver.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders rows as a plain text grid:
 * <pre>
 * +----+-------+
 * | ID | Name  |
 * +====+=======+
 * | 1  | Monzo |
 * +----+-------+
 * </pre>
 */
public final class TableFormatter {

    private TableFormatter() {
    }

    public static String grid(List<String> headers, List<List<?>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            if (row.size() != headers.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " cells, expected " + headers.size());
            }
            List<String> text = row.stream().map(v -> Objects.toString(v, "")).toList();
            for (int i = 0; i < text.size(); i++) {
                widths[i] = Math.max(widths[i], text.get(i).length());
            }
            cells.add(text);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(separator(widths, '-'));
        sb.append(line(widths, headers));
        sb.append(separator(widths, '='));
        for (List<String> row : cells) {
            sb.append(line(widths, row));
            sb.append(separator(widths, '-'));
        }
        if (cells.isEmpty()) {
            // header only: close the box with a plain rule instead of the '=' one
            sb.setLength(sb.length() - separator(widths, '=').length());
            sb.append(separator(widths, '-'));
        }
        return sb.toString();
    }

    private static String separator(int[] widths, char fill) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append(String.valueOf(fill).repeat(width + 2)).append('+');
        }
        return sb.append(System.lineSeparator()).toString();
    }

    private static String line(int[] widths, List<String> values) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            String value = values.get(i);
            sb.append(' ').append(value).append(" ".repeat(widths[i] - value.length())).append(" |");
        }
        return sb.append(System.lineSeparator()).toString();
    }
}
