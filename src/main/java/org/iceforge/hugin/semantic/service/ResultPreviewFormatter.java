package org.iceforge.hugin.semantic.service;

import org.iceforge.hugin.semantic.config.HuginProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the first rows of a warehouse result as a text grid:
 * <pre>
 * Total Rows: 2
 * First 10 Rows:
 * +--------+---------------+
 * | status | total_revenue |
 * +========+===============+
 * | Closed | $1,234.50     |
 * +--------+---------------+
 * </pre>
 */
@Component
public class ResultPreviewFormatter {

    private final int maxRows;

    @Autowired
    public ResultPreviewFormatter(HuginProperties props) {
        this(props.getMaxResults());
    }

    public ResultPreviewFormatter(int maxRows) {
        if (maxRows < 1) {
            throw new IllegalArgumentException("maxRows must be positive: " + maxRows);
        }
        this.maxRows = maxRows;
    }

    public String format(WarehouseResult result) {
        StringBuilder out = new StringBuilder();
        out.append("Total Rows: ").append(result.totalRows()).append('\n');
        if (result.rows().isEmpty()) {
            return out.toString();
        }
        out.append("First ").append(maxRows).append(" Rows:").append('\n');

        List<String> headers = new ArrayList<>(result.rows().get(0).keySet());
        List<Object[]> cells = new ArrayList<>();
        for (Map<String, Object> row : result.rows().subList(0, Math.min(maxRows, result.rows().size()))) {
            Object[] formatted = new Object[headers.size()];
            for (int c = 0; c < headers.size(); c++) {
                formatted[c] = formatValue(row.get(headers.get(c)));
            }
            cells.add(formatted);
        }

        int[] widths = new int[headers.size()];
        boolean[] numeric = new boolean[headers.size()];
        for (int c = 0; c < headers.size(); c++) {
            widths[c] = headers.get(c).length();
            numeric[c] = true;
            for (Object[] row : cells) {
                widths[c] = Math.max(widths[c], text(row[c]).length());
                if (row[c] != null && !(row[c] instanceof Number)) numeric[c] = false;
            }
        }

        String border = border(widths, '-');
        out.append(border).append('\n');
        out.append(line(headers.toArray(), widths, numeric)).append('\n');
        out.append(border(widths, '=')).append('\n');
        for (Object[] row : cells) {
            out.append(line(row, widths, numeric)).append('\n');
            out.append(border).append('\n');
        }
        return out.toString();
    }

    /**
     * Money-style floats ({@code $1.25M}, {@code $1,234.50}) and date-only timestamps.
     */
    static Object formatValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d > 1_000_000) {
                return String.format(Locale.ROOT, "$%.2fM", d / 1_000_000);
            }
            return String.format(Locale.US, "$%,.2f", d);
        }
        if (value instanceof String s && s.contains("+00:00")) {
            return s.strip().split("\\s+")[0];
        }
        return value;
    }

    private static String border(int[] widths, char fill) {
        StringBuilder sb = new StringBuilder("+");
        for (int w : widths) {
            sb.append(String.valueOf(fill).repeat(w + 2)).append('+');
        }
        return sb.toString();
    }

    private static String line(Object[] values, int[] widths, boolean[] numeric) {
        StringBuilder sb = new StringBuilder("|");
        for (int c = 0; c < widths.length; c++) {
            String t = text(values[c]);
            String pad = " ".repeat(widths[c] - t.length());
            sb.append(' ').append(numeric[c] ? pad + t : t + pad).append(" |");
        }
        return sb.toString();
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }
}
