package io.github.yok.xmlcsvlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.config.TableConfig;
import io.github.yok.xmlcsvlink.model.Node;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVPrinter;

/**
 * Flattens a {@link Node} tree into tabular text.
 *
 * <p>
 * <strong>Algorithm:</strong>
 * </p>
 * <ul>
 * <li>The tree is walked depth-first. Every leaf with a non-empty name and non-empty data
 * contributes one value to the column keyed by its path ({@code /}-joined).</li>
 * <li>A shared row counter is incremented once after the children of each non-leaf node have been
 * visited, so that each repeated record element closes one row.</li>
 * <li>Before a value is appended, the column is resized to the current row count: padded with empty
 * strings, or truncated when the column already holds a value for that row (the later value
 * wins).</li>
 * </ul>
 *
 * <p>
 * The header lists the last path segment of every column in first-seen order. Rows without any
 * value are skipped. When a column ran out of values early the row is written with fewer fields
 * than the header, unless {@link TableConfig#isPadRaggedRows()} is set.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableProjector {

    // Separator between path segments in a column key
    private static final String PATH_SEPARATOR = "/";

    private final TableConfig tableConfig;

    /**
     * Creates a projector.
     *
     * @param tableConfig tabular settings
     */
    public TableProjector(TableConfig tableConfig) {
        this.tableConfig = Preconditions.checkNotNull(tableConfig, "tableConfig");
    }

    /**
     * Converts the tree into tabular text.
     *
     * @param root root of the tree (usually the synthetic root returned by the parser)
     * @return header line followed by the data rows
     */
    public String project(Node root) {
        Preconditions.checkNotNull(root, "root must not be null");

        Map<String, List<String>> columns = new LinkedHashMap<>();
        int rowCount = collect(root, columns, 0);
        log.debug("Collected {} column(s) over {} row slot(s)", columns.size(), rowCount);

        return format(columns, rowCount);
    }

    /**
     * Collects leaf values below {@code node}.
     *
     * @param node current node
     * @param columns column key to values, in first-seen order
     * @param row current row count
     * @return row count after visiting {@code node}
     */
    private int collect(Node node, Map<String, List<String>> columns, int row) {
        if (node.isLeaf()) {
            if (!node.isSynthetic() && !node.getName().isEmpty() && !node.getData().isEmpty()) {
                String key = String.join(PATH_SEPARATOR, node.getPath());
                List<String> values = columns.computeIfAbsent(key, k -> new ArrayList<>());
                resize(values, row);
                values.add(node.getData());
            }
            return row;
        }

        int current = row;
        for (Node child : node.getChildren()) {
            current = collect(child, columns, current);
        }
        return current + 1;
    }

    private static void resize(List<String> values, int size) {
        if (values.size() > size) {
            values.subList(size, values.size()).clear();
        }
        while (values.size() < size) {
            values.add("");
        }
    }

    private String format(Map<String, List<String>> columns, int rowCount) {
        List<String> header = new ArrayList<>(columns.size());
        for (String key : columns.keySet()) {
            header.add(key.substring(key.lastIndexOf(PATH_SEPARATOR) + 1));
        }

        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, TableFormats.of(tableConfig))) {
            printer.printRecord(header);
            for (int row = 0; row < rowCount; row++) {
                List<String> record = buildRecord(columns, row);
                if (record != null) {
                    printer.printRecord(record);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to format tabular output", e);
        }
        return out.toString();
    }

    /**
     * Builds the fields of one row.
     *
     * @return fields in column order, or {@code null} if no column has a value for this row
     */
    private List<String> buildRecord(Map<String, List<String>> columns, int row) {
        List<String> record = new ArrayList<>(columns.size());
        boolean hasValue = false;
        for (List<String> values : columns.values()) {
            if (values.size() > row) {
                record.add(values.get(row));
                hasValue = true;
            } else if (tableConfig.isPadRaggedRows()) {
                record.add("");
            }
        }
        return hasValue ? record : null;
    }
}
