package io.github.yok.xmlcsvlink.core;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.config.TableConfig;
import io.github.yok.xmlcsvlink.model.Node;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Builds a {@link Node} tree from tabular text.
 *
 * <p>
 * The first line holds the column names; every following line becomes one record element with one
 * leaf per column. The resulting tree has a fixed shape:
 * </p>
 *
 * <pre>
 * root (synthetic)
 *  └─ root2
 *      ├─ element
 *      │   ├─ column1 = value
 *      │   └─ column2 = value
 *      └─ element ...
 * </pre>
 *
 * <p>
 * Values are split on the delimiter only; quoting is not supported. Fields beyond the declared
 * columns are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableIngestor {

    private final MarkupConfig markupConfig;
    private final TableConfig tableConfig;

    /**
     * Creates an ingestor.
     *
     * @param markupConfig element names of the generated tree
     * @param tableConfig delimiter settings
     */
    public TableIngestor(MarkupConfig markupConfig, TableConfig tableConfig) {
        this.markupConfig = Preconditions.checkNotNull(markupConfig, "markupConfig");
        this.tableConfig = Preconditions.checkNotNull(tableConfig, "tableConfig");
    }

    /**
     * Converts tabular text into a tree.
     *
     * @param text full tabular document
     * @return synthetic root of the generated tree
     * @throws TableFormatException if there is no data line, or a row lacks a declared column
     */
    public Node ingest(String text) throws TableFormatException {
        Preconditions.checkNotNull(text, "text must not be null");

        List<CSVRecord> records = readRecords(CharMatcher.whitespace().trimFrom(text));
        if (records.size() < 2) {
            throw new TableFormatException("No entries in CSV file");
        }

        List<String> columns = records.get(0).toList();
        log.debug("Columns: {}", columns);

        Node root = Node.syntheticRoot(markupConfig.getRootName());
        Node document = root.addChild(new Node(markupConfig.getDocumentElementName()));

        for (int rowIndex = 0; rowIndex < records.size() - 1; rowIndex++) {
            CSVRecord record = records.get(rowIndex + 1);
            Node element = new Node(markupConfig.getRecordElementName());
            for (int columnIndex = 0; columnIndex < columns.size(); columnIndex++) {
                if (record.size() <= columnIndex) {
                    throw new TableFormatException(String.format("Expected key %d for row %d",
                            columnIndex, rowIndex));
                }
                element.addChild(new Node(columns.get(columnIndex), record.get(columnIndex)));
            }
            document.addChild(element);
        }

        log.debug("Ingested {} row(s)", document.getChildren().size());
        return root;
    }

    private List<CSVRecord> readRecords(String text) {
        try (CSVParser parser = CSVParser.parse(text, TableFormats.of(tableConfig))) {
            return parser.getRecords();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to split tabular input", e);
        }
    }
}
