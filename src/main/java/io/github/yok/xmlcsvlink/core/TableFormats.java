package io.github.yok.xmlcsvlink.core;

import io.github.yok.xmlcsvlink.config.TableConfig;
import org.apache.commons.csv.CSVFormat;

/**
 * Builds the {@link CSVFormat} shared by {@link TableProjector} and {@link TableIngestor}.
 *
 * <p>
 * Quoting and escaping are disabled, so values are written and split verbatim. Empty lines are
 * kept as records so that row numbers in error messages match the input.
 * </p>
 */
final class TableFormats {

    private TableFormats() {
        // Utility class; do not instantiate.
    }

    /**
     * Builds the format for the given settings.
     *
     * @param tableConfig tabular settings
     * @return format using the configured delimiter and record separator
     */
    static CSVFormat of(TableConfig tableConfig) {
        return CSVFormat.DEFAULT.builder().setDelimiter(tableConfig.getDelimiter()).setQuote(null)
                .setEscape(null).setRecordSeparator(tableConfig.getRecordSeparator())
                .setIgnoreEmptyLines(false).get();
    }
}
