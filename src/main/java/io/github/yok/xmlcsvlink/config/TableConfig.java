package io.github.yok.xmlcsvlink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code table} section in {@code application.yml}.
 *
 * <p>
 * The tabular format never quotes or escapes values, so the delimiter and the record separator
 * must not occur inside values.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "table")
@Data
public class TableConfig {

    /**
     * Field delimiter.
     */
    private char delimiter = ',';

    /**
     * Separator written after every record, header included.
     */
    private String recordSeparator = "\n";

    /**
     * When {@code true}, rows whose columns ran out of values early are padded with empty fields.
     * Defaults to {@code false} (rows are written with the values that exist).
     */
    private boolean padRaggedRows = false;

    /**
     * Charset used to read and write tabular files.
     */
    private String charset = "UTF-8";
}
