package io.github.yok.xmlcsvlink.core;

import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.config.TableConfig;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

/**
 * Factory that creates the {@link Converter} for a conversion direction.
 *
 * <p>
 * The direction is named by the source format: {@link DataFormat#XML} exports to tabular text,
 * {@link DataFormat#CSV} imports into markup. {@link #forInput(Path)} derives the source format
 * from the input file extension.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConverterFactory {

    private final MarkupConfig markupConfig;
    private final TableConfig tableConfig;
    private final StatusNotifier notifier;

    /**
     * Creates the converter that reads the given format.
     *
     * @param sourceFormat format of the input file
     * @return converter for that direction
     */
    public Converter create(DataFormat sourceFormat) {
        switch (sourceFormat) {
            case XML:
                return new MarkupToTableConverter(markupConfig, tableConfig, notifier);
            case CSV:
                return new TableToMarkupConverter(markupConfig, tableConfig, notifier);
            default:
                throw new IllegalArgumentException("Unsupported format: " + sourceFormat);
        }
    }

    /**
     * Creates the converter matching the extension of {@code input}.
     *
     * @param input input file
     * @return converter for the detected direction
     * @throws IllegalArgumentException if the extension is not a supported format
     */
    public Converter forInput(Path input) {
        String ext = FilenameUtils.getExtension(String.valueOf(input.getFileName()));
        for (DataFormat format : DataFormat.values()) {
            if (format.matches(ext)) {
                log.info("Resolved input format {} for [{}]", format, input);
                return create(format);
            }
        }
        throw new IllegalArgumentException("Unsupported input file type: " + input);
    }
}
