package io.github.yok.xmlcsvlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.xmlcsvlink.parser.ConversionException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Base converter that owns the file handling shared by both conversion directions.
 *
 * <p>
 * The flow is fixed: read the input in the source charset, delegate to {@link #transform(String)},
 * then write the result in the target charset. A read failure aborts the call; a write failure is
 * reported through the {@link StatusNotifier} and leaves the converted text available in the
 * returned {@link ConversionResult}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class AbstractConverter implements Converter {

    /**
     * Channel used for progress and write errors.
     */
    protected final StatusNotifier notifier;

    /**
     * Creates the converter.
     *
     * @param notifier user-facing notification channel
     */
    protected AbstractConverter(StatusNotifier notifier) {
        this.notifier = Preconditions.checkNotNull(notifier, "notifier");
    }

    @Override
    public final ConversionResult convert(Path input, Path output)
            throws IOException, ConversionException {
        Preconditions.checkNotNull(input, "input must not be null");
        Preconditions.checkNotNull(output, "output must not be null");
        log.info("Converting {} file [{}] to {} file [{}]", getSourceFormat(), input,
                getTargetFormat(), output);

        String text;
        try {
            text = Files.readString(input, getSourceCharset());
        } catch (IOException e) {
            throw new IOException(String.format("Could not open %s file %s: %s",
                    getSourceFormat(), input, e.getMessage()), e);
        }
        notifier.info("File read successfully");

        String converted = transform(text);
        boolean written = write(output, converted);
        return new ConversionResult(converted, written);
    }

    /**
     * Converts the document text.
     *
     * @param text full input document
     * @return full output document
     * @throws ConversionException if the input is malformed
     */
    protected abstract String transform(String text) throws ConversionException;

    /**
     * Returns the format read by this converter.
     *
     * @return source format
     */
    public abstract DataFormat getSourceFormat();

    /**
     * Returns the format written by this converter.
     *
     * @return target format
     */
    public abstract DataFormat getTargetFormat();

    /**
     * Returns the charset of input files.
     *
     * @return source charset
     */
    protected abstract Charset getSourceCharset();

    /**
     * Returns the charset of output files.
     *
     * @return target charset
     */
    protected abstract Charset getTargetCharset();

    private boolean write(Path output, String content) {
        String label = getTargetFormat().name();
        Writer writer;
        try {
            writer = Files.newBufferedWriter(output, getTargetCharset());
        } catch (IOException e) {
            log.debug("Failed to create {}", output, e);
            notifier.error(String.format("Could not create %s file: %s", label, e.getMessage()));
            return false;
        }
        try (Writer w = writer) {
            w.write(content);
        } catch (IOException e) {
            log.debug("Failed to write {}", output, e);
            notifier.error(
                    String.format("Could not write to %s file: %s", label, e.getMessage()));
            return false;
        }
        notifier.info(label + " File written successfully");
        return true;
    }
}
