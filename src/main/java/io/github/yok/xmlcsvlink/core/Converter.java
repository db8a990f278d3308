package io.github.yok.xmlcsvlink.core;

import io.github.yok.xmlcsvlink.parser.ConversionException;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts one input file into one output file.
 *
 * @author Yasuharu.Okawauchi
 */
public interface Converter {

    /**
     * Reads {@code input}, converts it and writes the result to {@code output}.
     *
     * <p>
     * Failing to write the output is reported to the user but does not throw; check
     * {@link ConversionResult#isWritten()}.
     * </p>
     *
     * @param input file to read
     * @param output file to create or overwrite
     * @return converted text and write status
     * @throws IOException if the input cannot be read
     * @throws ConversionException if the input is malformed
     */
    ConversionResult convert(Path input, Path output) throws IOException, ConversionException;
}
