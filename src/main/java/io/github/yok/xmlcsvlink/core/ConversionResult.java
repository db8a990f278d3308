package io.github.yok.xmlcsvlink.core;

import lombok.Value;

/**
 * Outcome of one conversion call.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ConversionResult {

    // Converted document text
    String content;

    // Whether the content reached the output file
    boolean written;
}
