package io.github.yok.xmlcsvlink.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of the document formats handled by the converter.
 *
 * <p>
 * Each format knows the file extensions that identify it, so that {@link ConverterFactory} can
 * choose the conversion direction from an input file name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Tag-delimited hierarchical markup.
    XML("xml"),

    // Comma-delimited tabular text.
    CSV("csv");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }
}
