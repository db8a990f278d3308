package io.github.yok.xmlcsvlink.core;

/**
 * User-facing channel for progress and error messages of a conversion.
 *
 * @author Yasuharu.Okawauchi
 */
public interface StatusNotifier {

    /**
     * Reports progress.
     *
     * @param message message shown to the user
     */
    void info(String message);

    /**
     * Reports a problem that did not abort the conversion.
     *
     * @param message message shown to the user
     */
    void error(String message);
}
