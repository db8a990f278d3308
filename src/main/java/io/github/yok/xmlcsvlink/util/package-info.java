/**
 * Utility package for XmlCsvLink.
 *
 * <p>
 * Holds the fatal error reporting used by the command-line entry point.
 * </p>
 */
package io.github.yok.xmlcsvlink.util;
