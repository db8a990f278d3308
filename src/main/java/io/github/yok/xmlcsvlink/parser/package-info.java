/**
 * Markup reading for XmlCsvLink.
 *
 * <p>
 * {@code MarkupLexer} turns text into terms and {@code TreeParser} turns terms into a node tree.
 * Both report malformed input through subclasses of {@code ConversionException}.
 * </p>
 */
package io.github.yok.xmlcsvlink.parser;
