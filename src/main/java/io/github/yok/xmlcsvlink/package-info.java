/**
 * Root package of XmlCsvLink.
 *
 * <p>
 * Provides a CLI/library that converts documents between a tag-delimited markup format and a
 * comma-delimited tabular format.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.xmlcsvlink.config}: configuration models</li>
 * <li>{@code io.github.yok.xmlcsvlink.model}: document tree and lexical terms</li>
 * <li>{@code io.github.yok.xmlcsvlink.parser}: markup lexer and tree parser</li>
 * <li>{@code io.github.yok.xmlcsvlink.core}: projection, ingestion, serialization and the
 * file-level conversion workflows</li>
 * </ul>
 */
package io.github.yok.xmlcsvlink;
