/**
 * Core conversion workflows for XmlCsvLink.
 *
 * <p>
 * Contains the tree-to-table projection ({@code TableProjector}), the table-to-tree ingestion
 * ({@code TableIngestor}), the tree-to-markup serializer ({@code TreeSerializer}) and the
 * file-level converters that chain them with the markup parser.
 * </p>
 */
package io.github.yok.xmlcsvlink.core;
