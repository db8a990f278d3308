/**
 * Document model shared by all conversion stages.
 *
 * <p>
 * {@code Node} is the in-memory tree built per conversion call; {@code Term} is the transient unit
 * produced by the lexer and the serializer.
 * </p>
 */
package io.github.yok.xmlcsvlink.model;
