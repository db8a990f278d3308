/**
 * Configuration models for XmlCsvLink.
 *
 * <p>
 * Classes in this package are bound from {@code application.yml} by Spring Boot and can also be
 * instantiated directly, in which case their defaults apply.
 * </p>
 */
package io.github.yok.xmlcsvlink.config;
