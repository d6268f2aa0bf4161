/**
 * Utility package for CertDump.
 *
 * <p>
 * Provides stateless helpers: CSV writing and cell rendering, failure reporting, and log path
 * rendering.
 * </p>
 */
package io.github.yok.certdump.util;
