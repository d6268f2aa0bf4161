/**
 * Data model of CertDump.
 *
 * <p>
 * Holds the in-memory dataset representation ({@code Dataset}, {@code Cell}, {@code ColumnKind}),
 * the per-dataset {@code CleaningStatistics}, and the audit log record types.
 * </p>
 */
package io.github.yok.certdump.model;
