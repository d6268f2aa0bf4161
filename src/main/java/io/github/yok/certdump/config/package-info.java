/**
 * Configuration model package for CertDump.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: the database
 * connection, the output path, the dataset catalog, the audit log settings and the imputation
 * settings.
 * </p>
 *
 * <p>
 * This package only holds configuration data; execution logic lives in {@code core} and
 * {@code db}.
 * </p>
 */
package io.github.yok.certdump.config;
