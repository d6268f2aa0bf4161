/**
 * Relational store access.
 *
 * <p>
 * Defines the read contract ({@code TableReader}) and the audit contract ({@code AuditLogStore}),
 * with implementations over DBUnit and plain JDBC. The JDBC connection is opened once per run by
 * {@code ConnectionFactory} and passed explicitly to every collaborator.
 * </p>
 */
package io.github.yok.certdump.db;
