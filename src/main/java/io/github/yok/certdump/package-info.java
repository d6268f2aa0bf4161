/**
 * CertDump: extracts the tables of a legal-case warehouse, cleans them and writes one CSV snapshot
 * per table, recording every step in an audit log table.
 */
package io.github.yok.certdump;
