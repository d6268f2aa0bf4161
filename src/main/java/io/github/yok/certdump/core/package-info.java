/**
 * Cleaning pipeline and extraction driver.
 *
 * <p>
 * {@code ValidationOrchestrator} runs deduplication, imputation, the foreign-key check and type
 * normalization over one dataset; {@code ExtractionRunner} applies it to every catalog table and
 * writes the snapshots and the run report.
 * </p>
 */
package io.github.yok.certdump.core;
