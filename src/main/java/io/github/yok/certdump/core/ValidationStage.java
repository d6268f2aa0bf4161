package io.github.yok.certdump.core;

/**
 * States of one validation pass, in execution order.
 *
 * <p>
 * {@link #CHECK_REFERENTIAL} is only entered for fact datasets.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ValidationStage {
    START, DEDUPLICATE, IMPUTE, CHECK_REFERENTIAL, NORMALIZE_TYPES, DONE
}
