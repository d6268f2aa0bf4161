package io.github.yok.certdump.core;

import io.github.yok.certdump.model.Dataset;
import lombok.Value;

/**
 * Result of {@link DuplicateResolver#resolve(Dataset)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DuplicateResolution {

    // Dataset with the first occurrence of every distinct row
    Dataset dataset;

    // Rows that repeated an earlier row
    int duplicatesFound;

    // Rows deleted
    int duplicatesRemoved;
}
