package io.github.yok.certdump.util;

import com.google.common.base.Preconditions;
import java.io.File;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Utility for rendering output paths for logs.
 *
 * <p>
 * Paths under the configured data directory are rendered relative to it with UNIX separators;
 * anything else is rendered as an absolute normalized path.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.certdump.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a file path for logs.
     *
     * @param dataPath base data directory
     * @param file file or directory to render
     * @return path string rendered for logs
     * @throws NullPointerException if an argument is {@code null}
     */
    public static String renderForLog(Path dataPath, File file) {
        Preconditions.checkNotNull(dataPath, "dataPath must not be null");
        Preconditions.checkNotNull(file, "file must not be null");

        Path base = dataPath.toAbsolutePath().normalize();
        Path abs = file.toPath().toAbsolutePath().normalize();

        if (abs.startsWith(base)) {
            String rel = FilenameUtils.separatorsToUnix(base.relativize(abs).toString());
            log.debug("Rendered relative log path. base={}, abs={}, rel={}", base, abs, rel);
            return rel;
        }
        String absolute = FilenameUtils.separatorsToUnix(abs.toString());
        log.debug("Rendered absolute log path. abs={}", absolute);
        return absolute;
    }
}
