package io.github.yok.certdump.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Reads the {@code data-path} property and composes the snapshot output directory.
 *
 * <p>
 * Snapshots and the run report are written to {@code <data-path>/csvs}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the directory that receives {@code <table>.csv} snapshots.
     *
     * @return the path to the snapshot directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public String getSnapshotDir() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return dataPath.endsWith("/") ? dataPath + "csvs" : dataPath + "/csvs";
    }
}
