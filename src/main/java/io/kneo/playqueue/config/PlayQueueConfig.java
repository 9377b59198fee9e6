package io.kneo.playqueue.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "playqueue")
public interface PlayQueueConfig {

    @WithName("max-length")
    @WithDefault("16384")
    int getMaxLength();

    @WithName("history-horizon")
    @WithDefault("0")
    long getHistoryHorizon();

    @WithName("partitions")
    @WithDefault("default")
    List<String> getPartitions();

    @WithName("state-file.path")
    Optional<String> getStateFilePath();

    @WithName("state-file.interval")
    @WithDefault("2m")
    String getStateFileInterval();
}
