package com.tsvolume.config;

import com.tsvolume.cache.WriteCache;
import com.tsvolume.ingest.RespPointDecoder;
import com.tsvolume.ingest.SeriesRegistry;
import com.tsvolume.ingest.WriteRouter;
import com.tsvolume.query.QueryEngine;
import com.tsvolume.stats.StatsReporter;
import com.tsvolume.storage.VolumeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the storage engine components from {@link StorageConfig}.
 */
@Configuration
public class StorageEngineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(StorageEngineConfiguration.class);

    @Bean
    public VolumeSet volumeSet(StorageConfig config) {
        logger.info("Initializing storage engine with config: {}", config);
        return new VolumeSet(config.getVolumeCount(), config.getVolumeCapacity(), config.getCapacityPolicy());
    }

    @Bean
    public WriteCache writeCache() {
        return new WriteCache();
    }

    @Bean
    public SeriesRegistry seriesRegistry() {
        return new SeriesRegistry();
    }

    @Bean
    public WriteRouter writeRouter(VolumeSet volumeSet, WriteCache writeCache, SeriesRegistry seriesRegistry,
                                   StorageConfig config) {
        return new WriteRouter(volumeSet, writeCache, seriesRegistry, config);
    }

    @Bean
    public QueryEngine queryEngine(WriteCache writeCache, VolumeSet volumeSet, SeriesRegistry seriesRegistry) {
        return new QueryEngine(writeCache, volumeSet, seriesRegistry);
    }

    @Bean
    public StatsReporter statsReporter(VolumeSet volumeSet, WriteCache writeCache, WriteRouter writeRouter) {
        return new StatsReporter(volumeSet, writeCache, writeRouter);
    }

    @Bean
    public RespPointDecoder respPointDecoder() {
        return new RespPointDecoder();
    }
}
