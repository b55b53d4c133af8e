package com.phillippitts.satupscale.config;

import com.phillippitts.satupscale.config.properties.JobQueueProperties;
import com.phillippitts.satupscale.config.properties.ModelRuntimeProperties;
import com.phillippitts.satupscale.config.properties.UpscaleProperties;
import com.phillippitts.satupscale.service.image.AwtImageCodec;
import com.phillippitts.satupscale.service.image.ImageCodec;
import com.phillippitts.satupscale.service.job.JobEventLogger;
import com.phillippitts.satupscale.service.job.JobQueue;
import com.phillippitts.satupscale.service.job.JobRunner;
import com.phillippitts.satupscale.service.job.Log4jJobEventLogger;
import com.phillippitts.satupscale.service.job.MonotonicClock;
import com.phillippitts.satupscale.service.model.ModelInvoker;
import com.phillippitts.satupscale.service.model.ModelRuntimeResolver;
import com.phillippitts.satupscale.service.model.ProcessModelInvoker;
import com.phillippitts.satupscale.service.pipeline.JobPipeline;
import com.phillippitts.satupscale.service.pipeline.ModelVersionResolver;
import com.phillippitts.satupscale.service.pipeline.ProcessingReportWriter;
import com.phillippitts.satupscale.service.raster.RasterIo;
import com.phillippitts.satupscale.service.raster.UnavailableRasterIo;
import com.phillippitts.satupscale.service.upscale.GeospatialMasterWriter;
import com.phillippitts.satupscale.service.upscale.VisualExportBuilder;
import com.phillippitts.satupscale.service.upscale.VisualResizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the job engine and its collaborators.
 *
 * <p>A deployment with a native raster library replaces {@link RasterIo} by declaring its own bean;
 * otherwise geospatial masters fall back to visual outputs.
 */
@Configuration
public class UpscaleConfig {

    private static final Logger LOG = LogManager.getLogger(UpscaleConfig.class);

    @Bean
    public JobEventLogger jobEventLogger(UpscaleProperties props) {
        return new Log4jJobEventLogger(props.eventsLogComponent());
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.system();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobRunner jobRunner(JobEventLogger events, MonotonicClock monotonicClock) {
        return new JobRunner(events, monotonicClock);
    }

    @Bean(destroyMethod = "shutdown")
    public JobQueue jobQueue(JobRunner runner, JobQueueProperties props) {
        LOG.info("Starting job queue worker '{}' (poll={}ms)", props.threadName(), props.pollIntervalMillis());
        return new JobQueue(runner, null, null, Duration.ofMillis(props.pollIntervalMillis()), props.threadName());
    }

    @Bean
    public JobPipeline jobPipeline(JobRunner runner, UpscaleProperties props) {
        return new JobPipeline(runner, new ModelVersionResolver(Path.of(props.modelRegistryPath())),
                new ProcessingReportWriter());
    }

    @Bean
    @ConditionalOnMissingBean(RasterIo.class)
    public RasterIo rasterIo() {
        LOG.warn("No geospatial raster backend configured; metadata-preserving outputs will fall back");
        return new UnavailableRasterIo();
    }

    @Bean
    public ImageCodec imageCodec() {
        return new AwtImageCodec();
    }

    @Bean
    public ModelInvoker modelInvoker(ModelRuntimeProperties props) {
        ModelRuntimeResolver resolver = new ModelRuntimeResolver(Path.of(props.cacheDir()), props.entrypoints());
        return new ProcessModelInvoker(resolver, Duration.ofSeconds(props.timeoutSeconds()), props.maxStderrBytes());
    }

    @Bean
    public GeospatialMasterWriter geospatialMasterWriter(RasterIo rasterIo) {
        return new GeospatialMasterWriter(rasterIo);
    }

    @Bean
    public VisualResizer visualResizer(ImageCodec codec) {
        return new VisualResizer(codec);
    }

    @Bean
    public VisualExportBuilder visualExportBuilder(RasterIo rasterIo, ImageCodec codec, VisualResizer resizer) {
        return new VisualExportBuilder(rasterIo, codec, resizer);
    }
}
