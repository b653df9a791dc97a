package com.magsasa.runtimeintel.engine.job;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.detector.MetricSampleParser.ParsedSamples;
import com.magsasa.runtimeintel.detector.MetricSampleSource;
import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import com.magsasa.runtimeintel.engine.config.RuntimeConfig;
import com.magsasa.runtimeintel.engine.config.RuntimeConfigLoader;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;

class PipelineJobsTest {

  private RuntimeIntelligencePipeline pipeline;
  private RuntimeConfigLoader loader;
  private MetricSampleSource source;
  private JobExecutionContext context;

  @BeforeEach
  void setUp() {
    pipeline = mock(RuntimeIntelligencePipeline.class);
    loader = mock(RuntimeConfigLoader.class);
    source = mock(MetricSampleSource.class);
    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JobConstants.JOB_DATA_MAP_PIPELINE, pipeline);
    jobDataMap.put(JobConstants.JOB_DATA_MAP_CONFIG_LOADER, loader);
    jobDataMap.put(JobConstants.JOB_DATA_MAP_SAMPLE_SOURCE, source);
    JobDetail jobDetail = mock(JobDetail.class);
    when(jobDetail.getJobDataMap()).thenReturn(jobDataMap);
    context = mock(JobExecutionContext.class);
    when(context.getJobDetail()).thenReturn(jobDetail);
  }

  @Test
  void testReloadAppliesValidConfiguration() {
    RuntimeConfig next =
        RuntimeConfig.builder().detectors(List.of()).loadedAt(Instant.now()).build();
    when(loader.load()).thenReturn(next);

    new ConfigReloadJob().execute(context);

    verify(pipeline).reload(next);
    assertTrue(ConfigReloadJob.reload(pipeline, loader));
  }

  @Test
  void testInvalidReloadKeepsRunningConfiguration() {
    when(loader.load()).thenThrow(new ConfigurationException("Duplicate detector name:a"));
    when(pipeline.getRuntimeConfig())
        .thenReturn(RuntimeConfig.builder().loadedAt(Instant.now()).build());

    assertFalse(ConfigReloadJob.reload(pipeline, loader));
    verify(pipeline, never()).reload(any());
  }

  @Test
  void testMetricPollSubmitsSamples() throws IOException {
    ParsedSamples parsed = mock(ParsedSamples.class);
    when(parsed.getRejections()).thenReturn(List.of());
    when(source.poll()).thenReturn(parsed);
    when(pipeline.isAccepting()).thenReturn(true);

    new MetricPollJob().execute(context);

    verify(pipeline).submitPolled(parsed);
  }

  @Test
  void testMetricPollFailureIsContained() throws IOException {
    when(pipeline.isAccepting()).thenReturn(true);
    when(source.poll()).thenThrow(new IOException("connection refused"));

    new MetricPollJob().execute(context);

    verify(pipeline, never()).submitPolled(any());
  }

  @Test
  void testNothingIsPolledWhileStopping() throws IOException {
    when(pipeline.isAccepting()).thenReturn(false);

    new MetricPollJob().execute(context);

    verify(source, never()).poll();
  }

  @Test
  void testMaintenanceFailureIsContained() {
    doThrow(new IllegalStateException("boom")).when(pipeline).runMaintenance();

    new MaintenanceJob().execute(context);

    verify(pipeline).runMaintenance();
  }
}
