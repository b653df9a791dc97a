package com.magsasa.runtimeintel.engine.job;

import com.magsasa.runtimeintel.detector.MetricSampleParser.ParsedSamples;
import com.magsasa.runtimeintel.detector.MetricSampleSource;
import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import java.io.IOException;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Pulls the metric feed and submits what it returns to detection. */
@DisallowConcurrentExecution
public class MetricPollJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricPollJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDataMap jobDataMap = jobExecutionContext.getJobDetail().getJobDataMap();
    RuntimeIntelligencePipeline pipeline =
        (RuntimeIntelligencePipeline) jobDataMap.get(JobConstants.JOB_DATA_MAP_PIPELINE);
    MetricSampleSource source =
        (MetricSampleSource) jobDataMap.get(JobConstants.JOB_DATA_MAP_SAMPLE_SOURCE);
    if (!pipeline.isAccepting()) {
      return;
    }
    try {
      ParsedSamples parsed = source.poll();
      int submitted = pipeline.submitPolled(parsed);
      LOGGER.debug(
          "Submitted {} polled samples, {} rejected", submitted, parsed.getRejections().size());
    } catch (IOException e) {
      LOGGER.error("Metric poll failed", e);
    }
  }
}
