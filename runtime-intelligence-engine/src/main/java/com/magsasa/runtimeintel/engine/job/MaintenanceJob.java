package com.magsasa.runtimeintel.engine.job;

import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import java.time.Duration;
import java.time.Instant;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Suppression sweep with digests and auto resolution, plus series eviction. */
@DisallowConcurrentExecution
public class MaintenanceJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(MaintenanceJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDataMap jobDataMap = jobExecutionContext.getJobDetail().getJobDataMap();
    RuntimeIntelligencePipeline pipeline =
        (RuntimeIntelligencePipeline) jobDataMap.get(JobConstants.JOB_DATA_MAP_PIPELINE);
    Instant start = Instant.now();
    try {
      pipeline.runMaintenance();
    } catch (RuntimeException e) {
      LOGGER.error("Maintenance run failed", e);
    }
    LOGGER.debug("Maintenance took {}", Duration.between(start, Instant.now()));
  }
}
