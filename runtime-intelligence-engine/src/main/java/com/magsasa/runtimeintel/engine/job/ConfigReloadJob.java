package com.magsasa.runtimeintel.engine.job;

import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import com.magsasa.runtimeintel.engine.config.RuntimeConfig;
import com.magsasa.runtimeintel.engine.config.RuntimeConfigLoader;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Re-reads rules and channels. An invalid document leaves the running configuration alone. */
@DisallowConcurrentExecution
public class ConfigReloadJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigReloadJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDataMap jobDataMap = jobExecutionContext.getJobDetail().getJobDataMap();
    RuntimeIntelligencePipeline pipeline =
        (RuntimeIntelligencePipeline) jobDataMap.get(JobConstants.JOB_DATA_MAP_PIPELINE);
    RuntimeConfigLoader loader =
        (RuntimeConfigLoader) jobDataMap.get(JobConstants.JOB_DATA_MAP_CONFIG_LOADER);
    reload(pipeline, loader);
  }

  static boolean reload(RuntimeIntelligencePipeline pipeline, RuntimeConfigLoader loader) {
    RuntimeConfig next;
    try {
      next = loader.load();
    } catch (ConfigurationException e) {
      LOGGER.error(
          "Rejected configuration reload, keeping snapshot loaded at {}",
          pipeline.getRuntimeConfig().getLoadedAt(),
          e);
      return false;
    }
    pipeline.reload(next);
    return true;
  }
}
