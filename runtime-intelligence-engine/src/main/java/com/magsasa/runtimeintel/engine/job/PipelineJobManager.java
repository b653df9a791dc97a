package com.magsasa.runtimeintel.engine.job;

import static com.magsasa.runtimeintel.engine.job.JobConstants.CONFIG_RELOAD_JOB;
import static com.magsasa.runtimeintel.engine.job.JobConstants.DEFAULT_CONFIG_RELOAD_CRON;
import static com.magsasa.runtimeintel.engine.job.JobConstants.DEFAULT_MAINTENANCE_CRON;
import static com.magsasa.runtimeintel.engine.job.JobConstants.DEFAULT_METRIC_POLL_CRON;
import static com.magsasa.runtimeintel.engine.job.JobConstants.JOBS_CONFIG;
import static com.magsasa.runtimeintel.engine.job.JobConstants.JOB_CONFIG_CRON_EXPRESSION;
import static com.magsasa.runtimeintel.engine.job.JobConstants.JOB_CONFIG_ENABLED;
import static com.magsasa.runtimeintel.engine.job.JobConstants.JOB_DATA_MAP_CONFIG_LOADER;
import static com.magsasa.runtimeintel.engine.job.JobConstants.JOB_DATA_MAP_PIPELINE;
import static com.magsasa.runtimeintel.engine.job.JobConstants.JOB_DATA_MAP_SAMPLE_SOURCE;
import static com.magsasa.runtimeintel.engine.job.JobConstants.JOB_GROUP;
import static com.magsasa.runtimeintel.engine.job.JobConstants.MAINTENANCE_JOB;
import static com.magsasa.runtimeintel.engine.job.JobConstants.METRIC_POLL_JOB;

import com.google.common.annotations.VisibleForTesting;
import com.magsasa.runtimeintel.detector.MetricSampleSource;
import com.magsasa.runtimeintel.engine.RuntimeIntelligencePipeline;
import com.magsasa.runtimeintel.engine.config.RuntimeConfigLoader;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.quartz.CronScheduleBuilder;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedules the periodic pipeline work: maintenance, configuration reload and, when a metric
 * feed is configured, metric polling. Collaborators reach the jobs through their JobDataMap.
 */
public class PipelineJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineJobManager.class);
  private static final String TRIGGER_SUFFIX = "-trigger";

  private final RuntimeIntelligencePipeline pipeline;
  private final RuntimeConfigLoader configLoader;
  // null when no metric feed is configured
  private final MetricSampleSource sampleSource;
  private final List<ScheduledJob> jobs = new ArrayList<>();

  public PipelineJobManager(
      RuntimeIntelligencePipeline pipeline,
      RuntimeConfigLoader configLoader,
      MetricSampleSource sampleSource) {
    this.pipeline = pipeline;
    this.configLoader = configLoader;
    this.sampleSource = sampleSource;
  }

  @Override
  public void initJob(Config appConfig) {
    Config jobsConfig =
        appConfig.hasPath(JOBS_CONFIG)
            ? appConfig.getConfig(JOBS_CONFIG)
            : ConfigFactory.parseMap(Map.of());
    jobs.clear();

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_PIPELINE, pipeline);
    jobDataMap.put(JOB_DATA_MAP_CONFIG_LOADER, configLoader);
    if (sampleSource != null) {
      jobDataMap.put(JOB_DATA_MAP_SAMPLE_SOURCE, sampleSource);
    }

    addJob(
        jobsConfig, MAINTENANCE_JOB, MaintenanceJob.class, DEFAULT_MAINTENANCE_CRON, jobDataMap);
    addJob(
        jobsConfig,
        CONFIG_RELOAD_JOB,
        ConfigReloadJob.class,
        DEFAULT_CONFIG_RELOAD_CRON,
        jobDataMap);
    if (sampleSource != null) {
      addJob(
          jobsConfig, METRIC_POLL_JOB, MetricPollJob.class, DEFAULT_METRIC_POLL_CRON, jobDataMap);
    }
  }

  private void addJob(
      Config jobsConfig,
      String name,
      Class<? extends Job> jobClass,
      String defaultCron,
      JobDataMap jobDataMap) {
    Config jobConfig =
        jobsConfig.hasPath(name) ? jobsConfig.getConfig(name) : ConfigFactory.parseMap(Map.of());
    if (jobConfig.hasPath(JOB_CONFIG_ENABLED) && !jobConfig.getBoolean(JOB_CONFIG_ENABLED)) {
      LOGGER.info("Job {} is disabled", name);
      return;
    }
    String cronExpression =
        jobConfig.hasPath(JOB_CONFIG_CRON_EXPRESSION)
            ? jobConfig.getString(JOB_CONFIG_CRON_EXPRESSION)
            : defaultCron;

    JobKey jobKey = JobKey.jobKey(name, JOB_GROUP);
    JobDetail jobDetail =
        JobBuilder.newJob(jobClass).withIdentity(jobKey).usingJobData(jobDataMap).build();
    Trigger trigger =
        TriggerBuilder.newTrigger()
            .withIdentity(name + TRIGGER_SUFFIX, JOB_GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .startNow()
            .build();
    jobs.add(new ScheduledJob(jobKey, jobDetail, trigger));
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    for (ScheduledJob job : jobs) {
      LOGGER.info("Schedule a job:{} with Trigger:{}", job.jobKey, job.trigger);
      scheduler.scheduleJob(job.jobDetail, job.trigger);
    }
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    for (ScheduledJob job : jobs) {
      if (scheduler.checkExists(job.jobKey)) {
        scheduler.deleteJob(job.jobKey);
      }
    }
  }

  @VisibleForTesting
  List<JobKey> getJobKeys() {
    List<JobKey> keys = new ArrayList<>();
    jobs.forEach(job -> keys.add(job.jobKey));
    return keys;
  }

  private static class ScheduledJob {
    private final JobKey jobKey;
    private final JobDetail jobDetail;
    private final Trigger trigger;

    ScheduledJob(JobKey jobKey, JobDetail jobDetail, Trigger trigger) {
      this.jobKey = jobKey;
      this.jobDetail = jobDetail;
      this.trigger = trigger;
    }
  }
}
