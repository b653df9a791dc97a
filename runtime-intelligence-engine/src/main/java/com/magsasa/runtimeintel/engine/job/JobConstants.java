package com.magsasa.runtimeintel.engine.job;

public class JobConstants {
  public static final String JOBS_CONFIG = "jobs";
  public static final String JOB_GROUP = "runtime-intelligence";
  public static final String JOB_CONFIG_CRON_EXPRESSION = "cron";
  public static final String JOB_CONFIG_ENABLED = "enabled";

  public static final String MAINTENANCE_JOB = "maintenance";
  public static final String CONFIG_RELOAD_JOB = "config-reload";
  public static final String METRIC_POLL_JOB = "metric-poll";

  public static final String DEFAULT_MAINTENANCE_CRON = "0 * * * * ?";
  public static final String DEFAULT_CONFIG_RELOAD_CRON = "0 */5 * * * ?";
  public static final String DEFAULT_METRIC_POLL_CRON = "0/15 * * * * ?";

  public static final String JOB_DATA_MAP_PIPELINE = "pipeline";
  public static final String JOB_DATA_MAP_CONFIG_LOADER = "configLoader";
  public static final String JOB_DATA_MAP_SAMPLE_SOURCE = "sampleSource";

  private JobConstants() {}
}
