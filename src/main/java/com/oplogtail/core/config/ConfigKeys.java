package com.oplogtail.core.config;

public final class ConfigKeys {

  private ConfigKeys() {}

  public static final String TAIL_PROFILE = "TAIL_PROFILE";
  public static final String TAIL_NAME = "TAIL_NAME";

  public static final String TAIL_RESUME_POSITION = "TAIL_RESUME_POSITION";
  public static final String TAIL_POSITION_FILE = "TAIL_POSITION_FILE";

  public static final String TAIL_INCLUDE_NS = "TAIL_INCLUDE_NS";
  public static final String TAIL_EXCLUDE_NS = "TAIL_EXCLUDE_NS";

  public static final String TAIL_DIRECT_READ_NS = "TAIL_DIRECT_READ_NS";
  public static final String TAIL_DIRECT_READERS_PER_COL = "TAIL_DIRECT_READERS_PER_COL";
  public static final String TAIL_DIRECT_READ_BATCH_SIZE = "TAIL_DIRECT_READ_BATCH_SIZE";
  public static final String TAIL_DIRECT_READ_LIMIT = "TAIL_DIRECT_READ_LIMIT";

  public static final String TAIL_CHANNEL_SIZE = "TAIL_CHANNEL_SIZE";
  public static final String TAIL_BUFFER_SIZE = "TAIL_BUFFER_SIZE";
  public static final String TAIL_BUFFER_DURATION_MS = "TAIL_BUFFER_DURATION_MS";
  public static final String TAIL_WORKER_COUNT = "TAIL_WORKER_COUNT";
  public static final String TAIL_ORDERING = "TAIL_ORDERING";
  public static final String TAIL_UPDATE_DATA_AS_DELTA = "TAIL_UPDATE_DATA_AS_DELTA";
}
