package com.oplogtail.core.config;

public final class MetricKeys {

  private MetricKeys() {}

  public static final String LOG_READ_COUNT = "log.read_count";
  public static final String LOG_SKIPPED_COUNT = "log.skipped_count";
  public static final String LOG_REOPEN_COUNT = "log.reopen_count";

  public static final String DIRECT_READ_COUNT = "direct_read.document_count";
  public static final String DIRECT_READ_ERROR_COUNT = "direct_read.error_count";

  public static final String BATCH_SIZE_FLUSH_COUNT = "batch.size_flush_count";
  public static final String BATCH_TIMER_FLUSH_COUNT = "batch.timer_flush_count";

  public static final String FETCH_SUCCESS_COUNT = "fetch.success_count";
  public static final String FETCH_MISSING_COUNT = "fetch.missing_count";
  public static final String FETCH_ERROR_COUNT = "fetch.error_count";

  public static final String MERGER_HELD_COUNT = "merger.held_count";

  public static final String FILTER_PASS_COUNT = "filter.pass_count";
  public static final String FILTER_DROP_COUNT = "filter.drop_count";

  public static final String DISPATCH_INSERT_COUNT = "dispatch.insert_count";
  public static final String DISPATCH_UPDATE_COUNT = "dispatch.update_count";
  public static final String DISPATCH_DELETE_COUNT = "dispatch.delete_count";
  public static final String DISPATCH_DROP_COUNT = "dispatch.drop_count";
  public static final String DISPATCH_DISCARD_COUNT = "dispatch.discard_count";
  public static final String HANDLER_ERROR_COUNT = "dispatch.handler_error_count";

  public static final String ERROR_PUBLISHED_COUNT = "error.published_count";
  public static final String ERROR_FAILED_COUNT = "error.failed_count";
}
