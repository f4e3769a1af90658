package com.oplogtail.launcher;

import static com.oplogtail.core.config.ConfigKeys.TAIL_PROFILE;

import com.oplogtail.connector.mongo.MongoOplogStore;
import com.oplogtail.core.config.ScopedConfig;
import com.oplogtail.tail.OplogTailer;
import com.oplogtail.tail.TailConfig;
import com.oplogtail.tail.TailHandlers;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line tailer: logs every change of the configured MongoDB deployment until the JVM is
 * shut down.
 *
 * <pre>
 * java -jar oplogtail.jar [profile]
 * </pre>
 */
public class OplogTailApp {

  private static final Logger log = LoggerFactory.getLogger(OplogTailApp.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

  public static void main(String[] args) throws Exception {
    String profile = args.length > 0 ? args[0] : ScopedConfig.getOrDefault(TAIL_PROFILE, null);
    if (profile != null) {
      ScopedConfig.activateProfile(profile);
    }

    TailConfig config = TailConfig.fromScopedConfig();
    OplogTailer tailer = new OplogTailer(MongoOplogStore.fromScopedConfig());
    LoggingTailHandler handler = new LoggingTailHandler();

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  log.info("[OplogTailApp] Shutdown requested, draining");
                  if (!tailer.stop(SHUTDOWN_GRACE)) {
                    log.warn("[OplogTailApp] Drain did not finish within {}", SHUTDOWN_GRACE);
                  }
                  log.info("[OplogTailApp] {} events delivered, last position {}",
                      handler.deliveredCount(), tailer.currentPosition().orElse(null));
                },
                "oplogtail-shutdown"));

    tailer.start(config, TailHandlers.of(handler));
    if (!config.getDirectReadNamespaces().isEmpty() && tailer.awaitSnapshotComplete()) {
      log.info("[OplogTailApp] Direct read finished, {} events so far", handler.deliveredCount());
    }
    tailer.awaitStopped(null);
  }
}
