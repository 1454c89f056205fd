package com.codeheadsystems.quartermaster.dropwizard.lifecycle;

import com.codeheadsystems.quartermaster.server.store.AuthorizationCodeStore;
import com.codeheadsystems.quartermaster.server.store.TokenStore;
import io.dropwizard.lifecycle.Managed;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically purges expired authorization codes and access tokens so abandoned grants do not
 * accumulate. Correctness never depends on it: both stores also evict lazily on read.
 */
public class ExpiredGrantReaper implements Managed {

  private static final Logger log = LoggerFactory.getLogger(ExpiredGrantReaper.class);

  private final AuthorizationCodeStore codeStore;
  private final TokenStore tokenStore;
  private final Duration interval;
  private final ScheduledExecutorService reaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "quartermaster-grant-reaper");
        t.setDaemon(true);
        return t;
      });

  public ExpiredGrantReaper(AuthorizationCodeStore codeStore, TokenStore tokenStore,
                            Duration interval) {
    this.codeStore = codeStore;
    this.tokenStore = tokenStore;
    this.interval = interval;
  }

  @Override
  public void start() {
    long seconds = interval.toSeconds();
    reaper.scheduleAtFixedRate(this::reap, seconds, seconds, TimeUnit.SECONDS);
    log.info("Grant reaper running every {}s", seconds);
  }

  @Override
  public void stop() {
    reaper.shutdown();
  }

  /**
   * Runs one purge pass.
   */
  void reap() {
    try {
      int codes = codeStore.purgeExpired();
      int tokens = tokenStore.purgeExpired();
      if (codes > 0 || tokens > 0) {
        log.debug("Reaped {} code(s) and {} token(s)", codes, tokens);
      }
    } catch (RuntimeException e) {
      // A thrown exception would cancel every future run of this task.
      log.error("Grant reaper pass failed", e);
    }
  }
}
