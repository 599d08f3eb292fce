package io.github.tripaggregation.router;

import io.github.tripaggregation.model.BatchFileNotification;
import io.github.tripaggregation.model.ReductionOutcome;
import io.github.tripaggregation.reduction.ReductionOrchestrator;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts one reduction cycle per batch file notification. Notifications are neither filtered nor
 * deduplicated.
 */
@Singleton
public class NotificationRouter {

  private static final Logger log = LoggerFactory.getLogger(NotificationRouter.class);

  private final NotificationParser notificationParser;
  private final ReductionOrchestrator orchestrator;

  /**
   * Instantiates a new Notification router.
   *
   * @param notificationParser the notification parser
   * @param orchestrator       the orchestrator
   */
  @Inject
  public NotificationRouter(final NotificationParser notificationParser,
                            final ReductionOrchestrator orchestrator) {
    this.notificationParser = notificationParser;
    this.orchestrator = orchestrator;
  }

  /**
   * Route a notification.
   *
   * @param notification the notification
   * @return the outcome of the reduction cycle
   */
  public ReductionOutcome route(final BatchFileNotification notification) {
    log.info("Batch file written to {}: {}", notification.bucketName(), notification.key());
    return orchestrator.run(notification.key());
  }

  /**
   * Route a notification given as JSON.
   *
   * @param json the json
   * @return the outcome of the reduction cycle
   */
  public ReductionOutcome route(final String json) {
    return route(notificationParser.parse(json));
  }
}
