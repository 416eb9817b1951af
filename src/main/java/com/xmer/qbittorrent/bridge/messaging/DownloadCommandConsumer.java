package com.xmer.qbittorrent.bridge.messaging;

import com.xmer.qbittorrent.bridge.domain.DownloadCommand;
import com.xmer.qbittorrent.bridge.error.DownloadBridgeException;
import com.xmer.qbittorrent.bridge.error.ErrorCodes;
import com.xmer.qbittorrent.bridge.error.NonRetryableException;
import com.xmer.qbittorrent.bridge.service.DownloadSubmissionService;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.vertx.core.json.JsonObject;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.jboss.logging.Logger;

/**
 * Consumes {@code downloads.add} commands.
 * <p>
 * A failure is rethrown so the message is nacked; what happens next (requeue, dead-letter) is the
 * channel's failure strategy.
 */
@ApplicationScoped
public class DownloadCommandConsumer {

    private static final Logger LOG = Logger.getLogger(DownloadCommandConsumer.class);

    @Inject
    DownloadSubmissionService submissionService;

    @Incoming("download-commands")
    @Blocking
    public void onCommand(JsonObject payload) {
        try {
            if (payload == null) {
                throw new NonRetryableException("Empty download command", ErrorCodes.INVALID_MESSAGE);
            }
            DownloadCommand command = DownloadCommand.of(
                    payload.getValue("id"),
                    payload.getValue("magnetLink"),
                    payload.getValue("category"));

            LOG.debugf("Received download command: id=%s, category=%s", command.id(), command.category().value());
            submissionService.submit(command);
        } catch (DownloadBridgeException e) {
            LOG.warnf("Download command rejected [%s, retryable=%s]: %s", e.code(), e.retryable(), e.getMessage());
            throw e;
        }
    }
}
