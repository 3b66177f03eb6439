package com.triprelay.pipeline;

import com.triprelay.domain.ProcessingOutcome;
import com.triprelay.monitor.BatchResult;
import com.triprelay.monitor.NewMessageHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Runs the pipeline over each id of a batch, one message at a time.
 * A stop request is honoured between messages, never in the middle of one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboxProcessor implements NewMessageHandler {

    private final MessagePipeline pipeline;
    private final PipelineContext context;

    private volatile boolean stopping = false;

    @Override
    public BatchResult onNewMessages(Set<String> messageIds) {
        if (messageIds.isEmpty()) {
            log.debug("No unseen messages");
            return BatchResult.empty();
        }

        int attempted = 0;
        int succeeded = 0;
        int skipped = 0;
        int transientFailures = 0;
        int permanentFailures = 0;

        for (String id : messageIds) {
            if (stopping) {
                log.info("Stop requested, leaving {} message(s) for later", messageIds.size() - attempted);
                break;
            }
            attempted++;
            ProcessingOutcome outcome = pipeline.process(id, context);
            switch (outcome.type()) {
                case SUCCESS -> succeeded++;
                case SKIPPED -> skipped++;
                case TRANSIENT_FAILURE -> transientFailures++;
                case PERMANENT_FAILURE -> permanentFailures++;
            }
        }

        BatchResult result = new BatchResult(attempted, succeeded, skipped, transientFailures, permanentFailures);
        log.info("Batch done: {} processed, {} succeeded, {} skipped, {} to retry, {} failed",
                attempted, succeeded, skipped, transientFailures, permanentFailures);
        return result;
    }

    public void stop() {
        stopping = true;
    }
}
