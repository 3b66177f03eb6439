package com.triprelay.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.triprelay.domain.Attachment;
import com.triprelay.domain.InboundMessage;
import com.triprelay.domain.ProcessingOutcome;
import com.triprelay.domain.ReasoningResult;
import com.triprelay.extract.ArtifactValidator;
import com.triprelay.extract.ExtractionException;
import com.triprelay.extract.OutputExtractor;
import com.triprelay.extract.ReasoningResultMapper;
import com.triprelay.failure.FailureCategory;
import com.triprelay.failure.FailureDecision;
import com.triprelay.failure.ProcessingFailure;
import com.triprelay.guard.AutoReplyGuard;
import com.triprelay.guard.SkipDecision;
import com.triprelay.mail.DocumentExtractor;
import com.triprelay.mail.Mailbox;
import com.triprelay.mail.Mailer;
import com.triprelay.mail.MalformedMessageException;
import com.triprelay.reasoner.Reasoner;
import com.triprelay.reasoner.ReasonerException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-message processing
 *
 * Fetch, auto-reply classification, attachment text extraction, reasoning,
 * structured extraction, calendar validation, rate-limited reply and
 * acknowledgement. Every step failure is classified and routed through the
 * failure tracker; a message ends terminal (acknowledged) or transient
 * (left unseen for the next offer). Never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessagePipeline {

    static final String METRIC_PROCESSED = "triprelay.messages.processed";

    private final Mailbox mailbox;
    private final Mailer mailer;
    private final DocumentExtractor documentExtractor;
    private final Reasoner reasoner;
    private final AutoReplyGuard autoReplyGuard;
    private final OutputExtractor outputExtractor;
    private final ReasoningResultMapper resultMapper;
    private final ArtifactValidator artifactValidator;
    private final ReplyAddressResolver replyAddressResolver;
    private final PromptBuilder promptBuilder;
    private final ReplyComposer replyComposer;
    private final MeterRegistry meterRegistry;

    public ProcessingOutcome process(String messageId, PipelineContext context) {
        log.info("Processing message UID {}", messageId);
        ProcessingOutcome outcome;
        try {
            outcome = run(messageId, context);
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing UID {}", messageId, e);
            outcome = fail(messageId, null, context,
                    ProcessingFailure.transientFailure(FailureCategory.INTERNAL, "Unexpected error: " + e.getMessage()));
        }

        meterRegistry.counter(METRIC_PROCESSED, "outcome", outcome.type().name().toLowerCase(Locale.ROOT)).increment();
        log.info("UID {} finished: {}{}", messageId, outcome.type(),
                outcome.reason() == null ? "" : " (" + outcome.reason() + ")");
        return outcome;
    }

    private ProcessingOutcome run(String messageId, PipelineContext context) {
        if (context.isAcknowledgementPending(messageId)) {
            return retryAcknowledgement(messageId, context);
        }

        // 1. Fetch
        InboundMessage message;
        try {
            message = mailbox.fetch(messageId);
        } catch (MalformedMessageException e) {
            return fail(messageId, null, context,
                    ProcessingFailure.permanentFailure(FailureCategory.INPUT, e.getMessage()));
        } catch (IOException e) {
            return fail(messageId, null, context,
                    ProcessingFailure.transientFailure(FailureCategory.FETCH, e.getMessage()));
        }

        // 2. Auto-reply / bounce classification
        SkipDecision decision = autoReplyGuard.classify(message);
        if (decision.skip()) {
            log.info("Skipping UID {} from {}: {}", messageId, message.getSender(), decision.reason());
            return finish(messageId, context, ProcessingOutcome.skipped(decision.reason()));
        }

        Optional<String> replyTo = replyAddressResolver.resolve(message);
        if (replyTo.isEmpty()) {
            log.info("No reply address for UID {}, completing without reply", messageId);
            return finish(messageId, context, ProcessingOutcome.success(false));
        }
        String recipient = replyTo.get();
        if (!context.getRateLimiter().canSend(recipient)) {
            return finish(messageId, context, ProcessingOutcome.skipped("Rate limit exceeded for " + recipient));
        }

        // 3. Attachment texts
        message = message.withAttachmentTexts(extractAttachmentTexts(message));

        // 4. Reasoning
        String rawOutput;
        try {
            rawOutput = reasoner.complete(promptBuilder.build(message));
        } catch (ReasonerException e) {
            return fail(messageId, message, context,
                    new ProcessingFailure(e.getKind(), FailureCategory.REASONER, e.getMessage()));
        }

        // 5. Structured extraction
        ReasoningResult result;
        try {
            JsonNode json = outputExtractor.extract(rawOutput);
            result = resultMapper.map(json);
        } catch (ExtractionException e) {
            return fail(messageId, message, context,
                    new ProcessingFailure(e.getKind(), e.getCategory(), e.getMessage()));
        }

        if (result.messageType().isAutomated()) {
            log.info("Reasoner classified UID {} as {}: {}", messageId, result.messageType(), result.typeReason());
            return finish(messageId, context, ProcessingOutcome.skipped("Classified as " + result.messageType()));
        }

        // 6. Calendar validation
        boolean calendarValid = result.hasCalendar() && artifactValidator.validate(result.calendar());
        if (!calendarValid) {
            log.warn("No valid calendar for UID {}, replying without attachment", messageId);
        }
        ReplyDraft reply = replyComposer.itineraryReply(message, result, calendarValid);

        // 7. Rate limit, atomically recorded
        if (!context.getRateLimiter().tryAcquire(recipient)) {
            return finish(messageId, context, ProcessingOutcome.skipped("Rate limit exceeded for " + recipient));
        }

        // 8. Send
        try {
            mailer.send(recipient, reply.subject(), reply.body(), reply.attachment());
        } catch (IOException e) {
            context.getRateLimiter().release(recipient);
            return fail(messageId, message, context,
                    ProcessingFailure.transientFailure(FailureCategory.SEND, e.getMessage()));
        }

        // 9. Acknowledge
        return finish(messageId, context, ProcessingOutcome.success(true));
    }

    private List<String> extractAttachmentTexts(InboundMessage message) {
        List<String> texts = new ArrayList<>();
        for (Attachment attachment : message.getAttachments()) {
            String text;
            try {
                text = documentExtractor.extract(attachment.content());
            } catch (RuntimeException e) {
                log.warn("Text extraction failed for attachment {}: {}", attachment.filename(), e.getMessage());
                text = "";
            }
            texts.add(text == null ? "" : text);
        }
        return texts;
    }

    private ProcessingOutcome fail(String messageId, InboundMessage message, PipelineContext context,
                                   ProcessingFailure failure) {
        FailureDecision decision = failure.isPermanent()
                ? context.getFailureTracker().recordPermanent(messageId, failure.reason())
                : context.getFailureTracker().recordFailure(messageId, failure.category(), failure.reason());

        if (decision == FailureDecision.RETRY) {
            log.warn("UID {} failed at {} and will be retried: {}", messageId, failure.category(), failure.reason());
            return ProcessingOutcome.transientFailure(failure.reason());
        }

        log.warn("UID {} is poisoned after {} failure(s), giving up", messageId,
                context.getFailureTracker().attempts(messageId));
        boolean noticeSent = sendFailureNotice(message, context);
        return finish(messageId, context, ProcessingOutcome.permanentFailure(failure.reason(), noticeSent));
    }

    /**
     * Best effort: one attempt, subject to the same rate limit as any reply
     */
    private boolean sendFailureNotice(InboundMessage message, PipelineContext context) {
        if (message == null) {
            return false;
        }
        Optional<String> replyTo = replyAddressResolver.resolve(message);
        if (replyTo.isEmpty()) {
            return false;
        }
        String recipient = replyTo.get();
        if (!context.getRateLimiter().tryAcquire(recipient)) {
            return false;
        }
        ReplyDraft notice = replyComposer.failureNotice(message);
        try {
            mailer.send(recipient, notice.subject(), notice.body(), notice.attachment());
            log.info("Sent failure notice to {}", recipient);
            return true;
        } catch (IOException e) {
            context.getRateLimiter().release(recipient);
            log.warn("Could not send failure notice to {}: {}", recipient, e.getMessage());
            return false;
        }
    }

    /**
     * Terminal outcome: forget the failure history and acknowledge
     */
    private ProcessingOutcome finish(String messageId, PipelineContext context, ProcessingOutcome outcome) {
        context.getFailureTracker().clear(messageId);
        try {
            mailbox.markHandled(messageId);
            context.removePendingAcknowledgement(messageId);
        } catch (IOException e) {
            log.error("Could not mark UID {} as handled, acknowledgement will be retried: {}",
                    messageId, e.getMessage());
            context.addPendingAcknowledgement(messageId);
        }
        return outcome;
    }

    /**
     * The message already reached a terminal outcome; only the acknowledgement is outstanding
     */
    private ProcessingOutcome retryAcknowledgement(String messageId, PipelineContext context) {
        try {
            mailbox.markHandled(messageId);
            context.removePendingAcknowledgement(messageId);
            log.info("Completed pending acknowledgement for UID {}", messageId);
            return ProcessingOutcome.skipped("Already processed");
        } catch (IOException e) {
            log.warn("Acknowledgement of UID {} still failing: {}", messageId, e.getMessage());
            return ProcessingOutcome.transientFailure("Acknowledgement pending: " + e.getMessage());
        }
    }
}
