package com.triprelay.reasoner;

import com.triprelay.config.DaemonProperties;
import com.triprelay.failure.FailureKind;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Chat-completions reasoning client (Azure OpenAI style API)
 * - Independent connect and read timeouts
 * - In-call exponential-backoff retry on transient errors only
 * - One overall timeout across all attempts
 * - 4xx rejections are reported as permanent
 */
@Slf4j
@Component
public class ChatCompletionReasoner implements Reasoner {

    private final WebClient webClient;
    private final DaemonProperties.Reasoner settings;

    public ChatCompletionReasoner(@Qualifier("reasonerWebClient") WebClient webClient, DaemonProperties properties) {
        this.webClient = webClient;
        this.settings = properties.getReasoner();
    }

    @Override
    public String complete(String prompt) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            log.warn("complete: reasoner api key is not set; request may be rejected");
        }

        Map<String, Object> body = Map.of(
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "temperature", settings.getTemperature(),
                "max_tokens", settings.getMaxTokens());

        log.info("Calling reasoning service, promptLen={}", prompt.length());

        ChatCompletionResponse response = webClient.post()
                .uri(settings.getEndpoint())
                .header("api-key", settings.getApiKey() == null ? "" : settings.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .timeout(Duration.ofMillis(settings.getReadTimeoutMs() + settings.getConnectTimeoutMs()))
                .onErrorMap(ChatCompletionReasoner::classify)
                .retryWhen(Retry.backoff(settings.getMaxRetries(), Duration.ofMillis(settings.getRetryBaseDelayMs()))
                        .filter(ChatCompletionReasoner::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Reasoning call failed (attempt {}): {}",
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .timeout(Duration.ofMillis(settings.getTotalTimeoutMs()))
                .onErrorMap(ChatCompletionReasoner::classify)
                .block();

        String text = response == null ? null : response.getText();
        if (text == null || text.isBlank()) {
            throw new ReasonerException(ReasonerException.Reason.TRANSPORT, "Empty reasoning response", null);
        }
        log.info("Reasoning response received, length={}", text.length());
        return text;
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof ReasonerException reasonerException
                && reasonerException.getKind() == FailureKind.TRANSIENT;
    }

    /**
     * Map client errors onto the reasoner failure taxonomy
     */
    static ReasonerException classify(Throwable error) {
        if (error instanceof ReasonerException reasonerException) {
            return reasonerException;
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            boolean transientStatus = status >= 500 || status == 408 || status == 429
                    || status == 401 || status == 403;
            return new ReasonerException(
                    transientStatus ? ReasonerException.Reason.TRANSPORT : ReasonerException.Reason.REJECTED,
                    status, "Reasoning service returned HTTP " + status, error);
        }
        if (isTimeout(error)) {
            return new ReasonerException(ReasonerException.Reason.TIMEOUT,
                    "Reasoning call timed out: " + error.getMessage(), error);
        }
        if (error instanceof WebClientRequestException) {
            return new ReasonerException(ReasonerException.Reason.TRANSPORT,
                    "Reasoning service unreachable: " + error.getMessage(), error);
        }
        return new ReasonerException(ReasonerException.Reason.TRANSPORT,
                "Reasoning call failed: " + error.getMessage(), error);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException
                    || t instanceof ConnectTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
