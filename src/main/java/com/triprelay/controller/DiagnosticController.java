package com.triprelay.controller;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.AttemptRecord;
import com.triprelay.domain.ConnectionState;
import com.triprelay.monitor.MailboxMonitor;
import com.triprelay.pipeline.PipelineContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Daemon diagnostic endpoint.
 * Hit GET /api/diagnostic to see monitor state, retry bookkeeping and server reachability.
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
@RequiredArgsConstructor
public class DiagnosticController {

    private static final int CONNECT_TIMEOUT_MS = 2000;

    private final DaemonProperties properties;
    private final MailboxMonitor monitor;
    private final PipelineContext context;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> diagnostic() {
        Map<String, Object> result = new LinkedHashMap<>();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("imapHost", properties.getImap().getHost());
        config.put("imapFolder", properties.getImap().getFolder());
        config.put("idleEnabled", properties.getMonitor().isIdleEnabled());
        config.put("idleWaitMs", properties.getMonitor().getEffectiveIdleWaitMs());
        config.put("pollIntervalMs", properties.getMonitor().getPollIntervalMs());
        config.put("maxAttempts", properties.getRetry().getMaxAttempts());
        config.put("parseFailurePolicy", properties.getRetry().getParseFailurePolicy());
        config.put("maxRepliesPerWindow", properties.getGuard().getMaxRepliesPerWindow());
        config.put("replyWindowMs", properties.getGuard().getWindowMs());
        result.put("config", config);

        ConnectionState state = monitor.getConnectionState();
        Map<String, Object> monitorStatus = new LinkedHashMap<>();
        monitorStatus.put("mode", monitor.getMode());
        monitorStatus.put("connection", state.getStatus());
        monitorStatus.put("reconnectAttempts", state.getReconnectAttempts());
        monitorStatus.put("lastError", state.getLastError());
        result.put("monitor", monitorStatus);

        List<Map<String, Object>> failures = new ArrayList<>();
        for (String id : context.getFailureTracker().trackedIds()) {
            Optional<AttemptRecord> record = context.getFailureTracker().find(id);
            record.ifPresent(r -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("messageId", r.getMessageId());
                entry.put("attempts", r.getCount());
                entry.put("lastAttemptAt", String.valueOf(r.getLastAttemptAt()));
                entry.put("lastCategory", r.getLastCategory());
                entry.put("lastFailureReason", r.getLastFailureReason());
                failures.add(entry);
            });
        }
        result.put("failures", failures);
        result.put("pendingAcknowledgements", context.pendingAcknowledgementIds());
        result.put("trackedRecipients", context.getRateLimiter().trackedRecipients());
        result.put("rateLimitedRecipients", context.getRateLimiter().limitedRecipients());

        Map<String, Object> servers = new LinkedHashMap<>();
        servers.put("imap", checkPort("IMAP", properties.getImap().getHost(), properties.getImap().getPort()));
        servers.put("smtp", checkPort("SMTP", properties.getSmtp().getHost(), properties.getSmtp().getPort()));
        result.put("servers", servers);

        log.info("Diagnostic check performed");
        return result;
    }

    private Map<String, Object> checkPort(String name, String host, int port) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("name", name);
        status.put("host", host);
        status.put("port", port);

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
            status.put("reachable", true);
            status.put("status", "OK - port is reachable");
        } catch (IOException e) {
            status.put("reachable", false);
            status.put("status", "FAIL - " + e.getMessage());
        }

        return status;
    }
}
