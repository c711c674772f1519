package com.kotsin.structure.execution.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.kotsin.structure.exception.SystemicException;
import com.kotsin.structure.exception.ValidationException;
import com.kotsin.structure.execution.model.ExecutionResult;
import com.kotsin.structure.execution.service.ExecutionContextFactory;
import com.kotsin.structure.execution.service.ExecutionScaffold;
import com.kotsin.structure.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * ExecutionTriggerListener - event mode entry point.
 *
 * One message is one single-symbol execution. Malformed or invalid triggers
 * are logged and dropped; a systemic failure is rethrown to the container.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mode", havingValue = "event", matchIfMissing = true)
public class ExecutionTriggerListener {

    private final ExecutionContextFactory contextFactory;
    private final ExecutionScaffold scaffold;

    @KafkaListener(
            topics = "${execution.trigger.topic}",
            groupId = "${execution.trigger.group-id}",
            containerFactory = "triggerKafkaListenerContainerFactory"
    )
    public void onTrigger(String payload) {
        TriggerMessage message;
        try {
            message = JsonUtils.fromJson(payload, TriggerMessage.class);
        } catch (JsonProcessingException e) {
            log.error("[TRIGGER] Dropping unparseable trigger: {}", e.getOriginalMessage());
            return;
        }
        if (message == null) {
            log.warn("[TRIGGER] Received null trigger");
            return;
        }

        log.info("[TRIGGER] RECEIVED | {} | snapshot_time={} | dry_run={} | trace_id={}",
                message.symbol(), message.snapshotTime(), message.dryRun(), message.traceId());
        try {
            ExecutionResult result = scaffold.execute(contextFactory.fromTrigger(message.toTrigger()));
            log.info("[TRIGGER] PROCESSED | {} | trace_id={} | succeeded={} | failed={}",
                    message.symbol(), result.getTraceId(), result.succeeded(), result.failed());
        } catch (ValidationException e) {
            log.error("[TRIGGER] Rejected trigger for {}: {}", message.symbol(), e.getViolations());
        } catch (SystemicException e) {
            log.error("[TRIGGER] Systemic failure for {}: {}", message.symbol(), e.getMessage());
            throw e;
        }
    }
}
