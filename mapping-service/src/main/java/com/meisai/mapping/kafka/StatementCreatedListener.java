package com.meisai.mapping.kafka;

import com.meisai.common.model.StatementRecordEvent;
import com.meisai.mapping.dto.MappingView;
import com.meisai.mapping.service.AutoProposalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/** Feeds statement-created events into automatic proposal; idle unless auto-propose is enabled. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementCreatedListener {

    private final AutoProposalService autoProposalService;

    @KafkaListener(
            topics = "${meisai.topics.statement-created:meisai.statement.created}",
            containerFactory = "statementCreatedListenerFactory",
            autoStartup = "${meisai.matching.auto-propose.enabled:false}"
    )
    public void onStatementCreated(StatementRecordEvent event) {
        List<MappingView> created = autoProposalService.proposeFor(event);
        log.info("Statement {} created, {} mapping(s) proposed", event.getRecordId(), created.size());
    }
}
