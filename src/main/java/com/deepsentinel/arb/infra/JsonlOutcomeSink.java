package com.deepsentinel.arb.infra;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.core.OutcomeLedger;
import com.deepsentinel.arb.core.OutcomeSink;
import com.deepsentinel.arb.domain.OutcomeRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Appends every outcome as one JSON line to {@code arb.outcomes.log-path}, together with the
 * running PnL. A blank path disables the sink.
 */
@Slf4j
@Component
public class JsonlOutcomeSink implements OutcomeSink {

    private final ObjectMapper objectMapper;
    private final OutcomeLedger ledger;
    private final Path logFile;

    @Autowired
    public JsonlOutcomeSink(ObjectMapper objectMapper, OutcomeLedger ledger, ArbProperties properties) {
        this(objectMapper, ledger, toPath(properties.getOutcomes().getLogPath()));
    }

    JsonlOutcomeSink(ObjectMapper objectMapper, OutcomeLedger ledger, Path logFile) {
        this.objectMapper = objectMapper;
        this.ledger = ledger;
        this.logFile = logFile;
        if (logFile == null) {
            log.info("Outcome log disabled");
        } else {
            log.info("Writing outcomes to {}", logFile.toAbsolutePath());
        }
    }

    private static Path toPath(String logPath) {
        return logPath == null || logPath.isBlank() ? null : Paths.get(logPath);
    }

    @Override
    public synchronized void emit(OutcomeRecord record) {
        if (logFile == null) {
            return;
        }
        ObjectNode line = objectMapper.valueToTree(record);
        line.put("datetime", record.getTimestamp() == null ? null : record.getTimestamp().toString());
        line.put("cumulativePnl", ledger.pnlSummary().getCumulativePnl());

        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, objectMapper.writeValueAsString(line) + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise outcome " + record.getOpportunityId(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to outcome log " + logFile, e);
        }
    }
}
