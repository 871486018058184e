package dev.roshin.proofscanner.analysis.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.roshin.proofscanner.analysis.core.RankingEngine;
import dev.roshin.proofscanner.analysis.model.enums.AttemptOutcome;
import dev.roshin.proofscanner.analysis.model.tree.ProofTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a gnatprove JSON report and appends its proof results to a {@link ProofTree.Builder}.
 * <p>
 * Expected shape:
 * <pre>
 * { "proof": [ { "file": "pkg.adb", "line": 12, "rule": "VC_OVERFLOW_CHECK",
 *                "entity": { "name": "Pkg.Push" },
 *                "check_tree": [ { "proof_attempts": {
 *                    "CVC4": { "result": "Valid", "time": 0.1, "steps": 120 } } } ] } ] }
 * </pre>
 * Attempts made on goals produced by {@code "transformations"} (split goals, ...)
 * are accounted to the proof item that owns the check tree.
 * All proof items of a report are accounted to one unit, the report file name
 * without extension. The report is read completely and validated before
 * anything is added, so a rejected report leaves the builder untouched.
 */
public class SparkReportLoader {
    private static final Logger log = LoggerFactory.getLogger(SparkReportLoader.class);

    private final ObjectMapper mapper;

    public SparkReportLoader() {
        this(new ObjectMapper());
    }

    public SparkReportLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Loads one report into the builder.
     *
     * @return number of proof items added
     * @throws IOException              if the file can't be read or isn't JSON
     * @throws IllegalArgumentException if the document is not a JSON object or holds a
     *                                  negative or non-numeric time or step count
     */
    public int load(Path report, ProofTree.Builder builder) throws IOException {
        JsonNode root = mapper.readTree(report.toFile());
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Report is not a JSON object: " + report);
        }

        String unit = unitName(report);
        JsonNode proofs = root.path("proof");
        if (!proofs.isArray()) {
            log.debug("No proof section in {}", report);
            return 0;
        }

        List<PendingItem> pending = new ArrayList<>();
        for (JsonNode proof : proofs) {
            List<PendingAttempt> attempts = new ArrayList<>();
            for (JsonNode check : proof.path("check_tree")) {
                collectAttempts(check, attempts);
            }
            pending.add(new PendingItem(
                    text(proof.path("entity"), "name"),
                    text(proof, "file"),
                    text(proof, "rule"),
                    proof.path("line").asInt(0),
                    attempts
            ));
        }

        // Reject the whole report before anything reaches the shared builder
        for (PendingItem item : pending) {
            for (PendingAttempt attempt : item.attempts()) {
                if (!ProofTree.isValidMeasurement(attempt.timeSeconds(), attempt.steps())) {
                    throw new IllegalArgumentException(String.format(
                            "Invalid time %s or steps %s for prover %s in %s",
                            attempt.timeSeconds(), attempt.steps(), attempt.prover(), report));
                }
            }
        }

        Map<String, Integer> entities = new LinkedHashMap<>();
        for (PendingItem pendingItem : pending) {
            int entity = entities.computeIfAbsent(pendingItem.entity(), builder::addEntity);
            int item = builder.addProofItem(
                    entity, unit, pendingItem.sourceFile(), pendingItem.rule(), pendingItem.line());

            if (pendingItem.attempts().isEmpty()) {
                builder.addAttempt(item, RankingEngine.TRIVIAL_PROVER, AttemptOutcome.VALID, 0.0, 0L);
            }
            for (PendingAttempt attempt : pendingItem.attempts()) {
                builder.addAttempt(item, attempt.prover(), attempt.outcome(), attempt.timeSeconds(), attempt.steps());
            }
        }

        log.debug("Loaded {} proof items for {} entities from {}", pending.size(), entities.size(), report);
        return pending.size();
    }

    /**
     * Collects the attempts of a check tree node and of the goals produced by its
     * transformations (split goals, ...), depth first.
     */
    private static void collectAttempts(JsonNode check, List<PendingAttempt> attempts) {
        Iterator<Map.Entry<String, JsonNode>> fields = check.path("proof_attempts").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode attempt = field.getValue();
            attempts.add(new PendingAttempt(
                    field.getKey(),
                    AttemptOutcome.parse(text(attempt, "result")),
                    attempt.path("time").asDouble(0.0),
                    attempt.path("steps").asLong(0L)
            ));
        }

        for (JsonNode transformation : check.path("transformations")) {
            if (transformation.isArray()) {
                for (JsonNode goal : transformation) {
                    collectAttempts(goal, attempts);
                }
            } else if (transformation.isObject()) {
                collectAttempts(transformation, attempts);
            }
        }
    }

    static String unitName(Path report) {
        String fileName = report.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : "";
    }

    private record PendingAttempt(String prover, AttemptOutcome outcome, double timeSeconds, long steps) {
    }

    private record PendingItem(String entity, String sourceFile, String rule, int line,
                               List<PendingAttempt> attempts) {
    }
}
