package io.github.riemr.fleet.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.riemr.fleet.application.util.ClockTimeUtils;
import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotClassification;
import io.github.riemr.fleet.domain.model.SlotDistribution;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 外部プロセス（学習済みモデルのスクリプト）を 1 リクエスト 1 プロセスで呼び出す実装。
 * 標準入力に JSON を 1 件書き込み、標準出力の JSON を 1 件読み取る。
 *
 * <pre>
 * {"action":"predict_owner","contractClass":"classA","resourceId":"T-12","dayOfWeek":1,"canonicalTime":"16:30"}
 * → {"driver":"D1","confidence":0.92}
 * </pre>
 * 非ゼロ終了・空出力・不正 JSON はすべて {@link OracleException}。
 */
@Slf4j
public class ProcessScoringOracle implements ScoringOracle {

    static final String ACTION_PREDICT_OWNER = "predict_owner";
    static final String ACTION_DISTRIBUTION = "get_distribution";
    static final String ACTION_AVAILABILITY = "predict_availability";
    static final String ACTION_PATTERN = "get_driver_pattern";
    static final String ACTION_RANK = "rank";

    private final List<String> command;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public ProcessScoringOracle(List<String> command, ObjectMapper objectMapper, Duration timeout) {
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("Oracle command is required");
        this.command = List.copyOf(command);
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public OwnershipPrediction predictOwner(Slot slot) {
        JsonNode res = invoke(slotRequest(ACTION_PREDICT_OWNER, slot));
        String driver = textOrNull(res.get("driver"));
        if (driver == null || "Unknown".equalsIgnoreCase(driver)) return OwnershipPrediction.none();
        return new OwnershipPrediction(driver, res.path("confidence").asDouble(0.0));
    }

    @Override
    public SlotDistribution distribution(Slot slot) {
        JsonNode res = invoke(slotRequest(ACTION_DISTRIBUTION, slot));
        JsonNode shares = res.path("shares");
        Map<String, Double> byDriver = new HashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = shares.fields(); it.hasNext(); ) {
            var e = it.next();
            byDriver.put(e.getKey(), e.getValue().asDouble(0.0));
        }
        int total = res.path("total_assignments").asInt(0);
        if (total <= 0 || byDriver.isEmpty()) return SlotDistribution.unknown(slot.slotKey());

        String owner = textOrNull(res.get("owner"));
        double ownerShare = res.path("owner_share").asDouble(owner == null ? 0.0 : byDriver.getOrDefault(owner, 0.0));
        // classification はシェアから決め直す（モデル側のラベルは参考扱い）
        boolean owned = owner != null && ownerShare >= SlotDistribution.OWNERSHIP_THRESHOLD;
        return SlotDistribution.builder()
                .slotKey(slot.slotKey())
                .classification(owned ? SlotClassification.OWNED
                        : SlotClassification.ROTATING)
                .ownerId(owned ? owner : null)
                .ownerShare(ownerShare)
                .shares(byDriver)
                .totalObservations(total)
                .build();
    }

    @Override
    public double availability(String driverId, LocalDate date, List<HistoryEntry> history) {
        ObjectNode req = objectMapper.createObjectNode();
        req.put("action", ACTION_AVAILABILITY);
        req.put("driverId", driverId);
        req.put("date", date.toString());
        ArrayNode hist = req.putArray("history");
        for (var h : history) {
            ObjectNode n = hist.addObject();
            n.put("serviceDate", h.getServiceDate() == null ? null : h.getServiceDate().toString());
            n.put("slotKey", h.getSlotKey());
            n.put("contractClass", h.getContractClass() == null ? null : h.getContractClass().getCode());
        }
        JsonNode res = invoke(req);
        if (!res.hasNonNull("probability")) throw new OracleException("Availability response has no probability");
        return ClockTimeUtils.clamp01(res.get("probability").asDouble());
    }

    @Override
    public DriverPattern pattern(String driverId) {
        ObjectNode req = objectMapper.createObjectNode();
        req.put("action", ACTION_PATTERN);
        req.put("driverId", driverId);
        JsonNode res = invoke(req);
        JsonNode days = res.get("typical_days");
        Integer typical = days == null || days.isNull() ? null : days.asInt();
        return new DriverPattern(driverId, typical, res.path("confidence").asDouble(0.0));
    }

    @Override
    public List<RankedDriver> rankBackups(Slot slot, List<String> candidateIds, String unavailableOwnerId) {
        ObjectNode req = slotRequest(ACTION_RANK, slot);
        req.put("serviceDate", slot.getServiceDate().toString());
        req.put("unavailableOwner", unavailableOwnerId);
        ArrayNode cands = req.putArray("candidates");
        candidateIds.forEach(cands::add);
        JsonNode res = invoke(req);
        List<RankedDriver> out = new ArrayList<>();
        // rankings: [["D1", 0.8], ["D2", 0.3]]
        for (JsonNode pair : res.path("rankings")) {
            if (pair.isArray() && pair.size() >= 2) {
                out.add(new RankedDriver(pair.get(0).asText(), pair.get(1).asDouble()));
            }
        }
        return out;
    }

    private ObjectNode slotRequest(String action, Slot slot) {
        ObjectNode req = objectMapper.createObjectNode();
        req.put("action", action);
        req.put("contractClass", slot.getContractClass().getCode());
        req.put("resourceId", slot.getResourceId());
        // 0 = Sunday
        req.put("dayOfWeek", slot.getDayOfWeek().getValue() % 7);
        req.put("canonicalTime", ClockTimeUtils.format(slot.getCanonicalStartTime()));
        return req;
    }

    JsonNode invoke(ObjectNode request) {
        String action = request.path("action").asText();
        Path out = null;
        Process process = null;
        try {
            out = Files.createTempFile("oracle-", ".json");
            process = new ProcessBuilder(command)
                    .redirectOutput(out.toFile())
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(objectMapper.writeValueAsBytes(request));
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new OracleException("Oracle '" + action + "' timed out after " + timeout);
            }
            if (process.exitValue() != 0) {
                throw new OracleException("Oracle '" + action + "' exited with code " + process.exitValue());
            }
            String body = Files.readString(out, StandardCharsets.UTF_8).trim();
            if (body.isEmpty()) throw new OracleException("Oracle '" + action + "' returned no output");
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new OracleException("Oracle '" + action + "' returned invalid JSON", e);
        } catch (IOException e) {
            throw new OracleException("Oracle '" + action + "' I/O failure: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Oracle '" + action + "' interrupted", e);
        } finally {
            if (process != null && process.isAlive()) process.destroyForcibly();
            if (out != null) deleteQuietly(out);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not delete oracle temp file {}: {}", p, e.getMessage());
        }
    }

    private static String textOrNull(JsonNode n) {
        return n == null || n.isNull() || n.asText().isBlank() ? null : n.asText();
    }
}
