package com.powerflow.tree.service.graph;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.exception.EquipmentNotFoundException;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionRecord;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns raw connection records into a bidirectional adjacency map.
 *
 * Every origin x destination pair of a record becomes one relation, stored as a downstream
 * relation on the origin and as an upstream relation on the destination. Each relation carries
 * the derived classification (normal, bypass, redundant) so later passes never re-derive it.
 */
@Service
@Slf4j
public class ConnectionGraphBuilder {

    public static final String UNNAMED = "Unnamed";
    public static final String UNKNOWN_TYPE = "Unknown Type";

    /**
     * Clean raw records: placeholders for missing names and types, empty id lists for missing
     * id sets, records ordered by their explicit sequence. Never fails on bad input.
     */
    public List<ConnectionRecord> sanitize(List<ConnectionRecord> records, LayoutDiagnostics diagnostics) {
        if (records == null || records.isEmpty()) {
            return Collections.emptyList();
        }

        List<ConnectionRecord> cleaned = new ArrayList<>(records.size());
        for (ConnectionRecord raw : records) {
            if (raw == null) {
                log.warn("Skipping null connection record");
                diagnostics.warn(DiagnosticCode.MALFORMED_RECORD, null, "Null connection record skipped");
                continue;
            }

            List<String> problems = new ArrayList<>();
            List<String> from = cleanIds(raw.getFrom(), "from", problems);
            List<String> to = cleanIds(raw.getTo(), "to", problems);

            ConnectionRecord record = ConnectionRecord.builder()
                    .id(raw.getId())
                    .sequence(raw.getSequence())
                    .from(from)
                    .to(to)
                    .sourceLabel(normalizeSourceLabel(raw.getSourceLabel()))
                    .fromName(orPlaceholder(raw.getFromName(), UNNAMED, "fromName", problems))
                    .fromType(orPlaceholder(raw.getFromType(), UNKNOWN_TYPE, "fromType", problems))
                    .toName(orPlaceholder(raw.getToName(), UNNAMED, "toName", problems))
                    .toType(orPlaceholder(raw.getToType(), UNKNOWN_TYPE, "toType", problems))
                    .build();

            if (!problems.isEmpty()) {
                String message = "Record " + raw.getId() + " degraded: " + String.join(", ", problems);
                log.warn("Malformed connection record: {}", message);
                diagnostics.warn(DiagnosticCode.MALFORMED_RECORD, raw.getId(), message);
            }
            cleaned.add(record);
        }

        // Stable sort keeps feed order for records sharing a sequence number
        cleaned.sort(Comparator.comparingInt(ConnectionRecord::getSequence));
        return cleaned;
    }

    /**
     * Build the adjacency map from sanitized records.
     */
    public ConnectionMap build(List<ConnectionRecord> records) {
        ConnectionMap connectionMap = new ConnectionMap();

        // Register every id first so entries keep first-seen order
        for (ConnectionRecord record : records) {
            record.getFrom().forEach(connectionMap::getOrCreate);
            record.getTo().forEach(connectionMap::getOrCreate);
        }

        int relationCount = 0;
        for (ConnectionRecord record : records) {
            String sourceLabel = record.getSourceLabel() != null
                    ? record.getSourceLabel()
                    : Branch.PRIMARY.getSourceLabel();
            ConnectionType classification = classify(record);

            for (String fromId : record.getFrom()) {
                for (String toId : record.getTo()) {
                    connectionMap.getOrCreate(fromId).getDownstream().add(ConnectionRelation.builder()
                            .id(toId)
                            .name(record.getToName())
                            .type(record.getToType())
                            .sourceLabel(sourceLabel)
                            .classification(classification)
                            .build());

                    connectionMap.getOrCreate(toId).getUpstream().add(ConnectionRelation.builder()
                            .id(fromId)
                            .name(record.getFromName())
                            .type(record.getFromType())
                            .sourceLabel(sourceLabel)
                            .classification(classification)
                            .build());
                    relationCount++;
                }
            }
        }

        log.info("Built connection map with {} equipment entries and {} relations",
                connectionMap.size(), relationCount);
        return connectionMap;
    }

    /**
     * Classify a record. Priority: power storage on a secondary feed, power storage feeding a
     * critical panel, any secondary feed, otherwise normal.
     */
    public ConnectionType classify(ConnectionRecord record) {
        boolean secondary = Branch.SECONDARY.getSourceLabel().equals(record.getSourceLabel());
        boolean fromPowerStorage = EquipmentTypes.isPowerStorage(record.getFromType());

        if (fromPowerStorage && secondary) {
            return ConnectionType.BYPASS;
        }
        if (fromPowerStorage && EquipmentTypes.isCriticalPanel(record.getToType())) {
            return ConnectionType.BYPASS;
        }
        if (secondary) {
            return ConnectionType.REDUNDANT;
        }
        return ConnectionType.NORMAL;
    }

    /**
     * Resolve the selected equipment from the first record mentioning it, origin side first.
     *
     * @throws EquipmentNotFoundException when no record mentions the id
     */
    public EquipmentNode findEquipment(String equipmentId, List<ConnectionRecord> records) {
        for (ConnectionRecord record : records) {
            if (record.getFrom().contains(equipmentId)) {
                return selected(equipmentId, record.getFromName(), record.getFromType());
            }
            if (record.getTo().contains(equipmentId)) {
                return selected(equipmentId, record.getToName(), record.getToType());
            }
        }
        throw new EquipmentNotFoundException(equipmentId);
    }

    /**
     * Map the raw label variants onto S1/S2. "S2", "2" and "Source 2" are secondary,
     * anything else (including nothing) is primary.
     */
    public static String normalizeSourceLabel(String raw) {
        if (raw == null) {
            return Branch.PRIMARY.getSourceLabel();
        }
        String compact = raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (compact.equals("S2") || compact.equals("2") || compact.equals("SOURCE2")) {
            return Branch.SECONDARY.getSourceLabel();
        }
        return Branch.PRIMARY.getSourceLabel();
    }

    // ========================= HELPERS =========================

    private EquipmentNode selected(String id, String name, String type) {
        return EquipmentNode.builder()
                .id(id)
                .name(name)
                .type(type)
                .level(0)
                .build();
    }

    private List<String> cleanIds(List<String> ids, String field, List<String> problems) {
        if (ids == null) {
            problems.add(field + " ids missing");
            return Collections.emptyList();
        }
        List<String> cleaned = ids.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.toList());
        if (cleaned.size() != ids.size()) {
            problems.add(field + " ids contain blanks");
        }
        return cleaned;
    }

    private String orPlaceholder(String value, String placeholder, String field, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add(field + " missing");
            return placeholder;
        }
        return value;
    }
}
