package com.powerflow.tree.service.graph;

import com.powerflow.tree.dto.graph.EquipmentSummary;
import com.powerflow.tree.model.ConnectionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Distinct equipment mentioned by the connection records, in first-seen order.
 */
@Service
@Slf4j
public class EquipmentCatalog {

    public List<EquipmentSummary> listEquipment(List<ConnectionRecord> records) {
        Map<String, EquipmentSummary> equipment = new LinkedHashMap<>();

        for (ConnectionRecord record : records) {
            if (record == null) continue;
            for (String id : idsOf(record.getFrom())) {
                equipment.putIfAbsent(id, new EquipmentSummary(id, record.getFromName(), record.getFromType()));
            }
            for (String id : idsOf(record.getTo())) {
                equipment.putIfAbsent(id, new EquipmentSummary(id, record.getToName(), record.getToType()));
            }
        }

        log.info("Catalogued {} distinct equipment from {} records", equipment.size(), records.size());
        return new ArrayList<>(equipment.values());
    }

    private List<String> idsOf(List<String> ids) {
        if (ids == null) return Collections.emptyList();
        return ids.stream().filter(id -> id != null && !id.isBlank()).collect(Collectors.toList());
    }
}
