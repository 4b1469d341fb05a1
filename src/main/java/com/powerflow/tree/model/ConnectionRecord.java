package com.powerflow.tree.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One raw connection row as supplied by the data source.
 * A record may carry several origins and destinations; every origin feeds every destination.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRecord {

    private String id;
    private int sequence;           // Position in the source feed, used for first-seen tie-breaking
    private List<String> from;      // Origin equipment ids
    private List<String> to;        // Destination equipment ids
    private String sourceLabel;     // S1, S2 (or raw variants such as "2", "Source 2")
    private String fromName;
    private String fromType;
    private String toName;
    private String toType;
}
