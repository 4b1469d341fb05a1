package com.powerflow.tree.exception;

import lombok.Getter;

/**
 * The selected equipment id does not appear in any connection record.
 */
@Getter
public class EquipmentNotFoundException extends RuntimeException {

    private final String equipmentId;

    public EquipmentNotFoundException(String equipmentId) {
        super("Equipment with ID " + equipmentId + " not found");
        this.equipmentId = equipmentId;
    }
}
