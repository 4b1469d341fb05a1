package com.powerflow.tree.service.graph;

import com.powerflow.tree.model.layout.TypeCategory;

import java.util.Locale;

/**
 * Type tag checks shared by the graph and layout passes.
 * Type tags look like "MDS: Main Distribution Switchboard"; matching is case-insensitive.
 */
public final class EquipmentTypes {

    private EquipmentTypes() {
    }

    public static boolean isPowerStorage(String type) {
        return upper(type).contains("UPS");
    }

    /**
     * Power storage by type tag or by name, used where a node must stay anchored.
     */
    public static boolean isPowerStorage(String type, String name) {
        return isPowerStorage(type) || (name != null && name.toLowerCase(Locale.ROOT).contains("ups"));
    }

    public static boolean isCriticalPanel(String type) {
        return upper(type).contains("CUPP");
    }

    public static boolean isMainDistribution(String type) {
        return upper(type).contains("MDS");
    }

    /**
     * MDS, SWGR or switchgear.
     */
    public static boolean isDistributionSwitch(String type) {
        String value = upper(type);
        return value.contains("MDS") || value.contains("SWGR") || value.contains("SWITCHGEAR");
    }

    /**
     * Equipment where primary and secondary feeds meet.
     */
    public static boolean isConvergencePoint(String type) {
        String value = upper(type);
        return value.contains("UTILITY") || value.contains("GEN")
                || value.contains("SWGR") || value.contains("SWITCHGEAR");
    }

    public static TypeCategory categorize(String type) {
        String value = upper(type);
        if (value.contains("UTILITY") || value.contains("PADMOUNT") || value.contains("PAD MOUNT")) {
            return TypeCategory.UTILITY;
        }
        if (value.contains("MDS") || value.contains("SWGR") || value.contains("SWITCHGEAR")) {
            return TypeCategory.DISTRIBUTION;
        }
        if (value.contains("UPS")) {
            return TypeCategory.DISTRIBUTION;
        }
        if (value.contains("TX") || value.contains("TRANSFORMER") || value.contains("XFMR")) {
            return TypeCategory.TRANSFORMER;
        }
        if (value.contains("GEN") || value.contains("GENERATOR")) {
            return TypeCategory.GENERATOR;
        }
        return TypeCategory.END_EQUIPMENT;
    }

    /**
     * Part of the type tag before the first colon, upper-cased.
     */
    public static String typePrefix(String type) {
        if (type == null) return "";
        int colon = type.indexOf(':');
        String prefix = colon >= 0 ? type.substring(0, colon) : type;
        return prefix.trim().toUpperCase(Locale.ROOT);
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT);
    }
}
