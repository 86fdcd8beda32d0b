package com.dealsim.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Distance between the counterpart's acceptable range and the user's, the fourth axis of
 * the run matrix.
 */
public enum ZopaDistanceEnum {

    CLOSE("close"),
    MEDIUM("medium"),
    FAR("far");

    private final String code;

    ZopaDistanceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Catalog order used when the "all" selector is resolved.
     */
    public static List<String> allCodes() {
        List<String> codes = new ArrayList<>();
        for (ZopaDistanceEnum distance : ZopaDistanceEnum.values()) {
            codes.add(distance.code);
        }
        return codes;
    }

    public static ZopaDistanceEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ZopaDistanceEnum distance : ZopaDistanceEnum.values()) {
            if (distance.code.equals(code)) {
                return distance;
            }
        }
        throw new IllegalArgumentException("Unknown zopa distance code: " + code);
    }
}
