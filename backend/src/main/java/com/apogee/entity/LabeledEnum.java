package com.apogee.entity;

/** Enum whose constants are stored under a lower-case PostgreSQL enum label. */
public interface LabeledEnum {

    String getLabel();

    static <T extends Enum<T> & LabeledEnum> T fromLabel(Class<T> enumClass, String label) {
        for (T constant : enumClass.getEnumConstants()) {
            if (constant.getLabel().equals(label)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                String.format("Unknown %s label: %s", enumClass.getSimpleName(), label));
    }
}
