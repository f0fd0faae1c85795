package com.gt.studyplanner.model;

// Enums exchanged with clients by a stable lower-case name rather than the constant name
public interface WireNamed {

    String getWireName();

    static <T extends Enum<T> & WireNamed> T fromWireName(Class<T> enumClass, String wireName) {
        for (T value : enumClass.getEnumConstants()) {
            if (value.getWireName().equalsIgnoreCase(wireName) || value.name().equalsIgnoreCase(wireName)) {
                return value;
            }
        }

        throw new IllegalArgumentException("Unknown " + enumClass.getSimpleName() + " value: " + wireName);
    }
}
