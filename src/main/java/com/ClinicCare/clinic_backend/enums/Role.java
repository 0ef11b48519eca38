package com.ClinicCare.clinic_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Role a user holds inside one tenant. The same user may hold a different role in another tenant.
 */
public enum Role {
    ADMIN,
    DOCTOR,
    STAFF,
    NURSE;

    /** Every clinical role; used for list and read operations. */
    public static final Set<Role> ALL = Collections.unmodifiableSet(EnumSet.allOf(Role.class));

    public static final Set<Role> ADMIN_OR_DOCTOR = Collections.unmodifiableSet(EnumSet.of(ADMIN, DOCTOR));

    public static final Set<Role> ADMIN_DOCTOR_OR_STAFF = Collections.unmodifiableSet(EnumSet.of(ADMIN, DOCTOR, STAFF));

    public static final Set<Role> ADMIN_OR_STAFF = Collections.unmodifiableSet(EnumSet.of(ADMIN, STAFF));

    public static final Set<Role> ADMIN_ONLY = Collections.unmodifiableSet(EnumSet.of(ADMIN));

    @JsonCreator
    public static Role fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Role.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
