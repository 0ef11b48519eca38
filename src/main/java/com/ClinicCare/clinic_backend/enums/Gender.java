package com.ClinicCare.clinic_backend.enums;

public enum Gender {
    MALE,
    FEMALE,
    OTHER
}
