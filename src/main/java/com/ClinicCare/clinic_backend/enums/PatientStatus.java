package com.ClinicCare.clinic_backend.enums;

public enum PatientStatus {
    ACTIVE,
    REFERRED,
    DISCHARGED
}
