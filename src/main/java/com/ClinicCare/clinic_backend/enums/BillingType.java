package com.ClinicCare.clinic_backend.enums;

public enum BillingType {
    REGISTRATION,
    CONSULTATION,
    OPERATION,
    PHARMACY
}
