package com.ClinicCare.clinic_backend.enums;

public enum PaymentStatus {
    UNPAID,
    PARTIAL,
    PAID
}
