package com.ClinicCare.clinic_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    public static final String API_BASE_PATH = "/api/";

    // Tenant Constants
    public static final int TENANT_CODE_LENGTH = 6;
    public static final String TENANT_CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    public static final int MAX_TENANT_CODE_DRAWS = 100;
    public static final int MAX_SIGNUP_ATTEMPTS = 5;

    // Patient Constants
    public static final String PATIENT_NUMBER_FORMAT = "PT-%s-%03d";
    public static final String INITIAL_VISIT_NOTES = "Initial registration";
    public static final String DEFAULT_VISIT_NOTES = "New visit";

    // Billing Constants
    public static final int FEE_WAIVER_DAYS = 14;

    // Validation Constants
    public static final String EMAIL_PATTERN = "^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$";
    public static final String PHONE_PATTERN = "^\\+?[0-9]{10,15}$";
    public static final int MIN_PASSWORD_LENGTH = 6;

    public static final int MAX_PAGE_LIMIT = 100;
}
