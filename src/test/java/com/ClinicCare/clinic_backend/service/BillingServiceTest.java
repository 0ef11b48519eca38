package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.PaymentUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.BillingResponse;
import com.ClinicCare.clinic_backend.enums.BillingType;
import com.ClinicCare.clinic_backend.enums.PaymentMethod;
import com.ClinicCare.clinic_backend.enums.PaymentStatus;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ForbiddenException;
import com.ClinicCare.clinic_backend.model.Billing;
import com.ClinicCare.clinic_backend.model.Patient;
import com.ClinicCare.clinic_backend.repository.BillingRepository;
import com.ClinicCare.clinic_backend.repository.PatientRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BillingServiceTest {

    private static final Instant NOW_INSTANT = Instant.parse("2025-07-01T11:15:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);

    @Mock
    private BillingRepository billingRepository;
    @Mock
    private PatientRepository patientRepository;
    @Mock
    private TenantMembershipService membershipService;

    private BillingService billingService;

    private final UUID tenantId = UUID.randomUUID();
    private final AuthenticatedUser staff = AuthenticatedUser.builder()
            .id(UUID.randomUUID()).email("desk@abc.com").role(Role.STAFF).tenantId(tenantId).build();
    private Patient patient;

    @BeforeEach
    void setUp() {
        billingService = new BillingService(billingRepository, patientRepository, membershipService,
                Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));
        patient = Patient.builder().id(UUID.randomUUID()).tenantId(tenantId).patientNumber("PT-ABC-001")
                .fullName("Ann Lee").build();
        lenient().when(billingRepository.save(any(Billing.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Billing unpaidBill() {
        return Billing.builder().id(UUID.randomUUID()).patient(patient).type(BillingType.REGISTRATION)
                .amount(new BigDecimal("500")).build();
    }

    @Test
    @DisplayName("side-effect bills start UNPAID and a null amount becomes zero")
    void recordsUnpaid() {
        Billing billing = billingService.recordRegistrationFee(patient, null);

        assertThat(billing.getStatus()).isEqualTo(PaymentStatus.UNPAID);
        assertThat(billing.getType()).isEqualTo(BillingType.REGISTRATION);
        assertThat(billing.getAmount()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("adjusting without an operation bill changes nothing")
    void adjustWithoutBill() {
        when(billingRepository.findFirstByPatientIdAndTypeAndDeletedAtIsNullOrderByCreatedAtDesc(patient.getId(), BillingType.OPERATION))
                .thenReturn(Optional.empty());

        assertThat(billingService.adjustLatestOperationFee(patient.getId(), BigDecimal.TEN)).isEmpty();
        verify(billingRepository, never()).save(any());
    }

    @Nested
    @DisplayName("updatePayment")
    class UpdatePayment {

        @BeforeEach
        void allowStaff() {
            lenient().when(membershipService.requireRole(staff, Role.ADMIN_OR_STAFF, "record payments"))
                    .thenReturn(Role.STAFF);
        }

        @Test
        @DisplayName("marking paid records the method and the time")
        void paid() {
            Billing billing = unpaidBill();
            when(billingRepository.findById(billing.getId())).thenReturn(Optional.of(billing));

            ApiResponse<BillingResponse> result = billingService.updatePayment(billing.getId(),
                    PaymentUpdateRequest.builder().status(PaymentStatus.PAID).paymentMethod(PaymentMethod.MPESA).build(), staff);

            assertThat(result.getStatusCode()).isEqualTo(200);
            assertThat(result.getData().getPaymentMethod()).isEqualTo(PaymentMethod.MPESA);
            assertThat(billing.getPaidAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("a paid status without a method is rejected")
        void methodRequired() {
            Billing billing = unpaidBill();
            when(billingRepository.findById(billing.getId())).thenReturn(Optional.of(billing));

            ApiResponse<BillingResponse> result = billingService.updatePayment(billing.getId(),
                    PaymentUpdateRequest.builder().status(PaymentStatus.PARTIAL).build(), staff);

            assertThat(result.getStatusCode()).isEqualTo(400);
            assertThat(billing.getStatus()).isEqualTo(PaymentStatus.UNPAID);
        }

        @Test
        @DisplayName("reverting to UNPAID clears the method and the time")
        void revert() {
            Billing billing = unpaidBill();
            billing.setStatus(PaymentStatus.PAID);
            billing.setPaymentMethod(PaymentMethod.CASH);
            billing.setPaidAt(NOW.minusDays(1));
            when(billingRepository.findById(billing.getId())).thenReturn(Optional.of(billing));

            billingService.updatePayment(billing.getId(),
                    PaymentUpdateRequest.builder().status(PaymentStatus.UNPAID).paymentMethod(PaymentMethod.CASH).build(), staff);

            assertThat(billing.getPaymentMethod()).isNull();
            assertThat(billing.getPaidAt()).isNull();
        }

        @Test
        @DisplayName("a bill of another clinic is not found")
        void foreignBill() {
            Billing billing = unpaidBill();
            patient.setTenantId(UUID.randomUUID());
            when(billingRepository.findById(billing.getId())).thenReturn(Optional.of(billing));

            ApiResponse<BillingResponse> result = billingService.updatePayment(billing.getId(),
                    PaymentUpdateRequest.builder().status(PaymentStatus.PAID).paymentMethod(PaymentMethod.CARD).build(), staff);

            assertThat(result.getStatusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("doctors cannot record payments")
        void doctorForbidden() {
            AuthenticatedUser doctor = AuthenticatedUser.builder()
                    .id(UUID.randomUUID()).role(Role.DOCTOR).tenantId(tenantId).build();
            when(membershipService.requireRole(doctor, Role.ADMIN_OR_STAFF, "record payments"))
                    .thenThrow(new ForbiddenException("You are not allowed to record payments"));

            ApiResponse<BillingResponse> result = billingService.updatePayment(UUID.randomUUID(),
                    PaymentUpdateRequest.builder().status(PaymentStatus.PAID).paymentMethod(PaymentMethod.CARD).build(), doctor);

            assertThat(result.getStatusCode()).isEqualTo(403);
            verify(billingRepository, never()).findById(any());
        }
    }
}
