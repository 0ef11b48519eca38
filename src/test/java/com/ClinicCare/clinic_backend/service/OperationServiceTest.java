package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.OperationRequest;
import com.ClinicCare.clinic_backend.dto.request.OperationUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.OperationResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.model.Doctor;
import com.ClinicCare.clinic_backend.model.Operation;
import com.ClinicCare.clinic_backend.model.Patient;
import com.ClinicCare.clinic_backend.model.Visit;
import com.ClinicCare.clinic_backend.repository.DoctorRepository;
import com.ClinicCare.clinic_backend.repository.OperationRepository;
import com.ClinicCare.clinic_backend.repository.PatientRepository;
import com.ClinicCare.clinic_backend.repository.VisitRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OperationServiceTest {

    private static final Instant NOW_INSTANT = Instant.parse("2025-04-01T08:30:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);

    @Mock
    private OperationRepository operationRepository;
    @Mock
    private PatientRepository patientRepository;
    @Mock
    private DoctorRepository doctorRepository;
    @Mock
    private VisitRepository visitRepository;
    @Mock
    private BillingService billingService;
    @Mock
    private TenantMembershipService membershipService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private OperationService operationService;

    private final UUID tenantId = UUID.randomUUID();
    private final AuthenticatedUser caller = AuthenticatedUser.builder()
            .id(UUID.randomUUID()).email("surgeon@abc.com").role(Role.DOCTOR).tenantId(tenantId).build();
    private Patient patient;
    private Doctor surgeon;

    @BeforeEach
    void setUp() {
        operationService = new OperationService(operationRepository, patientRepository, doctorRepository,
                visitRepository, billingService, membershipService, new TransactionTemplate(transactionManager),
                Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));
        patient = Patient.builder().id(UUID.randomUUID()).tenantId(tenantId).patientNumber("PT-ABC-002")
                .fullName("Mary Major").build();
        surgeon = Doctor.builder().id(UUID.randomUUID()).tenantId(tenantId).employeeCode("S-1").build();

        lenient().when(membershipService.requireRole(eq(caller), eq(Role.ADMIN_OR_DOCTOR), anyString())).thenReturn(Role.DOCTOR);
        lenient().when(membershipService.requireRole(eq(caller), eq(Role.ADMIN_ONLY), anyString())).thenReturn(Role.ADMIN);
        lenient().when(operationRepository.save(any(Operation.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Operation existingOperation() {
        return Operation.builder().id(UUID.randomUUID()).patient(patient).surgeon(surgeon)
                .name("Appendectomy").date(NOW.plusDays(2)).fee(new BigDecimal("20000")).build();
    }

    @Nested
    @DisplayName("create")
    class Create {

        private OperationRequest request(BigDecimal fee) {
            return OperationRequest.builder().patientId(patient.getId()).surgeonId(surgeon.getId())
                    .name("Appendectomy").date(NOW.plusDays(2)).fee(fee).build();
        }

        @Test
        @DisplayName("rejects a zero fee before any lookup")
        void zeroFee() {
            ApiResponse<OperationResponse> result = operationService.create(request(BigDecimal.ZERO), caller);

            assertThat(result.getStatusCode()).isEqualTo(400);
            verifyNoInteractions(patientRepository, operationRepository, billingService);
        }

        @Test
        @DisplayName("rejects a negative fee")
        void negativeFee() {
            assertThat(operationService.create(request(new BigDecimal("-5")), caller).getStatusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("bills the fee and notes the operation on the latest visit")
        void billsAndNotes() {
            when(patientRepository.findByIdAndTenantIdAndDeletedAtIsNull(patient.getId(), tenantId))
                    .thenReturn(Optional.of(patient));
            when(doctorRepository.findByIdAndTenantIdAndDeletedAtIsNull(surgeon.getId(), tenantId))
                    .thenReturn(Optional.of(surgeon));
            Visit latest = Visit.builder().id(UUID.randomUUID()).patient(patient).visitDate(NOW.minusDays(1))
                    .notes("Initial registration").build();
            when(visitRepository.findFirstByPatientIdAndDeletedAtIsNullOrderByVisitDateDesc(patient.getId()))
                    .thenReturn(Optional.of(latest));

            ApiResponse<OperationResponse> result = operationService.create(request(new BigDecimal("20000")), caller);

            assertThat(result.getStatusCode()).isEqualTo(201);
            assertThat(result.getData().getFee()).isEqualByComparingTo("20000");
            verify(billingService).recordOperationFee(patient, new BigDecimal("20000"));
            assertThat(latest.getNotes()).isEqualTo("Initial registration\nOperation scheduled: Appendectomy");
            verify(visitRepository).save(latest);
            verify(transactionManager).commit(any());
        }

        @Test
        @DisplayName("a patient of another clinic is not found")
        void foreignPatient() {
            when(patientRepository.findByIdAndTenantIdAndDeletedAtIsNull(patient.getId(), tenantId))
                    .thenReturn(Optional.empty());

            ApiResponse<OperationResponse> result = operationService.create(request(new BigDecimal("100")), caller);

            assertThat(result.getStatusCode()).isEqualTo(404);
            verify(billingService, never()).recordOperationFee(any(), any());
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("rejects a non-positive fee")
        void invalidFee() {
            Operation operation = existingOperation();
            when(operationRepository.findById(operation.getId())).thenReturn(Optional.of(operation));

            ApiResponse<OperationResponse> result = operationService.update(operation.getId(),
                    OperationUpdateRequest.builder().fee(new BigDecimal("0")).build(), caller);

            assertThat(result.getStatusCode()).isEqualTo(400);
            assertThat(operation.getFee()).isEqualByComparingTo("20000");
            verify(billingService, never()).adjustLatestOperationFee(any(), any());
        }

        @Test
        @DisplayName("moves the linked operation bill to the new fee")
        void adjustsBill() {
            Operation operation = existingOperation();
            when(operationRepository.findById(operation.getId())).thenReturn(Optional.of(operation));

            ApiResponse<OperationResponse> result = operationService.update(operation.getId(),
                    OperationUpdateRequest.builder().fee(new BigDecimal("25000")).build(), caller);

            assertThat(result.getStatusCode()).isEqualTo(200);
            assertThat(result.getData().getFee()).isEqualByComparingTo("25000");
            verify(billingService).adjustLatestOperationFee(patient.getId(), new BigDecimal("25000"));
            verify(transactionManager).commit(any());
        }

        @Test
        @DisplayName("leaves the bill alone when the fee is unchanged")
        void sameFee() {
            Operation operation = existingOperation();
            when(operationRepository.findById(operation.getId())).thenReturn(Optional.of(operation));

            operationService.update(operation.getId(),
                    OperationUpdateRequest.builder().fee(new BigDecimal("20000.00")).outcome("Successful").build(), caller);

            assertThat(operation.getOutcome()).isEqualTo("Successful");
            verify(billingService, never()).adjustLatestOperationFee(any(), any());
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        @DisplayName("soft-deletes the operation and voids its bill")
        void voidsBill() {
            Operation operation = existingOperation();
            when(operationRepository.findById(operation.getId())).thenReturn(Optional.of(operation));

            ApiResponse<OperationResponse> result = operationService.remove(operation.getId(), caller);

            assertThat(result.getStatusCode()).isEqualTo(200);
            assertThat(operation.getDeletedAt()).isEqualTo(NOW);
            verify(billingService).voidLatestOperationFee(patient.getId(), NOW);
        }

        @Test
        @DisplayName("a second removal answers 'already deleted'")
        void alreadyDeleted() {
            Operation operation = existingOperation();
            operation.setDeletedAt(NOW.minusHours(1));
            when(operationRepository.findById(operation.getId())).thenReturn(Optional.of(operation));

            ApiResponse<OperationResponse> result = operationService.remove(operation.getId(), caller);

            assertThat(result.getStatusCode()).isEqualTo(404);
            assertThat(result.getMessage()).isEqualTo("Operation already deleted");
            verify(billingService, never()).voidLatestOperationFee(any(), any());
        }
    }
}
