package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.config.ModelMapperConfig;
import com.ClinicCare.clinic_backend.dto.request.DoctorRequest;
import com.ClinicCare.clinic_backend.dto.request.DoctorUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.DoctorResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ForbiddenException;
import com.ClinicCare.clinic_backend.model.Doctor;
import com.ClinicCare.clinic_backend.model.Tenant;
import com.ClinicCare.clinic_backend.model.User;
import com.ClinicCare.clinic_backend.model.UserTenant;
import com.ClinicCare.clinic_backend.repository.DoctorRepository;
import com.ClinicCare.clinic_backend.repository.TenantRepository;
import com.ClinicCare.clinic_backend.repository.UserRepository;
import com.ClinicCare.clinic_backend.repository.UserTenantRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
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
class DoctorServiceTest {

    private static final Instant NOW_INSTANT = Instant.parse("2025-05-05T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);

    @Mock
    private DoctorRepository doctorRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private UserTenantRepository userTenantRepository;
    @Mock
    private TenantRepository tenantRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private TenantMembershipService membershipService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private DoctorService doctorService;

    private final Tenant tenant = Tenant.builder().id(UUID.randomUUID()).name("ABC Clinic").code("ABC123").build();
    private final AuthenticatedUser admin = AuthenticatedUser.builder()
            .id(UUID.randomUUID()).email("admin@abc.com").role(Role.ADMIN).tenantId(tenant.getId()).build();

    @BeforeEach
    void setUp() {
        MemberAccountService memberAccountService =
                new MemberAccountService(userRepository, userTenantRepository, tenantRepository, passwordEncoder);
        doctorService = new DoctorService(doctorRepository, memberAccountService, membershipService,
                new TransactionTemplate(transactionManager), ModelMapperConfig.createModelMapper(),
                Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));

        lenient().when(membershipService.requireRole(eq(admin), any(), anyString())).thenReturn(Role.ADMIN);
        lenient().when(doctorRepository.save(any(Doctor.class))).thenAnswer(inv -> {
            Doctor doctor = inv.getArgument(0);
            if (doctor.getId() == null) {
                doctor.setId(UUID.randomUUID());
            }
            return doctor;
        });
    }

    private Doctor existingDoctor() {
        User user = User.builder().id(UUID.randomUUID()).email("jane@abc.com").name("Dr Jane").role(Role.DOCTOR).build();
        return Doctor.builder().id(UUID.randomUUID()).user(user).tenantId(tenant.getId())
                .employeeCode("D-001").specialty("Cardiology").build();
    }

    @Nested
    @DisplayName("create")
    class Create {

        private DoctorRequest.DoctorRequestBuilder request() {
            return DoctorRequest.builder()
                    .email(" Jane.Roe@ABC.com ")
                    .password("secret12")
                    .specialty("Cardiology")
                    .employeeCode("D-001");
        }

        @Test
        @DisplayName("creates the user, the DOCTOR membership and the profile together")
        void createsAll() {
            when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));
            when(passwordEncoder.encode("secret12")).thenReturn("hashed");
            when(userRepository.saveAndFlush(any(User.class))).thenAnswer(inv -> {
                User user = inv.getArgument(0);
                user.setId(UUID.randomUUID());
                return user;
            });

            ApiResponse<DoctorResponse> result = doctorService.create(request().build(), admin);

            assertThat(result.getStatusCode()).isEqualTo(201);
            DoctorResponse body = result.getData();
            assertThat(body.getEmail()).isEqualTo("jane.roe@abc.com");
            assertThat(body.getName()).isEqualTo("jane.roe");
            assertThat(body.getTenantId()).isEqualTo(tenant.getId());
            assertThat(body.getEmployeeCode()).isEqualTo("D-001");
            assertThat(body.isActive()).isTrue();

            ArgumentCaptor<UserTenant> membership = ArgumentCaptor.forClass(UserTenant.class);
            verify(userTenantRepository).save(membership.capture());
            assertThat(membership.getValue().getRole()).isEqualTo(Role.DOCTOR);
            assertThat(membership.getValue().getTenant()).isSameAs(tenant);
            verify(transactionManager).commit(any());
        }

        @Test
        @DisplayName("rolls everything back when the membership cannot be written")
        void rollsBack() {
            when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));
            when(passwordEncoder.encode("secret12")).thenReturn("hashed");
            when(userRepository.saveAndFlush(any(User.class))).thenAnswer(inv -> inv.getArgument(0));
            when(userTenantRepository.save(any(UserTenant.class)))
                    .thenThrow(new DataAccessResourceFailureException("connection reset"));

            ApiResponse<DoctorResponse> result = doctorService.create(request().build(), admin);

            assertThat(result.getStatusCode()).isEqualTo(500);
            assertThat(result.isSuccess()).isFalse();
            verify(doctorRepository, never()).save(any());
            verify(transactionManager).rollback(any());
        }

        @Test
        @DisplayName("a taken employee code is a conflict")
        void duplicateEmployeeCode() {
            when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));
            when(doctorRepository.existsByTenantIdAndEmployeeCode(tenant.getId(), "D-001")).thenReturn(true);

            ApiResponse<DoctorResponse> result = doctorService.create(request().build(), admin);

            assertThat(result.getStatusCode()).isEqualTo(409);
            verify(userRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("a registered email is a conflict")
        void duplicateEmail() {
            when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));
            when(userRepository.existsByEmail("jane.roe@abc.com")).thenReturn(true);

            assertThat(doctorService.create(request().build(), admin).getStatusCode()).isEqualTo(409);
        }

        @Test
        @DisplayName("a malformed email is rejected")
        void invalidEmail() {
            when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));

            ApiResponse<DoctorResponse> result = doctorService.create(request().email("not-an-email").build(), admin);

            assertThat(result.getStatusCode()).isEqualTo(400);
            assertThat(result.getMessage()).isEqualTo("Invalid email format");
        }

        @Test
        @DisplayName("only admins may add doctors")
        void forbidden() {
            AuthenticatedUser staff = AuthenticatedUser.builder()
                    .id(UUID.randomUUID()).role(Role.STAFF).tenantId(tenant.getId()).build();
            when(membershipService.requireRole(staff, Role.ADMIN_ONLY, "add doctors"))
                    .thenThrow(new ForbiddenException("You are not allowed to add doctors"));

            ApiResponse<DoctorResponse> result = doctorService.create(request().build(), staff);

            assertThat(result.getStatusCode()).isEqualTo(403);
            verifyNoInteractions(tenantRepository, userRepository, userTenantRepository);
        }
    }

    @Test
    @DisplayName("a doctor of another clinic is not found")
    void findOneCrossTenant() {
        Doctor doctor = existingDoctor();
        doctor.setTenantId(UUID.randomUUID());
        when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));

        ApiResponse<DoctorResponse> result = doctorService.findOne(doctor.getId(), admin);

        assertThat(result.getStatusCode()).isEqualTo(404);
        assertThat(result.getMessage()).isEqualTo("Doctor not found");
    }

    @Nested
    @DisplayName("findAll")
    class FindAll {

        @Test
        @DisplayName("returns one page of the clinic's doctors with paging info")
        void pages() {
            Doctor doctor = existingDoctor();
            when(doctorRepository.findActiveByTenant(eq(tenant.getId()), any(Pageable.class)))
                    .thenAnswer(inv -> new PageImpl<>(List.of(doctor), inv.getArgument(1), 1));

            ApiResponse<PaginatedResponse<DoctorResponse>> result = doctorService.findAll(admin, 1, 20);

            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            verify(doctorRepository).findActiveByTenant(eq(tenant.getId()), pageable.capture());
            assertThat(pageable.getValue().getPageNumber()).isZero();
            assertThat(pageable.getValue().getPageSize()).isEqualTo(20);

            assertThat(result.getStatusCode()).isEqualTo(200);
            assertThat(result.getData().getData()).singleElement()
                    .satisfies(body -> {
                        assertThat(body.getName()).isEqualTo("Dr Jane");
                        assertThat(body.getEmployeeCode()).isEqualTo("D-001");
                    });
            PaginatedResponse.PaginationInfo pagination = result.getData().getPagination();
            assertThat(pagination.getTotal()).isEqualTo(1);
            assertThat(pagination.getPages()).isEqualTo(1);
            assertThat(pagination.isHasNext()).isFalse();
            assertThat(pagination.isHasPrev()).isFalse();
        }

        @Test
        @DisplayName("a page past the end is empty but still reports the total")
        void pastTheEnd() {
            when(doctorRepository.findActiveByTenant(eq(tenant.getId()), any(Pageable.class)))
                    .thenAnswer(inv -> new PageImpl<>(List.of(), inv.getArgument(1), 3));

            ApiResponse<PaginatedResponse<DoctorResponse>> result = doctorService.findAll(admin, 4, 2);

            assertThat(result.getData().getData()).isEmpty();
            assertThat(result.getData().getPagination().getPage()).isEqualTo(4);
            assertThat(result.getData().getPagination().getTotal()).isEqualTo(3);
            assertThat(result.getData().getPagination().isHasNext()).isFalse();
        }

        @Test
        @DisplayName("a zero limit is rejected")
        void zeroLimit() {
            ApiResponse<PaginatedResponse<DoctorResponse>> result = doctorService.findAll(admin, 1, 0);

            assertThat(result.getStatusCode()).isEqualTo(400);
            verify(doctorRepository, never()).findActiveByTenant(any(), any());
        }
    }

    @Nested
    @DisplayName("remove and restore")
    class RemoveAndRestore {

        @Test
        @DisplayName("remove marks the user, the membership and the profile deleted")
        void remove() {
            Doctor doctor = existingDoctor();
            UserTenant membership = UserTenant.builder().id(UUID.randomUUID()).user(doctor.getUser())
                    .tenant(tenant).role(Role.DOCTOR).build();
            when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));
            when(userTenantRepository.findByUserIdAndTenantId(doctor.getUser().getId(), tenant.getId()))
                    .thenReturn(Optional.of(membership));

            ApiResponse<DoctorResponse> result = doctorService.remove(doctor.getId(), admin);

            assertThat(result.getStatusCode()).isEqualTo(200);
            assertThat(doctor.getDeletedAt()).isEqualTo(NOW);
            assertThat(doctor.isActive()).isFalse();
            assertThat(doctor.getUser().getDeletedAt()).isEqualTo(NOW);
            assertThat(membership.getDeletedAt()).isEqualTo(NOW);
            verify(userRepository).save(doctor.getUser());
            verify(userTenantRepository).save(membership);
        }

        @Test
        @DisplayName("removing twice answers 'already deleted'")
        void removeTwice() {
            Doctor doctor = existingDoctor();
            doctor.setDeletedAt(NOW.minusDays(1));
            when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));

            ApiResponse<DoctorResponse> result = doctorService.remove(doctor.getId(), admin);

            assertThat(result.getStatusCode()).isEqualTo(404);
            assertThat(result.getMessage()).isEqualTo("Doctor already deleted");
        }

        @Test
        @DisplayName("restoring a live doctor answers 'not deleted'")
        void restoreLive() {
            Doctor doctor = existingDoctor();
            when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));

            ApiResponse<DoctorResponse> result = doctorService.restore(doctor.getId(), admin);

            assertThat(result.getStatusCode()).isEqualTo(404);
            assertThat(result.getMessage()).isEqualTo("Doctor is not deleted");
        }

        @Test
        @DisplayName("restore clears every delete timestamp and reactivates")
        void restore() {
            Doctor doctor = existingDoctor();
            doctor.setDeletedAt(NOW.minusDays(3));
            doctor.setActive(false);
            doctor.getUser().setDeletedAt(NOW.minusDays(3));
            UserTenant membership = UserTenant.builder().user(doctor.getUser()).tenant(tenant)
                    .role(Role.DOCTOR).deletedAt(NOW.minusDays(3)).build();
            when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));
            when(userTenantRepository.findByUserIdAndTenantId(doctor.getUser().getId(), tenant.getId()))
                    .thenReturn(Optional.of(membership));

            ApiResponse<DoctorResponse> result = doctorService.restore(doctor.getId(), admin);

            assertThat(result.getStatusCode()).isEqualTo(200);
            assertThat(doctor.getDeletedAt()).isNull();
            assertThat(doctor.isActive()).isTrue();
            assertThat(doctor.getUser().getDeletedAt()).isNull();
            assertThat(membership.getDeletedAt()).isNull();
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("an email owned by another user is a conflict")
        void emailConflict() {
            Doctor doctor = existingDoctor();
            when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));
            when(userRepository.existsByEmailAndIdNot("taken@abc.com", doctor.getUser().getId())).thenReturn(true);

            ApiResponse<DoctorResponse> result = doctorService.update(doctor.getId(),
                    DoctorUpdateRequest.builder().email("taken@abc.com").build(), admin);

            assertThat(result.getStatusCode()).isEqualTo(409);
            assertThat(doctor.getUser().getEmail()).isEqualTo("jane@abc.com");
        }

        @Test
        @DisplayName("applies only the supplied fields")
        void partial() {
            Doctor doctor = existingDoctor();
            when(doctorRepository.findById(doctor.getId())).thenReturn(Optional.of(doctor));

            ApiResponse<DoctorResponse> result = doctorService.update(doctor.getId(),
                    DoctorUpdateRequest.builder().specialty("Neurology").isActive(false).build(), admin);

            assertThat(result.getStatusCode()).isEqualTo(200);
            assertThat(result.getData().getSpecialty()).isEqualTo("Neurology");
            assertThat(result.getData().getName()).isEqualTo("Dr Jane");
            assertThat(result.getData().getEmployeeCode()).isEqualTo("D-001");
            assertThat(doctor.isActive()).isFalse();
        }
    }
}
