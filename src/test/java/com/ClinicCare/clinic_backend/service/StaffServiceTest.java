package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.config.ModelMapperConfig;
import com.ClinicCare.clinic_backend.dto.request.StaffRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.StaffResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.model.Staff;
import com.ClinicCare.clinic_backend.model.Tenant;
import com.ClinicCare.clinic_backend.model.User;
import com.ClinicCare.clinic_backend.model.UserTenant;
import com.ClinicCare.clinic_backend.repository.StaffRepository;
import com.ClinicCare.clinic_backend.repository.TenantRepository;
import com.ClinicCare.clinic_backend.repository.UserRepository;
import com.ClinicCare.clinic_backend.repository.UserTenantRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

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
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StaffServiceTest {

    private static final Instant NOW_INSTANT = Instant.parse("2025-05-05T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(NOW_INSTANT, ZoneOffset.UTC);

    @Mock
    private StaffRepository staffRepository;
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

    private StaffService staffService;

    private final Tenant tenant = Tenant.builder().id(UUID.randomUUID()).name("ABC Clinic").code("ABC123").build();
    private final AuthenticatedUser admin = AuthenticatedUser.builder()
            .id(UUID.randomUUID()).email("admin@abc.com").role(Role.ADMIN).tenantId(tenant.getId()).build();

    @BeforeEach
    void setUp() {
        MemberAccountService memberAccountService =
                new MemberAccountService(userRepository, userTenantRepository, tenantRepository, passwordEncoder);
        staffService = new StaffService(staffRepository, memberAccountService, membershipService,
                new TransactionTemplate(transactionManager), ModelMapperConfig.createModelMapper(),
                Clock.fixed(NOW_INSTANT, ZoneOffset.UTC));
        lenient().when(membershipService.requireRole(eq(admin), any(), anyString())).thenReturn(Role.ADMIN);
        lenient().when(staffRepository.save(any(Staff.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("create adds a STAFF membership next to the profile")
    void create() {
        when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));
        when(passwordEncoder.encode("secret12")).thenReturn("hashed");
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        ApiResponse<StaffResponse> result = staffService.create(StaffRequest.builder()
                .email("desk@abc.com").password("secret12").name("Front Desk").employeeCode("S-07").build(), admin);

        assertThat(result.getStatusCode()).isEqualTo(201);
        assertThat(result.getData().getName()).isEqualTo("Front Desk");
        assertThat(result.getData().getEmployeeCode()).isEqualTo("S-07");
        ArgumentCaptor<UserTenant> membership = ArgumentCaptor.forClass(UserTenant.class);
        verify(userTenantRepository).save(membership.capture());
        assertThat(membership.getValue().getRole()).isEqualTo(Role.STAFF);
    }

    @Test
    @DisplayName("a short password is rejected before anything is written")
    void shortPassword() {
        when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));

        ApiResponse<StaffResponse> result = staffService.create(StaffRequest.builder()
                .email("desk@abc.com").password("123").employeeCode("S-07").build(), admin);

        assertThat(result.getStatusCode()).isEqualTo(400);
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    @DisplayName("remove then restore round-trips the delete timestamp")
    void removeThenRestore() {
        User user = User.builder().id(UUID.randomUUID()).email("desk@abc.com").name("Front Desk").build();
        Staff staff = Staff.builder().id(UUID.randomUUID()).user(user).tenantId(tenant.getId()).employeeCode("S-07").build();
        when(staffRepository.findById(staff.getId())).thenReturn(Optional.of(staff));

        assertThat(staffService.remove(staff.getId(), admin).getStatusCode()).isEqualTo(200);
        assertThat(staff.getDeletedAt()).isEqualTo(NOW);
        assertThat(user.getDeletedAt()).isEqualTo(NOW);
        assertThat(staffService.remove(staff.getId(), admin).getMessage()).isEqualTo("Staff already deleted");

        assertThat(staffService.restore(staff.getId(), admin).getStatusCode()).isEqualTo(200);
        assertThat(staff.getDeletedAt()).isNull();
        assertThat(staff.isActive()).isTrue();
    }

    @Test
    @DisplayName("an employee code already used in the clinic is a conflict")
    void duplicateEmployeeCode() {
        when(tenantRepository.findByIdAndDeletedAtIsNull(tenant.getId())).thenReturn(Optional.of(tenant));
        when(staffRepository.existsByTenantIdAndEmployeeCode(tenant.getId(), "S-07")).thenReturn(true);

        ApiResponse<StaffResponse> result = staffService.create(StaffRequest.builder()
                .email("desk@abc.com").password("secret12").employeeCode("S-07").build(), admin);

        assertThat(result.getStatusCode()).isEqualTo(409);
        assertThat(result.getMessage()).isEqualTo("Employee code already exists in this clinic");
        verify(userRepository, never()).saveAndFlush(any());
        verify(staffRepository, never()).save(any());
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    @DisplayName("staff of another clinic can be neither read nor removed")
    void crossTenant() {
        User user = User.builder().id(UUID.randomUUID()).email("desk@xyz.com").name("Other Desk").build();
        Staff foreign = Staff.builder().id(UUID.randomUUID()).user(user).tenantId(UUID.randomUUID())
                .employeeCode("S-01").build();
        when(staffRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        ApiResponse<StaffResponse> read = staffService.findOne(foreign.getId(), admin);
        ApiResponse<StaffResponse> removed = staffService.remove(foreign.getId(), admin);

        assertThat(read.getStatusCode()).isEqualTo(404);
        assertThat(read.getMessage()).isEqualTo("Staff not found");
        assertThat(removed.getStatusCode()).isEqualTo(404);
        assertThat(foreign.getDeletedAt()).isNull();
        assertThat(user.getDeletedAt()).isNull();
        verify(staffRepository, never()).save(any());
    }
}
