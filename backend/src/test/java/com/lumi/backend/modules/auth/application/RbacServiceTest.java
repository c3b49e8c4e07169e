package com.lumi.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.lumi.backend.modules.auth.domain.Role;
import com.lumi.backend.modules.auth.domain.UserRole;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RbacServiceTest {

    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    private UserRoleRepository userRoleRepository;

    @InjectMocks
    private RbacService rbacService;

    @Test
    void permissionsAreMergedAcrossRolesSortedAndDistinct() {
        when(userRoleRepository.findActiveRoles(USER_ID)).thenReturn(List.of(
                grant(role("CUSTOMER", "Customer", "profile:read", "session:manage")),
                grant(role("ADMIN", "Administrator", "user:unlock", "profile:read"))
        ));

        assertThat(rbacService.getUserRoleCodes(USER_ID)).containsExactly("CUSTOMER", "ADMIN");
        assertThat(rbacService.getUserPermissions(USER_ID))
                .containsExactly("profile:read", "session:manage", "user:unlock");
    }

    @Test
    void userWithoutActiveRolesHasNothing() {
        when(userRoleRepository.findActiveRoles(USER_ID)).thenReturn(List.of());

        assertThat(rbacService.getUserRoles(USER_ID)).isEmpty();
        assertThat(rbacService.getUserPermissions(USER_ID)).isEmpty();
    }

    private static Role role(String code, String name, String... permissions) {
        Role role = new Role();
        role.setCode(code);
        role.setName(name);
        role.getPermissions().addAll(List.of(permissions));
        return role;
    }

    private static UserRole grant(Role role) {
        UserRole userRole = new UserRole();
        userRole.setRole(role);
        return userRole;
    }
}
