package com.lumi.backend.modules.auth.application;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.lumi.backend.modules.auth.domain.Role;
import com.lumi.backend.modules.auth.domain.UserRole;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class RbacService {

    private final UserRoleRepository userRoleRepository;

    public RbacService(UserRoleRepository userRoleRepository) {
        this.userRoleRepository = userRoleRepository;
    }

    public List<RoleView> getUserRoles(UUID userId) {
        return userRoleRepository.findActiveRoles(userId).stream()
                .map(UserRole::getRole)
                .map(role -> new RoleView(role.getCode(), role.getName()))
                .distinct()
                .toList();
    }

    public List<String> getUserRoleCodes(UUID userId) {
        return getUserRoles(userId).stream()
                .map(RoleView::code)
                .toList();
    }

    public List<String> getUserPermissions(UUID userId) {
        return userRoleRepository.findActiveRoles(userId).stream()
                .map(UserRole::getRole)
                .map(Role::getPermissions)
                .flatMap(Set::stream)
                .distinct()
                .sorted()
                .toList();
    }

    public record RoleView(String code, String name) {
    }
}
