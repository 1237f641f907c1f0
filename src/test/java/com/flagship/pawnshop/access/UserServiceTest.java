package com.flagship.pawnshop.access;

import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private RoleRepository roleRepository;
    @Mock
    private PasswordEncoder passwordEncoder;

    private UserService service;
    private RoleEntity cashier;

    @BeforeEach
    void setUp() {
        service = new UserService(userRepository, roleRepository, passwordEncoder);
        cashier = RoleEntity.create("cashier", "Front counter");
    }

    @Test
    void roleHeldByUsersCannotBeDeleted() {
        when(roleRepository.findById(cashier.getId())).thenReturn(Optional.of(cashier));
        when(userRepository.countByRoleId(cashier.getId())).thenReturn(4L);

        ConflictException e = assertThrows(ConflictException.class, () -> service.deleteRole(cashier.getId()));

        assertEquals("Cannot delete role 'cashier': assigned to 4 users", e.getMessage());
        verify(roleRepository, never()).delete(any(RoleEntity.class));
    }

    @Test
    void unassignedRoleIsDeleted() {
        when(roleRepository.findById(cashier.getId())).thenReturn(Optional.of(cashier));
        when(userRepository.countByRoleId(cashier.getId())).thenReturn(0L);

        service.deleteRole(cashier.getId());

        verify(roleRepository).delete(cashier);
    }

    @Test
    void unknownRoleIsNotFound() {
        UUID id = UUID.randomUUID();
        when(roleRepository.findById(id)).thenReturn(Optional.empty());

        NotFoundException e = assertThrows(NotFoundException.class, () -> service.deleteRole(id));

        assertNotNull(e.getMessage());
        verify(roleRepository, never()).delete(any(RoleEntity.class));
    }
}
