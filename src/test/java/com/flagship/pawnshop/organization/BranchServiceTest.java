package com.flagship.pawnshop.organization;

import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.organization.dto.BranchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BranchServiceTest {

    @Mock
    private BranchRepository branchRepository;
    @Mock
    private EmployeeRepository employeeRepository;

    private BranchService service;
    private BranchEntity branch;

    @BeforeEach
    void setUp() {
        service = new BranchService(branchRepository, employeeRepository);
        branch = BranchEntity.create("Downtown", "1 Main St", "555-0100", "downtown@pawnshop.local");
    }

    @Test
    void branchWithEmployeesCannotBeDeleted() {
        when(branchRepository.findById(branch.getId())).thenReturn(Optional.of(branch));
        when(employeeRepository.countByBranchId(branch.getId())).thenReturn(3L);

        ConflictException e = assertThrows(ConflictException.class, () -> service.delete(branch.getId()));

        assertEquals("Cannot delete branch that has 3 employees assigned", e.getMessage());
        verify(branchRepository, never()).delete(any(BranchEntity.class));
    }

    @Test
    void emptyBranchIsDeleted() {
        when(branchRepository.findById(branch.getId())).thenReturn(Optional.of(branch));
        when(employeeRepository.countByBranchId(branch.getId())).thenReturn(0L);

        service.delete(branch.getId());

        verify(branchRepository).delete(branch);
    }

    @Test
    void updateKeepsFieldsLeftOut() {
        when(branchRepository.findById(branch.getId())).thenReturn(Optional.of(branch));
        when(branchRepository.save(branch)).thenReturn(branch);

        BranchEntity updated = service.update(branch.getId(), new BranchRequest("Uptown", null, null, null));

        assertEquals("Uptown", updated.getName());
        assertEquals("1 Main St", updated.getAddress());
    }

    @Test
    void unknownBranchIsNotFound() {
        UUID id = UUID.randomUUID();
        when(branchRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.delete(id));
    }
}
