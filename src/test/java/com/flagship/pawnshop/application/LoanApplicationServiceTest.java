package com.flagship.pawnshop.application;

import com.flagship.pawnshop.application.dto.ApplicationRequest;
import com.flagship.pawnshop.application.dto.ApplicationUpdateRequest;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.inventory.ItemCategory;
import com.flagship.pawnshop.organization.BranchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoanApplicationServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");

    @Mock
    private LoanApplicationRepository applicationRepository;
    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private BranchRepository branchRepository;

    private LoanApplicationService service;

    private final UUID customerId = UUID.randomUUID();
    private final UUID branchId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new LoanApplicationService(applicationRepository, customerRepository, branchRepository,
            Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(applicationRepository.save(any(LoanApplicationEntity.class)))
            .thenAnswer(inv -> inv.getArgument(0));
        lenient().when(customerRepository.existsById(customerId)).thenReturn(true);
        lenient().when(branchRepository.existsById(branchId)).thenReturn(true);
    }

    private ApplicationRequest request(String estimatedValue, String loanAmount) {
        return new ApplicationRequest(customerId, branchId, ItemCategory.JEWELRY, "Gold ring",
            new BigDecimal(estimatedValue), new BigDecimal(loanAmount), new BigDecimal("5"), 3, null);
    }

    private static ApplicationUpdateRequest statusChange(ApplicationStatus status, String reason) {
        return new ApplicationUpdateRequest(null, null, null, null, null, null, null, null, status, null, reason);
    }

    private LoanApplicationEntity stored(ApplicationStatus status) {
        LoanApplicationEntity application = LoanApplicationEntity.create("APP-20240615-0001", request("1000", "800"));
        if (status != ApplicationStatus.PENDING) {
            application.process(status, UUID.randomUUID(), NOW);
        }
        lenient().when(applicationRepository.findById(application.getId())).thenReturn(Optional.of(application));
        return application;
    }

    @Test
    @DisplayName("Estimated value 1000 with loan 1200 is refused")
    void loanAboveEstimatedValueIsRejected() {
        BusinessValidationException e = assertThrows(BusinessValidationException.class,
            () -> service.create(request("1000", "1200")));

        assertEquals("loan_within_estimated_value", e.getRule());
        verify(applicationRepository, never()).save(any());
    }

    @Test
    void loanEqualToEstimatedValueIsAccepted() {
        LoanApplicationEntity created = service.create(request("1000", "1000"));

        assertEquals(ApplicationStatus.PENDING, created.getStatus());
        assertTrue(created.getApplicationNumber().startsWith("APP-"));
        assertNull(created.getProcessedAt());
    }

    @Test
    void createForUnknownBranchIsNotFound() {
        UUID unknownBranch = UUID.randomUUID();
        when(branchRepository.existsById(unknownBranch)).thenReturn(false);

        assertThrows(NotFoundException.class, () -> service.create(new ApplicationRequest(customerId, unknownBranch,
            ItemCategory.WATCHES, "Watch", new BigDecimal("500"), new BigDecimal("100"), new BigDecimal("5"), 1, null)));
    }

    @Test
    void statusChangeRecordsProcessor() {
        LoanApplicationEntity application = stored(ApplicationStatus.PENDING);
        UUID reviewer = UUID.randomUUID();

        LoanApplicationEntity updated = service.update(application.getId(),
            statusChange(ApplicationStatus.APPROVED, null), reviewer);

        assertEquals(ApplicationStatus.APPROVED, updated.getStatus());
        assertEquals(reviewer, updated.getProcessedBy());
        assertEquals(NOW, updated.getProcessedAt());
    }

    @Test
    @DisplayName("Rejecting without a reason is refused")
    void rejectionNeedsReason() {
        LoanApplicationEntity application = stored(ApplicationStatus.PENDING);

        BusinessValidationException e = assertThrows(BusinessValidationException.class,
            () -> service.update(application.getId(), statusChange(ApplicationStatus.REJECTED, "  "), UUID.randomUUID()));

        assertEquals("rejection_reason_required", e.getRule());
        assertEquals(ApplicationStatus.PENDING, application.getStatus());
    }

    @Test
    void rejectionWithReasonIsStored() {
        LoanApplicationEntity application = stored(ApplicationStatus.PENDING);

        LoanApplicationEntity updated = service.update(application.getId(),
            statusChange(ApplicationStatus.REJECTED, "Counterfeit"), UUID.randomUUID());

        assertEquals(ApplicationStatus.REJECTED, updated.getStatus());
        assertEquals("Counterfeit", updated.getRejectionReason());
    }

    @Test
    void raisingLoanAboveStoredValueIsRejected() {
        LoanApplicationEntity application = stored(ApplicationStatus.PENDING);
        ApplicationUpdateRequest change = new ApplicationUpdateRequest(null, null, null, null, null,
            new BigDecimal("1500"), null, null, null, null, null);

        assertThrows(BusinessValidationException.class,
            () -> service.update(application.getId(), change, UUID.randomUUID()));
        assertEquals(0, new BigDecimal("800").compareTo(application.getLoanAmount()));
    }

    @Test
    @DisplayName("Processed applications cannot be deleted")
    void deletingProcessedApplicationIsConflict() {
        LoanApplicationEntity application = stored(ApplicationStatus.APPROVED);

        assertThrows(ConflictException.class, () -> service.delete(application.getId()));
        verify(applicationRepository, never()).delete(any(LoanApplicationEntity.class));
    }

    @Test
    void deletingPendingApplication() {
        LoanApplicationEntity application = stored(ApplicationStatus.PENDING);

        service.delete(application.getId());

        verify(applicationRepository).delete(application);
    }

    @Test
    void bulkDeleteIsAllOrNothing() {
        LoanApplicationEntity pending = stored(ApplicationStatus.PENDING);
        LoanApplicationEntity approved = stored(ApplicationStatus.APPROVED);
        List<UUID> ids = List.of(pending.getId(), approved.getId());
        when(applicationRepository.findAllById(ids)).thenReturn(List.of(pending, approved));

        ConflictException e = assertThrows(ConflictException.class, () -> service.bulkDelete(ids));

        assertTrue(e.getMessage().contains(approved.getId().toString()));
        verify(applicationRepository, never()).deleteAll(anyList());
    }

    @Test
    void bulkUpdateWithNoKnownIdsIsNotFound() {
        List<UUID> ids = List.of(UUID.randomUUID());
        when(applicationRepository.findAllById(ids)).thenReturn(List.of());

        assertThrows(NotFoundException.class,
            () -> service.bulkUpdate(ids, statusChange(ApplicationStatus.CANCELLED, null), UUID.randomUUID()));
    }
}
