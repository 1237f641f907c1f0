package com.flagship.pawnshop.customer;

import com.flagship.pawnshop.customer.dto.CustomerRequest;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.loan.LoanRepository;
import com.flagship.pawnshop.loan.LoanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CustomerServiceTest {

    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private LoanRepository loanRepository;

    private CustomerService service;

    @BeforeEach
    void setUp() {
        service = new CustomerService(customerRepository, loanRepository, Clock.systemUTC());
        lenient().when(customerRepository.save(any(CustomerEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static CustomerRequest request(String email, String phone) {
        return new CustomerRequest("Ada", "Lovelace", email, phone, null, null, null, null, null,
            null, null, null, null, null, null, null);
    }

    private CustomerEntity stored() {
        CustomerEntity customer = CustomerEntity.create("CUST-0001", request("ada@example.com", "555-0100"));
        lenient().when(customerRepository.findById(customer.getId())).thenReturn(Optional.of(customer));
        return customer;
    }

    @Test
    void newCustomerIsActiveByDefault() {
        CustomerEntity created = service.create(request("ada@example.com", "555-0100"));

        assertTrue(created.isActive());
        assertEquals("Ada Lovelace", created.getFullName());
    }

    @Test
    void duplicateEmailIsRejected() {
        when(customerRepository.existsByEmailIgnoreCase("ada@example.com")).thenReturn(true);

        BusinessValidationException e = assertThrows(BusinessValidationException.class,
            () -> service.create(request("ada@example.com", null)));

        assertEquals("unique_customer_email", e.getRule());
        verify(customerRepository, never()).save(any());
    }

    @Test
    void keepingOwnEmailOnUpdateIsAllowed() {
        CustomerEntity customer = stored();

        service.update(customer.getId(), request("ADA@example.com", null));

        verify(customerRepository, never()).existsByEmailIgnoreCaseAndIdNot(any(), any());
    }

    @Test
    @DisplayName("A customer with open loans cannot be deleted")
    void deleteWithOpenLoansIsConflict() {
        CustomerEntity customer = stored();
        when(loanRepository.countByCustomerIdAndStatusIn(customer.getId(), LoanStatus.OPEN)).thenReturn(2L);

        ConflictException e = assertThrows(ConflictException.class, () -> service.delete(customer.getId()));

        assertEquals("Cannot delete customer with 2 active loans", e.getMessage());
        assertTrue(customer.isActive());
        verify(customerRepository, never()).save(any());
    }

    @Test
    @DisplayName("Delete only deactivates the customer")
    void deleteDeactivates() {
        CustomerEntity customer = stored();
        when(loanRepository.countByCustomerIdAndStatusIn(customer.getId(), LoanStatus.OPEN)).thenReturn(0L);

        CustomerEntity deleted = service.delete(customer.getId());

        assertFalse(deleted.isActive());
        verify(customerRepository, never()).delete(any(CustomerEntity.class));
    }

    @Test
    void unknownCustomerIsNotFound() {
        UUID id = UUID.randomUUID();
        when(customerRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.get(id));
    }
}
