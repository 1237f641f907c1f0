package com.flagship.pawnshop.customer;

import com.flagship.pawnshop.common.CodeGenerator;
import com.flagship.pawnshop.common.Specs;
import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.customer.dto.CustomerRequest;
import com.flagship.pawnshop.customer.dto.CustomerSearchRequest;
import com.flagship.pawnshop.customer.dto.CustomerStats;
import com.flagship.pawnshop.customer.dto.TopCustomer;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.loan.LoanRepository;
import com.flagship.pawnshop.loan.LoanStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Customer records. Email and phone are unique among customers; deletion is a soft delete
 * refused while the customer has open loans.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private static final int TOP_CUSTOMERS = 5;

    private final CustomerRepository customerRepository;
    private final LoanRepository loanRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<CustomerEntity> list(String search, Boolean active, Pageable pageable) {
        Specification<CustomerEntity> spec = Specification
            .where(Specs.<CustomerEntity>textSearch(search, "firstName", "lastName", "email", "phone", "customerCode"))
            .and(Specs.equal("active", active));
        return customerRepository.findAll(spec, pageable).getContent();
    }

    @Transactional(readOnly = true)
    public List<CustomerEntity> search(CustomerSearchRequest criteria, Pageable pageable) {
        Specification<CustomerEntity> spec = Specification
            .where(Specs.<CustomerEntity>textSearch(criteria.getSearchTerm(),
                "firstName", "lastName", "email", "phone", "customerCode"))
            .and(Specs.textSearch(criteria.getEmail(), "email"))
            .and(Specs.textSearch(criteria.getPhone(), "phone"))
            .and(Specs.textSearch(criteria.getCustomerCode(), "customerCode"))
            .and(Specs.equal("active", criteria.getActive()))
            .and(Specs.textSearch(criteria.getCity(), "city"))
            .and(Specs.textSearch(criteria.getState(), "state"));
        return customerRepository.findAll(spec, pageable).getContent();
    }

    @Transactional(readOnly = true)
    public CustomerEntity get(UUID id) {
        return customerRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Customer", id));
    }

    /**
     * @throws BusinessValidationException if another customer already uses the email or phone
     */
    @Transactional
    public CustomerEntity create(CustomerRequest request) {
        if (request.getEmail() != null && customerRepository.existsByEmailIgnoreCase(request.getEmail())) {
            throw new BusinessValidationException("unique_customer_email", "Customer with this email already exists");
        }
        if (request.getPhone() != null && customerRepository.existsByPhone(request.getPhone())) {
            throw new BusinessValidationException("unique_customer_phone", "Customer with this phone already exists");
        }
        CustomerEntity saved = customerRepository.save(CustomerEntity.create(CodeGenerator.customerCode(), request));
        log.info("Customer created: customerId={}, customerCode={}", saved.getId(), saved.getCustomerCode());
        return saved;
    }

    @Transactional
    public CustomerEntity update(UUID id, CustomerRequest request) {
        CustomerEntity customer = get(id);
        if (request.getEmail() != null && !request.getEmail().equalsIgnoreCase(customer.getEmail())
                && customerRepository.existsByEmailIgnoreCaseAndIdNot(request.getEmail(), id)) {
            throw new BusinessValidationException("unique_customer_email", "Customer with this email already exists");
        }
        if (request.getPhone() != null && !request.getPhone().equals(customer.getPhone())
                && customerRepository.existsByPhoneAndIdNot(request.getPhone(), id)) {
            throw new BusinessValidationException("unique_customer_phone", "Customer with this phone already exists");
        }
        customer.apply(request);
        return customerRepository.save(customer);
    }

    /**
     * Soft delete: the customer is marked inactive and kept for loan history.
     *
     * @throws ConflictException if the customer has ACTIVE or OVERDUE loans
     */
    @Transactional
    public CustomerEntity delete(UUID id) {
        CustomerEntity customer = get(id);
        long openLoans = loanRepository.countByCustomerIdAndStatusIn(id, LoanStatus.OPEN);
        if (openLoans > 0) {
            throw new ConflictException(String.format(
                "Cannot delete customer with %d active loans", openLoans));
        }
        customer.deactivate();
        CustomerEntity saved = customerRepository.save(customer);
        log.info("Customer deactivated: customerId={}", id);
        return saved;
    }

    @Transactional(readOnly = true)
    public CustomerStats stats() {
        return CustomerStats.builder()
            .totalCustomers(customerRepository.count())
            .activeCustomers(customerRepository.countByActive(true))
            .inactiveCustomers(customerRepository.countByActive(false))
            .customersWithActiveLoans(loanRepository.countDistinctCustomersWithStatusIn(EnumSet.of(LoanStatus.ACTIVE)))
            .customersWithCompletedLoans(loanRepository.countDistinctCustomersWithStatusIn(EnumSet.of(LoanStatus.COMPLETED)))
            .customersWithDefaultedLoans(loanRepository.countDistinctCustomersWithStatusIn(EnumSet.of(LoanStatus.DEFAULTED)))
            .newCustomersThisMonth(customerRepository.countByCreatedAtGreaterThanEqual(TimeWindows.startOfCurrentMonth(clock)))
            .newCustomersThisYear(customerRepository.countByCreatedAtGreaterThanEqual(TimeWindows.startOfCurrentYear(clock)))
            .topCustomersByLoanCount(toTopCustomers(loanRepository.topCustomersByLoanCount(PageRequest.of(0, TOP_CUSTOMERS))))
            .topCustomersByLoanAmount(toTopCustomers(loanRepository.topCustomersByPrincipal(PageRequest.of(0, TOP_CUSTOMERS))))
            .build();
    }

    private List<TopCustomer> toTopCustomers(List<Object[]> rows) {
        List<UUID> ids = rows.stream().map(row -> (UUID) row[0]).toList();
        Map<UUID, CustomerEntity> customers = customerRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(CustomerEntity::getId, Function.identity()));
        return rows.stream()
            .filter(row -> customers.containsKey((UUID) row[0]))
            .map(row -> {
                CustomerEntity customer = customers.get((UUID) row[0]);
                return new TopCustomer(customer.getId(), customer.getCustomerCode(), customer.getFullName(),
                    (Long) row[1], (BigDecimal) row[2]);
            })
            .toList();
    }
}
