package com.flagship.pawnshop.application;

import com.flagship.pawnshop.application.dto.ApplicationFilter;
import com.flagship.pawnshop.application.dto.ApplicationRequest;
import com.flagship.pawnshop.application.dto.ApplicationStats;
import com.flagship.pawnshop.application.dto.ApplicationTrend;
import com.flagship.pawnshop.application.dto.ApplicationUpdateRequest;
import com.flagship.pawnshop.common.CodeGenerator;
import com.flagship.pawnshop.common.Specs;
import com.flagship.pawnshop.common.TimeWindows;
import com.flagship.pawnshop.customer.CustomerRepository;
import com.flagship.pawnshop.exception.BusinessValidationException;
import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.organization.BranchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loan applications: filing, review, bulk operations, statistics and export.
 *
 * Rules:
 * - The requested loan amount may not exceed the estimated value (equal is fine)
 * - A status change records the processing user and time
 * - Rejection needs a non-blank reason
 * - Only PENDING applications can be deleted
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanApplicationService {

    private final LoanApplicationRepository applicationRepository;
    private final CustomerRepository customerRepository;
    private final BranchRepository branchRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<LoanApplicationEntity> list(ApplicationFilter filter, Pageable pageable) {
        return applicationRepository.findAll(toSpecification(filter), pageable).getContent();
    }

    @Transactional(readOnly = true)
    public LoanApplicationEntity get(UUID id) {
        return applicationRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Application", id));
    }

    /**
     * @throws NotFoundException if the customer or branch does not exist
     * @throws BusinessValidationException if the loan amount exceeds the estimated value
     */
    @Transactional
    public LoanApplicationEntity create(ApplicationRequest request) {
        requireReferences(request.getCustomerId(), request.getBranchId());
        requireLoanWithinValue(request.getLoanAmount(), request.getEstimatedValue());

        LoanApplicationEntity saved = applicationRepository.save(LoanApplicationEntity.create(
            CodeGenerator.applicationNumber(LocalDate.now(clock)), request));
        log.info("Application filed: applicationId={}, number={}, loanAmount={}",
            saved.getId(), saved.getApplicationNumber(), saved.getLoanAmount());
        return saved;
    }

    /**
     * @param processedBy user recorded as processor when the status changes
     */
    @Transactional
    public LoanApplicationEntity update(UUID id, ApplicationUpdateRequest request, UUID processedBy) {
        LoanApplicationEntity application = get(id);
        requireReferences(request.getCustomerId(), request.getBranchId());
        applyUpdate(application, request, processedBy, Instant.now(clock));
        return applicationRepository.save(application);
    }

    /**
     * Applies the same change to every existing application among the ids, all or nothing.
     * Unknown ids are skipped.
     *
     * @throws NotFoundException if none of the ids exist
     */
    @Transactional
    public List<LoanApplicationEntity> bulkUpdate(List<UUID> ids, ApplicationUpdateRequest request, UUID processedBy) {
        List<LoanApplicationEntity> applications = applicationRepository.findAllById(ids);
        if (applications.isEmpty()) {
            throw new NotFoundException("Application", ids);
        }
        requireReferences(request.getCustomerId(), request.getBranchId());

        Instant now = Instant.now(clock);
        for (LoanApplicationEntity application : applications) {
            applyUpdate(application, request, processedBy, now);
        }
        List<LoanApplicationEntity> saved = applicationRepository.saveAll(applications);
        log.info("Bulk update applied to {} applications", saved.size());
        return saved;
    }

    /**
     * @throws ConflictException if the application is no longer PENDING
     */
    @Transactional
    public void delete(UUID id) {
        LoanApplicationEntity application = get(id);
        if (!application.isPending()) {
            throw new ConflictException("Cannot delete applications that have been processed");
        }
        applicationRepository.delete(application);
        log.info("Application deleted: applicationId={}", id);
    }

    /**
     * Deletes every existing application among the ids, all or nothing.
     *
     * @throws NotFoundException if none of the ids exist
     * @throws ConflictException listing the ids that are no longer PENDING
     */
    @Transactional
    public void bulkDelete(List<UUID> ids) {
        List<LoanApplicationEntity> applications = applicationRepository.findAllById(ids);
        if (applications.isEmpty()) {
            throw new NotFoundException("Application", ids);
        }
        List<String> processed = applications.stream()
            .filter(application -> !application.isPending())
            .map(application -> application.getId().toString())
            .toList();
        if (!processed.isEmpty()) {
            throw new ConflictException("Cannot delete processed applications: " + processed, processed);
        }
        applicationRepository.deleteAll(applications);
        log.info("Bulk delete removed {} applications", applications.size());
    }

    @Transactional(readOnly = true)
    public ApplicationStats stats(UUID branchId, LocalDate startDate, LocalDate endDate) {
        List<LoanApplicationEntity> applications = applicationRepository.findAll(toSpecification(
            ApplicationFilter.builder().branchId(branchId).startDate(startDate).endDate(endDate).build()));

        Map<ApplicationStatus, Long> byStatus = new EnumMap<>(ApplicationStatus.class);
        for (LoanApplicationEntity application : applications) {
            byStatus.merge(application.getStatus(), 1L, Long::sum);
        }

        BigDecimal totalValue = sum(applications, LoanApplicationEntity::getEstimatedValue);
        BigDecimal totalLoan = sum(applications, LoanApplicationEntity::getLoanAmount);
        BigDecimal totalRate = sum(applications, LoanApplicationEntity::getInterestRate);
        BigDecimal totalTerm = sum(applications, application -> BigDecimal.valueOf(application.getTermMonths()));

        return ApplicationStats.builder()
            .totalApplications(applications.size())
            .pendingCount(byStatus.getOrDefault(ApplicationStatus.PENDING, 0L))
            .approvedCount(byStatus.getOrDefault(ApplicationStatus.APPROVED, 0L))
            .rejectedCount(byStatus.getOrDefault(ApplicationStatus.REJECTED, 0L))
            .cancelledCount(byStatus.getOrDefault(ApplicationStatus.CANCELLED, 0L))
            .totalValue(totalValue)
            .totalLoanAmount(totalLoan)
            .averageLoanAmount(average(totalLoan, applications.size()))
            .averageInterestRate(average(totalRate, applications.size()))
            .averageTermMonths(average(totalTerm, applications.size()))
            .build();
    }

    /**
     * Daily counts and totals for the last {@code days} days up to and including today,
     * oldest first. Days without applications are omitted.
     */
    @Transactional(readOnly = true)
    public List<ApplicationTrend> trends(int days, UUID branchId) {
        if (days < 1 || days > 365) {
            throw new IllegalArgumentException("days must be between 1 and 365");
        }
        LocalDate today = LocalDate.now(clock);
        List<LoanApplicationEntity> applications = applicationRepository.findAll(toSpecification(
            ApplicationFilter.builder().branchId(branchId).startDate(today.minusDays(days)).endDate(today).build()));

        Map<LocalDate, List<LoanApplicationEntity>> byDay = applications.stream()
            .collect(Collectors.groupingBy(
                application -> LocalDate.ofInstant(application.getCreatedAt(), clock.getZone()),
                TreeMap::new,
                Collectors.toList()));

        List<ApplicationTrend> trends = new ArrayList<>();
        byDay.forEach((day, filed) -> trends.add(new ApplicationTrend(
            day,
            filed.size(),
            sum(filed, LoanApplicationEntity::getEstimatedValue),
            sum(filed, LoanApplicationEntity::getLoanAmount))));
        return trends;
    }

    @Transactional(readOnly = true)
    public List<LoanApplicationEntity> export(ApplicationFilter filter) {
        return applicationRepository.findAll(toSpecification(filter), Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    private void applyUpdate(LoanApplicationEntity application, ApplicationUpdateRequest request,
                             UUID processedBy, Instant now) {
        ApplicationStatus newStatus = request.getStatus();
        boolean statusChanges = newStatus != null && newStatus != application.getStatus();
        if (statusChanges && newStatus == ApplicationStatus.REJECTED && isBlank(request.getRejectionReason())) {
            throw new BusinessValidationException("rejection_reason_required", String.format(
                "Rejection reason is required when rejecting application %s", application.getApplicationNumber()));
        }
        if (request.getLoanAmount() != null || request.getEstimatedValue() != null) {
            requireLoanWithinValue(
                request.getLoanAmount() != null ? request.getLoanAmount() : application.getLoanAmount(),
                request.getEstimatedValue() != null ? request.getEstimatedValue() : application.getEstimatedValue());
        }

        application.apply(request);
        if (statusChanges) {
            ApplicationStatus previous = application.getStatus();
            application.process(newStatus, processedBy, now);
            log.info("Application processed: applicationId={}, {} -> {}, processedBy={}",
                application.getId(), previous, newStatus, processedBy);
        }
    }

    private void requireLoanWithinValue(BigDecimal loanAmount, BigDecimal estimatedValue) {
        if (loanAmount.compareTo(estimatedValue) > 0) {
            throw new BusinessValidationException("loan_within_estimated_value",
                "Loan amount cannot exceed estimated value");
        }
    }

    private void requireReferences(UUID customerId, UUID branchId) {
        if (customerId != null && !customerRepository.existsById(customerId)) {
            throw new NotFoundException("Customer", customerId);
        }
        if (branchId != null && !branchRepository.existsById(branchId)) {
            throw new NotFoundException("Branch", branchId);
        }
    }

    private Specification<LoanApplicationEntity> toSpecification(ApplicationFilter filter) {
        Instant from = filter.getStartDate() != null ? TimeWindows.startOfDay(filter.getStartDate(), clock) : null;
        Instant until = filter.getEndDate() != null ? TimeWindows.endOfDay(filter.getEndDate(), clock) : null;
        return Specification.where(Specs.<LoanApplicationEntity>equal("status", filter.getStatus()))
            .and(Specs.equal("branchId", filter.getBranchId()))
            .and(Specs.equal("customerId", filter.getCustomerId()))
            .and(Specs.atLeast("estimatedValue", filter.getMinValue()))
            .and(Specs.atMost("estimatedValue", filter.getMaxValue()))
            .and(Specs.atLeast("loanAmount", filter.getMinLoan()))
            .and(Specs.atMost("loanAmount", filter.getMaxLoan()))
            .and(Specs.atLeast("createdAt", from))
            .and(Specs.before("createdAt", until))
            .and(Specs.textSearch(filter.getSearch(), "applicationNumber", "itemDescription", "notes"));
    }

    private static BigDecimal sum(List<LoanApplicationEntity> applications,
                                  Function<LoanApplicationEntity, BigDecimal> field) {
        return applications.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(BigDecimal total, int count) {
        return count > 0 ? total.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP) : BigDecimal.ZERO;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
