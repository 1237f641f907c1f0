package com.flagship.pawnshop.organization;

import com.flagship.pawnshop.exception.ConflictException;
import com.flagship.pawnshop.exception.NotFoundException;
import com.flagship.pawnshop.organization.dto.BranchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class BranchService {

    private final BranchRepository branchRepository;
    private final EmployeeRepository employeeRepository;

    @Transactional(readOnly = true)
    public List<BranchEntity> list(Pageable pageable) {
        return branchRepository.findAll(pageable).getContent();
    }

    @Transactional(readOnly = true)
    public BranchEntity get(UUID id) {
        return branchRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("Branch", id));
    }

    @Transactional
    public BranchEntity create(BranchRequest request) {
        BranchEntity saved = branchRepository.save(
            BranchEntity.create(request.getName(), request.getAddress(), request.getPhone(), request.getEmail()));
        log.info("Branch created: branchId={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public BranchEntity update(UUID id, BranchRequest request) {
        BranchEntity branch = get(id);
        branch.update(request.getName(), request.getAddress(), request.getPhone(), request.getEmail());
        return branchRepository.save(branch);
    }

    /**
     * @throws ConflictException if employees are still assigned to the branch
     */
    @Transactional
    public void delete(UUID id) {
        BranchEntity branch = get(id);
        long employees = employeeRepository.countByBranchId(id);
        if (employees > 0) {
            throw new ConflictException(String.format(
                "Cannot delete branch that has %d employees assigned", employees));
        }
        branchRepository.delete(branch);
        log.info("Branch deleted: branchId={}", id);
    }
}
