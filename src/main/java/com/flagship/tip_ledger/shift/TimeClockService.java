package com.flagship.tip_ledger.shift;

import com.flagship.tip_ledger.common.IdOrder;
import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Time clock backed {@link ShiftDirectory}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeClockService implements ShiftDirectory {

    private final TimeClockEntryRepository timeClockRepository;
    private final EmployeeRepository employeeRepository;
    private final TransactionRunner transactionRunner;

    public TimeClockEntry clockIn(UUID employeeId, String role, String section, Instant at) {
        EmployeeEntity employee = employeeRepository.findById(employeeId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_EMPLOYEE, "Employee not found: %s", employeeId));
        String clockRole = role == null || role.isBlank() ? employee.getRole() : Roles.normalize(role);
        String clockSection = section == null ? employee.getSection() : Roles.normalizeSection(section);

        try {
            return transactionRunner.inTransaction("clock in", () -> {
                timeClockRepository.findByEmployeeIdAndClockedOutAtIsNull(employeeId).ifPresent(open -> {
                    throw TipLedgerException.of(ErrorKind.ALREADY_ON_DUTY,
                        "Employee %s has been clocked in since %s", employeeId, open.getClockedInAt());
                });
                TimeClockEntryEntity entry = timeClockRepository.saveAndFlush(
                    TimeClockEntryEntity.clockIn(employeeId, clockRole, clockSection, at));
                log.info("Employee {} clocked in as {} (section={}) at {}", employeeId, clockRole, clockSection, at);
                return entry.toDomain();
            });
        } catch (DataIntegrityViolationException e) {
            throw new TipLedgerException(ErrorKind.ALREADY_ON_DUTY,
                "Employee " + employeeId + " is already clocked in", e);
        }
    }

    public TimeClockEntry clockOut(UUID employeeId, Instant at) {
        return transactionRunner.inTransaction("clock out", () -> {
            TimeClockEntryEntity open = timeClockRepository.findByEmployeeIdAndClockedOutAtIsNull(employeeId)
                .orElseThrow(() -> TipLedgerException.of(ErrorKind.NOT_ON_DUTY,
                    "Employee %s is not clocked in", employeeId));
            if (at.isBefore(open.getClockedInAt())) {
                throw TipLedgerException.validation("Clock-out %s precedes clock-in %s", at, open.getClockedInAt());
            }
            open.clockOut(at);
            log.info("Employee {} clocked out at {}", employeeId, at);
            return open.toDomain();
        });
    }

    public List<TimeClockEntry> entriesOf(UUID employeeId) {
        return timeClockRepository.findByEmployeeIdOrderByClockedInAtDesc(employeeId).stream()
            .map(TimeClockEntryEntity::toDomain)
            .toList();
    }

    @Override
    public boolean isOnDuty(UUID employeeId, String role, String section, Instant at) {
        return timeClockRepository.findCovering(employeeId, Roles.normalize(role), at).stream()
            .anyMatch(entry -> Roles.sectionsMatch(entry.getSection(), Roles.normalizeSection(section)));
    }

    @Override
    public Optional<String> roleOf(UUID employeeId) {
        return employeeRepository.findById(employeeId).map(EmployeeEntity::getRole);
    }

    @Override
    public List<Employee> recipientsFor(UUID locationId, String role, String section) {
        return employeeRepository.findByLocationIdAndRoleAndActiveTrue(locationId, Roles.normalize(role)).stream()
            .map(EmployeeEntity::toDomain)
            .filter(employee -> employee.worksSection(section))
            .sorted(Comparator.comparing(Employee::getId, IdOrder.ASCENDING))
            .toList();
    }
}
