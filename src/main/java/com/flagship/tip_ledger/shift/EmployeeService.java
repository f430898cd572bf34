package com.flagship.tip_ledger.shift;

import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {

    private final EmployeeRepository repository;
    private final LedgerService ledgerService;
    private final TransactionRunner transactionRunner;

    /**
     * Registers the employee and opens their ledger account at the location.
     */
    public Employee register(UUID locationId, String displayName, String role, String section) {
        Employee employee = Employee.register(locationId, displayName, role, section);
        return transactionRunner.inTransaction("register employee", () -> {
            repository.saveAndFlush(EmployeeEntity.fromDomain(employee));
            ledgerService.openAccount(employee.getId(), employee.getLocationId());
            log.info("Registered employee {} as {} at location {}", employee.getId(), employee.getRole(), locationId);
            return employee;
        });
    }

    public Employee reassign(UUID employeeId, String role, String section) {
        return transactionRunner.inTransaction("reassign employee", () -> {
            EmployeeEntity entity = load(employeeId);
            entity.reassign(role, section);
            return entity.toDomain();
        });
    }

    public Employee deactivate(UUID employeeId) {
        return transactionRunner.inTransaction("deactivate employee", () -> {
            EmployeeEntity entity = load(employeeId);
            entity.deactivate();
            return entity.toDomain();
        });
    }

    public Employee get(UUID employeeId) {
        return load(employeeId).toDomain();
    }

    public List<Employee> atLocation(UUID locationId) {
        return repository.findByLocationIdOrderByDisplayNameAsc(locationId).stream()
            .map(EmployeeEntity::toDomain)
            .toList();
    }

    private EmployeeEntity load(UUID employeeId) {
        return repository.findById(employeeId)
            .orElseThrow(() -> TipLedgerException.of(ErrorKind.UNKNOWN_EMPLOYEE, "Employee not found: %s", employeeId));
    }
}
