package com.flagship.tip_ledger.shift;

import com.flagship.tip_ledger.shift.dto.AssignmentRequest;
import com.flagship.tip_ledger.shift.dto.ClockRequest;
import com.flagship.tip_ledger.shift.dto.EmployeeResponse;
import com.flagship.tip_ledger.shift.dto.RegisterEmployeeRequest;
import com.flagship.tip_ledger.shift.dto.TimeClockEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Employees and the time clock.
 */
@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeService employeeService;
    private final TimeClockService timeClockService;

    @PostMapping
    public ResponseEntity<EmployeeResponse> register(@Valid @RequestBody RegisterEmployeeRequest request) {
        Employee employee = employeeService.register(request.getLocationId(), request.getDisplayName(),
            request.getRole(), request.getSection());
        return ResponseEntity.status(HttpStatus.CREATED).body(EmployeeResponse.from(employee));
    }

    @GetMapping("/{id}")
    public EmployeeResponse get(@PathVariable("id") UUID id) {
        return EmployeeResponse.from(employeeService.get(id));
    }

    @GetMapping
    public List<EmployeeResponse> atLocation(@RequestParam("locationId") UUID locationId) {
        return employeeService.atLocation(locationId).stream().map(EmployeeResponse::from).toList();
    }

    @PutMapping("/{id}/assignment")
    public EmployeeResponse reassign(@PathVariable("id") UUID id, @Valid @RequestBody AssignmentRequest request) {
        return EmployeeResponse.from(employeeService.reassign(id, request.getRole(), request.getSection()));
    }

    @DeleteMapping("/{id}")
    public EmployeeResponse deactivate(@PathVariable("id") UUID id) {
        return EmployeeResponse.from(employeeService.deactivate(id));
    }

    @PostMapping("/{id}/clock-in")
    public ResponseEntity<TimeClockEntryResponse> clockIn(@PathVariable("id") UUID id,
                                                          @RequestBody(required = false) ClockRequest request) {
        ClockRequest clock = request != null ? request : ClockRequest.builder().build();
        TimeClockEntry entry = timeClockService.clockIn(id, clock.getRole(), clock.getSection(), atOrNow(clock));
        return ResponseEntity.status(HttpStatus.CREATED).body(TimeClockEntryResponse.from(entry));
    }

    @PostMapping("/{id}/clock-out")
    public TimeClockEntryResponse clockOut(@PathVariable("id") UUID id,
                                           @RequestBody(required = false) ClockRequest request) {
        ClockRequest clock = request != null ? request : ClockRequest.builder().build();
        return TimeClockEntryResponse.from(timeClockService.clockOut(id, atOrNow(clock)));
    }

    @GetMapping("/{id}/time-clock")
    public List<TimeClockEntryResponse> timeClock(@PathVariable("id") UUID id) {
        return timeClockService.entriesOf(id).stream().map(TimeClockEntryResponse::from).toList();
    }

    private static Instant atOrNow(ClockRequest request) {
        return request.getAt() != null ? request.getAt() : Instant.now();
    }
}
