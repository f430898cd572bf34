package com.flagship.tip_ledger.pool;

import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.pool.dto.CheckoutResponse;
import com.flagship.tip_ledger.pool.dto.CreatePoolRequest;
import com.flagship.tip_ledger.pool.dto.MemberRequest;
import com.flagship.tip_ledger.pool.dto.MembershipResponse;
import com.flagship.tip_ledger.pool.dto.OwnershipRequest;
import com.flagship.tip_ledger.pool.dto.PoolResponse;
import com.flagship.tip_ledger.pool.dto.SegmentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
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
import java.util.Locale;
import java.util.UUID;

/**
 * Pool lifecycle and timeline queries.
 */
@RestController
@RequestMapping("/api/pools")
@RequiredArgsConstructor
public class PoolController {

    private final PoolService poolService;

    @PostMapping
    public ResponseEntity<PoolResponse> create(@Valid @RequestBody CreatePoolRequest request) {
        List<PoolMemberRequest> members = request.getMembers() == null ? List.of()
            : request.getMembers().stream()
                .map(member -> new PoolMemberRequest(member.getEmployeeId(), member.getWeight()))
                .toList();
        Instant createdAt = request.getCreatedAt() != null ? request.getCreatedAt() : Instant.now();
        TipPool pool = poolService.createPool(request.getLocationId(), request.getName(),
            request.getOwnerEmployeeId(), parseSplitMode(request.getSplitMode()), createdAt, members);
        return ResponseEntity.status(HttpStatus.CREATED).body(PoolResponse.from(pool));
    }

    @GetMapping("/{poolId}")
    public PoolResponse get(@PathVariable("poolId") UUID poolId) {
        return PoolResponse.from(poolService.getPool(poolId));
    }

    @GetMapping
    public List<PoolResponse> atLocation(@RequestParam("locationId") UUID locationId) {
        return poolService.poolsAt(locationId).stream().map(PoolResponse::from).toList();
    }

    @PostMapping("/{poolId}/members")
    public SegmentResponse join(@PathVariable("poolId") UUID poolId, @Valid @RequestBody MemberRequest request) {
        PoolSegment segment = poolService.join(poolId, request.getEmployeeId(), request.getWeight(),
            atOrNow(request.getAt()));
        return SegmentResponse.from(segment);
    }

    @DeleteMapping("/{poolId}/members/{employeeId}")
    public SegmentResponse leave(
            @PathVariable("poolId") UUID poolId,
            @PathVariable("employeeId") UUID employeeId,
            @RequestParam(value = "at", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {
        return SegmentResponse.from(poolService.leave(poolId, employeeId, atOrNow(at)));
    }

    @PostMapping("/{poolId}/end")
    public PoolResponse end(
            @PathVariable("poolId") UUID poolId,
            @RequestParam(value = "at", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {
        return PoolResponse.from(poolService.end(poolId, atOrNow(at)));
    }

    @PutMapping("/{poolId}/owner")
    public PoolResponse transferOwnership(@PathVariable("poolId") UUID poolId,
                                          @Valid @RequestBody OwnershipRequest request) {
        return PoolResponse.from(poolService.transferOwnership(poolId, request.getOwnerEmployeeId()));
    }

    @GetMapping("/{poolId}/segments")
    public List<SegmentResponse> segments(@PathVariable("poolId") UUID poolId) {
        return poolService.segments(poolId).stream().map(SegmentResponse::from).toList();
    }

    @GetMapping("/{poolId}/segments/at")
    public SegmentResponse segmentAt(
            @PathVariable("poolId") UUID poolId,
            @RequestParam("instant") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant instant) {
        return SegmentResponse.from(poolService.segmentAt(poolId, instant));
    }

    @GetMapping("/{poolId}/memberships")
    public List<MembershipResponse> memberships(@PathVariable("poolId") UUID poolId) {
        return poolService.memberships(poolId).stream().map(MembershipResponse::from).toList();
    }

    @GetMapping("/{poolId}/timeline/verify")
    public List<SegmentResponse> verifyTimeline(@PathVariable("poolId") UUID poolId) {
        return poolService.verifyTimeline(poolId).stream().map(SegmentResponse::from).toList();
    }

    @GetMapping("/{poolId}/checkout")
    public List<CheckoutResponse> checkout(
            @PathVariable("poolId") UUID poolId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return poolService.checkout(poolId, from, to).stream().map(CheckoutResponse::from).toList();
    }

    private static SplitMode parseSplitMode(String value) {
        try {
            return SplitMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw TipLedgerException.validation("Unknown split mode: %s", value);
        }
    }

    private static Instant atOrNow(Instant at) {
        return at != null ? at : Instant.now();
    }
}
