package com.flagship.tip_ledger.debt;

import com.flagship.tip_ledger.common.TransactionRunner;
import com.flagship.tip_ledger.common.exception.ErrorKind;
import com.flagship.tip_ledger.common.exception.TipLedgerException;
import com.flagship.tip_ledger.observability.TipMetrics;
import com.flagship.tip_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DebtServiceTest {

    @Mock
    private DebtRepository repository;
    @Mock
    private TransactionRunner transactionRunner;
    @Mock
    private OutboxService outboxService;
    @Mock
    private TipMetrics metrics;

    @InjectMocks
    private DebtService debtService;

    @BeforeEach
    void setUp() {
        lenient().when(transactionRunner.inTransaction(anyString(), any()))
            .thenAnswer(invocation -> invocation.<Supplier<?>>getArgument(1).get());
    }

    @Test
    @DisplayName("Writing off an open debt clears it and publishes an event")
    void testWriteOff() {
        TipDebt debt = TipDebt.open(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 700);
        when(repository.lock(debt.getId())).thenReturn(Optional.of(debt));

        TipDebt writtenOff = debtService.writeOff(debt.getId(), "Disputed chargeback", "gm");

        assertEquals(DebtStatus.WRITTEN_OFF, writtenOff.getStatus());
        assertEquals(0, writtenOff.getRemainingCents());
        verify(repository).update(writtenOff);
        verify(outboxService).saveEvent(eq("TipDebt"), eq(debt.getId()), any());
        verify(metrics).recordDebtWrittenOff();
    }

    @Test
    @DisplayName("A recovered debt cannot be written off")
    void testWriteOffRecoveredDebt() {
        TipDebt recovered = TipDebt.open(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 100).recover(100);
        when(repository.lock(recovered.getId())).thenReturn(Optional.of(recovered));

        TipLedgerException e = assertThrows(TipLedgerException.class,
            () -> debtService.writeOff(recovered.getId(), "late", "gm"));

        assertEquals(ErrorKind.ALREADY_RESOLVED, e.getKind());
        verify(repository, never()).update(any());
    }

    @Test
    @DisplayName("Unknown debts are reported as such")
    void testUnknownDebt() {
        UUID missing = UUID.randomUUID();
        when(repository.findById(missing)).thenReturn(Optional.empty());

        TipLedgerException e = assertThrows(TipLedgerException.class, () -> debtService.get(missing));
        assertEquals(ErrorKind.UNKNOWN_DEBT, e.getKind());
    }
}
