package com.duelo.engine.ledger;

import com.duelo.engine.exception.InsufficientCreditsException;
import com.duelo.entity.CreditLedgerEntry;
import com.duelo.entity.TransactionType;
import com.duelo.support.DirectTransactionTemplate;
import com.duelo.support.InMemoryBalanceAccessor;
import com.duelo.support.InMemoryLedgerEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CreditLedgerServiceImplTest {

    private final UUID user = UUID.randomUUID();
    private InMemoryBalanceAccessor balances;
    private InMemoryLedgerEntryRepository entries;
    private CreditLedgerServiceImpl ledger;

    @BeforeEach
    void setUp() {
        balances = new InMemoryBalanceAccessor();
        entries = new InMemoryLedgerEntryRepository();
        ledger = new CreditLedgerServiceImpl(balances, entries, new UserLockRegistry(), new DirectTransactionTemplate());
    }

    @Test
    void testDebitWritesConsumptionEntry() {
        balances.set(user, 100);
        UUID executionId = UUID.randomUUID();

        CreditLedgerEntry entry = ledger.debit(user, 8,
                LedgerReference.forExecution(executionId, "writer run", "test-model", 4000, new BigDecimal("0.08")));

        assertEquals(92, ledger.balanceOf(user));
        assertEquals(-8, entry.getAmount());
        assertEquals(92, entry.getBalanceAfter());
        assertEquals(TransactionType.CONSUMPTION, entry.getTransactionType());
        assertEquals("agent_execution", entry.getRelatedEntityType());
        assertEquals(executionId, entry.getRelatedEntityId());
        assertEquals("test-model", entry.getModel());
        assertEquals(4000, entry.getTokensUsed());
    }

    @Test
    void testDebitBeyondBalanceIsRejected() {
        balances.set(user, 5);

        InsufficientCreditsException ex = assertThrows(InsufficientCreditsException.class,
                () -> ledger.debit(user, 8, LedgerReference.note("too much")));

        assertEquals(8, ex.getRequired());
        assertEquals(5, ex.getAvailable());
        assertEquals(5, ledger.balanceOf(user));
        assertTrue(entries.all().isEmpty());
    }

    @Test
    void testDebitAvailableTakesWhatIsLeft() {
        balances.set(user, 3);

        Optional<CreditLedgerEntry> entry = ledger.debitAvailable(user, 8, LedgerReference.note("overrun"));

        assertTrue(entry.isPresent());
        assertEquals(-3, entry.get().getAmount());
        assertEquals(0, ledger.balanceOf(user));
    }

    @Test
    void testDebitAvailableOnEmptyBalanceWritesNothing() {
        Optional<CreditLedgerEntry> entry = ledger.debitAvailable(user, 8, LedgerReference.note("overrun"));

        assertTrue(entry.isEmpty());
        assertEquals(0, ledger.balanceOf(user));
        assertTrue(entries.all().isEmpty());
    }

    @Test
    void testCreditAcceptsOnlyPurchaseAndRefund() {
        ledger.credit(user, 50, TransactionType.PURCHASE, LedgerReference.note("pack"));
        ledger.credit(user, 5, TransactionType.REFUND, LedgerReference.note("refund"));

        assertEquals(55, ledger.balanceOf(user));
        assertThrows(IllegalArgumentException.class,
                () -> ledger.credit(user, 5, TransactionType.CONSUMPTION, LedgerReference.note("wrong")));
        assertThrows(IllegalArgumentException.class,
                () -> ledger.credit(user, 5, TransactionType.ADMIN_ADJUSTMENT, LedgerReference.note("wrong")));
        assertEquals(2, entries.all().size());
    }

    @Test
    void testAmountsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> ledger.debit(user, 0, LedgerReference.note("zero")));
        assertThrows(IllegalArgumentException.class, () -> ledger.debitAvailable(user, -1, LedgerReference.note("neg")));
        assertThrows(IllegalArgumentException.class,
                () -> ledger.credit(user, 0, TransactionType.PURCHASE, LedgerReference.note("zero")));
        assertThrows(IllegalArgumentException.class, () -> ledger.adjust(user, 0, LedgerReference.note("zero")));
    }

    @Test
    void testAdjustmentNeverGoesNegative() {
        balances.set(user, 10);

        CreditLedgerEntry down = ledger.adjust(user, -4, LedgerReference.note("correction"));
        CreditLedgerEntry up = ledger.adjust(user, 20, LedgerReference.note("goodwill"));

        assertEquals(TransactionType.ADMIN_ADJUSTMENT, down.getTransactionType());
        assertEquals(6, down.getBalanceAfter());
        assertEquals(26, up.getBalanceAfter());
        assertThrows(InsufficientCreditsException.class, () -> ledger.adjust(user, -27, LedgerReference.note("too much")));
        assertEquals(26, ledger.balanceOf(user));
    }

    @Test
    void testHasSufficientCredits() {
        balances.set(user, 8);

        assertTrue(ledger.hasSufficientCredits(user, 8));
        assertFalse(ledger.hasSufficientCredits(user, 9));
        assertFalse(ledger.hasSufficientCredits(UUID.randomUUID(), 1));
    }

    @Test
    void testEntriesSumToLatestBalance() {
        ledger.credit(user, 100, TransactionType.PURCHASE, LedgerReference.note("pack"));
        ledger.debit(user, 8, LedgerReference.note("writer"));
        ledger.debitAvailable(user, 30, LedgerReference.note("judge"));
        ledger.adjust(user, -2, LedgerReference.note("correction"));
        ledger.credit(user, 8, TransactionType.REFUND, LedgerReference.note("refund"));

        List<CreditLedgerEntry> history = ledger.entriesFor(user);
        long running = 0;
        for (CreditLedgerEntry entry : history) {
            running += entry.getAmount();
            assertEquals(running, entry.getBalanceAfter());
        }
        assertEquals(68, running);
        assertEquals(68, ledger.balanceOf(user));
    }

    @Test
    void testConcurrentDebitsNeverOverdraw() throws Exception {
        balances.set(user, 500);
        int threads = 16;
        int debitsPerThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                results.add(pool.submit(() -> {
                    start.await();
                    int succeeded = 0;
                    for (int i = 0; i < debitsPerThread; i++) {
                        try {
                            ledger.debit(user, 1, LedgerReference.note("race"));
                            succeeded++;
                        } catch (InsufficientCreditsException ex) {
                            // balance exhausted
                        }
                    }
                    return succeeded;
                }));
            }
            start.countDown();
            int total = 0;
            for (Future<Integer> result : results) {
                total += result.get(30, TimeUnit.SECONDS);
            }

            assertEquals(500, total);
            assertEquals(0, ledger.balanceOf(user));
            assertEquals(500, entries.all().size());
            assertEquals(0, entries.all().stream().mapToLong(CreditLedgerEntry::getBalanceAfter).min().orElseThrow());
        } finally {
            pool.shutdownNow();
        }
    }
}
