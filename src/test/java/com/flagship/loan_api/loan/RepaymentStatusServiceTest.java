package com.flagship.loan_api.loan;

import com.flagship.loan_api.payment.PaymentRelationshipResolver;
import com.flagship.loan_api.store.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RepaymentStatusServiceTest {

    private static final LocalDate DUE = LocalDate.of(2025, 3, 1);

    private RecordStore store;
    private RepaymentStatusService service;

    @BeforeEach
    void setUp() {
        store = new RecordStore();
        Clock clock = Clock.fixed(LocalDate.of(2025, 1, 15).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new RepaymentStatusService(new PaymentRelationshipResolver(store), clock);
    }

    @ParameterizedTest(name = "paid {0} -> {1}")
    @CsvSource({
        "2025-02-01, ON_TIME",
        "2025-03-01, ON_TIME",
        "2025-03-06, ON_TIME",
        "2025-03-07, LATE",
        "2025-03-31, LATE",
        "2025-04-01, DEFAULTED"
    })
    @DisplayName("Payment date is classified against the due date")
    void testClassify(LocalDate paymentDate, RepaymentStatus expected) {
        assertEquals(expected, service.classify(paymentDate, DUE));
    }

    @Test
    @DisplayName("Loan without payments is unpaid")
    void testUnpaid() {
        Loan loan = store.insertLoan("A", 5.0, 1000, DUE);

        assertEquals(RepaymentStatus.UNPAID, service.status(loan));
        assertTrue(service.latestPayment(loan).isEmpty());
    }

    @Test
    @DisplayName("Status follows the latest payment, not the last recorded")
    void testStatusUsesLatestPayment() {
        Loan loan = store.insertLoan("A", 5.0, 1000, DUE);
        store.insertPayment(loan.getId(), LocalDate.of(2025, 4, 20));
        store.insertPayment(loan.getId(), LocalDate.of(2025, 2, 20));

        assertEquals(LocalDate.of(2025, 4, 20), service.latestPayment(loan).orElseThrow().getPaymentDate());
        assertEquals(RepaymentStatus.DEFAULTED, service.status(loan));
    }

    @Test
    @DisplayName("Equal payment dates keep the first recorded payment")
    void testLatestPaymentTie() {
        Loan loan = store.insertLoan("A", 5.0, 1000, DUE);
        store.insertPayment(loan.getId(), LocalDate.of(2025, 3, 2));
        store.insertPayment(loan.getId(), LocalDate.of(2025, 3, 2));

        assertEquals(1, service.latestPayment(loan).orElseThrow().getId());
    }

    @Test
    @DisplayName("Months until due rounds up on a later day of month and never goes negative")
    void testMonthsUntilDue() {
        // today is 2025-01-15
        assertEquals(2, service.monthsUntilDue(store.insertLoan("A", 1.0, 1, LocalDate.of(2025, 3, 1))));
        assertEquals(2, service.monthsUntilDue(store.insertLoan("B", 1.0, 1, LocalDate.of(2025, 3, 15))));
        assertEquals(3, service.monthsUntilDue(store.insertLoan("C", 1.0, 1, LocalDate.of(2025, 3, 16))));
        assertEquals(12, service.monthsUntilDue(store.insertLoan("D", 1.0, 1, LocalDate.of(2026, 1, 15))));
        assertEquals(0, service.monthsUntilDue(store.insertLoan("E", 1.0, 1, LocalDate.of(2024, 6, 1))));
    }

    @Test
    @DisplayName("Projected interest is simple interest over the given months")
    void testProjectedInterest() {
        Loan loan = store.insertLoan("A", 5.0, 10000, DUE);

        assertEquals(1500.0, service.projectedInterest(loan, 3).orElseThrow(), 1e-9);
        assertTrue(service.projectedInterest(loan, 0).isEmpty());
        assertTrue(service.projectedInterest(store.insertLoan("B", 0.0, 10000, DUE), 3).isEmpty());
    }
}
