package com.flagship.loan_api.loan;

import com.flagship.loan_api.exception.ErrorCode;
import com.flagship.loan_api.exception.MissingFieldException;
import com.flagship.loan_api.observability.LoanMetrics;
import com.flagship.loan_api.store.RecordStore;
import com.flagship.loan_api.validation.RecordValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loan creation tests.
 *
 * These tests verify that:
 * - New loans get the next id
 * - Missing fields are all reported at once
 * - A rejected loan leaves the store unchanged
 */
class LoanServiceTest {

    private RecordStore store;
    private SimpleMeterRegistry registry;
    private LoanService loanService;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        store = new RecordStore();
        registry = new SimpleMeterRegistry();
        loanService = new LoanService(store, new RecordValidator(store), new LoanMetrics(registry));
        store.insertLoan("Test Loan 1", 5.0, 10000, LocalDate.of(2025, 4, 1));
        store.insertLoan("Test Loan 2", 3.5, 50000, LocalDate.of(2025, 5, 1));
    }

    @Test
    @DisplayName("Create loan on a two-loan store returns id 3")
    void testCreateLoan() {
        printTestHeader("Create Loan");
        CreateLoanInput input = new CreateLoanInput("New Test Loan", 4.0, 25000, LocalDate.of(2025, 6, 1));
        printInput("Input", input);

        Loan loan = loanService.createLoan(input);

        printOutput("Loan", loan);
        assertEquals(3, loan.getId());
        assertEquals("New Test Loan", loan.getName());
        assertEquals(4.0, loan.getInterestRate());
        assertEquals(25000, loan.getPrincipal());
        assertEquals(LocalDate.of(2025, 6, 1), loan.getDueDate());
        assertEquals(3, loanService.listLoans().size());
        assertEquals(1.0, registry.get("loan.created").tag("outcome", "success").counter().count());
    }

    @Test
    @DisplayName("Missing fields are all named and nothing is stored")
    void testCreateLoan_MissingFields() {
        printTestHeader("Create Loan With Missing Fields");
        CreateLoanInput input = new CreateLoanInput("New Loan", null, 20000, null);
        printInput("Input", input);

        MissingFieldException e = assertThrows(MissingFieldException.class,
            () -> loanService.createLoan(input));

        printOutput("Exception", e.getMessage());
        assertEquals(List.of("interestRate", "dueDate"), e.getFields());
        assertTrue(e.getMessage().contains("interestRate"));
        assertTrue(e.getMessage().contains("dueDate"));
        assertEquals(ErrorCode.MISSING_FIELD, e.getCode());
        assertEquals(2, store.loanCount());
        assertEquals(1.0, registry.get("loan.created").tag("outcome", "missing_field").counter().count());
    }

    @Test
    @DisplayName("Every field missing names all four")
    void testCreateLoan_AllFieldsMissing() {
        MissingFieldException e = assertThrows(MissingFieldException.class,
            () -> loanService.createLoan(new CreateLoanInput(null, null, null, null)));

        assertEquals(List.of("name", "interestRate", "principal", "dueDate"), e.getFields());
        assertEquals(2, store.loanCount());
    }

    @Test
    @DisplayName("Blank name counts as missing")
    void testCreateLoan_BlankName() {
        MissingFieldException e = assertThrows(MissingFieldException.class,
            () -> loanService.createLoan(new CreateLoanInput("  ", 4.0, 100, LocalDate.of(2025, 6, 1))));

        assertEquals(List.of("name"), e.getFields());
        assertEquals(2, store.loanCount());
    }

    @Test
    @DisplayName("Successive creations get strictly increasing ids")
    void testCreateLoan_SequentialIds() {
        for (int expectedId = 3; expectedId <= 7; expectedId++) {
            Loan loan = loanService.createLoan(
                new CreateLoanInput("Loan " + expectedId, 2.0, 1000, LocalDate.of(2026, 1, 1)));
            assertEquals(expectedId, loan.getId());
        }
    }

    @Test
    @DisplayName("Finding an unknown loan returns empty")
    void testFindLoan_NotFound() {
        assertTrue(loanService.findLoan(999).isEmpty());
        assertEquals("Test Loan 1", loanService.findLoan(1).orElseThrow().getName());
    }
}
