package com.flagship.loan_api.store;

import com.flagship.loan_api.loan.Loan;
import com.flagship.loan_api.payment.Payment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory owner of all loan and payment records.
 *
 * Both collections are append-only and kept in insertion order. Identifiers
 * are assigned as (max existing id, or 0) + 1, independently per collection.
 *
 * The servlet container calls in on many threads, so every insert runs its
 * read-max/append sequence under the write lock. Reads return immutable
 * snapshots taken under the read lock.
 *
 * No validation happens here: callers check required fields and loan
 * references before inserting.
 */
@Component
@Slf4j
public class RecordStore {

    private final List<Loan> loans = new ArrayList<>();
    private final List<Payment> payments = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Returns all loans in insertion order.
     */
    public List<Loan> listLoans() {
        lock.readLock().lock();
        try {
            return List.copyOf(loans);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds a loan by id.
     *
     * @param id Loan id
     * @return Optional containing the loan if present
     */
    public Optional<Loan> findLoan(int id) {
        lock.readLock().lock();
        try {
            return loans.stream()
                .filter(loan -> loan.getId() == id)
                .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean loanExists(int id) {
        return findLoan(id).isPresent();
    }

    /**
     * Returns all payments in insertion order.
     */
    public List<Payment> listPayments() {
        lock.readLock().lock();
        try {
            return List.copyOf(payments);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Appends a new loan with the next loan id.
     *
     * @return The stored loan
     */
    public Loan insertLoan(String name, double interestRate, int principal, LocalDate dueDate) {
        lock.writeLock().lock();
        try {
            int nextId = loans.stream().mapToInt(Loan::getId).max().orElse(0) + 1;
            Loan loan = new Loan(nextId, name, interestRate, principal, dueDate);
            loans.add(loan);
            log.debug("Stored loan {} ({} loans total)", nextId, loans.size());
            return loan;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends a new payment with the next payment id.
     *
     * @return The stored payment
     */
    public Payment insertPayment(int loanId, LocalDate paymentDate) {
        lock.writeLock().lock();
        try {
            int nextId = payments.stream().mapToInt(Payment::getId).max().orElse(0) + 1;
            Payment payment = new Payment(nextId, loanId, paymentDate);
            payments.add(payment);
            log.debug("Stored payment {} for loan {} ({} payments total)", nextId, loanId, payments.size());
            return payment;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int loanCount() {
        lock.readLock().lock();
        try {
            return loans.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int paymentCount() {
        lock.readLock().lock();
        try {
            return payments.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
