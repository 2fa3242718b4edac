package com.flagship.loan_api.seed;

import com.flagship.loan_api.loan.CreateLoanInput;
import com.flagship.loan_api.loan.LoanService;
import com.flagship.loan_api.observability.LoanMetrics;
import com.flagship.loan_api.payment.PaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Loads the configured seed records at startup.
 *
 * Goes through the regular services, so seed payments must reference a
 * seeded loan or startup fails.
 */
@Component
@ConditionalOnProperty(prefix = "loan-api.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SeedDataLoader implements ApplicationRunner {

    private final SeedProperties seedProperties;
    private final LoanService loanService;
    private final PaymentService paymentService;

    @Override
    public void run(ApplicationArguments args) {
        for (SeedProperties.LoanSeed seed : seedProperties.getLoans()) {
            loanService.createLoan(new CreateLoanInput(
                seed.getName(),
                seed.getInterestRate(),
                seed.getPrincipal(),
                LocalDate.parse(seed.getDueDate())
            ));
        }
        for (SeedProperties.PaymentSeed seed : seedProperties.getPayments()) {
            paymentService.createPayment(
                seed.getLoanId(),
                LocalDate.parse(seed.getPaymentDate()),
                LoanMetrics.SURFACE_SEED
            );
        }
        log.info("Seeded {} loans and {} payments",
                seedProperties.getLoans().size(), seedProperties.getPayments().size());
    }
}
