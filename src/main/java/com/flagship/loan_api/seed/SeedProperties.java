package com.flagship.loan_api.seed;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Initial records loaded into the store at startup ({@code loan-api.seed.*}).
 *
 * Loans receive ids 1..n in list order; payments refer to those ids.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "loan-api.seed")
public class SeedProperties {

    private static final String ISO_DATE = "\\d{4}-\\d{2}-\\d{2}";

    private boolean enabled = true;

    @Valid
    private List<LoanSeed> loans = new ArrayList<>();

    @Valid
    private List<PaymentSeed> payments = new ArrayList<>();

    @Data
    public static class LoanSeed {
        @NotBlank
        private String name;

        @NotNull
        private Double interestRate;

        @NotNull
        private Integer principal;

        @NotNull
        @Pattern(regexp = ISO_DATE, message = "must be YYYY-MM-DD")
        private String dueDate;
    }

    @Data
    public static class PaymentSeed {
        @NotNull
        @Positive
        private Integer loanId;

        @NotNull
        @Pattern(regexp = ISO_DATE, message = "must be YYYY-MM-DD")
        private String paymentDate;
    }
}
