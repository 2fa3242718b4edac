package com.flagship.loan_api.graphql;

import com.flagship.loan_api.loan.CreateLoanInput;
import com.flagship.loan_api.loan.Loan;
import com.flagship.loan_api.loan.LoanService;
import com.flagship.loan_api.loan.RepaymentStatus;
import com.flagship.loan_api.loan.RepaymentStatusService;
import com.flagship.loan_api.observability.LoanMetrics;
import com.flagship.loan_api.payment.Payment;
import com.flagship.loan_api.payment.PaymentRelationshipResolver;
import com.flagship.loan_api.payment.PaymentService;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.util.List;

/**
 * GraphQL queries and mutations over loans and payments.
 *
 * Field-level input checks come from the schema (non-null fields, Date
 * scalar); the services add the referential check. Failures are mapped to
 * GraphQL errors by {@link GraphQlExceptionResolver}.
 */
@Controller
@RequiredArgsConstructor
public class LoanGraphController {

    private final LoanService loanService;
    private final PaymentService paymentService;
    private final PaymentRelationshipResolver relationshipResolver;
    private final RepaymentStatusService repaymentStatusService;

    @QueryMapping
    public List<Loan> loans() {
        return loanService.listLoans();
    }

    /**
     * @return The loan, or null if no loan has this id
     */
    @QueryMapping
    public Loan loan(@Argument int id) {
        return loanService.findLoan(id).orElse(null);
    }

    @QueryMapping
    public List<Payment> loanPayments() {
        return paymentService.listPayments();
    }

    @MutationMapping
    public CreateLoanPayload createLoan(@Argument CreateLoanInput input) {
        return new CreateLoanPayload(loanService.createLoan(input));
    }

    @MutationMapping
    public CreateLoanPaymentPayload createLoanPayment(@Argument CreateLoanPaymentInput input) {
        Payment payment = paymentService.createPayment(
            input.getLoanId(),
            input.getPaymentDate(),
            LoanMetrics.SURFACE_GRAPHQL
        );
        return new CreateLoanPaymentPayload(payment);
    }

    // Loan fields derived from the payment collection

    @SchemaMapping(typeName = "Loan")
    public List<Payment> payments(Loan loan) {
        return relationshipResolver.paymentsFor(loan);
    }

    @SchemaMapping(typeName = "Loan")
    public Payment latestPayment(Loan loan) {
        return repaymentStatusService.latestPayment(loan).orElse(null);
    }

    @SchemaMapping(typeName = "Loan")
    public RepaymentStatus status(Loan loan) {
        return repaymentStatusService.status(loan);
    }

    @SchemaMapping(typeName = "Loan")
    public int monthsUntilDue(Loan loan) {
        return repaymentStatusService.monthsUntilDue(loan);
    }

    @SchemaMapping(typeName = "Loan")
    public Double projectedInterest(Loan loan, @Argument int months) {
        return repaymentStatusService.projectedInterest(loan, months).orElse(null);
    }
}
