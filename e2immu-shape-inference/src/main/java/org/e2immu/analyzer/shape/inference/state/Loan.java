package org.e2immu.analyzer.shape.inference.state;

import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;

/*
the borrower holds 'amount' of the lender's permission until the loan is restored.
a unique loan takes the whole permission; a shared one half of what the lender held.
 */
public record Loan(Place lender, Place borrower, Amount amount, boolean unique) {

    @Override
    public String toString() {
        return unique ? "&mut " + lender : "&" + lender + ":" + amount;
    }
}
