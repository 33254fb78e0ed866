package com.jay.fiipulse.model;

import com.jay.fiipulse.model.enums.CashAction;
import com.jay.fiipulse.model.enums.DealCategory;
import com.jay.fiipulse.model.enums.InvestorClass;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * One disclosed bulk/block trade in canonical form.
 *
 * <p>{@code declaredInvestors} is empty for exchange disclosures, where the investor class is
 * inferred from the client name. Sources that already know the class (the FII/DII scrape and the
 * static fallback table) declare it directly.
 */
@Value
@Builder
public class DealRecord {
    String symbol;
    String companyName;
    String clientName;
    String buySell;          // raw flag from the provider: BUY / SELL / B / S
    long quantity;
    double price;            // weighted average trade price
    LocalDate tradeDate;     // may be null when the provider omits it
    DealCategory category;
    @Singular
    Set<InvestorClass> declaredInvestors;

    public CashAction action() {
        return CashAction.fromBuySellFlag(buySell);
    }
}
