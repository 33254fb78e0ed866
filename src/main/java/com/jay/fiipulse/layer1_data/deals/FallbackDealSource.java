package com.jay.fiipulse.layer1_data.deals;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.enums.CashAction;
import com.jay.fiipulse.model.enums.InvestorClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Source 3 — static table of institutionally active securities from reference-data.yaml.
 * Each declared FII or DII action becomes one deal; a stock with neither declared still yields a
 * single unclassified deal so it appears in the BULK/BLOCK bucket.
 */
@Slf4j
@Component
@Order(3)
public class FallbackDealSource implements DealSource {

    public static final String LABEL = "Fallback (Known Institutional Stocks)";

    private static final String CLIENT = "REFERENCE TABLE";

    // used only when reference-data.yaml is missing or has no fallback table
    private static final List<PulseConfig.FallbackStock> BUILT_IN = List.of(
        stock("RELIANCE", "Reliance Industries", "buy", "buy"),
        stock("HDFCBANK", "HDFC Bank", "buy", "buy"),
        stock("INFY", "Infosys", "buy", "sell"),
        stock("ICICIBANK", "ICICI Bank", "sell", "buy"));

    private final PulseConfig config;

    public FallbackDealSource(PulseConfig config) {
        this.config = config;
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<DealRecord> fetch() {
        log.warn("[Source 3] Reference fallback stocks");
        List<PulseConfig.FallbackStock> table = config.reference().getFallbackStocks();
        if (table == null || table.isEmpty()) {
            log.warn("  !! No fallback table in reference data, using built-in list");
            table = BUILT_IN;
        }
        List<DealRecord> deals = new ArrayList<>();
        for (PulseConfig.FallbackStock s : table) {
            if (s.getSymbol() == null || s.getSymbol().isBlank()) continue;
            String symbol = s.getSymbol().trim().toUpperCase(Locale.ROOT);
            String name = s.getName() == null || s.getName().isBlank() ? symbol : s.getName().trim();

            CashAction fii = CashAction.fromLabel(s.getFii());
            CashAction dii = CashAction.fromLabel(s.getDii());
            if (fii != CashAction.NEUTRAL) deals.add(deal(symbol, name, fii, InvestorClass.FII));
            if (dii != CashAction.NEUTRAL) deals.add(deal(symbol, name, dii, InvestorClass.DII));
            if (fii == CashAction.NEUTRAL && dii == CashAction.NEUTRAL) {
                deals.add(DealRecord.builder()
                    .symbol(symbol).companyName(name).clientName(CLIENT).buySell("")
                    .build());
            }
        }
        log.info("  -> Fallback: {} deals", deals.size());
        return deals;
    }

    private static PulseConfig.FallbackStock stock(String symbol, String name, String fii, String dii) {
        PulseConfig.FallbackStock s = new PulseConfig.FallbackStock();
        s.setSymbol(symbol);
        s.setName(name);
        s.setFii(fii);
        s.setDii(dii);
        return s;
    }

    private static DealRecord deal(String symbol, String name, CashAction action, InvestorClass investor) {
        return DealRecord.builder()
            .symbol(symbol)
            .companyName(name)
            .clientName(CLIENT)
            .buySell(action == CashAction.BUY ? "BUY" : "SELL")
            .declaredInvestor(investor)
            .build();
    }
}
