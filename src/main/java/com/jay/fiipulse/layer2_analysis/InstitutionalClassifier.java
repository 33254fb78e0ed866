package com.jay.fiipulse.layer2_analysis;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.InstitutionalStock;
import com.jay.fiipulse.model.enums.CashAction;
import com.jay.fiipulse.model.enums.InvestorClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Layer 2 — Institutional Classifier.
 * Tags each deal as FII, DII, both or neither from its client name, then folds the deals of
 * each security into one {@link InstitutionalStock}.
 *
 * Matching is a case-insensitive substring test against the keyword tables in
 * reference-data.yaml. Deals from sources that already know the investor class carry it in
 * {@link DealRecord#getDeclaredInvestors()} and skip the keyword test.
 *
 * Fold order is the provider's row order: a later deal overwrites the FII slot, the DII slot,
 * or both, independently. With {@code classifier.sort_by_trade_date} the deals are first
 * stable-sorted by trade date. Unclassified deals still register their security, which then
 * stays neutral/neutral (the BULK/BLOCK bucket).
 */
@Slf4j
@Component
public class InstitutionalClassifier {

    private static final int CLIENT_SAMPLE_SIZE = 10;

    private final List<String> fiiKeywords;
    private final List<String> diiKeywords;
    private final boolean sortByTradeDate;

    @Autowired
    public InstitutionalClassifier(PulseConfig config) {
        this(config.reference().getFiiKeywords(), config.reference().getDiiKeywords(),
            config.classifier().isSortByTradeDate());
    }

    public InstitutionalClassifier(List<String> fiiKeywords, List<String> diiKeywords, boolean sortByTradeDate) {
        this.fiiKeywords = upper(fiiKeywords);
        this.diiKeywords = upper(diiKeywords);
        this.sortByTradeDate = sortByTradeDate;
    }

    public Set<InvestorClass> investorClasses(DealRecord deal) {
        if (!deal.getDeclaredInvestors().isEmpty()) {
            return EnumSet.copyOf(deal.getDeclaredInvestors());
        }
        Set<InvestorClass> classes = EnumSet.noneOf(InvestorClass.class);
        String client = deal.getClientName() == null ? "" : deal.getClientName().toUpperCase(Locale.ROOT);
        if (matchesAny(client, fiiKeywords)) classes.add(InvestorClass.FII);
        if (matchesAny(client, diiKeywords)) classes.add(InvestorClass.DII);
        return classes;
    }

    public List<InstitutionalStock> classify(List<DealRecord> deals) {
        List<DealRecord> ordered = new ArrayList<>(deals);
        if (sortByTradeDate) {
            ordered.sort(Comparator.comparing(DealRecord::getTradeDate,
                Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())));
        }

        Map<String, InstitutionalStock> bySymbol = new LinkedHashMap<>();
        int matched = 0;
        for (DealRecord deal : ordered) {
            InstitutionalStock stock = bySymbol.computeIfAbsent(deal.getSymbol(), s ->
                InstitutionalStock.builder().symbol(s).name(deal.getCompanyName()).build());

            Set<InvestorClass> classes = investorClasses(deal);
            if (classes.isEmpty()) continue;
            matched++;

            CashAction action = deal.action();
            InstitutionalStock.InstitutionalStockBuilder updated = stock.toBuilder();
            if (classes.contains(InvestorClass.FII)) updated.fiiCash(action);
            if (classes.contains(InvestorClass.DII)) updated.diiCash(action);
            bySymbol.put(deal.getSymbol(), updated.build());
        }

        if (matched == 0 && !ordered.isEmpty()) {
            logClientSample(ordered);
        }
        log.info("Classified {} deals into {} securities ({} FII/DII matched)",
            ordered.size(), bySymbol.size(), matched);
        return new ArrayList<>(bySymbol.values());
    }

    private void logClientSample(List<DealRecord> deals) {
        Set<String> sample = new LinkedHashSet<>();
        for (DealRecord d : deals) {
            if (sample.size() >= CLIENT_SAMPLE_SIZE) break;
            sample.add(d.getClientName());
        }
        log.warn("No FII/DII matches. Sample client names: {}", sample);
    }

    private static boolean matchesAny(String client, List<String> keywords) {
        for (String kw : keywords) {
            if (client.contains(kw)) return true;
        }
        return false;
    }

    private static List<String> upper(List<String> keywords) {
        return keywords.stream()
            .filter(k -> k != null && !k.isBlank())
            .map(k -> k.toUpperCase(Locale.ROOT))
            .toList();
    }
}
