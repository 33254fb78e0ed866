package com.jay.fiipulse.layer1_data.deals;

import com.jay.fiipulse.config.PulseConfig;
import com.jay.fiipulse.layer1_data.CannedHttp;
import com.jay.fiipulse.model.DealRecord;
import com.jay.fiipulse.model.enums.CashAction;
import com.jay.fiipulse.model.enums.InvestorClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MunafaSutraDealSourceTest {

    private static final String PAGE = """
        <html><body>
        <a href="/nse/stock/MENU">Top menu link</a>
        <table>
          <tr><th>Stock</th><th>FII cash</th><th>FII F&amp;O</th></tr>
          <tr><td><a href="https://munafasutra.com/nse/stock/POWERGRID/">Power Grid Corp</a></td>
              <td>FII Bought 12 Cr</td><td>Sold</td></tr>
          <tr><td><a href="/nse/stock/INFY">Infosys</a></td>
              <td>FII Sold 40 Cr</td><td>Sold</td></tr>
          <tr><td><a href="/nse/stock/">Broken</a></td><td>Bought</td></tr>
          <tr><td><a href="/nse/stock/TCS"></a></td><td>Bought</td></tr>
        </table>
        </body></html>
        """;

    private PulseConfig config;

    @BeforeEach
    void setUp() {
        config = new PulseConfig();
        config.load();
    }

    @Test
    void parse_shouldReadSymbolNameAndBoughtKeyword() {
        MunafaSutraDealSource source = new MunafaSutraDealSource(config, new CannedHttp().factory());

        List<DealRecord> deals = source.parse(PAGE);

        assertEquals(2, deals.size());
        DealRecord grid = deals.get(0);
        assertEquals("POWERGRID", grid.getSymbol());
        assertEquals("Power Grid Corp", grid.getCompanyName());
        assertEquals(CashAction.BUY, grid.action());
        assertEquals(Set.of(InvestorClass.FII, InvestorClass.DII), grid.getDeclaredInvestors());

        DealRecord infy = deals.get(1);
        assertEquals("INFY", infy.getSymbol());
        assertEquals(CashAction.SELL, infy.action());
    }

    @Test
    void parse_shouldStopAtRowLimit() {
        config.scrape().setRowLimit(1);
        MunafaSutraDealSource source = new MunafaSutraDealSource(config, new CannedHttp().factory());

        assertEquals(1, source.parse(PAGE).size());
    }

    @Test
    void fetch_shouldReturnEmptyOnHttpError() {
        CannedHttp http = new CannedHttp().on("munafasutra.com", CannedHttp.status(500, "oops"));
        MunafaSutraDealSource source = new MunafaSutraDealSource(config, http.factory());

        assertTrue(source.fetch().isEmpty());
    }

    @Test
    void fetch_shouldParseServedPage() {
        CannedHttp http = new CannedHttp().on("munafasutra.com", CannedHttp.ok(PAGE, "text/html"));
        MunafaSutraDealSource source = new MunafaSutraDealSource(config, http.factory());

        List<DealRecord> deals = source.fetch();

        assertEquals(2, deals.size());
        assertEquals(MunafaSutraDealSource.LABEL, source.label());
    }
}
