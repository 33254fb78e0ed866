package com.jay.fiipulse;

import com.jay.fiipulse.layer1_data.deals.DealSourceChain;
import com.jay.fiipulse.layer1_data.deals.FallbackDealSource;
import com.jay.fiipulse.layer1_data.deals.MunafaSutraDealSource;
import com.jay.fiipulse.layer1_data.deals.NseDealSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
class FiiPulseApplicationTest {

    @Autowired
    private DealSourceChain dealSourceChain;

    @Test
    void contextLoads_shouldWireProvidersInPriorityOrder() {
        assertEquals(List.of(NseDealSource.LABEL, MunafaSutraDealSource.LABEL, FallbackDealSource.LABEL),
            dealSourceChain.labels());
    }
}
