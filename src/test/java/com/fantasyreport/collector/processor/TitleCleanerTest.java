package com.fantasyreport.collector.processor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TitleCleanerTest {

    private final TitleCleaner cleaner = new TitleCleaner();

    @Test
    void decodesEntitiesAndStripsLabelAndPublisher() {
        assertEquals("Week 5 Waiver Wire & More",
                cleaner.clean("FantasyPros", "NEWS: Week 5 Waiver Wire &amp; More - FantasyPros"));
    }

    @Test
    void stripsPipeSection() {
        assertEquals("Top 10 RBs for Week 3", cleaner.clean("Site", "Top 10 RBs for Week 3 | Site Name"));
    }

    @Test
    void perSourceCleaners() {
        assertEquals("Week 6 Rankings", cleaner.clean("Rotowire NFL", "RotoWire: Week 6 Rankings"));
        assertEquals("Start 'em, sit 'em", cleaner.clean("Yahoo Sports NFL", "Start 'em, sit 'em - Yahoo Sports NFL"));
    }

    @Test
    void collapsesWhitespaceAndHandlesNull() {
        assertEquals("A title", cleaner.clean(null, "  A \n title  "));
        assertEquals("", cleaner.clean("Site", null));
    }
}
