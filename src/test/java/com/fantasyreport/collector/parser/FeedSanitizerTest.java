package com.fantasyreport.collector.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeedSanitizerTest {

    private final FeedSanitizer sanitizer = new FeedSanitizer();

    @Test
    void escapesBareAmpersandsButKeepsEntities() {
        String out = sanitizer.sanitize("<title>Tom & Jerry &amp; friends &#38; &#x26; &lt;3</title>");
        assertEquals("<title>Tom &amp; Jerry &amp; friends &#38; &#x26; &lt;3</title>", out);
    }

    @Test
    void stripsBomAndLeadingWhitespace() {
        String out = sanitizer.sanitize("\uFEFF  \n<?xml version=\"1.0\"?><rss/>");
        assertTrue(out.startsWith("<?xml"));
    }

    @Test
    void leavesCdataUntouched() {
        String out = sanitizer.sanitize("<description><![CDATA[Q&A <b>bold</b>]]></description> & more");
        assertEquals("<description><![CDATA[Q&A <b>bold</b>]]></description> &amp; more", out);
    }

    @Test
    void removesControlCharacters() {
        String out = sanitizer.sanitize("<title>Bad\u0001Char\u000B</title>\n\t");
        assertEquals("<title>BadChar</title>\n\t", out);
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", sanitizer.sanitize(null));
    }
}
