package com.contextsmith.multimatch.cli;

import com.contextsmith.multimatch.ahocorasick.AhoCorasick;
import com.contextsmith.multimatch.ahocorasick.Match;
import com.google.common.io.CharSource;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.*;

public class TextScannerTest {

    private static final AhoCorasick USHERS = AhoCorasick.of("he", "she", "his", "hers");
    private static final String NL = System.lineSeparator();

    @Test
    public void batchTextOutput() throws IOException {
        StringBuilder out = new StringBuilder();
        int numMatches = new TextScanner(USHERS, new ScanConfiguration())
                .scan("in.txt", CharSource.wrap("ushers"), out);

        assertEquals(3, numMatches);
        assertEquals("in.txt:2-4\t2\tshe" + NL +
                     "in.txt:3-4\t1\the" + NL +
                     "in.txt:3-6\t4\thers" + NL, out.toString());
    }

    @Test
    public void streamJsonOutput() throws IOException {
        ScanConfiguration config = new ScanConfiguration();
        config.setScanMode("stream");
        config.setOutputFormat("json");
        StringBuilder out = new StringBuilder();
        new TextScanner(USHERS, config).scan("-", CharSource.wrap("ushers"), out);

        String[] lines = out.toString().split(NL);
        assertEquals(3, lines.length);
        // Discovery order: "she" and "he" end at the same position.
        JsonObject second = JsonParser.parseString(lines[1]).getAsJsonObject();
        assertEquals("-", second.get("source").getAsString());
        assertEquals("he", second.get("pattern").getAsString());
        assertEquals(1, second.get("pattern_index").getAsInt());
        assertEquals(3, second.get("start").getAsInt());
        assertEquals(4, second.get("stop").getAsInt());
    }

    @Test
    public void formats() {
        Match match = new Match("日本", 6, 1, 2);
        assertEquals("a.txt:1-2\t6\t日本", OutputFormat.text.format("a.txt", match));
        assertEquals("{\"source\":\"a.txt\",\"pattern\":\"日本\",\"pattern_index\":6,\"start\":1,\"stop\":2}",
                OutputFormat.json.format("a.txt", match));
    }

    @Test
    public void noMatchesWritesNothing() throws IOException {
        StringBuilder out = new StringBuilder();
        assertEquals(0, new TextScanner(USHERS, new ScanConfiguration())
                .scan("empty", CharSource.wrap(""), out));
        assertEquals("", out.toString());
    }
}
