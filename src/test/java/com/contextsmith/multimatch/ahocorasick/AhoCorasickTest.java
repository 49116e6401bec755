package com.contextsmith.multimatch.ahocorasick;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.Assert.*;

public class AhoCorasickTest {

    private static Match m(String pattern, int index, int start, int stop) {
        return new Match(pattern, index, start, stop);
    }

    @Test
    public void wikipediaExample() {
        AhoCorasick automaton = AhoCorasick.of("a", "ab", "bab", "bc", "bca", "c", "caa");
        List<Match> matches = automaton.search("abccab");

        assertEquals(Arrays.asList(
                m("a", 1, 1, 1),
                m("ab", 2, 1, 2),
                m("bc", 4, 2, 3),
                m("c", 6, 3, 3),
                m("c", 6, 4, 4),
                m("a", 1, 5, 5),
                m("ab", 2, 5, 6)), matches);
    }

    @Test
    public void ushers() {
        AhoCorasick automaton = AhoCorasick.of("he", "she", "his", "hers");
        List<Match> matches = automaton.search("ushers");

        assertEquals(Arrays.asList(
                m("she", 2, 2, 4),
                m("he", 1, 3, 4),
                m("hers", 4, 3, 6)), matches);
    }

    @Test
    public void singlePattern() {
        List<Match> matches = AhoCorasick.of("test").search("this is a test string with test");
        assertEquals(2, matches.size());
        assertEquals(11, matches.get(0).getStart());
        assertEquals(28, matches.get(1).getStart());
    }

    @Test
    public void overlappingPatterns() {
        List<Match> matches = AhoCorasick.of("a", "aa", "aaa").search("aaaa");

        assertEquals(4, matches.stream().filter(x -> x.getPattern().equals("a")).count());
        assertEquals(3, matches.stream().filter(x -> x.getPattern().equals("aa")).count());
        assertEquals(2, matches.stream().filter(x -> x.getPattern().equals("aaa")).count());
        assertEquals(9, matches.size());
    }

    @Test
    public void noMatches() {
        assertTrue(AhoCorasick.of("xyz", "abc").search("hello world").isEmpty());
    }

    @Test
    public void emptyText() {
        assertTrue(AhoCorasick.of("test").search("").isEmpty());
        assertFalse(AhoCorasick.of("test").matchesOf("").hasNext());
    }

    @Test
    public void emptyPatternList() {
        AhoCorasick automaton = AhoCorasick.of();
        assertEquals(1, automaton.size());
        assertTrue(automaton.search("anything at all").isEmpty());
        assertFalse(automaton.matchesAny("anything at all"));
        assertTrue(automaton.getPatterns().isEmpty());
    }

    @Test
    public void patternsAtBoundaries() {
        List<Match> matches = AhoCorasick.of("start", "end").search("start middle end");
        assertEquals(Arrays.asList(m("start", 1, 1, 5), m("end", 2, 14, 16)), matches);
    }

    @Test
    public void caseSensitive() {
        List<Match> matches = AhoCorasick.of("Test", "TEST", "test").search("Test TEST test");
        assertEquals(Arrays.asList("Test", "TEST", "test"),
                matches.stream().map(Match::getPattern).collect(Collectors.toList()));
    }

    @Test
    public void unicodePositionsCountCodePoints() {
        AhoCorasick automaton = AhoCorasick.of("héllo", "wörld", "日本");

        assertEquals(Arrays.asList(m("héllo", 1, 1, 5), m("wörld", 2, 7, 11)),
                automaton.search("héllo wörld"));
        assertEquals(Arrays.asList(m("日本", 3, 1, 2)), automaton.search("日本語"));
    }

    @Test
    public void supplementaryCodePoints() {
        // U+1F600 takes two chars but is one position.
        AhoCorasick automaton = AhoCorasick.of("😀x", "x");
        List<Match> matches = automaton.search("a😀x😀");

        assertEquals(Arrays.asList(m("😀x", 1, 2, 3), m("x", 2, 3, 3)), matches);
        assertEquals(2, matches.get(0).length());
    }

    @Test
    public void multipleOccurrences() {
        List<Match> matches = AhoCorasick.of("na").search("banana");
        assertEquals(2, matches.size());
        assertEquals(3, matches.get(0).getStart());
        assertEquals(5, matches.get(1).getStart());
    }

    @Test
    public void prefixPatterns() {
        List<Match> matches = AhoCorasick.of("pre", "prefix", "prefixation").search("prefixation");
        assertEquals(3, matches.size());
        assertTrue(matches.stream().allMatch(x -> x.getStart() == 1));
        assertEquals(Arrays.asList(1, 2, 3),
                matches.stream().map(Match::getPatternIndex).collect(Collectors.toList()));
    }

    @Test
    public void suffixPatterns() {
        List<Match> matches = AhoCorasick.of("tion", "ation", "ization").search("optimization");
        assertEquals(Arrays.asList(
                m("ization", 3, 6, 12),
                m("ation", 2, 8, 12),
                m("tion", 1, 9, 12)), matches);
    }

    @Test
    public void manyPatterns() {
        List<String> patterns = IntStream.rangeClosed(1, 100)
                .mapToObj(i -> "pattern" + i).collect(Collectors.toList());
        AhoCorasick automaton = AhoCorasick.of(patterns);

        // "pattern1" is a prefix of "pattern10".
        List<Match> matches = automaton.search(String.join(" ", patterns.subList(0, 10)));
        assertEquals(11, matches.size());
    }

    @Test
    public void substringPatterns() {
        AhoCorasick automaton = AhoCorasick.of("hello".substring(0, 3), "world".substring(0, 4));
        assertEquals(2, automaton.search("hel worl").size());
    }

    @Test
    public void duplicatePatternsKeepTheirOwnIndex() {
        List<Match> matches = AhoCorasick.of("ab", "ab").search("xab");
        assertEquals(Arrays.asList(m("ab", 1, 2, 3), m("ab", 2, 2, 3)), matches);
    }

    @Test
    public void matchProperties() {
        List<Match> matches = AhoCorasick.of("test").search("a test here");
        assertEquals(1, matches.size());
        Match match = matches.get(0);
        assertEquals("test", match.getPattern());
        assertEquals(1, match.getPatternIndex());
        assertEquals(3, match.getStart());
        assertEquals(6, match.getStop());
    }

    @Test
    public void searchIsDeterministic() {
        AhoCorasick automaton = AhoCorasick.of("he", "she", "his", "hers", "e", "rs");
        String text = "she sells his shells by the shore, hers";
        assertEquals(automaton.search(text), automaton.search(text));
        assertEquals(automaton.search(text).toString(), automaton.search(text).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyPattern() {
        AhoCorasick.of("a", "");
    }

    @Test(expected = NullPointerException.class)
    public void rejectsNullPattern() {
        AhoCorasick.of("a", null);
    }

    @Test(expected = NullPointerException.class)
    public void rejectsNullText() {
        AhoCorasick.of("a").search(null);
    }

    @Test
    public void builderIsSingleUse() {
        AhoCorasick.Builder builder = AhoCorasick.builder().add("a");
        builder.build();
        try {
            builder.add("b");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            builder.build();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void inspection() {
        AhoCorasick automaton = AhoCorasick.of("he", "she", "his", "hers");

        // root, h, he, her, hers, hi, his, s, sh, she
        assertEquals(10, automaton.size());
        assertEquals("his", automaton.getPattern(3));
        assertEquals(Arrays.asList("he", "she", "his", "hers"), automaton.getPatterns());

        assertTrue(automaton.hasPrefix(""));
        assertTrue(automaton.hasPrefix("her"));
        assertFalse(automaton.hasPrefix("hex"));

        assertEquals(1, automaton.indexOf("he"));
        assertEquals(2, automaton.indexOf("she"));
        assertEquals(4, automaton.indexOf("hers"));
        assertEquals(-1, automaton.indexOf("her"));
        assertEquals(-1, automaton.indexOf(""));
        assertTrue(automaton.contains("his"));
        assertFalse(automaton.contains("hi"));

        assertTrue(automaton.matchesAny("ushers"));
        assertFalse(automaton.matchesAny("xyz"));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void patternIndexIsOneBased() {
        AhoCorasick.of("he").getPattern(0);
    }

    @Test
    public void nextStateFollowsFailLinks() {
        AhoCorasick automaton = AhoCorasick.of("he", "she", "his", "hers");
        int state = AhoCorasick.ROOT;
        for (char c : "she".toCharArray()) {
            state = automaton.nextState(state, c);
        }
        assertEquals(3, automaton.getState(state).getDepth());

        // "she" + 'r' has no transition, so it falls back to "he" and takes 'r'.
        int her = automaton.nextState(state, 'r');
        assertEquals(3, automaton.getState(her).getDepth());
        assertEquals(AhoCorasick.ROOT, automaton.nextState(her, 'z'));
        assertEquals(AhoCorasick.ROOT, automaton.nextState(AhoCorasick.ROOT, 'z'));
    }
}
